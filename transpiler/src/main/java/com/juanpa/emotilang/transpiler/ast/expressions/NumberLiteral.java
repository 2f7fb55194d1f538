package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

import java.math.BigInteger;

/**
 * A number literal, written {@code :0 42} or {@code :0 3.14}. Integers are held as Long
 * (BigInteger past the range of a long), decimals as Double.
 */
public class NumberLiteral implements Expression
{
	private final Number value;

	public NumberLiteral(Number value)
	{
		this.value = value;
	}

	public Number getValue()
	{
		return value;
	}

	public boolean isInteger()
	{
		return value instanceof Long || value instanceof Integer || value instanceof BigInteger;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitNumberLiteral(this, context);
	}

	@Override
	public String toString()
	{
		return String.valueOf(value);
	}
}
