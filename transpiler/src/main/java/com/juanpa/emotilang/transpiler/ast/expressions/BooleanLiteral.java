package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

public class BooleanLiteral implements Expression
{
	private final boolean value;

	public BooleanLiteral(boolean value)
	{
		this.value = value;
	}

	public boolean getValue()
	{
		return value;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitBooleanLiteral(this, context);
	}

	@Override
	public String toString()
	{
		return String.valueOf(value);
	}
}
