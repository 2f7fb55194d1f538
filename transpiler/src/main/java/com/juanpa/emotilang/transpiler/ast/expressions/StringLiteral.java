package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

/**
 * A string literal, written {@code :L "text"}. Holds the text between the quotes.
 */
public class StringLiteral implements Expression
{
	private final String value;

	public StringLiteral(String value)
	{
		this.value = value;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitStringLiteral(this, context);
	}

	@Override
	public String toString()
	{
		return "\"" + value + "\"";
	}
}
