package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

/**
 * A reference to a variable by name.
 */
public class Identifier implements Expression
{
	private final String name;

	public Identifier(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitIdentifier(this, context);
	}

	@Override
	public String toString()
	{
		return name;
	}
}
