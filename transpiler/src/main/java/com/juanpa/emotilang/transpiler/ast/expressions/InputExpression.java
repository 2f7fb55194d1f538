package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

/**
 * Reads a value from the user ({@code O_O}).
 */
public class InputExpression implements Expression
{
	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitInputExpression(this, context);
	}

	@Override
	public String toString()
	{
		return "input()";
	}
}
