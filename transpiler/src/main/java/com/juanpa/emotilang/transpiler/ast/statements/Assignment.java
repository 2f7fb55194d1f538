package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

/**
 * Assigns a new value to an existing name, {@code x <3 expr ;)}.
 */
public class Assignment implements Statement
{
	private final String identifier;
	private final Expression expression;

	public Assignment(String identifier, Expression expression)
	{
		this.identifier = identifier;
		this.expression = expression;
	}

	public String getIdentifier()
	{
		return identifier;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitAssignment(this, context);
	}

	@Override
	public String toString()
	{
		return identifier + " = " + expression;
	}
}
