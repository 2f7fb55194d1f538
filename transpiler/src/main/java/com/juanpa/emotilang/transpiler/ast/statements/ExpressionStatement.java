package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

/**
 * An expression evaluated for its side effects, such as a call whose result is dropped.
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitExpressionStatement(this, context);
	}

	@Override
	public String toString()
	{
		return String.valueOf(expression);
	}
}
