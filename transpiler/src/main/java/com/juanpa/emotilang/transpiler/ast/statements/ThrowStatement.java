package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

public class ThrowStatement implements Statement
{
	private final Expression expression;

	public ThrowStatement(Expression expression)
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
		return visitor.visitThrowStatement(this, context);
	}

	@Override
	public String toString()
	{
		return "throw " + expression;
	}
}
