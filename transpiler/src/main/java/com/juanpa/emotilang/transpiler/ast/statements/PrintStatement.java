package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

public class PrintStatement implements Statement
{
	private final Expression expression;

	public PrintStatement(Expression expression)
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
		return visitor.visitPrintStatement(this, context);
	}

	@Override
	public String toString()
	{
		return "print(" + expression + ")";
	}
}
