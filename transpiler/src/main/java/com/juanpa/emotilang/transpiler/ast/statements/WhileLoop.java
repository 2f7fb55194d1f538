package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

public class WhileLoop implements Statement
{
	private final Expression condition;
	private final Block body;

	public WhileLoop(Expression condition, Block body)
	{
		this.condition = condition;
		this.body = body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Block getBody()
	{
		return body;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitWhileLoop(this, context);
	}

	@Override
	public String toString()
	{
		return "while " + condition + " " + body;
	}
}
