package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

/**
 * AST node representing a prefix unary operation. The only one the language has is
 * logical negation, {@code !) x}.
 */
public class UnaryOp implements Expression
{
	private final Operator operator;
	private final Expression operand;

	public UnaryOp(Operator operator, Expression operand)
	{
		if (!operator.isUnary())
		{
			throw new IllegalArgumentException("Not a unary operator: " + operator.getSourceTag());
		}
		this.operator = operator;
		this.operand = operand;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitUnaryOp(this, context);
	}

	@Override
	public String toString()
	{
		return "(" + operator.getJavaScript() + operand + ")";
	}
}
