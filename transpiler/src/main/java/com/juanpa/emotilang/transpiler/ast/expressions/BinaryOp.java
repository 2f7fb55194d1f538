package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

/**
 * AST node representing a binary operation (e.g., {@code a :+) b}, {@code x =) y}).
 */
public class BinaryOp implements Expression
{
	private final Expression left;
	private final Operator operator;
	private final Expression right;

	/**
	 * Constructs a BinaryOp.
	 *
	 * @param left     The left-hand side expression.
	 * @param operator The binary operator.
	 * @param right    The right-hand side expression.
	 */
	public BinaryOp(Expression left, Operator operator, Expression right)
	{
		if (!operator.isBinary())
		{
			throw new IllegalArgumentException("Not a binary operator: " + operator.getSourceTag());
		}
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitBinaryOp(this, context);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getJavaScript() + " " + right + ")";
	}
}
