package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

import java.util.Optional;

/**
 * AST node representing an 'if' statement.
 * Includes a condition, a 'then' block and an optional 'else' block. The surface syntax has
 * no way to write an else branch, so parsed programs never carry one.
 */
public class IfStatement implements Statement
{
	private final Expression condition;
	private final Block thenBlock;
	private final Block elseBlock; // null when absent

	/**
	 * Constructs an IfStatement.
	 *
	 * @param condition The expression for the condition.
	 * @param thenBlock The block to execute if the condition is true.
	 * @param elseBlock The optional block to execute otherwise, or null.
	 */
	public IfStatement(Expression condition, Block thenBlock, Block elseBlock)
	{
		this.condition = condition;
		this.thenBlock = thenBlock;
		this.elseBlock = elseBlock;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Block getThenBlock()
	{
		return thenBlock;
	}

	public Optional<Block> getElseBlock()
	{
		return Optional.ofNullable(elseBlock);
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitIfStatement(this, context);
	}

	@Override
	public String toString()
	{
		String base = "if " + condition + " " + thenBlock;
		return elseBlock != null ? base + " else " + elseBlock : base;
	}
}
