package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

/**
 * AST node representing a try/catch statement. The catch variable is bound by name
 * to whatever the try block threw.
 */
public class TryStatement implements Statement
{
	private final Block tryBlock;
	private final String catchVariable;
	private final Block catchBlock;

	public TryStatement(Block tryBlock, String catchVariable, Block catchBlock)
	{
		this.tryBlock = tryBlock;
		this.catchVariable = catchVariable;
		this.catchBlock = catchBlock;
	}

	public Block getTryBlock()
	{
		return tryBlock;
	}

	public String getCatchVariable()
	{
		return catchVariable;
	}

	public Block getCatchBlock()
	{
		return catchBlock;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitTryStatement(this, context);
	}

	@Override
	public String toString()
	{
		return "try " + tryBlock + " catch " + catchVariable + " " + catchBlock;
	}
}
