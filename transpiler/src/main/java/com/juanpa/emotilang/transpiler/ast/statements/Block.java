package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a block of statements, enclosed in {@code :{ ... :}}.
 * The order of the statements is the order they run in.
 */
public class Block implements Statement
{
	private final List<Statement> statements;

	public Block(List<Statement> statements)
	{
		this.statements = List.copyOf(statements);
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitBlock(this, context);
	}

	@Override
	public String toString()
	{
		if (statements.isEmpty())
		{
			return "{ }";
		}
		return "{ " + statements.stream().map(String::valueOf).collect(Collectors.joining("; ")) + " }";
	}
}
