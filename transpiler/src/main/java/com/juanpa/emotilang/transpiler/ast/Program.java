package com.juanpa.emotilang.transpiler.ast;

import com.juanpa.emotilang.transpiler.ast.statements.Statement;

import java.util.List;

/**
 * The root of every AST: the top-level statements of one source file, in source order.
 */
public class Program implements ASTNode
{
	private final List<Statement> declarations;

	public Program(List<Statement> declarations)
	{
		this.declarations = List.copyOf(declarations);
	}

	public List<Statement> getDeclarations()
	{
		return declarations;
	}

	public boolean isEmpty()
	{
		return declarations.isEmpty();
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitProgram(this, context);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("Program {\n");
		for (Statement declaration : declarations)
		{
			sb.append("  ").append(declaration).append("\n");
		}
		sb.append("}");
		return sb.toString();
	}
}
