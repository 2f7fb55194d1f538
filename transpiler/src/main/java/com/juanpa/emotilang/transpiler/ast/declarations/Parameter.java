package com.juanpa.emotilang.transpiler.ast.declarations;

import com.juanpa.emotilang.transpiler.ast.ASTNode;
import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.TypeNode;

/**
 * A function parameter, {@code name :> type}.
 */
public class Parameter implements ASTNode
{
	private final String name;
	private final TypeNode type;

	public Parameter(String name, TypeNode type)
	{
		this.name = name;
		this.type = type;
	}

	public String getName()
	{
		return name;
	}

	public TypeNode getType()
	{
		return type;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitParameter(this, context);
	}

	@Override
	public String toString()
	{
		return name + ": " + type;
	}
}
