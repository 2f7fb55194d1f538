package com.juanpa.emotilang.transpiler.ast;

import com.juanpa.emotilang.transpiler.semantics.PrimitiveType;

/**
 * A declared type as written in source (':0', ':L' or 'X_X').
 */
public class TypeNode implements ASTNode
{
	private final PrimitiveType type;

	public TypeNode(PrimitiveType type)
	{
		this.type = type;
	}

	public PrimitiveType getType()
	{
		return type;
	}

	public String getName()
	{
		return type.getName();
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitTypeNode(this, context);
	}

	@Override
	public String toString()
	{
		return type.getName();
	}
}
