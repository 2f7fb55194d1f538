package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a call by name, {@code name :( a :,D b :)}.
 */
public class FunctionCall implements Expression
{
	private final String name;
	private final List<Expression> arguments;

	public FunctionCall(String name, List<Expression> arguments)
	{
		this.name = name;
		this.arguments = List.copyOf(arguments);
	}

	public String getName()
	{
		return name;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitFunctionCall(this, context);
	}

	@Override
	public String toString()
	{
		return name + "(" + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ")) + ")";
	}
}
