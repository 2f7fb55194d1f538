package com.juanpa.emotilang.transpiler.ast.declarations;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.TypeNode;
import com.juanpa.emotilang.transpiler.ast.statements.Block;
import com.juanpa.emotilang.transpiler.ast.statements.Statement;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a function declaration.
 * Grammar: {@code 🤖 name :( params :) :> returnType :{ body :}}
 * A declaration is a statement, so functions may also be declared inside blocks.
 */
public class FunctionDeclaration implements Statement
{
	private final String name;
	private final List<Parameter> parameters;
	private final TypeNode returnType;
	private final Block body;

	/**
	 * Constructs a FunctionDeclaration.
	 *
	 * @param name       The function's name.
	 * @param parameters The parameters in declaration order.
	 * @param returnType The declared return type.
	 * @param body       The function body.
	 */
	public FunctionDeclaration(String name, List<Parameter> parameters, TypeNode returnType, Block body)
	{
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.returnType = returnType;
		this.body = body;
	}

	public String getName()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public TypeNode getReturnType()
	{
		return returnType;
	}

	public Block getBody()
	{
		return body;
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitFunctionDeclaration(this, context);
	}

	@Override
	public String toString()
	{
		String params = parameters.stream().map(String::valueOf).collect(Collectors.joining(", "));
		return "function " + name + "(" + params + "): " + returnType + " " + body;
	}
}
