package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.TypeNode;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

import java.util.Optional;

/**
 * AST node representing a variable declaration, {@code :< x :> :0 <3 :0 5 ;)}.
 * The parser always supplies an initializer; generated code handles its absence too.
 */
public class VariableDeclaration implements Statement
{
	private final String identifier;
	private final TypeNode declaredType;
	private final Expression initialValue; // null when absent

	public VariableDeclaration(String identifier, TypeNode declaredType, Expression initialValue)
	{
		this.identifier = identifier;
		this.declaredType = declaredType;
		this.initialValue = initialValue;
	}

	public String getIdentifier()
	{
		return identifier;
	}

	public TypeNode getDeclaredType()
	{
		return declaredType;
	}

	public Optional<Expression> getInitialValue()
	{
		return Optional.ofNullable(initialValue);
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitVariableDeclaration(this, context);
	}

	@Override
	public String toString()
	{
		String base = "let " + identifier + ": " + declaredType;
		return initialValue != null ? base + " = " + initialValue : base;
	}
}
