package com.juanpa.emotilang.transpiler.ast.statements;

import com.juanpa.emotilang.transpiler.ast.ASTVisitor;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;

import java.util.Optional;

/**
 * AST node representing a return statement, {@code /o/ expr ;)} or a bare {@code /o/ ;)}.
 */
public class ReturnStatement implements Statement
{
	private final Expression value; // null for a bare return

	public ReturnStatement(Expression value)
	{
		this.value = value;
	}

	public Optional<Expression> getValue()
	{
		return Optional.ofNullable(value);
	}

	@Override
	public <R, C> R accept(ASTVisitor<R, C> visitor, C context)
	{
		return visitor.visitReturnStatement(this, context);
	}

	@Override
	public String toString()
	{
		return value != null ? "return " + value : "return";
	}
}
