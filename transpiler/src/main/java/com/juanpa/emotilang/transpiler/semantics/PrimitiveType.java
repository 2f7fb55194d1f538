package com.juanpa.emotilang.transpiler.semantics;

import com.juanpa.emotilang.transpiler.lexer.TokenType;

import java.util.Optional;

/**
 * The three types a declaration can name. Types are recorded and echoed into the output
 * as comments; nothing checks them.
 */
public enum PrimitiveType
{
	NUMBER("number", TokenType.SURPRISED),
	STRING("string", TokenType.L_FACE),
	BOOLEAN("boolean", TokenType.DEAD);

	private final String name;
	private final TokenType marker;

	PrimitiveType(String name, TokenType marker)
	{
		this.name = name;
		this.marker = marker;
	}

	public String getName()
	{
		return name;
	}

	public static Optional<PrimitiveType> fromMarker(TokenType tokenType)
	{
		for (PrimitiveType type : values())
		{
			if (type.marker == tokenType)
			{
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString()
	{
		return name;
	}
}
