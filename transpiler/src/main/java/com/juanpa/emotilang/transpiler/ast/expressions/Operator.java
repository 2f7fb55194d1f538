package com.juanpa.emotilang.transpiler.ast.expressions;

import com.juanpa.emotilang.transpiler.lexer.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The operators of the language, each tying the source token it is written with to the
 * JavaScript operator it becomes. Each source tag maps to exactly one JavaScript lexeme
 * and no two operators share a lexeme.
 */
public enum Operator
{
	// Multiplicative
	MULTIPLY(TokenType.STAR_EYES, "*", false),
	DIVIDE(TokenType.SLASH_CONFUSED, "/", false),
	MODULO(TokenType.PERCENT_WEIRD, "%", false),

	// Additive
	ADD(TokenType.PLUS_HAPPY, "+", false),
	SUBTRACT(TokenType.MINUS_SAD, "-", false),

	// Relational & Equality
	GREATER(TokenType.GREATER_SMUG, ">", false),
	LESS(TokenType.LESS_DOWN, "<", false),
	EQUAL(TokenType.EQUAL_TWINS, "==", false),
	NOT_EQUAL(TokenType.NOT_EQUAL, "!=", false),

	// Logical
	AND(TokenType.AND_TOGETHER, "&&", false),
	OR(TokenType.OR_CHOICE, "||", false),
	NOT(TokenType.NOT_OPPOSITE, "!", true);

	private static final Map<TokenType, Operator> byToken;

	static
	{
		Map<TokenType, Operator> map = new EnumMap<>(TokenType.class);
		for (Operator operator : values())
		{
			map.put(operator.tokenType, operator);
		}
		byToken = Collections.unmodifiableMap(map);
	}

	private final TokenType tokenType;
	private final String javaScript;
	private final boolean unary;

	Operator(TokenType tokenType, String javaScript, boolean unary)
	{
		this.tokenType = tokenType;
		this.javaScript = javaScript;
		this.unary = unary;
	}

	public TokenType getTokenType()
	{
		return tokenType;
	}

	/**
	 * The operator as written in EmotiLang source, e.g. {@code ":+)"}.
	 */
	public String getSourceTag()
	{
		return tokenType.getSymbol();
	}

	/**
	 * The JavaScript operator lexeme, e.g. {@code "+"}.
	 */
	public String getJavaScript()
	{
		return javaScript;
	}

	public boolean isUnary()
	{
		return unary;
	}

	public boolean isBinary()
	{
		return !unary;
	}

	public static Optional<Operator> fromTokenType(TokenType tokenType)
	{
		return Optional.ofNullable(byToken.get(tokenType));
	}

	@Override
	public String toString()
	{
		return javaScript;
	}
}
