package com.juanpa.emotilang.transpiler.lexer;

import com.juanpa.emotilang.transpiler.util.CompilationStage;
import com.juanpa.emotilang.transpiler.util.Debug;
import com.juanpa.emotilang.transpiler.util.ErrorReporter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw EmotiLang source code and converts it into a stream of meaningful Tokens.
 * Fixed symbols are tried longest spelling first; illegal characters are reported,
 * skipped one at a time, and scanning carries on.
 */
public class Lexer
{
	/**
	 * Starts a comment that runs to the end of the line.
	 */
	public static final String COMMENT_SENTINEL = "Z_Z";

	// Every fixed-spelling token kind, longest spelling first
	private static final List<TokenType> SYMBOLS;

	// Identifiers that are remapped to dedicated token kinds
	private static final Map<String, TokenType> reservedIdentifiers;

	static
	{
		List<TokenType> symbols = new ArrayList<>();
		for (TokenType type : TokenType.values())
		{
			if (type.isFixedSymbol())
			{
				symbols.add(type);
			}
		}
		symbols.sort(Comparator.comparingInt((TokenType t) -> t.getSymbol().length()).reversed());
		SYMBOLS = Collections.unmodifiableList(symbols);

		Map<String, TokenType> reserved = new HashMap<>();
		reserved.put("X_X", TokenType.DEAD);
		reserved.put("O_O", TokenType.INPUT);
		reservedIdentifiers = Collections.unmodifiableMap(reserved);
	}

	private final String source;
	private final ErrorReporter errorReporter;
	private List<Token> tokens;

	private int start;
	private int current;
	private int line;
	private int column;

	private int startLine;
	private int startColumn;

	/**
	 * Constructs a Lexer.
	 *
	 * @param source        The source code string to tokenize.
	 * @param errorReporter An instance of ErrorReporter for recording lexical errors.
	 */
	public Lexer(String source, ErrorReporter errorReporter)
	{
		this.source = source;
		this.errorReporter = errorReporter;
	}

	/**
	 * Scans the entire source code and returns a list of tokens ending with an EOF token.
	 * Each call starts over from the first character on line 1.
	 */
	public List<Token> scanTokens()
	{
		tokens = new ArrayList<>();
		start = 0;
		current = 0;
		line = 1;
		column = 1;

		while (!isAtEnd())
		{
			start = current;
			startLine = line;
			startColumn = column;
			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, line, column));
		Debug.log("Lexer produced %d tokens over %d line(s)", tokens.size(), line);
		return tokens;
	}

	/**
	 * Returns the fixed-symbol table in matching order.
	 */
	public static List<TokenType> symbolsInMatchOrder()
	{
		return SYMBOLS;
	}

	/**
	 * Scans a single token (or skips whitespace, a newline or a comment).
	 */
	private void scanToken()
	{
		char c = peek();

		switch (c)
		{
			case ' ':
			case '\t':
			case '\r':
				advance();
				return;
			case '\n':
				advance();
				line++;
				column = 1;
				return;
			case '"':
				string();
				return;
			default:
				break;
		}

		if (source.startsWith(COMMENT_SENTINEL, current))
		{
			while (!isAtEnd() && peek() != '\n')
			{
				advance();
			}
			return;
		}

		for (TokenType type : SYMBOLS)
		{
			if (source.startsWith(type.getSymbol(), current))
			{
				advance(type.getSymbol().length());
				addToken(type);
				return;
			}
		}

		if (isDigit(c))
		{
			number();
		}
		else if (isAlpha(c))
		{
			identifier();
		}
		else
		{
			illegalCharacter();
		}
	}

	/**
	 * Scans a double-quoted string. There are no escape sequences; the text between
	 * the quotes is taken verbatim and may span lines. A quote with no partner is an
	 * illegal character.
	 */
	private void string()
	{
		int closing = source.indexOf('"', current + 1);
		if (closing < 0)
		{
			illegalCharacter();
			return;
		}

		advance(); // opening quote
		while (current < closing)
		{
			if (advance() == '\n')
			{
				line++;
				column = 1;
			}
		}
		advance(); // closing quote

		String value = source.substring(start + 1, current - 1);
		addToken(TokenType.STRING, value);
	}

	/**
	 * Scans digits with an optional fraction. A fraction makes the literal a Double,
	 * otherwise it is a Long, or a BigInteger when the digits do not fit in one.
	 */
	private void number()
	{
		while (isDigit(peek()))
		{
			advance();
		}

		boolean decimal = false;
		if (peek() == '.' && isDigit(peekNext()))
		{
			decimal = true;
			advance(); // the '.'
			while (isDigit(peek()))
			{
				advance();
			}
		}

		String text = source.substring(start, current);
		if (decimal)
		{
			addToken(TokenType.NUMBER, Double.parseDouble(text));
			return;
		}

		try
		{
			addToken(TokenType.NUMBER, Long.parseLong(text));
		}
		catch (NumberFormatException e)
		{
			// Too wide for a long; the digits are kept exactly
			addToken(TokenType.NUMBER, new BigInteger(text));
		}
	}

	private void identifier()
	{
		while (isAlphaNumeric(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);
		addToken(reservedIdentifiers.getOrDefault(text, TokenType.IDENTIFIER));
	}

	private void illegalCharacter()
	{
		int codePoint = source.codePointAt(current);
		advance(Character.charCount(codePoint));
		error("Illegal character '" + new String(Character.toChars(codePoint)) + "'");
	}

	private void error(String message)
	{
		errorReporter.report(CompilationStage.LEXICAL, startLine, message);
	}

	// --- Helper Methods ---

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	// Columns count code points, so an emoji is one column wide
	private char advance()
	{
		char c = source.charAt(current++);
		if (!Character.isLowSurrogate(c))
		{
			column++;
		}
		return c;
	}

	private void advance(int count)
	{
		column += source.codePointCount(current, current + count);
		current += count;
	}

	private char peek()
	{
		if (isAtEnd())
			return '\0';
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
			return '\0';
		return source.charAt(current + 1);
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isAlpha(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isAlphaNumeric(char c)
	{
		return isAlpha(c) || isDigit(c);
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, startLine, startColumn));
	}
}
