package com.juanpa.emotilang.transpiler.lexer;

/**
 * Defines the types of tokens recognized by the EmotiLang Lexer.
 * Fixed-spelling tokens carry their exact source symbol; literal and identifier kinds carry none.
 */
public enum TokenType
{
	// --- Punctuation & Delimiters ---
	HAPPY_CLOSE(":)"),      // closes a parameter/argument list
	SAD_OPEN(":("),         // opens a parameter/argument list
	WINK_SEP(";)"),         // statement terminator
	CURLY_OPEN(":{"),       // block open
	CURLY_CLOSE(":}"),      // block close
	FIELD_SEP(":,D"),       // list separator

	// --- Declarations & Types ---
	DECLARE(":<"),
	TYPE_ARROW(":>"),
	SURPRISED(":0"),        // number type, number literal marker
	L_FACE(":L"),           // string type, string literal marker
	DEAD(null),             // boolean type, spelled X_X
	ASSIGN_GIVE("<3"),

	// --- Keywords ---
	ROBOT("\uD83E\uDD16"),                    // 🤖 function
	WAVE("/o/"),                                // return
	IF("(\u256D\u0CB0_\u2022\u0301)"),           // (╭ರ_•́)
	DIZZY("(\u2E1D\u2E1D\u0E51\uFE4F\u0E51\u2E1D\u2E1D)"), // (⸝⸝๑﹏๑⸝⸝) while
	TRY("\uD83D\uDD77\uFE0F"),                 // 🕷️
	CATCH("\uD83D\uDD78\uFE0F"),               // 🕸️
	THROW("\uD83D\uDCA5"),                     // 💥
	TONGUE_OUT(":P"),                           // print
	INPUT(null),            // spelled O_O

	// --- Literals ---
	LAUGHING(":D"),         // true
	CRYING(":'("),          // false
	NUMBER(null),
	STRING(null),
	IDENTIFIER(null),

	// --- Operators ---
	PLUS_HAPPY(":+)"),
	MINUS_SAD(":-("),
	STAR_EYES("*_*"),
	SLASH_CONFUSED(":/"),
	PERCENT_WEIRD(":%"),
	EQUAL_TWINS("=)"),
	NOT_EQUAL("!("),
	GREATER_SMUG(">:)"),
	LESS_DOWN("<:("),
	AND_TOGETHER("&)"),
	OR_CHOICE("|)"),
	NOT_OPPOSITE("!)"),

	// --- Special ---
	EOF(null);

	private final String symbol;

	TokenType(String symbol)
	{
		this.symbol = symbol;
	}

	/**
	 * The exact source spelling of this token, or {@code null} for kinds whose text varies
	 * (literals, identifiers) or that come from a reserved identifier.
	 */
	public String getSymbol()
	{
		return symbol;
	}

	public boolean isFixedSymbol()
	{
		return symbol != null;
	}
}
