package com.juanpa.emotilang.transpiler.parser;

import com.juanpa.emotilang.transpiler.ast.Program;
import com.juanpa.emotilang.transpiler.ast.TypeNode;
import com.juanpa.emotilang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.emotilang.transpiler.ast.declarations.Parameter;
import com.juanpa.emotilang.transpiler.ast.expressions.*;
import com.juanpa.emotilang.transpiler.ast.statements.*;
import com.juanpa.emotilang.transpiler.lexer.Token;
import com.juanpa.emotilang.transpiler.lexer.TokenType;
import com.juanpa.emotilang.transpiler.semantics.PrimitiveType;
import com.juanpa.emotilang.transpiler.semantics.SymbolTable;
import com.juanpa.emotilang.transpiler.util.CompilationStage;
import com.juanpa.emotilang.transpiler.util.Debug;
import com.juanpa.emotilang.transpiler.util.Diagnostic;
import com.juanpa.emotilang.transpiler.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The EmotiParser is responsible for performing syntactic analysis.
 * It takes a list of tokens from the lexer and attempts to build an
 * Abstract Syntax Tree (AST) based on the EmotiLang grammar.
 * This parser uses a recursive-descent approach with one method per precedence level.
 * <p>
 * The first mismatch ends the parse: no partial tree is returned. A parser instance
 * parses its tokens once.
 */
public class EmotiParser
{
	/**
	 * How deep blocks, calls, negations and operator chains may nest before the parse is
	 * refused. Every later stage walks the tree recursively, so its depth stays bounded.
	 */
	public static final int MAX_NESTING = 256;

	private final List<Token> tokens; // The list of tokens from the lexer
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private final SymbolTable symbolTable = new SymbolTable();
	private int current = 0; // Current position in the token list
	private boolean used = false;
	private int nesting = 0;
	private Diagnostic failure;

	/**
	 * Constructs a parser over a token list. A list without a trailing EOF token gets one.
	 *
	 * @param tokens        The tokens to parse.
	 * @param errorReporter Receives the syntax error, if any.
	 */
	public EmotiParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this.tokens = new ArrayList<>(tokens);
		this.errorReporter = errorReporter;

		if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).getType() != TokenType.EOF)
		{
			int line = this.tokens.isEmpty() ? 1 : this.tokens.get(this.tokens.size() - 1).getLine();
			this.tokens.add(new Token(TokenType.EOF, "", null, line, 0));
		}
	}

	/**
	 * Parses the whole token list into a Program.
	 *
	 * @return The Program, or empty if a syntax error was found (see {@link #getFailure()}).
	 * @throws IllegalStateException if this parser has already been used.
	 */
	public Optional<Program> parse()
	{
		if (used)
		{
			throw new IllegalStateException("A parser can only be used once; create a new one for a new token list.");
		}
		used = true;

		try
		{
			List<Statement> declarations = new ArrayList<>();
			while (!isAtEnd())
			{
				declarations.add(statement());
			}
			Debug.log("Parsed %d top-level statement(s), %d declared variable(s)", declarations.size(), symbolTable.size());
			return Optional.of(new Program(declarations));
		}
		catch (SyntaxError e)
		{
			failure = e.getDiagnostic();
			return Optional.empty();
		}
	}

	/**
	 * The syntax error that ended the parse, if there was one.
	 */
	public Optional<Diagnostic> getFailure()
	{
		return Optional.ofNullable(failure);
	}

	/**
	 * The names declared with {@code :<} while parsing, with their declared types.
	 */
	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}

	// --- Statements ---

	/**
	 * Parses a single statement.
	 *
	 * @return The Statement AST node.
	 * @throws SyntaxError if a syntax error occurs.
	 */
	private Statement statement() throws SyntaxError
	{
		if (match(TokenType.DECLARE))
			return variableDeclaration();
		if (match(TokenType.TONGUE_OUT))
			return printStatement();
		if (match(TokenType.ROBOT))
			return functionDeclaration();
		if (match(TokenType.WAVE))
			return returnStatement();
		if (match(TokenType.IF))
			return ifStatement();
		if (match(TokenType.DIZZY))
			return whileLoop();
		if (match(TokenType.TRY))
			return tryStatement();
		if (match(TokenType.THROW))
			return throwStatement();

		if (check(TokenType.IDENTIFIER))
		{
			if (checkNext(TokenType.ASSIGN_GIVE))
			{
				return assignment();
			}
			if (checkNext(TokenType.SAD_OPEN))
			{
				return callStatement();
			}
			advance();
			throw error(peek(), "expected '" + TokenType.ASSIGN_GIVE.getSymbol() + "' or '" + TokenType.SAD_OPEN.getSymbol()
					+ "' after '" + previous().getLexeme() + "'");
		}

		throw error(peek(), "expected a statement");
	}

	/**
	 * Grammar: {@code :< IDENT :> type <3 expression ;)}
	 */
	private VariableDeclaration variableDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "expected a variable name after ':<'");
		consume(TokenType.TYPE_ARROW, "expected ':>' before the variable type");
		TypeNode type = type();
		consume(TokenType.ASSIGN_GIVE, "expected '<3' before the initial value");
		Expression value = expression();
		consume(TokenType.WINK_SEP, "expected ';)' after the variable declaration");

		symbolTable.declare(name.getLexeme(), type.getType());
		return new VariableDeclaration(name.getLexeme(), type, value);
	}

	/**
	 * Grammar: {@code IDENT <3 expression ;)}
	 */
	private Assignment assignment() throws SyntaxError
	{
		Token name = advance();
		advance(); // '<3'
		Expression value = expression();
		consume(TokenType.WINK_SEP, "expected ';)' after the assignment");
		return new Assignment(name.getLexeme(), value);
	}

	/**
	 * A call whose result is discarded. Grammar: {@code IDENT :( arguments :) ;)}
	 */
	private ExpressionStatement callStatement() throws SyntaxError
	{
		Token name = advance();
		advance(); // ':('
		FunctionCall call = finishCall(name);
		consume(TokenType.WINK_SEP, "expected ';)' after the function call");
		return new ExpressionStatement(call);
	}

	private PrintStatement printStatement() throws SyntaxError
	{
		Expression value = expression();
		consume(TokenType.WINK_SEP, "expected ';)' after the print statement");
		return new PrintStatement(value);
	}

	/**
	 * Grammar: {@code 🤖 IDENT :( parameters :) :> type block}
	 */
	private FunctionDeclaration functionDeclaration() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "expected a function name");
		consume(TokenType.SAD_OPEN, "expected ':(' after the function name");

		List<Parameter> parameters = new ArrayList<>();
		if (!check(TokenType.HAPPY_CLOSE))
		{
			do
			{
				parameters.add(parameter());
			}
			while (match(TokenType.FIELD_SEP));
		}
		consume(TokenType.HAPPY_CLOSE, "expected ':)' after the parameters");
		consume(TokenType.TYPE_ARROW, "expected ':>' before the return type");
		TypeNode returnType = type();
		Block body = block();

		return new FunctionDeclaration(name.getLexeme(), parameters, returnType, body);
	}

	private Parameter parameter() throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "expected a parameter name");
		consume(TokenType.TYPE_ARROW, "expected ':>' before the parameter type");
		return new Parameter(name.getLexeme(), type());
	}

	/**
	 * Grammar: {@code /o/ expression? ;)}
	 */
	private ReturnStatement returnStatement() throws SyntaxError
	{
		Expression value = null;
		if (!check(TokenType.WINK_SEP))
		{
			value = expression();
		}
		consume(TokenType.WINK_SEP, "expected ';)' after the return statement");
		return new ReturnStatement(value);
	}

	/**
	 * Grammar: {@code (╭ರ_•́) expression block}. There is no else branch.
	 */
	private IfStatement ifStatement() throws SyntaxError
	{
		Expression condition = expression();
		Block thenBlock = block();
		return new IfStatement(condition, thenBlock, null);
	}

	private WhileLoop whileLoop() throws SyntaxError
	{
		Expression condition = expression();
		Block body = block();
		return new WhileLoop(condition, body);
	}

	/**
	 * Grammar: {@code 🕷️ block 🕸️ IDENT block}
	 */
	private TryStatement tryStatement() throws SyntaxError
	{
		Block tryBlock = block();
		consume(TokenType.CATCH, "expected the catch keyword after the try block");
		Token variable = consume(TokenType.IDENTIFIER, "expected a name for the caught error");
		Block catchBlock = block();
		return new TryStatement(tryBlock, variable.getLexeme(), catchBlock);
	}

	private ThrowStatement throwStatement() throws SyntaxError
	{
		Expression value = expression();
		consume(TokenType.WINK_SEP, "expected ';)' after the throw statement");
		return new ThrowStatement(value);
	}

	/**
	 * Grammar: {@code :{ statement+ :}}
	 */
	private Block block() throws SyntaxError
	{
		consume(TokenType.CURLY_OPEN, "expected ':{' to open a block");
		enterNesting();

		List<Statement> statements = new ArrayList<>();
		do
		{
			statements.add(statement());
		}
		while (!check(TokenType.CURLY_CLOSE) && !isAtEnd());

		consume(TokenType.CURLY_CLOSE, "expected ':}' to close the block");
		leaveNesting(1);
		return new Block(statements);
	}

	private TypeNode type() throws SyntaxError
	{
		Optional<PrimitiveType> type = PrimitiveType.fromMarker(peek().getType());
		if (type.isEmpty())
		{
			throw error(peek(), "expected a type (':0', ':L' or 'X_X')");
		}
		advance();
		return new TypeNode(type.get());
	}

	// --- Expressions, lowest precedence first ---

	private Expression expression() throws SyntaxError
	{
		return or();
	}

	private Expression or() throws SyntaxError
	{
		Expression expr = and();

		while (match(TokenType.OR_CHOICE))
		{
			Expression right = and();
			expr = new BinaryOp(expr, Operator.OR, right);
		}
		return expr;
	}

	private Expression and() throws SyntaxError
	{
		Expression expr = not();

		while (match(TokenType.AND_TOGETHER))
		{
			Expression right = not();
			expr = new BinaryOp(expr, Operator.AND, right);
		}
		return expr;
	}

	/**
	 * Logical negation is prefix and right-associative, binding looser than equality:
	 * {@code !) a =) b} negates the whole comparison.
	 */
	private Expression not() throws SyntaxError
	{
		if (match(TokenType.NOT_OPPOSITE))
		{
			enterNesting();
			Expression operand = not();
			leaveNesting(1);
			return new UnaryOp(Operator.NOT, operand);
		}
		return equality();
	}

	private Expression equality() throws SyntaxError
	{
		return binaryLevel(this::relational, TokenType.EQUAL_TWINS, TokenType.NOT_EQUAL);
	}

	private Expression relational() throws SyntaxError
	{
		return binaryLevel(this::additive, TokenType.GREATER_SMUG, TokenType.LESS_DOWN);
	}

	private Expression additive() throws SyntaxError
	{
		return binaryLevel(this::multiplicative, TokenType.PLUS_HAPPY, TokenType.MINUS_SAD);
	}

	private Expression multiplicative() throws SyntaxError
	{
		return binaryLevel(this::primary, TokenType.STAR_EYES, TokenType.SLASH_CONFUSED, TokenType.PERCENT_WEIRD);
	}

	/**
	 * One left-associative level: {@code operand ( op operand )*}.
	 */
	private Expression binaryLevel(OperandParser operand, TokenType... operators) throws SyntaxError
	{
		Expression expr = operand.parse();

		// Each operator deepens the left-leaning tree by one level
		int chained = 0;
		while (match(operators))
		{
			enterNesting();
			chained++;
			Operator operator = toOperator(previous());
			Expression right = operand.parse();
			expr = new BinaryOp(expr, operator, right);
		}
		leaveNesting(chained);
		return expr;
	}

	/**
	 * Parses literals, names, calls, input and a negation met in operand position.
	 */
	private Expression primary() throws SyntaxError
	{
		if (match(TokenType.SURPRISED))
		{
			Token number = consume(TokenType.NUMBER, "expected a number after ':0'");
			return new NumberLiteral((Number) number.getLiteral());
		}
		if (match(TokenType.L_FACE))
		{
			Token string = consume(TokenType.STRING, "expected a string after ':L'");
			return new StringLiteral((String) string.getLiteral());
		}
		if (match(TokenType.LAUGHING))
			return new BooleanLiteral(true);
		if (match(TokenType.CRYING))
			return new BooleanLiteral(false);
		if (match(TokenType.INPUT))
			return new InputExpression();

		if (match(TokenType.IDENTIFIER))
		{
			Token name = previous();
			if (match(TokenType.SAD_OPEN))
			{
				return finishCall(name);
			}
			return new Identifier(name.getLexeme());
		}

		// A negation after a binary operator takes everything up to the next '&)' or '|)'
		if (match(TokenType.NOT_OPPOSITE))
		{
			enterNesting();
			Expression operand = not();
			leaveNesting(1);
			return new UnaryOp(Operator.NOT, operand);
		}

		throw error(peek(), "expected an expression");
	}

	/**
	 * Parses the arguments of a call whose name and ':(' are already consumed.
	 */
	private FunctionCall finishCall(Token name) throws SyntaxError
	{
		enterNesting();
		List<Expression> arguments = new ArrayList<>();
		if (!check(TokenType.HAPPY_CLOSE))
		{
			do
			{
				arguments.add(expression());
			}
			while (match(TokenType.FIELD_SEP));
		}
		consume(TokenType.HAPPY_CLOSE, "expected ':)' after the arguments");
		leaveNesting(1);
		return new FunctionCall(name.getLexeme(), arguments);
	}

	private Operator toOperator(Token token)
	{
		return Operator.fromTokenType(token.getType())
				.orElseThrow(() -> new IllegalStateException("No operator for token " + token.getType()));
	}

	private void enterNesting() throws SyntaxError
	{
		if (++nesting > MAX_NESTING)
		{
			throw error(previous(), "nesting deeper than " + MAX_NESTING + " levels");
		}
	}

	private void leaveNesting(int levels)
	{
		nesting -= levels;
	}

	// --- Helper Methods ---

	/**
	 * Consumes the current token if its type matches any of the given types.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it is of the expected type, otherwise fails the parse.
	 *
	 * @param type    The expected TokenType.
	 * @param message What was expected, for the error message.
	 * @return The consumed Token.
	 * @throws SyntaxError if the current token's type does not match the expected type.
	 */
	private Token consume(TokenType type, String message) throws SyntaxError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private boolean check(TokenType type)
	{
		if (isAtEnd())
		{
			return false;
		}
		return peek().getType() == type;
	}

	private boolean checkNext(TokenType type)
	{
		if (current + 1 >= tokens.size())
		{
			return false;
		}
		return tokens.get(current + 1).getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	/**
	 * Reports a syntax error at the given token and creates the SyntaxError that unwinds the parse.
	 *
	 * @param token   The offending token.
	 * @param message What the parser expected instead.
	 * @return A new SyntaxError instance.
	 */
	private SyntaxError error(Token token, String message)
	{
		Diagnostic diagnostic;
		if (token.getType() == TokenType.EOF)
		{
			diagnostic = errorReporter.report(CompilationStage.SYNTACTIC, Diagnostic.NO_LINE,
					"unexpected end of input, " + message);
		}
		else
		{
			diagnostic = errorReporter.report(CompilationStage.SYNTACTIC, token.getLine(),
					"unexpected '" + token.getLexeme() + "', " + message);
		}
		return new SyntaxError(diagnostic);
	}

	@FunctionalInterface
	private interface OperandParser
	{
		Expression parse() throws SyntaxError;
	}

	/**
	 * Unchecked exception used internally by the parser to unwind the stack
	 * when a syntax error is found.
	 */
	private static class SyntaxError extends RuntimeException
	{
		private final transient Diagnostic diagnostic;

		SyntaxError(Diagnostic diagnostic)
		{
			super(diagnostic.getMessage(), null, false, false);
			this.diagnostic = diagnostic;
		}

		Diagnostic getDiagnostic()
		{
			return diagnostic;
		}
	}
}
