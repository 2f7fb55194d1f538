package com.juanpa.emotilang.transpiler.parser;

import com.juanpa.emotilang.transpiler.ast.Program;
import com.juanpa.emotilang.transpiler.ast.declarations.FunctionDeclaration;
import com.juanpa.emotilang.transpiler.ast.expressions.BinaryOp;
import com.juanpa.emotilang.transpiler.ast.expressions.Expression;
import com.juanpa.emotilang.transpiler.ast.expressions.FunctionCall;
import com.juanpa.emotilang.transpiler.ast.expressions.InputExpression;
import com.juanpa.emotilang.transpiler.ast.expressions.NumberLiteral;
import com.juanpa.emotilang.transpiler.ast.expressions.Operator;
import com.juanpa.emotilang.transpiler.ast.statements.*;
import com.juanpa.emotilang.transpiler.lexer.Lexer;
import com.juanpa.emotilang.transpiler.lexer.Token;
import com.juanpa.emotilang.transpiler.lexer.TokenType;
import com.juanpa.emotilang.transpiler.semantics.PrimitiveType;
import com.juanpa.emotilang.transpiler.util.CompilationStage;
import com.juanpa.emotilang.transpiler.util.Diagnostic;
import com.juanpa.emotilang.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmotiParserTest
{
	private static final String FUNCTION = TokenType.ROBOT.getSymbol();
	private static final String IF = TokenType.IF.getSymbol();
	private static final String WHILE = TokenType.DIZZY.getSymbol();
	private static final String TRY = TokenType.TRY.getSymbol();
	private static final String CATCH = TokenType.CATCH.getSymbol();
	private static final String THROW = TokenType.THROW.getSymbol();

	private final ErrorReporter reporter = new ErrorReporter();

	private EmotiParser parserFor(String source)
	{
		List<Token> tokens = new Lexer(source, reporter).scanTokens();
		return new EmotiParser(tokens, reporter);
	}

	private Program parse(String source)
	{
		Optional<Program> program = parserFor(source).parse();
		assertThat(program).as("parse of %s, diagnostics %s", source, reporter.getDiagnostics()).isPresent();
		return program.get();
	}

	/**
	 * Parses {@code :P expr ;)} and returns the printed expression.
	 */
	private Expression expression(String expr)
	{
		Program program = parse(":P " + expr + " ;)");
		return ((PrintStatement) program.getDeclarations().get(0)).getExpression();
	}

	// --- Precedence & associativity ---

	@Test
	void multiplicationBindsTighterThanAddition()
	{
		Expression expr = expression("a :+) b *_* c");

		assertThat(expr.toString()).isEqualTo("(a + (b * c))");
		BinaryOp add = (BinaryOp) expr;
		assertThat(add.getOperator()).isEqualTo(Operator.ADD);
		assertThat(((BinaryOp) add.getRight()).getOperator()).isEqualTo(Operator.MULTIPLY);
	}

	@Test
	void subtractionIsLeftAssociative()
	{
		assertThat(expression("a :-( b :-( c").toString()).isEqualTo("((a - b) - c)");
		assertThat(expression("a :/ b :% c *_* d").toString()).isEqualTo("(((a / b) % c) * d)");
	}

	@Test
	void comparisonBindsTighterThanEquality()
	{
		assertThat(expression("a >:) b =) c <:( d").toString()).isEqualTo("((a > b) == (c < d))");
		assertThat(expression("a !( b =) c").toString()).isEqualTo("((a != b) == c)");
	}

	@Test
	void andBindsTighterThanOr()
	{
		assertThat(expression("a |) b &) c").toString()).isEqualTo("(a || (b && c))");
		assertThat(expression("a &) b |) c &) d").toString()).isEqualTo("((a && b) || (c && d))");
	}

	@Test
	void notBindsLooserThanEqualityButTighterThanAnd()
	{
		assertThat(expression("!) a =) b").toString()).isEqualTo("(!(a == b))");
		assertThat(expression("!) a &) b").toString()).isEqualTo("((!a) && b)");
		assertThat(expression("!) !) a").toString()).isEqualTo("(!(!a))");
	}

	@Test
	void notAfterBinaryOperatorTakesTheRestOfTheComparison()
	{
		assertThat(expression("a *_* !) b :+) c").toString()).isEqualTo("(a * (!(b + c)))");
		assertThat(expression("a =) !) b |) c").toString()).isEqualTo("((a == (!b)) || c)");
	}

	@Test
	void literalsAndCalls()
	{
		assertThat(expression(":0 1.5").toString()).isEqualTo("1.5");
		assertThat(expression(":L \"hi\"").toString()).isEqualTo("\"hi\"");
		assertThat(expression(":D &) :'(").toString()).isEqualTo("(true && false)");
		assertThat(expression("O_O")).isInstanceOf(InputExpression.class);
		assertThat(expression("max :( :0 1 :,D b :+) :0 2 :)").toString()).isEqualTo("max(1, (b + 2))");

		FunctionCall noArgs = (FunctionCall) expression("now :( :)");
		assertThat(noArgs.getName()).isEqualTo("now");
		assertThat(noArgs.getArguments()).isEmpty();
	}

	@Test
	void numberLiteralKeepsIntegerness()
	{
		NumberLiteral integer = (NumberLiteral) expression(":0 42");
		NumberLiteral decimal = (NumberLiteral) expression(":0 4.2");

		assertThat(integer.isInteger()).isTrue();
		assertThat(integer.getValue()).isEqualTo(42L);
		assertThat(decimal.isInteger()).isFalse();
	}

	// --- Statements ---

	@Test
	void parsesDeclarationAssignmentAndPrint()
	{
		Program program = parse(":< x :> :0 <3 :0 5 ;)\nx <3 x :+) :0 1 ;)\n:P x ;)");

		assertThat(program.getDeclarations()).hasSize(3);
		VariableDeclaration declaration = (VariableDeclaration) program.getDeclarations().get(0);
		assertThat(declaration.getIdentifier()).isEqualTo("x");
		assertThat(declaration.getDeclaredType().getType()).isEqualTo(PrimitiveType.NUMBER);
		assertThat(declaration.getInitialValue()).isPresent();

		Assignment assignment = (Assignment) program.getDeclarations().get(1);
		assertThat(assignment.getIdentifier()).isEqualTo("x");
		assertThat(assignment.getExpression().toString()).isEqualTo("(x + 1)");

		assertThat(program.getDeclarations().get(2)).isInstanceOf(PrintStatement.class);
	}

	@Test
	void parsesFunctionDeclaration()
	{
		Program program = parse(FUNCTION + " add :( a :> :0 :,D b :> :0 :) :> :0 :{ /o/ a :+) b ;) :}");

		FunctionDeclaration function = (FunctionDeclaration) program.getDeclarations().get(0);
		assertThat(function.getName()).isEqualTo("add");
		assertThat(function.getParameters()).extracting(p -> p.getName() + ":" + p.getType().getName())
				.containsExactly("a:number", "b:number");
		assertThat(function.getReturnType().getType()).isEqualTo(PrimitiveType.NUMBER);
		assertThat(function.getBody().getStatements()).hasSize(1);
		ReturnStatement ret = (ReturnStatement) function.getBody().getStatements().get(0);
		assertThat(ret.getValue()).map(Object::toString).contains("(a + b)");
	}

	@Test
	void parsesFunctionWithoutParameters()
	{
		Program program = parse(FUNCTION + " hello :( :) :> :L :{ :P :L \"hi\" ;) :}");

		FunctionDeclaration function = (FunctionDeclaration) program.getDeclarations().get(0);
		assertThat(function.getParameters()).isEmpty();
		assertThat(function.getReturnType().getType()).isEqualTo(PrimitiveType.STRING);
	}

	@Test
	void parsesIfWithoutElse()
	{
		Program program = parse(IF + " x >:) :0 0 :{ :P x ;) :}");

		IfStatement ifStatement = (IfStatement) program.getDeclarations().get(0);
		assertThat(ifStatement.getCondition().toString()).isEqualTo("(x > 0)");
		assertThat(ifStatement.getThenBlock().getStatements()).hasSize(1);
		assertThat(ifStatement.getElseBlock()).isEmpty();
	}

	@Test
	void parsesWhileLoop()
	{
		Program program = parse(WHILE + " i <:( :0 3 :{ i <3 i :+) :0 1 ;) :P i ;) :}");

		WhileLoop loop = (WhileLoop) program.getDeclarations().get(0);
		assertThat(loop.getCondition().toString()).isEqualTo("(i < 3)");
		assertThat(loop.getBody().getStatements()).hasSize(2);
	}

	@Test
	void parsesTryCatchAndThrow()
	{
		Program program = parse(TRY + " :{ " + THROW + " :L \"oops\" ;) :} " + CATCH + " err :{ :P err ;) :}");

		TryStatement tryStatement = (TryStatement) program.getDeclarations().get(0);
		assertThat(tryStatement.getCatchVariable()).isEqualTo("err");
		assertThat(tryStatement.getTryBlock().getStatements().get(0)).isInstanceOf(ThrowStatement.class);
		assertThat(tryStatement.getCatchBlock().getStatements().get(0)).isInstanceOf(PrintStatement.class);
	}

	@Test
	void parsesBareReturnAndCallStatement()
	{
		Program program = parse(FUNCTION + " f :( :) :> X_X :{ greet :( :L \"bob\" :) ;) /o/ ;) :}");

		FunctionDeclaration function = (FunctionDeclaration) program.getDeclarations().get(0);
		assertThat(function.getReturnType().getType()).isEqualTo(PrimitiveType.BOOLEAN);
		List<Statement> body = function.getBody().getStatements();
		assertThat(body.get(0)).isInstanceOf(ExpressionStatement.class);
		assertThat(body.get(0).toString()).isEqualTo("greet(\"bob\")");
		assertThat(((ReturnStatement) body.get(1)).getValue()).isEmpty();
	}

	@Test
	void functionsMayNestInsideBlocks()
	{
		Program program = parse(IF + " :D :{ " + FUNCTION + " inner :( :) :> :0 :{ /o/ :0 1 ;) :} :}");

		IfStatement ifStatement = (IfStatement) program.getDeclarations().get(0);
		assertThat(ifStatement.getThenBlock().getStatements().get(0)).isInstanceOf(FunctionDeclaration.class);
	}

	@Test
	void commentsAreIgnored()
	{
		Program program = parse("Z_Z a greeting\n:P :L \"hi\" ;) Z_Z trailing");

		assertThat(program.getDeclarations()).hasSize(1);
	}

	@Test
	void emptyProgramIsValid()
	{
		Program program = parse("Z_Z nothing here");

		assertThat(program.isEmpty()).isTrue();
	}

	@Test
	void recordsDeclaredVariablesWithoutCheckingThem()
	{
		EmotiParser parser = parserFor(":< name :> :L <3 :0 5 ;) :< ok :> X_X <3 :D ;) :< name :> :0 <3 :0 1 ;) :P undeclared ;)");

		assertThat(parser.parse()).isPresent();
		assertThat(parser.getSymbolTable().lookup("name")).contains(PrimitiveType.NUMBER);
		assertThat(parser.getSymbolTable().lookup("ok")).contains(PrimitiveType.BOOLEAN);
		assertThat(parser.getSymbolTable().isDeclared("undeclared")).isFalse();
		assertThat(reporter.hasErrors()).isFalse();
	}

	@Test
	void sameTokensGiveSameTree()
	{
		String source = FUNCTION + " f :( n :> :0 :) :> :0 :{ " + IF + " n >:) :0 1 :{ /o/ n *_* f :( n :-( :0 1 :) ;) :} /o/ :0 1 ;) :}";
		List<Token> tokens = new Lexer(source, reporter).scanTokens();

		Program first = new EmotiParser(tokens, reporter).parse().orElseThrow();
		Program second = new EmotiParser(tokens, reporter).parse().orElseThrow();

		assertThat(second.toString()).isEqualTo(first.toString());
	}

	// --- Failures ---

	@Test
	void missingTerminatorFailsWithLineAndToken()
	{
		EmotiParser parser = parserFor(":< x :> :0 <3 :0 5 ;)\n:P x\n:P x ;)");

		assertThat(parser.parse()).isEmpty();
		Diagnostic failure = parser.getFailure().orElseThrow();
		assertThat(failure.getStage()).isEqualTo(CompilationStage.SYNTACTIC);
		assertThat(failure.getLine()).isEqualTo(3);
		assertThat(failure.getMessage()).startsWith("unexpected ':P'");
		assertThat(reporter.getDiagnostics()).containsExactly(failure);
	}

	@Test
	void prematureEndOfInputIsReported()
	{
		EmotiParser parser = parserFor(":P :0 1 :+)");

		assertThat(parser.parse()).isEmpty();
		Diagnostic failure = parser.getFailure().orElseThrow();
		assertThat(failure.hasLine()).isFalse();
		assertThat(failure.getMessage()).startsWith("unexpected end of input");
	}

	@Test
	void operatorChainUpToTheNestingLimitParses()
	{
		EmotiParser parser = parserFor(":P :0 1" + " :+) :0 1".repeat(EmotiParser.MAX_NESTING) + " ;)");

		assertThat(parser.parse()).isPresent();
		assertThat(reporter.hasErrors()).isFalse();
	}

	@Test
	void operatorChainPastTheNestingLimitIsRejected()
	{
		EmotiParser parser = parserFor(":P :0 1" + " :+) :0 1".repeat(EmotiParser.MAX_NESTING + 1) + " ;)");

		assertThat(parser.parse()).isEmpty();
		Diagnostic failure = parser.getFailure().orElseThrow();
		assertThat(failure.getStage()).isEqualTo(CompilationStage.SYNTACTIC);
		assertThat(failure.getMessage()).isEqualTo("unexpected ':+)', nesting deeper than " + EmotiParser.MAX_NESTING + " levels");
	}

	@Test
	void deeplyNestedNegationIsRejected()
	{
		EmotiParser parser = parserFor(":P " + "!) ".repeat(EmotiParser.MAX_NESTING + 1) + ":D ;)");

		assertThat(parser.parse()).isEmpty();
		assertThat(parser.getFailure().orElseThrow().getMessage()).contains("nesting deeper than");
	}

	@Test
	void deeplyNestedBlocksAreRejected()
	{
		int depth = EmotiParser.MAX_NESTING + 1;
		EmotiParser parser = parserFor((IF + " :D :{ ").repeat(depth) + ":P :D ;) " + ":} ".repeat(depth));

		assertThat(parser.parse()).isEmpty();
		assertThat(parser.getFailure().orElseThrow().getMessage()).contains("nesting deeper than");
	}

	@Test
	void deeplyNestedCallsAreRejected()
	{
		int depth = EmotiParser.MAX_NESTING + 1;
		EmotiParser parser = parserFor(":P " + "f :( ".repeat(depth) + ":)".repeat(depth) + " ;)");

		assertThat(parser.parse()).isEmpty();
		assertThat(parser.getFailure().orElseThrow().getMessage()).contains("nesting deeper than");
	}

	@Test
	void numberWithoutTypeMarkerIsRejected()
	{
		EmotiParser parser = parserFor(":P 5 ;)");

		assertThat(parser.parse()).isEmpty();
		assertThat(parser.getFailure().orElseThrow().getMessage()).startsWith("unexpected '5'");
	}

	@Test
	void emptyBlockIsRejected()
	{
		EmotiParser parser = parserFor(IF + " :D :{ :}");

		assertThat(parser.parse()).isEmpty();
		assertThat(parser.getFailure().orElseThrow().getMessage()).startsWith("unexpected ':}'");
	}

	@Test
	void bareIdentifierStatementIsRejected()
	{
		EmotiParser parser = parserFor("x ;)");

		assertThat(parser.parse()).isEmpty();
		assertThat(parser.getFailure().orElseThrow().getMessage()).startsWith("unexpected ';)'");
	}

	@Test
	void invalidTypeIsRejected()
	{
		EmotiParser parser = parserFor(":< x :> :P <3 :0 1 ;)");

		assertThat(parser.parse()).isEmpty();
		assertThat(parser.getFailure().orElseThrow().getMessage()).contains("expected a type");
	}

	@Test
	void parserCannotBeReused()
	{
		EmotiParser parser = parserFor(":P :D ;)");
		parser.parse();

		assertThatThrownBy(parser::parse).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void tokenListWithoutEofIsAccepted()
	{
		List<Token> tokens = List.of(
				new Token(TokenType.TONGUE_OUT, ":P", null, 1, 1),
				new Token(TokenType.LAUGHING, ":D", null, 1, 4),
				new Token(TokenType.WINK_SEP, ";)", null, 1, 7));

		Optional<Program> program = new EmotiParser(tokens, reporter).parse();

		assertThat(program).isPresent();
		assertThat(program.get().getDeclarations()).hasSize(1);
	}
}
