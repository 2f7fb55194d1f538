package com.juanpa.emotilang.transpiler.codegen;

import com.juanpa.emotilang.transpiler.ast.Program;
import com.juanpa.emotilang.transpiler.ast.TypeNode;
import com.juanpa.emotilang.transpiler.ast.expressions.BinaryOp;
import com.juanpa.emotilang.transpiler.ast.expressions.BooleanLiteral;
import com.juanpa.emotilang.transpiler.ast.expressions.Identifier;
import com.juanpa.emotilang.transpiler.ast.expressions.InputExpression;
import com.juanpa.emotilang.transpiler.ast.expressions.NumberLiteral;
import com.juanpa.emotilang.transpiler.ast.expressions.Operator;
import com.juanpa.emotilang.transpiler.ast.expressions.StringLiteral;
import com.juanpa.emotilang.transpiler.ast.statements.*;
import com.juanpa.emotilang.transpiler.lexer.Lexer;
import com.juanpa.emotilang.transpiler.lexer.TokenType;
import com.juanpa.emotilang.transpiler.parser.EmotiParser;
import com.juanpa.emotilang.transpiler.semantics.PrimitiveType;
import com.juanpa.emotilang.transpiler.util.CompilerConfig;
import com.juanpa.emotilang.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaScriptGeneratorTest
{
	private static final String HEADER = "// Transpiled from EmotiLang";
	private static final String FUNCTION = TokenType.ROBOT.getSymbol();
	private static final String IF = TokenType.IF.getSymbol();
	private static final String WHILE = TokenType.DIZZY.getSymbol();
	private static final String TRY = TokenType.TRY.getSymbol();
	private static final String CATCH = TokenType.CATCH.getSymbol();
	private static final String THROW = TokenType.THROW.getSymbol();

	private final JavaScriptGenerator generator = new JavaScriptGenerator(new CompilerConfig(new Properties()));

	private String generate(String source)
	{
		ErrorReporter reporter = new ErrorReporter();
		Program program = new EmotiParser(new Lexer(source, reporter).scanTokens(), reporter).parse().orElseThrow();
		assertThat(reporter.hasErrors()).isFalse();
		return generator.generate(program);
	}

	private static String js(String... lines)
	{
		return HEADER + "\n\n" + String.join("\n", lines);
	}

	@Test
	void emptyProgramGeneratesOnlyTheHeader()
	{
		assertThat(generator.generate(new Program(List.of()))).isEqualTo(HEADER + "\n");
	}

	@Test
	void declarationFollowedByPrint()
	{
		assertThat(generate(":< x :> :0 <3 :0 5 ;)\n:P x ;)")).isEqualTo(js(
				"let x = 5; // number",
				"console.log(x);"));
	}

	@Test
	void functionWithIfAndReturns()
	{
		String source = FUNCTION + " f :( n :> :0 :) :> :0 :{\n"
				+ "  " + IF + " n >:) :0 0 :{ /o/ n ;) :}\n"
				+ "  /o/ :0 0 ;)\n"
				+ ":}";

		assertThat(generate(source)).isEqualTo(js(
				"function f(n /* number */) /* -> number */ {",
				"  if ((n > 0)) {",
				"    return n;",
				"  }",
				"  return 0;",
				"}"));
	}

	@Test
	void tryCatchWithThrow()
	{
		String source = TRY + " :{ " + THROW + " :L \"oops\" ;) :} " + CATCH + " err :{ :P err ;) :}";

		assertThat(generate(source)).isEqualTo(js(
				"try {",
				"  throw new Error(\"oops\");",
				"} catch (err) {",
				"  console.log(err);",
				"}"));
	}

	@Test
	void whileLoopWithAssignment()
	{
		String source = ":< i :> :0 <3 :0 0 ;) " + WHILE + " i <:( :0 3 :{ i <3 i :+) :0 1 ;) :}";

		assertThat(generate(source)).isEqualTo(js(
				"let i = 0; // number",
				"while ((i < 3)) {",
				"  i = (i + 1);",
				"}"));
	}

	@Test
	void operatorsAreParenthesizedAndMapped()
	{
		assertThat(generate(":P !) a =) b &) c !( :0 2.5 |) d :% e ;)"))
				.isEqualTo(js("console.log((((!(a == b)) && (c != 2.5)) || (d % e)));"));
	}

	@Test
	void literalsInputAndCalls()
	{
		String source = ":< name :> :L <3 O_O ;) :< ok :> X_X <3 :'( ;) greet :( name :,D :D :) ;) :P now :( :) ;)";

		assertThat(generate(source)).isEqualTo(js(
				"let name = prompt(\"Enter input:\"); // string",
				"let ok = false; // boolean",
				"greet(name, true);",
				"console.log(now());"));
	}

	@Test
	void functionWithoutParametersAndBareReturn()
	{
		String source = FUNCTION + " stop :( :) :> X_X :{ /o/ ;) :}";

		assertThat(generate(source)).isEqualTo(js(
				"function stop() /* -> boolean */ {",
				"  return;",
				"}"));
	}

	@Test
	void stringLiteralsAreEscaped()
	{
		String source = ":P :L \"tab\there\nback\\slash\" ;)";

		assertThat(generate(source)).isEqualTo(js("console.log(\"tab\\there\\nback\\\\slash\");"));
		assertThat(JavaScriptGenerator.quote("say \"hi\"\r")).isEqualTo("\"say \\\"hi\\\"\\r\"");
	}

	@Test
	void nestedBlocksKeepBracesBalanced()
	{
		String source = FUNCTION + " deep :( :) :> :0 :{ "
				+ WHILE + " :D :{ "
				+ IF + " :D :{ "
				+ TRY + " :{ :P :0 1 ;) :} " + CATCH + " e :{ /o/ :0 2 ;) :} "
				+ ":} :} /o/ :0 3 ;) :}";

		String output = generate(source);

		assertThat(output.chars().filter(c -> c == '{').count())
				.isEqualTo(output.chars().filter(c -> c == '}').count());
		assertThat(output).contains("\n        console.log(1);\n");
		assertThat(output).endsWith("\n  return 3;\n}");
	}

	@Test
	void elseBranchIsEmittedWhenPresent()
	{
		IfStatement statement = new IfStatement(new Identifier("ready"),
				new Block(List.of(new PrintStatement(new StringLiteral("go")))),
				new Block(List.of(new PrintStatement(new StringLiteral("wait")))));

		assertThat(generator.generate(new Program(List.of(statement)))).isEqualTo(js(
				"if (ready) {",
				"  console.log(\"go\");",
				"} else {",
				"  console.log(\"wait\");",
				"}"));
	}

	@Test
	void declarationWithoutInitializer()
	{
		VariableDeclaration declaration = new VariableDeclaration("label", new TypeNode(PrimitiveType.STRING), null);

		assertThat(generator.generate(new Program(List.of(declaration)))).isEqualTo(js("let label; // string"));
	}

	@Test
	void standaloneBlockIsBraced()
	{
		Block block = new Block(List.of(new ExpressionStatement(new BooleanLiteral(true))));

		assertThat(generator.generate(new Program(List.of(block)))).isEqualTo(js("{", "  true;", "}"));
	}

	@Test
	void configurationControlsIndentHeaderAndPrompt()
	{
		Properties props = new Properties();
		props.setProperty("codegen.indent", "\t");
		props.setProperty("codegen.header", "// generated");
		props.setProperty("codegen.input_prompt", "Name?");
		JavaScriptGenerator custom = new JavaScriptGenerator(new CompilerConfig(props));

		WhileLoop loop = new WhileLoop(new BooleanLiteral(true),
				new Block(List.of(new Assignment("x", new InputExpression()))));

		assertThat(custom.generate(new Program(List.of(loop))))
				.isEqualTo("// generated\n\nwhile (true) {\n\tx = prompt(\"Name?\");\n}");
	}

	@Test
	void generatorCanBeReused()
	{
		Program program = new Program(List.of(new PrintStatement(new NumberLiteral(7L))));

		assertThat(generator.generate(program)).isEqualTo(generator.generate(program));
	}

	@Test
	void malformedTreeIsAGenerationError()
	{
		PrintStatement broken = new PrintStatement(new BinaryOp(null, Operator.ADD, new NumberLiteral(1L)));

		assertThatThrownBy(() -> generator.generate(new Program(List.of(broken))))
				.isInstanceOf(CodeGenerationException.class)
				.hasMessageContaining("left operand");
	}
}
