package com.juanpa.emotilang.transpiler;

import com.juanpa.emotilang.transpiler.ast.Program;
import com.juanpa.emotilang.transpiler.codegen.JavaScriptGenerator;
import com.juanpa.emotilang.transpiler.lexer.Lexer;
import com.juanpa.emotilang.transpiler.lexer.Token;
import com.juanpa.emotilang.transpiler.parser.EmotiParser;
import com.juanpa.emotilang.transpiler.util.AstPrinter;
import com.juanpa.emotilang.transpiler.util.CompilationStage;
import com.juanpa.emotilang.transpiler.util.CompilerConfig;
import com.juanpa.emotilang.transpiler.util.Debug;
import com.juanpa.emotilang.transpiler.util.Diagnostic;
import com.juanpa.emotilang.transpiler.util.ErrorReporter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the whole pipeline on one source text: lexing, parsing and JavaScript generation.
 * Each call builds its own lexer, parser and error reporter, so a single compiler can be
 * shared between threads.
 */
public class EmotiCompiler
{
	private final JavaScriptGenerator generator;

	public EmotiCompiler()
	{
		this(CompilerConfig.defaults());
	}

	public EmotiCompiler(CompilerConfig config)
	{
		this.generator = new JavaScriptGenerator(config);
	}

	/**
	 * Compiles EmotiLang source to JavaScript. Problems are reported in the result, never thrown.
	 *
	 * @param source The EmotiLang source text.
	 * @return The generated code, or the diagnostic that stopped compilation.
	 */
	public CompilationResult compile(String source)
	{
		Objects.requireNonNull(source, "source");
		ErrorReporter errorReporter = new ErrorReporter();

		// 1. Lexing. Illegal characters are recorded and skipped.
		List<Token> tokens = new Lexer(source, errorReporter).scanTokens();
		StringBuilder debug = new StringBuilder("=== TOKENS ===\n").append(AstPrinter.listTokens(tokens));

		// 2. Parsing. The first syntax error ends the compilation.
		EmotiParser parser = new EmotiParser(tokens, errorReporter);
		Optional<Program> program = parser.parse();
		if (program.isEmpty())
		{
			Diagnostic failure = parser.getFailure()
					.orElseGet(() -> errorReporter.report(CompilationStage.SYNTACTIC, Diagnostic.NO_LINE, "parsing failed"));
			appendDiagnostics(debug, errorReporter);
			return CompilationResult.failure(failure, errorReporter.getDiagnostics(), debug.toString());
		}
		Debug.log("Declared variables: %s", parser.getSymbolTable());

		// 3. Generation.
		try
		{
			debug.append("\n=== AST ===\n").append(new AstPrinter().print(program.get())).append('\n');
			String javaScript = generator.generate(program.get());
			appendDiagnostics(debug, errorReporter);
			return CompilationResult.success(javaScript, errorReporter.getDiagnostics(), debug.toString());
		}
		catch (RuntimeException e)
		{
			String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
			Diagnostic failure = errorReporter.report(CompilationStage.GENERATION, Diagnostic.NO_LINE, message);
			appendDiagnostics(debug, errorReporter);
			return CompilationResult.failure(failure, errorReporter.getDiagnostics(), debug.toString());
		}
	}

	private static void appendDiagnostics(StringBuilder debug, ErrorReporter errorReporter)
	{
		if (!errorReporter.hasErrors())
		{
			return;
		}
		debug.append("\n=== ERRORS ===\n");
		for (Diagnostic diagnostic : errorReporter.getDiagnostics())
		{
			debug.append(diagnostic.format()).append('\n');
		}
	}
}
