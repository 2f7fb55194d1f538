package com.juanpa.emotilang.transpiler;

import com.juanpa.emotilang.transpiler.util.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of compiling one source text: either the generated JavaScript or the
 * diagnostic that stopped compilation. Lexical problems do not stop compilation, so a
 * successful result can still carry diagnostics.
 */
public final class CompilationResult
{
	private final String javaScript;
	private final Diagnostic failure;
	private final List<Diagnostic> diagnostics;
	private final String debugOutput;

	private CompilationResult(String javaScript, Diagnostic failure, List<Diagnostic> diagnostics, String debugOutput)
	{
		this.javaScript = javaScript;
		this.failure = failure;
		this.diagnostics = List.copyOf(diagnostics);
		this.debugOutput = debugOutput;
	}

	static CompilationResult success(String javaScript, List<Diagnostic> diagnostics, String debugOutput)
	{
		return new CompilationResult(javaScript, null, diagnostics, debugOutput);
	}

	static CompilationResult failure(Diagnostic failure, List<Diagnostic> diagnostics, String debugOutput)
	{
		return new CompilationResult(null, failure, diagnostics, debugOutput);
	}

	public boolean isSuccess()
	{
		return failure == null;
	}

	public Optional<String> getJavaScript()
	{
		return Optional.ofNullable(javaScript);
	}

	/**
	 * The syntax or generation error that stopped compilation, if any.
	 */
	public Optional<Diagnostic> getFailure()
	{
		return Optional.ofNullable(failure);
	}

	/**
	 * Every diagnostic recorded during compilation, in the order they were found.
	 */
	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	/**
	 * The token listing and syntax tree (or the errors), for showing next to the output.
	 */
	public String getDebugOutput()
	{
		return debugOutput;
	}

	@Override
	public String toString()
	{
		return isSuccess()
				? "CompilationResult[success, " + diagnostics.size() + " diagnostic(s)]"
				: "CompilationResult[failed: " + failure.format() + "]";
	}
}
