package com.juanpa.emotilang.transpiler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of a single compilation. One instance per compilation;
 * the lexer and the parser share it.
 */
public class ErrorReporter
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	/**
	 * Records a compilation problem.
	 *
	 * @param stage   The pipeline stage reporting the problem.
	 * @param line    The line number where the problem occurred, or {@link Diagnostic#NO_LINE}.
	 * @param message The error message.
	 * @return The recorded diagnostic.
	 */
	public Diagnostic report(CompilationStage stage, int line, String message)
	{
		Diagnostic diagnostic = new Diagnostic(stage, message, line);
		diagnostics.add(diagnostic);
		Debug.log("%s", diagnostic.format());
		return diagnostic;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
