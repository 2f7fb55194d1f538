package com.juanpa.emotilang.transpiler.util;

import java.util.Objects;

/**
 * A structured description of a problem found while compiling: which stage found it,
 * what went wrong, and on which source line (when a line is known).
 */
public final class Diagnostic
{
	/**
	 * Line value used when the problem has no source position, e.g. an unexpected end of input.
	 */
	public static final int NO_LINE = -1;

	private final CompilationStage stage;
	private final String message;
	private final int line;

	public Diagnostic(CompilationStage stage, String message, int line)
	{
		this.stage = Objects.requireNonNull(stage, "stage");
		this.message = Objects.requireNonNull(message, "message");
		this.line = line;
	}

	public CompilationStage getStage()
	{
		return stage;
	}

	public String getMessage()
	{
		return message;
	}

	public int getLine()
	{
		return line;
	}

	public boolean hasLine()
	{
		return line != NO_LINE;
	}

	/**
	 * Renders the diagnostic for display, e.g. {@code [Syntax Error] Line 3: unexpected ':)'}.
	 */
	public String format()
	{
		if (hasLine())
		{
			return "[" + stage.getLabel() + "] Line " + line + ": " + message;
		}
		return "[" + stage.getLabel() + "] " + message;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Diagnostic that = (Diagnostic) o;
		return line == that.line && stage == that.stage && message.equals(that.message);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(stage, message, line);
	}

	@Override
	public String toString()
	{
		return format();
	}
}
