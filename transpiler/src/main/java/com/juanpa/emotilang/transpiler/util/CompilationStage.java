package com.juanpa.emotilang.transpiler.util;

/**
 * The pipeline stage that produced a {@link Diagnostic}.
 */
public enum CompilationStage
{
	LEXICAL("Lexical Error"),
	SYNTACTIC("Syntax Error"),
	GENERATION("Generation Error");

	private final String label;

	CompilationStage(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
