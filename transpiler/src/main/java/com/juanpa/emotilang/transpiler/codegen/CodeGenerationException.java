package com.juanpa.emotilang.transpiler.codegen;

/**
 * Thrown when the tree handed to the generator is not one the parser could have built,
 * such as a node with a missing child.
 */
public class CodeGenerationException extends RuntimeException
{
	public CodeGenerationException(String message)
	{
		super(message);
	}
}
