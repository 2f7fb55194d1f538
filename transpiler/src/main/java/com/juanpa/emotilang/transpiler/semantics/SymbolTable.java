package com.juanpa.emotilang.transpiler.semantics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A flat table of declared variable names and their declared types, filled while parsing.
 * There are no scopes: a later declaration of the same name replaces the earlier one.
 * No stage of the compiler validates against it.
 */
public class SymbolTable
{
	private final Map<String, PrimitiveType> variables = new LinkedHashMap<>();

	public void declare(String name, PrimitiveType type)
	{
		variables.put(name, type);
	}

	public Optional<PrimitiveType> lookup(String name)
	{
		return Optional.ofNullable(variables.get(name));
	}

	public boolean isDeclared(String name)
	{
		return variables.containsKey(name);
	}

	public int size()
	{
		return variables.size();
	}

	@Override
	public String toString()
	{
		return variables.toString();
	}
}
