package com.juanpa.emotilang.transpiler.codegen;

/**
 * The indentation in effect for one node of the generated output. Entering a block
 * produces a new, deeper value; leaving the block simply goes back to the caller's value.
 *
 * @param level How many units deep the current line is.
 * @param unit  The text of one indentation step.
 */
public record Indentation(int level, String unit)
{
	public Indentation
	{
		if (level < 0)
		{
			throw new IllegalArgumentException("Indentation level cannot be negative: " + level);
		}
	}

	public static Indentation root(String unit)
	{
		return new Indentation(0, unit);
	}

	public Indentation deeper()
	{
		return new Indentation(level + 1, unit);
	}

	/**
	 * The whitespace that starts a line at this level.
	 */
	public String prefix()
	{
		return unit.repeat(level);
	}
}
