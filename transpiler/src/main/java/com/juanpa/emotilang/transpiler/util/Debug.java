package com.juanpa.emotilang.transpiler.util;

public final class Debug
{
	/**
	 * Master switch for all debug logging, read once from the {@code emotilang.debug} system property.
	 */
	public static final boolean ENABLED = Boolean.getBoolean("emotilang.debug");

	private Debug()
	{
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Scanned %d tokens").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (ENABLED)
		{
			System.out.println("[DEBUG] " + String.format(format, args));
		}
	}
}
