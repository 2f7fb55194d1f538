package com.juanpa.emotilang.transpiler.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Holds configuration settings for the EmotiLang compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final String DEFAULTS_RESOURCE = "/emotilang.properties";

	private final String indentUnit;
	private final String header;
	private final String inputPrompt;
	private final String sourceExtension;
	private final String outputExtension;

	public CompilerConfig(Properties props)
	{
		this.indentUnit = props.getProperty("codegen.indent", "  ");
		this.header = props.getProperty("codegen.header", "// Transpiled from EmotiLang");
		this.inputPrompt = props.getProperty("codegen.input_prompt", "Enter input:");
		this.sourceExtension = props.getProperty("source.extension", ".emoti");
		this.outputExtension = props.getProperty("output.extension", ".js");
	}

	/**
	 * Builds a configuration from the defaults bundled on the classpath.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(loadDefaultProperties());
	}

	/**
	 * Reads the bundled {@code emotilang.properties}. A missing resource yields empty
	 * properties, so the hard-coded defaults apply.
	 */
	public static Properties loadDefaultProperties()
	{
		Properties props = new Properties();
		try (InputStream in = CompilerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if (in != null)
			{
				props.load(in);
			}
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("Could not read " + DEFAULTS_RESOURCE, e);
		}
		return props;
	}

	public String getIndentUnit()
	{
		return indentUnit;
	}

	public String getHeader()
	{
		return header;
	}

	public String getInputPrompt()
	{
		return inputPrompt;
	}

	public String getSourceExtension()
	{
		return sourceExtension;
	}

	public String getOutputExtension()
	{
		return outputExtension;
	}
}
