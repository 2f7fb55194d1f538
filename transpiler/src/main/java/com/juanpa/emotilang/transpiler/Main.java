package com.juanpa.emotilang.transpiler;

import com.juanpa.emotilang.transpiler.util.CompilerConfig;
import com.juanpa.emotilang.transpiler.util.Diagnostic;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Entry point for the EmotiLang compiler.
 * Reads a source file, compiles it and writes the JavaScript next to it (or where asked).
 */
public class Main
{
	private static final String USAGE = "Usage: emotic <input.emoti> [output.js] [-o|--output <file>] [-v|--verbose] [--debug-output]";

	public static void main(String[] args)
	{
		int status = run(args);
		if (status != 0)
		{
			System.exit(status);
		}
	}

	/**
	 * Runs the compiler with command-line arguments.
	 *
	 * @return 0 on success, 1 when compilation failed, 2 on bad usage or an I/O error.
	 */
	static int run(String[] args)
	{
		// 1. Argument parsing
		Path inputFile = null;
		Path outputFile = null;
		boolean verbose = false;
		boolean printDebugOutput = false;

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "-v":
				case "--verbose":
					verbose = true;
					break;
				case "--debug-output":
					printDebugOutput = true;
					break;
				case "-o":
				case "--output":
					if (i + 1 >= args.length)
					{
						System.err.println("Error: " + arg + " needs a file name.");
						System.err.println(USAGE);
						return 2;
					}
					outputFile = Paths.get(args[++i]);
					break;
				default:
					if (arg.startsWith("-"))
					{
						System.err.println("Error: unknown option " + arg);
						System.err.println(USAGE);
						return 2;
					}
					if (inputFile == null)
					{
						inputFile = Paths.get(arg);
					}
					else if (outputFile == null)
					{
						outputFile = Paths.get(arg);
					}
					else
					{
						System.err.println("Error: unexpected argument " + arg);
						System.err.println(USAGE);
						return 2;
					}
			}
		}

		if (inputFile == null)
		{
			System.err.println(USAGE);
			return 2;
		}
		if (!Files.exists(inputFile))
		{
			System.err.println("Error: Input file not found: " + inputFile);
			return 2;
		}

		// 2. Configuration
		CompilerConfig config = loadConfiguration(verbose);
		if (outputFile == null)
		{
			outputFile = deriveOutputPath(inputFile, config);
		}

		// 3. Compilation
		String source;
		try
		{
			source = Files.readString(inputFile, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			System.err.println("Error reading '" + inputFile + "': " + e.getMessage());
			return 2;
		}

		if (verbose)
		{
			System.out.println("--- Compiling " + inputFile.getFileName() + " ---");
		}
		CompilationResult result = new EmotiCompiler(config).compile(source);

		if (printDebugOutput)
		{
			System.out.println(result.getDebugOutput());
		}
		for (Diagnostic diagnostic : result.getDiagnostics())
		{
			System.err.println(diagnostic.format());
		}
		if (!result.isSuccess())
		{
			System.err.println("Compilation failed.");
			return 1;
		}

		// 4. Output
		try
		{
			saveToFile(outputFile, result.getJavaScript().orElse(""));
		}
		catch (IOException e)
		{
			System.err.println("Error saving generated code to file '" + outputFile + "': " + e.getMessage());
			return 2;
		}
		if (verbose)
		{
			System.out.println("Saved: " + outputFile);
		}
		return 0;
	}

	/**
	 * Replaces the source extension of {@code inputFile} with the output extension,
	 * or appends the output extension when the file has a different one.
	 */
	static Path deriveOutputPath(Path inputFile, CompilerConfig config)
	{
		String fileName = inputFile.getFileName().toString();
		String sourceExtension = config.getSourceExtension();
		String baseName = fileName.endsWith(sourceExtension)
				? fileName.substring(0, fileName.length() - sourceExtension.length())
				: fileName;
		return inputFile.resolveSibling(baseName + config.getOutputExtension());
	}

	/**
	 * Loads the bundled defaults, then overlays {@code ~/.config/emotilang/emotilang.conf} if it exists.
	 */
	private static CompilerConfig loadConfiguration(boolean verbose)
	{
		Properties props = CompilerConfig.loadDefaultProperties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "emotilang", "emotilang.conf");

		if (Files.exists(configPath))
		{
			try (InputStream input = Files.newInputStream(configPath))
			{
				props.load(input);
				if (verbose)
				{
					System.out.println("--- Loaded configuration from: " + configPath + " ---");
				}
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new CompilerConfig(props);
	}

	private static void saveToFile(Path filePath, String content) throws IOException
	{
		Path parent = filePath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.write(filePath, content.getBytes(StandardCharsets.UTF_8));
	}
}
