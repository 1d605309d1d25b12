// File: src/main/java/org/lokray/tabula/Main.java

package org.lokray.tabula;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.lokray.tabula.ast.AstDumper;
import org.lokray.tabula.format.SourceFormatter;
import org.lokray.tabula.lexer.Token;
import org.lokray.tabula.serialization.AstJsonSerializer;
import org.lokray.tabula.util.CompilerArguments;
import org.lokray.tabula.util.CompilerConfig;
import org.lokray.tabula.util.Debug;
import org.lokray.tabula.util.Diagnostic;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

/**
 * Entry point of the {@code tabula} command line tool.
 * This Main class wires configuration, argument parsing and the front end together and prints
 * the results. Exit status: 0 on success, 1 if any file has errors, 2 on usage or I/O failure.
 */
public class Main
{
	public static final int EXIT_OK = 0;
	public static final int EXIT_ERRORS = 1;
	public static final int EXIT_USAGE = 2;

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the driver without exiting the JVM.
	 *
	 * @return The exit status.
	 */
	public static int run(String[] args)
	{
		// 1. Argument parsing
		CompilerArguments arguments = CompilerArguments.parse(args);
		if (arguments.getUsageError() != null)
		{
			Debug.logError("Error: " + arguments.getUsageError());
			CompilerArguments.printUsage();
			return EXIT_USAGE;
		}
		if (arguments.isHelpFlag())
		{
			CompilerArguments.printUsage();
			return EXIT_OK;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println("tabula " + version());
			return EXIT_OK;
		}

		// 2. Configuration; command line flags win over the config file
		CompilerConfig config = loadConfiguration();
		Debug.setEnabled(arguments.isVerboseFlag() || config.isDebugEnabled());
		int threads = arguments.getThreads() != null ? arguments.getThreads() : config.getThreads();
		long timeout = arguments.getTimeoutMillis() != null ? arguments.getTimeoutMillis() : config.getTimeoutMillis();

		// 3. Front end over every input file
		ProjectLoader loader = new ProjectLoader(config.getSourceExtension(), threads, timeout);
		ProjectLoader.LoadResult result;
		try
		{
			result = loader.load(arguments.getInputPaths());
		}
		catch (IOException e)
		{
			Debug.logError("Error: Could not read sources: " + e.getMessage());
			return EXIT_USAGE;
		}

		if (result.getUnits().isEmpty() && result.getTimedOut().isEmpty())
		{
			Debug.logError("Error: No source (." + config.getSourceExtension() + ") files found in the given paths.");
			return EXIT_USAGE;
		}

		// 4. Command
		try
		{
			switch (arguments.getCommand())
			{
				case CHECK:
					check(result.getUnits(), arguments.isJsonOutput());
					break;
				case TOKENS:
					printTokens(result.getUnits(), arguments.isJsonOutput());
					break;
				case AST:
					printTrees(result.getUnits(), arguments.isJsonOutput());
					break;
				case FMT:
					format(result.getUnits(), arguments.isWriteInPlace());
					break;
				default:
					throw new IllegalStateException("Unhandled command " + arguments.getCommand());
			}
		}
		catch (IOException e)
		{
			Debug.logError("Error: Could not write output: " + e.getMessage());
			return EXIT_USAGE;
		}

		return result.hasErrors() || !result.getTimedOut().isEmpty() ? EXIT_ERRORS : EXIT_OK;
	}

	private static void check(List<CompilationUnit> units, boolean json)
	{
		if (json)
		{
			JsonArray files = new JsonArray();
			for (CompilationUnit unit : units)
			{
				JsonObject file = new JsonObject();
				file.addProperty("path", unit.getDisplayName());
				file.add("diagnostics", AstJsonSerializer.toJson(unit.getDiagnostics()));
				files.add(file);
			}
			System.out.println(AstJsonSerializer.toPrettyString(files));
			return;
		}

		int errors = 0;
		int warnings = 0;
		for (CompilationUnit unit : units)
		{
			printDiagnostics(unit);
			for (Diagnostic diagnostic : unit.getDiagnostics())
			{
				if (diagnostic.isError())
				{
					errors++;
				}
				else
				{
					warnings++;
				}
			}
		}
		System.out.println(units.size() + " file(s) checked: " + errors + " error(s), " + warnings + " warning(s).");
	}

	private static void printTokens(List<CompilationUnit> units, boolean json)
	{
		for (CompilationUnit unit : units)
		{
			List<Token> tokens = unit.getResolvedTokens().getTokens();
			if (json)
			{
				JsonObject file = new JsonObject();
				file.addProperty("path", unit.getDisplayName());
				file.add("tokens", AstJsonSerializer.tokensToJson(tokens));
				file.add("diagnostics", AstJsonSerializer.toJson(unit.getDiagnostics()));
				System.out.println(AstJsonSerializer.toPrettyString(file));
				continue;
			}
			System.out.println("--- " + unit.getDisplayName() + " ---");
			tokens.forEach(System.out::println);
			printDiagnostics(unit);
		}
	}

	private static void printTrees(List<CompilationUnit> units, boolean json)
	{
		for (CompilationUnit unit : units)
		{
			if (json)
			{
				System.out.println(AstJsonSerializer.toPrettyString(
						AstJsonSerializer.toDocument(unit.getDisplayName(), unit.getProgram(), unit.getDiagnostics())));
				continue;
			}
			System.out.println("--- " + unit.getDisplayName() + " ---");
			System.out.println(AstDumper.dump(unit.getProgram()));
			printDiagnostics(unit);
		}
	}

	/**
	 * Formats every unit that parsed cleanly. Files with errors are reported and left alone.
	 */
	private static void format(List<CompilationUnit> units, boolean write) throws IOException
	{
		for (CompilationUnit unit : units)
		{
			if (unit.hasErrors())
			{
				printDiagnostics(unit);
				Debug.logWarning("Warning: Not formatting " + unit.getDisplayName() + " because it has errors.");
				continue;
			}

			String formatted = SourceFormatter.format(unit.getProgram());
			if (!write)
			{
				System.out.print(formatted);
				continue;
			}

			if (unit.getSource().indexOf('#') >= 0)
			{
				Debug.logWarning("Warning: Not rewriting " + unit.getDisplayName() + ": it may contain comments, which formatting drops.");
				continue;
			}
			if (!formatted.equals(unit.getSource()))
			{
				Files.writeString(Paths.get(unit.getPath()), formatted, StandardCharsets.UTF_8);
				System.out.println("Formatted " + unit.getDisplayName());
			}
		}
	}

	private static void printDiagnostics(CompilationUnit unit)
	{
		for (Diagnostic diagnostic : unit.getDiagnostics())
		{
			String text = unit.getDisplayName() + ": " + diagnostic;
			if (diagnostic.isError())
			{
				Debug.logError(text);
			}
			else
			{
				Debug.logWarning(text);
			}
		}
	}

	private static String version()
	{
		String version = Main.class.getPackage().getImplementationVersion();
		return version != null ? version : "development build";
	}

	private static CompilerConfig loadConfiguration()
	{
		Properties props = new Properties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "tabula", "tabula.conf");

		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
				Debug.log("Loaded configuration from: %s", configPath);
			}
			catch (IOException e)
			{
				Debug.logWarning("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		else
		{
			Debug.log("No config file found at %s. Using default settings.", configPath);
		}
		return new CompilerConfig(props);
	}
}
