package org.lokray.tabula.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds all command-line arguments of the {@code tabula} driver.
 * Usage: {@code tabula [options] <check|tokens|ast|fmt> <path>...}
 */
public class CompilerArguments
{
	public enum Command
	{
		CHECK, TOKENS, AST, FMT
	}

	private Command command = null;
	private final List<Path> inputPaths = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean jsonOutput = false;
	private boolean writeInPlace = false;
	private Integer threads = null; // null: use the configured value
	private Long timeoutMillis = null; // null: use the configured value
	private String usageError = null;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs; // Version flag overrides all else
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					continue;
				}
				if (arg.equals("--json"))
				{
					parsedArgs.jsonOutput = true;
					continue;
				}
				if (arg.equals("-w") || arg.equals("--write"))
				{
					parsedArgs.writeInPlace = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-j") || arg.equals("--threads"))
				{
					parsedArgs.threads = parsePositive(getNextArg(args, ++i, arg), arg);
					continue;
				}
				if (arg.equals("--timeout"))
				{
					parsedArgs.timeoutMillis = (long) parsePositive(getNextArg(args, ++i, arg), arg);
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// The first plain argument is the command, every later one is an input path
				if (parsedArgs.command == null)
				{
					parsedArgs.command = parseCommand(arg);
				}
				else
				{
					parsedArgs.inputPaths.add(Paths.get(arg));
				}
			}

			if (parsedArgs.command == null)
			{
				throw new IllegalArgumentException("Missing command: expected one of check, tokens, ast, fmt");
			}
			if (parsedArgs.inputPaths.isEmpty())
			{
				throw new IllegalArgumentException("No input files or directories given");
			}
			if (parsedArgs.writeInPlace && parsedArgs.command != Command.FMT)
			{
				throw new IllegalArgumentException("--write is only valid with the fmt command");
			}
		}
		catch (IllegalArgumentException e)
		{
			parsedArgs.usageError = e.getMessage();
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static Command parseCommand(String arg)
	{
		switch (arg)
		{
			case "check":
				return Command.CHECK;
			case "tokens":
				return Command.TOKENS;
			case "ast":
				return Command.AST;
			case "fmt":
				return Command.FMT;
			default:
				throw new IllegalArgumentException("Unknown command: " + arg);
		}
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	private static int parsePositive(String value, String flag)
	{
		int parsed;
		try
		{
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid value for " + flag + ": " + value + " (expected a positive integer)", e);
		}
		if (parsed <= 0)
		{
			throw new IllegalArgumentException("Invalid value for " + flag + ": " + value + " (expected a positive integer)");
		}
		return parsed;
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Front end (lexer, block resolver, parser) for the Tabula language.");
		System.out.println("\nUSAGE: tabula [options] <command> <file|directory>...");
		System.out.println("\nCOMMANDS:");
		System.out.println("  check                     Report lexical, indentation and syntax diagnostics.");
		System.out.println("  tokens                    Print the token stream after block resolution.");
		System.out.println("  ast                       Print the syntax tree.");
		System.out.println("  fmt                       Print the canonically formatted source.");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show the version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  --json                    Print tokens, trees and diagnostics as JSON.");
		System.out.println("  -w, --write               With fmt: rewrite the files in place.");
		System.out.println("  -j, --threads <n>         Number of files processed in parallel.");
		System.out.println("  --timeout <ms>            Give up on a file after this many milliseconds.");
	}

	// --- Getters ---

	public Command getCommand()
	{
		return command;
	}

	public List<Path> getInputPaths()
	{
		return inputPaths;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isJsonOutput()
	{
		return jsonOutput;
	}

	public boolean isWriteInPlace()
	{
		return writeInPlace;
	}

	public Integer getThreads()
	{
		return threads;
	}

	public Long getTimeoutMillis()
	{
		return timeoutMillis;
	}

	/**
	 * @return the reason the arguments were rejected, or null if they were valid.
	 */
	public String getUsageError()
	{
		return usageError;
	}
}
