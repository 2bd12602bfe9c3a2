package org.nimble.util;

import org.nimble.parser.StartRule;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds the command-line arguments of the type dump tool.
 */
public class HarnessArguments
{
	private Path inputFile = null;
	private StartRule startRule = StartRule.SCRIPT;
	private boolean firstPhaseOnly = false;
	private boolean jsonOutput = false;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean parseErrors = false;

	// Private constructor, use parse()
	private HarnessArguments()
	{
	}

	public static HarnessArguments parse(String[] args)
	{
		HarnessArguments parsedArgs = new HarnessArguments();

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
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-1") || arg.equals("--first-phase-only"))
				{
					parsedArgs.firstPhaseOnly = true;
					continue;
				}
				if (arg.equals("-j") || arg.equals("--json"))
				{
					parsedArgs.jsonOutput = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-r") || arg.equals("--rule"))
				{
					parsedArgs.startRule = StartRule.fromName(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}
				if (parsedArgs.inputFile != null)
				{
					throw new IllegalArgumentException("Only one input file may be given, found a second: " + arg);
				}
				parsedArgs.inputFile = Paths.get(arg);
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.parseErrors = true;
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("Usage: nimble-types [options] <file.nm>");
		System.out.println();
		System.out.println("Runs the installed Nimble semantic phases over <file.nm> and prints the");
		System.out.println("inferred type of every expression and function call statement.");
		System.out.println();
		System.out.println("Options:");
		System.out.println("  -r, --rule <name>         Grammar rule to parse from (default: script)");
		System.out.println("  -1, --first-phase-only    Skip type inference and constraint checking");
		System.out.println("  -j, --json                Print the type index as JSON");
		System.out.println("  -v, --verbose             Enable debug logging");
		System.out.println("  -h, --help                Show this message");
		System.out.println("      --version             Show the version");
	}

	public Path getInputFile()
	{
		return inputFile;
	}

	public StartRule getStartRule()
	{
		return startRule;
	}

	public boolean isFirstPhaseOnly()
	{
		return firstPhaseOnly;
	}

	public boolean isJsonOutput()
	{
		return jsonOutput;
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

	public boolean hasParseErrors()
	{
		return parseErrors;
	}
}
