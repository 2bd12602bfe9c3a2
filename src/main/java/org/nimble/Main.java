package org.nimble;

import org.nimble.semantic.AnalysisResult;
import org.nimble.semantic.SemanticAnalysisDriver;
import org.nimble.semantic.SemanticPhases;
import org.nimble.semantic.TypeReport;
import org.nimble.util.Debug;
import org.nimble.util.HarnessArguments;
import org.nimble.util.TypeIndexJson;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * Command-line entry point: analyses one Nimble file with the installed
 * {@link SemanticPhases} and prints what was inferred.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	static final int EXIT_OK = 0;
	static final int EXIT_SEMANTIC_ERRORS = 1;
	static final int EXIT_USAGE = 2;
	static final int EXIT_SYNTAX_ERRORS = 3;

	public static void main(String[] args)
	{
		System.exit(run(args, System.out));
	}

	static int run(String[] args, PrintStream out)
	{
		return run(args, out, () -> ServiceLoader.load(SemanticPhases.class).findFirst());
	}

	/**
	 * Exceptions thrown while the phases run are not caught here.
	 */
	static int run(String[] args, PrintStream out, Supplier<Optional<SemanticPhases>> phaseLoader)
	{
		HarnessArguments arguments;
		String source;
		try
		{
			arguments = HarnessArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				HarnessArguments.printUsage();
				return arguments.hasParseErrors() ? EXIT_USAGE : EXIT_OK;
			}
			if (arguments.isVersionFlag())
			{
				out.println("nimble-types (Nimble Semantics Harness) version " + VERSION);
				return EXIT_OK;
			}
			if (arguments.getInputFile() == null)
			{
				throw new IllegalArgumentException("No input file provided. Use -h for help.");
			}
			if (!Files.exists(arguments.getInputFile()))
			{
				throw new IllegalArgumentException("Input file not found: " + arguments.getInputFile());
			}
			source = Files.readString(arguments.getInputFile());
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Harness initialization failed: " + e.getMessage());
			return EXIT_USAGE;
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
			return EXIT_USAGE;
		}

		Optional<SemanticPhases> phases = phaseLoader.get();
		if (phases.isEmpty())
		{
			Debug.logError("No " + SemanticPhases.class.getName() + " implementation is installed on the class path.");
			return EXIT_USAGE;
		}
		Debug.logDebug("Using semantic phases from " + phases.get().getClass().getName());

		SemanticAnalysisDriver driver = new SemanticAnalysisDriver(phases.get());
		AnalysisResult result = driver.analyze(source, arguments.getStartRule(), arguments.isFirstPhaseOnly());

		if (arguments.isJsonOutput())
		{
			out.println(TypeIndexJson.toJson(result.getInferredTypes()));
		}
		else
		{
			out.println(TypeReport.pretty(result.getInferredTypes()));
		}

		if (result.hasSyntaxErrors())
		{
			Debug.logError("Parsing reported " + result.getSyntaxErrors().size() + " syntax error(s).");
			return EXIT_SYNTAX_ERRORS;
		}
		if (result.getErrors().hasErrors())
		{
			Debug.logError("Analysis recorded " + result.getErrors().total() + " semantic error(s).");
			return EXIT_SEMANTIC_ERRORS;
		}
		Debug.logInfo("Analysis passed.");
		return EXIT_OK;
	}
}
