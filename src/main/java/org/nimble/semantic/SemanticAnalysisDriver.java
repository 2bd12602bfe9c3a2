package org.nimble.semantic;

import org.antlr.v4.runtime.tree.ParseTreeWalker;
import org.nimble.parser.AnnotatedContext;
import org.nimble.parser.NimbleSourceParser;
import org.nimble.parser.StartRule;
import org.nimble.semantic.symbol.Scope;
import org.nimble.util.Debug;
import org.nimble.util.ErrorLog;
import org.nimble.util.SyntaxErrorListener;

import java.util.Objects;

/**
 * Runs semantic analysis on a piece of Nimble source, then collects the inferred
 * types with an {@link ExpressionTypeCollector}.
 * <p>
 * The analysis runs in two phases, defining scopes and symbols and then inferring
 * types and checking constraints. The second phase can be switched off when only
 * the results of the first are under test.
 * <p>
 * Syntax errors do not stop the run: the phases see the tree the parser recovered,
 * and the errors are returned with the result.
 * <p>
 * Exceptions thrown by a phase are not caught.
 */
public class SemanticAnalysisDriver
{
	private final SemanticPhases phases;

	public SemanticAnalysisDriver(SemanticPhases phases)
	{
		this.phases = Objects.requireNonNull(phases, "phases");
	}

	public AnalysisResult analyze(String source, StartRule startRule)
	{
		return analyze(source, startRule, false);
	}

	public AnalysisResult analyze(String source, String startRuleName, boolean firstPhaseOnly)
	{
		return analyze(source, StartRule.fromName(startRuleName), firstPhaseOnly);
	}

	public AnalysisResult analyze(String source, StartRule startRule, boolean firstPhaseOnly)
	{
		SyntaxErrorListener syntaxErrors = new SyntaxErrorListener();
		AnnotatedContext tree = NimbleSourceParser.parse(source, startRule, syntaxErrors);
		ErrorLog errors = new ErrorLog();
		ParseTreeWalker walker = ParseTreeWalker.DEFAULT;

		Debug.logDebug("PHASE 1: Defining scopes and symbols...");
		walker.walk(phases.defineScopesAndSymbols(errors), tree);

		if (!firstPhaseOnly)
		{
			Debug.logDebug("PHASE 2: Inferring types and checking constraints...");
			walker.walk(phases.inferTypesAndCheckConstraints(errors), tree);
		}

		ExpressionTypeCollector typeCollector = new ExpressionTypeCollector();
		walker.walk(typeCollector, tree);

		Scope globalScope = tree.getScope().orElse(null);
		Debug.logDebug("Analysis finished with " + errors.total() + " error(s), "
				+ typeCollector.getInferredTypes().size() + " typed expression(s)");
		return new AnalysisResult(syntaxErrors.getErrors(), errors, globalScope, typeCollector.getInferredTypes());
	}
}
