package org.nimble.semantic;

import org.nimble.semantic.symbol.Scope;
import org.nimble.util.ErrorLog;

import java.util.List;
import java.util.Optional;

public class AnalysisResult
{
	private final List<String> syntaxErrors;
	private final ErrorLog errors;
	private final Scope globalScope;
	private final TypeIndex inferredTypes;

	public AnalysisResult(List<String> syntaxErrors, ErrorLog errors, Scope globalScope, TypeIndex inferredTypes)
	{
		this.syntaxErrors = List.copyOf(syntaxErrors);
		this.errors = errors;
		this.globalScope = globalScope;
		this.inferredTypes = inferredTypes;
	}

	/**
	 * @return the parser's messages, in the order they were reported
	 */
	public List<String> getSyntaxErrors()
	{
		return syntaxErrors;
	}

	public boolean hasSyntaxErrors()
	{
		return !syntaxErrors.isEmpty();
	}

	public ErrorLog getErrors()
	{
		return errors;
	}

	/**
	 * @return the scope phase one attached to the root node, if it attached one
	 */
	public Optional<Scope> getGlobalScope()
	{
		return Optional.ofNullable(globalScope);
	}

	public TypeIndex getInferredTypes()
	{
		return inferredTypes;
	}
}
