package org.nimble.util;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only, ordered record of the semantic errors found by the analysis phases.
 * Every error is also reported through {@link Debug#logError(String)} as it is added.
 */
public class ErrorLog implements Iterable<SemanticError>
{
	private final List<SemanticError> entries = new ArrayList<>();

	public SemanticError add(ParserRuleContext ctx, ErrorCategory category, String message)
	{
		Token start = ctx.getStart();
		if (start == null)
		{
			throw new IllegalArgumentException("Cannot log an error against a node with no start token");
		}
		SemanticError error = new SemanticError(category, start.getLine(), start.getCharPositionInLine() + 1, ctx.getText(), message);
		entries.add(error);
		Debug.logError(error.toString());
		return error;
	}

	public boolean hasErrors()
	{
		return !entries.isEmpty();
	}

	public int total()
	{
		return entries.size();
	}

	public List<SemanticError> entries()
	{
		return Collections.unmodifiableList(entries);
	}

	/**
	 * True if an error of the given category was recorded on the given line against a node
	 * whose text (whitespace removed) is exactly {@code text}.
	 */
	public boolean includesExactly(ErrorCategory category, int line, String text)
	{
		return entries.stream()
				.anyMatch(e -> e.getCategory() == category && e.getLine() == line && e.getText().equals(text));
	}

	public boolean includesOnLine(ErrorCategory category, int line)
	{
		return entries.stream()
				.anyMatch(e -> e.getCategory() == category && e.getLine() == line);
	}

	@Override
	public Iterator<SemanticError> iterator()
	{
		return entries().iterator();
	}

	@Override
	public boolean equals(Object o)
	{
		return this == o || (o instanceof ErrorLog that && entries.equals(that.entries));
	}

	@Override
	public int hashCode()
	{
		return entries.hashCode();
	}

	@Override
	public String toString()
	{
		return entries.stream().map(SemanticError::toString).collect(Collectors.joining("\n"));
	}
}
