package org.nimble.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.nimble.util.Debug;
import org.nimble.util.SyntaxErrorListener;

import java.util.Objects;

/**
 * Parses Nimble source text from any {@link StartRule}.
 */
public final class NimbleSourceParser
{
	private NimbleSourceParser()
	{
	}

	public static AnnotatedContext parse(String source, StartRule startRule)
	{
		return parse(source, startRule, new SyntaxErrorListener());
	}

	/**
	 * Syntax errors are reported to {@code errorListener} and never thrown; the tree
	 * ANTLR recovered is returned either way.
	 */
	public static AnnotatedContext parse(String source, StartRule startRule, SyntaxErrorListener errorListener)
	{
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(startRule, "startRule");

		NimbleLexer lexer = new NimbleLexer(CharStreams.fromString(source));
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);

		NimbleParser parser = new NimbleParser(new CommonTokenStream(lexer));
		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(errorListener);

		AnnotatedContext tree = startRule.invoke(parser);
		if (errorListener.hasErrors())
		{
			Debug.logWarning("Parsing from '" + startRule.getRuleName() + "' reported " + errorListener.getErrors().size() + " syntax error(s)");
		}
		if (Debug.ENABLE_DEBUG)
		{
			Debug.logDebug("Parse tree: " + tree.toStringTree(parser));
		}
		return tree;
	}
}
