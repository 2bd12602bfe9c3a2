package org.nimble.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeWalker;
import org.nimble.parser.AnnotatedContext;
import org.nimble.parser.NimbleBaseListener;
import org.nimble.semantic.type.NoType;
import org.nimble.semantic.type.Type;

/**
 * Collects the inferred type of every expression and function call statement
 * into a {@link TypeIndex}, to assist with testing. Relies on the analysis phases
 * having stored each type in the node's inferred type annotation; nodes without one
 * are recorded as {@link NoType#INSTANCE}.
 */
public class ExpressionTypeCollector extends NimbleBaseListener
{
	private final TypeIndex inferredTypes = new TypeIndex();

	public static TypeIndex collect(ParseTree tree)
	{
		ExpressionTypeCollector collector = new ExpressionTypeCollector();
		ParseTreeWalker.DEFAULT.walk(collector, tree);
		return collector.getInferredTypes();
	}

	@Override
	public void exitEveryRule(ParserRuleContext ctx)
	{
		switch (NodeKind.of(ctx))
		{
			case EXPRESSION, FUNC_CALL_STATEMENT -> record((AnnotatedContext) ctx);
			case OTHER ->
			{
			}
		}
	}

	private void record(AnnotatedContext ctx)
	{
		Token start = ctx.getStart();
		if (start == null)
		{
			throw new IllegalStateException("Parse tree node has no start token: " + ctx.getClass().getSimpleName());
		}
		Type type = ctx.getInferredType().orElse(NoType.INSTANCE);
		inferredTypes.record(start.getLine(), ctx.getText(), type);
	}

	public TypeIndex getInferredTypes()
	{
		return inferredTypes;
	}
}
