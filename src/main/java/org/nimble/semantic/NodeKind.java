package org.nimble.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.nimble.parser.NimbleParser;

import java.util.Map;

/**
 * How the type collector treats a parse tree node.
 */
public enum NodeKind
{
	EXPRESSION,
	FUNC_CALL_STATEMENT,
	OTHER;

	// Labelled alternatives extend their rule's context, so a lookup falls back to the superclass
	private static final Map<Class<? extends ParserRuleContext>, NodeKind> BY_CONTEXT = Map.of(
			NimbleParser.ExprContext.class, EXPRESSION,
			NimbleParser.FuncCallStmtContext.class, FUNC_CALL_STATEMENT);

	public static NodeKind of(ParserRuleContext ctx)
	{
		Class<?> contextClass = ctx.getClass();
		NodeKind kind = BY_CONTEXT.get(contextClass);
		return kind != null ? kind : BY_CONTEXT.getOrDefault(contextClass.getSuperclass(), OTHER);
	}
}
