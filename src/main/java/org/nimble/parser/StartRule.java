package org.nimble.parser;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The grammar productions a parse may start from. Starting below {@code script}
 * lets tests analyse a single declaration, statement or expression.
 */
public enum StartRule
{
	SCRIPT("script", NimbleParser::script),
	FUNC_DEF("funcDef", NimbleParser::funcDef),
	MAIN("main", NimbleParser::main),
	BODY("body", NimbleParser::body),
	VAR_DEC("varDec", NimbleParser::varDec),
	BLOCK("block", NimbleParser::block),
	STATEMENT("statement", NimbleParser::statement),
	EXPR("expr", NimbleParser::expr),
	FUNC_CALL("funcCall", NimbleParser::funcCall);

	private final String ruleName;
	private final Function<NimbleParser, AnnotatedContext> invoker;

	StartRule(String ruleName, Function<NimbleParser, AnnotatedContext> invoker)
	{
		this.ruleName = ruleName;
		this.invoker = invoker;
	}

	public String getRuleName()
	{
		return ruleName;
	}

	AnnotatedContext invoke(NimbleParser parser)
	{
		return invoker.apply(parser);
	}

	public static StartRule fromName(String ruleName)
	{
		for (StartRule rule : values())
		{
			if (rule.ruleName.equals(ruleName))
			{
				return rule;
			}
		}
		String known = Arrays.stream(values()).map(StartRule::getRuleName).collect(Collectors.joining(", "));
		throw new IllegalArgumentException("Unknown start rule '" + ruleName + "'. Expected one of: " + known);
	}
}
