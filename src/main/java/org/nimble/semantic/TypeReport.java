package org.nimble.semantic;

import org.nimble.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Debug rendering of a {@link TypeIndex}: lines in ascending order, expressions
 * sorted within each line.
 */
public final class TypeReport
{
	private TypeReport()
	{
	}

	public static String pretty(TypeIndex inferredTypes)
	{
		List<String> output = new ArrayList<>();
		for (int line : inferredTypes.lines())
		{
			output.add("line " + line + ":");
			Map<String, Type> sorted = new TreeMap<>(inferredTypes.entriesOn(line));
			sorted.forEach((expr, type) -> output.add("  " + expr + " : " + type.getName()));
		}
		return String.join("\n", output);
	}
}
