package org.nimble.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.nimble.semantic.TypeIndex;
import org.nimble.semantic.type.NoType;
import org.nimble.semantic.type.Type;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON form of a {@link TypeIndex}: {@code {"<line>": {"<expr>": "<type>"}}}.
 * The no-type marker is written as JSON {@code null}.
 */
public final class TypeIndexJson
{
	private static final Gson GSON = new GsonBuilder()
			.setPrettyPrinting()
			.serializeNulls()
			.disableHtmlEscaping()
			.create();

	private TypeIndexJson()
	{
	}

	public static JsonObject toJsonTree(TypeIndex inferredTypes)
	{
		JsonObject root = new JsonObject();
		for (int line : inferredTypes.lines())
		{
			JsonObject entries = new JsonObject();
			Map<String, Type> sorted = new TreeMap<>(inferredTypes.entriesOn(line));
			sorted.forEach((expr, type) -> entries.addProperty(expr, type == NoType.INSTANCE ? null : type.getName()));
			root.add(String.valueOf(line), entries);
		}
		return root;
	}

	public static String toJson(TypeIndex inferredTypes)
	{
		return GSON.toJson(toJsonTree(inferredTypes));
	}

	/**
	 * Reads an expected index written in the same form, keeping type names as strings.
	 * A {@code null} type name stands for the no-type marker.
	 *
	 * @throws IllegalArgumentException if the text is not a JSON object of objects keyed by line numbers
	 */
	public static Map<Integer, Map<String, String>> readExpected(String json)
	{
		JsonElement root;
		try
		{
			root = JsonParser.parseString(json);
		}
		catch (JsonParseException e)
		{
			throw new IllegalArgumentException("Malformed type index JSON: " + e.getMessage(), e);
		}
		if (!root.isJsonObject())
		{
			throw new IllegalArgumentException("Type index JSON must be an object keyed by line number");
		}

		Map<Integer, Map<String, String>> expected = new TreeMap<>();
		for (Map.Entry<String, JsonElement> lineEntry : root.getAsJsonObject().entrySet())
		{
			int line;
			try
			{
				line = Integer.parseInt(lineEntry.getKey());
			}
			catch (NumberFormatException e)
			{
				throw new IllegalArgumentException("Not a line number: " + lineEntry.getKey(), e);
			}
			if (!lineEntry.getValue().isJsonObject())
			{
				throw new IllegalArgumentException("Entries for line " + line + " must be an object");
			}

			Map<String, String> entries = new LinkedHashMap<>();
			for (Map.Entry<String, JsonElement> expr : lineEntry.getValue().getAsJsonObject().entrySet())
			{
				JsonElement typeName = expr.getValue();
				if (!typeName.isJsonNull() && !typeName.isJsonPrimitive())
				{
					throw new IllegalArgumentException("Type of '" + expr.getKey() + "' on line " + line + " must be a name or null");
				}
				entries.put(expr.getKey(), typeName.isJsonNull() ? null : typeName.getAsString());
			}
			expected.put(line, entries);
		}
		return expected;
	}

	/**
	 * The index in the shape {@link #readExpected(String)} returns, for direct comparison.
	 */
	public static Map<Integer, Map<String, String>> toTypeNames(TypeIndex inferredTypes)
	{
		Map<Integer, Map<String, String>> names = new TreeMap<>();
		inferredTypes.asMap().forEach((line, entries) ->
		{
			Map<String, String> lineNames = new LinkedHashMap<>();
			entries.forEach((expr, type) -> lineNames.put(expr, type == NoType.INSTANCE ? null : type.getName()));
			names.put(line, lineNames);
		});
		return names;
	}
}
