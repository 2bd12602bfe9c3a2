package org.nimble.semantic;

import org.nimble.semantic.type.Type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Inferred types indexed by source line, then by the expression's text with all
 * whitespace removed (as {@code getText()} renders it).
 * <p>
 * Each line holds at most one entry per text: recording the same text twice on a
 * line keeps the later type.
 */
public class TypeIndex
{
	private final TreeMap<Integer, Map<String, Type>> lines = new TreeMap<>();

	public void record(int line, String text, Type type)
	{
		Objects.requireNonNull(text, "text");
		Objects.requireNonNull(type, "type");

		Map<String, Type> entries = lines.get(line);
		if (entries == null)
		{
			entries = new LinkedHashMap<>();
			lines.put(line, entries);
		}
		entries.put(text, type);
	}

	public Optional<Type> typeOf(int line, String text)
	{
		Map<String, Type> entries = lines.get(line);
		return entries == null ? Optional.empty() : Optional.ofNullable(entries.get(text));
	}

	public boolean contains(int line, String text)
	{
		return typeOf(line, text).isPresent();
	}

	/**
	 * @return the entries on {@code line} in recording order; empty if there are none
	 */
	public Map<String, Type> entriesOn(int line)
	{
		Map<String, Type> entries = lines.get(line);
		return entries == null ? Collections.emptyMap() : Collections.unmodifiableMap(entries);
	}

	public NavigableSet<Integer> lines()
	{
		return Collections.unmodifiableNavigableSet(lines.navigableKeySet());
	}

	public int size()
	{
		return lines.values().stream().mapToInt(Map::size).sum();
	}

	public boolean isEmpty()
	{
		return lines.isEmpty();
	}

	public Map<Integer, Map<String, Type>> asMap()
	{
		Map<Integer, Map<String, Type>> view = new LinkedHashMap<>();
		lines.forEach((line, entries) -> view.put(line, Collections.unmodifiableMap(entries)));
		return Collections.unmodifiableMap(view);
	}

	@Override
	public boolean equals(Object o)
	{
		return this == o || (o instanceof TypeIndex that && lines.equals(that.lines));
	}

	@Override
	public int hashCode()
	{
		return lines.hashCode();
	}

	@Override
	public String toString()
	{
		return lines.toString();
	}
}
