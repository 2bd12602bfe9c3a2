package org.nimble.semantic.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType INT = new PrimitiveType("Int");
	public static final PrimitiveType BOOL = new PrimitiveType("Bool");
	public static final PrimitiveType STRING = new PrimitiveType("String");
	public static final PrimitiveType VOID = new PrimitiveType("Void");

	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new LinkedHashMap<>();
		map.put(INT.getName(), INT);
		map.put(BOOL.getName(), BOOL);
		map.put(STRING.getName(), STRING);
		map.put(VOID.getName(), VOID);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	/**
	 * Looks up the primitive type spelled by a {@code TYPE} token, e.g. {@code Int}.
	 */
	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	public static Map<String, PrimitiveType> getAllPrimitiveKeywords()
	{
		return KEYWORD_TO_TYPE_MAP;
	}

	private final String name;

	private PrimitiveType(String name)
	{
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return this == other || other == ErrorType.INSTANCE;
	}

	@Override
	public boolean isPrimitive()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
