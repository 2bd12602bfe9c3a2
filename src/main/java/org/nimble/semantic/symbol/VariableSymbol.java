package org.nimble.semantic.symbol;

import org.nimble.semantic.type.Type;

import java.util.Objects;

public class VariableSymbol implements Symbol
{
	private final String name;
	private final Type type;
	private final boolean isParameter;

	public VariableSymbol(String name, Type type, boolean isParameter)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.type = Objects.requireNonNull(type, "type");
		this.isParameter = isParameter;
	}

	public VariableSymbol(String name, Type type)
	{
		this(name, type, false);
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	@Override
	public SymbolKind getKind()
	{
		return isParameter ? SymbolKind.PARAMETER : SymbolKind.VARIABLE;
	}

	public boolean isParameter()
	{
		return isParameter;
	}

	@Override
	public String toString()
	{
		return getKind().name().toLowerCase() + " " + name + " : " + type.getName();
	}
}
