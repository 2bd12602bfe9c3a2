package org.nimble.semantic.symbol;

import org.nimble.semantic.type.FunctionType;
import org.nimble.semantic.type.Type;

import java.util.List;
import java.util.Objects;

/**
 * A function declared in the global scope, together with the scope of its body.
 */
public class FunctionSymbol implements Symbol
{
	private final String name;
	private final FunctionType type;
	private final List<VariableSymbol> parameters;
	private final Scope bodyScope;

	public FunctionSymbol(String name, List<VariableSymbol> parameters, Type returnType, Scope enclosingScope)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.parameters = List.copyOf(parameters);
		this.type = new FunctionType(this.parameters.stream().map(VariableSymbol::getType).toList(), returnType);
		this.bodyScope = enclosingScope.createChildScope(name, returnType);
		for (VariableSymbol parameter : this.parameters)
		{
			bodyScope.define(parameter);
		}
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public FunctionType getType()
	{
		return type;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.FUNCTION;
	}

	public List<VariableSymbol> getParameters()
	{
		return parameters;
	}

	public Type getReturnType()
	{
		return type.getReturnType();
	}

	public Scope getBodyScope()
	{
		return bodyScope;
	}

	@Override
	public String toString()
	{
		return "function " + name + " : " + type.getName();
	}
}
