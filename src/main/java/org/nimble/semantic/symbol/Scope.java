package org.nimble.semantic.symbol;

import org.nimble.semantic.type.PrimitiveType;
import org.nimble.semantic.type.Type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A set of name bindings, linked to the scope that encloses it.
 * The global scope has no enclosing scope.
 */
public class Scope
{
	public static final String GLOBAL_SCOPE_NAME = "$global";

	private final String name;
	private final Scope enclosingScope;
	private final Type returnType;
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	public Scope(String name, Scope enclosingScope, Type returnType)
	{
		this.name = name;
		this.enclosingScope = enclosingScope;
		this.returnType = returnType;
	}

	public static Scope createGlobal()
	{
		return new Scope(GLOBAL_SCOPE_NAME, null, PrimitiveType.VOID);
	}

	public Scope createChildScope(String childName, Type childReturnType)
	{
		return new Scope(childName, this, childReturnType);
	}

	/**
	 * Binds the symbol's name in this scope.
	 *
	 * @return false, leaving the existing binding in place, if the name is already bound here
	 */
	public boolean define(Symbol sym)
	{
		if (symbols.containsKey(sym.getName()))
		{
			return false;
		}
		symbols.put(sym.getName(), sym);
		return true;
	}

	public Optional<Symbol> resolve(String symbolName)
	{
		Optional<Symbol> local = resolveLocally(symbolName);
		if (local.isPresent())
		{
			return local;
		}
		if (enclosingScope != null)
		{
			return enclosingScope.resolve(symbolName);
		}
		return Optional.empty();
	}

	public Optional<Symbol> resolveLocally(String symbolName)
	{
		return Optional.ofNullable(symbols.get(symbolName));
	}

	public Map<String, Symbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	public boolean isGlobal()
	{
		return enclosingScope == null;
	}

	public String getName()
	{
		return name;
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("scope ").append(name);
		symbols.values().forEach(s -> sb.append("\n  ").append(s));
		return sb.toString();
	}
}
