package org.nimble.semantic.symbol;

import org.nimble.semantic.type.Type;

public interface Symbol
{
	String getName();

	Type getType();

	SymbolKind getKind();
}
