package org.nimble.semantic.symbol;

public enum SymbolKind
{
	VARIABLE,
	PARAMETER,
	FUNCTION
}
