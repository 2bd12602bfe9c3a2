package org.nimble.semantic;

import org.antlr.v4.runtime.tree.ParseTreeListener;
import org.nimble.util.ErrorLog;

/**
 * The two analysis phases of the analyzer under test. Each method returns a fresh
 * listener for one full walk of the tree; errors go to the supplied log.
 * <p>
 * Implementations are found by {@link java.util.ServiceLoader} when the harness
 * runs from the command line.
 */
public interface SemanticPhases
{
	/**
	 * Phase one: builds scopes and defines symbols. Expected to attach the global
	 * scope to the root node.
	 */
	ParseTreeListener defineScopesAndSymbols(ErrorLog errors);

	/**
	 * Phase two: infers types, annotating expression nodes, and checks constraints.
	 */
	ParseTreeListener inferTypesAndCheckConstraints(ErrorLog errors);
}
