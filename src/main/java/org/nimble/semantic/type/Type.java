package org.nimble.semantic.type;

/**
 * A type an analysis phase may attach to a parse tree node.
 */
public interface Type
{
	String getName();

	boolean isAssignableTo(Type other);

	default boolean isPrimitive()
	{
		return false;
	}

	default boolean isFunction()
	{
		return false;
	}
}
