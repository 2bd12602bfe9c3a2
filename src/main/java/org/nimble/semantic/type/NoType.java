package org.nimble.semantic.type;

/**
 * Marks an expression that no analysis phase annotated. Never equal to a real type.
 */
public class NoType implements Type
{
	public static final NoType INSTANCE = new NoType();

	private NoType()
	{
	}

	@Override
	public String getName()
	{
		return "None";
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return false;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
