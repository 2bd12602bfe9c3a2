package org.nimble.semantic.type;

public class ErrorType implements Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
	}

	@Override
	public String getName()
	{
		return "<error>";
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return true; // Avoid cascading errors
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
