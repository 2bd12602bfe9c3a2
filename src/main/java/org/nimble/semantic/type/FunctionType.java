package org.nimble.semantic.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class FunctionType implements Type
{
	private final List<Type> parameterTypes;
	private final Type returnType;

	public FunctionType(List<Type> parameterTypes, Type returnType)
	{
		this.parameterTypes = List.copyOf(parameterTypes);
		this.returnType = Objects.requireNonNull(returnType, "returnType");
	}

	public List<Type> getParameterTypes()
	{
		return parameterTypes;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	@Override
	public String getName()
	{
		String params = parameterTypes.stream()
				.map(Type::getName)
				.collect(Collectors.joining(", "));
		return "(" + params + ") -> " + returnType.getName();
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return this.equals(other) || other == ErrorType.INSTANCE;
	}

	@Override
	public boolean isFunction()
	{
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof FunctionType that))
		{
			return false;
		}
		return parameterTypes.equals(that.parameterTypes) && returnType.equals(that.returnType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(parameterTypes, returnType);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
