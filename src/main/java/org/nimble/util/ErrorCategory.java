package org.nimble.util;

/**
 * The kinds of semantic error an analysis phase can record.
 */
public enum ErrorCategory
{
	ASSIGN_TO_WRONG_TYPE("assignment to wrong type"),
	ASSIGN_TO_FUNCTION("assignment to a function name"),
	DUPLICATE_NAME("duplicate name"),
	UNDEFINED_NAME("undefined name"),
	INVALID_BINARY_OP("invalid binary operation"),
	INVALID_NEGATION("invalid negation"),
	CONDITION_NOT_BOOL("condition is not boolean"),
	UNPRINTABLE_EXPRESSION("unprintable expression"),
	INVALID_CALL("invalid function call"),
	CALL_NON_FUNCTION("call to a non-function"),
	INVALID_RETURN("invalid return"),
	MISSING_RETURN("missing return"),
	VARIABLE_AS_FUNCTION_NAME("variable used as function");

	private final String description;

	ErrorCategory(String description)
	{
		this.description = description;
	}

	public String getDescription()
	{
		return description;
	}
}
