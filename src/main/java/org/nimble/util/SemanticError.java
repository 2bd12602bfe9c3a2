package org.nimble.util;

import java.util.Objects;

/**
 * One diagnostic recorded against a parse tree node.
 */
public final class SemanticError
{
	private final ErrorCategory category;
	private final int line;
	private final int column;
	private final String text;
	private final String message;

	public SemanticError(ErrorCategory category, int line, int column, String text, String message)
	{
		this.category = Objects.requireNonNull(category, "category");
		this.line = line;
		this.column = column;
		this.text = Objects.requireNonNull(text, "text");
		this.message = Objects.requireNonNull(message, "message");
	}

	public ErrorCategory getCategory()
	{
		return category;
	}

	public int getLine()
	{
		return line;
	}

	/**
	 * @return the 1-based column of the node's first token
	 */
	public int getColumn()
	{
		return column;
	}

	public String getText()
	{
		return text;
	}

	public String getMessage()
	{
		return message;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof SemanticError that))
		{
			return false;
		}
		return line == that.line
				&& column == that.column
				&& category == that.category
				&& text.equals(that.text)
				&& message.equals(that.message);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(category, line, column, text, message);
	}

	@Override
	public String toString()
	{
		return String.format("[Semantic Error] line %d:%d - %s: %s", line, column, category.getDescription(), message);
	}
}
