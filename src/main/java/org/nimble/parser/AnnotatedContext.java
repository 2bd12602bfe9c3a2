package org.nimble.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.nimble.semantic.symbol.Scope;
import org.nimble.semantic.type.Type;

import java.util.Objects;
import java.util.Optional;

/**
 * Base class of every Nimble parse tree node (the grammar's {@code contextSuperClass}).
 * Analysis phases write their results onto the tree through these two annotations;
 * both start out absent.
 */
public class AnnotatedContext extends ParserRuleContext
{
	private Type inferredType;
	private Scope scope;

	public AnnotatedContext()
	{
	}

	public AnnotatedContext(ParserRuleContext parent, int invokingStateNumber)
	{
		super(parent, invokingStateNumber);
	}

	public Optional<Type> getInferredType()
	{
		return Optional.ofNullable(inferredType);
	}

	public void setInferredType(Type inferredType)
	{
		this.inferredType = Objects.requireNonNull(inferredType, "inferredType");
	}

	public Optional<Scope> getScope()
	{
		return Optional.ofNullable(scope);
	}

	public void setScope(Scope scope)
	{
		this.scope = Objects.requireNonNull(scope, "scope");
	}

	// Labelled alternatives are built by copying the rule's generic context.
	@Override
	public void copyFrom(ParserRuleContext ctx)
	{
		super.copyFrom(ctx);
		if (ctx instanceof AnnotatedContext other)
		{
			this.inferredType = other.inferredType;
			this.scope = other.scope;
		}
	}
}
