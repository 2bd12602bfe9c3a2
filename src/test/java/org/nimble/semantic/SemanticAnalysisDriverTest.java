package org.nimble.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTreeListener;
import org.nimble.parser.NimbleBaseListener;
import org.nimble.parser.StartRule;
import org.nimble.semantic.reference.ReferenceNimbleSemantics;
import org.nimble.semantic.symbol.Scope;
import org.nimble.semantic.symbol.SymbolKind;
import org.nimble.semantic.type.ErrorType;
import org.nimble.semantic.type.NoType;
import org.nimble.semantic.type.PrimitiveType;
import org.nimble.util.ErrorCategory;
import org.nimble.util.ErrorLog;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticAnalysisDriverTest
{
	private final SemanticAnalysisDriver driver = new SemanticAnalysisDriver(new ReferenceNimbleSemantics());

	@Test
	public void programWithoutExpressionsHasEmptyIndex()
	{
		AnalysisResult result = driver.analyze("var x : Int\nvar flag : Bool\n", StartRule.SCRIPT);

		assertTrue(result.getInferredTypes().isEmpty());
		assertFalse(result.getErrors().hasErrors());
	}

	@Test
	public void emptyScriptHasEmptyIndex()
	{
		AnalysisResult result = driver.analyze("", StartRule.SCRIPT);

		assertTrue(result.getInferredTypes().isEmpty());
		assertTrue(result.getGlobalScope().isPresent());
	}

	@Test
	public void singleExpressionIsIndexedByLineAndText()
	{
		AnalysisResult result = driver.analyze("\n\nprint 42\n", StartRule.SCRIPT);

		TypeIndex types = result.getInferredTypes();
		assertEquals(1, types.size());
		assertEquals(Optional.of(PrimitiveType.INT), types.typeOf(3, "42"));
	}

	@Test
	public void singleExpressionHasNoTypeWhenSecondPhaseSkipped()
	{
		AnalysisResult result = driver.analyze("print 42", "script", true);

		assertEquals(Map.of(1, Map.of("42", NoType.INSTANCE)), result.getInferredTypes().asMap());
	}

	@Test
	public void declarationFromVarDecRuleFirstPhaseOnly()
	{
		AnalysisResult result = driver.analyze("var x : Int = 1 + 2", StartRule.VAR_DEC, true);

		TypeIndex types = result.getInferredTypes();
		assertEquals(Optional.of(NoType.INSTANCE), types.typeOf(1, "1+2"));
		assertEquals(Optional.of(NoType.INSTANCE), types.typeOf(1, "1"));
		assertEquals(Optional.of(NoType.INSTANCE), types.typeOf(1, "2"));
		assertEquals(3, types.size());
	}

	@Test
	public void declarationFromVarDecRuleBothPhases()
	{
		AnalysisResult result = driver.analyze("var x : Int = 1 + 2", StartRule.VAR_DEC, false);

		assertEquals(Optional.of(PrimitiveType.INT), result.getInferredTypes().typeOf(1, "1+2"));
		assertFalse(result.getErrors().hasErrors());
	}

	@Test
	public void firstPhaseOnlyLeavesEveryEntryUntyped()
	{
		String source = """
				func twice(n : Int) : Int {
				    return n * 2
				}
				var total : Int = twice(3) + 1
				if total < 10 {
				    print "small"
				}
				twice(total)
				""";

		AnalysisResult result = driver.analyze(source, StartRule.SCRIPT, true);

		TypeIndex types = result.getInferredTypes();
		assertFalse(types.isEmpty());
		types.asMap().values().forEach(entries ->
				entries.values().forEach(type -> assertSame(NoType.INSTANCE, type)));
	}

	@Test
	public void identicalTextOnDifferentLinesGivesSeparateEntries()
	{
		String source = """
				var x : Int = 3
				var s : String = "x"
				print x
				print s
				print x
				""";

		TypeIndex types = driver.analyze(source, StartRule.SCRIPT).getInferredTypes();

		assertEquals(Optional.of(PrimitiveType.INT), types.typeOf(3, "x"));
		assertEquals(Optional.of(PrimitiveType.STRING), types.typeOf(4, "s"));
		assertEquals(Optional.of(PrimitiveType.INT), types.typeOf(5, "x"));
		assertEquals(Optional.of(PrimitiveType.STRING), types.typeOf(2, "\"x\""));
		assertEquals(Optional.of(PrimitiveType.INT), types.typeOf(1, "3"));
		assertEquals(5, types.size());
	}

	@Test
	public void functionCallStatementsAndExpressionsAreTyped()
	{
		String source = """
				func greet(name : String) {
				    print "hi " + name
				}
				func square(n : Int) : Int {
				    return n * n
				}
				greet("bob")
				print square(4)
				""";

		AnalysisResult result = driver.analyze(source, StartRule.SCRIPT);
		TypeIndex types = result.getInferredTypes();

		assertFalse(result.getErrors().hasErrors(), result.getErrors().toString());
		assertEquals(Optional.of(PrimitiveType.STRING), types.typeOf(2, "\"hi \"+name"));
		assertEquals(Optional.of(PrimitiveType.STRING), types.typeOf(2, "name"));
		assertEquals(Optional.of(PrimitiveType.INT), types.typeOf(5, "n*n"));
		assertEquals(Optional.of(PrimitiveType.VOID), types.typeOf(7, "greet(\"bob\")"));
		assertEquals(Optional.of(PrimitiveType.STRING), types.typeOf(7, "\"bob\""));
		assertEquals(Optional.of(PrimitiveType.INT), types.typeOf(8, "square(4)"));
	}

	@Test
	public void semanticErrorsAreCollectedNotThrown()
	{
		String source = """
				var b : Bool = 1
				var b : Int
				print y
				while 3 {
				    b = true
				}
				""";

		AnalysisResult result = driver.analyze(source, StartRule.SCRIPT);
		ErrorLog errors = result.getErrors();

		assertEquals(4, errors.total(), errors.toString());
		assertTrue(errors.includesExactly(ErrorCategory.ASSIGN_TO_WRONG_TYPE, 1, "varb:Bool=1"));
		assertTrue(errors.includesExactly(ErrorCategory.DUPLICATE_NAME, 2, "varb:Int"));
		assertTrue(errors.includesExactly(ErrorCategory.UNDEFINED_NAME, 3, "y"));
		assertTrue(errors.includesOnLine(ErrorCategory.CONDITION_NOT_BOOL, 4));
		assertEquals(Optional.of(ErrorType.INSTANCE), result.getInferredTypes().typeOf(3, "y"));
	}

	@Test
	public void secondPhaseErrorsAreSkippedWithFirstPhaseOnly()
	{
		AnalysisResult result = driver.analyze("var b : Bool = 1\nvar b : Int\n", StartRule.SCRIPT, true);

		assertEquals(1, result.getErrors().total());
		assertEquals(ErrorCategory.DUPLICATE_NAME, result.getErrors().entries().get(0).getCategory());
	}

	@Test
	public void repeatedRunsAreIdentical()
	{
		String source = """
				func f(a : Int, b : Bool) : Int {
				    if b {
				        return a
				    }
				    return -a
				}
				print f(1, 2 == 2)
				print f(true, 1)
				print undefined + 1
				""";

		AnalysisResult first = driver.analyze(source, StartRule.SCRIPT, false);
		AnalysisResult second = driver.analyze(source, StartRule.SCRIPT, false);

		assertTrue(first.getErrors().hasErrors());
		assertEquals(first.getErrors().entries(), second.getErrors().entries());
		assertEquals(first.getInferredTypes(), second.getInferredTypes());
		assertNotSame(first.getErrors(), second.getErrors());
		assertNotSame(first.getInferredTypes(), second.getInferredTypes());
	}

	@Test
	public void globalScopeIsReturnedFromScriptRoot()
	{
		AnalysisResult result = driver.analyze("func f() {\n}\nvar x : Int\n", StartRule.SCRIPT, true);

		Scope global = result.getGlobalScope().orElseThrow();
		assertTrue(global.isGlobal());
		assertEquals(SymbolKind.FUNCTION, global.resolveLocally("f").orElseThrow().getKind());
		// Main's variables live in a child scope
		assertTrue(global.resolveLocally("x").isEmpty());
	}

	@Test
	public void globalScopeIsAbsentWhenNoneAttached()
	{
		AnalysisResult result = driver.analyze("print 1", StartRule.STATEMENT, false);

		assertTrue(result.getGlobalScope().isEmpty());
		assertEquals(Optional.of(PrimitiveType.INT), result.getInferredTypes().typeOf(1, "1"));
	}

	@Test
	public void phasesThatDoNothingLeaveEverythingEmpty()
	{
		SemanticAnalysisDriver inert = new SemanticAnalysisDriver(new SemanticPhases()
		{
			@Override
			public ParseTreeListener defineScopesAndSymbols(ErrorLog errors)
			{
				return new NimbleBaseListener();
			}

			@Override
			public ParseTreeListener inferTypesAndCheckConstraints(ErrorLog errors)
			{
				return new NimbleBaseListener();
			}
		});

		AnalysisResult result = inert.analyze("print 1 + 2\n", StartRule.SCRIPT);

		assertTrue(result.getGlobalScope().isEmpty());
		assertFalse(result.getErrors().hasErrors());
		assertEquals(Optional.of(NoType.INSTANCE), result.getInferredTypes().typeOf(1, "1+2"));
	}

	@Test
	public void secondPhaseIsNotCreatedWhenSkipped()
	{
		AtomicInteger secondPhaseRuns = new AtomicInteger();
		SemanticAnalysisDriver counting = new SemanticAnalysisDriver(new SemanticPhases()
		{
			@Override
			public ParseTreeListener defineScopesAndSymbols(ErrorLog errors)
			{
				return new NimbleBaseListener();
			}

			@Override
			public ParseTreeListener inferTypesAndCheckConstraints(ErrorLog errors)
			{
				secondPhaseRuns.incrementAndGet();
				return new NimbleBaseListener();
			}
		});

		counting.analyze("print 1", StartRule.SCRIPT, true);
		assertEquals(0, secondPhaseRuns.get());
		counting.analyze("print 1", StartRule.SCRIPT, false);
		assertEquals(1, secondPhaseRuns.get());
	}

	@Test
	public void exceptionsFromPhasesPropagate()
	{
		SemanticAnalysisDriver broken = new SemanticAnalysisDriver(new SemanticPhases()
		{
			@Override
			public ParseTreeListener defineScopesAndSymbols(ErrorLog errors)
			{
				return new NimbleBaseListener()
				{
					@Override
					public void enterEveryRule(ParserRuleContext ctx)
					{
						throw new IllegalStateException("analyzer bug");
					}
				};
			}

			@Override
			public ParseTreeListener inferTypesAndCheckConstraints(ErrorLog errors)
			{
				return new NimbleBaseListener();
			}
		});

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> broken.analyze("print 1", StartRule.SCRIPT));
		assertEquals("analyzer bug", e.getMessage());
	}

	@Test
	public void syntaxErrorsAreReturnedWithTheResult()
	{
		AnalysisResult result = driver.analyze("var x : Int = = 3\nprint (1 +\n", StartRule.SCRIPT);

		assertTrue(result.hasSyntaxErrors());
		assertTrue(result.getSyntaxErrors().get(0).startsWith("[Syntax Error] line 1:"), result.getSyntaxErrors().toString());
	}

	@Test
	public void wellFormedSourceHasNoSyntaxErrors()
	{
		AnalysisResult result = driver.analyze("var x : Int = 1 + 2", StartRule.VAR_DEC);

		assertFalse(result.hasSyntaxErrors());
		assertTrue(result.getSyntaxErrors().isEmpty());
	}

	@Test
	public void syntaxErrorsAreNotSharedBetweenRuns()
	{
		assertTrue(driver.analyze("var x : Int = = 3\nprint (1 +\n", StartRule.SCRIPT).hasSyntaxErrors());
		assertFalse(driver.analyze("print 1", StartRule.SCRIPT).hasSyntaxErrors());
	}

	@Test
	public void unknownStartRuleIsRejected()
	{
		assertThrows(IllegalArgumentException.class, () -> driver.analyze("print 1", "program", false));
	}
}
