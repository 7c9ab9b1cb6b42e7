package org.metricshub.datatwist.frontend;

import static org.junit.Assert.*;
import static org.metricshub.datatwist.TwistTestSupport.twistTest;

import java.util.EnumSet;
import org.junit.Test;
import org.metricshub.datatwist.DataTwist;
import org.metricshub.datatwist.ParseResult;
import org.metricshub.datatwist.frontend.ast.Diagnostic;
import org.metricshub.datatwist.frontend.ast.DiagnosticKind;
import org.metricshub.datatwist.frontend.ast.ErrorNode;
import org.metricshub.datatwist.frontend.ast.LimitException;
import org.metricshub.datatwist.frontend.ast.ParseException;
import org.metricshub.datatwist.frontend.ast.Program;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SourceSpan;
import org.metricshub.datatwist.frontend.ast.SyntaxException;

public class DiagnosticTest {

	private static String nested(int depth) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			sb.append('(');
		}
		sb.append('1');
		for (int i = 0; i < depth; i++) {
			sb.append(')');
		}
		return sb.toString();
	}

	private static String sum(int terms) {
		StringBuilder sb = new StringBuilder("x = 1");
		for (int i = 1; i < terms; i++) {
			sb.append(" + 1");
		}
		return sb.toString();
	}

	private static String stages(int count) {
		StringBuilder sb = new StringBuilder("xs");
		for (int i = 0; i < count; i++) {
			sb.append(" take 1");
		}
		return sb.toString();
	}

	@Test
	public void testFormat() {
		SourceSpan span = new SourceSpan(2, 5, 10, 1);
		assertEquals(
				"script.dtw:2:5: Expecting ')', found end of input (expected ')')",
				new Diagnostic(
						DiagnosticKind.SYNTAX,
						"script.dtw",
						span,
						EnumSet.of(TokenType.RPAREN),
						"Expecting ')', found end of input").format());
		assertEquals(
				"2:5: Bad (expected one of: identifier, line break)",
				new Diagnostic(DiagnosticKind.SYNTAX, null, span, EnumSet.of(TokenType.NEWLINE, TokenType.IDENTIFIER), "Bad")
						.format());
		Diagnostic scan = new Diagnostic(DiagnosticKind.SCAN, "x", span, null, "Unterminated string");
		assertTrue(scan.getExpected().isEmpty());
		assertEquals("SCAN x:2:5: Unterminated string", scan.toString());
		assertThrows(IllegalArgumentException.class, () -> new Diagnostic(null, "x", span, null, "reason"));
	}

	@Test
	public void testExceptionCarriesDiagnostic() {
		ParseException e = twistTest("missing paren").source("x = (1 + 2").failure();
		assertTrue(e instanceof SyntaxException);
		assertEquals(DiagnosticKind.SYNTAX, e.getDiagnostic().getKind());
		assertEquals("<inline-script>:1:11: Expecting ')', found end of input (expected ')')", e.getMessage());

		ParseException scan = twistTest("bad number").source("x = 12.34.56").failure();
		assertTrue(scan instanceof ScanException);
		assertEquals(DiagnosticKind.SCAN, scan.getDiagnostic().getKind());
		assertEquals(1, scan.getLineNumber());
		assertEquals(5, scan.getColumn());
	}

	@Test
	public void testStrictParseReportsFirstError() {
		ParseResult result = new DataTwist().parse("x = 1\ny = )\nz = )");
		assertFalse(result.isSuccess());
		assertNull(result.getTree());
		assertEquals(1, result.getDiagnostics().size());
		assertEquals(2, result.getDiagnostics().get(0).getLine());
	}

	@Test
	public void testBestEffortRecoversAtNextStatement() {
		ParseResult result = twistTest("best effort").bestEffort().source("x = 1", "y = (2 +", "z = 3").parseResult();
		assertFalse(result.isSuccess());
		assertEquals(1, result.getDiagnostics().size());
		assertEquals(
				"(program (= x (num 1)) (error \"Expecting an expression, found line break\") (= z (num 3)))",
				new DataTwist().dump(result.getTree()));
	}

	@Test
	public void testBestEffortCollectsEveryError() {
		ParseResult result = twistTest("several errors")
				.bestEffort()
				.source("a = [1, 2]", "b = 2", "c = )", "d = 4")
				.parseResult();
		assertEquals(2, result.getDiagnostics().size());
		assertEquals(1, result.getDiagnostics().get(0).getLine());
		assertEquals(3, result.getDiagnostics().get(1).getLine());
		assertEquals(
				"(program (error \"List elements are separated by spaces or line breaks, not commas\") (= b (num 2)) (error \"Expecting an expression, found ')'\") (= d (num 4)))",
				new DataTwist().dump(result.getTree()));
	}

	@Test
	public void testBestEffortAfterScanError() {
		ParseResult result = twistTest("scan error").bestEffort().source("a = 1", "b = @", "c = 3").parseResult();
		assertEquals(1, result.getDiagnostics().size());
		assertEquals(DiagnosticKind.SCAN, result.getDiagnostics().get(0).getKind());
		assertEquals(
				"(program (= a (num 1)) (error \"Invalid character '@'\") (= c (num 3)))",
				new DataTwist().dump(result.getTree()));
	}

	@Test
	public void testBestEffortAfterUnclosedBracket() {
		ParseResult paren = twistTest("unclosed paren").bestEffort().source("x = (1", "y = 2").parseResult();
		assertEquals(1, paren.getDiagnostics().size());
		assertEquals(1, paren.getDiagnostics().get(0).getLine());
		assertEquals(
				"(program (error \"Expecting ')', found 'y'\") (= y (num 2)))",
				new DataTwist().dump(paren.getTree()));

		ParseResult list = twistTest("unclosed list").bestEffort().source("x = [1 2", "y = 3", "z = 4").parseResult();
		assertEquals(1, list.getDiagnostics().size());
		assertEquals(
				"(program (error \"Expecting an expression, found end of input\") (= y (num 3)) (= z (num 4)))",
				new DataTwist().dump(list.getTree()));

		ParseResult application = twistTest("unclosed argument")
				.bestEffort()
				.source("x = f (g 1", "y = 3")
				.parseResult();
		assertEquals(1, application.getDiagnostics().size());
		assertEquals(
				"(program (error \"Expecting ')', found 'y'\") (= y (num 3)))",
				new DataTwist().dump(application.getTree()));
	}

	@Test
	public void testBestEffortSkipsContinuationKeywords() {
		ParseResult result = twistTest("continuation")
				.bestEffort()
				.source("a = if (x", "then 1", "else 2", "b = 3")
				.parseResult();
		assertEquals(1, result.getDiagnostics().size());
		Program program = (Program) result.getTree();
		assertEquals(2, program.getStatements().size());
		assertEquals("(= b (num 3))", new DataTwist().dump(program.getStatements().get(1)));
	}

	@Test
	public void testBestEffortSkipsIndentedLines() {
		ParseResult result = twistTest("skip block")
				.bestEffort()
				.source("a = data", "  filter (", "  map x", "b = 2")
				.parseResult();
		Program program = (Program) result.getTree();
		assertEquals(2, program.getStatements().size());
		assertTrue(program.getStatements().get(0) instanceof ErrorNode);
		assertEquals("(= b (num 2))", new DataTwist().dump(program.getStatements().get(1)));
	}

	@Test
	public void testBestEffortErrorOnLastLine() {
		ParseResult result = twistTest("last line").bestEffort().source("a = 1", "b = )").parseResult();
		Program program = (Program) result.getTree();
		assertEquals(2, program.getStatements().size());
		assertEquals(1, result.getDiagnostics().size());
	}

	@Test
	public void testBestEffortIndentedStart() {
		ParseResult result = twistTest("indented start").bestEffort().source("  x = 1", "y = 2").parseResult();
		assertEquals("Unexpected indentation at the start of the input", result.getDiagnostics().get(0).getReason());
		assertEquals(
				"(program (error \"Unexpected indentation at the start of the input\") (= y (num 2)))",
				new DataTwist().dump(result.getTree()));
	}

	@Test
	public void testBestEffortDoesNotApplyToFragments() {
		ParseResult result = twistTest("fragment").bestEffort().source("{a: 1,}").rule(GrammarRule.RECORD).parseResult();
		assertNull(result.getTree());
		assertEquals(1, result.getDiagnostics().size());
	}

	@Test
	public void testErrorNodesAreNotPrintable() {
		ParseResult result = twistTest("print").bestEffort().source("a = )").parseResult();
		assertThrows(IllegalArgumentException.class, () -> new DataTwist().format(result.getTree()));
	}

	@Test
	public void testNestingLimit() {
		twistTest("default limit").source(nested(50)).expectDump("(program (num 1))").runAndAssert();
		twistTest("beyond default limit")
				.source(nested(300))
				.expectError(LimitException.class, "Nesting deeper than 200 levels")
				.runAndAssert();

		twistTest("at custom limit").maxNestingDepth(10).source(nested(9)).expectDump("(program (num 1))").runAndAssert();
		ParseException e = twistTest("beyond custom limit").maxNestingDepth(10).source(nested(10)).failure();
		assertTrue(e instanceof LimitException);
		assertEquals(DiagnosticKind.LIMIT, e.getDiagnostic().getKind());
		assertEquals("Nesting deeper than 10 levels", e.getDiagnostic().getReason());
	}

	@Test
	public void testNestingLimitCountsOperatorChains() {
		twistTest("short chain").source(sum(100)).runAndAssert();
		twistTest("long chain")
				.source(sum(3000))
				.expectError(LimitException.class, "Nesting deeper than 200 levels")
				.runAndAssert();
		twistTest("field chain at custom limit")
				.maxNestingDepth(5)
				.source("a.b.c.d.e.f.g")
				.expectError(LimitException.class, "Nesting deeper than 5 levels")
				.runAndAssert();
	}

	@Test
	public void testNestingLimitCountsPipelineStages() {
		twistTest("short pipeline").source(stages(100)).runAndAssert();
		twistTest("long pipeline")
				.source(stages(5000))
				.expectError(LimitException.class, "Nesting deeper than 200 levels")
				.runAndAssert();

		StringBuilder block = new StringBuilder("xs");
		for (int i = 0; i < 300; i++) {
			block.append("\n  take 1");
		}
		twistTest("long stage block")
				.source(block.toString())
				.expectError(LimitException.class, "Nesting deeper than 200 levels")
				.runAndAssert();
	}

	@Test
	public void testNestingLimitInBestEffort() {
		ParseResult result = twistTest("limit best effort")
				.bestEffort()
				.maxNestingDepth(5)
				.source("a = " + nested(10), "b = 1")
				.parseResult();
		assertEquals(DiagnosticKind.LIMIT, result.getDiagnostics().get(0).getKind());
		assertEquals(
				"(program (error \"Nesting deeper than 5 levels\") (= b (num 1)))",
				new DataTwist().dump(result.getTree()));
	}

	@Test
	public void testIndentationErrors() {
		twistTest("too shallow")
				.source("xs", " take 1")
				.expectError(ScanException.class, "Indentation of 1 space(s) is too shallow, at least 2 required")
				.expectErrorAt(2, 1)
				.runAndAssert();
		twistTest("mixed")
				.source("xs", " \ttake 1")
				.expectError(ScanException.class, "Indentation mixes tabs and spaces")
				.runAndAssert();
		twistTest("no enclosing block")
				.source("xs", "    take 1", "  drop 1")
				.expectError(ScanException.class, "Indentation does not match any enclosing block")
				.runAndAssert();
		twistTest("unexpected dedent")
				.source("a = data", "  filter (x", "b)")
				.expectError(SyntaxException.class, "Unexpected dedent")
				.expectErrorAt(3, 1)
				.runAndAssert();
	}

	@Test
	public void testWiderIndentation() {
		twistTest("four spaces")
				.minimumIndentWidth(4)
				.source("xs", "    take 1")
				.expectDump("(program (pipeline (id xs) (stage take (num 1))))")
				.runAndAssert();
		twistTest("two spaces rejected")
				.minimumIndentWidth(4)
				.source("xs", "  take 1")
				.expectError(ScanException.class, "at least 4 required")
				.runAndAssert();
	}

	@Test
	public void testTabIndentation() {
		twistTest("tabs")
				.source("xs", "\ttake 1", "\tdrop 2")
				.expectDump("(program (pipeline (id xs) (stage take (num 1)) (stage drop (num 2))))")
				.runAndAssert();
	}
}
