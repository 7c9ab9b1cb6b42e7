package org.metricshub.datatwist.frontend;

import static org.junit.Assert.*;
import static org.metricshub.datatwist.TwistTestSupport.parse;

import java.util.Collections;
import org.junit.Test;
import org.metricshub.datatwist.DataTwist;
import org.metricshub.datatwist.frontend.ast.StringLiteral;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.util.ParserSettings;

public class SyntaxPrinterTest {

	private static final DataTwist TWIST = new DataTwist();

	/**
	 * Formats the program, compares with the expected text, and checks that
	 * the text parses back to the same tree.
	 */
	private static void assertFormat(String expected, String... source) {
		SyntaxNode tree = parse(source);
		String formatted = TWIST.format(tree);
		assertEquals(expected, formatted);
		assertEquals(formatted, tree, TWIST.parseOrThrow(formatted));
	}

	@Test
	public void testOperators() {
		assertFormat("1 + 2 * 3", "1+2*3");
		assertFormat("(1 + 2) * 3", "((1 + 2)) * 3");
		assertFormat("a - (b - c)", "a - (b - c)");
		assertFormat("a - b - c", "(a - b) - c");
		assertFormat("f x + g y", "(f x) + (g y)");
		assertFormat("2 * -3", "2 * -3");
		assertFormat("f (-1)", "f (-1)");
	}

	@Test
	public void testComparisonAtStatementStart() {
		assertFormat("(a = b)", "(a = b)");
		assertFormat("x = a = b", "x = (a = b)");
	}

	@Test
	public void testLiterals() {
		assertFormat("\"tab\\tquote\\\" brace\\{\"", "\"tab\\tquote\\\" brace\\{\"");
		assertFormat("{name: \"Alice\" \"first name\": \"A\" \"if\": 1}", "{name: \"Alice\"  \"first name\": \"A\" \"if\": 1}");
		assertFormat("[1 (-2) (f x) a + b]", "[1 (-2) (f x) a + b]");
		assertFormat("[x y -> x + y]", "[x y ->", "  x + y", "]");
		assertFormat("(f x).name", "(f x).name");
	}

	@Test
	public void testPipelines() {
		assertFormat("data\n  filter (_.age > 18)", "data filter _.age > 18");
		assertFormat(
				"result = users\n  filter _.active\n  map _.name\n  take 10",
				"result = users filter _.active map _.name take 10");
		assertFormat(
				"{\n  adults: people\n    filter (_.age >= 18)\n  count: 2\n}",
				"{adults: people filter _.age >= 18 count: 2}");
		assertFormat("xs\n  map (filter)", "xs map (filter)");
	}

	@Test
	public void testInterpolations() {
		assertFormat("\"{xs take 1}\"", "\"{xs take 1}\"");
		assertFormat("\"{match x | 1 -> 2 | _ -> 3}\"", "\"{match x | 1 -> 2 | _ -> 3}\"");
		assertFormat("\"{try a catch e -> b} and more\"", "\"{(try a catch e -> b)} and more\"");
	}

	@Test
	public void testUnregisteredStageCannotBePrintedFlat() {
		SyntaxNode pipeline = TWIST.parseOrThrow("data\n  select name", GrammarRule.EXPRESSION);
		StringLiteral string = new StringLiteral(
				Collections.singletonList(StringLiteral.Segment.embedded(pipeline)),
				pipeline.getSpan());
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> TWIST.format(string));
		assertTrue(e.getMessage().contains("'select'"));
	}

	@Test
	public void testConstructs() {
		assertFormat("let a = 1, b = 2 in a + b", "let", "  a = 1", "  b = 2", "in a + b");
		assertFormat(
				"let\n  items = order\n    map _.price\nin sum items",
				"let items = order map _.price in sum items");
		assertFormat("if a then 1 else if b then 2 else 3", "if a then 1 else if b then 2 else 3");
		assertFormat("if a then 1 else (if b then 2 else 3)", "if a then 1 else (if b then 2 else 3)");
		assertFormat(
				"if ok\n  then match x\n    | 1 -> 2\n    | _ -> 3\n  else 0",
				"if ok then (match x | 1 -> 2 | _ -> 3) else 0");
		assertFormat("match x\n  | 1 -> \"a\"\n  | _ -> \"b\"", "match x | 1 -> \"a\" | _ -> \"b\"");
		assertFormat("f = match _\n  | 0 -> \"zero\"\n  | otherwise -> \"n\"", "f = | 0 -> \"zero\" | otherwise -> \"n\"");
		assertFormat(
				"match u\n  | {name age: 30} -> name\n  | {\"full name\": n id: _} -> n\n  | _.age > 1 -> 1\n  | 1 + 1 when u -> 2",
				"match u",
				"  | {name age: 30} -> name",
				"  | {\"full name\": n id: _} -> n",
				"  | _.age > 1 -> 1",
				"  | 1 + 1 when u -> 2");
		assertFormat("try parse input catch ParseError e -> nil", "try parse input", "catch ParseError e -> nil");
		assertFormat("try (match x\n  | 1 -> 2)\n  catch e -> 0", "try (match x | 1 -> 2) catch e -> 0");
	}

	@Test
	public void testProgram() {
		assertFormat("x = 1\ny = x + 1\ny", "x = 1", ";; comment", "", "y = x+1", "y");
		assertFormat("", "");
	}

	@Test
	public void testDesugaredTree() {
		SyntaxNode desugared = TWIST.desugar(parse("data filter _.age > 18 take 1"));
		String formatted = TWIST.format(desugared);
		assertEquals("take (filter data (_.age > 18)) 1", formatted);
		assertEquals(desugared, TWIST.parseOrThrow(formatted));
	}

	@Test
	public void testIndentStepFollowsMinimumWidth() {
		ParserSettings settings = new ParserSettings();
		settings.setMinimumIndentWidth(4);
		DataTwist wide = new DataTwist(settings);
		SyntaxNode tree = wide.parseOrThrow("xs take 1");
		assertEquals("xs\n    take 1", wide.format(tree));
		assertEquals(tree, wide.parseOrThrow(wide.format(tree)));
	}

	@Test
	public void testErrorTreesCannotBePrinted() {
		ParserSettings settings = new ParserSettings();
		settings.setBestEffort(true);
		DataTwist twist = new DataTwist(settings);
		SyntaxNode tree = twist.parse("a = )").getTree();
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> twist.format(tree));
		assertTrue(e.getMessage().startsWith("Cannot print a tree with a parse error"));
	}
}
