package org.metricshub.datatwist.frontend;

import static org.junit.Assert.*;
import static org.metricshub.datatwist.TwistTestSupport.dump;
import static org.metricshub.datatwist.TwistTestSupport.dumpExpression;
import static org.metricshub.datatwist.TwistTestSupport.twistTest;

import org.junit.Test;
import org.metricshub.datatwist.frontend.ast.Application;
import org.metricshub.datatwist.frontend.ast.Identifier;
import org.metricshub.datatwist.frontend.ast.ParseException;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SyntaxException;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;

public class ExpressionParserTest {

	private static void expression(String source, String expectedDump) {
		twistTest(source).source(source).rule(GrammarRule.EXPRESSION).expectDump(expectedDump).runAndAssert();
	}

	private static void program(String expectedDump, String... lines) {
		twistTest(lines[0]).source(lines).expectDump(expectedDump).runAndAssert();
	}

	private static void syntaxError(String source, String reason) {
		twistTest(source).source(source).expectError(SyntaxException.class, reason).runAndAssert();
	}

	@Test
	public void testPrecedence() {
		expression("1 + 2 * 3", "(+ (num 1) (* (num 2) (num 3)))");
		expression("1 * 2 + 3", "(+ (* (num 1) (num 2)) (num 3))");
		expression("(1 + 2) * 3", "(* (+ (num 1) (num 2)) (num 3))");
		expression("a % b / c", "(/ (% (id a) (id b)) (id c))");
		expression(
				"x > 1 and y < 2 or z",
				"(or (and (> (id x) (num 1)) (< (id y) (num 2))) (id z))");
		expression("a or b and c", "(or (id a) (and (id b) (id c)))");
		expression("a + 1 >= b - 1", "(>= (+ (id a) (num 1)) (- (id b) (num 1)))");
		expression("a != b", "(!= (id a) (id b))");
	}

	@Test
	public void testLeftAssociativity() {
		expression("a - b - c", "(- (- (id a) (id b)) (id c))");
		expression("a - (b - c)", "(- (id a) (- (id b) (id c)))");
		expression("a / b / c", "(/ (/ (id a) (id b)) (id c))");
	}

	@Test
	public void testOperatorsDesugarToApplications() {
		SyntaxNode tree = twistTest("1 + 2").source("1 + 2").rule(GrammarRule.EXPRESSION).parse();
		Application plus = (Application) tree;
		assertTrue(plus.isBinaryOperator());
		assertEquals("+", plus.getCalleeName());
		assertTrue(((Identifier) plus.getCallee()).isOperator());
		assertEquals(2, plus.getArgs().size());
	}

	@Test
	public void testComparisonVersusAssignment() {
		program("(program (= x (id b)))", "x = b");
		program("(program (= x (= (id y) (num 1))))", "x = y = 1");
		program("(program (= (id a) (id b)))", "(a = b)");
		expression("a = b", "(= (id a) (id b))");
	}

	@Test
	public void testOperatorContinuationLine() {
		program(
				"(program (= total (+ (+ (id a) (id b)) (id c))))",
				"total = a + b +",
				"  c");
	}

	@Test
	public void testApplication() {
		expression("f x y", "(apply (id f) (id x) (id y))");
		expression("f x + g y", "(+ (apply (id f) (id x)) (apply (id g) (id y)))");
		expression("f (g x) 1", "(apply (id f) (apply (id g) (id x)) (num 1))");
		expression("add (multiply 5 2) 10", "(apply (id add) (apply (id multiply) (num 5) (num 2)) (num 10))");
		expression(
				"f 42 3.14 \"hi\" true false nil _",
				"(apply (id f) (num 42) (num 3.14) (str \"hi\") true false nil (_))");
		expression("f {a: 1} [1 2]", "(apply (id f) (record (a: (num 1))) (list (num 1) (num 2)))");
	}

	@Test
	public void testFieldAccess() {
		expression("user.name", "(. (id user) name)");
		expression("user.address.city", "(. (. (id user) address) city)");
		expression("f user.name", "(apply (id f) (. (id user) name))");
		expression("user.greet \"hi\"", "(apply (. (id user) greet) (str \"hi\"))");
		expression("(f x).name", "(. (apply (id f) (id x)) name)");
		expression("{a: 1}.a", "(. (record (a: (num 1))) a)");
	}

	@Test
	public void testWildcard() {
		expression("_", "(_)");
		expression("_.age > 18", "(> (_ age) (num 18))");
		expression("_.address.city", "(_ address city)");
	}

	@Test
	public void testIdentifierForms() {
		expression("even? n", "(apply (id even?) (id n))");
		expression("save! user-data", "(apply (id save!) (id user-data))");
		expression("a-1", "(id a-1)");
		expression("a - 1", "(- (id a) (num 1))");
	}

	@Test
	public void testNegativeNumbers() {
		expression("-5", "(num -5)");
		expression("10 - 5", "(- (num 10) (num 5))");
		expression("10 -5", "(- (num 10) (num 5))");
		expression("f -1", "(apply (id f) (num -1))");
		expression("f x -1 2", "(apply (id f) (id x) (num -1) (num 2))");
		expression("f - 1", "(- (id f) (num 1))");
		expression("f-1", "(id f-1)");
		expression("f x-1", "(apply (id f) (id x-1))");
		expression("f (g 1)-1", "(- (apply (id f) (apply (id g) (num 1))) (num 1))");
		expression("f - -1", "(- (id f) (num -1))");
		expression("f (-1)", "(apply (id f) (num -1))");
		expression("2 * -3", "(* (num 2) (num -3))");
		syntaxError("- 5", "Expecting an expression, found '-'");
	}

	@Test
	public void testStrings() {
		expression("\"Hello\"", "(str \"Hello\")");
		expression("\"\"", "(str)");
		expression("\"Hello {user.name}!\"", "(str \"Hello \" (. (id user) name) \"!\")");
		expression("\"{a} and {b}\"", "(str (id a) \" and \" (id b))");
		expression("\"{f x + 1}\"", "(str (+ (apply (id f) (id x)) (num 1)))");
		expression("\"quote \\\" and brace \\{\"", "(str \"quote \\\" and brace {\")");
		expression("\"{ {a: 1}.a }\"", "(str (. (record (a: (num 1))) a))");
	}

	@Test
	public void testInterpolationErrors() {
		syntaxError("\"{}\"", "Empty string interpolation");
		syntaxError("\"{  }\"", "Empty string interpolation");
		syntaxError("\"{a )}\"", "Expecting '}' to close the interpolation, found ')'");
		twistTest("unterminated interpolation")
				.source("\"{a")
				.expectError(ScanException.class, "Unterminated string interpolation")
				.runAndAssert();
	}

	@Test
	public void testRecords() {
		expression("{}", "(record)");
		expression("{name: \"Alice\" age: 30}", "(record (name: (str \"Alice\")) (age: (num 30)))");
		expression("{\"first name\": \"A\"}", "(record (first name: (str \"A\")))");
		expression("{user: {name: \"A\"}}", "(record (user: (record (name: (str \"A\")))))");
		expression("{total: sum xs count: 2}", "(record (total: (apply (id sum) (id xs))) (count: (num 2)))");
		expression("{\"let\": 1}", "(record (let: (num 1)))");
	}

	@Test
	public void testMultiLineRecord() {
		program(
				"(program (= user (record (name: (str \"Alice\")) (age: (num 30)) (tags: (list (str \"a\") (str \"b\"))))))",
				"user = {",
				"  name: \"Alice\"",
				"  age: 30",
				"  tags: [\"a\" \"b\"]",
				"}");
		program(
				"(program (= user (record (name: (str \"Alice\")) (address: (record (city: (str \"Paris\")))))))",
				"user = {name: \"Alice\"",
				"  address: {",
				"    city: \"Paris\"",
				"  }",
				"}");
	}

	@Test
	public void testRecordErrors() {
		syntaxError("{a: 1, b: 2}", "Record fields are separated by spaces or line breaks, not commas");
		syntaxError("{a: 1 a: 2}", "Duplicate record key 'a'");
		syntaxError("{\"{x}\": 1}", "A record key cannot be an interpolated string");
		syntaxError("{1: 2}", "Expecting a field name, found '1'");
		syntaxError("{a 1}", "Expecting ':', found '1'");
		syntaxError("{a: 1", "Expecting a field name, found end of input");
	}

	@Test
	public void testLists() {
		expression("[]", "(list)");
		expression("[1 2 3]", "(list (num 1) (num 2) (num 3))");
		expression("[a + 1 f x]", "(list (+ (id a) (num 1)) (id f) (id x))");
		expression("[(f x) 2]", "(list (apply (id f) (id x)) (num 2))");
		expression("[-1 2]", "(list (num -1) (num 2))");
		expression("[1 -2 3]", "(list (num 1) (num -2) (num 3))");
		expression("[1 - 2]", "(list (- (num 1) (num 2)))");
		expression("[1 + 2 -3]", "(list (+ (num 1) (num 2)) (num -3))");
		expression("[x -1]", "(list (id x) (num -1))");
		expression("[[1] [2 3]]", "(list (list (num 1)) (list (num 2) (num 3)))");
		program(
				"(program (= xs (list (num 1) (num 2) (num 3))))",
				"xs = [",
				"  1",
				"  2 3",
				"]");
	}

	@Test
	public void testListErrors() {
		syntaxError("[1, 2]", "List elements are separated by spaces or line breaks, not commas");
		syntaxError("[1 2", "Expecting an expression, found end of input");
	}

	@Test
	public void testFunctions() {
		expression("[x -> x * 2]", "(fn [x] (* (id x) (num 2)))");
		expression("[a b -> a + b]", "(fn [a b] (+ (id a) (id b)))");
		expression("[x -> f x]", "(fn [x] (apply (id f) (id x)))");
		expression("[x y]", "(list (id x) (id y))");
		expression("[x -> [y -> x + y]]", "(fn [x] (fn [y] (+ (id x) (id y))))");
		program(
				"(program (= add (fn [a b] (+ (id a) (id b)))))",
				"add = [a b ->",
				"  a + b",
				"]");
	}

	@Test
	public void testFunctionErrors() {
		syntaxError("[-> 1]", "Function literal has an empty parameter list");
		syntaxError("[a a -> a]", "Duplicate parameter 'a'");
		syntaxError("[x -> x", "Expecting ']', found end of input");
	}

	@Test
	public void testPrimaryErrors() {
		syntaxError("1 +", "Expecting an expression, found end of input");
		syntaxError(")", "Expecting an expression, found ')'");
		syntaxError("x.1", "Expecting a field name, found '1'");
		syntaxError("x = (1 + 2", "Expecting ')', found end of input");
		syntaxError("a b: 1", "Expecting a line break after the statement, found 'b'");
	}

	@Test
	public void testErrorPosition() {
		ParseException e = twistTest("missing paren")
				.source("x = (1 + 2")
				.expectError(SyntaxException.class, "Expecting ')'")
				.expectErrorAt(1, 11)
				.failure();
		assertTrue(e.getDiagnostic().getExpected().contains(TokenType.RPAREN));

		twistTest("second line")
				.source("x = 1", "y = (2 +", "  )")
				.expectError(SyntaxException.class, "Expecting an expression, found ')'")
				.expectErrorAt(3, 3)
				.runAndAssert();
	}

	@Test
	public void testDumpHelper() {
		assertEquals("(program (= x (num 1)) (id x))", dump("x = 1", "x"));
		assertEquals("(+ (num 1) (num 2))", dumpExpression("1 +", "  2"));
	}
}
