package org.metricshub.datatwist.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SourceSpan;

public class ScannerTest {

	private static List<TokenType> types(String source) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : Scanner.tokenize(source)) {
			types.add(token.getType());
		}
		return types;
	}

	private static List<String> texts(String source) {
		List<String> texts = new ArrayList<String>();
		for (Token token : Scanner.tokenize(source)) {
			if (token.getType() != TokenType.EOF) {
				texts.add(token.getText());
			}
		}
		return texts;
	}

	private static ScanException scanFailure(String source) {
		return assertThrows(source, ScanException.class, () -> Scanner.tokenize(source));
	}

	@Test
	public void testIdentifiers() {
		assertEquals(
				Arrays.asList("even?", "user-data", "user123", "user_name", "save!", "a-1"),
				texts("even? user-data user123 user_name save! a-1"));
		for (TokenType type : types("even? user-data user123 user_name")) {
			assertTrue(type == TokenType.IDENTIFIER || type == TokenType.EOF);
		}
	}

	@Test
	public void testKeywords() {
		assertEquals(
				Arrays.asList(
						TokenType.LET,
						TokenType.IN,
						TokenType.IF,
						TokenType.THEN,
						TokenType.ELSE,
						TokenType.MATCH,
						TokenType.WHEN,
						TokenType.OTHERWISE,
						TokenType.TRY,
						TokenType.CATCH,
						TokenType.AND,
						TokenType.OR,
						TokenType.TRUE,
						TokenType.FALSE,
						TokenType.NIL,
						TokenType.IDENTIFIER,
						TokenType.EOF),
				types("let in if then else match when otherwise try catch and or true false nil lets"));
	}

	@Test
	public void testPunctuationAndOperators() {
		assertEquals(
				Arrays.asList(
						TokenType.EQUALS,
						TokenType.NOT_EQUALS,
						TokenType.LESS,
						TokenType.LESS_EQUALS,
						TokenType.GREATER,
						TokenType.GREATER_EQUALS,
						TokenType.PLUS,
						TokenType.MINUS,
						TokenType.STAR,
						TokenType.SLASH,
						TokenType.PERCENT,
						TokenType.ARROW,
						TokenType.PIPE,
						TokenType.COLON,
						TokenType.COMMA,
						TokenType.DOT,
						TokenType.UNDERSCORE,
						TokenType.LPAREN,
						TokenType.RPAREN,
						TokenType.LBRACE,
						TokenType.RBRACE,
						TokenType.LBRACKET,
						TokenType.RBRACKET,
						TokenType.EOF),
				types("= != < <= > >= + - * / % -> | : , . _ ( ) { } [ ]"));
	}

	@Test
	public void testNumbers() {
		assertEquals(Arrays.asList("42", "3.14", "0"), texts("42 3.14 0"));
		assertEquals(Arrays.asList(TokenType.MINUS, TokenType.NUMBER, TokenType.EOF), types("-5"));
		assertEquals(Arrays.asList(TokenType.NUMBER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EOF), types("1.a"));
	}

	@Test
	public void testMalformedNumbers() {
		assertEquals("Malformed number: 12.34.56", scanFailure("12.34.56").getDiagnostic().getReason());
		assertEquals("Malformed number: 123user", scanFailure("123user").getDiagnostic().getReason());
	}

	@Test
	public void testIdentifierStart() {
		assertEquals("Identifiers must start with a letter", scanFailure("-user").getDiagnostic().getReason());
		assertEquals("Identifiers must start with a letter", scanFailure("---").getDiagnostic().getReason());
		assertEquals("Identifiers must start with a letter", scanFailure("_private").getDiagnostic().getReason());
	}

	@Test
	public void testInvalidCharacters() {
		assertEquals("Invalid character '@'", scanFailure("x = @#$%").getDiagnostic().getReason());
		assertEquals("Invalid character '!'", scanFailure("!x").getDiagnostic().getReason());
		assertEquals("Invalid character ';'", scanFailure("x ; y").getDiagnostic().getReason());
	}

	@Test
	public void testStrings() {
		List<Token> tokens = Scanner.tokenize("\"a\\\"b\\\\c\\n\\t\\{d\\}\"");
		assertEquals(TokenType.STRING, tokens.get(0).getType());
		List<Token.Segment> segments = tokens.get(0).getSegments();
		assertEquals(1, segments.size());
		assertTrue(segments.get(0).isLiteral());
		assertEquals("a\"b\\c\n\t{d}", segments.get(0).getText());

		assertTrue(Scanner.tokenize("\"\"").get(0).getSegments().isEmpty());
	}

	@Test
	public void testStringErrors() {
		assertEquals("Unterminated string", scanFailure("\"Hello World").getDiagnostic().getReason());
		assertEquals("Unterminated string", scanFailure("\"Hello\nWorld\"").getDiagnostic().getReason());
		assertEquals("Invalid escape sequence in string", scanFailure("\"a\\qb\"").getDiagnostic().getReason());
	}

	@Test
	public void testInterpolation() {
		Token string = Scanner.tokenize("\"Hello {name + 1}!\"").get(0);
		List<Token.Segment> segments = string.getSegments();
		assertEquals(3, segments.size());
		assertEquals("Hello ", segments.get(0).getText());
		assertFalse(segments.get(1).isLiteral());
		List<TokenType> inner = new ArrayList<TokenType>();
		for (Token token : segments.get(1).getTokens()) {
			inner.add(token.getType());
		}
		assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.PLUS, TokenType.NUMBER, TokenType.EOF), inner);
		assertEquals("!", segments.get(2).getText());
	}

	@Test
	public void testInterpolationWithBraces() {
		Token string = Scanner.tokenize("\"{ {a: 1}.a }\"").get(0);
		List<TokenType> inner = new ArrayList<TokenType>();
		for (Token token : string.getSegments().get(0).getTokens()) {
			inner.add(token.getType());
		}
		assertEquals(
				Arrays.asList(
						TokenType.LBRACE,
						TokenType.IDENTIFIER,
						TokenType.COLON,
						TokenType.NUMBER,
						TokenType.RBRACE,
						TokenType.DOT,
						TokenType.IDENTIFIER,
						TokenType.EOF),
				inner);
	}

	@Test
	public void testInterpolationErrors() {
		assertEquals("Unterminated string interpolation", scanFailure("\"{a").getDiagnostic().getReason());
		assertEquals("Line break inside a string interpolation", scanFailure("\"{a\n}\"").getDiagnostic().getReason());
	}

	@Test
	public void testLineBreaksCarryIndentation() {
		List<Token> tokens = Scanner.tokenize("data\n  filter x\n\n   \n  map y\n");
		assertEquals(TokenType.NEWLINE, tokens.get(1).getType());
		assertEquals("  ", tokens.get(1).getText());
		assertEquals(TokenType.NEWLINE, tokens.get(4).getType());
		assertEquals("  ", tokens.get(4).getText());
		assertEquals(5, tokens.get(4).getSpan().getLine());
		assertEquals(
				Arrays.asList(
						TokenType.IDENTIFIER,
						TokenType.NEWLINE,
						TokenType.IDENTIFIER,
						TokenType.IDENTIFIER,
						TokenType.NEWLINE,
						TokenType.IDENTIFIER,
						TokenType.IDENTIFIER,
						TokenType.EOF),
				types("data\n  filter x\n\n   \n  map y\n"));
	}

	@Test
	public void testCarriageReturnsAreIgnored() {
		assertEquals(types("a\n  b\nc"), types("a\r\n  b\r\nc\r\n"));
	}

	@Test
	public void testLeadingBlankLines() {
		List<Token> tokens = Scanner.tokenize("\n\n;; header\nx");
		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		assertEquals(4, tokens.get(0).getSpan().getLine());
		assertEquals(
				"Unexpected indentation at the start of the input",
				scanFailure("\n  x").getDiagnostic().getReason());
	}

	@Test
	public void testComments() {
		assertEquals(Arrays.asList(TokenType.EOF), types(";; comment"));
		assertEquals(Arrays.asList(TokenType.EOF), types("(comment nested (parentheses) work)"));
		assertEquals(Arrays.asList("x", "=", "42"), texts("x = (comment the answer) 42 ;; trailing"));
		assertEquals(Arrays.asList("(", "comments", "x", ")"), texts("(comments x)"));
		assertEquals("Unterminated block comment", scanFailure("(comment (never closed)").getDiagnostic().getReason());
	}

	@Test
	public void testSpans() {
		List<Token> tokens = Scanner.tokenize("ab  cd\n  ef");
		SourceSpan cd = tokens.get(1).getSpan();
		assertEquals(1, cd.getLine());
		assertEquals(5, cd.getColumn());
		assertEquals(4, cd.getOffset());
		assertEquals(2, cd.getLength());
		SourceSpan ef = tokens.get(3).getSpan();
		assertEquals(2, ef.getLine());
		assertEquals(3, ef.getColumn());
		assertEquals(9, ef.getOffset());
	}

	@Test
	public void testOffsetsAreUtf8() {
		List<Token> tokens = Scanner.tokenize("\"é\" x");
		assertEquals(4, tokens.get(0).getSpan().getLength());
		SourceSpan x = tokens.get(1).getSpan();
		assertEquals(5, x.getColumn());
		assertEquals(5, x.getOffset());
	}

	@Test
	public void testScanErrorPosition() {
		ScanException e = scanFailure("x = 1\ny = @");
		assertEquals(2, e.getLineNumber());
		assertEquals(5, e.getColumn());
	}
}
