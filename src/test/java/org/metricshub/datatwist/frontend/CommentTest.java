package org.metricshub.datatwist.frontend;

import static org.junit.Assert.*;
import static org.metricshub.datatwist.TwistTestSupport.twistTest;

import org.junit.Test;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SourceSpan;

public class CommentTest {

	@Test
	public void testEmptyPrograms() {
		twistTest("empty").source("").expectDump("(program)").runAndAssert();
		twistTest("line comment").source(";; nothing here").expectDump("(program)").runAndAssert();
		twistTest("nested block comment")
				.source("(comment nested (parentheses) work)")
				.expectDump("(program)")
				.runAndAssert();
		twistTest("blank lines").source("", "   ", "", "\t").expectDump("(program)").runAndAssert();
	}

	@Test
	public void testEmptyProgramSpan() {
		SourceSpan span = twistTest("comment only").source(";; header", "", "(comment body)").parse().getSpan();
		assertEquals(1, span.getLine());
		assertEquals(1, span.getColumn());
		assertEquals(0, span.getOffset());
		assertEquals(0, span.getLength());
		assertEquals(0, span.getEndOffset());

		SourceSpan statement = twistTest("after comments").source(";; header", "x = 1").parse().getSpan();
		assertEquals(2, statement.getLine());
		assertEquals(10, statement.getOffset());
		assertEquals(5, statement.getLength());
	}

	@Test
	public void testTrailingAndInlineComments() {
		twistTest("trailing")
				.source("x = 42 ;; the answer", "y = (comment unused) x")
				.expectDump("(program (= x (num 42)) (= y (id x)))")
				.runAndAssert();
	}

	@Test
	public void testCommentsBetweenStages() {
		twistTest("pipeline with comments")
				.source(
						"result = users ;; all users",
						"  ;; keep the active ones",
						"  filter _.active",
						"",
						"  (comment",
						"    names only",
						"  )",
						"  map _.name")
				.expectDump("(program (= result (pipeline (id users) (stage filter (_ active)) (stage map (_ name)))))")
				.runAndAssert();
	}

	@Test
	public void testCommentLinesDoNotChangeIndentation() {
		twistTest("comment at column 1 inside a block")
				.source("xs", ";; first", "  take 1", "    ;; deeper comment", "  drop 1")
				.expectDump("(program (pipeline (id xs) (stage take (num 1)) (stage drop (num 1))))")
				.runAndAssert();
	}

	@Test
	public void testCommentLikeIdentifiers() {
		twistTest("comments is an identifier")
				.source("(comments x)")
				.expectDump("(program (apply (id comments) (id x)))")
				.runAndAssert();
	}

	@Test
	public void testUnterminatedBlockComment() {
		twistTest("unterminated")
				.source("x = 1", "(comment (never closed)")
				.expectError(ScanException.class, "Unterminated block comment")
				.expectErrorAt(2, 1)
				.runAndAssert();
	}

	@Test
	public void testSingleSemicolon() {
		twistTest("single semicolon")
				.source("x = 1 ; not a comment")
				.expectError(ScanException.class, "Invalid character ';'")
				.runAndAssert();
	}
}
