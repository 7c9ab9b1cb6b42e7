package org.metricshub.datatwist.frontend;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;
import org.metricshub.datatwist.frontend.IndentationTracker.Change;
import org.metricshub.datatwist.frontend.IndentationTracker.Layout;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SourceSpan;

public class IndentationTrackerTest {

	private static final SourceSpan SPAN = new SourceSpan(3, 1, 20, 4);

	private IndentationTracker tracker;

	@Before
	public void setUp() {
		tracker = new IndentationTracker(2, "test");
	}

	private Layout classify(String prefix) {
		return tracker.classify(prefix, SPAN);
	}

	private String failure(String prefix) {
		ScanException e = assertThrows(ScanException.class, () -> classify(prefix));
		assertEquals(3, e.getLineNumber());
		return e.getDiagnostic().getReason();
	}

	@Test
	public void testOutermostLevel() {
		assertEquals(0, tracker.depth());
		assertEquals("", tracker.top().getPrefix());
		assertEquals(Change.SAME, classify("").getChange());
	}

	@Test
	public void testIndent() {
		Layout layout = classify("  ");
		assertTrue(layout.isIndent());
		assertEquals(1, layout.getTargetDepth());
		// classifying does not touch the stack
		assertEquals(0, tracker.depth());
	}

	@Test
	public void testNestedLevelsAndDedent() {
		tracker.push("  ", 1);
		tracker.push("    ", 2);
		assertEquals(2, tracker.depth());
		assertTrue(classify("    ").isSame());
		assertTrue(classify("       ").isIndent());

		Layout dedent = classify("  ");
		assertTrue(dedent.isDedent());
		assertEquals(1, dedent.getTargetDepth());
		assertEquals(0, classify("").getTargetDepth());

		tracker.popTo(dedent.getTargetDepth());
		assertEquals(1, tracker.depth());
		assertEquals("  ", tracker.top().getPrefix());
		assertEquals(1, tracker.top().getLine());
	}

	@Test
	public void testTabs() {
		assertTrue(classify("\t").isIndent());
		tracker.push("\t", 1);
		assertTrue(classify("\t\t").isIndent());
		assertTrue(classify("").isDedent());
	}

	@Test
	public void testTooShallow() {
		assertEquals("Indentation of 1 space(s) is too shallow, at least 2 required", failure(" "));
		tracker.push("  ", 1);
		assertEquals("Indentation of 1 space(s) is too shallow, at least 2 required", failure("   "));
	}

	@Test
	public void testCustomMinimumWidth() {
		tracker = new IndentationTracker(4, "test");
		assertEquals("Indentation of 2 space(s) is too shallow, at least 4 required", failure("  "));
		assertTrue(classify("    ").isIndent());

		tracker = new IndentationTracker(1, "test");
		assertTrue(classify(" ").isIndent());
	}

	@Test
	public void testMixedPrefix() {
		assertEquals("Indentation mixes tabs and spaces", failure(" \t"));
		assertEquals("Indentation mixes tabs and spaces", failure("\t  "));
	}

	@Test
	public void testMixedWithEnclosingBlock() {
		tracker.push("  ", 1);
		assertEquals("Indentation mixes tabs and spaces with the enclosing block", failure("\t"));
	}

	@Test
	public void testDedentToUnknownLevel() {
		tracker.push("    ", 1);
		assertEquals("Indentation does not match any enclosing block", failure("  "));
	}

	@Test
	public void testDepthOf() {
		tracker.push("  ", 1);
		tracker.push("    ", 4);
		assertEquals(0, tracker.depthOf(""));
		assertEquals(2, tracker.depthOf("    "));
		assertEquals(-1, tracker.depthOf("   "));
	}

	@Test
	public void testReset() {
		tracker.push("  ", 1);
		tracker.reset();
		assertEquals(0, tracker.depth());
		assertTrue(classify("").isSame());
	}

	@Test
	public void testMisuse() {
		assertThrows(IllegalStateException.class, () -> tracker.push("", 1));
		tracker.push("  ", 1);
		assertThrows(IllegalStateException.class, () -> tracker.push("\t", 2));
		assertThrows(IllegalStateException.class, () -> tracker.popTo(2));
		assertThrows(IllegalStateException.class, () -> tracker.popTo(-1));
		assertThrows(IllegalArgumentException.class, () -> new IndentationTracker(0, "test"));
	}

	@Test
	public void testClassifyLineBreakToken() {
		Token newline = Scanner.tokenize("a\n  b").get(1);
		assertEquals(TokenType.NEWLINE, newline.getType());
		assertTrue(tracker.classify(newline).isIndent());
	}
}
