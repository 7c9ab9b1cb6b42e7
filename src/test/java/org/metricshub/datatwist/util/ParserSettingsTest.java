package org.metricshub.datatwist.util;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.Set;
import org.junit.Test;
import org.metricshub.datatwist.frontend.GrammarRule;

public class ParserSettingsTest {

	@Test
	public void testDefaults() {
		ParserSettings settings = new ParserSettings();
		assertEquals(GrammarRule.PROGRAM, settings.getEntryRule());
		assertFalse(settings.isBestEffort());
		assertEquals(200, settings.getMaxNestingDepth());
		assertEquals(2, settings.getMinimumIndentWidth());
		assertEquals(ParserSettings.DEFAULT_PIPELINE_OPERATIONS, settings.getPipelineOperations());
		assertTrue(settings.isPipelineOperation("filter"));
		assertTrue(settings.isPipelineOperation("sort-by"));
		assertFalse(settings.isPipelineOperation("select"));
	}

	@Test
	public void testValidation() {
		ParserSettings settings = new ParserSettings();
		assertThrows(IllegalArgumentException.class, () -> settings.setEntryRule(null));
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> settings.setMaxNestingDepth(0));
		assertEquals("Maximum nesting depth must be positive", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> settings.setMinimumIndentWidth(0));
	}

	@Test
	public void testPipelineOperations() {
		ParserSettings settings = new ParserSettings();
		settings.addPipelineOperation("select");
		assertTrue(settings.isPipelineOperation("select"));

		Set<String> copy = settings.getPipelineOperations();
		copy.add("other");
		assertFalse(settings.isPipelineOperation("other"));

		settings.setPipelineOperations(Collections.singleton("only"));
		assertTrue(settings.isPipelineOperation("only"));
		assertFalse(settings.isPipelineOperation("filter"));
	}

	@Test
	public void testCopy() {
		ParserSettings settings = new ParserSettings();
		settings.setBestEffort(true);
		settings.setEntryRule(GrammarRule.EXPRESSION);
		settings.setMinimumIndentWidth(4);
		ParserSettings copy = new ParserSettings(settings);
		settings.addPipelineOperation("select");

		assertTrue(copy.isBestEffort());
		assertEquals(GrammarRule.EXPRESSION, copy.getEntryRule());
		assertEquals(4, copy.getMinimumIndentWidth());
		assertFalse(copy.isPipelineOperation("select"));
	}

	@Test
	public void testDescription() {
		String description = new ParserSettings().toDescriptionString();
		assertTrue(description.contains("entryRule = PROGRAM\n"));
		assertTrue(description.contains("bestEffort = false\n"));
		assertTrue(description.contains("maxNestingDepth = 200\n"));
		assertTrue(description.contains("pipelineOperations = [filter, map"));
	}
}
