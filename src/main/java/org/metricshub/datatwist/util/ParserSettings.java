package org.metricshub.datatwist.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DataTwist
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.metricshub.datatwist.frontend.GrammarRule;

/**
 * A simple container for the parameters of the DataTwist parser.
 * These values have defaults, which may be changed when invoking the
 * parser from Java code.
 */
public class ParserSettings {

	/**
	 * Names recognized as pipeline operations by default: a name of this set
	 * written after a complete expression on the same line starts a new
	 * pipeline stage instead of being one more argument.
	 */
	public static final Set<String> DEFAULT_PIPELINE_OPERATIONS = Collections.unmodifiableSet(
			new LinkedHashSet<String>(
					Arrays.asList(
							"filter",
							"map",
							"reduce",
							"take",
							"drop",
							"sort-by",
							"group-by",
							"flat-map",
							"take-while",
							"drop-while",
							"distinct",
							"reverse",
							"sort",
							"partition")));

	/**
	 * Grammar rule the source is parsed with;
	 * {@link GrammarRule#PROGRAM} by default.
	 */
	private GrammarRule entryRule = GrammarRule.PROGRAM;

	/**
	 * Whether a failed statement is replaced with an error marker so that
	 * parsing continues with the next statement;
	 * <code>false</code> by default.
	 */
	private boolean bestEffort = false;

	/**
	 * Maximum nesting depth of expressions before the parse fails with a
	 * limit error.
	 */
	private int maxNestingDepth = 200;

	/**
	 * Number of spaces an indented line must add at least to the enclosing
	 * level. Tab indentation requires one tab.
	 */
	private int minimumIndentWidth = 2;

	private Set<String> pipelineOperations = new LinkedHashSet<String>(DEFAULT_PIPELINE_OPERATIONS);

	public ParserSettings() {}

	/**
	 * Copy constructor.
	 *
	 * @param other settings to copy
	 */
	public ParserSettings(ParserSettings other) {
		this.entryRule = other.entryRule;
		this.bestEffort = other.bestEffort;
		this.maxNestingDepth = other.maxNestingDepth;
		this.minimumIndentWidth = other.minimumIndentWidth;
		this.pipelineOperations = new LinkedHashSet<String>(other.pipelineOperations);
	}

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("entryRule = ").append(getEntryRule()).append(newLine);
		desc.append("bestEffort = ").append(isBestEffort()).append(newLine);
		desc.append("maxNestingDepth = ").append(getMaxNestingDepth()).append(newLine);
		desc.append("minimumIndentWidth = ").append(getMinimumIndentWidth()).append(newLine);
		desc.append("pipelineOperations = ").append(getPipelineOperations()).append(newLine);

		return desc.toString();
	}

	public GrammarRule getEntryRule() {
		return entryRule;
	}

	public void setEntryRule(GrammarRule entryRule) {
		if (entryRule == null) {
			throw new IllegalArgumentException("Entry rule is required");
		}
		this.entryRule = entryRule;
	}

	public boolean isBestEffort() {
		return bestEffort;
	}

	/**
	 * Best-effort parsing only applies to {@link GrammarRule#PROGRAM}: each
	 * failed statement becomes an error node and parsing resumes on the next
	 * line starting at column 1.
	 *
	 * @param bestEffort whether to continue past errors
	 */
	public void setBestEffort(boolean bestEffort) {
		this.bestEffort = bestEffort;
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	public void setMaxNestingDepth(int maxNestingDepth) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("Maximum nesting depth must be positive");
		}
		this.maxNestingDepth = maxNestingDepth;
	}

	public int getMinimumIndentWidth() {
		return minimumIndentWidth;
	}

	public void setMinimumIndentWidth(int minimumIndentWidth) {
		if (minimumIndentWidth < 1) {
			throw new IllegalArgumentException("Minimum indentation width must be positive");
		}
		this.minimumIndentWidth = minimumIndentWidth;
	}

	/**
	 * @return a copy of the names recognized as pipeline operations
	 */
	public Set<String> getPipelineOperations() {
		return new LinkedHashSet<String>(pipelineOperations);
	}

	public void setPipelineOperations(Set<String> pipelineOperations) {
		this.pipelineOperations = new LinkedHashSet<String>(pipelineOperations);
	}

	/**
	 * Registers one more pipeline operation name.
	 *
	 * @param name the operation name, like {@code "window"}
	 */
	public void addPipelineOperation(String name) {
		pipelineOperations.add(name);
	}

	/**
	 * @param name an identifier
	 * @return {@code true} if the name is registered as a pipeline operation
	 */
	public boolean isPipelineOperation(String name) {
		return pipelineOperations.contains(name);
	}
}
