package org.metricshub.datatwist.frontend;

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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.datatwist.frontend.ast.Diagnostic;
import org.metricshub.datatwist.frontend.ast.DiagnosticKind;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SourceSpan;

/**
 * Stack of active indentation levels, consulted by the parser each time it
 * examines a line break.
 * <p>
 * A line prefix is compared to the prefix of the top frame, as a character
 * sequence rather than a width:
 * <ul>
 * <li>exact match: {@link Change#SAME} level
 * <li>strict extension with more whitespace of the same kind:
 * {@link Change#INDENT}
 * <li>exact match of a lower frame: {@link Change#DEDENT} to that frame
 * </ul>
 * Anything else, including a mix of tabs and spaces, is a scan error and
 * never a silent dedent.
 * <p>
 * Classifying a prefix does not modify the stack: pushing and popping is
 * decided by the parser, which knows which construct a level belongs to.
 */
public class IndentationTracker {

	/**
	 * How a line is placed relative to the top frame.
	 */
	public enum Change {
		SAME,
		INDENT,
		DEDENT
	}

	/**
	 * Result of {@link IndentationTracker#classify(Token)}.
	 */
	public static final class Layout {

		private final Change change;
		private final int targetDepth;

		Layout(Change change, int targetDepth) {
			this.change = change;
			this.targetDepth = targetDepth;
		}

		public Change getChange() {
			return change;
		}

		/**
		 * @return depth of the frame matching the line; for an indent, the depth it would have once pushed
		 */
		public int getTargetDepth() {
			return targetDepth;
		}

		public boolean isSame() {
			return change == Change.SAME;
		}

		public boolean isIndent() {
			return change == Change.INDENT;
		}

		public boolean isDedent() {
			return change == Change.DEDENT;
		}

		@Override
		public String toString() {
			return change + "(" + targetDepth + ")";
		}
	}

	private final List<IndentFrame> frames = new ArrayList<IndentFrame>();
	private final int minimumIndentWidth;
	private final String sourceDescription;

	/**
	 * @param minimumIndentWidth number of spaces a space-indented level must add at least
	 * @param sourceDescription name of the source, used in diagnostics
	 */
	public IndentationTracker(int minimumIndentWidth, String sourceDescription) {
		if (minimumIndentWidth < 1) {
			throw new IllegalArgumentException("Minimum indentation width must be at least 1");
		}
		this.minimumIndentWidth = minimumIndentWidth;
		this.sourceDescription = sourceDescription;
		reset();
	}

	/**
	 * Drops every frame but the outermost one, whose prefix is empty.
	 */
	public final void reset() {
		frames.clear();
		frames.add(new IndentFrame("", 0));
	}

	/**
	 * @return number of frames above the outermost level
	 */
	public int depth() {
		return frames.size() - 1;
	}

	public IndentFrame top() {
		return frames.get(frames.size() - 1);
	}

	/**
	 * @param prefix a whitespace prefix
	 * @return depth of the frame with exactly this prefix, or -1
	 */
	public int depthOf(String prefix) {
		for (int i = frames.size() - 1; i >= 0; i--) {
			if (frames.get(i).getPrefix().equals(prefix)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Classifies the line introduced by the specified line break.
	 *
	 * @param newline a {@link TokenType#NEWLINE} token
	 * @return how the line is placed relative to the top frame
	 * @throws ScanException if the prefix mixes tabs and spaces, is too
	 *         shallow, or matches no frame of the stack
	 */
	public Layout classify(Token newline) {
		return classify(newline.getText(), newline.getSpan());
	}

	/**
	 * Classifies a line prefix.
	 *
	 * @param prefix leading whitespace of the line
	 * @param span where the prefix was found, for diagnostics
	 * @return how the line is placed relative to the top frame
	 * @throws ScanException on an invalid indentation transition
	 */
	public Layout classify(String prefix, SourceSpan span) {
		if (prefix.indexOf(' ') >= 0 && prefix.indexOf('\t') >= 0) {
			throw indentationException("Indentation mixes tabs and spaces", span);
		}
		String top = top().getPrefix();
		if (prefix.equals(top)) {
			return new Layout(Change.SAME, depth());
		}
		if (prefix.startsWith(top)) {
			int added = prefix.length() - top.length();
			if (prefix.charAt(0) == ' ' && added < minimumIndentWidth) {
				throw indentationException(
						"Indentation of " + added + " space(s) is too shallow, at least " + minimumIndentWidth + " required",
						span);
			}
			return new Layout(Change.INDENT, depth() + 1);
		}
		int lower = depthOf(prefix);
		if (lower >= 0) {
			return new Layout(Change.DEDENT, lower);
		}
		if (!top.isEmpty() && !prefix.isEmpty() && top.charAt(0) != prefix.charAt(0)) {
			throw indentationException("Indentation mixes tabs and spaces with the enclosing block", span);
		}
		throw indentationException("Indentation does not match any enclosing block", span);
	}

	/**
	 * Opens a new level.
	 *
	 * @param prefix the prefix of the new level, a strict extension of the top one
	 * @param line the line opening the level
	 */
	public void push(String prefix, int line) {
		if (!prefix.startsWith(top().getPrefix()) || prefix.length() == top().getPrefix().length()) {
			throw new IllegalStateException("'" + prefix + "' does not extend the current indentation level");
		}
		frames.add(new IndentFrame(prefix, line));
	}

	/**
	 * Pops frames until the specified depth is the top.
	 *
	 * @param targetDepth depth to return to
	 */
	public void popTo(int targetDepth) {
		if (targetDepth < 0 || targetDepth > depth()) {
			throw new IllegalStateException("Cannot pop to depth " + targetDepth + " from depth " + depth());
		}
		while (depth() > targetDepth) {
			frames.remove(frames.size() - 1);
		}
	}

	private ScanException indentationException(String reason, SourceSpan span) {
		return new ScanException(new Diagnostic(DiagnosticKind.SCAN, sourceDescription, span, null, reason));
	}

	@Override
	public String toString() {
		return "IndentationTracker" + frames;
	}
}
