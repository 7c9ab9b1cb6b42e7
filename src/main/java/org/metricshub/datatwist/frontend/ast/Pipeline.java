package org.metricshub.datatwist.frontend.ast;

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

import java.util.List;

/**
 * {@code seed} followed by one or more stages.
 * <p>
 * Stages hold their arguments as written. The accumulated value becomes the
 * first argument of a stage, unless one of its top-level arguments is a bare
 * {@code _}, in which case that position receives it.
 */
public final class Pipeline extends SyntaxNode {

	private final SyntaxNode seed;
	private final List<Application> stages;

	public Pipeline(SyntaxNode seed, List<Application> stages, SourceSpan span) {
		super(span);
		this.seed = required(seed, "Pipeline seed");
		this.stages = immutableList(stages, "Pipeline stages");
		if (this.stages.isEmpty()) {
			throw new IllegalArgumentException("A pipeline requires at least one stage");
		}
	}

	public SyntaxNode getSeed() {
		return seed;
	}

	public List<Application> getStages() {
		return stages;
	}

	/**
	 * @param stage one of the stages of a pipeline
	 * @return {@code true} if the stage places the piped value explicitly with a bare {@code _}
	 */
	public static boolean hasPlaceholder(Application stage) {
		for (SyntaxNode arg : stage.getArgs()) {
			if (arg instanceof WildcardAccess && ((WildcardAccess) arg).isBare()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.PIPELINE;
	}

	@Override
	public <R> R accept(SyntaxVisitor<R> visitor) {
		return visitor.visitPipeline(this);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Pipeline)) {
			return false;
		}
		Pipeline other = (Pipeline) o;
		return seed.equals(other.seed) && stages.equals(other.stages);
	}

	@Override
	public int hashCode() {
		return 31 * seed.hashCode() + stages.hashCode();
	}

	@Override
	public String toString() {
		return "Pipeline(" + seed + ", " + stages + ")";
	}
}
