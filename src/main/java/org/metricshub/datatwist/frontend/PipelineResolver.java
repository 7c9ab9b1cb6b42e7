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
import org.metricshub.datatwist.frontend.ast.Application;
import org.metricshub.datatwist.frontend.ast.Assignment;
import org.metricshub.datatwist.frontend.ast.BoolLiteral;
import org.metricshub.datatwist.frontend.ast.CatchAllPattern;
import org.metricshub.datatwist.frontend.ast.CatchClause;
import org.metricshub.datatwist.frontend.ast.ErrorNode;
import org.metricshub.datatwist.frontend.ast.FieldAccess;
import org.metricshub.datatwist.frontend.ast.FunctionDef;
import org.metricshub.datatwist.frontend.ast.GuardPattern;
import org.metricshub.datatwist.frontend.ast.Identifier;
import org.metricshub.datatwist.frontend.ast.IfExpr;
import org.metricshub.datatwist.frontend.ast.LetBinding;
import org.metricshub.datatwist.frontend.ast.ListLiteral;
import org.metricshub.datatwist.frontend.ast.LiteralPattern;
import org.metricshub.datatwist.frontend.ast.MatchClause;
import org.metricshub.datatwist.frontend.ast.MatchExpr;
import org.metricshub.datatwist.frontend.ast.NilLiteral;
import org.metricshub.datatwist.frontend.ast.NumberLiteral;
import org.metricshub.datatwist.frontend.ast.Pattern;
import org.metricshub.datatwist.frontend.ast.Pipeline;
import org.metricshub.datatwist.frontend.ast.Program;
import org.metricshub.datatwist.frontend.ast.RecordLiteral;
import org.metricshub.datatwist.frontend.ast.RecordPattern;
import org.metricshub.datatwist.frontend.ast.StringLiteral;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.frontend.ast.SyntaxVisitor;
import org.metricshub.datatwist.frontend.ast.TryCatch;
import org.metricshub.datatwist.frontend.ast.WildcardAccess;

/**
 * Rewrites pipelines as nested applications.
 * <p>
 * The value flowing through a pipeline is passed to each stage as its first
 * argument, unless the stage places it explicitly with a bare {@code _}
 * argument, in which case every bare {@code _} argument of the stage receives
 * it. As a consequence, {@code a f x g y} means {@code g (f a x) y}.
 * <p>
 * Nodes are never shared within a resolved tree: when a stage has several
 * bare {@code _} arguments, each one receives its own copy of the value.
 */
public final class PipelineResolver {

	private PipelineResolver() {}

	/**
	 * Folds the stages of a pipeline over its seed.
	 *
	 * @param pipeline the pipeline to resolve
	 * @return the application of the last stage
	 */
	public static SyntaxNode resolve(Pipeline pipeline) {
		SyntaxNode value = pipeline.getSeed();
		for (Application stage : pipeline.getStages()) {
			value = apply(stage, value);
		}
		return value;
	}

	private static Application apply(Application stage, SyntaxNode value) {
		List<SyntaxNode> args = new ArrayList<SyntaxNode>(stage.getArgs().size() + 1);
		if (Pipeline.hasPlaceholder(stage)) {
			boolean placed = false;
			for (SyntaxNode arg : stage.getArgs()) {
				if (isPlaceholder(arg)) {
					args.add(placed ? value.accept(new Desugarer(true)) : value);
					placed = true;
				} else {
					args.add(arg);
				}
			}
		} else {
			args.add(value);
			args.addAll(stage.getArgs());
		}
		return new Application(stage.getCallee(), args, value.getSpan().to(stage.getSpan()));
	}

	private static boolean isPlaceholder(SyntaxNode arg) {
		return arg instanceof WildcardAccess && ((WildcardAccess) arg).isBare();
	}

	/**
	 * Resolves every pipeline of a tree, including pipelines nested in stage
	 * arguments and in other constructs.
	 *
	 * @param node root of the tree
	 * @return an equivalent tree without any {@link Pipeline} node
	 */
	public static SyntaxNode desugar(SyntaxNode node) {
		return node.accept(new Desugarer(false));
	}

	/**
	 * Rebuilds a tree bottom-up, replacing pipelines with their resolution.
	 * A copying desugarer also recreates the leaves instead of reusing them.
	 */
	private static final class Desugarer implements SyntaxVisitor<SyntaxNode> {

		private final boolean copy;

		private Desugarer(boolean copy) {
			this.copy = copy;
		}

		private SyntaxNode rebuild(SyntaxNode node) {
			return node == null ? null : node.accept(this);
		}

		private List<SyntaxNode> rebuildAll(List<SyntaxNode> nodes) {
			List<SyntaxNode> result = new ArrayList<SyntaxNode>(nodes.size());
			for (SyntaxNode node : nodes) {
				result.add(rebuild(node));
			}
			return result;
		}

		@Override
		public SyntaxNode visitProgram(Program node) {
			return new Program(rebuildAll(node.getStatements()), node.getSpan());
		}

		@Override
		public SyntaxNode visitAssignment(Assignment node) {
			return new Assignment(node.getName(), rebuild(node.getValue()), node.getSpan());
		}

		@Override
		public SyntaxNode visitIdentifier(Identifier node) {
			return copy ? new Identifier(node.getName(), node.isOperator(), node.getSpan()) : node;
		}

		@Override
		public SyntaxNode visitWildcardAccess(WildcardAccess node) {
			return copy ? new WildcardAccess(node.getPath(), node.getSpan()) : node;
		}

		@Override
		public SyntaxNode visitFieldAccess(FieldAccess node) {
			return new FieldAccess(rebuild(node.getTarget()), node.getField(), node.getSpan());
		}

		@Override
		public SyntaxNode visitNumberLiteral(NumberLiteral node) {
			return copy ? new NumberLiteral(node.getText(), node.getSpan()) : node;
		}

		@Override
		public SyntaxNode visitStringLiteral(StringLiteral node) {
			if (!node.isInterpolated()) {
				return copy ? new StringLiteral(node.getSegments(), node.getSpan()) : node;
			}
			List<StringLiteral.Segment> segments = new ArrayList<StringLiteral.Segment>();
			for (StringLiteral.Segment segment : node.getSegments()) {
				segments.add(segment.isLiteral() ? segment : StringLiteral.Segment.embedded(rebuild(segment.getExpression())));
			}
			return new StringLiteral(segments, node.getSpan());
		}

		@Override
		public SyntaxNode visitBoolLiteral(BoolLiteral node) {
			return copy ? new BoolLiteral(node.getValue(), node.getSpan()) : node;
		}

		@Override
		public SyntaxNode visitNilLiteral(NilLiteral node) {
			return copy ? new NilLiteral(node.getSpan()) : node;
		}

		@Override
		public SyntaxNode visitRecordLiteral(RecordLiteral node) {
			List<RecordLiteral.Field> fields = new ArrayList<RecordLiteral.Field>();
			for (RecordLiteral.Field field : node.getFields()) {
				fields.add(new RecordLiteral.Field(field.getKey(), rebuild(field.getValue()), field.getSpan()));
			}
			return new RecordLiteral(fields, node.getSpan());
		}

		@Override
		public SyntaxNode visitListLiteral(ListLiteral node) {
			return new ListLiteral(rebuildAll(node.getElements()), node.getSpan());
		}

		@Override
		public SyntaxNode visitFunctionDef(FunctionDef node) {
			return new FunctionDef(node.getParams(), rebuild(node.getBody()), node.getSpan());
		}

		@Override
		public SyntaxNode visitApplication(Application node) {
			return new Application(rebuild(node.getCallee()), rebuildAll(node.getArgs()), node.getSpan());
		}

		@Override
		public SyntaxNode visitPipeline(Pipeline node) {
			List<Application> stages = new ArrayList<Application>();
			for (Application stage : node.getStages()) {
				stages.add((Application) rebuild(stage));
			}
			return resolve(new Pipeline(rebuild(node.getSeed()), stages, node.getSpan()));
		}

		@Override
		public SyntaxNode visitLetBinding(LetBinding node) {
			List<LetBinding.Binding> bindings = new ArrayList<LetBinding.Binding>();
			for (LetBinding.Binding binding : node.getBindings()) {
				bindings.add(new LetBinding.Binding(binding.getName(), rebuild(binding.getValue()), binding.getSpan()));
			}
			return new LetBinding(bindings, rebuild(node.getBody()), node.getSpan());
		}

		@Override
		public SyntaxNode visitIfExpr(IfExpr node) {
			List<IfExpr.Branch> branches = new ArrayList<IfExpr.Branch>();
			for (IfExpr.Branch branch : node.getBranches()) {
				branches.add(new IfExpr.Branch(rebuild(branch.getCondition()), rebuild(branch.getResult())));
			}
			return new IfExpr(branches, rebuild(node.getElseExpr()), node.getSpan());
		}

		@Override
		public SyntaxNode visitMatchExpr(MatchExpr node) {
			List<MatchClause> clauses = new ArrayList<MatchClause>();
			for (MatchClause clause : node.getClauses()) {
				clauses.add((MatchClause) rebuild(clause));
			}
			return new MatchExpr(rebuild(node.getScrutinee()), clauses, node.getSpan());
		}

		@Override
		public SyntaxNode visitMatchClause(MatchClause node) {
			return new MatchClause(
					(Pattern) rebuild(node.getPattern()),
					rebuild(node.getGuard()),
					rebuild(node.getResult()),
					node.getSpan());
		}

		@Override
		public SyntaxNode visitRecordPattern(RecordPattern node) {
			if (!copy) {
				return node;
			}
			List<RecordPattern.FieldPattern> fields = new ArrayList<RecordPattern.FieldPattern>();
			for (RecordPattern.FieldPattern field : node.getFields()) {
				switch (field.getConstraint()) {
				case BIND:
					fields.add(RecordPattern.FieldPattern.bind(field.getField(), field.getBinding(), field.getSpan()));
					break;
				case LITERAL:
					fields.add(RecordPattern.FieldPattern.literal(field.getField(), rebuild(field.getLiteral()), field.getSpan()));
					break;
				default:
					fields.add(RecordPattern.FieldPattern.present(field.getField(), field.getSpan()));
				}
			}
			return new RecordPattern(fields, node.getSpan());
		}

		@Override
		public SyntaxNode visitCatchAllPattern(CatchAllPattern node) {
			return copy ? new CatchAllPattern(node.getSpelling(), node.getSpan()) : node;
		}

		@Override
		public SyntaxNode visitLiteralPattern(LiteralPattern node) {
			return copy ? new LiteralPattern(rebuild(node.getLiteral()), node.getSpan()) : node;
		}

		@Override
		public SyntaxNode visitGuardPattern(GuardPattern node) {
			return new GuardPattern(rebuild(node.getCondition()), node.getSpan());
		}

		@Override
		public SyntaxNode visitTryCatch(TryCatch node) {
			List<CatchClause> catches = new ArrayList<CatchClause>();
			for (CatchClause clause : node.getCatches()) {
				catches.add((CatchClause) rebuild(clause));
			}
			return new TryCatch(rebuild(node.getBody()), catches, node.getSpan());
		}

		@Override
		public SyntaxNode visitCatchClause(CatchClause node) {
			return new CatchClause(node.getErrorTag(), node.getBinding(), rebuild(node.getHandler()), node.getSpan());
		}

		@Override
		public SyntaxNode visitError(ErrorNode node) {
			return copy ? new ErrorNode(node.getDiagnostic(), node.getSpan()) : node;
		}
	}
}
