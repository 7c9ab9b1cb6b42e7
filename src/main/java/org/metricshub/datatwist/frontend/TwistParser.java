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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.metricshub.datatwist.frontend.ast.Application;
import org.metricshub.datatwist.frontend.ast.CatchClause;
import org.metricshub.datatwist.frontend.ast.Diagnostic;
import org.metricshub.datatwist.frontend.ast.DiagnosticKind;
import org.metricshub.datatwist.frontend.ast.FunctionDef;
import org.metricshub.datatwist.frontend.ast.IfExpr;
import org.metricshub.datatwist.frontend.ast.Identifier;
import org.metricshub.datatwist.frontend.ast.FieldAccess;
import org.metricshub.datatwist.frontend.ast.LetBinding;
import org.metricshub.datatwist.frontend.ast.LimitException;
import org.metricshub.datatwist.frontend.ast.ListLiteral;
import org.metricshub.datatwist.frontend.ast.MatchClause;
import org.metricshub.datatwist.frontend.ast.MatchExpr;
import org.metricshub.datatwist.frontend.ast.ParseException;
import org.metricshub.datatwist.frontend.ast.Pattern;
import org.metricshub.datatwist.frontend.ast.Pipeline;
import org.metricshub.datatwist.frontend.ast.Program;
import org.metricshub.datatwist.frontend.ast.RecordLiteral;
import org.metricshub.datatwist.frontend.ast.RecordPattern;
import org.metricshub.datatwist.frontend.ast.ScanException;
import org.metricshub.datatwist.frontend.ast.SourceSpan;
import org.metricshub.datatwist.frontend.ast.StringLiteral;
import org.metricshub.datatwist.frontend.ast.SyntaxException;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.frontend.ast.TryCatch;
import org.metricshub.datatwist.util.ParserSettings;
import org.metricshub.datatwist.util.TwistLogger;
import org.slf4j.Logger;

/**
 * Converts DataTwist source into a syntax tree.
 * <p>
 * The parser is a recursive descent parser that pulls tokens from a
 * {@link Scanner} on demand and asks an {@link IndentationTracker} how each
 * line break relates to the enclosing blocks. Layout is only classified
 * where the grammar can make use of it: between statements, at the start of
 * a pipeline stage block, before an indented expression, and inside
 * bracketed regions.
 * <p>
 * Each instance parses a single source.
 */
public class TwistParser {

	private static final Logger LOGGER = TwistLogger.getLogger(TwistParser.class);

	private static final Set<TokenType> PRIMARY_START = EnumSet.of(
			TokenType.IDENTIFIER,
			TokenType.NUMBER,
			TokenType.STRING,
			TokenType.TRUE,
			TokenType.FALSE,
			TokenType.NIL,
			TokenType.UNDERSCORE,
			TokenType.LPAREN,
			TokenType.LBRACE,
			TokenType.LBRACKET);

	private static final Set<TokenType> CLOSERS = EnumSet.of(TokenType.RPAREN, TokenType.RBRACE, TokenType.RBRACKET);

	/**
	 * Tokens of a string interpolation, already scanned.
	 */
	private static final class TokenList implements TokenSource {

		private final List<Token> tokens;
		private int next;

		TokenList(List<Token> tokens) {
			this.tokens = tokens;
		}

		@Override
		public Token next() {
			Token token = tokens.get(next);
			if (next < tokens.size() - 1) {
				next++;
			}
			return token;
		}
	}

	/**
	 * A bracketed construct whose content may continue on deeper lines.
	 * The first deeper line opens a frame that lasts until the line that
	 * brings the content back to where the construct started.
	 */
	private static final class Region {

		private final int baseDepth;
		private boolean framed;

		Region(int baseDepth) {
			this.baseDepth = baseDepth;
		}
	}

	private final ParserSettings settings;
	private final String sourceDescription;
	private final Scanner scanner;
	private final IndentationTracker tracker;
	private final TreeBuilder builder;
	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
	private final EnumSet<TokenType> expected = EnumSet.noneOf(TokenType.class);

	private TokenSource tokens;
	private List<Token> lookahead = new ArrayList<Token>();
	private Token previous;
	private int nesting;
	private boolean used;

	/**
	 * @param source text to parse
	 * @param sourceDescription name of the source, used in diagnostics
	 * @param settings parser settings, read but never modified
	 */
	public TwistParser(String source, String sourceDescription, ParserSettings settings) {
		this.settings = new ParserSettings(settings);
		this.sourceDescription = sourceDescription;
		this.scanner = new Scanner(source, sourceDescription);
		this.tracker = new IndentationTracker(this.settings.getMinimumIndentWidth(), sourceDescription);
		this.builder = new TreeBuilder(sourceDescription);
		this.tokens = scanner;
	}

	/**
	 * Parses the source with the entry rule of the settings.
	 *
	 * @return the syntax tree
	 * @throws ParseException when the source is invalid (and the parse is not best-effort)
	 */
	public SyntaxNode parse() {
		return parse(settings.getEntryRule());
	}

	/**
	 * Parses the whole source as the specified grammar rule.
	 * <p>
	 * Best-effort parsing only applies to {@link GrammarRule#PROGRAM}: the
	 * statements that fail are replaced with error nodes and their
	 * diagnostics are available from {@link #getDiagnostics()}.
	 *
	 * @param rule rule that must match the entire source
	 * @return the syntax tree
	 * @throws ParseException when the source is invalid
	 */
	public SyntaxNode parse(GrammarRule rule) {
		if (used) {
			throw new IllegalStateException("A parser instance parses a single source");
		}
		used = true;
		LOGGER.debug("Parsing {} as {}", sourceDescription, rule);

		SyntaxNode result;
		switch (rule) {
		case PROGRAM:
			return PROGRAM();
		case STATEMENT:
			result = STATEMENT();
			break;
		case EXPRESSION:
			result = EXPRESSION();
			break;
		case PIPELINE:
			result = EXPRESSION();
			if (!(result instanceof Pipeline)) {
				throw syntaxException("Expecting a pipeline", result.getSpan());
			}
			break;
		case MATCH:
			if (check(TokenType.MATCH)) {
				result = MATCH();
			} else if (check(TokenType.PIPE)) {
				result = IMPLICIT_MATCH();
			} else {
				throw syntaxException("Expecting a match expression, found " + describe(peek()));
			}
			break;
		case TRY_CATCH:
			if (!check(TokenType.TRY)) {
				throw syntaxException("Expecting 'try', found " + describe(peek()));
			}
			result = TRY_CATCH();
			break;
		case FUNCTION:
			if (!check(TokenType.LBRACKET)) {
				throw syntaxException("Expecting a function literal, found " + describe(peek()));
			}
			result = LIST_OR_FUNCTION();
			if (!(result instanceof FunctionDef)) {
				throw syntaxException("Expecting a function literal", result.getSpan());
			}
			break;
		case RECORD:
			if (!check(TokenType.LBRACE)) {
				throw syntaxException("Expecting a record, found " + describe(peek()));
			}
			result = RECORD();
			break;
		case LIST:
			if (!check(TokenType.LBRACKET)) {
				throw syntaxException("Expecting a list, found " + describe(peek()));
			}
			result = LIST_OR_FUNCTION();
			if (!(result instanceof ListLiteral)) {
				throw syntaxException("Expecting a list", result.getSpan());
			}
			break;
		case PATTERN:
			result = PATTERN();
			break;
		default:
			throw new IllegalArgumentException("Unsupported grammar rule: " + rule);
		}
		consume(TokenType.EOF, "end of input");
		return result;
	}

	/**
	 * @return the diagnostics collected by a best-effort parse
	 */
	public List<Diagnostic> getDiagnostics() {
		return new ArrayList<Diagnostic>(diagnostics);
	}

	// TOKENS

	private Token peek() {
		return peek(0);
	}

	private Token peek(int k) {
		while (lookahead.size() <= k) {
			lookahead.add(tokens.next());
		}
		return lookahead.get(k);
	}

	private TokenType type() {
		return peek(0).getType();
	}

	private TokenType type(int k) {
		return peek(k).getType();
	}

	private Token advance() {
		previous = peek();
		if (previous.getType() != TokenType.EOF) {
			lookahead.remove(0);
		}
		expected.clear();
		return previous;
	}

	/**
	 * Tests the current token, remembering the type for the error message of
	 * a failure at this position.
	 */
	private boolean check(TokenType t) {
		expected.add(t);
		return type() == t;
	}

	private boolean match(TokenType t) {
		if (check(t)) {
			advance();
			return true;
		}
		return false;
	}

	private Token consume(TokenType t, String what) {
		if (check(t)) {
			return advance();
		}
		throw syntaxException("Expecting " + what + ", found " + describe(peek()));
	}

	private static String describe(Token token) {
		switch (token.getType()) {
		case EOF:
		case NEWLINE:
			return token.getType().getDisplayName();
		default:
			return "'" + token.getText() + "'";
		}
	}

	private boolean isPipelineOperation(Token token) {
		return token.getType() == TokenType.IDENTIFIER && settings.isPipelineOperation(token.getText());
	}

	private void enter() {
		if (++nesting > settings.getMaxNestingDepth()) {
			throw new LimitException(
					new Diagnostic(
							DiagnosticKind.LIMIT,
							sourceDescription,
							peek().getSpan(),
							null,
							"Nesting deeper than " + settings.getMaxNestingDepth() + " levels"));
		}
	}

	private void leave() {
		nesting--;
	}

	private SyntaxException syntaxException(String reason) {
		return syntaxException(reason, peek().getSpan());
	}

	private SyntaxException syntaxException(String reason, SourceSpan span) {
		return new SyntaxException(new Diagnostic(DiagnosticKind.SYNTAX, sourceDescription, span, expected, reason));
	}

	// LAYOUT

	private Region region() {
		return new Region(tracker.depth());
	}

	/**
	 * Skips the line breaks inside a bracketed construct, opening its frame
	 * on the first deeper line and closing it when a line comes back to the
	 * depth where the construct started.
	 */
	private void skipLayout(Region region) {
		while (type() == TokenType.NEWLINE) {
			Token newline = peek();
			IndentationTracker.Layout layout = tracker.classify(newline);
			if (layout.isSame()) {
				advance();
			} else if (layout.isIndent()) {
				if (!region.framed) {
					tracker.push(newline.getText(), newline.getSpan().getLine());
					region.framed = true;
				} else if (!CLOSERS.contains(type(1))) {
					throw syntaxException("Unexpected indentation");
				}
				advance();
			} else if (region.framed && layout.getTargetDepth() == region.baseDepth) {
				tracker.popTo(region.baseDepth);
				region.framed = false;
				advance();
			} else {
				throw syntaxException("Unexpected dedent");
			}
		}
	}

	private void closeRegion(Region region) {
		if (region.framed) {
			tracker.popTo(region.baseDepth);
			region.framed = false;
		}
	}

	/**
	 * Lets an infix operator continue its expression on a deeper line.
	 */
	private void continuationLine() {
		if (type() == TokenType.NEWLINE && tracker.classify(peek()).isIndent()) {
			advance();
		}
	}

	// INDENTED_EXPRESSION : NEWLINE(indent) EXPRESSION | EXPRESSION
	private SyntaxNode INDENTED_EXPRESSION() {
		if (type() == TokenType.NEWLINE) {
			Token newline = peek();
			if (tracker.classify(newline).isIndent()) {
				int depth = tracker.depth();
				tracker.push(newline.getText(), newline.getSpan().getLine());
				advance();
				SyntaxNode expression = EXPRESSION();
				tracker.popTo(depth);
				return expression;
			}
		}
		return EXPRESSION();
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : [STATEMENT (NEWLINE STATEMENT)*] EOF
	private Program PROGRAM() {
		List<SyntaxNode> statements = new ArrayList<SyntaxNode>();
		while (true) {
			Token statementStart = null;
			try {
				while (type() == TokenType.NEWLINE) {
					if (!tracker.classify(peek()).isSame()) {
						throw syntaxException("Unexpected indentation");
					}
					advance();
				}
				if (type() == TokenType.EOF) {
					break;
				}
				statementStart = peek();
				statements.add(STATEMENT());
				if (!check(TokenType.NEWLINE) && !check(TokenType.EOF)) {
					throw syntaxException("Expecting a line break after the statement, found " + describe(peek()));
				}
			} catch (ParseException e) {
				if (!settings.isBestEffort()) {
					throw e;
				}
				Diagnostic diagnostic = e.getDiagnostic();
				diagnostics.add(diagnostic);
				statements.add(builder.error(diagnostic));
				LOGGER.debug("Recovering from {}", diagnostic);
				if (!recover(e, statementStart)) {
					break;
				}
			}
		}
		return builder.program(statements);
	}

	/**
	 * Moves past the statement that failed, to the next line that can start a
	 * statement. The search starts on the line after the first token of the
	 * statement, whatever the bracket or block the parser failed in, so an
	 * unclosed bracket does not swallow the statements that follow it.
	 *
	 * @param statementStart first token of the failed statement, {@code null}
	 *        if the failure happened before the statement started
	 * @return {@code false} if nothing is left to parse
	 */
	private boolean recover(ParseException e, Token statementStart) {
		boolean resumed;
		if (statementStart != null) {
			resumed = scanner.resyncAfter(statementStart);
		} else if (e instanceof ScanException && scanner.hasFailure()) {
			resumed = scanner.resyncAfterFailure();
		} else if (!lookahead.isEmpty()) {
			resumed = scanner.resyncAfter(lookahead.get(0));
		} else {
			resumed = scanner.resyncAfterFailure();
		}
		tokens = scanner;
		lookahead.clear();
		tracker.reset();
		expected.clear();
		nesting = 0;
		return resumed;
	}

	// STATEMENT : IDENTIFIER '=' INDENTED_EXPRESSION | EXPRESSION
	private SyntaxNode STATEMENT() {
		if (type() == TokenType.IDENTIFIER && type(1) == TokenType.EQUALS) {
			Token name = advance();
			advance();
			return builder.assignment(name, INDENTED_EXPRESSION());
		}
		return EXPRESSION();
	}

	// EXPRESSION : OPERATION [STAGES]
	private SyntaxNode EXPRESSION() {
		return PIPELINE_TAIL(OPERATION(Operator.LOWEST, true));
	}

	// OPERATION : OPERAND (operator [NEWLINE(indent)] OPERAND)*
	private SyntaxNode OPERATION(int minPrecedence, boolean juxtaposition) {
		return OPERATION_REST(OPERAND(juxtaposition), minPrecedence, juxtaposition);
	}

	private SyntaxNode OPERATION_REST(SyntaxNode left, int minPrecedence, boolean juxtaposition) {
		int folds = 0;
		try {
			while (true) {
				Operator operator = Operator.of(type());
				if (operator == null || operator.getPrecedence() < minPrecedence) {
					return left;
				}
				if (!juxtaposition && operator == Operator.MINUS && isDetachedNegativeNumber()) {
					// next list element
					return left;
				}
				Token symbol = advance();
				// each fold deepens the left spine of the tree
				enter();
				folds++;
				continuationLine();
				SyntaxNode right = OPERATION(operator.getPrecedence() + 1, juxtaposition);
				left = builder.binary(operator, symbol, left, right);
			}
		} finally {
			nesting -= folds;
		}
	}

	// OPERAND : LET | IF | MATCH | TRY_CATCH | IMPLICIT_MATCH | '-' NUMBER | PRIMARY [ARGUMENTS]
	private SyntaxNode OPERAND(boolean juxtaposition) {
		enter();
		try {
			switch (type()) {
			case LET:
				return LET();
			case IF:
				return IF();
			case MATCH:
				return MATCH();
			case TRY:
				return TRY_CATCH();
			case PIPE:
				return IMPLICIT_MATCH();
			case MINUS:
				if (isNegativeNumber()) {
					Token minus = advance();
					return builder.negativeNumber(minus, advance());
				}
				break;
			default:
				break;
			}
			SyntaxNode primary = PRIMARY();
			if (juxtaposition && isApplicationHead(primary)) {
				List<SyntaxNode> args = ARGUMENTS();
				if (!args.isEmpty()) {
					return builder.application(primary, args);
				}
			}
			return primary;
		} finally {
			leave();
		}
	}

	private boolean isNegativeNumber() {
		return type() == TokenType.MINUS && type(1) == TokenType.NUMBER && peek().isAdjacentTo(peek(1));
	}

	/**
	 * {@code -N} separated from the previous token by whitespace, as in
	 * {@code f -1} or {@code [1 -2]}: a negative argument or element, not a
	 * subtraction.
	 */
	private boolean isDetachedNegativeNumber() {
		return isNegativeNumber() && previous != null && !previous.isAdjacentTo(peek());
	}

	private static boolean isApplicationHead(SyntaxNode node) {
		return (node instanceof Identifier && !((Identifier) node).isOperator()) || node instanceof FieldAccess;
	}

	// ARGUMENTS : (PRIMARY | detached '-' NUMBER)*
	private List<SyntaxNode> ARGUMENTS() {
		List<SyntaxNode> args = new ArrayList<SyntaxNode>();
		while (true) {
			if (isDetachedNegativeNumber()) {
				Token minus = advance();
				args.add(builder.negativeNumber(minus, advance()));
			} else if (startsArgument()) {
				args.add(PRIMARY());
			} else {
				return args;
			}
		}
	}

	private boolean startsArgument() {
		switch (type()) {
		case IDENTIFIER:
			return !isPipelineOperation(peek()) && type(1) != TokenType.COLON;
		case NUMBER:
		case STRING:
		case TRUE:
		case FALSE:
		case NIL:
		case UNDERSCORE:
		case LPAREN:
		case LBRACE:
		case LBRACKET:
			return true;
		default:
			return false;
		}
	}

	// PRIMARY : (IDENTIFIER | NUMBER | STRING | 'true' | 'false' | 'nil' | WILDCARD | GROUP | RECORD | LIST_OR_FUNCTION) ('.' IDENTIFIER)*
	private SyntaxNode PRIMARY() {
		SyntaxNode node;
		switch (type()) {
		case IDENTIFIER:
			node = builder.identifier(advance());
			break;
		case NUMBER:
			node = builder.number(advance());
			break;
		case STRING:
			node = STRING(advance());
			break;
		case TRUE:
		case FALSE:
			node = builder.bool(advance());
			break;
		case NIL:
			node = builder.nil(advance());
			break;
		case UNDERSCORE:
			node = WILDCARD();
			break;
		case LPAREN:
			node = GROUP();
			break;
		case LBRACE:
			node = RECORD();
			break;
		case LBRACKET:
			node = LIST_OR_FUNCTION();
			break;
		default:
			expected.addAll(PRIMARY_START);
			throw syntaxException("Expecting an expression, found " + describe(peek()));
		}
		int folds = 0;
		try {
			while (type() == TokenType.DOT) {
				advance();
				enter();
				folds++;
				node = builder.fieldAccess(node, consume(TokenType.IDENTIFIER, "a field name"));
			}
		} finally {
			nesting -= folds;
		}
		return node;
	}

	// WILDCARD : '_' ('.' IDENTIFIER)*
	private SyntaxNode WILDCARD() {
		Token underscore = advance();
		List<Token> fields = new ArrayList<Token>();
		while (type() == TokenType.DOT) {
			advance();
			fields.add(consume(TokenType.IDENTIFIER, "a field name"));
		}
		return builder.wildcard(underscore, fields);
	}

	// STRING : literal and embedded segments; each embedded segment is an EXPRESSION
	private StringLiteral STRING(Token string) {
		List<StringLiteral.Segment> segments = new ArrayList<StringLiteral.Segment>();
		for (Token.Segment segment : string.getSegments()) {
			if (segment.isLiteral()) {
				segments.add(StringLiteral.Segment.literal(segment.getText()));
			} else {
				segments.add(StringLiteral.Segment.embedded(INTERPOLATION(segment)));
			}
		}
		return builder.string(string, segments);
	}

	private SyntaxNode INTERPOLATION(Token.Segment segment) {
		if (segment.getTokens().size() == 1) {
			throw syntaxException("Empty string interpolation", segment.getSpan());
		}
		TokenSource savedTokens = tokens;
		List<Token> savedLookahead = lookahead;
		tokens = new TokenList(segment.getTokens());
		lookahead = new ArrayList<Token>();
		try {
			SyntaxNode expression = EXPRESSION();
			if (!check(TokenType.EOF)) {
				throw syntaxException("Expecting '}' to close the interpolation, found " + describe(peek()));
			}
			return expression;
		} finally {
			tokens = savedTokens;
			lookahead = savedLookahead;
		}
	}

	// GROUP : '(' EXPRESSION ')'
	private SyntaxNode GROUP() {
		advance();
		Region region = region();
		skipLayout(region);
		SyntaxNode expression = EXPRESSION();
		skipLayout(region);
		consume(TokenType.RPAREN, "')'");
		closeRegion(region);
		return expression;
	}

	// RECORD : '{' (KEY ':' INDENTED_EXPRESSION)* '}'
	private RecordLiteral RECORD() {
		Token open = advance();
		Region region = region();
		List<RecordLiteral.Field> fields = new ArrayList<RecordLiteral.Field>();
		skipLayout(region);
		while (!check(TokenType.RBRACE)) {
			Token key = peek();
			String name = KEY();
			consume(TokenType.COLON, "':'");
			SyntaxNode value = INDENTED_EXPRESSION();
			fields.add(builder.field(key, name, value));
			if (type() == TokenType.COMMA) {
				throw syntaxException("Record fields are separated by spaces or line breaks, not commas");
			}
			skipLayout(region);
		}
		Token close = advance();
		closeRegion(region);
		return builder.record(open, fields, close);
	}

	// KEY : IDENTIFIER | STRING (without interpolation)
	private String KEY() {
		if (check(TokenType.IDENTIFIER)) {
			return advance().getText();
		}
		if (check(TokenType.STRING)) {
			Token string = advance();
			StringBuilder text = new StringBuilder();
			for (Token.Segment segment : string.getSegments()) {
				if (!segment.isLiteral()) {
					throw syntaxException("A record key cannot be an interpolated string", string.getSpan());
				}
				text.append(segment.getText());
			}
			return text.toString();
		}
		throw syntaxException("Expecting a field name, found " + describe(peek()));
	}

	// LIST_OR_FUNCTION : '[' IDENTIFIER+ '->' INDENTED_EXPRESSION ']' | '[' ELEMENT* ']'
	private SyntaxNode LIST_OR_FUNCTION() {
		if (type(1) == TokenType.ARROW) {
			throw syntaxException("Function literal has an empty parameter list", peek(1).getSpan());
		}
		int k = 1;
		while (type(k) == TokenType.IDENTIFIER) {
			k++;
		}
		if (k > 1 && type(k) == TokenType.ARROW) {
			return FUNCTION();
		}
		return LIST();
	}

	private FunctionDef FUNCTION() {
		Token open = advance();
		Region region = region();
		List<Token> params = new ArrayList<Token>();
		while (type() == TokenType.IDENTIFIER) {
			params.add(advance());
		}
		consume(TokenType.ARROW, "'->'");
		SyntaxNode body = INDENTED_EXPRESSION();
		skipLayout(region);
		Token close = consume(TokenType.RBRACKET, "']'");
		closeRegion(region);
		return builder.function(open, params, body, close);
	}

	// ELEMENT : OPERATION(without juxtaposition) [STAGES]
	private ListLiteral LIST() {
		Token open = advance();
		Region region = region();
		List<SyntaxNode> elements = new ArrayList<SyntaxNode>();
		skipLayout(region);
		while (!check(TokenType.RBRACKET)) {
			elements.add(PIPELINE_TAIL(OPERATION(Operator.LOWEST, false)));
			if (type() == TokenType.COMMA) {
				throw syntaxException("List elements are separated by spaces or line breaks, not commas");
			}
			skipLayout(region);
		}
		Token close = advance();
		closeRegion(region);
		return builder.list(open, elements, close);
	}

	// STAGES : STAGE* [NEWLINE(indent) STAGE* (NEWLINE(same) STAGE*)*]
	private SyntaxNode PIPELINE_TAIL(SyntaxNode seed) {
		List<Application> stages = new ArrayList<Application>();
		try {
			while (isPipelineOperation(peek()) && type(1) != TokenType.COLON) {
				addStage(stages);
			}
			if (startsStageBlock()) {
				int depth = tracker.depth();
				Token newline = advance();
				tracker.push(newline.getText(), newline.getSpan().getLine());
				while (true) {
					addStage(stages);
					while (isPipelineOperation(peek()) && type(1) != TokenType.COLON) {
						addStage(stages);
					}
					if (type() != TokenType.NEWLINE || type(1) != TokenType.IDENTIFIER) {
						break;
					}
					IndentationTracker.Layout layout = tracker.classify(peek());
					if (layout.isSame()) {
						advance();
					} else if (layout.isIndent()) {
						throw syntaxException("Unexpected indentation inside a pipeline");
					} else {
						break;
					}
				}
				tracker.popTo(depth);
			}
		} finally {
			nesting -= stages.size();
		}
		return stages.isEmpty() ? seed : builder.pipeline(seed, stages);
	}

	/**
	 * Parses one more stage. Stages count toward the nesting limit, as the
	 * resolved pipeline nests one application per stage.
	 */
	private void addStage(List<Application> stages) {
		enter();
		stages.add(STAGE());
	}

	private boolean startsStageBlock() {
		return type() == TokenType.NEWLINE
				&& type(1) == TokenType.IDENTIFIER
				&& type(2) != TokenType.COLON
				&& type(2) != TokenType.EQUALS
				&& tracker.classify(peek()).isIndent();
	}

	// STAGE : IDENTIFIER ARGUMENTS, the last argument taking any trailing operators
	private Application STAGE() {
		Token head = consume(TokenType.IDENTIFIER, "a pipeline operation");
		Identifier operation = builder.identifier(head);
		List<SyntaxNode> args = ARGUMENTS();
		if (Operator.of(type()) != null) {
			if (args.isEmpty()) {
				throw syntaxException("Operator after pipeline operation '" + head.getText() + "' without arguments");
			}
			int last = args.size() - 1;
			args.set(last, OPERATION_REST(args.get(last), Operator.LOWEST, true));
		}
		return builder.application(operation, args);
	}

	// LET : 'let' BINDING ((',' | NEWLINE) BINDING)* 'in' INDENTED_EXPRESSION
	private LetBinding LET() {
		Token let = advance();
		Region region = region();
		List<LetBinding.Binding> bindings = new ArrayList<LetBinding.Binding>();
		while (true) {
			skipLayout(region);
			Token name = consume(TokenType.IDENTIFIER, "a binding name");
			consume(TokenType.EQUALS, "'='");
			bindings.add(builder.binding(name, INDENTED_EXPRESSION()));
			boolean lineBreak = type() == TokenType.NEWLINE;
			skipLayout(region);
			if (match(TokenType.COMMA)) {
				continue;
			}
			if (check(TokenType.IN)) {
				break;
			}
			if (lineBreak && type() == TokenType.IDENTIFIER) {
				continue;
			}
			throw syntaxException("Expecting ',' or 'in' after the binding, found " + describe(peek()));
		}
		consume(TokenType.IN, "'in'");
		SyntaxNode body = INDENTED_EXPRESSION();
		closeRegion(region);
		return builder.let(let, bindings, body);
	}

	// IF : 'if' EXPRESSION 'then' INDENTED_EXPRESSION 'else' ('if' ... | INDENTED_EXPRESSION)
	private IfExpr IF() {
		Token ifToken = advance();
		Region region = region();
		List<IfExpr.Branch> branches = new ArrayList<IfExpr.Branch>();
		SyntaxNode elseExpr;
		while (true) {
			skipLayout(region);
			SyntaxNode condition = EXPRESSION();
			skipLayout(region);
			consume(TokenType.THEN, "'then'");
			SyntaxNode result = INDENTED_EXPRESSION();
			branches.add(new IfExpr.Branch(condition, result));
			skipLayout(region);
			consume(TokenType.ELSE, "'else'");
			if (match(TokenType.IF)) {
				continue;
			}
			elseExpr = INDENTED_EXPRESSION();
			break;
		}
		closeRegion(region);
		return builder.ifExpr(ifToken, branches, elseExpr);
	}

	// MATCH : 'match' EXPRESSION CLAUSES
	private MatchExpr MATCH() {
		Token match = advance();
		SyntaxNode scrutinee = EXPRESSION();
		return builder.match(match, scrutinee, CLAUSES());
	}

	// IMPLICIT_MATCH : CLAUSES
	private MatchExpr IMPLICIT_MATCH() {
		return builder.implicitMatch(CLAUSES());
	}

	// CLAUSES : [NEWLINE] CLAUSE ([NEWLINE(same)] CLAUSE)*
	private List<MatchClause> CLAUSES() {
		int depth = tracker.depth();
		boolean pushed = false;
		if (type() == TokenType.NEWLINE && type(1) == TokenType.PIPE) {
			Token newline = peek();
			IndentationTracker.Layout layout = tracker.classify(newline);
			if (layout.isIndent()) {
				tracker.push(newline.getText(), newline.getSpan().getLine());
				pushed = true;
				advance();
			} else if (layout.isSame()) {
				advance();
			}
		}
		if (!check(TokenType.PIPE)) {
			throw syntaxException("Expecting a match clause, found " + describe(peek()));
		}
		List<MatchClause> clauses = new ArrayList<MatchClause>();
		while (true) {
			clauses.add(CLAUSE());
			if (type() == TokenType.PIPE) {
				continue;
			}
			if (type() == TokenType.NEWLINE && type(1) == TokenType.PIPE && tracker.classify(peek()).isSame()) {
				advance();
				continue;
			}
			break;
		}
		if (pushed) {
			tracker.popTo(depth);
		}
		return clauses;
	}

	// CLAUSE : '|' PATTERN ['when' EXPRESSION] '->' INDENTED_EXPRESSION
	private MatchClause CLAUSE() {
		Token bar = consume(TokenType.PIPE, "'|'");
		Pattern pattern = PATTERN();
		SyntaxNode guard = null;
		if (match(TokenType.WHEN)) {
			guard = EXPRESSION();
		}
		consume(TokenType.ARROW, "'->'");
		SyntaxNode result = INDENTED_EXPRESSION();
		return builder.clause(bar, pattern, guard, result);
	}

	// PATTERN : '_' | 'otherwise' | RECORD_PATTERN | LITERAL | EXPRESSION
	private Pattern PATTERN() {
		if (check(TokenType.OTHERWISE)) {
			return builder.catchAll(advance());
		}
		if (check(TokenType.UNDERSCORE) && endsPattern(type(1))) {
			return builder.catchAll(advance());
		}
		if (check(TokenType.LBRACE)) {
			return RECORD_PATTERN();
		}
		if (isNegativeNumber() && endsPattern(type(2))) {
			return builder.literalPattern(LITERAL());
		}
		if (isLiteralStart(type()) && endsPattern(type(1))) {
			return builder.literalPattern(LITERAL());
		}
		return builder.guardPattern(EXPRESSION());
	}

	private static boolean endsPattern(TokenType t) {
		return t == TokenType.ARROW || t == TokenType.WHEN || t == TokenType.EOF;
	}

	private static boolean isLiteralStart(TokenType t) {
		switch (t) {
		case NUMBER:
		case STRING:
		case TRUE:
		case FALSE:
		case NIL:
			return true;
		default:
			return false;
		}
	}

	// LITERAL : ['-'] NUMBER | STRING | 'true' | 'false' | 'nil'
	private SyntaxNode LITERAL() {
		if (isNegativeNumber()) {
			Token minus = advance();
			return builder.negativeNumber(minus, advance());
		}
		switch (type()) {
		case NUMBER:
			return builder.number(advance());
		case STRING:
			return STRING(advance());
		case TRUE:
		case FALSE:
			return builder.bool(advance());
		case NIL:
			return builder.nil(advance());
		default:
			throw syntaxException("Expecting a literal, found " + describe(peek()));
		}
	}

	// RECORD_PATTERN : '{' (FIELD [':' (IDENTIFIER | LITERAL | '_')])* '}'
	private RecordPattern RECORD_PATTERN() {
		Token open = advance();
		Region region = region();
		List<RecordPattern.FieldPattern> fields = new ArrayList<RecordPattern.FieldPattern>();
		skipLayout(region);
		while (!check(TokenType.RBRACE)) {
			Token start = peek();
			boolean quoted = start.getType() == TokenType.STRING;
			String field = KEY();
			if (match(TokenType.COLON)) {
				if (type() == TokenType.UNDERSCORE) {
					advance();
					fields.add(RecordPattern.FieldPattern.present(field, start.getSpan().to(previous.getSpan())));
				} else if (type() == TokenType.IDENTIFIER) {
					Token binding = advance();
					fields.add(RecordPattern.FieldPattern.bind(field, binding.getText(), start.getSpan().to(binding.getSpan())));
				} else if (isLiteralStart(type()) || isNegativeNumber()) {
					SyntaxNode literal = LITERAL();
					fields.add(RecordPattern.FieldPattern.literal(field, literal, start.getSpan().to(literal.getSpan())));
				} else {
					expected.add(TokenType.IDENTIFIER);
					expected.add(TokenType.UNDERSCORE);
					throw syntaxException("Expecting a binding, a literal or '_', found " + describe(peek()));
				}
			} else if (quoted) {
				throw syntaxException("Expecting ':' after a quoted field name, found " + describe(peek()));
			} else {
				fields.add(RecordPattern.FieldPattern.bind(field, field, start.getSpan()));
			}
			if (type() == TokenType.COMMA) {
				throw syntaxException("Record pattern fields are separated by spaces or line breaks, not commas");
			}
			skipLayout(region);
		}
		Token close = advance();
		closeRegion(region);
		return builder.recordPattern(open, fields, close);
	}

	// TRY_CATCH : 'try' INDENTED_EXPRESSION CATCH_CLAUSE+
	private TryCatch TRY_CATCH() {
		Token tryToken = advance();
		SyntaxNode body = INDENTED_EXPRESSION();
		int depth = tracker.depth();
		boolean pushed = false;
		if (type() == TokenType.NEWLINE && type(1) == TokenType.CATCH) {
			Token newline = peek();
			IndentationTracker.Layout layout = tracker.classify(newline);
			if (layout.isIndent()) {
				tracker.push(newline.getText(), newline.getSpan().getLine());
				pushed = true;
				advance();
			} else if (layout.isSame()) {
				advance();
			}
		}
		if (!check(TokenType.CATCH)) {
			throw syntaxException("Expecting 'catch', found " + describe(peek()));
		}
		List<CatchClause> catches = new ArrayList<CatchClause>();
		while (true) {
			catches.add(CATCH_CLAUSE());
			if (type() == TokenType.CATCH) {
				continue;
			}
			if (type() == TokenType.NEWLINE && type(1) == TokenType.CATCH && tracker.classify(peek()).isSame()) {
				advance();
				continue;
			}
			break;
		}
		if (pushed) {
			tracker.popTo(depth);
		}
		return builder.tryCatch(tryToken, body, catches);
	}

	// CATCH_CLAUSE : 'catch' [ErrorTag] [binding] '->' INDENTED_EXPRESSION
	private CatchClause CATCH_CLAUSE() {
		Token catchToken = consume(TokenType.CATCH, "'catch'");
		Token tag = null;
		Token binding = null;
		if (type() == TokenType.IDENTIFIER) {
			Token first = advance();
			if (isErrorTag(first)) {
				tag = first;
				if (type() == TokenType.IDENTIFIER) {
					Token second = advance();
					if (isErrorTag(second)) {
						throw syntaxException("A catch clause takes a single error tag", second.getSpan());
					}
					binding = second;
				}
			} else {
				binding = first;
				if (type() == TokenType.IDENTIFIER) {
					throw syntaxException("The error tag of a catch clause must come before the binding");
				}
			}
		}
		if (tag == null && binding == null) {
			expected.add(TokenType.IDENTIFIER);
			throw syntaxException("A catch clause requires an error tag or a binding");
		}
		consume(TokenType.ARROW, "'->'");
		SyntaxNode handler = INDENTED_EXPRESSION();
		return builder.catchClause(catchToken, tag, binding, handler);
	}

	private static boolean isErrorTag(Token identifier) {
		return Character.isUpperCase(identifier.getText().charAt(0));
	}
	// CHECKSTYLE.ON: MethodName
}
