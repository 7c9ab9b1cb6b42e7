package org.metricshub.datatwist;

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

import java.io.IOException;
import java.util.Collections;
import org.metricshub.datatwist.frontend.GrammarRule;
import org.metricshub.datatwist.frontend.PipelineResolver;
import org.metricshub.datatwist.frontend.SyntaxPrinter;
import org.metricshub.datatwist.frontend.SyntaxTreeDumper;
import org.metricshub.datatwist.frontend.TwistParser;
import org.metricshub.datatwist.frontend.ast.ParseException;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.util.ParserSettings;
import org.metricshub.datatwist.util.ScriptSource;
import org.metricshub.datatwist.util.TwistLogger;
import org.slf4j.Logger;

/**
 * Entry point of the DataTwist front end.
 * <p>
 * An instance holds a copy of the settings it was created with and no other
 * state: it can parse any number of sources, from several threads.
 *
 * <pre>
 * DataTwist twist = new DataTwist();
 * ParseResult result = twist.parse("users\n  filter _.age &gt; 18\n  map _.name");
 * if (result.isSuccess()) {
 *     System.out.println(twist.dump(result.getTree()));
 * }
 * </pre>
 */
public class DataTwist {

	private static final Logger LOGGER = TwistLogger.getLogger(DataTwist.class);

	private final ParserSettings settings;

	/**
	 * Create a new instance with the default settings
	 */
	public DataTwist() {
		this(new ParserSettings());
	}

	/**
	 * Create a new instance with the specified settings. Later changes to
	 * {@code settings} do not affect this instance.
	 *
	 * @param settings parser settings
	 */
	public DataTwist(ParserSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings must not be null");
		}
		this.settings = new ParserSettings(settings);
	}

	/**
	 * @return a copy of the settings of this instance
	 */
	public ParserSettings getSettings() {
		return new ParserSettings(settings);
	}

	/**
	 * Parses inline source with the entry rule of the settings.
	 *
	 * @param source DataTwist source
	 * @return the tree, or the diagnostics of the failure
	 */
	public ParseResult parse(String source) {
		return parse(source, ScriptSource.DESCRIPTION_INLINE_SCRIPT, settings.getEntryRule());
	}

	/**
	 * Parses inline source as the specified grammar rule.
	 *
	 * @param source DataTwist source
	 * @param rule rule that must match the whole source
	 * @return the tree, or the diagnostics of the failure
	 */
	public ParseResult parse(String source, GrammarRule rule) {
		return parse(source, ScriptSource.DESCRIPTION_INLINE_SCRIPT, rule);
	}

	/**
	 * Reads and parses a script.
	 *
	 * @param script the script to parse
	 * @return the tree, or the diagnostics of the failure
	 * @throws IOException if the script cannot be read
	 */
	public ParseResult parse(ScriptSource script) throws IOException {
		return parse(script.readFully(), script.getDescription(), settings.getEntryRule());
	}

	private ParseResult parse(String source, String description, GrammarRule rule) {
		TwistParser parser = new TwistParser(source, description, settings);
		try {
			SyntaxNode tree = parser.parse(rule);
			ParseResult result = new ParseResult(tree, parser.getDiagnostics());
			LOGGER.debug("Parsed {}: {}", description, result);
			return result;
		} catch (ParseException e) {
			LOGGER.debug("Failed to parse {}: {}", description, e.getMessage());
			return new ParseResult(null, Collections.singletonList(e.getDiagnostic()));
		}
	}

	/**
	 * Parses inline source with the entry rule of the settings, failing on
	 * the first error even when the settings ask for best-effort parsing.
	 *
	 * @param source DataTwist source
	 * @return the syntax tree
	 * @throws ParseException when the source is invalid
	 */
	public SyntaxNode parseOrThrow(String source) {
		return parseOrThrow(source, settings.getEntryRule());
	}

	/**
	 * Same as {@link #parseOrThrow(String)}, for the specified grammar rule.
	 *
	 * @param source DataTwist source
	 * @param rule rule that must match the whole source
	 * @return the syntax tree
	 * @throws ParseException when the source is invalid
	 */
	public SyntaxNode parseOrThrow(String source, GrammarRule rule) {
		return strictParser(source, ScriptSource.DESCRIPTION_INLINE_SCRIPT).parse(rule);
	}

	/**
	 * Same as {@link #parseOrThrow(String)}, for a script.
	 *
	 * @param script the script to parse
	 * @return the syntax tree
	 * @throws IOException if the script cannot be read
	 * @throws ParseException when the script is invalid
	 */
	public SyntaxNode parseOrThrow(ScriptSource script) throws IOException {
		return strictParser(script.readFully(), script.getDescription()).parse(settings.getEntryRule());
	}

	private TwistParser strictParser(String source, String description) {
		ParserSettings strict = new ParserSettings(settings);
		strict.setBestEffort(false);
		return new TwistParser(source, description, strict);
	}

	/**
	 * Renders a tree as canonical DataTwist source, that parses back into an
	 * equal tree.
	 *
	 * @param tree tree without error nodes
	 * @return DataTwist source
	 */
	public String format(SyntaxNode tree) {
		return new SyntaxPrinter(settings).print(tree);
	}

	/**
	 * @param tree any syntax tree
	 * @return the s-expression dump of the tree
	 */
	public String dump(SyntaxNode tree) {
		return new SyntaxTreeDumper().dump(tree);
	}

	/**
	 * @param tree any syntax tree
	 * @return an equivalent tree where every pipeline is a nested application
	 */
	public SyntaxNode desugar(SyntaxNode tree) {
		return PipelineResolver.desugar(tree);
	}
}
