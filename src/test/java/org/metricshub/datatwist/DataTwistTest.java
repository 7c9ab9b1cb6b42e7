package org.metricshub.datatwist;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.datatwist.frontend.GrammarRule;
import org.metricshub.datatwist.frontend.ast.Diagnostic;
import org.metricshub.datatwist.frontend.ast.NodeKind;
import org.metricshub.datatwist.frontend.ast.ParseException;
import org.metricshub.datatwist.frontend.ast.Program;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.util.ParserSettings;
import org.metricshub.datatwist.util.ScriptFileSource;
import org.metricshub.datatwist.util.ScriptSource;

public class DataTwistTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testParse() {
		ParseResult result = new DataTwist().parse("x = 1\ny = x filter _.ok");
		assertTrue(result.isSuccess());
		assertTrue(result.getDiagnostics().isEmpty());
		assertEquals(NodeKind.PROGRAM, result.getTree().getKind());
		assertEquals(2, ((Program) result.getTree()).getStatements().size());
		assertEquals("ParseResult[PROGRAM]", result.toString());
	}

	@Test
	public void testParseFailure() {
		ParseResult result = new DataTwist().parse("x = (");
		assertFalse(result.isSuccess());
		assertNull(result.getTree());
		Diagnostic diagnostic = result.getDiagnostics().get(0);
		assertEquals(ScriptSource.DESCRIPTION_INLINE_SCRIPT, diagnostic.getSourceDescription());
		assertTrue(result.toString().contains("1 error(s)"));
		assertThrows(UnsupportedOperationException.class, () -> result.getDiagnostics().clear());
	}

	@Test
	public void testParseOrThrow() {
		DataTwist twist = new DataTwist();
		assertEquals("(program (= x (num 1)))", twist.dump(twist.parseOrThrow("x = 1")));
		ParseException e = assertThrows(ParseException.class, () -> twist.parseOrThrow("x = )"));
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testParseOrThrowIgnoresBestEffort() {
		ParserSettings settings = new ParserSettings();
		settings.setBestEffort(true);
		DataTwist twist = new DataTwist(settings);
		assertThrows(ParseException.class, () -> twist.parseOrThrow("x = )\ny = 1"));
		assertEquals(1, twist.parse("x = )\ny = 1").getDiagnostics().size());
	}

	@Test
	public void testEntryRuleFromSettings() {
		ParserSettings settings = new ParserSettings();
		settings.setEntryRule(GrammarRule.EXPRESSION);
		DataTwist twist = new DataTwist(settings);
		assertEquals("(+ (num 1) (num 2))", twist.dump(twist.parse("1 + 2").getTree()));
		assertEquals("(list (num 1))", twist.dump(twist.parse("[1]", GrammarRule.LIST).getTree()));
	}

	@Test
	public void testSettingsAreCopied() {
		ParserSettings settings = new ParserSettings();
		DataTwist twist = new DataTwist(settings);
		settings.addPipelineOperation("select");
		settings.setMaxNestingDepth(1);
		assertFalse(twist.getSettings().isPipelineOperation("select"));
		assertEquals(200, twist.getSettings().getMaxNestingDepth());

		twist.getSettings().addPipelineOperation("select");
		assertFalse(twist.getSettings().isPipelineOperation("select"));
		assertEquals("(program (apply (id data) (id select) (id name)))", twist.dump(twist.parseOrThrow("data select name")));

		assertThrows(IllegalArgumentException.class, () -> new DataTwist(null));
	}

	@Test
	public void testScriptSource() throws IOException {
		DataTwist twist = new DataTwist();
		ParseResult result = twist.parse(ScriptSource.of("x = 1"));
		assertTrue(result.isSuccess());

		ScriptSource named = ScriptSource.of("stream.dtw", new ByteArrayInputStream("y = )".getBytes(StandardCharsets.UTF_8)));
		assertEquals("stream.dtw", named.toString());
		ParseResult failure = twist.parse(named);
		assertEquals("stream.dtw", failure.getDiagnostics().get(0).getSourceDescription());
		assertTrue(failure.getDiagnostics().get(0).format().startsWith("stream.dtw:1:5: "));
	}

	@Test
	public void testScriptFileSource() throws IOException {
		File file = folder.newFile("users.dtw");
		Files.write(
				file.toPath(),
				Collections.singletonList("adults = users\n  filter _.age >= 18\n  map _.name ;; names only"),
				StandardCharsets.UTF_8);
		ScriptFileSource source = new ScriptFileSource(file.toPath());
		assertEquals(file.toPath(), source.getFilePath());
		assertEquals(file.toPath().toString(), source.getDescription());

		SyntaxNode tree = new DataTwist().parseOrThrow(source);
		assertEquals(
				"(program (= adults (pipeline (id users) (stage filter (>= (_ age) (num 18))) (stage map (_ name)))))",
				new DataTwist().dump(tree));
	}

	@Test
	public void testScriptFileSourceErrorNamesTheFile() throws IOException {
		File file = folder.newFile("broken.dtw");
		Files.write(file.toPath(), Collections.singletonList("x = \"unterminated"), StandardCharsets.UTF_8);
		ParseException e = assertThrows(
				ParseException.class,
				() -> new DataTwist().parseOrThrow(new ScriptFileSource(file.toPath())));
		assertEquals(file.toPath().toString() + ":1:5: Unterminated string", e.getMessage());
	}

	@Test
	public void testMissingFile() {
		ScriptFileSource missing = new ScriptFileSource(new File(folder.getRoot(), "missing.dtw").toPath());
		assertThrows(IOException.class, () -> new DataTwist().parse(missing));
	}

	@Test
	public void testParseResultRequiresDiagnosticsWithoutTree() {
		assertThrows(IllegalArgumentException.class, () -> new ParseResult(null, Collections.<Diagnostic>emptyList()));
	}
}
