package org.metricshub.datatwist;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.datatwist.frontend.ast.ParseException;
import org.metricshub.datatwist.frontend.ast.SyntaxNode;
import org.metricshub.datatwist.util.ScriptFileSource;

/**
 * Parses every sample program in src/test/resources/programs.
 * <p>
 * Programs under {@code valid} must parse, survive a round trip through the
 * printer and, when a {@code .dump} file sits next to them, dump to its
 * content. Programs under {@code invalid} start with a
 * {@code ;; error: <reason>} line and must fail with a diagnostic whose
 * reason contains {@code <reason>}.
 */
@RunWith(Parameterized.class)
public class ProgramSamplesTest {

	private static final String PROGRAMS_PATH = "/programs";
	private static final String ERROR_HEADER = ";; error: ";
	private static File programsDirectory;

	@BeforeClass
	public static void beforeAll() throws Exception {}

	/**
	 * @return the sample programs, relative to /src/test/resources/programs
	 * @throws Exception when the resource directory cannot be found
	 */
	@Parameters(name = "{0}")
	public static Iterable<String> programList() throws Exception {
		URL programsUrl = ProgramSamplesTest.class.getResource(PROGRAMS_PATH);
		if (programsUrl == null) {
			throw new IOException("Couldn't find resource " + PROGRAMS_PATH);
		}
		programsDirectory = new File(programsUrl.toURI());
		if (!programsDirectory.isDirectory()) {
			throw new IOException(PROGRAMS_PATH + " is not a directory");
		}

		List<String> programs = new ArrayList<String>();
		for (String kind : new String[] { "valid", "invalid" }) {
			File directory = new File(programsDirectory, kind);
			if (!directory.isDirectory()) {
				throw new IOException(kind + " is not a directory");
			}
			programs
					.addAll(
							Arrays
									.stream(directory.listFiles())
									.filter(f -> f.getName().endsWith(".dtw"))
									.map(f -> kind + "/" + f.getName())
									.sorted()
									.collect(Collectors.toList()));
		}
		return programs;
	}

	/** Path of the program, relative to the programs directory */
	@Parameter
	public String programName;

	@Test
	public void test() throws Exception {
		File programFile = new File(programsDirectory, programName);
		DataTwist twist = new DataTwist();
		ScriptFileSource script = new ScriptFileSource(programFile.toPath());

		if (programName.startsWith("invalid/")) {
			String firstLine = Files.readAllLines(programFile.toPath(), StandardCharsets.UTF_8).get(0);
			assertTrue(programName + " must start with '" + ERROR_HEADER + "'", firstLine.startsWith(ERROR_HEADER));
			String expectedReason = firstLine.substring(ERROR_HEADER.length()).trim();

			ParseException e = assertThrows(programName, ParseException.class, () -> twist.parseOrThrow(script));
			assertTrue(
					programName + ": '" + e.getMessage() + "' should contain '" + expectedReason + "'",
					e.getDiagnostic().getReason().contains(expectedReason));
			assertTrue(e.getMessage(), e.getMessage().startsWith(script.getDescription() + ":"));
			return;
		}

		SyntaxNode tree = twist.parseOrThrow(script);
		assertNotNull(programName, tree);

		File dumpFile = new File(programsDirectory, programName.replaceAll("\\.dtw$", ".dump"));
		if (dumpFile.isFile()) {
			String expectedDump = new String(Files.readAllBytes(dumpFile.toPath()), StandardCharsets.UTF_8).trim();
			assertEquals(programName, expectedDump, twist.dump(tree));
		}

		String formatted = twist.format(tree);
		assertEquals(programName + ", formatted as:\n" + formatted, tree, twist.parseOrThrow(formatted));
	}
}
