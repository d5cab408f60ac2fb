package io.evitadb.compendium.check;

import io.evitadb.compendium.model.MarkdownSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("HeadingLabelExtractor finds heading lines and their labels")
public class HeadingLabelExtractorTest {

	private static final Path FILE = Path.of("/docs/a.md");

	@Test
	@DisplayName("extracts labels in file order")
	public void shouldExtractLabelsInFileOrder() {
		final MarkdownSource source = new MarkdownSource(FILE, "# Title\n\ntext\n\n## Some Section\n### Details\n");

		assertEquals(List.of("title", "some-section", "details"), HeadingLabelExtractor.extractLabels(source, false));
	}

	@Test
	@DisplayName("keeps repeated labels")
	public void shouldKeepRepeatedLabels() {
		final MarkdownSource source = new MarkdownSource(FILE, "## Intro\ntext\n## Intro\n");

		assertEquals(List.of("intro", "intro"), HeadingLabelExtractor.extractLabels(source, false));
	}

	@Test
	@DisplayName("requires the hash at the start of the line")
	public void shouldRequireHashAtLineStart() {
		assertTrue(HeadingLabelExtractor.labelOf("  # Not a heading").isEmpty());
		assertTrue(HeadingLabelExtractor.labelOf("text # not a heading").isEmpty());
		assertTrue(HeadingLabelExtractor.labelOf("").isEmpty());
	}

	@Test
	@DisplayName("accepts a heading without space after the hash run")
	public void shouldAcceptHeadingWithoutSpace() {
		assertEquals(Optional.of("compact"), HeadingLabelExtractor.labelOf("##Compact"));
	}

	@Test
	@DisplayName("ignores headings without text")
	public void shouldIgnoreEmptyHeadings() {
		assertTrue(HeadingLabelExtractor.labelOf("###").isEmpty());
		assertTrue(HeadingLabelExtractor.labelOf("#   ").isEmpty());
	}

	@Test
	@DisplayName("strips the hash run and following whitespace")
	public void shouldStripHashRun() {
		assertEquals("Some Section", HeadingLabelExtractor.headingText("###   Some Section"));
	}

	@Test
	@DisplayName("treats hash lines inside code blocks as headings unless told otherwise")
	public void shouldHonourCodeBlockSwitch() {
		final MarkdownSource source = new MarkdownSource(FILE, "# Real\n\n```bash\n# comment\n```\n");

		assertEquals(List.of("real", "comment"), HeadingLabelExtractor.extractLabels(source, false));
		assertEquals(List.of("real"), HeadingLabelExtractor.extractLabels(source, true));
	}
}
