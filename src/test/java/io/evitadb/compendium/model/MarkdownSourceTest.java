package io.evitadb.compendium.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MarkdownSource exposes lines and code block positions")
public class MarkdownSourceTest {

	private static final Path FILE = Path.of("/docs/a.md");

	@Test
	@DisplayName("splits lines on LF and CRLF without trailing empty line")
	public void shouldSplitLines() {
		final MarkdownSource source = new MarkdownSource(FILE, "one\r\ntwo\nthree\n");

		assertEquals(List.of("one", "two", "three"), source.getLines());
	}

	@Test
	@DisplayName("keeps Unicode line separators and lone carriage returns inside a line")
	public void shouldSplitOnlyOnLineFeed() {
		final MarkdownSource source = new MarkdownSource(FILE, "a\u0085b\u2028c\u2029d\ne\rf\n");

		assertEquals(List.of("a\u0085b\u2028c\u2029d", "e\rf"), source.getLines());
	}

	@Test
	@DisplayName("keeps code block positions aligned when a line holds a carriage return")
	public void shouldAlignCodeLinesAroundCarriageReturn() {
		final MarkdownSource source = new MarkdownSource(FILE, "text\rmore\n```\ncode\n```\nafter\n");

		assertFalse(source.isCodeLine(0));
		assertTrue(source.isCodeLine(2));
		assertFalse(source.isCodeLine(4));
	}

	@Test
	@DisplayName("keeps blank lines in the middle and at the end")
	public void shouldKeepBlankLines() {
		final MarkdownSource source = new MarkdownSource(FILE, "one\n\ntwo\n\n");

		assertEquals(List.of("one", "", "two", ""), source.getLines());
	}

	@Test
	@DisplayName("has no lines for empty content")
	public void shouldHaveNoLinesForEmptyContent() {
		assertTrue(new MarkdownSource(FILE, "").getLines().isEmpty());
	}

	@Test
	@DisplayName("marks fenced code block lines")
	public void shouldMarkFencedCodeLines() {
		final MarkdownSource source = new MarkdownSource(FILE, "# Title\n\n```bash\n# comment\necho hi\n```\n\ntext\n");

		assertFalse(source.isCodeLine(0));
		assertTrue(source.isCodeLine(3));
		assertTrue(source.isCodeLine(4));
		assertFalse(source.isCodeLine(7));
	}

	@Test
	@DisplayName("marks indented code block lines")
	public void shouldMarkIndentedCodeLines() {
		final MarkdownSource source = new MarkdownSource(FILE, "text\n\n    [x](./a.md#b)\n\nmore\n");

		assertTrue(source.isCodeLine(2));
		assertFalse(source.isCodeLine(4));
	}

	@Test
	@DisplayName("scans code lines unless skipping is requested")
	public void shouldScanCodeLinesUnlessSkipping() {
		final MarkdownSource source = new MarkdownSource(FILE, "```\n# x\n```\n");

		assertTrue(source.isScanned(1, false));
		assertFalse(source.isScanned(1, true));
	}

	@Test
	@DisplayName("reads file content as UTF-8")
	public void shouldReadFileAsUtf8() throws IOException {
		final Path file = Files.createTempFile("markdown-source-", ".md");
		try {
			Files.writeString(file, "# Příliš žluťoučký kůň\n", StandardCharsets.UTF_8);

			final MarkdownSource source = MarkdownSource.read(file);

			assertEquals(file, source.getFile());
			assertEquals(List.of("# Příliš žluťoučký kůň"), source.getLines());
		} finally {
			Files.deleteIfExists(file);
		}
	}
}
