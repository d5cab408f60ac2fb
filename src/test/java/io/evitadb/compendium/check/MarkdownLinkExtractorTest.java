package io.evitadb.compendium.check;

import io.evitadb.compendium.model.MarkdownSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MarkdownLinkExtractor finds section links on markdown lines")
public class MarkdownLinkExtractorTest {

	private static final Path FILE = Path.of("/docs/guide/b.md");

	@Test
	@DisplayName("extracts cross-file link with label")
	public void shouldExtractCrossFileLink() {
		final List<DocumentLink> links = MarkdownLinkExtractor.extractLinks(
			FILE, "See [the section](./a.md#some-section) for details.", false
		);

		assertEquals(1, links.size());
		final DocumentLink link = links.get(0);
		assertEquals("./a.md", link.path());
		assertEquals("some-section", link.label());
		assertEquals("./a.md#some-section", link.destination());
		assertFalse(link.isLocal());
		assertFalse(link.isDirect());
	}

	@Test
	@DisplayName("extracts direct link without label")
	public void shouldExtractDirectLink() {
		final List<DocumentLink> links = MarkdownLinkExtractor.extractLinks(FILE, "[whole](./a.md)", false);

		assertEquals(1, links.size());
		assertNull(links.get(0).label());
		assertTrue(links.get(0).isDirect());
	}

	@Test
	@DisplayName("extracts several links on one line")
	public void shouldExtractSeveralLinks() {
		final List<DocumentLink> links = MarkdownLinkExtractor.extractLinks(
			FILE, "[x](./a.md#one) and [y](../other/c.md#two) and [z](./sub/d.markdown#three)", false
		);

		assertEquals(2, links.size());
		assertEquals("one", links.get(0).label());
		assertEquals("./sub/d.markdown", links.get(1).path());
	}

	@Test
	@DisplayName("ignores links without the ./ prefix and non-markdown targets")
	public void shouldIgnoreUnsupportedLinks() {
		assertTrue(MarkdownLinkExtractor.extractLinks(FILE, "[x](a.md#one)", false).isEmpty());
		assertTrue(MarkdownLinkExtractor.extractLinks(FILE, "![pic](./img/pic.png)", false).isEmpty());
		assertTrue(MarkdownLinkExtractor.extractLinks(FILE, "[w](https://example.com/a.md#x)", false).isEmpty());
	}

	@Test
	@DisplayName("extracts local links only when asked")
	public void shouldExtractLocalLinksOnRequest() {
		final String line = "Go [up](#intro) or [there](./a.md#x).";

		assertEquals(1, MarkdownLinkExtractor.extractLinks(FILE, line, false).size());

		final List<DocumentLink> links = MarkdownLinkExtractor.extractLinks(FILE, line, true);
		assertEquals(2, links.size());
		assertTrue(links.get(1).isLocal());
		assertEquals("intro", links.get(1).label());
		assertEquals(FILE, links.get(1).resolveTarget());
	}

	@Test
	@DisplayName("resolves target against the directory of the source file")
	public void shouldResolveAgainstSourceDirectory() {
		final DocumentLink link = MarkdownLinkExtractor.extractLinks(FILE, "[x](./../a.md#one)", false).get(0);

		assertEquals(Path.of("/docs/a.md"), link.resolveTarget());
	}

	@Test
	@DisplayName("rejects a destination with two anchors")
	public void shouldRejectTwoAnchors() {
		assertThrows(MalformedLinkException.class,
			() -> MarkdownLinkExtractor.extractLinks(FILE, "[x](./a.md#one#two)", false));
	}

	@Test
	@DisplayName("skips links in code blocks when asked")
	public void shouldSkipLinksInCodeBlocks() {
		final MarkdownSource source = new MarkdownSource(FILE, "[x](./a.md#one)\n\n```\n[y](./a.md#two)\n```\n");

		assertEquals(2, MarkdownLinkExtractor.extractLinks(source, false, false).size());
		assertEquals(1, MarkdownLinkExtractor.extractLinks(source, true, false).size());
	}
}
