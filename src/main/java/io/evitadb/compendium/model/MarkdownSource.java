package io.evitadb.compendium.model;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Line oriented view of one markdown fragment of the document.
 *
 * Headings and links are recognized line by line, so the source keeps the file's lines as read.
 * The text is additionally parsed with CommonMark to learn which lines belong to fenced or indented
 * code blocks; callers may decide to leave those lines alone.
 */
public final class MarkdownSource {

	private static final Parser PARSER = Parser.builder()
		.includeSourceSpans(IncludeSourceSpans.BLOCKS)
		.build();

	@Nonnull
	private final Path file;
	@Nonnull
	private final List<String> lines;
	@Nonnull
	private final BitSet codeLines;

	/**
	 * Creates a source from already loaded content.
	 *
	 * @param file    path the content was read from; used for link resolution and identity
	 * @param content the markdown text; must not be null
	 */
	public MarkdownSource(@Nonnull Path file, @Nonnull String content) {
		this.file = Objects.requireNonNull(file, "file must not be null");
		Objects.requireNonNull(content, "content must not be null");
		this.lines = splitLines(content);
		// a lone carriage return stays inside its line, the parser must not break there
		this.codeLines = collectCodeLines(String.join("\n", this.lines).replace('\r', ' '));
	}

	/**
	 * Reads a markdown file using UTF-8.
	 *
	 * @param file the file to read
	 * @return the loaded source
	 * @throws IOException if the file cannot be read
	 */
	@Nonnull
	public static MarkdownSource read(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		return new MarkdownSource(file, Files.readString(file, StandardCharsets.UTF_8));
	}

	/**
	 * Returns the path this source was read from.
	 *
	 * @return file path
	 */
	@Nonnull
	public Path getFile() {
		return this.file;
	}

	/**
	 * Returns the lines of the file without line terminators.
	 *
	 * @return immutable list of lines in file order
	 */
	@Nonnull
	public List<String> getLines() {
		return this.lines;
	}

	/**
	 * Returns true if the line at the given index is part of a fenced or indented code block.
	 *
	 * @param lineIndex zero-based line index
	 * @return true for code block lines
	 */
	public boolean isCodeLine(int lineIndex) {
		return this.codeLines.get(lineIndex);
	}

	/**
	 * Tells whether headings and links should be recognized on the given line.
	 *
	 * @param lineIndex      zero-based line index
	 * @param skipCodeBlocks whether code block lines are excluded
	 * @return true if the line is subject to label and link processing
	 */
	public boolean isScanned(int lineIndex, boolean skipCodeBlocks) {
		return !skipCodeBlocks || !isCodeLine(lineIndex);
	}

	@Nonnull
	private static List<String> splitLines(@Nonnull String content) {
		if (content.isEmpty()) {
			return List.of();
		}
		final String[] parts = content.split("\\r?\\n", -1);
		// a trailing terminator does not open another line
		final int count = parts[parts.length - 1].isEmpty() ? parts.length - 1 : parts.length;
		return List.of(Arrays.copyOf(parts, count));
	}

	@Nonnull
	private static BitSet collectCodeLines(@Nonnull String text) {
		final Node document = PARSER.parse(text);
		final CodeBlockCollector collector = new CodeBlockCollector();
		document.accept(collector);
		return collector.lines;
	}

	/**
	 * Records the line indices covered by code blocks.
	 */
	private static final class CodeBlockCollector extends AbstractVisitor {

		@Nonnull
		private final BitSet lines = new BitSet();

		@Override
		public void visit(@Nonnull FencedCodeBlock fencedCodeBlock) {
			mark(fencedCodeBlock);
		}

		@Override
		public void visit(@Nonnull IndentedCodeBlock indentedCodeBlock) {
			mark(indentedCodeBlock);
		}

		private void mark(@Nonnull Node block) {
			for (final SourceSpan span : block.getSourceSpans()) {
				this.lines.set(span.getLineIndex());
			}
		}
	}
}
