package io.evitadb.compendium.check;

import io.evitadb.compendium.model.MarkdownSource;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds heading lines and derives their labels.
 *
 * A line is a heading when it starts with one or more `#` characters and has some text after them.
 * Labels are returned in file order without deduplication, which is left to {@link LabelRegistry}.
 */
public final class HeadingLabelExtractor {

	private HeadingLabelExtractor() {
	}

	/**
	 * Extracts the labels of all headings of a source, in file order.
	 *
	 * @param source         the markdown source
	 * @param skipCodeBlocks whether headings inside code blocks are ignored
	 * @return ordered list of labels, possibly containing repeats
	 */
	@Nonnull
	public static List<String> extractLabels(@Nonnull MarkdownSource source, boolean skipCodeBlocks) {
		Objects.requireNonNull(source, "source must not be null");
		final List<String> lines = source.getLines();
		final List<String> labels = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			if (source.isScanned(i, skipCodeBlocks)) {
				labelOf(lines.get(i)).ifPresent(labels::add);
			}
		}
		return List.copyOf(labels);
	}

	/**
	 * Returns the label of a heading line, or empty if the line is not a heading.
	 *
	 * @param line a single line of markdown
	 * @return label of the heading
	 */
	@Nonnull
	public static Optional<String> labelOf(@Nonnull String line) {
		Objects.requireNonNull(line, "line must not be null");
		if (line.isEmpty() || line.charAt(0) != '#') {
			return Optional.empty();
		}
		final String label = LabelNormalizer.normalize(headingText(line));
		return label.isEmpty() ? Optional.empty() : Optional.of(label);
	}

	/**
	 * Strips the leading `#` run and the spaces and tabs following it.
	 *
	 * @param line heading line
	 * @return heading text
	 */
	@Nonnull
	static String headingText(@Nonnull String line) {
		int index = 0;
		while (index < line.length() && line.charAt(index) == '#') {
			index++;
		}
		while (index < line.length() && LabelNormalizer.isBlank(line.charAt(index))) {
			index++;
		}
		return line.substring(index);
	}
}
