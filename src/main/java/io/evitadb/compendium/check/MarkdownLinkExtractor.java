package io.evitadb.compendium.check;

import io.evitadb.compendium.model.MarkdownSource;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts section links from the lines of a markdown fragment.
 *
 * Recognized shapes:
 * - `](./PATH#LABEL)` - cross-file link, PATH ends with a markdown suffix
 * - `](./PATH)` - direct link to a whole file, reported as an error by the validator
 * - `](#LABEL)` - local link to a section of the same file
 *
 * Links to other files without the `./` prefix are not recognized and pass through the merge untouched.
 */
public final class MarkdownLinkExtractor {

	/**
	 * Group 1: the relative path including `./`.
	 * Group 2: everything after the first `#`, absent for direct links.
	 */
	public static final Pattern CROSS_FILE_LINK = Pattern.compile(
		"\\]\\((\\./[^)#]*\\.(?:md|markdown))(?:#([^)]*))?\\)"
	);

	/**
	 * Group 1: the label.
	 */
	public static final Pattern LOCAL_LINK = Pattern.compile(
		"\\]\\(#([^)]*)\\)"
	);

	private MarkdownLinkExtractor() {
	}

	/**
	 * Extracts all links from a source, in file order.
	 *
	 * @param source         the markdown source
	 * @param skipCodeBlocks whether links inside code blocks are ignored
	 * @param includeLocal   whether local `(#label)` links are extracted as well
	 * @return list of links
	 * @throws MalformedLinkException if a cross-file link destination contains more than one `#`
	 */
	@Nonnull
	public static List<DocumentLink> extractLinks(
		@Nonnull MarkdownSource source,
		boolean skipCodeBlocks,
		boolean includeLocal
	) {
		Objects.requireNonNull(source, "source must not be null");
		final List<String> lines = source.getLines();
		final List<DocumentLink> links = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			if (source.isScanned(i, skipCodeBlocks)) {
				links.addAll(extractLinks(source.getFile(), lines.get(i), includeLocal));
			}
		}
		return List.copyOf(links);
	}

	/**
	 * Extracts the links found on a single line.
	 *
	 * @param sourceFile   the file the line belongs to
	 * @param line         the line
	 * @param includeLocal whether local `(#label)` links are extracted as well
	 * @return list of links in line order, cross-file links first
	 * @throws MalformedLinkException if a cross-file link destination contains more than one `#`
	 */
	@Nonnull
	public static List<DocumentLink> extractLinks(
		@Nonnull Path sourceFile,
		@Nonnull String line,
		boolean includeLocal
	) {
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(line, "line must not be null");
		final List<DocumentLink> links = new ArrayList<>(2);
		final Matcher crossFile = CROSS_FILE_LINK.matcher(line);
		while (crossFile.find()) {
			links.add(toCrossFileLink(sourceFile, crossFile));
		}
		if (includeLocal) {
			final Matcher local = LOCAL_LINK.matcher(line);
			while (local.find()) {
				links.add(new DocumentLink(sourceFile, "#" + local.group(1), null, local.group(1)));
			}
		}
		return links;
	}

	/**
	 * Builds a cross-file link from a {@link #CROSS_FILE_LINK} match.
	 *
	 * @param sourceFile the file the match belongs to
	 * @param matcher    matcher positioned on a match
	 * @return the link
	 */
	@Nonnull
	public static DocumentLink toCrossFileLink(@Nonnull Path sourceFile, @Nonnull Matcher matcher) {
		final String path = matcher.group(1);
		final String label = matcher.group(2);
		final String destination = label == null ? path : path + "#" + label;
		if (label != null && label.indexOf('#') >= 0) {
			throw new MalformedLinkException(sourceFile, destination);
		}
		return new DocumentLink(sourceFile, destination, path, label);
	}
}
