package io.evitadb.compendium.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Switches shared by the validation and merge passes.
 *
 * @param pageBreak         marker emitted after every merged file (e.g. `\newpage`)
 * @param rewriteLocalLinks whether same-file `(#label)` links are validated and rewritten
 * @param skipCodeBlocks    whether lines inside code blocks are exempt from heading and link processing
 */
public record MergeOptions(
	@Nonnull String pageBreak,
	boolean rewriteLocalLinks,
	boolean skipCodeBlocks
) {

	/**
	 * Page break understood by pandoc's LaTeX writer.
	 */
	public static final String DEFAULT_PAGE_BREAK = "\\newpage";

	/**
	 * Creates new MergeOptions with validation.
	 */
	public MergeOptions {
		Objects.requireNonNull(pageBreak, "pageBreak must not be null");
	}

	/**
	 * Returns the default options: `\newpage` breaks, local links rewritten, code blocks scanned.
	 *
	 * @return default options
	 */
	@Nonnull
	public static MergeOptions defaults() {
		return new MergeOptions(DEFAULT_PAGE_BREAK, true, false);
	}
}
