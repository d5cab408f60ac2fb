package io.evitadb.compendium.merge;

import io.evitadb.compendium.check.DocumentLink;
import io.evitadb.compendium.check.HeadingLabelExtractor;
import io.evitadb.compendium.check.MarkdownLinkExtractor;
import io.evitadb.compendium.identity.FileIdentity;
import io.evitadb.compendium.identity.FileIdentityResolver;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Rewrites a single line of a validated fragment for the merged document.
 *
 * - a heading gets an explicit anchor appended: `## Some Section {#n42-some-section}`
 * - a cross-file link `(./other.md#label)` becomes `(#<identity of other.md>-label)`
 * - a local link `(#label)` becomes `(#<identity of the file>-label)` when enabled
 *
 * Labels are recomputed with the same rules the registry used, so anchors and links agree.
 * Only validated content should be passed here: a link whose target cannot be identified fails
 * with {@link io.evitadb.compendium.identity.IdentityResolutionException}.
 */
public final class AnchorRewriter {

	@Nonnull
	private final FileIdentityResolver resolver;
	private final boolean rewriteLocalLinks;

	/**
	 * Creates a rewriter.
	 *
	 * @param resolver          identity resolver for link targets
	 * @param rewriteLocalLinks whether same-file links get the file prefix
	 */
	public AnchorRewriter(@Nonnull FileIdentityResolver resolver, boolean rewriteLocalLinks) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.rewriteLocalLinks = rewriteLocalLinks;
	}

	/**
	 * Rewrites one line.
	 *
	 * @param sourceFile file the line belongs to; link paths are relative to its directory
	 * @param prefix     identity of the file
	 * @param line       the original line
	 * @return the rewritten line, the same instance if nothing applied
	 */
	@Nonnull
	public String rewriteLine(@Nonnull Path sourceFile, @Nonnull FileIdentity prefix, @Nonnull String line) {
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(prefix, "prefix must not be null");
		Objects.requireNonNull(line, "line must not be null");

		// computed before links are touched, the registry saw the original text
		final Optional<String> headingLabel = HeadingLabelExtractor.labelOf(line);

		String result = line;
		if (this.rewriteLocalLinks) {
			result = rewriteLocalLinks(prefix, result);
		}
		result = rewriteCrossFileLinks(sourceFile, result);

		if (headingLabel.isPresent()) {
			result = result.stripTrailing() + " {#" + prefix.anchor(headingLabel.get()) + "}";
		}
		return result;
	}

	@Nonnull
	private static String rewriteLocalLinks(@Nonnull FileIdentity prefix, @Nonnull String line) {
		final Matcher matcher = MarkdownLinkExtractor.LOCAL_LINK.matcher(line);
		if (!matcher.find()) {
			return line;
		}
		final StringBuilder sb = new StringBuilder(line.length() + 16);
		do {
			final String replacement = "](#" + prefix.anchor(matcher.group(1)) + ")";
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		} while (matcher.find());
		matcher.appendTail(sb);
		return sb.toString();
	}

	@Nonnull
	private String rewriteCrossFileLinks(@Nonnull Path sourceFile, @Nonnull String line) {
		final Matcher matcher = MarkdownLinkExtractor.CROSS_FILE_LINK.matcher(line);
		if (!matcher.find()) {
			return line;
		}
		final StringBuilder sb = new StringBuilder(line.length());
		do {
			final DocumentLink link = MarkdownLinkExtractor.toCrossFileLink(sourceFile, matcher);
			final String replacement;
			if (link.label() == null) {
				// never reached after validation, kept verbatim
				replacement = matcher.group();
			} else {
				final FileIdentity target = this.resolver.identity(link.resolveTarget());
				replacement = "](#" + target.anchor(link.label()) + ")";
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		} while (matcher.find());
		matcher.appendTail(sb);
		return sb.toString();
	}
}
