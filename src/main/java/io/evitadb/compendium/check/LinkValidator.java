package io.evitadb.compendium.check;

import io.evitadb.compendium.identity.FileIdentity;
import io.evitadb.compendium.identity.FileIdentityResolver;
import io.evitadb.compendium.identity.IdentityResolutionException;
import io.evitadb.compendium.model.MarkdownSource;
import io.evitadb.compendium.model.MergeOptions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks every section link of the document against a completed {@link LabelRegistry}.
 *
 * A link is checked in this order:
 * 1. no label: {@link LinkError.LinkErrorType#DIRECT_LINK}
 * 2. target file unknown to the document: {@link LinkError.LinkErrorType#DEAD_FILE_LINK}
 * 3. label not defined by the target: {@link LinkError.LinkErrorType#DEAD_LABEL_LINK}
 * 4. label defined more than once by the target: {@link LinkError.LinkErrorType#LABEL_CLASH}
 */
public final class LinkValidator {

	@Nonnull
	private final LabelRegistry registry;
	@Nonnull
	private final FileIdentityResolver resolver;
	@Nonnull
	private final MergeOptions options;

	/**
	 * Creates a validator.
	 *
	 * @param registry the label registry built over all files
	 * @param resolver identity resolver used to identify link targets
	 * @param options  decides whether local links and code blocks are checked
	 */
	public LinkValidator(
		@Nonnull LabelRegistry registry,
		@Nonnull FileIdentityResolver resolver,
		@Nonnull MergeOptions options
	) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * Validates the links of all sources.
	 *
	 * @param sources document fragments in document order
	 * @return report grouping errors by source file
	 * @throws MalformedLinkException if a link cannot be interpreted at all
	 */
	@Nonnull
	public ValidationReport validateAll(@Nonnull List<MarkdownSource> sources) {
		Objects.requireNonNull(sources, "sources must not be null");
		final Map<Path, List<LinkError>> errors = new LinkedHashMap<>();
		for (final MarkdownSource source : sources) {
			final List<LinkError> fileErrors = validate(source);
			if (!fileErrors.isEmpty()) {
				errors.computeIfAbsent(source.getFile(), k -> new ArrayList<>()).addAll(fileErrors);
			}
		}
		return new ValidationReport(errors);
	}

	/**
	 * Validates the links of a single source.
	 *
	 * @param source the fragment to check
	 * @return errors in link order, empty if all links are valid
	 * @throws MalformedLinkException if a link cannot be interpreted at all
	 */
	@Nonnull
	public List<LinkError> validate(@Nonnull MarkdownSource source) {
		Objects.requireNonNull(source, "source must not be null");
		final List<LinkError> errors = new ArrayList<>();
		final List<DocumentLink> links = MarkdownLinkExtractor.extractLinks(
			source, this.options.skipCodeBlocks(), this.options.rewriteLocalLinks()
		);
		for (final DocumentLink link : links) {
			final LinkError error = check(link);
			if (error != null) {
				errors.add(error);
			}
		}
		return errors;
	}

	/**
	 * Classifies a single link.
	 *
	 * @param link the link to check
	 * @return the error, or null for a valid link
	 */
	@Nullable
	LinkError check(@Nonnull DocumentLink link) {
		final Path target = link.resolveTarget();
		final String label = link.label();
		if (label == null) {
			return new LinkError(link.sourceFile(), target, null, LinkError.LinkErrorType.DIRECT_LINK);
		}

		final FileIdentity identity;
		try {
			identity = this.resolver.identity(target);
		} catch (IdentityResolutionException e) {
			return new LinkError(link.sourceFile(), target, label, LinkError.LinkErrorType.DEAD_FILE_LINK);
		}
		if (!this.registry.contains(identity)) {
			return new LinkError(link.sourceFile(), target, label, LinkError.LinkErrorType.DEAD_FILE_LINK);
		}
		if (!this.registry.defines(identity, label)) {
			return new LinkError(link.sourceFile(), target, label, LinkError.LinkErrorType.DEAD_LABEL_LINK);
		}
		if (this.registry.isClash(identity, label)) {
			return new LinkError(link.sourceFile(), target, label, LinkError.LinkErrorType.LABEL_CLASH);
		}
		return null;
	}
}
