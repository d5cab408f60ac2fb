package io.evitadb.compendium.merge;

import io.evitadb.compendium.identity.FileIdentity;
import io.evitadb.compendium.identity.FileIdentityResolver;
import io.evitadb.compendium.model.MarkdownSource;
import io.evitadb.compendium.model.MergeOptions;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Concatenates validated fragments into the merged document.
 *
 * Fragments are written strictly in the given order. Every line passes through {@link AnchorRewriter};
 * a page break follows each fragment. The target is held open only for the duration of {@link #merge}
 * and closed on every exit path.
 */
public final class DocumentMerger {

	@Nonnull
	private final FileIdentityResolver resolver;
	@Nonnull
	private final MergeOptions options;
	@Nonnull
	private final AnchorRewriter rewriter;
	@Nonnull
	private final Log log;

	/**
	 * Creates a merger.
	 *
	 * @param resolver identity resolver providing anchor prefixes
	 * @param options  page break and rewriting switches
	 * @param log      Maven log for output
	 */
	public DocumentMerger(
		@Nonnull FileIdentityResolver resolver,
		@Nonnull MergeOptions options,
		@Nonnull Log log
	) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.rewriter = new AnchorRewriter(resolver, options.rewriteLocalLinks());
	}

	/**
	 * Writes all sources into the target file.
	 *
	 * @param sources    validated fragments in document order
	 * @param targetFile the merged document; truncated before writing
	 * @return number of lines changed by rewriting
	 * @throws IOException if the target cannot be written
	 */
	public int merge(@Nonnull List<MarkdownSource> sources, @Nonnull Path targetFile) throws IOException {
		Objects.requireNonNull(sources, "sources must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		int rewritten = 0;
		try (MergedDocumentWriter writer = MergedDocumentWriter.open(targetFile)) {
			this.log.debug("Writing merged document to " + writer.getTarget());
			for (final MarkdownSource source : sources) {
				rewritten += mergeFragment(source, writer);
				writer.endFragment(this.options.pageBreak());
			}
		}
		return rewritten;
	}

	private int mergeFragment(@Nonnull MarkdownSource source, @Nonnull MergedDocumentWriter writer) throws IOException {
		final FileIdentity prefix = this.resolver.identity(source.getFile());
		final List<String> lines = source.getLines();
		int rewritten = 0;
		for (int i = 0; i < lines.size(); i++) {
			final String line = lines.get(i);
			if (!source.isScanned(i, this.options.skipCodeBlocks())) {
				writer.writeLine(line);
				continue;
			}
			final String result = this.rewriter.rewriteLine(source.getFile(), prefix, line);
			if (!result.equals(line)) {
				rewritten++;
				if (this.log.isDebugEnabled()) {
					this.log.debug("> [" + line + "]");
					this.log.debug("  [" + result + "]");
				}
			}
			writer.writeLine(result);
		}
		return rewritten;
	}
}
