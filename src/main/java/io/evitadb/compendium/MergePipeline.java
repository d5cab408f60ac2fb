package io.evitadb.compendium;

import io.evitadb.compendium.check.LabelRegistry;
import io.evitadb.compendium.check.LinkError;
import io.evitadb.compendium.check.LinkValidator;
import io.evitadb.compendium.check.ValidationReport;
import io.evitadb.compendium.identity.FileIdentity;
import io.evitadb.compendium.identity.FileIdentityResolver;
import io.evitadb.compendium.merge.DocumentMerger;
import io.evitadb.compendium.model.MarkdownSource;
import io.evitadb.compendium.model.MergeOptions;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the three strictly sequential passes over the document fragments:
 * building the label registry, validating links against it and, only when no link error was found,
 * rewriting and merging the fragments into the output file.
 */
public final class MergePipeline {

	@Nonnull
	private final FileIdentityResolver resolver;
	@Nonnull
	private final MergeOptions options;
	@Nonnull
	private final Log log;

	/**
	 * Creates a pipeline.
	 *
	 * @param resolver identity resolver shared by all passes
	 * @param options  merge switches
	 * @param log      Maven log for diagnostics
	 */
	public MergePipeline(
		@Nonnull FileIdentityResolver resolver,
		@Nonnull MergeOptions options,
		@Nonnull Log log
	) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Runs registry and validation passes without producing any output.
	 *
	 * @param inputs fragments in document order
	 * @return validation report
	 * @throws IOException if a fragment cannot be read
	 */
	@Nonnull
	public ValidationReport check(@Nonnull List<Path> inputs) throws IOException {
		final List<MarkdownSource> sources = load(inputs);
		final LabelRegistry registry = buildRegistry(sources);
		return validate(sources, registry);
	}

	/**
	 * Runs all three passes. The output file is not touched when validation fails.
	 *
	 * @param inputs fragments in document order
	 * @param output the merged document
	 * @return validation report; merged output exists only if it is successful
	 * @throws IOException if a fragment cannot be read or the output cannot be written
	 */
	@Nonnull
	public ValidationReport merge(@Nonnull List<Path> inputs, @Nonnull Path output) throws IOException {
		Objects.requireNonNull(output, "output must not be null");
		final List<MarkdownSource> sources = load(inputs);
		final LabelRegistry registry = buildRegistry(sources);
		final ValidationReport report = validate(sources, registry);
		if (!report.isSuccess()) {
			return report;
		}

		final DocumentMerger merger = new DocumentMerger(this.resolver, this.options, this.log);
		final int rewritten = merger.merge(sources, output);
		this.log.info("Merged " + sources.size() + " file(s) into " + output + " (" + rewritten + " line(s) rewritten)");
		return report;
	}

	/**
	 * Reads all fragments.
	 *
	 * @param inputs paths in document order
	 * @return loaded sources in the same order
	 * @throws IOException if a fragment cannot be read
	 */
	@Nonnull
	List<MarkdownSource> load(@Nonnull List<Path> inputs) throws IOException {
		Objects.requireNonNull(inputs, "inputs must not be null");
		final List<MarkdownSource> sources = new ArrayList<>(inputs.size());
		for (final Path input : inputs) {
			sources.add(MarkdownSource.read(input));
		}
		return sources;
	}

	/**
	 * Pass 1: builds the registry, warns about clashing labels and dumps the context.
	 *
	 * @param sources loaded fragments
	 * @return the registry
	 */
	@Nonnull
	LabelRegistry buildRegistry(@Nonnull List<MarkdownSource> sources) {
		final LabelRegistry registry = LabelRegistry.build(sources, this.resolver, this.options.skipCodeBlocks());
		reportClashes(registry);
		reportContext(registry);
		return registry;
	}

	/**
	 * Pass 2: validates all links and reports errors grouped by file.
	 *
	 * @param sources  loaded fragments
	 * @param registry the completed registry
	 * @return validation report
	 */
	@Nonnull
	ValidationReport validate(@Nonnull List<MarkdownSource> sources, @Nonnull LabelRegistry registry) {
		final LinkValidator validator = new LinkValidator(registry, this.resolver, this.options);
		final ValidationReport report = validator.validateAll(sources);
		if (!report.isSuccess()) {
			reportErrors(report);
		}
		return report;
	}

	private void reportClashes(@Nonnull LabelRegistry registry) {
		final Map<FileIdentity, Set<String>> clashes = registry.clashes();
		if (clashes.isEmpty()) {
			return;
		}
		this.log.warn("Some sections have the same name and therefore the same label");
		for (final Map.Entry<FileIdentity, Set<String>> entry : clashes.entrySet()) {
			final Path file = registry.registeredPath(entry.getKey());
			final Set<String> labels = entry.getValue();
			if (labels.size() == 1) {
				this.log.warn("  in file \"" + file + "\" for label " + labels.iterator().next());
			} else {
				this.log.warn("  in file \"" + file + "\" for labels " + String.join(", ", labels));
			}
		}
	}

	private void reportContext(@Nonnull LabelRegistry registry) {
		this.log.info("context:");
		for (final FileIdentity file : registry.files()) {
			this.log.info("  " + registry.registeredPath(file) + " -> " + String.join(", ", registry.labels(file)));
		}
	}

	private void reportErrors(@Nonnull ValidationReport report) {
		this.log.error("Link validation errors: " + report.errorCount());
		for (final Map.Entry<Path, List<LinkError>> entry : report.errors().entrySet()) {
			this.log.error("on file " + entry.getKey());
			for (final LinkError error : entry.getValue()) {
				this.log.error("  " + error.describe());
			}
		}
	}
}
