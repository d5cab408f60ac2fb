package io.evitadb.compendium;

import io.evitadb.compendium.check.MalformedLinkException;
import io.evitadb.compendium.check.ValidationReport;
import io.evitadb.compendium.identity.FileKeyIdentityResolver;
import io.evitadb.compendium.identity.IdentityResolutionException;
import io.evitadb.compendium.model.MergeOptions;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main Mojo for Compendium plugin providing actions:
 * - show-config: prints current configuration
 * - check: validates cross-file section links of the document fragments
 * - merge: validates and merges the fragments into a single document for pandoc
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class CompendiumMojo extends AbstractMojo {

	private static final String USAGE = String.join("\n",
		"Usage: mvn compendium:run -Dcompendium.action=merge -Dcompendium.output=<out> -Dcompendium.inputs=<in>[,<in>]*",
		"  Checks the links in a multi file markdown document, and",
		"  generates a md file that can be passed to pandoc directly.",
		"  The final document will have a structure consistent with the order",
		"  of the input files.",
		"  * <out> is the name of the file the plugin writes to, and",
		"  * <in> is a markdown file from the document."
	);

	/** Which action to perform: "show-config", "check" or "merge". */
	@Parameter(property = "compendium.action", defaultValue = "show-config")
	private String action;

	/** Directory relative inputs and output resolve against; also searched when reporting files. */
	@Parameter(property = "compendium.baseDir", defaultValue = "${project.basedir}")
	private String baseDir;

	/** Markdown fragments in document order. */
	@Parameter(property = "compendium.inputs")
	private List<String> inputs;

	/** Merged document path (no default). */
	@Parameter(property = "compendium.output")
	private String output;

	/** Marker written after every fragment. */
	@Parameter(property = "compendium.pageBreak", defaultValue = MergeOptions.DEFAULT_PAGE_BREAK)
	private String pageBreak = MergeOptions.DEFAULT_PAGE_BREAK;

	/** When true, same-file `(#label)` links are validated and prefixed like cross-file links. */
	@Parameter(property = "compendium.rewriteLocalLinks", defaultValue = "true")
	private boolean rewriteLocalLinks = true;

	/** When true, headings and links inside code blocks are left alone. */
	@Parameter(property = "compendium.skipCodeBlocks", defaultValue = "false")
	private boolean skipCodeBlocks = false;

	@Override
	public void execute() throws MojoExecutionException, MojoFailureException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "check":
				check(getLog());
				break;
			case "merge":
				merge(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, check, merge");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Compendium Plugin Configuration:");
		log.info(" - baseDir: " + resolveBaseDir());
		if (this.inputs == null || this.inputs.isEmpty()) {
			log.info(" - inputs: <none>");
			log.warn("No input files configured");
		} else {
			log.info(" - inputs:");
			for (final String input : this.inputs) {
				log.info("   - " + input);
			}
		}
		log.info(" - output: " + (this.output == null || this.output.isBlank() ? "<not set>" : this.output));
		if (this.output == null || this.output.isBlank()) {
			log.warn("Output file is not set");
		}
		log.info(" - pageBreak: " + this.pageBreak);
		log.info(" - rewriteLocalLinks: " + this.rewriteLocalLinks);
		log.info(" - skipCodeBlocks: " + this.skipCodeBlocks);
	}

	/**
	 * Executes the check action: builds the label registry and validates links, writes nothing.
	 *
	 * @param log the Maven log
	 * @throws MojoExecutionException on usage or internal errors
	 * @throws MojoFailureException   if link validation fails
	 */
	private void check(@Nonnull final Log log) throws MojoExecutionException, MojoFailureException {
		final List<Path> files = requireInputs();
		log.info("Input:  " + files);

		final ValidationReport report;
		try {
			report = createPipeline(log).check(files);
		} catch (final IOException ex) {
			throw new MojoExecutionException("Check action failed: " + ex.getMessage(), ex);
		} catch (final IdentityResolutionException | MalformedLinkException ex) {
			throw new MojoExecutionException("Internal error: " + ex.getMessage(), ex);
		}
		failOnErrors(report);
		log.info("All links are valid!");
	}

	/**
	 * Executes the merge action: all three passes, output is produced only for a valid document.
	 *
	 * @param log the Maven log
	 * @throws MojoExecutionException on usage or internal errors
	 * @throws MojoFailureException   if link validation fails
	 */
	private void merge(@Nonnull final Log log) throws MojoExecutionException, MojoFailureException {
		if (this.output == null || this.output.isBlank()) {
			throw usageError("no output file given");
		}
		final List<Path> files = requireInputs();
		final Path target = resolveBaseDir().resolve(this.output).normalize();
		log.info("Target: " + target);
		log.info("Input:  " + files);

		final ValidationReport report;
		try {
			report = createPipeline(log).merge(files, target);
		} catch (final IOException ex) {
			throw new MojoExecutionException("Merge action failed: " + ex.getMessage(), ex);
		} catch (final IdentityResolutionException | MalformedLinkException ex) {
			throw new MojoExecutionException("Internal error: " + ex.getMessage(), ex);
		}
		failOnErrors(report);
	}

	@Nonnull
	private MergePipeline createPipeline(@Nonnull final Log log) {
		final MergeOptions options = new MergeOptions(
			this.pageBreak == null ? MergeOptions.DEFAULT_PAGE_BREAK : this.pageBreak,
			this.rewriteLocalLinks,
			this.skipCodeBlocks
		);
		return new MergePipeline(new FileKeyIdentityResolver(resolveBaseDir()), options, log);
	}

	private static void failOnErrors(@Nonnull final ValidationReport report) throws MojoFailureException {
		if (!report.isSuccess()) {
			throw new MojoFailureException(
				"Link validation failed with " + report.errorCount() + " error(s) in " + report.errors().size() + " file(s)"
			);
		}
	}

	@Nonnull
	private List<Path> requireInputs() throws MojoExecutionException {
		if (this.inputs == null || this.inputs.isEmpty()) {
			throw usageError("no input file given, need at least one");
		}
		final Path base = resolveBaseDir();
		final List<Path> files = new ArrayList<>(this.inputs.size());
		for (final String input : this.inputs) {
			if (input == null || input.isBlank()) {
				throw usageError("blank input file name");
			}
			files.add(base.resolve(input).normalize());
		}
		return files;
	}

	@Nonnull
	private MojoExecutionException usageError(@Nonnull final String reason) {
		getLog().error(USAGE);
		return new MojoExecutionException("Illegal arguments: " + reason);
	}

	@Nonnull
	private Path resolveBaseDir() {
		final String dir = this.baseDir == null || this.baseDir.isBlank() ? "" : this.baseDir;
		return Path.of(dir).toAbsolutePath().normalize();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setBaseDir(@Nullable final String baseDir) { this.baseDir = baseDir; }
	void setInputs(@Nullable final List<String> inputs) { this.inputs = inputs; }
	void setOutput(@Nullable final String output) { this.output = output; }
	void setPageBreak(@Nullable final String pageBreak) { this.pageBreak = pageBreak; }
	void setRewriteLocalLinks(final boolean rewriteLocalLinks) { this.rewriteLocalLinks = rewriteLocalLinks; }
	void setSkipCodeBlocks(final boolean skipCodeBlocks) { this.skipCodeBlocks = skipCodeBlocks; }
}
