package io.evitadb.compendium.merge;

import javax.annotation.Nonnull;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes the merged document line by line to a target file using UTF-8.
 *
 * Opening the writer creates the parent directory structure and truncates an existing target,
 * so the file is always fully recreated. Output is flushed after every fragment; a failure in
 * the middle of the merge therefore leaves a partial file on disk, which must be considered invalid.
 */
public final class MergedDocumentWriter implements Closeable {

	@Nonnull
	private final Path target;
	@Nonnull
	private final BufferedWriter writer;

	private MergedDocumentWriter(@Nonnull Path target, @Nonnull BufferedWriter writer) {
		this.target = target;
		this.writer = writer;
	}

	/**
	 * Opens the target file for writing, replacing any previous content.
	 *
	 * @param targetFile the path of the merged document
	 * @return open writer; must be closed by the caller
	 * @throws IOException if directories cannot be created or the file cannot be opened
	 */
	@Nonnull
	public static MergedDocumentWriter open(@Nonnull Path targetFile) throws IOException {
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		final BufferedWriter writer = Files.newBufferedWriter(
			absolute,
			StandardCharsets.UTF_8,
			StandardOpenOption.CREATE,
			StandardOpenOption.TRUNCATE_EXISTING,
			StandardOpenOption.WRITE
		);
		return new MergedDocumentWriter(absolute, writer);
	}

	/**
	 * Returns the absolute path being written.
	 *
	 * @return target path
	 */
	@Nonnull
	public Path getTarget() {
		return this.target;
	}

	/**
	 * Writes a line followed by a line feed.
	 *
	 * @param line the line without terminator
	 * @throws IOException if writing fails
	 */
	public void writeLine(@Nonnull String line) throws IOException {
		this.writer.write(line);
		this.writer.write('\n');
	}

	/**
	 * Ends a fragment: writes the page break marker surrounded by blank lines and flushes.
	 *
	 * @param marker the page break marker, e.g. `\newpage`
	 * @throws IOException if writing fails
	 */
	public void endFragment(@Nonnull String marker) throws IOException {
		this.writer.write("\n\n");
		this.writer.write(marker);
		this.writer.write("\n\n");
		this.writer.flush();
	}

	@Override
	public void close() throws IOException {
		this.writer.close();
	}
}
