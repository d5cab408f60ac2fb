package io.evitadb.compendium.check;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Exception thrown when a cross-file link has a shape the merge cannot interpret,
 * such as a destination with more than one `#` separator.
 */
public final class MalformedLinkException extends RuntimeException {

	@Nonnull
	private final Path sourceFile;
	@Nonnull
	private final String destination;

	/**
	 * Creates a new MalformedLinkException.
	 *
	 * @param sourceFile  file containing the link
	 * @param destination the offending destination
	 */
	public MalformedLinkException(@Nonnull Path sourceFile, @Nonnull String destination) {
		super("Unexpected link in file " + sourceFile + ": " + destination);
		this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		this.destination = Objects.requireNonNull(destination, "destination must not be null");
	}

	/**
	 * Returns the file containing the link.
	 *
	 * @return source file
	 */
	@Nonnull
	public Path getSourceFile() {
		return this.sourceFile;
	}

	/**
	 * Returns the offending link destination.
	 *
	 * @return destination as written
	 */
	@Nonnull
	public String getDestination() {
		return this.destination;
	}
}
