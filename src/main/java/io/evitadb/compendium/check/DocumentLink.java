package io.evitadb.compendium.check;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A link from one fragment of the document to a section.
 *
 * Cross-file links carry the target path relative to the directory of the source file (`./other.md`);
 * local links (`#section`) have no path and target the source file itself.
 *
 * @param sourceFile  the file containing the link
 * @param destination the original link destination as written in the markdown
 * @param path        the relative path of the target file, null for a local link
 * @param label       the section label without `#`, null when the link targets a whole file
 */
public record DocumentLink(
	@Nonnull Path sourceFile,
	@Nonnull String destination,
	@Nullable String path,
	@Nullable String label
) {

	/**
	 * Creates a new DocumentLink with validation.
	 */
	public DocumentLink {
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(destination, "destination must not be null");
		if (path == null && label == null) {
			throw new IllegalArgumentException("link must have a path or a label: " + destination);
		}
	}

	/**
	 * Returns true if this link points to a section of its own file.
	 *
	 * @return true for `(#label)` links
	 */
	public boolean isLocal() {
		return this.path == null;
	}

	/**
	 * Returns true if this cross-file link omits the section label.
	 *
	 * @return true for `(./file.md)` links
	 */
	public boolean isDirect() {
		return this.path != null && this.label == null;
	}

	/**
	 * Resolves the target file against the directory of the source file.
	 * Link paths are never relative to the working directory.
	 *
	 * @return normalized target path
	 */
	@Nonnull
	public Path resolveTarget() {
		if (this.path == null) {
			return this.sourceFile;
		}
		final Path parent = this.sourceFile.getParent();
		final Path base = parent == null ? Path.of("") : parent;
		return base.resolve(this.path).normalize();
	}
}
