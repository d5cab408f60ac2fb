package io.evitadb.compendium.check;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Represents a link validation error found in one fragment of the document.
 *
 * @param sourceFile the file containing the offending link
 * @param targetFile the resolved target file of the link
 * @param label      the label the link points to, null for {@link LinkErrorType#DIRECT_LINK}
 * @param type       the kind of error
 */
public record LinkError(
	@Nonnull Path sourceFile,
	@Nonnull Path targetFile,
	@Nullable String label,
	@Nonnull LinkErrorType type
) {

	/**
	 * Creates a new LinkError with validation.
	 */
	public LinkError {
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");
		Objects.requireNonNull(type, "type must not be null");
		if (label == null && type != LinkErrorType.DIRECT_LINK) {
			throw new IllegalArgumentException("label is required for " + type);
		}
	}

	/**
	 * Returns a one-line human readable description naming the kind, the file and the label.
	 *
	 * @return description of the error
	 */
	@Nonnull
	public String describe() {
		return switch (this.type) {
			case LABEL_CLASH -> "link to overloaded label \"" + this.label + "\" in file \"" + this.targetFile + "\"";
			case DEAD_LABEL_LINK -> "link to inexistent label \"" + this.label + "\" in file \"" + this.targetFile + "\"";
			case DEAD_FILE_LINK -> "link to inexistent file \"" + this.targetFile + "\" (label is \"" + this.label + "\")";
			case DIRECT_LINK -> "direct link to file " + this.targetFile;
		};
	}

	/**
	 * Types of link validation errors.
	 */
	public enum LinkErrorType {
		/**
		 * The target file defines the label more than once, so the destination is ambiguous.
		 */
		LABEL_CLASH,

		/**
		 * The target file is part of the document but does not define the label.
		 */
		DEAD_LABEL_LINK,

		/**
		 * The target file is not part of the document.
		 */
		DEAD_FILE_LINK,

		/**
		 * The link targets a whole file instead of a section.
		 */
		DIRECT_LINK
	}
}
