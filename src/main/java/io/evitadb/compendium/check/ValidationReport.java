package io.evitadb.compendium.check;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of link validation: errors grouped by the file containing the links.
 * Files without errors are not present. Iteration follows the document order.
 *
 * @param errors map of source file to its link errors
 */
public record ValidationReport(
	@Nonnull Map<Path, List<LinkError>> errors
) {

	/**
	 * Creates a new ValidationReport with validation and defensive copying.
	 */
	public ValidationReport {
		Objects.requireNonNull(errors, "errors must not be null");
		final Map<Path, List<LinkError>> copy = new LinkedHashMap<>();
		for (final Map.Entry<Path, List<LinkError>> entry : errors.entrySet()) {
			if (!entry.getValue().isEmpty()) {
				copy.put(entry.getKey(), List.copyOf(entry.getValue()));
			}
		}
		errors = Collections.unmodifiableMap(copy);
	}

	/**
	 * Returns true if no link error was found.
	 *
	 * @return true when the document may be merged
	 */
	public boolean isSuccess() {
		return this.errors.isEmpty();
	}

	/**
	 * Returns the total number of link errors across all files.
	 *
	 * @return error count
	 */
	public int errorCount() {
		return this.errors.values().stream().mapToInt(List::size).sum();
	}

	/**
	 * Returns the errors found in one file.
	 *
	 * @param sourceFile the file containing the links
	 * @return errors, empty if none
	 */
	@Nonnull
	public List<LinkError> errorsOf(@Nonnull Path sourceFile) {
		return this.errors.getOrDefault(sourceFile, List.of());
	}

	/**
	 * Creates an empty successful report.
	 *
	 * @return report without errors
	 */
	@Nonnull
	public static ValidationReport success() {
		return new ValidationReport(Map.of());
	}
}
