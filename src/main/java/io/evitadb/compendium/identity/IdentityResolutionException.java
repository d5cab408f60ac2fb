package io.evitadb.compendium.identity;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Exception thrown when a file identity cannot be resolved unambiguously.
 *
 * Raised for a path that denotes no file, and for an identity that matches zero or several files.
 * Outside of link validation this is an internal inconsistency the merge cannot recover from.
 */
public final class IdentityResolutionException extends RuntimeException {

	@Nonnull
	private final String subject;
	@Nonnull
	private final Reason reason;

	/**
	 * Creates a new IdentityResolutionException.
	 *
	 * @param subject the path or identity token that failed to resolve
	 * @param reason  why the lookup failed
	 * @param message human readable description
	 * @param cause   underlying failure, may be null
	 */
	public IdentityResolutionException(
		@Nonnull String subject,
		@Nonnull Reason reason,
		@Nonnull String message,
		Throwable cause
	) {
		super(message, cause);
		this.subject = Objects.requireNonNull(subject, "subject must not be null");
		this.reason = Objects.requireNonNull(reason, "reason must not be null");
	}

	/**
	 * Shortcut for a path that does not denote an existing file.
	 *
	 * @param path  the missing path
	 * @param cause underlying I/O failure
	 * @return new exception
	 */
	@Nonnull
	public static IdentityResolutionException missingFile(@Nonnull Path path, Throwable cause) {
		return new IdentityResolutionException(
			path.toString(), Reason.MISSING, "Cannot resolve identity of file: " + path, cause
		);
	}

	/**
	 * Returns the path or identity token that failed to resolve.
	 *
	 * @return subject of the lookup
	 */
	@Nonnull
	public String getSubject() {
		return this.subject;
	}

	/**
	 * Returns why the lookup failed.
	 *
	 * @return failure reason
	 */
	@Nonnull
	public Reason getReason() {
		return this.reason;
	}

	/**
	 * Kinds of identity lookup failures.
	 */
	public enum Reason {
		/**
		 * No file matches.
		 */
		MISSING,

		/**
		 * More than one file matches.
		 */
		AMBIGUOUS
	}
}
