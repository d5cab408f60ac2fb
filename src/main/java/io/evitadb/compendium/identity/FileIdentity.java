package io.evitadb.compendium.identity;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Stable token identifying a file regardless of the relative path used to reach it.
 * The token doubles as the prefix of every anchor generated for the file in the merged document,
 * so it only contains characters that are valid in a pandoc explicit identifier.
 *
 * @param token the opaque identity token (e.g. `n4718263`)
 */
public record FileIdentity(@Nonnull String token) {

	/**
	 * Creates a new FileIdentity with validation.
	 */
	public FileIdentity {
		Objects.requireNonNull(token, "token must not be null");
		if (token.isBlank()) {
			throw new IllegalArgumentException("token must not be blank");
		}
	}

	/**
	 * Builds the globally unique anchor for a label of this file.
	 *
	 * @param label normalized label defined by the file
	 * @return anchor in the form `<token>-<label>`
	 */
	@Nonnull
	public String anchor(@Nonnull String label) {
		Objects.requireNonNull(label, "label must not be null");
		return this.token + "-" + label;
	}

	@Override
	public String toString() {
		return this.token;
	}
}
