package io.evitadb.compendium.identity;

import javax.annotation.Nonnull;
import java.nio.file.Path;

/**
 * Maps files to stable identities and back.
 *
 * Implementations must be consistent: the same underlying file always yields the same identity,
 * whichever relative path was used to reach it.
 */
public interface FileIdentityResolver {

	/**
	 * Returns the identity of the file at the given path.
	 *
	 * @param path path of an existing file
	 * @return identity of the file
	 * @throws IdentityResolutionException if the file does not exist or cannot be identified
	 */
	@Nonnull
	FileIdentity identity(@Nonnull Path path);

	/**
	 * Returns the single path that carries the given identity.
	 *
	 * @param identity identity previously returned by {@link #identity(Path)}
	 * @return path of the file
	 * @throws IdentityResolutionException if no file or more than one file carries the identity
	 */
	@Nonnull
	Path pathOf(@Nonnull FileIdentity identity);
}
