package io.evitadb.compendium.identity;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Resolves file identities from the key the operating system assigns to each file.
 *
 * On Unix-like systems the key carries the inode number, which is used as the token (`n<inode>`),
 * so two relative paths reaching the same file always share an identity. On platforms that report
 * no file key the token is derived from the real (symlink-free, normalized) path instead.
 *
 * Reverse lookup walks the search root and collects every regular file with a matching identity.
 * Symbolic links met during the walk are not followed, so a link pointing at a file does not make
 * its identity ambiguous.
 */
public final class FileKeyIdentityResolver implements FileIdentityResolver {

	/**
	 * Matches the inode part of the Unix file key, e.g. `(dev=fd01,ino=4718263)`.
	 */
	private static final Pattern INODE_PATTERN = Pattern.compile("ino=(\\d+)");

	@Nonnull
	private final Path searchRoot;

	/**
	 * Creates a resolver.
	 *
	 * @param searchRoot directory scanned by {@link #pathOf(FileIdentity)}
	 */
	public FileKeyIdentityResolver(@Nonnull Path searchRoot) {
		this.searchRoot = Objects.requireNonNull(searchRoot, "searchRoot must not be null")
			.toAbsolutePath().normalize();
	}

	@Nonnull
	@Override
	public FileIdentity identity(@Nonnull Path path) {
		Objects.requireNonNull(path, "path must not be null");
		return readIdentity(path);
	}

	@Nonnull
	private static FileIdentity readIdentity(@Nonnull Path path, @Nonnull LinkOption... options) {
		final BasicFileAttributes attrs;
		try {
			attrs = Files.readAttributes(path, BasicFileAttributes.class, options);
		} catch (IOException e) {
			throw IdentityResolutionException.missingFile(path, e);
		}
		if (!attrs.isRegularFile()) {
			throw IdentityResolutionException.missingFile(path, null);
		}
		final String token = tokenOf(attrs.fileKey());
		if (token != null) {
			return new FileIdentity(token);
		}
		try {
			final Path real = path.toRealPath();
			return new FileIdentity("p" + Integer.toHexString(real.toString().hashCode()));
		} catch (IOException e) {
			throw IdentityResolutionException.missingFile(path, e);
		}
	}

	@Nonnull
	@Override
	public Path pathOf(@Nonnull FileIdentity identity) {
		Objects.requireNonNull(identity, "identity must not be null");
		final List<Path> matches = new ArrayList<>(1);
		try (Stream<Path> stream = Files.walk(this.searchRoot)) {
			stream
				.filter(candidate -> Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS))
				.filter(candidate -> identity.equals(identityOrNull(candidate)))
				.forEach(matches::add);
		} catch (IOException | UncheckedIOException e) {
			throw new IdentityResolutionException(
				identity.token(),
				IdentityResolutionException.Reason.MISSING,
				"Cannot scan " + this.searchRoot + " for file " + identity,
				e
			);
		}
		if (matches.isEmpty()) {
			throw new IdentityResolutionException(
				identity.token(),
				IdentityResolutionException.Reason.MISSING,
				"No file under " + this.searchRoot + " has identity " + identity,
				null
			);
		}
		if (matches.size() > 1) {
			throw new IdentityResolutionException(
				identity.token(),
				IdentityResolutionException.Reason.AMBIGUOUS,
				"Identity " + identity + " is shared by several files: " + matches,
				null
			);
		}
		return matches.get(0);
	}

	@Nullable
	private static FileIdentity identityOrNull(@Nonnull Path candidate) {
		try {
			return readIdentity(candidate, LinkOption.NOFOLLOW_LINKS);
		} catch (IdentityResolutionException e) {
			// vanished while walking
			return null;
		}
	}

	@Nullable
	private static String tokenOf(@Nullable Object fileKey) {
		if (fileKey == null) {
			return null;
		}
		final Matcher matcher = INODE_PATTERN.matcher(fileKey.toString());
		return matcher.find() ? "n" + matcher.group(1) : null;
	}
}
