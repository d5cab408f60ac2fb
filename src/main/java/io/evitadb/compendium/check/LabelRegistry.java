package io.evitadb.compendium.check;

import io.evitadb.compendium.identity.FileIdentity;
import io.evitadb.compendium.identity.FileIdentityResolver;
import io.evitadb.compendium.model.MarkdownSource;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Labels defined by every file of the document, keyed by file identity.
 *
 * For each file the registry keeps the set of first-seen labels and the set of labels that occurred
 * more than once ("clashes"). Every clash is also present among the labels: the first occurrence is
 * retained as canonical. Clash detection is strictly per file.
 *
 * The registry is immutable once built; use {@link Builder} or {@link #build(List, FileIdentityResolver, boolean)}.
 */
public final class LabelRegistry {

	@Nonnull
	private final Map<FileIdentity, Path> files;
	@Nonnull
	private final Map<FileIdentity, Set<String>> labels;
	@Nonnull
	private final Map<FileIdentity, Set<String>> clashes;

	private LabelRegistry(
		@Nonnull Map<FileIdentity, Path> files,
		@Nonnull Map<FileIdentity, Set<String>> labels,
		@Nonnull Map<FileIdentity, Set<String>> clashes
	) {
		this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
		this.labels = freeze(labels);
		this.clashes = freeze(clashes);
	}

	/**
	 * Builds the registry over all sources, in order.
	 *
	 * @param sources        the document fragments
	 * @param resolver       identity resolver
	 * @param skipCodeBlocks whether headings inside code blocks are ignored
	 * @return the populated registry
	 */
	@Nonnull
	public static LabelRegistry build(
		@Nonnull List<MarkdownSource> sources,
		@Nonnull FileIdentityResolver resolver,
		boolean skipCodeBlocks
	) {
		Objects.requireNonNull(sources, "sources must not be null");
		final Builder builder = new Builder(resolver);
		for (final MarkdownSource source : sources) {
			builder.addFile(source.getFile());
			for (final String label : HeadingLabelExtractor.extractLabels(source, skipCodeBlocks)) {
				builder.addLabel(source.getFile(), label);
			}
		}
		return builder.build();
	}

	/**
	 * Returns true if the file is part of the document.
	 *
	 * @param file file identity
	 * @return true if the file was registered
	 */
	public boolean contains(@Nonnull FileIdentity file) {
		return this.files.containsKey(file);
	}

	/**
	 * Returns the identities of all registered files in registration order.
	 *
	 * @return ordered set of identities
	 */
	@Nonnull
	public Set<FileIdentity> files() {
		return this.files.keySet();
	}

	/**
	 * Returns the path under which the file was first registered.
	 *
	 * @param file file identity
	 * @return registered path
	 * @throws IllegalArgumentException if the file is unknown
	 */
	@Nonnull
	public Path registeredPath(@Nonnull FileIdentity file) {
		final Path path = this.files.get(file);
		if (path == null) {
			throw new IllegalArgumentException("Unknown file: " + file);
		}
		return path;
	}

	/**
	 * Returns the labels defined by a file in definition order.
	 *
	 * @param file file identity
	 * @return labels, empty for unknown files or files without headings
	 */
	@Nonnull
	public Set<String> labels(@Nonnull FileIdentity file) {
		return this.labels.getOrDefault(file, Set.of());
	}

	/**
	 * Returns the labels defined more than once by a file.
	 *
	 * @param file file identity
	 * @return clashing labels, empty if none
	 */
	@Nonnull
	public Set<String> clashes(@Nonnull FileIdentity file) {
		return this.clashes.getOrDefault(file, Set.of());
	}

	/**
	 * Returns all files having at least one clashing label.
	 *
	 * @return map of file identity to its clashing labels, in registration order
	 */
	@Nonnull
	public Map<FileIdentity, Set<String>> clashes() {
		return this.clashes;
	}

	/**
	 * Returns true if the file defines the label.
	 *
	 * @param file  file identity
	 * @param label label to look up
	 * @return true if defined at least once
	 */
	public boolean defines(@Nonnull FileIdentity file, @Nonnull String label) {
		return labels(file).contains(label);
	}

	/**
	 * Returns true if the file defines the label more than once.
	 *
	 * @param file  file identity
	 * @param label label to look up
	 * @return true if the label clashes
	 */
	public boolean isClash(@Nonnull FileIdentity file, @Nonnull String label) {
		return clashes(file).contains(label);
	}

	@Nonnull
	private static Map<FileIdentity, Set<String>> freeze(@Nonnull Map<FileIdentity, Set<String>> source) {
		final Map<FileIdentity, Set<String>> copy = new LinkedHashMap<>();
		for (final Map.Entry<FileIdentity, Set<String>> entry : source.entrySet()) {
			copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
		}
		return Collections.unmodifiableMap(copy);
	}

	/**
	 * Outcome of inserting a label into a per-file set.
	 */
	public enum InsertResult {
		/**
		 * The label was not present and has been added.
		 */
		INSERTED,

		/**
		 * The label was already present; the set is unchanged.
		 */
		ALREADY_PRESENT
	}

	/**
	 * Mutable accumulator producing a {@link LabelRegistry}.
	 */
	public static final class Builder {

		@Nonnull
		private final FileIdentityResolver resolver;
		@Nonnull
		private final Map<FileIdentity, Path> files = new LinkedHashMap<>();
		@Nonnull
		private final Map<FileIdentity, Set<String>> labels = new LinkedHashMap<>();
		@Nonnull
		private final Map<FileIdentity, Set<String>> clashes = new LinkedHashMap<>();

		/**
		 * Creates an empty builder.
		 *
		 * @param resolver identity resolver used to key files
		 */
		public Builder(@Nonnull FileIdentityResolver resolver) {
			this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		}

		/**
		 * Registers a file as part of the document, even if it defines no label.
		 *
		 * @param file path of the file
		 * @return identity of the file
		 */
		@Nonnull
		public FileIdentity addFile(@Nonnull Path file) {
			Objects.requireNonNull(file, "file must not be null");
			final FileIdentity identity = this.resolver.identity(file);
			this.files.putIfAbsent(identity, file);
			return identity;
		}

		/**
		 * Adds a label to a file. A label already known for the file is recorded as a clash instead.
		 *
		 * @param file  path of the file defining the label
		 * @param label normalized label
		 * @return {@link InsertResult#INSERTED} for a first occurrence, {@link InsertResult#ALREADY_PRESENT} for a repeat
		 */
		@Nonnull
		public InsertResult addLabel(@Nonnull Path file, @Nonnull String label) {
			Objects.requireNonNull(label, "label must not be null");
			final FileIdentity identity = addFile(file);
			final InsertResult result = insert(this.labels, identity, label);
			if (result == InsertResult.ALREADY_PRESENT) {
				insert(this.clashes, identity, label);
			}
			return result;
		}

		/**
		 * Creates the immutable registry.
		 *
		 * @return registry snapshot
		 */
		@Nonnull
		public LabelRegistry build() {
			return new LabelRegistry(this.files, this.labels, this.clashes);
		}

		@Nonnull
		private static InsertResult insert(
			@Nonnull Map<FileIdentity, Set<String>> map,
			@Nonnull FileIdentity identity,
			@Nonnull String label
		) {
			final boolean added = map.computeIfAbsent(identity, k -> new LinkedHashSet<>()).add(label);
			return added ? InsertResult.INSERTED : InsertResult.ALREADY_PRESENT;
		}
	}
}
