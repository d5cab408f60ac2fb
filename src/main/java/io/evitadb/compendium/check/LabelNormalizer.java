package io.evitadb.compendium.check;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Turns heading text into the label used as anchor key within a file.
 *
 * Rules:
 * - ASCII letters `A`-`Z` are lowercased, every other character outside the rules below is kept as is
 * - a run of spaces, tabs, `/` and `-` becomes a single `-`; other whitespace is an ordinary character
 * - `,`, `.` and backtick are deleted and do not interrupt a separator run
 *
 * Normalizing a label again yields the same label.
 */
public final class LabelNormalizer {

	private LabelNormalizer() {
	}

	/**
	 * Normalizes heading text into a label.
	 *
	 * @param text heading text without the leading `#` run
	 * @return normalized label, empty for text without any kept character
	 */
	@Nonnull
	public static String normalize(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		int start = 0;
		int end = text.length();
		while (start < end && isBlank(text.charAt(start))) {
			start++;
		}
		while (end > start && isBlank(text.charAt(end - 1))) {
			end--;
		}
		final StringBuilder sb = new StringBuilder(end - start);
		boolean inSeparator = false;
		for (int i = start; i < end; i++) {
			final char c = text.charAt(i);
			if (isBlank(c) || c == '/' || c == '-') {
				if (!inSeparator) {
					sb.append('-');
					inSeparator = true;
				}
			} else if (c >= 'A' && c <= 'Z') {
				sb.append((char) (c + ('a' - 'A')));
				inSeparator = false;
			} else if (c != ',' && c != '.' && c != '`') {
				sb.append(c);
				inSeparator = false;
			}
		}
		return sb.toString();
	}

	/**
	 * Space or tab, the only characters that separate words of a heading.
	 */
	static boolean isBlank(char c) {
		return c == ' ' || c == '\t';
	}
}
