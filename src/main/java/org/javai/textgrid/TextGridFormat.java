package org.javai.textgrid;

import java.util.Locale;

/**
 * The two textual encodings of a Praat TextGrid.
 */
public enum TextGridFormat {

	/** Verbose encoding where every value is introduced by its key. */
	FULL("full"),

	/** Compact encoding where values are identified by position only. */
	MINIMAL("minimal");

	private final String id;

	TextGridFormat(String id) {
		this.id = id;
	}

	/**
	 * Resolves a format from its name, ignoring case.
	 *
	 * @throws IllegalArgumentException if the name is neither {@code full} nor {@code minimal}
	 */
	public static TextGridFormat fromName(String name) {
		if (name != null) {
			String normalized = name.trim().toLowerCase(Locale.ROOT);
			for (TextGridFormat format : values()) {
				if (format.id.equals(normalized)) {
					return format;
				}
			}
		}
		throw new IllegalArgumentException(
				"Unsupported TextGrid format: '" + name + "' (expected 'full' or 'minimal')");
	}

	@Override
	public String toString() {
		return id;
	}
}
