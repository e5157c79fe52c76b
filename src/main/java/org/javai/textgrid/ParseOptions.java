package org.javai.textgrid;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Configuration of a single parse call.
 *
 * @param format the encoding of the input
 * @param checkConsistency whether declared counts and bounds are verified against the parsed tiers
 * @param charset charset used to decode byte input that carries no byte-order mark
 */
public record ParseOptions(TextGridFormat format, boolean checkConsistency, Charset charset) {

	public ParseOptions {
		Objects.requireNonNull(format, "format must not be null");
		Objects.requireNonNull(charset, "charset must not be null");
	}

	/**
	 * Options for the given format name with consistency checking on.
	 *
	 * @throws IllegalArgumentException if the name is neither {@code full} nor {@code minimal}
	 */
	public static ParseOptions of(String format) {
		return TextGridSettings.builtIn().toOptions().withFormat(TextGridFormat.fromName(format));
	}

	public ParseOptions withFormat(TextGridFormat format) {
		return new ParseOptions(format, checkConsistency, charset);
	}

	public ParseOptions withConsistencyCheck(boolean checkConsistency) {
		return new ParseOptions(format, checkConsistency, charset);
	}

	public ParseOptions withCharset(Charset charset) {
		return new ParseOptions(format, checkConsistency, charset);
	}
}
