package org.javai.textgrid;

/**
 * Thrown when the caller hands the parser an input representation it cannot read.
 * Raised before any tokenization takes place.
 */
public class UnsupportedInputException extends TextGridException {

	private final Class<?> inputType;

	public UnsupportedInputException(Class<?> inputType) {
		super("Unsupported TextGrid input: " + (inputType == null ? "null" : inputType.getName())
				+ " (expected a Path, File, Reader, InputStream or CharSequence)");
		this.inputType = inputType;
	}

	/**
	 * The rejected input's type, or {@code null} when the input itself was null.
	 */
	public Class<?> inputType() {
		return inputType;
	}
}
