package org.javai.textgrid;

/**
 * Base class of every failure raised while reading a TextGrid document.
 * <p>
 * Subclasses carry the structured details of the failure so callers can react
 * programmatically; the message is meant for diagnostics only.
 */
public class TextGridException extends RuntimeException {

	public TextGridException(String message) {
		super(message);
	}

	public TextGridException(String message, Throwable cause) {
		super(message, cause);
	}
}
