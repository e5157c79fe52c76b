package org.javai.textgrid.lexer;

import org.javai.textgrid.TextGridException;

/**
 * Thrown when the input contains a character that starts no token.
 */
public class LexicalException extends TextGridException {

	private final char character;
	private final int offset;
	private final int line;

	public LexicalException(String message, char character, int offset, int line) {
		super(message);
		this.character = character;
		this.offset = offset;
		this.line = line;
	}

	static LexicalException unexpected(char character, int offset, int line) {
		return new LexicalException(
				"Unexpected character '" + printable(character) + "' at line " + line + ", offset " + offset,
				character, offset, line);
	}

	static LexicalException unterminatedString(int offset, int line) {
		return new LexicalException(
				"Unterminated string starting at line " + line + ", offset " + offset, '"', offset, line);
	}

	public char character() {
		return character;
	}

	public int offset() {
		return offset;
	}

	public int line() {
		return line;
	}

	private static String printable(char c) {
		return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
	}
}
