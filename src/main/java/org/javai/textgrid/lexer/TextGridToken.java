package org.javai.textgrid.lexer;

/**
 * A token of a TextGrid document.
 *
 * @param type the token type
 * @param value the literal text of the token (string content without quotes)
 * @param offset the character offset of the token in the input
 * @param line the 1-based line the token starts on
 */
public record TextGridToken(TokenType type, String value, int offset, int line) {

	@Override
	public String toString() {
		return switch (type) {
			case STRING, TAG_INTERVAL, TAG_TEXT -> type + "(\"" + value + "\")";
			case FLOAT, INT, IDENTIFIER -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	/**
	 * The numeric value of a {@link TokenType#FLOAT} or {@link TokenType#INT} token, widened to double.
	 *
	 * @throws IllegalStateException if this token is not numeric
	 */
	public double doubleValue() {
		if (!type.isNumber()) {
			throw new IllegalStateException("Not a numeric token: " + this);
		}
		return Double.parseDouble(value);
	}

	/**
	 * Describes where this token sits in the input, for error messages.
	 */
	public String location() {
		return "line " + line + ", offset " + offset;
	}
}
