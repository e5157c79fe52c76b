package org.javai.textgrid.grammar;

import org.javai.textgrid.TextGridException;
import org.javai.textgrid.lexer.TextGridToken;
import org.javai.textgrid.lexer.TokenType;

/**
 * Thrown when the token stream matches no production of the grammar at the current position.
 */
public class TextGridSyntaxException extends TextGridException {

	private final TextGridToken token;
	private final String expected;

	public TextGridSyntaxException(TextGridToken token, String expected) {
		super(describe(token, expected));
		this.token = token;
		this.expected = expected;
	}

	public TextGridSyntaxException(TextGridToken token, String expected, String detail) {
		super(detail + " at " + token.location());
		this.token = token;
		this.expected = expected;
	}

	/**
	 * The offending token. At end of input this is the {@link TokenType#EOF} token.
	 */
	public TextGridToken token() {
		return token;
	}

	/**
	 * What the grammar would have accepted at this position.
	 */
	public String expected() {
		return expected;
	}

	public boolean isEndOfInput() {
		return token.type() == TokenType.EOF;
	}

	private static String describe(TextGridToken token, String expected) {
		if (token.type() == TokenType.EOF) {
			return "Unexpected end of input at " + token.location() + ": expected " + expected;
		}
		return "Unexpected " + token + " at " + token.location() + ": expected " + expected;
	}
}
