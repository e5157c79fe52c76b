package org.javai.textgrid.grammar;

import java.util.List;
import org.javai.textgrid.lexer.TextGridToken;
import org.javai.textgrid.lexer.TokenType;

/**
 * Read position over a token list, shared by the grammar strategies.
 * The list is expected to end with an {@link TokenType#EOF} token.
 */
public class TokenCursor {

	private final List<TextGridToken> tokens;
	private int current = 0;

	public TokenCursor(List<TextGridToken> tokens) {
		if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
			throw new IllegalArgumentException("Token list must be terminated by an EOF token");
		}
		this.tokens = tokens;
	}

	public TextGridToken peek() {
		return tokens.get(current);
	}

	public TextGridToken advance() {
		TextGridToken token = peek();
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	public boolean check(TokenType type) {
		return peek().type() == type;
	}

	public boolean isAtEnd() {
		return peek().type() == TokenType.EOF;
	}

	/**
	 * Consumes the next token if it has the given type.
	 *
	 * @throws TextGridSyntaxException otherwise
	 */
	public TextGridToken expect(TokenType type, String expected) {
		if (!check(type)) {
			throw new TextGridSyntaxException(peek(), expected);
		}
		return advance();
	}

	/**
	 * Consumes an integer or decimal literal and returns it widened to double.
	 */
	public double expectNumber(String expected) {
		if (!peek().type().isNumber()) {
			throw new TextGridSyntaxException(peek(), expected);
		}
		return advance().doubleValue();
	}

	/**
	 * Consumes a quoted literal (a tier tag counts as one) and returns its content.
	 */
	public String expectString(String expected) {
		if (!peek().type().isString()) {
			throw new TextGridSyntaxException(peek(), expected);
		}
		return advance().value();
	}

	/**
	 * Consumes an integer literal.
	 */
	public int expectInt(String expected) {
		TextGridToken token = expect(TokenType.INT, expected);
		try {
			return Integer.parseInt(token.value());
		}
		catch (NumberFormatException e) {
			throw new TextGridSyntaxException(token, expected, "Integer literal out of range: " + token.value());
		}
	}

	/**
	 * Fails unless every token but the trailing EOF has been consumed.
	 */
	public void expectEnd(String expected) {
		if (!isAtEnd()) {
			throw new TextGridSyntaxException(peek(), expected);
		}
	}
}
