package org.javai.textgrid.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.textgrid.TextGridFormat;

/**
 * Tokenizer for both TextGrid encodings.
 * <p>
 * Numbers, strings and the single-character literals {@code = : [ ] < >} are
 * shared by the two dialects. The full dialect additionally maps a handful of
 * identifier spellings onto keyword tokens; the minimal dialect never uses keys,
 * so every bare word stays an {@link TokenType#IDENTIFIER} there.
 * <p>
 * A lexer holds the cursor for a single input and is not reusable.
 */
public class TextGridLexer {

	private static final Map<String, TokenType> KEYWORDS = Map.of(
			"size", TokenType.SIZE,
			"intervals", TokenType.INTERVALS,
			"points", TokenType.POINTS,
			"class", TokenType.CLASS,
			"item", TokenType.ITEM,
			"tiers?", TokenType.TIERS_EXIST
	);

	private static final Map<String, TokenType> TAGS = Map.of(
			"IntervalTier", TokenType.TAG_INTERVAL,
			"TextTier", TokenType.TAG_TEXT
	);

	private final String input;
	private final TextGridFormat format;
	private int pos = 0;
	private int line = 1;

	public TextGridLexer(String input, TextGridFormat format) {
		if (format == null) {
			throw new IllegalArgumentException("Format cannot be null");
		}
		this.input = input != null ? input : "";
		this.format = format;
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens, always terminated by an {@link TokenType#EOF} token
	 * @throws LexicalException if a character matches no token rule
	 */
	public List<TextGridToken> tokenize() {
		List<TextGridToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new TextGridToken(TokenType.EOF, "", pos, line));
		return tokens;
	}

	private TextGridToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '=' -> single(TokenType.EQUALS, start);
			case ':' -> single(TokenType.COLON, start);
			case '[' -> single(TokenType.LBRACKET, start);
			case ']' -> single(TokenType.RBRACKET, start);
			case '<' -> single(TokenType.LANGLE, start);
			case '>' -> single(TokenType.RANGLE, start);
			case '"' -> scanString();
			default -> {
				if (isDigit(c) || (c == '-' && isDigit(peekNext()))) {
					yield scanNumber();
				} else if (Character.isLetter(c)) {
					yield scanIdentifier();
				} else {
					throw LexicalException.unexpected(c, pos, line);
				}
			}
		};
	}

	private TextGridToken single(TokenType type, int start) {
		char c = advance();
		return new TextGridToken(type, String.valueOf(c), start, line);
	}

	private TextGridToken scanString() {
		int start = pos;
		int startLine = line;
		advance(); // opening quote

		while (!isAtEnd() && peek() != '"') {
			if (advance() == '\n') {
				line++;
			}
		}

		if (isAtEnd()) {
			throw LexicalException.unterminatedString(start, startLine);
		}

		String value = input.substring(start + 1, pos);
		advance(); // closing quote
		TokenType type = TAGS.getOrDefault(value, TokenType.STRING);
		return new TextGridToken(type, value, start, startLine);
	}

	private TextGridToken scanNumber() {
		int start = pos;
		boolean decimal = false;

		if (peek() == '-') {
			advance();
		}
		skipDigits();

		if (peek() == '.' && isDigit(peekNext())) {
			advance();
			skipDigits();
			decimal = true;
		}

		if ((peek() == 'e' || peek() == 'E') && startsExponent()) {
			advance();
			if (peek() == '+' || peek() == '-') {
				advance();
			}
			skipDigits();
			decimal = true;
		}

		String value = input.substring(start, pos);
		return new TextGridToken(decimal ? TokenType.FLOAT : TokenType.INT, value, start, line);
	}

	private boolean startsExponent() {
		int next = pos + 1;
		if (next < input.length() && (input.charAt(next) == '+' || input.charAt(next) == '-')) {
			next++;
		}
		return next < input.length() && isDigit(input.charAt(next));
	}

	private TextGridToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		if (peek() == '?') {
			advance();
		}

		String value = input.substring(start, pos).trim();
		TokenType type = format == TextGridFormat.FULL
				? KEYWORDS.getOrDefault(value, TokenType.IDENTIFIER)
				: TokenType.IDENTIFIER;
		return new TextGridToken(type, value, start, line);
	}

	private void skipDigits() {
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			if (advance() == '\n') {
				line++;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierChar(char c) {
		return Character.isLetter(c) || c == ' ' || c == '\t';
	}
}
