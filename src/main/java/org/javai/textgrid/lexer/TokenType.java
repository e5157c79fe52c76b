package org.javai.textgrid.lexer;

/**
 * Kinds of tokens produced by {@link TextGridLexer}.
 */
public enum TokenType {
	FLOAT,          // 2.3
	INT,            // 3
	STRING,         // "quoted", quotes stripped
	EQUALS,         // =
	COLON,          // :
	LBRACKET,       // [
	RBRACKET,       // ]
	LANGLE,         // <
	RANGLE,         // >
	SIZE,           // size
	INTERVALS,      // intervals
	POINTS,         // points
	CLASS,          // class
	ITEM,           // item
	TIERS_EXIST,    // tiers?
	TAG_INTERVAL,   // "IntervalTier"
	TAG_TEXT,       // "TextTier"
	IDENTIFIER,     // property names and bare words
	EOF;

	/**
	 * Whether tokens of this type carry a numeric literal.
	 */
	public boolean isNumber() {
		return this == FLOAT || this == INT;
	}

	/**
	 * Whether tokens of this type carry quoted text. Tier tags are quoted text too.
	 */
	public boolean isString() {
		return this == STRING || this == TAG_INTERVAL || this == TAG_TEXT;
	}
}
