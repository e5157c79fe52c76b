package org.javai.textgrid.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.javai.textgrid.lexer.TextGridToken;
import org.javai.textgrid.lexer.TokenType;
import org.javai.textgrid.model.Interval;
import org.javai.textgrid.model.IntervalTier;
import org.javai.textgrid.model.Point;
import org.javai.textgrid.model.TextTier;
import org.javai.textgrid.model.Tier;

/**
 * Grammar of the verbose TextGrid encoding, where every value is introduced by its key:
 *
 * <pre>
 * textgrid      := {header_prop}* tiers_block
 * header_prop   := IDENT '=' (STRING|INT|FLOAT) | SIZE '=' INT | TIERS_EXIST '&lt;' IDENT '&gt;'
 * tiers_block   := ITEM '[' ']' ':' {tier}*
 * tier          := item_header CLASS '=' (TAG_INTERVAL | TAG_TEXT) tier_header {item}*
 * tier_header   := {IDENT '=' value}* (INTERVALS|POINTS) ':' SIZE '=' INT
 * item          := (INTERVALS|POINTS) '[' INT ']' ':' {IDENT '=' value}*
 * </pre>
 *
 * The property lines of a tier header and of an interval or point are looked up by
 * key, so their order within the block does not matter. Indices inside brackets are
 * read but not checked against the actual position.
 * <p>
 * The tiers block may only be left out when the header declares {@code tiers? <absent>}.
 * <p>
 * This class is stateless; all parse state lives in the {@link TokenCursor}.
 */
public class FullGrammarStrategy implements GrammarStrategy {

	private static final String XMIN = "xmin";
	private static final String XMAX = "xmax";

	@Override
	public ParsedTextGrid parse(List<TextGridToken> tokens) {
		TokenCursor cursor = new TokenCursor(tokens);
		DocumentHeader header = parseHeader(cursor);

		List<Tier> tiers = new ArrayList<>();
		List<TierHeader> tierHeaders = new ArrayList<>();
		if (cursor.isAtEnd() && declaresAbsentTiers(tokens)) {
			return new ParsedTextGrid(header, tiers, tierHeaders);
		}

		cursor.expect(TokenType.ITEM, "'item []:' or a header property");
		cursor.expect(TokenType.LBRACKET, "'['");
		cursor.expect(TokenType.RBRACKET, "']'");
		cursor.expect(TokenType.COLON, "':'");

		while (cursor.check(TokenType.ITEM)) {
			parseTier(cursor, tiers, tierHeaders);
		}
		cursor.expectEnd("'item [n]:' or end of input");

		return new ParsedTextGrid(header, tiers, tierHeaders);
	}

	private static boolean declaresAbsentTiers(List<TextGridToken> tokens) {
		boolean absent = false;
		for (int i = 0; i + 2 < tokens.size(); i++) {
			if (tokens.get(i).type() == TokenType.TIERS_EXIST) {
				absent = "absent".equals(tokens.get(i + 2).value());
			}
		}
		return absent;
	}

	private DocumentHeader parseHeader(TokenCursor cursor) {
		Double xmin = null;
		Double xmax = null;
		Integer size = null;
		boolean tiersExist = false;
		Map<String, String> properties = new LinkedHashMap<>();

		while (true) {
			TextGridToken token = cursor.peek();
			switch (token.type()) {
				case IDENTIFIER -> {
					cursor.advance();
					cursor.expect(TokenType.EQUALS, "'=' after '" + token.value() + "'");
					if (XMIN.equals(token.value()) || XMAX.equals(token.value())) {
						double value = cursor.expectNumber("a number for '" + token.value() + "'");
						if (XMIN.equals(token.value())) {
							xmin = value;
						} else {
							xmax = value;
						}
					} else {
						TextGridToken value = cursor.peek();
						if (!value.type().isString() && !value.type().isNumber()) {
							throw new TextGridSyntaxException(value, "a string or number for '" + token.value() + "'");
						}
						properties.put(token.value(), cursor.advance().value());
					}
				}
				case SIZE -> {
					cursor.advance();
					cursor.expect(TokenType.EQUALS, "'=' after 'size'");
					size = cursor.expectInt("the number of tiers");
				}
				case TIERS_EXIST -> {
					cursor.advance();
					cursor.expect(TokenType.LANGLE, "'<' after 'tiers?'");
					tiersExist = "exists".equals(cursor.expect(TokenType.IDENTIFIER, "'exists' or 'absent'").value());
					cursor.expect(TokenType.RANGLE, "'>'");
				}
				default -> {
					return new DocumentHeader(xmin, xmax, size, tiersExist, properties);
				}
			}
		}
	}

	private void parseTier(TokenCursor cursor, List<Tier> tiers, List<TierHeader> tierHeaders) {
		parseSubHeader(cursor, TokenType.ITEM);
		cursor.expect(TokenType.CLASS, "'class'");
		cursor.expect(TokenType.EQUALS, "'=' after 'class'");

		TextGridToken tag = cursor.peek();
		TierKind kind = switch (tag.type()) {
			case TAG_INTERVAL -> TierKind.INTERVAL;
			case TAG_TEXT -> TierKind.TEXT;
			default -> throw new TextGridSyntaxException(tag, "\"IntervalTier\" or \"TextTier\"");
		};
		cursor.advance();

		PropertyBlock properties = PropertyBlock.collect(cursor, Set.of("name", XMIN, XMAX));
		String name = properties.string("name");
		double xmin = properties.number(XMIN);
		double xmax = properties.number(XMAX);

		cursor.expect(kind.itemKeyword, "'" + kind.itemName + ": size'");
		cursor.expect(TokenType.COLON, "':'");
		cursor.expect(TokenType.SIZE, "'size'");
		cursor.expect(TokenType.EQUALS, "'='");
		int size = cursor.expectInt("the number of " + kind.itemName);
		tierHeaders.add(new TierHeader(name, xmin, xmax, size));

		if (kind == TierKind.INTERVAL) {
			List<Interval> intervals = new ArrayList<>();
			while (cursor.check(TokenType.INTERVALS)) {
				parseSubHeader(cursor, TokenType.INTERVALS);
				PropertyBlock item = PropertyBlock.collect(cursor, kind.itemKeys);
				intervals.add(new Interval(item.number(XMIN), item.number(XMAX), item.string("text")));
			}
			tiers.add(new IntervalTier(name, intervals));
		} else {
			List<Point> points = new ArrayList<>();
			while (cursor.check(TokenType.POINTS)) {
				parseSubHeader(cursor, TokenType.POINTS);
				PropertyBlock item = PropertyBlock.collect(cursor, kind.itemKeys);
				points.add(new Point(item.number("number"), item.string("mark")));
			}
			tiers.add(new TextTier(name, points));
		}
	}

	/**
	 * Consumes {@code keyword '[' INT ']' ':'}. The index is not checked.
	 */
	private void parseSubHeader(TokenCursor cursor, TokenType keyword) {
		TextGridToken header = cursor.expect(keyword, "'" + keywordText(keyword) + " [n]:'");
		cursor.expect(TokenType.LBRACKET, "'[' after '" + header.value() + "'");
		cursor.expectInt("an index");
		cursor.expect(TokenType.RBRACKET, "']'");
		cursor.expect(TokenType.COLON, "':'");
	}

	private static String keywordText(TokenType keyword) {
		return switch (keyword) {
			case INTERVALS -> "intervals";
			case POINTS -> "points";
			default -> "item";
		};
	}

	private enum TierKind {
		INTERVAL(TokenType.INTERVALS, "intervals", Set.of(XMIN, XMAX, "text")),
		TEXT(TokenType.POINTS, "points", Set.of("number", "mark"));

		final TokenType itemKeyword;
		final String itemName;
		final Set<String> itemKeys;

		TierKind(TokenType itemKeyword, String itemName, Set<String> itemKeys) {
			this.itemKeyword = itemKeyword;
			this.itemName = itemName;
			this.itemKeys = itemKeys;
		}
	}

	/**
	 * A run of {@code key = value} lines, looked up by key once the run has been read.
	 */
	private static final class PropertyBlock {

		private final Map<String, TextGridToken> values;
		private final TextGridToken end;

		private PropertyBlock(Map<String, TextGridToken> values, TextGridToken end) {
			this.values = values;
			this.end = end;
		}

		static PropertyBlock collect(TokenCursor cursor, Set<String> allowedKeys) {
			Map<String, TextGridToken> values = new LinkedHashMap<>();
			while (cursor.check(TokenType.IDENTIFIER)) {
				TextGridToken key = cursor.advance();
				if (!allowedKeys.contains(key.value())) {
					throw new TextGridSyntaxException(key, "one of " + new TreeSet<>(allowedKeys),
							"Unknown property '" + key.value() + "'");
				}
				if (values.containsKey(key.value())) {
					throw new TextGridSyntaxException(key, "one of " + new TreeSet<>(allowedKeys),
							"Duplicate property '" + key.value() + "'");
				}
				cursor.expect(TokenType.EQUALS, "'=' after '" + key.value() + "'");
				TextGridToken value = cursor.peek();
				if (!value.type().isString() && !value.type().isNumber()) {
					throw new TextGridSyntaxException(value, "a value for '" + key.value() + "'");
				}
				values.put(key.value(), cursor.advance());
			}
			return new PropertyBlock(values, cursor.peek());
		}

		double number(String key) {
			TextGridToken value = require(key);
			if (!value.type().isNumber()) {
				throw new TextGridSyntaxException(value, "a number for '" + key + "'");
			}
			return value.doubleValue();
		}

		String string(String key) {
			TextGridToken value = require(key);
			if (!value.type().isString()) {
				throw new TextGridSyntaxException(value, "a quoted string for '" + key + "'");
			}
			return value.value();
		}

		private TextGridToken require(String key) {
			TextGridToken value = values.get(key);
			if (value == null) {
				throw new TextGridSyntaxException(end, "'" + key + " = ...'", "Missing property '" + key + "'");
			}
			return value;
		}
	}
}
