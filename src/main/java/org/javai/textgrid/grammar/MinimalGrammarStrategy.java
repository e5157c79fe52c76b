package org.javai.textgrid.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.textgrid.lexer.TextGridToken;
import org.javai.textgrid.lexer.TokenType;
import org.javai.textgrid.model.Interval;
import org.javai.textgrid.model.IntervalTier;
import org.javai.textgrid.model.Point;
import org.javai.textgrid.model.TextTier;
import org.javai.textgrid.model.Tier;

/**
 * Grammar of the compact TextGrid encoding, where fields carry no keys:
 *
 * <pre>
 * textgrid      := tg_header {tier}*
 * tg_header     := (IDENT '=' STRING)* number number '&lt;' IDENT '&gt;' INT
 * interval_tier := TAG_INTERVAL STRING number number INT {number number STRING}*
 * text_tier     := TAG_TEXT STRING number number INT {number STRING}*
 * number        := INT | FLOAT
 * </pre>
 *
 * A field that is out of place fails at that very token; there is no recovery.
 */
public class MinimalGrammarStrategy implements GrammarStrategy {

	private static final String TIER_TAG = "\"IntervalTier\" or \"TextTier\"";

	@Override
	public ParsedTextGrid parse(List<TextGridToken> tokens) {
		TokenCursor cursor = new TokenCursor(tokens);
		DocumentHeader header = parseHeader(cursor);

		List<Tier> tiers = new ArrayList<>();
		List<TierHeader> tierHeaders = new ArrayList<>();
		while (!cursor.isAtEnd()) {
			TextGridToken tag = cursor.peek();
			switch (tag.type()) {
				case TAG_INTERVAL -> {
					cursor.advance();
					TierHeader tierHeader = parseTierHeader(cursor, "intervals");
					List<Interval> intervals = new ArrayList<>();
					while (cursor.peek().type().isNumber()) {
						double start = cursor.expectNumber("the interval start");
						double end = cursor.expectNumber("the interval end");
						String text = cursor.expectString("the interval text");
						intervals.add(new Interval(start, end, text));
					}
					tierHeaders.add(tierHeader);
					tiers.add(new IntervalTier(tierHeader.name(), intervals));
				}
				case TAG_TEXT -> {
					cursor.advance();
					TierHeader tierHeader = parseTierHeader(cursor, "points");
					List<Point> points = new ArrayList<>();
					while (cursor.peek().type().isNumber()) {
						double number = cursor.expectNumber("the point time");
						String mark = cursor.expectString("the point mark");
						points.add(new Point(number, mark));
					}
					tierHeaders.add(tierHeader);
					tiers.add(new TextTier(tierHeader.name(), points));
				}
				default -> throw new TextGridSyntaxException(tag, TIER_TAG);
			}
		}

		return new ParsedTextGrid(header, tiers, tierHeaders);
	}

	private DocumentHeader parseHeader(TokenCursor cursor) {
		Map<String, String> properties = new LinkedHashMap<>();
		while (cursor.check(TokenType.IDENTIFIER)) {
			TextGridToken key = cursor.advance();
			cursor.expect(TokenType.EQUALS, "'=' after '" + key.value() + "'");
			properties.put(key.value(), cursor.expectString("a quoted value for '" + key.value() + "'"));
		}

		double xmin = cursor.expectNumber("the TextGrid xmin");
		double xmax = cursor.expectNumber("the TextGrid xmax");
		cursor.expect(TokenType.LANGLE, "'<exists>' or '<absent>'");
		boolean tiersExist = "exists".equals(cursor.expect(TokenType.IDENTIFIER, "'exists' or 'absent'").value());
		cursor.expect(TokenType.RANGLE, "'>'");
		int size = cursor.expectInt("the number of tiers");

		return new DocumentHeader(xmin, xmax, size, tiersExist, properties);
	}

	private TierHeader parseTierHeader(TokenCursor cursor, String itemName) {
		String name = cursor.expectString("the tier name");
		double xmin = cursor.expectNumber("the tier xmin");
		double xmax = cursor.expectNumber("the tier xmax");
		int size = cursor.expectInt("the number of " + itemName);
		return new TierHeader(name, xmin, xmax, size);
	}
}
