package org.javai.textgrid.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.textgrid.TextGridFormat;
import org.javai.textgrid.lexer.TextGridLexer;
import org.javai.textgrid.lexer.TokenType;
import org.javai.textgrid.model.Interval;
import org.javai.textgrid.model.IntervalTier;
import org.javai.textgrid.model.Point;
import org.javai.textgrid.model.TextTier;
import org.junit.jupiter.api.Test;

/**
 * The compact encoding has no keys, so every test here is about position: a value
 * in the wrong slot has to fail right where it stands.
 */
class MinimalGrammarStrategyTest {

	private static final String HEADER = """
			File type = "ooTextFile"
			Object class = "TextGrid"

			0
			2.3
			<exists>
			2
			""";

	private static ParsedTextGrid parse(String text) {
		return new MinimalGrammarStrategy().parse(new TextGridLexer(text, TextGridFormat.MINIMAL).tokenize());
	}

	@Test
	void parseIntervalAndTextTiers() {
		ParsedTextGrid parsed = parse(HEADER + """
				"IntervalTier"
				"words"
				0
				2.3
				2
				0
				1.1
				"hello"
				1.1
				2.3
				""
				"TextTier"
				"events"
				0
				2.3
				1
				1
				"click"
				""");

		assertThat(parsed.tiers()).containsExactly(
				new IntervalTier("words", List.of(
						new Interval(0.0, 1.1, "hello"),
						new Interval(1.1, 2.3, ""))),
				new TextTier("events", List.of(new Point(1.0, "click"))));
		assertThat(parsed.tierHeaders()).containsExactly(
				new TierHeader("words", 0.0, 2.3, 2),
				new TierHeader("events", 0.0, 2.3, 1));
	}

	@Test
	void headerIsRead() {
		DocumentHeader header = parse(HEADER).header();

		assertThat(header.xmin()).isEqualTo(0.0);
		assertThat(header.xmax()).isEqualTo(2.3);
		assertThat(header.size()).isEqualTo(2);
		assertThat(header.tiersExist()).isTrue();
		assertThat(header.properties()).containsEntry("File type", "ooTextFile");
	}

	@Test
	void headerWithoutFreeFormLines() {
		ParsedTextGrid parsed = parse("0 1 <absent> 0");

		assertThat(parsed.header().tiersExist()).isFalse();
		assertThat(parsed.header().properties()).isEmpty();
		assertThat(parsed.tiers()).isEmpty();
	}

	@Test
	void onlyExistsMarksTiersAsPresent() {
		assertThat(parse("0 1 <Exists> 0").header().tiersExist()).isFalse();
	}

	@Test
	void emptyTiersAreAllowed() {
		ParsedTextGrid parsed = parse(HEADER + """
				"IntervalTier" "a" 0 2.3 0
				"TextTier" "b" 0 2.3 0
				""");

		assertThat(parsed.tiers()).containsExactly(
				new IntervalTier("a", List.of()),
				new TextTier("b", List.of()));
	}

	@Test
	void labelSpelledLikeATagIsText() {
		ParsedTextGrid parsed = parse(HEADER + """
				"TextTier" "b" 0 2.3 1
				0.5 "TextTier"
				""");

		assertThat(parsed.tiers()).containsExactly(new TextTier("b", List.of(new Point(0.5, "TextTier"))));
	}

	@Test
	void numberInPlaceOfTierNameFailsAtThatToken() {
		assertThatThrownBy(() -> parse(HEADER + """
				"IntervalTier"
				0
				"""))
				.isInstanceOfSatisfying(TextGridSyntaxException.class, e -> {
					assertThat(e.token().type()).isEqualTo(TokenType.INT);
					assertThat(e.token().line()).isEqualTo(9);
					assertThat(e.expected()).isEqualTo("the tier name");
				});
	}

	@Test
	void decimalTierSizeIsRejected() {
		assertThatThrownBy(() -> parse(HEADER + "\"TextTier\" \"b\" 0 2.3 1.5"))
				.isInstanceOfSatisfying(TextGridSyntaxException.class, e -> {
					assertThat(e.token().type()).isEqualTo(TokenType.FLOAT);
					assertThat(e.expected()).isEqualTo("the number of points");
				});
	}

	@Test
	void untaggedTierIsRejected() {
		assertThatThrownBy(() -> parse(HEADER + "\"PitchTier\" \"f0\" 0 2.3 0"))
				.isInstanceOfSatisfying(TextGridSyntaxException.class, e -> {
					assertThat(e.token().value()).isEqualTo("PitchTier");
					assertThat(e.expected()).isEqualTo("\"IntervalTier\" or \"TextTier\"");
				});
	}

	@Test
	void missingIntervalTextFailsAtNextNumber() {
		assertThatThrownBy(() -> parse(HEADER + """
				"IntervalTier" "a" 0 2.3 2
				0 1.1
				1.1 2.3 "b"
				"""))
				.isInstanceOfSatisfying(TextGridSyntaxException.class, e -> {
					assertThat(e.token().type()).isEqualTo(TokenType.FLOAT);
					assertThat(e.token().value()).isEqualTo("1.1");
					assertThat(e.token().line()).isEqualTo(10);
					assertThat(e.expected()).isEqualTo("the interval text");
				});
	}

	@Test
	void truncatedIntervalReportsEndOfInput() {
		assertThatThrownBy(() -> parse(HEADER + "\"IntervalTier\" \"a\" 0 2.3 1\n0"))
				.isInstanceOfSatisfying(TextGridSyntaxException.class, e -> {
					assertThat(e.isEndOfInput()).isTrue();
					assertThat(e.getMessage()).startsWith("Unexpected end of input");
				});
	}

	@Test
	void missingHeaderBoundsAreRejected() {
		assertThatThrownBy(() -> parse("File type = \"ooTextFile\"\n<exists> 1"))
				.isInstanceOfSatisfying(TextGridSyntaxException.class, e -> {
					assertThat(e.token().type()).isEqualTo(TokenType.LANGLE);
					assertThat(e.expected()).isEqualTo("the TextGrid xmin");
				});
	}

	@Test
	void keyWithoutQuotedValueIsRejected() {
		assertThatThrownBy(() -> parse("File type = 3"))
				.isInstanceOf(TextGridSyntaxException.class)
				.hasMessageContaining("a quoted value for 'File type'");
	}
}
