package org.javai.textgrid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TextGridFormatTest {

	@Test
	void resolveByName() {
		assertThat(TextGridFormat.fromName("full")).isEqualTo(TextGridFormat.FULL);
		assertThat(TextGridFormat.fromName("minimal")).isEqualTo(TextGridFormat.MINIMAL);
		assertThat(TextGridFormat.fromName(" Minimal ")).isEqualTo(TextGridFormat.MINIMAL);
	}

	@Test
	void onlyTheTwoEncodingsAreAccepted() {
		assertThatThrownBy(() -> TextGridFormat.fromName("short"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'short'");
		assertThatThrownBy(() -> TextGridFormat.fromName(null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void optionsForFormatCheckConsistencyByDefault() {
		ParseOptions options = ParseOptions.of("minimal");

		assertThat(options.format()).isEqualTo(TextGridFormat.MINIMAL);
		assertThat(options.checkConsistency()).isTrue();
	}

	@Test
	void toStringIsTheName() {
		assertThat(TextGridFormat.FULL).hasToString("full");
	}
}
