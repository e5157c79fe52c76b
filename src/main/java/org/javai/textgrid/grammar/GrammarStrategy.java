package org.javai.textgrid.grammar;

import java.util.List;
import org.javai.textgrid.lexer.TextGridToken;

/**
 * Grammar of one TextGrid encoding, turning a token stream into tiers.
 */
public interface GrammarStrategy {

	/**
	 * Parses a complete token stream.
	 *
	 * @param tokens the tokens to parse, terminated by an EOF token
	 * @return the tiers in declaration order along with their declared metadata
	 * @throws TextGridSyntaxException if the tokens match no production
	 */
	ParsedTextGrid parse(List<TextGridToken> tokens) throws TextGridSyntaxException;
}
