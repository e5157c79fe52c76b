package org.javai.textgrid.grammar;

import java.util.List;
import org.javai.textgrid.model.Tier;

/**
 * Result of a grammar pass: the built tiers together with the headers that declared them.
 * {@code tierHeaders.get(i)} is the header of {@code tiers.get(i)}.
 */
public record ParsedTextGrid(DocumentHeader header, List<Tier> tiers, List<TierHeader> tierHeaders) {

	public ParsedTextGrid {
		tiers = List.copyOf(tiers);
		tierHeaders = List.copyOf(tierHeaders);
		if (tiers.size() != tierHeaders.size()) {
			throw new IllegalArgumentException("Every tier needs exactly one header");
		}
	}
}
