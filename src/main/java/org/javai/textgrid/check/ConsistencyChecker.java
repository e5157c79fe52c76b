package org.javai.textgrid.check;

import java.util.List;
import org.javai.textgrid.check.ConsistencyException.Check;
import org.javai.textgrid.grammar.DocumentHeader;
import org.javai.textgrid.grammar.ParsedTextGrid;
import org.javai.textgrid.grammar.TierHeader;
import org.javai.textgrid.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies that the counts and time bounds declared in a TextGrid agree with the
 * tiers built from it.
 * <p>
 * Rules are evaluated in a fixed order and the first violation is thrown:
 * <ol>
 * <li>the declared tier count equals the number of tiers;</li>
 * <li>every non-empty tier lies within the document's xmin and xmax;</li>
 * <li>every tier holds as many items as its header declares;</li>
 * <li>every non-empty tier lies within its own declared xmin and xmax.</li>
 * </ol>
 * Empty tiers have no bounds and are skipped by both bound rules.
 */
public class ConsistencyChecker {

	private static final Logger logger = LoggerFactory.getLogger(ConsistencyChecker.class);

	/**
	 * @throws ConsistencyException on the first rule that fails
	 */
	public void check(ParsedTextGrid parsed) {
		DocumentHeader header = parsed.header();
		List<Tier> tiers = parsed.tiers();
		List<TierHeader> tierHeaders = parsed.tierHeaders();

		checkTierCount(header, tiers);
		for (Tier tier : tiers) {
			checkBounds(tier, Check.DOCUMENT_BOUNDS, "TextGrid header", header.xmin(), header.xmax());
		}
		for (int i = 0; i < tiers.size(); i++) {
			checkItemCount(tiers.get(i), tierHeaders.get(i));
		}
		for (int i = 0; i < tiers.size(); i++) {
			TierHeader tierHeader = tierHeaders.get(i);
			checkBounds(tiers.get(i), Check.TIER_BOUNDS, "tier header", tierHeader.xmin(), tierHeader.xmax());
		}

		logger.debug("Consistency check passed for {} tiers", tiers.size());
	}

	private void checkTierCount(DocumentHeader header, List<Tier> tiers) {
		int declared = require(header.size(), Check.TIER_COUNT, "size");
		if (declared != tiers.size()) {
			throw new ConsistencyException(
					"Inconsistent number of tiers: " + declared + " declared in TextGrid header, found "
							+ tiers.size() + " in file.",
					Check.TIER_COUNT, null, "size", declared, tiers.size());
		}
	}

	private void checkItemCount(Tier tier, TierHeader tierHeader) {
		if (tierHeader.size() != tier.size()) {
			throw new ConsistencyException(
					"Inconsistent number of items in tier " + tier.name() + ": " + tierHeader.size()
							+ " declared in tier header, found " + tier.size() + " in file.",
					Check.ITEM_COUNT, tier.name(), "size", tierHeader.size(), tier.size());
		}
	}

	private void checkBounds(Tier tier, Check check, String source, Double declaredXmin, Double declaredXmax) {
		if (tier.isEmpty()) {
			return;
		}
		double declaredMin = require(declaredXmin, check, "xmin");
		double declaredMax = require(declaredXmax, check, "xmax");
		double xmin = tier.xmin().getAsDouble();
		double xmax = tier.xmax().getAsDouble();
		if (xmin < declaredMin) {
			throw new ConsistencyException(
					"Inconsistent xmin in tier " + tier.name() + ": items start at " + xmin
							+ ", before xmin " + declaredMin + " declared in " + source + ".",
					check, tier.name(), "xmin", declaredMin, xmin);
		}
		if (xmax > declaredMax) {
			throw new ConsistencyException(
					"Inconsistent xmax in tier " + tier.name() + ": items end at " + xmax
							+ ", after xmax " + declaredMax + " declared in " + source + ".",
					check, tier.name(), "xmax", declaredMax, xmax);
		}
	}

	private static <T extends Number> T require(T declared, Check check, String field) {
		if (declared == null) {
			throw new ConsistencyException(
					"Missing " + field + " in TextGrid header: cannot check consistency.",
					check, null, field, null, null);
		}
		return declared;
	}
}
