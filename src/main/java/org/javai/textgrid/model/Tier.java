package org.javai.textgrid.model;

import java.util.OptionalDouble;

/**
 * A named track of time-aligned labels.
 * <p>
 * The bounds of a tier are derived from its items rather than stored: they are
 * empty when the tier holds no items.
 */
public sealed interface Tier permits IntervalTier, TextTier {

	String name();

	/**
	 * Number of items (intervals or points) held by this tier.
	 */
	int size();

	/**
	 * Smallest time covered by the items of this tier, or empty for an empty tier.
	 */
	OptionalDouble xmin();

	/**
	 * Largest time covered by the items of this tier, or empty for an empty tier.
	 */
	OptionalDouble xmax();

	default boolean isEmpty() {
		return size() == 0;
	}
}
