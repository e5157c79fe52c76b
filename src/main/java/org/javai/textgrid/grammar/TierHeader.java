package org.javai.textgrid.grammar;

/**
 * Tier metadata as declared in the file, kept only until it has been checked
 * against the tier built from the same block.
 *
 * @param name declared tier name
 * @param xmin declared start of the tier
 * @param xmax declared end of the tier
 * @param size declared number of intervals or points
 */
public record TierHeader(String name, double xmin, double xmax, int size) {
}
