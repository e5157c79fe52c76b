package org.javai.textgrid.model;

import java.util.Objects;

/**
 * A labeled time span.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text the label, possibly empty
 */
public record Interval(double start, double end, String text) {

	public Interval {
		Objects.requireNonNull(text, "text must not be null");
	}
}
