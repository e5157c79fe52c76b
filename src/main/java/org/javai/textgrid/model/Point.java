package org.javai.textgrid.model;

import java.util.Objects;

/**
 * A labeled instant.
 *
 * @param number time in seconds
 * @param mark the label, possibly empty
 */
public record Point(double number, String mark) {

	public Point {
		Objects.requireNonNull(mark, "mark must not be null");
	}
}
