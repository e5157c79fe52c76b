package org.javai.textgrid.model;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A tier of labeled points, kept in file declaration order.
 */
public record TextTier(String name, List<Point> points) implements Tier {

	public TextTier {
		Objects.requireNonNull(name, "name must not be null");
		points = List.copyOf(points);
	}

	@Override
	public int size() {
		return points.size();
	}

	@Override
	public OptionalDouble xmin() {
		return points.stream().mapToDouble(Point::number).min();
	}

	@Override
	public OptionalDouble xmax() {
		return points.stream().mapToDouble(Point::number).max();
	}
}
