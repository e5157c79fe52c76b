package org.javai.textgrid.model;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A tier of labeled intervals, kept in file declaration order.
 */
public record IntervalTier(String name, List<Interval> intervals) implements Tier {

	public IntervalTier {
		Objects.requireNonNull(name, "name must not be null");
		intervals = List.copyOf(intervals);
	}

	@Override
	public int size() {
		return intervals.size();
	}

	@Override
	public OptionalDouble xmin() {
		return intervals.stream().mapToDouble(Interval::start).min();
	}

	@Override
	public OptionalDouble xmax() {
		return intervals.stream().mapToDouble(Interval::end).max();
	}
}
