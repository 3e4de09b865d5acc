package com.github.micycle1.monotone4j.core;

import java.util.Comparator;
import java.util.stream.IntStream;

import org.locationtech.jts.geom.Coordinate;

/**
 * The sweep order shared by decomposition and monotone triangulation:
 * ascending x, then ascending y. Coincident points keep their relative index
 * order.
 */
public final class SweepOrder {

	/**
	 * Lexicographic (x, y) comparator agreeing with
	 * {@link com.github.micycle1.monotone4j.geom.Geom#precedes(Coordinate, Coordinate)}.
	 */
	public static final Comparator<Coordinate> COMPARATOR = (a, b) -> {
		if (a.x < b.x) {
			return -1;
		} else if (a.x > b.x) {
			return 1;
		} else if (a.y < b.y) {
			return -1;
		} else if (a.y > b.y) {
			return 1;
		}
		return 0;
	};

	private SweepOrder() {
	}

	/**
	 * Returns every index of {@code points} in sweep order.
	 */
	public static int[] sortIndices(Coordinate[] points) {
		return IntStream.range(0, points.length)
				.boxed()
				.sorted((i, j) -> COMPARATOR.compare(points[i], points[j]))
				.mapToInt(Integer::intValue)
				.toArray();
	}

	/**
	 * Returns the positions {@code 0..loop.length} of an index loop, ordered by
	 * the sweep order of the points they reference.
	 *
	 * @param points point data indexed by the loop entries
	 * @param loop   loop of indices into {@code points}
	 * @return loop positions (not point indices) in sweep order
	 */
	public static int[] sortPositions(Coordinate[] points, int[] loop) {
		return IntStream.range(0, loop.length)
				.boxed()
				.sorted((i, j) -> COMPARATOR.compare(points[loop[i]], points[loop[j]]))
				.mapToInt(Integer::intValue)
				.toArray();
	}
}
