package com.github.micycle1.monotone4j;

import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.monotone4j.core.Diagonal;
import com.github.micycle1.monotone4j.core.MonotoneDecomposition;
import com.github.micycle1.monotone4j.core.MonotoneTriangulator;
import com.github.micycle1.monotone4j.core.PolygonSplitter;
import com.github.micycle1.monotone4j.geom.Geom;
import com.github.micycle1.monotone4j.geom.SweepAxis;
import com.github.micycle1.monotone4j.input.Adapter;
import com.github.micycle1.monotone4j.input.InputPolygon;
import com.github.micycle1.monotone4j.input.PolygonAdapter;
import com.github.micycle1.monotone4j.model.TriangulatedPolygon;

/**
 * Public API for triangulating simple polygons (single ring, no holes) by
 * monotone decomposition.
 * <p>
 * The pipeline is: winding test, sweep-line decomposition into monotone
 * pieces, splitting of the index ring along the decomposition diagonals, then
 * a linear stack sweep over each piece. An {@code n}-vertex ring always yields
 * {@code n - 2} triangles, returned as a flat array of {@code 3(n - 2)}
 * indices into the input. Each triangle has the input ring's winding.
 * <p>
 * Calls share no state and may run concurrently, provided each call owns its
 * output buffer. Self-intersecting input is not validated; it either produces
 * an arbitrary triangulation or fails with a
 * {@link com.github.micycle1.monotone4j.core.TriangulationException}.
 */
public class Triangulator {

	private static final Logger LOGGER = LoggerFactory.getLogger(Triangulator.class);

	private Triangulator() {
	}

	/**
	 * Triangulates a polygon ring, sweeping along x.
	 *
	 * @param points ring vertices (no closing duplicate), at least 3, either
	 *               winding
	 * @return {@code 3(n - 2)} triangle indices into {@code points}
	 */
	public static int[] triangulate(Coordinate[] points) {
		return triangulate(points, SweepAxis.X);
	}

	public static int[] triangulate(List<Coordinate> points) {
		Objects.requireNonNull(points, "points");
		return triangulate(points.toArray(Coordinate[]::new));
	}

	/**
	 * Triangulates a polygon ring along a chosen sweep axis.
	 *
	 * @param points ring vertices (no closing duplicate), at least 3
	 * @param axis   primary sweep coordinate
	 * @return {@code 3(n - 2)} triangle indices into {@code points}
	 */
	public static int[] triangulate(Coordinate[] points, SweepAxis axis) {
		checkRing(points);
		int[] output = new int[(points.length - 2) * 3];
		triangulate(points, axis, output, 0);
		return output;
	}

	/**
	 * Triangulates into a caller-owned buffer, sweeping along x.
	 *
	 * @see #triangulate(Coordinate[], SweepAxis, int[], int)
	 */
	public static int triangulate(Coordinate[] points, int[] output, int offset) {
		return triangulate(points, SweepAxis.X, output, offset);
	}

	/**
	 * Triangulates into a caller-owned buffer.
	 * <p>
	 * The buffer capacity is checked before anything is written.
	 *
	 * @param points ring vertices (no closing duplicate), at least 3
	 * @param axis   primary sweep coordinate
	 * @param output destination buffer; needs {@code 3(n - 2)} free slots from
	 *               {@code offset}
	 * @param offset first slot to write
	 * @return the offset following the last written index
	 */
	public static int triangulate(Coordinate[] points, SweepAxis axis, int[] output, int offset) {
		checkRing(points);
		Objects.requireNonNull(axis, "axis");
		Objects.requireNonNull(output, "output");
		int required = (points.length - 2) * 3;
		if (offset < 0 || output.length - offset < required) {
			throw new IllegalArgumentException(
					"Output buffer of length " + output.length + " cannot hold " + required + " indices from offset " + offset);
		}

		Coordinate[] sweepPoints = axis.toSweepSpace(points);
		boolean clockwise = Geom.isClockwise(sweepPoints);
		List<int[]> loops = partitionSweepSpace(sweepPoints, clockwise);

		for (int[] loop : loops) {
			offset = MonotoneTriangulator.triangulate(sweepPoints, loop, clockwise, output, offset);
		}
		LOGGER.debug("Triangulated {}-gon (axis {}, {}) from {} monotone piece(s)", points.length, axis,
				clockwise ? "clockwise in sweep space" : "counter-clockwise in sweep space", loops.size());
		return offset;
	}

	/**
	 * Triangulates a hole-free JTS polygon's shell.
	 *
	 * @throws IllegalArgumentException if the polygon is empty or has holes
	 */
	public static TriangulatedPolygon triangulate(Polygon polygon) {
		return triangulate(polygon, new PolygonAdapter());
	}

	/**
	 * Triangulates user-supplied input via an adapter.
	 *
	 * @param <T>     source input type
	 * @param input   source input object
	 * @param adapter converts {@code input} into an {@link InputPolygon}
	 * @return the adapted ring and its triangles
	 */
	public static <T> TriangulatedPolygon triangulate(T input, Adapter<T> adapter) {
		Objects.requireNonNull(adapter, "adapter");
		return triangulate(adapter.toPolygon(input));
	}

	public static TriangulatedPolygon triangulate(InputPolygon polygon) {
		return triangulate(polygon, SweepAxis.X);
	}

	public static TriangulatedPolygon triangulate(InputPolygon polygon, SweepAxis axis) {
		Objects.requireNonNull(polygon, "polygon");
		return new TriangulatedPolygon(polygon.vertices, triangulate(polygon.toArray(), axis));
	}

	/**
	 * Splits a polygon ring into x-monotone pieces.
	 *
	 * @see #partition(Coordinate[], SweepAxis)
	 */
	public static List<int[]> partition(Coordinate[] points) {
		return partition(points, SweepAxis.X);
	}

	/**
	 * Splits a polygon ring into pieces that are monotone along {@code axis}.
	 *
	 * @return index loops into {@code points}, each wound like the input ring
	 */
	public static List<int[]> partition(Coordinate[] points, SweepAxis axis) {
		checkRing(points);
		Objects.requireNonNull(axis, "axis");
		Coordinate[] sweepPoints = axis.toSweepSpace(points);
		return partitionSweepSpace(sweepPoints, Geom.isClockwise(sweepPoints));
	}

	/**
	 * @return {@code true} if the ring is clockwise or has zero area
	 */
	public static boolean isClockwise(Coordinate[] points) {
		checkRing(points);
		return Geom.isClockwise(points);
	}

	private static List<int[]> partitionSweepSpace(Coordinate[] sweepPoints, boolean clockwise) {
		List<Diagonal> diagonals = MonotoneDecomposition.decompose(sweepPoints, clockwise);
		int[] ccwCycle = MonotoneDecomposition.ccwCycle(sweepPoints.length, clockwise);
		// loops come out of the CCW cycle; flipping restores the ring's own winding
		return PolygonSplitter.split(ccwCycle, diagonals, clockwise);
	}

	private static void checkRing(Coordinate[] points) {
		Objects.requireNonNull(points, "points");
		if (points.length < 3) {
			throw new IllegalArgumentException("Expected a polygon with 3 or more vertices, got " + points.length);
		}
	}
}
