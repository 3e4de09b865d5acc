package com.github.micycle1.monotone4j.core;

import static com.github.micycle1.monotone4j.geom.Geom.interiorAngle;
import static com.github.micycle1.monotone4j.geom.Geom.precedes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.monotone4j.geom.Geom;

/**
 * Computes the diagonals that cut a simple polygon into x-monotone pieces.
 * <p>
 * This is the plane sweep of de Berg et al., <i>Computational Geometry:
 * Algorithms and Applications</i> (2nd ed., §3.2), run left to right instead
 * of top to bottom. "Left of a vertex" in the book therefore reads as "below
 * it" here: the status holds polygon edges whose interior lies above them.
 * <p>
 * The sweep assumes a counter-clockwise ring. Clockwise input is walked through
 * a reversed index view ({@link #ccwCycle(int, boolean)}); diagonals are
 * always reported in the caller's original indices.
 * <p>
 * Instances hold the per-call sweep state and are not reused; use
 * {@link #decompose(Coordinate[], boolean)}.
 */
public final class MonotoneDecomposition {

	private static final Logger LOGGER = LoggerFactory.getLogger(MonotoneDecomposition.class);

	private final Coordinate[] points;
	/** Ring position (CCW order) to original index. */
	private final int[] cycle;
	private final int n;

	private final VertexType[] types;
	/** Helper ring position per status edge, keyed by the edge's start position; -1 if unset. */
	private final int[] helpers;
	/** Start positions of the edges crossing the sweep line. Insertion ordered. */
	private final Set<Integer> status = new LinkedHashSet<>();
	private final List<Diagonal> diagonals = new ArrayList<>();

	private MonotoneDecomposition(Coordinate[] points, boolean clockwise) {
		this.points = points;
		this.n = points.length;
		this.cycle = ccwCycle(n, clockwise);
		this.types = new VertexType[n];
		this.helpers = new int[n];
		Arrays.fill(helpers, -1);
	}

	/**
	 * Decomposes a polygon, deriving its winding first.
	 *
	 * @see #decompose(Coordinate[], boolean)
	 */
	public static List<Diagonal> decompose(Coordinate[] points) {
		return decompose(points, Geom.isClockwise(points));
	}

	/**
	 * Computes monotone-decomposition diagonals for a simple polygon.
	 *
	 * @param points    polygon ring (no closing duplicate), at least 3 points
	 * @param clockwise winding of {@code points}, as reported by
	 *                  {@link Geom#isClockwise(Coordinate[])}
	 * @return diagonals in original indices; empty when the polygon is already
	 *         monotone
	 * @throws TriangulationException if the sweep finds no status edge below a
	 *                                vertex that needs one (non-simple input)
	 */
	public static List<Diagonal> decompose(Coordinate[] points, boolean clockwise) {
		if (points.length < 3) {
			throw new IllegalArgumentException("Expected a polygon with 3 or more vertices, got " + points.length);
		}
		return new MonotoneDecomposition(points, clockwise).sweep();
	}

	/**
	 * Original indices of an {@code n}-gon in counter-clockwise order: the
	 * identity for CCW rings, reversed for clockwise ones.
	 */
	public static int[] ccwCycle(int n, boolean clockwise) {
		int[] cycle = new int[n];
		for (int i = 0; i < n; i++) {
			cycle[i] = clockwise ? n - 1 - i : i;
		}
		return cycle;
	}

	private Coordinate at(int position) {
		return points[cycle[position]];
	}

	private List<Diagonal> sweep() {
		Coordinate[] ccwPoints = new Coordinate[n];
		for (int i = 0; i < n; i++) {
			ccwPoints[i] = at(i);
		}

		for (int v : SweepOrder.sortIndices(ccwPoints)) {
			int prev = (v + n - 1) % n;
			int next = (v + 1) % n;
			Coordinate p = at(prev);
			Coordinate c = at(v);
			Coordinate q = at(next);

			boolean beforePrev = precedes(c, p);
			boolean beforeNext = precedes(c, q);

			if (beforePrev && beforeNext) {
				if (interiorAngle(p, c, q) < Math.PI) {
					types[v] = VertexType.START;
				} else {
					types[v] = VertexType.SPLIT;
					int left = leftEdge(c);
					addDiagonal(v, helpers[left]);
					helpers[left] = v;
				}
				status.add(v);
				helpers[v] = v;
			} else if (!beforePrev && !beforeNext) {
				closeEdge(v, prev);
				if (interiorAngle(p, c, q) < Math.PI) {
					types[v] = VertexType.END;
				} else {
					types[v] = VertexType.MERGE;
					updateLeftHelper(v, c);
				}
			} else {
				types[v] = VertexType.REGULAR;
				// interior lies above v when the ring continues forward in sweep order
				if (beforeNext) {
					closeEdge(v, prev);
					status.add(v);
					helpers[v] = v;
				} else {
					updateLeftHelper(v, c);
				}
			}
			LOGGER.trace("Vertex {} classified {}", cycle[v], types[v]);
		}

		LOGGER.debug("Decomposed {}-gon with {} diagonal(s)", n, diagonals.size());
		return diagonals;
	}

	/**
	 * Retires the status edge starting at {@code edge}, first connecting
	 * {@code v} to the edge's helper if that helper is a merge vertex.
	 */
	private void closeEdge(int v, int edge) {
		int helper = helpers[edge];
		if (helper >= 0 && types[helper] == VertexType.MERGE) {
			addDiagonal(v, helper);
		}
		status.remove(edge);
	}

	private void updateLeftHelper(int v, Coordinate c) {
		int left = leftEdge(c);
		int helper = helpers[left];
		if (helper >= 0 && types[helper] == VertexType.MERGE) {
			addDiagonal(v, helper);
		}
		helpers[left] = v;
	}

	private void addDiagonal(int from, int to) {
		diagonals.add(new Diagonal(cycle[from], cycle[to]));
	}

	/**
	 * Finds the status edge directly below {@code vertex}: among edges spanning
	 * its x, the one whose crossing with the sweep line is highest while not
	 * above the vertex.
	 */
	private int leftEdge(Coordinate vertex) {
		int leftEdge = -1;
		double leftY = Double.NEGATIVE_INFINITY;

		for (int edge : status) {
			Coordinate start = at(edge);
			Coordinate end = at((edge + 1) % n);
			Coordinate min = start.x > end.x ? end : start;
			Coordinate max = start.x > end.x ? start : end;

			if (vertex.x >= min.x && vertex.x <= max.x) {
				double dx = max.x - min.x;
				double y;
				if (dx == 0) {
					y = Math.min(min.y, max.y);
				} else {
					y = min.y + (max.y - min.y) * (vertex.x - min.x) / dx;
				}
				if (y <= vertex.y && y >= leftY) {
					leftY = y;
					leftEdge = edge;
				}
			}
		}

		if (leftEdge == -1) {
			throw new TriangulationException("No edge below vertex " + vertex + "; status: " + describeStatus());
		}
		return leftEdge;
	}

	private String describeStatus() {
		List<Integer> edges = new ArrayList<>();
		for (int edge : status) {
			edges.add(cycle[edge]);
		}
		return edges.toString();
	}
}
