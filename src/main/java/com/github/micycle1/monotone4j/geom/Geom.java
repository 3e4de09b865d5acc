package com.github.micycle1.monotone4j.geom;

import org.locationtech.jts.geom.Coordinate;

/**
 * Planar predicates shared by the decomposition, splitting and monotone
 * triangulation stages.
 * <p>
 * All predicates read only the {@code x} and {@code y} ordinates of a
 * {@link Coordinate}. Winding tests use the shoelace-style edge sum
 * {@code (next.x - last.x) * (next.y + last.y)}, which is twice the negated
 * signed area; zero-area input resolves to clockwise.
 */
public final class Geom {

	public static final double TAU = Math.PI * 2;

	private Geom() {
	}

	/**
	 * Tests whether a closed ring (last point implicitly joined to the first) is
	 * wound clockwise.
	 *
	 * @param ring ring vertices, without a closing duplicate
	 * @return {@code true} for clockwise or degenerate (zero-area) rings
	 */
	public static boolean isClockwise(Coordinate[] ring) {
		double sum = 0;
		Coordinate last = ring[ring.length - 1];
		for (Coordinate next : ring) {
			sum += (next.x - last.x) * (next.y + last.y);
			last = next;
		}
		return sum >= 0;
	}

	/**
	 * Triangle specialisation of {@link #isClockwise(Coordinate[])}.
	 */
	public static boolean isClockwise(Coordinate a, Coordinate b, Coordinate c) {
		return (b.x - a.x) * (b.y + a.y) + (c.x - b.x) * (c.y + b.y) + (a.x - c.x) * (a.y + c.y) >= 0;
	}

	/**
	 * Sweep-order predicate: {@code p} is swept before {@code q} when it has a
	 * smaller x, or an equal x and a smaller y.
	 */
	public static boolean precedes(Coordinate p, Coordinate q) {
		return p.x < q.x || (p.x == q.x && p.y < q.y);
	}

	/**
	 * Interior angle at {@code cur} of a counter-clockwise ring, in
	 * {@code [0, 2π)}. Values of π or more mark a reflex vertex.
	 */
	public static double interiorAngle(Coordinate prev, Coordinate cur, Coordinate next) {
		// negated because the interior of a CCW ring lies to the left
		double prevAngle = -Math.atan2(prev.y - cur.y, prev.x - cur.x);
		double nextAngle = -Math.atan2(next.y - cur.y, next.x - cur.x);
		return (((nextAngle - prevAngle) % TAU) + TAU) % TAU;
	}

	/**
	 * Unsigned area of a triangle.
	 */
	public static double triangleArea(Coordinate a, Coordinate b, Coordinate c) {
		return Math.abs((b.x - a.x) * (c.y - a.y) - (c.x - a.x) * (b.y - a.y)) * 0.5;
	}

}
