package com.github.micycle1.monotone4j.polyline;

import org.locationtech.jts.geom.Coordinate;

/**
 * Generators for common 2D cross-section rings (the polygon bases of prisms,
 * pyramids and extrusions), centred on the origin.
 * <p>
 * Angles are measured clockwise from +y ({@code x = sin θ}, {@code y = cos θ}),
 * so the first vertex of a regular ring sits at the top. Rings are open and
 * counter-clockwise unless {@code clockwise} is set.
 */
public final class Polylines {

	private static final double TAU = Math.PI * 2;
	private static final int DEFAULT_CIRCLE_SUBDIVISIONS = 12;

	private Polylines() {
	}

	public static Coordinate[] regular(double radius, int sides, boolean clockwise) {
		if (sides < 3) {
			throw new IllegalArgumentException("A regular polyline needs at least 3 sides, got " + sides);
		}

		Coordinate[] ring = new Coordinate[sides];
		for (int i = 0; i < sides; i++) {
			int j = clockwise ? i : sides - 1 - i;
			double angle = TAU * j / sides;
			ring[i] = new Coordinate(Math.sin(angle) * radius, Math.cos(angle) * radius);
		}
		return ring;
	}

	public static Coordinate[] circle(double radius, boolean clockwise, int subdivisions) {
		return regular(radius, subdivisions, clockwise);
	}

	public static Coordinate[] circle(double radius) {
		return circle(radius, false, DEFAULT_CIRCLE_SUBDIVISIONS);
	}

	/**
	 * A star with {@code sides} points: {@code 2 * sides} vertices alternating
	 * between the outer and inner radius, inner vertices half a step after their
	 * outer vertex.
	 */
	public static Coordinate[] star(double outerRadius, double innerRadius, int sides, boolean clockwise) {
		if (sides < 3) {
			throw new IllegalArgumentException("A star polyline needs at least 3 sides, got " + sides);
		}

		Coordinate[] ring = new Coordinate[sides * 2];
		double halfAngle = TAU / sides / 2;
		int k = 0;
		for (int i = 0; i < sides; i++) {
			int j = clockwise ? i : sides - 1 - i;
			double outerAngle = TAU * j / sides;
			double innerAngle = outerAngle + halfAngle;
			Coordinate outer = new Coordinate(Math.sin(outerAngle) * outerRadius, Math.cos(outerAngle) * outerRadius);
			Coordinate inner = new Coordinate(Math.sin(innerAngle) * innerRadius, Math.cos(innerAngle) * innerRadius);

			if (clockwise) {
				ring[k++] = outer;
				ring[k++] = inner;
			} else {
				ring[k++] = inner;
				ring[k++] = outer;
			}
		}
		return ring;
	}

	public static Coordinate[] rectangle(double width, double height, boolean clockwise) {
		double hw = width / 2;
		double hh = height / 2;
		if (clockwise) {
			return new Coordinate[] { new Coordinate(hw, hh), new Coordinate(hw, -hh), new Coordinate(-hw, -hh), new Coordinate(-hw, hh) };
		}
		return new Coordinate[] { new Coordinate(hw, hh), new Coordinate(-hw, hh), new Coordinate(-hw, -hh), new Coordinate(hw, -hh) };
	}

	public static Coordinate[] square(double length, boolean clockwise) {
		return rectangle(length, length, clockwise);
	}
}
