package com.github.micycle1.monotone4j.input;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * A single polygon ring as consumed by the triangulator.
 * <p>
 * The ring is open (its last vertex implicitly connects to the first), holds
 * at least 3 vertices, and may be wound either way. Self-intersection is not
 * checked.
 */
public class InputPolygon {

	public final List<Coordinate> vertices;

	public InputPolygon(List<Coordinate> vertices) {
		Objects.requireNonNull(vertices, "vertices");
		if (vertices.size() < 3) {
			throw new IllegalArgumentException("A polygon needs 3 or more vertices, got " + vertices.size());
		}
		this.vertices = List.copyOf(vertices);
	}

	public static InputPolygon of(Coordinate... vertices) {
		return new InputPolygon(Arrays.asList(vertices));
	}

	/**
	 * Builds a ring from interleaved ordinates: {@code x0, y0, x1, y1, ...}.
	 */
	public static InputPolygon fromXY(double... xy) {
		if (xy.length % 2 != 0) {
			throw new IllegalArgumentException("Interleaved ordinates must come in (x, y) pairs, got " + xy.length + " values");
		}
		Coordinate[] coords = new Coordinate[xy.length / 2];
		for (int i = 0; i < coords.length; i++) {
			coords[i] = new Coordinate(xy[2 * i], xy[2 * i + 1]);
		}
		return of(coords);
	}

	public int size() {
		return vertices.size();
	}

	public Coordinate[] toArray() {
		return vertices.toArray(Coordinate[]::new);
	}
}
