package com.github.micycle1.monotone4j.model;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import com.github.micycle1.monotone4j.geom.Geom;

/**
 * Triangulation of a single polygon ring: the ring's vertices plus a flat
 * array of index triplets into them.
 * <p>
 * Every triangle carries the winding of the input ring.
 */
public class TriangulatedPolygon {

	private final List<Coordinate> vertices;
	private final int[] indices;

	public TriangulatedPolygon(List<Coordinate> vertices, int[] indices) {
		if (indices.length % 3 != 0) {
			throw new IllegalArgumentException("Triangle index count must be a multiple of 3, got " + indices.length);
		}
		this.vertices = List.copyOf(vertices);
		this.indices = indices.clone();
	}

	public List<Coordinate> vertices() {
		return vertices;
	}

	/**
	 * @return a copy of the flat triangle index array
	 */
	public int[] indices() {
		return indices.clone();
	}

	public int triangleCount() {
		return indices.length / 3;
	}

	/**
	 * @param i triangle number, {@code 0 <= i < triangleCount()}
	 * @return the three vertex indices of triangle {@code i}
	 */
	public int[] triangle(int i) {
		return new int[] { indices[3 * i], indices[3 * i + 1], indices[3 * i + 2] };
	}

	/**
	 * Sum of the unsigned triangle areas.
	 */
	public double area() {
		double area = 0;
		for (int i = 0; i < indices.length; i += 3) {
			area += Geom.triangleArea(vertices.get(indices[i]), vertices.get(indices[i + 1]), vertices.get(indices[i + 2]));
		}
		return area;
	}

	/**
	 * Returns the triangles as a JTS geometry collection of triangular polygons,
	 * in emission order.
	 */
	public Geometry toGeometry(GeometryFactory factory) {
		Polygon[] triangles = new Polygon[triangleCount()];
		for (int t = 0; t < triangles.length; t++) {
			Coordinate a = vertices.get(indices[3 * t]);
			Coordinate b = vertices.get(indices[3 * t + 1]);
			Coordinate c = vertices.get(indices[3 * t + 2]);
			triangles[t] = factory.createPolygon(new Coordinate[] { a.copy(), b.copy(), c.copy(), a.copy() });
		}
		return factory.createGeometryCollection(triangles);
	}
}
