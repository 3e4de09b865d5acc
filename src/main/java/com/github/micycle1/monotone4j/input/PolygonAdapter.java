package com.github.micycle1.monotone4j.input;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

/**
 * Adapter that converts a hole-free JTS {@link Polygon} into an
 * {@link InputPolygon}.
 * <p>
 * The shell's closing coordinate is dropped, so triangle index {@code i}
 * refers to {@code polygon.getExteriorRing().getCoordinateN(i)}. The shell's
 * winding is kept as given.
 */
public class PolygonAdapter implements Adapter<Polygon> {

	@Override
	public InputPolygon toPolygon(Polygon polygon) {
		if (polygon.isEmpty()) {
			throw new IllegalArgumentException("Cannot triangulate an empty polygon");
		}
		if (polygon.getNumInteriorRing() > 0) {
			throw new IllegalArgumentException("Polygons with holes are not supported (" + polygon.getNumInteriorRing() + " interior rings)");
		}

		Coordinate[] coords = polygon.getExteriorRing().getCoordinates();
		List<Coordinate> ring = new ArrayList<>(coords.length - 1);
		for (int i = 0; i < coords.length - 1; i++) {
			ring.add(coords[i]);
		}
		return new InputPolygon(ring);
	}

	public static InputPolygon fromPolygon(Polygon polygon) {
		return new PolygonAdapter().toPolygon(polygon);
	}
}
