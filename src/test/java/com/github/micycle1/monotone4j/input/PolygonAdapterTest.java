package com.github.micycle1.monotone4j.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

class PolygonAdapterTest {

	private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

	@Test
	void dropsClosingCoordinate() {
		Polygon polygon = GEOMETRY_FACTORY.createPolygon(new Coordinate[] { c(0, 0), c(4, 0), c(4, 3), c(0, 3), c(0, 0) });
		InputPolygon input = PolygonAdapter.fromPolygon(polygon);

		assertEquals(4, input.size());
		assertEquals(c(0, 0), input.vertices.get(0));
		assertEquals(c(0, 3), input.vertices.get(3));
	}

	@Test
	void keepsShellWinding() {
		Coordinate[] cw = { c(0, 0), c(0, 3), c(4, 3), c(4, 0), c(0, 0) };
		InputPolygon input = new PolygonAdapter().toPolygon(GEOMETRY_FACTORY.createPolygon(cw));
		assertEquals(c(0, 3), input.vertices.get(1));
	}

	@Test
	void rejectsHoles() {
		LinearRing shell = GEOMETRY_FACTORY.createLinearRing(new Coordinate[] { c(0, 0), c(10, 0), c(10, 10), c(0, 10), c(0, 0) });
		LinearRing hole = GEOMETRY_FACTORY.createLinearRing(new Coordinate[] { c(4, 4), c(6, 4), c(6, 6), c(4, 6), c(4, 4) });
		Polygon polygon = GEOMETRY_FACTORY.createPolygon(shell, new LinearRing[] { hole });

		assertThrows(IllegalArgumentException.class, () -> PolygonAdapter.fromPolygon(polygon));
	}

	@Test
	void rejectsEmptyPolygon() {
		assertThrows(IllegalArgumentException.class, () -> PolygonAdapter.fromPolygon(GEOMETRY_FACTORY.createPolygon()));
	}

	@Test
	void interleavedOrdinates() {
		InputPolygon input = InputPolygon.fromXY(0, 0, 1, 0, 0, 1);
		assertEquals(3, input.size());
		assertEquals(c(1, 0), input.toArray()[1]);

		assertThrows(IllegalArgumentException.class, () -> InputPolygon.fromXY(0, 0, 1, 0, 0));
		assertThrows(IllegalArgumentException.class, () -> InputPolygon.fromXY(0, 0, 1, 0));
	}

	private static Coordinate c(double x, double y) {
		return new Coordinate(x, y);
	}
}
