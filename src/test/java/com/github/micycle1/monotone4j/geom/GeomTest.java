package com.github.micycle1.monotone4j.geom;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

class GeomTest {

	private static final Coordinate[] CCW_SQUARE = { c(1, 1), c(-1, 1), c(-1, -1), c(1, -1) };

	@Test
	void squareWinding() {
		assertFalse(Geom.isClockwise(CCW_SQUARE));
		assertTrue(Geom.isClockwise(reversed(CCW_SQUARE)));
	}

	@Test
	void windingAgreesWithJts() {
		Coordinate[] ring = { c(0, 0), c(2, 0), c(2, 1), c(1, 1), c(1, 2), c(0, 2) };
		Coordinate[] closed = new Coordinate[ring.length + 1];
		System.arraycopy(ring, 0, closed, 0, ring.length);
		closed[ring.length] = ring[0];

		assertEquals(!Orientation.isCCW(closed), Geom.isClockwise(ring));
	}

	@Test
	void zeroAreaResolvesToClockwise() {
		assertTrue(Geom.isClockwise(new Coordinate[] { c(0, 0), c(1, 1), c(2, 2) }));
		assertTrue(Geom.isClockwise(c(0, 0), c(1, 0), c(2, 0)));
	}

	@Test
	void triangleWinding() {
		assertFalse(Geom.isClockwise(c(0, 0), c(1, 0), c(0, 1)));
		assertTrue(Geom.isClockwise(c(0, 0), c(0, 1), c(1, 0)));
	}

	@Test
	void precedesIsLexicographic() {
		assertTrue(Geom.precedes(c(0, 5), c(1, -5)));
		assertTrue(Geom.precedes(c(1, -5), c(1, 5)));
		assertFalse(Geom.precedes(c(1, 5), c(1, 5)));
		assertFalse(Geom.precedes(c(2, 0), c(1, 0)));
	}

	@Test
	void interiorAngleOfCcwRing() {
		// corner of a CCW square
		assertEquals(Math.PI / 2, Geom.interiorAngle(c(-1, 1), c(-1, -1), c(1, -1)), 1e-12);
		// reflex corner of the L-shape: prev (2,1), cur (1,1), next (1,2)
		assertEquals(3 * Math.PI / 2, Geom.interiorAngle(c(2, 1), c(1, 1), c(1, 2)), 1e-12);
	}

	@Test
	void triangleArea() {
		assertEquals(0.5, Geom.triangleArea(c(0, 0), c(1, 0), c(0, 1)), 1e-12);
		assertEquals(0.5, Geom.triangleArea(c(0, 0), c(0, 1), c(1, 0)), 1e-12);
	}

	@Test
	void sweepSpaceMapping() {
		assertSame(CCW_SQUARE, SweepAxis.X.toSweepSpace(CCW_SQUARE));

		Coordinate[] swapped = SweepAxis.Y.toSweepSpace(new Coordinate[] { c(1, 2), c(3, 4), c(5, 6) });
		assertEquals(c(2, 1), swapped[0]);
		assertEquals(c(6, 5), swapped[2]);

		// reflection flips winding
		Coordinate[] square = SweepAxis.Y.toSweepSpace(CCW_SQUARE);
		assertNotSame(CCW_SQUARE, square);
		assertTrue(Geom.isClockwise(square));
		assertArrayEquals(new double[] { 1, 1 }, new double[] { square[0].x, square[0].y });
	}

	private static Coordinate[] reversed(Coordinate[] ring) {
		Coordinate[] out = new Coordinate[ring.length];
		for (int i = 0; i < ring.length; i++) {
			out[i] = ring[ring.length - 1 - i];
		}
		return out;
	}

	private static Coordinate c(double x, double y) {
		return new Coordinate(x, y);
	}
}
