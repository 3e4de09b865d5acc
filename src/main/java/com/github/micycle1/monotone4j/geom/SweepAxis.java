package com.github.micycle1.monotone4j.geom;

import org.locationtech.jts.geom.Coordinate;

/**
 * Selects the primary sweep coordinate.
 * <p>
 * The triangulation stages are written against a fixed (x-primary,
 * y-secondary) order. Other axes are supported by mapping the input into that
 * sweep space first. The {@link #Y} mapping swaps ordinates, which is a
 * reflection: it flips the winding of the ring and of every triangle cut from
 * it alike, so triangle indices computed in sweep space keep the input
 * winding.
 */
public enum SweepAxis {

	/** Sweep left to right; ties broken by ascending y. */
	X {
		@Override
		public Coordinate[] toSweepSpace(Coordinate[] points) {
			return points;
		}
	},

	/** Sweep bottom to top; ties broken by ascending x. */
	Y {
		@Override
		public Coordinate[] toSweepSpace(Coordinate[] points) {
			Coordinate[] swapped = new Coordinate[points.length];
			for (int i = 0; i < points.length; i++) {
				swapped[i] = new Coordinate(points[i].y, points[i].x);
			}
			return swapped;
		}
	};

	/**
	 * Maps points into (primary, secondary) sweep space, preserving index order.
	 * May return the input array itself when no mapping is required; callers
	 * must treat the result as read-only.
	 */
	public abstract Coordinate[] toSweepSpace(Coordinate[] points);
}
