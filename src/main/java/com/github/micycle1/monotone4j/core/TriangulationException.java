package com.github.micycle1.monotone4j.core;

/**
 * Raised when an internal invariant of the triangulation pipeline breaks.
 * <p>
 * For simple polygons this never happens; it indicates self-intersecting or
 * otherwise degenerate input that passed the precondition checks. There is no
 * partial result: the failing call produces nothing and leaves no state
 * behind.
 */
public class TriangulationException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public TriangulationException(String message) {
		super(message);
	}
}
