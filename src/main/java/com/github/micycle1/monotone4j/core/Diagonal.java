package com.github.micycle1.monotone4j.core;

/**
 * An internal edge between two non-adjacent polygon vertices, expressed as
 * indices into the caller's point array. Endpoint order carries no meaning.
 *
 * @param a first endpoint index
 * @param b second endpoint index
 */
public record Diagonal(int a, int b) {

	public Diagonal {
		if (a < 0 || b < 0) {
			throw new IllegalArgumentException("Diagonal indices must be non-negative");
		}
		if (a == b) {
			throw new IllegalArgumentException("Diagonal endpoints must be distinct: " + a);
		}
	}

	@Override
	public String toString() {
		return "(" + a + ", " + b + ")";
	}
}
