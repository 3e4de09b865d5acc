package com.github.micycle1.monotone4j.input;

/**
 * Converts an external input type into the triangulator's intermediate
 * {@link InputPolygon} representation.
 * <p>
 * {@link #toPolygon(Object)} must return a single open ring (no closing
 * duplicate vertex) describing a simple polygon in either winding. Triangle
 * indices produced for the result refer to positions in that ring, so an
 * adapter fixes the index space its callers will see.
 *
 * @param <T> source input type
 */
public interface Adapter<T> {

	InputPolygon toPolygon(T input);
}
