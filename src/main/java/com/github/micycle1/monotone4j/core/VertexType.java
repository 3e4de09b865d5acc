package com.github.micycle1.monotone4j.core;

/**
 * Sweep classification of a polygon vertex during monotone decomposition.
 */
public enum VertexType {
	/** Both neighbours are swept later; interior angle below π. */
	START,
	/** Both neighbours were swept earlier; interior angle below π. */
	END,
	/** One neighbour before, one after. */
	REGULAR,
	/** Both neighbours swept later; reflex. */
	SPLIT,
	/** Both neighbours swept earlier; reflex. */
	MERGE
}
