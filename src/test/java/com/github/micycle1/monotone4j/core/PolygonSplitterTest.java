package com.github.micycle1.monotone4j.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class PolygonSplitterTest {

	private static final int[] HEXAGON = { 0, 1, 2, 3, 4, 5 };

	@Test
	void noDiagonalsYieldsTheCycle() {
		List<int[]> loops = PolygonSplitter.split(HEXAGON, List.of(), false);
		assertEquals(1, loops.size());
		assertSame(HEXAGON, loops.get(0));
	}

	@Test
	void singleDiagonal() {
		List<int[]> loops = PolygonSplitter.split(HEXAGON, List.of(new Diagonal(3, 5)), false);
		assertEquals(2, loops.size());
		assertArrayEquals(new int[] { 3, 4, 5 }, loops.get(0));
		assertArrayEquals(new int[] { 5, 0, 1, 2, 3 }, loops.get(1));
	}

	@Test
	void flipReversesEveryLoop() {
		int[] cw = { 5, 4, 3, 2, 1, 0 };
		List<int[]> loops = PolygonSplitter.split(cw, List.of(new Diagonal(2, 0)), true);
		assertEquals(2, loops.size());
		assertArrayEquals(new int[] { 0, 1, 2 }, loops.get(0));
		assertArrayEquals(new int[] { 2, 3, 4, 5, 0 }, loops.get(1));
	}

	@Test
	void nestedDiagonalsFollowTheirPiece() {
		int[] octagon = { 0, 1, 2, 3, 4, 5, 6, 7 };
		List<Diagonal> diagonals = List.of(new Diagonal(0, 4), new Diagonal(1, 3), new Diagonal(5, 7));
		List<int[]> loops = PolygonSplitter.split(octagon, diagonals, false);

		assertEquals(4, loops.size());
		int total = 0;
		for (int[] loop : loops) {
			total += loop.length - 2;
		}
		assertEquals(octagon.length - 2, total, "Pieces must account for every triangle of the ring");
		assertArrayEquals(new int[] { 1, 2, 3 }, loops.get(0));
		assertArrayEquals(new int[] { 3, 4, 0, 1 }, loops.get(1));
		assertArrayEquals(new int[] { 5, 6, 7 }, loops.get(2));
		assertArrayEquals(new int[] { 7, 0, 4, 5 }, loops.get(3));
	}

	@Test
	void crossingDiagonalsFailHard() {
		List<Diagonal> diagonals = new ArrayList<>();
		diagonals.add(new Diagonal(0, 3));
		diagonals.add(new Diagonal(1, 4));
		assertThrows(TriangulationException.class, () -> PolygonSplitter.split(HEXAGON, diagonals, false));
	}

	@Test
	void diagonalOffTheLoopFailsHard() {
		assertThrows(TriangulationException.class, () -> PolygonSplitter.split(HEXAGON, List.of(new Diagonal(7, 2)), false));
	}
}
