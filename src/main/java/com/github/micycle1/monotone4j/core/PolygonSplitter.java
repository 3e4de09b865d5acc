package com.github.micycle1.monotone4j.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions an index cycle into sub-loops along a set of non-crossing
 * diagonals.
 * <p>
 * Each diagonal cuts its current loop in two; the remaining diagonals are
 * handed to whichever half contains both of their endpoints. Pieces are
 * processed from an explicit work-list, so large diagonal counts do not grow
 * the call stack.
 */
public final class PolygonSplitter {

	private static final Logger LOGGER = LoggerFactory.getLogger(PolygonSplitter.class);

	private record Piece(int[] loop, List<Diagonal> diagonals) {
	}

	private PolygonSplitter() {
	}

	/**
	 * Splits {@code cycle} along {@code diagonals}.
	 *
	 * @param cycle     the full index cycle to partition
	 * @param diagonals non-crossing diagonals between entries of {@code cycle}
	 * @param flip      when {@code true}, every emitted loop is reversed
	 * @return loops of original indices, one per piece ({@code diagonals.size() + 1}
	 *         in total)
	 * @throws TriangulationException if a diagonal spans two pieces or does not
	 *                                connect entries of its piece
	 */
	public static List<int[]> split(int[] cycle, List<Diagonal> diagonals, boolean flip) {
		List<int[]> output = new ArrayList<>(diagonals.size() + 1);
		Deque<Piece> pending = new ArrayDeque<>();
		pending.push(new Piece(cycle, diagonals));

		while (!pending.isEmpty()) {
			Piece piece = pending.pop();
			if (piece.diagonals().isEmpty()) {
				output.add(flip ? reversed(piece.loop()) : piece.loop());
				continue;
			}

			Diagonal cut = piece.diagonals().get(0);
			int[] a = walk(piece.loop(), cut.a(), cut.b());
			int[] b = walk(piece.loop(), cut.b(), cut.a());
			Set<Integer> aMembers = members(a);
			Set<Integer> bMembers = members(b);

			List<Diagonal> aDiagonals = new ArrayList<>();
			List<Diagonal> bDiagonals = new ArrayList<>();
			for (Diagonal d : piece.diagonals().subList(1, piece.diagonals().size())) {
				if (aMembers.contains(d.a()) && aMembers.contains(d.b())) {
					aDiagonals.add(d);
				} else if (bMembers.contains(d.a()) && bMembers.contains(d.b())) {
					bDiagonals.add(d);
				} else {
					throw new TriangulationException("Diagonal " + d + " crosses split diagonal " + cut);
				}
			}
			LOGGER.trace("Split along {} into loops of {} and {} vertices", cut, a.length, b.length);

			// b first so that a is processed (and emitted) first
			pending.push(new Piece(b, bDiagonals));
			pending.push(new Piece(a, aDiagonals));
		}
		return output;
	}

	/**
	 * Collects the loop entries from {@code start} forward to {@code end},
	 * inclusive of both.
	 */
	private static int[] walk(int[] loop, int start, int end) {
		int startPos = -1;
		for (int i = 0; i < loop.length; i++) {
			if (loop[i] == start) {
				startPos = i;
				break;
			}
		}
		if (startPos < 0) {
			throw new TriangulationException("Split diagonal (" + start + ", " + end + ") does not start on its loop");
		}

		List<Integer> out = new ArrayList<>();
		out.add(start);
		for (int i = (startPos + 1) % loop.length;; i = (i + 1) % loop.length) {
			int index = loop[i];
			out.add(index);
			if (index == end) {
				return out.stream().mapToInt(Integer::intValue).toArray();
			} else if (index == start) {
				throw new TriangulationException("Endless walk along split diagonal (" + start + ", " + end + ")");
			}
		}
	}

	private static Set<Integer> members(int[] loop) {
		Set<Integer> set = new HashSet<>(loop.length * 2);
		for (int i : loop) {
			set.add(i);
		}
		return set;
	}

	private static int[] reversed(int[] loop) {
		int[] out = new int[loop.length];
		for (int i = 0; i < loop.length; i++) {
			out[i] = loop[loop.length - 1 - i];
		}
		return out;
	}
}
