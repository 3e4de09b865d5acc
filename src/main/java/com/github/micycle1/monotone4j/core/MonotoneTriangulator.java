package com.github.micycle1.monotone4j.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.monotone4j.geom.Geom;

/**
 * Linear-time triangulation of one x-monotone polygon (de Berg et al., §3.3).
 * <p>
 * The loop's vertices are swept in {@link SweepOrder}. A vertex belongs to the
 * "second" chain when its loop position lies in the cyclic interval from the
 * sweep-last vertex (inclusive) to the sweep-first vertex (exclusive); which
 * physical chain (upper or lower) that is depends on the loop's winding.
 * Emitted triangles are reoriented one by one to match the requested winding.
 */
public final class MonotoneTriangulator {

	private MonotoneTriangulator() {
	}

	/**
	 * Triangulates a monotone loop into a new array.
	 *
	 * @see #triangulate(Coordinate[], int[], boolean, int[], int)
	 */
	public static int[] triangulate(Coordinate[] points, int[] loop, boolean clockwise) {
		if (loop.length < 3) {
			throw new IllegalArgumentException("Expected a monotone loop with 3 or more vertices, got " + loop.length);
		}
		int[] output = new int[(loop.length - 2) * 3];
		triangulate(points, loop, clockwise, output, 0);
		return output;
	}

	/**
	 * Triangulates a monotone loop, writing {@code 3 * (loop.length - 2)}
	 * indices into {@code output} from {@code offset}.
	 *
	 * @param points    point data referenced by {@code loop}
	 * @param loop      monotone index loop, wound like the polygon it was cut from
	 * @param clockwise winding of the source polygon; every triangle is emitted
	 *                  with this winding
	 * @param output    destination for triangle indices (indices into
	 *                  {@code points})
	 * @param offset    first slot of {@code output} to write
	 * @return the offset following the last written index
	 */
	public static int triangulate(Coordinate[] points, int[] loop, boolean clockwise, int[] output, int offset) {
		final int vertexCount = loop.length;
		if (vertexCount < 3) {
			throw new IllegalArgumentException("Expected a monotone loop with 3 or more vertices, got " + vertexCount);
		}

		if (vertexCount == 3) {
			output[offset++] = loop[0];
			output[offset++] = loop[1];
			output[offset++] = loop[2];
			return offset;
		}

		// no square fast path: a 4-vertex piece may be non-convex

		final int[] order = SweepOrder.sortPositions(points, loop);
		final int secondChainStart = order[vertexCount - 1];
		final int secondChainEnd = order[0];

		// stack of loop positions; head is the top
		Deque<Integer> stack = new ArrayDeque<>();
		stack.push(order[0]);
		stack.push(order[1]);

		for (int i = 2; i < vertexCount - 1; i++) {
			final int current = order[i];
			final int top = stack.peek();
			final boolean currentSecond = inInterval(current, secondChainStart, secondChainEnd);

			if (currentSecond != inInterval(top, secondChainStart, secondChainEnd)) {
				offset = emitFan(points, loop, clockwise, output, offset, current, stack);
				stack.clear();
				stack.push(top);
				stack.push(current);
			} else {
				// the second chain is the upper one on CCW loops, the lower one on CW loops
				final boolean upper = currentSecond != clockwise;
				final Coordinate v = points[loop[current]];
				int lastPopped = stack.pop();

				while (!stack.isEmpty()) {
					int next = stack.peek();
					int turn = Orientation.index(points[loop[next]], points[loop[lastPopped]], v);
					boolean inside = upper ? turn == Orientation.CLOCKWISE : turn == Orientation.COUNTERCLOCKWISE;
					if (!inside) {
						break;
					}
					stack.pop();
					offset = addTriangle(points, output, offset, clockwise, loop[current], loop[lastPopped], loop[next]);
					lastPopped = next;
				}

				stack.push(lastPopped);
				stack.push(current);
			}
		}

		return emitFan(points, loop, clockwise, output, offset, order[vertexCount - 1], stack);
	}

	/**
	 * Connects {@code apex} to every consecutive pair on the stack, bottom to top.
	 */
	private static int emitFan(Coordinate[] points, int[] loop, boolean clockwise, int[] output, int offset, int apex,
			Deque<Integer> stack) {
		Iterator<Integer> it = stack.descendingIterator();
		int prev = it.next();
		while (it.hasNext()) {
			int next = it.next();
			offset = addTriangle(points, output, offset, clockwise, loop[apex], loop[prev], loop[next]);
			prev = next;
		}
		return offset;
	}

	private static int addTriangle(Coordinate[] points, int[] output, int offset, boolean clockwise, int a, int b, int c) {
		output[offset++] = a;
		if (Geom.isClockwise(points[a], points[b], points[c]) == clockwise) {
			output[offset++] = b;
			output[offset++] = c;
		} else {
			output[offset++] = c;
			output[offset++] = b;
		}
		return offset;
	}

	private static boolean inInterval(int position, int start, int end) {
		if (start > end) {
			return position >= start || position < end;
		}
		return position >= start && position < end;
	}
}
