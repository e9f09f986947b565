package com.freightoptimization.tracking.geo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Douglas–Peucker simplification. Iterative, so long tracks cannot overflow the stack.
 *
 * <p>Every dropped point lies within {@code tolerance} of the segment between the kept points that
 * bracket it; the first and last points are always kept.
 */
public final class PolylineSimplifier {

    private PolylineSimplifier() {
    }

    public static <T> List<T> simplify(List<T> points, ToDoubleFunction<T> x, ToDoubleFunction<T> y,
                                       double tolerance) {
        if (Double.isNaN(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be >= 0, was " + tolerance);
        }
        int n = points.size();
        if (n <= 2) {
            return new ArrayList<>(points);
        }

        boolean[] keep = new boolean[n];
        keep[0] = true;
        keep[n - 1] = true;

        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, n - 1});

        while (!ranges.isEmpty()) {
            int[] range = ranges.pop();
            int first = range[0];
            int last = range[1];
            if (last - first < 2) {
                continue;
            }
            T a = points.get(first);
            T b = points.get(last);
            double ax = x.applyAsDouble(a);
            double ay = y.applyAsDouble(a);
            double bx = x.applyAsDouble(b);
            double by = y.applyAsDouble(b);

            double maxDistance = -1.0;
            int index = -1;
            for (int i = first + 1; i < last; i++) {
                T p = points.get(i);
                double d = GeoUtils.distanceToSegment(x.applyAsDouble(p), y.applyAsDouble(p), ax, ay, bx, by);
                if (d > maxDistance) {
                    maxDistance = d;
                    index = i;
                }
            }

            if (maxDistance > tolerance) {
                keep[index] = true;
                ranges.push(new int[]{first, index});
                ranges.push(new int[]{index, last});
            }
        }

        List<T> result = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (keep[i]) {
                result.add(points.get(i));
            }
        }
        return result;
    }
}
