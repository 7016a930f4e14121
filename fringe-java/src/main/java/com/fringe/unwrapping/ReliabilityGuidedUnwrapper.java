package com.fringe.unwrapping;

import com.fringe.core.HeightMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Two-dimensional phase unwrapper that follows a non-continuous path ordered by reliability
 * (Herraez et al., Applied Optics 41(35), 2002).
 * <p>
 * Operates on wrapped phase in radians. A pixel's reliability is the inverse of the root of its
 * squared wrapped second differences along the two axes and both diagonals; border pixels get
 * zero. Edges between horizontal and vertical neighbours are ranked by the summed reliability of
 * their pixels and merged most reliable first, shifting the smaller group by the multiple of 2 pi
 * that best joins it to the larger one.
 */
public class ReliabilityGuidedUnwrapper {
    
    private static final Logger log = LoggerFactory.getLogger(ReliabilityGuidedUnwrapper.class);
    
    private static final double TWO_PI = 2 * Math.PI;
    
    public HeightMap unwrap(HeightMap wrapped) {
        Objects.requireNonNull(wrapped, "wrapped phase cannot be null");
        var result = wrapped.copy();
        if (wrapped.isEmpty()) {
            return result;
        }
        
        int width = wrapped.width();
        int height = wrapped.height();
        int pixels = width * height;
        var phase = wrapped.values();
        var reliability = reliability(phase, width, height);
        
        var edges = edges(reliability, width, height);
        
        // union-find over pixel groups, each group a linked list headed by its representative
        var group = new int[pixels];
        var next = new int[pixels];
        var tail = new int[pixels];
        var size = new int[pixels];
        var increment = new double[pixels];
        for (int i = 0; i < pixels; i++) {
            group[i] = i;
            next[i] = -1;
            tail[i] = i;
            size[i] = 1;
        }
        
        int merges = 0;
        for (var edge : edges) {
            int a = edge.first();
            int b = edge.second();
            int groupA = group[a];
            int groupB = group[b];
            if (groupA == groupB) {
                continue;
            }
            
            double difference = (phase[a] + increment[a]) - (phase[b] + increment[b]);
            double shift = TWO_PI * Math.rint(difference / TWO_PI);
            
            if (size[groupA] >= size[groupB]) {
                merge(groupA, groupB, shift, group, next, tail, size, increment);
            } else {
                merge(groupB, groupA, -shift, group, next, tail, size, increment);
            }
            merges++;
        }
        
        for (int i = 0; i < pixels; i++) {
            result.set(i % width, i / width, phase[i] + increment[i]);
        }
        log.trace("Reliability unwrap of {} merged {} groups over {} edges", wrapped, merges, edges.length);
        return result;
    }
    
    /**
     * Moves every pixel of {@code absorbed} into {@code keeper}, adding {@code shift} to its increment.
     */
    private static void merge(int keeper, int absorbed, double shift, int[] group, int[] next,
                              int[] tail, int[] size, double[] increment) {
        for (int p = absorbed; p != -1; p = next[p]) {
            group[p] = keeper;
            increment[p] += shift;
        }
        next[tail[keeper]] = absorbed;
        tail[keeper] = tail[absorbed];
        size[keeper] += size[absorbed];
    }
    
    static double wrap(double value) {
        return value - TWO_PI * Math.rint(value / TWO_PI);
    }
    
    static double[] reliability(double[] phase, int width, int height) {
        var reliability = new double[phase.length];
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int i = y * width + x;
                double c = phase[i];
                double h = wrap(phase[i - 1] - c) - wrap(c - phase[i + 1]);
                double v = wrap(phase[i - width] - c) - wrap(c - phase[i + width]);
                double d1 = wrap(phase[i - width - 1] - c) - wrap(c - phase[i + width + 1]);
                double d2 = wrap(phase[i - width + 1] - c) - wrap(c - phase[i + width - 1]);
                double d = Math.sqrt(h * h + v * v + d1 * d1 + d2 * d2);
                reliability[i] = d > 0 ? 1.0 / d : Double.MAX_VALUE;
            }
        }
        return reliability;
    }
    
    private static Edge[] edges(double[] reliability, int width, int height) {
        int count = (width - 1) * height + width * (height - 1);
        var edges = new Edge[count];
        int e = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                if (x + 1 < width) {
                    edges[e++] = new Edge(i, i + 1, reliability[i] + reliability[i + 1]);
                }
                if (y + 1 < height) {
                    edges[e++] = new Edge(i, i + width, reliability[i] + reliability[i + width]);
                }
            }
        }
        // stable sort keeps scan order among equally reliable edges
        Arrays.sort(edges, (l, r) -> Double.compare(r.weight(), l.weight()));
        return edges;
    }
    
    private record Edge(int first, int second, double weight) {}
}
