package org.processdiagram.converter.layout;

/**
 * Result of {@link RankAssigner#assign}: for node {@code i}, {@code ranks[i]} is its layer and
 * {@code order[i]} its position key inside the layer (smaller comes first).
 */
public record Ranking(int[] ranks, int[] order) {

    public int rankCount() {
        int max = -1;
        for (int rank : ranks) {
            max = Math.max(max, rank);
        }
        return max + 1;
    }

    /**
     * Fallback placement: nodes fill rows of {@code columns} ranks in index order.
     */
    public static Ranking grid(int nodeCount, int columns) {
        int[] ranks = new int[nodeCount];
        int[] order = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            ranks[i] = i % columns;
            order[i] = i;
        }
        return new Ranking(ranks, order);
    }
}
