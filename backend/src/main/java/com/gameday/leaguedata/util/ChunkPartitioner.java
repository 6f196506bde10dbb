package com.gameday.leaguedata.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an ordered list into display pages. Order is preserved and no item is dropped
 * or repeated; chunks are copies, so callers may keep them after the source changes.
 */
public final class ChunkPartitioner {

    private ChunkPartitioner() {}

    public static <T> List<List<T>> chunk(List<T> items, int maxPerChunk) {
        return chunk(items, maxPerChunk, ChunkPolicy.BALANCED);
    }

    public static <T> List<List<T>> chunk(List<T> items, int maxPerChunk, ChunkPolicy policy) {
        if (maxPerChunk < 1) throw new IllegalArgumentException("maxPerChunk must be >= 1");
        List<List<T>> out = new ArrayList<>();
        if (items == null || items.isEmpty()) return out;

        int n = items.size();
        if (n <= maxPerChunk) {
            out.add(new ArrayList<>(items));
            return out;
        }

        int numChunks;
        int chunkSize;
        switch (policy == null ? ChunkPolicy.BALANCED : policy) {
            case HEAD_HEAVY_HALVES -> {
                numChunks = 2;
                chunkSize = ceilDiv(n, 2);
            }
            default -> {
                numChunks = ceilDiv(n, maxPerChunk);
                chunkSize = ceilDiv(n, numChunks);
            }
        }

        int start = 0;
        for (int c = 0; c < numChunks && start < n; c++) {
            boolean last = c == numChunks - 1;
            int end = last ? n : Math.min(n, start + chunkSize);
            out.add(new ArrayList<>(items.subList(start, end)));
            start = end;
        }
        return out;
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
