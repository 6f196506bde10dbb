package com.gameday.leaguedata.util;

/** Where a split puts its remainder. */
public enum ChunkPolicy {
    /** Fewest chunks within the limit; equal sizes except a smaller (or equal) last chunk. */
    BALANCED,
    /** At most two chunks, the first one taking the extra item on odd totals. */
    HEAD_HEAVY_HALVES
}
