package com.gameday.leaguedata.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChunkPartitionerTest {

    private static List<Integer> items(int n) {
        return IntStream.rangeClosed(1, n).boxed().collect(Collectors.toList());
    }

    private static List<Integer> sizes(List<List<Integer>> chunks) {
        return chunks.stream().map(List::size).toList();
    }

    @Test
    void balancedSplitsNineteenIntoSevenSevenFive() {
        assertThat(sizes(ChunkPartitioner.chunk(items(19), 9))).containsExactly(7, 7, 5);
    }

    @Test
    void balancedSplitsTwelveIntoSixSix() {
        assertThat(sizes(ChunkPartitioner.chunk(items(12), 9))).containsExactly(6, 6);
    }

    @Test
    void fitsInOneChunkWhenAtOrBelowMax() {
        assertThat(sizes(ChunkPartitioner.chunk(items(5), 9))).containsExactly(5);
        assertThat(sizes(ChunkPartitioner.chunk(items(9), 9))).containsExactly(9);
    }

    @Test
    void headHeavyHalvesPutsTheOddItemFirst() {
        assertThat(sizes(ChunkPartitioner.chunk(items(13), 10, ChunkPolicy.HEAD_HEAVY_HALVES))).containsExactly(7, 6);
        assertThat(sizes(ChunkPartitioner.chunk(items(10), 10, ChunkPolicy.HEAD_HEAVY_HALVES))).containsExactly(10);
    }

    @Test
    void chunksPreserveOrderAndLoseNothing() {
        List<Integer> in = items(23);
        for (ChunkPolicy policy : ChunkPolicy.values()) {
            List<List<Integer>> chunks = ChunkPartitioner.chunk(in, 9, policy);
            assertThat(chunks.stream().flatMap(List::stream).toList()).isEqualTo(in);
            assertThat(chunks).allSatisfy(c -> assertThat(c).isNotEmpty());
        }
    }

    @Test
    void emptyInputGivesNoChunks() {
        assertThat(ChunkPartitioner.chunk(List.of(), 9)).isEmpty();
    }

    @Test
    void rejectsNonPositiveMax() {
        assertThrows(IllegalArgumentException.class, () -> ChunkPartitioner.chunk(items(3), 0));
    }
}
