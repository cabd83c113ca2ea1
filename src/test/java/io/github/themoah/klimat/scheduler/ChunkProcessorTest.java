package io.github.themoah.klimat.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.function.ToIntFunction;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ChunkProcessor.
 */
public class ChunkProcessorTest {

  @Test
  void balanceIntoChunks_emptyCollection() {
    List<List<String>> chunks = ChunkProcessor.balanceIntoChunks(List.of(), 3, s -> 1);

    assertTrue(chunks.isEmpty());
  }

  @Test
  void balanceIntoChunks_singleItem() {
    List<List<String>> chunks = ChunkProcessor.balanceIntoChunks(List.of("a"), 3, s -> 1);

    assertEquals(1, chunks.size());
    assertEquals(List.of("a"), chunks.get(0));
  }

  @Test
  void balanceIntoChunks_chunkCountOne() {
    List<List<String>> chunks = ChunkProcessor.balanceIntoChunks(List.of("a", "b", "c"), 1, s -> 1);

    assertEquals(1, chunks.size());
    assertEquals(List.of("a", "b", "c"), chunks.get(0));
  }

  @Test
  void balanceIntoChunks_moreChunksThanItems() {
    List<List<String>> chunks = ChunkProcessor.balanceIntoChunks(List.of("a", "b"), 5, s -> 1);

    // Effective chunks = items.size() = 2
    assertEquals(2, chunks.size());
    assertEquals(List.of("a"), chunks.get(0));
    assertEquals(List.of("b"), chunks.get(1));
  }

  @Test
  void balanceIntoChunks_equalWeights_roundRobin() {
    List<List<String>> chunks = ChunkProcessor.balanceIntoChunks(List.of("a", "b", "c", "d", "e", "f"), 3, s -> 1);

    assertEquals(List.of("a", "d"), chunks.get(0));
    assertEquals(List.of("b", "e"), chunks.get(1));
    assertEquals(List.of("c", "f"), chunks.get(2));
  }

  @Test
  void balanceIntoChunks_unequalWeights_heaviestFirst() {
    // Partition sizes: a=90, b=92, c=1, d=91
    ToIntFunction<String> weightFn = s -> switch (s) {
      case "a" -> 90;
      case "b" -> 92;
      case "c" -> 1;
      case "d" -> 91;
      default -> 0;
    };
    List<List<String>> chunks = ChunkProcessor.balanceIntoChunks(List.of("a", "b", "c", "d"), 2, weightFn);

    // b(92)->c0, d(91)->c1, a(90)->c1, c(1)->c0
    assertEquals(List.of("b", "c"), chunks.get(0));
    assertEquals(List.of("d", "a"), chunks.get(1));
  }

  @Test
  void balanceIntoChunks_everyItemExactlyOnce() {
    List<Integer> items = List.of(5, 3, 8, 1, 9, 2, 7, 4, 6);
    List<List<Integer>> chunks = ChunkProcessor.balanceIntoChunks(items, 4, Integer::intValue);

    List<Integer> flattened = ChunkProcessor.concatenate(chunks);
    assertEquals(items.size(), flattened.size());
    assertTrue(flattened.containsAll(items));
    for (List<Integer> chunk : chunks) {
      assertTrue(!chunk.isEmpty());
    }
  }

  @Test
  void balanceIntoChunks_invalidChunkCount_throws() {
    assertThrows(IllegalArgumentException.class, () -> ChunkProcessor.balanceIntoChunks(List.of("a"), 0, s -> 1));
  }

  @Test
  void concatenate_keepsChunkOrder() {
    List<String> all = ChunkProcessor.concatenate(List.of(List.of("a", "b"), List.of(), List.of("c")));

    assertEquals(List.of("a", "b", "c"), all);
  }
}
