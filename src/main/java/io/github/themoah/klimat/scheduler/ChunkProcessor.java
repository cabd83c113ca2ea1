package io.github.themoah.klimat.scheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Utility class for splitting work units into balanced chunks, one per worker.
 */
public final class ChunkProcessor {

  private ChunkProcessor() {}

  /**
   * Splits items into balanced chunks using greedy bin-packing.
   * Items are sorted by weight descending, then each item is assigned to the lightest chunk.
   * Ties keep the input order, so the split is deterministic.
   *
   * @param items the items to split
   * @param chunkCount the maximum number of chunks to create
   * @param weightFn function to determine the weight of each item
   * @return list of non-empty chunks, each containing a subset of items; every item appears exactly once
   */
  public static <T> List<List<T>> balanceIntoChunks(
      Collection<T> items, int chunkCount, ToIntFunction<T> weightFn) {

    if (chunkCount < 1) {
      throw new IllegalArgumentException("chunkCount must be >= 1, got " + chunkCount);
    }
    if (items.isEmpty()) {
      return List.of();
    }

    int effectiveChunks = Math.min(chunkCount, items.size());

    // Stable sort, heaviest first
    List<T> sorted = new ArrayList<>(items);
    sorted.sort(Comparator.comparingInt(weightFn).reversed());

    List<List<T>> chunks = new ArrayList<>(effectiveChunks);
    long[] chunkWeights = new long[effectiveChunks];
    for (int i = 0; i < effectiveChunks; i++) {
      chunks.add(new ArrayList<>());
    }

    for (T item : sorted) {
      int lightestIdx = 0;
      for (int i = 1; i < effectiveChunks; i++) {
        if (chunkWeights[i] < chunkWeights[lightestIdx]) {
          lightestIdx = i;
        }
      }
      chunks.get(lightestIdx).add(item);
      chunkWeights[lightestIdx] += weightFn.applyAsInt(item);
    }

    return chunks;
  }

  /**
   * Concatenates per-chunk results in chunk order.
   */
  public static <R> List<R> concatenate(List<List<R>> chunkResults) {
    int total = 0;
    for (List<R> results : chunkResults) {
      total += results.size();
    }
    List<R> all = new ArrayList<>(total);
    for (List<R> results : chunkResults) {
      all.addAll(results);
    }
    return all;
  }
}
