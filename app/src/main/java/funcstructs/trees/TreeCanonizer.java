package funcstructs.trees;

import funcstructs.core.Counts;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Canonical ordering of a tree given by its level sequence, worked out one level at a time from
 * the deepest nodes up so that tall trees cost no call stack.
 *
 * <p>Nodes on a level are ranked by the list of their children's ranks in decreasing order,
 * compared lexicographically with a proper prefix ranking lower. This agrees with comparing the
 * dominant sequences of their subtrees, so listing every node's children by decreasing rank in
 * pre-order yields the dominant sequence, and equal ranks mark isomorphic sibling subtrees.
 */
final class TreeCanonizer {
  private final int[] levels;
  // Children of every node, by decreasing rank.
  private final int[][] children;
  private final int[] rank;

  private TreeCanonizer(int[] levels) {
    int n = levels.length;
    this.levels = levels;
    this.children = childArrays(levels);
    this.rank = new int[n];

    int height = 0;
    for (int level : levels) {
      height = Math.max(height, level);
    }
    int[] levelStart = new int[height + 2];
    for (int level : levels) {
      levelStart[level + 1]++;
    }
    for (int level = 0; level <= height; level++) {
      levelStart[level + 1] += levelStart[level];
    }
    int[] byLevel = new int[n];
    int[] cursor = levelStart.clone();
    for (int node = 0; node < n; node++) {
      byLevel[cursor[levels[node]]++] = node;
    }

    int[][] keys = new int[n][];
    for (int level = height; level >= 0; level--) {
      Integer[] nodes = new Integer[levelStart[level + 1] - levelStart[level]];
      for (int i = 0; i < nodes.length; i++) {
        int node = byLevel[levelStart[level] + i];
        nodes[i] = node;
        sortByDecreasingRank(children[node]);
        int[] key = new int[children[node].length];
        for (int c = 0; c < key.length; c++) {
          key[c] = rank[children[node][c]];
        }
        keys[node] = key;
      }
      Arrays.sort(nodes, (a, b) -> Arrays.compare(keys[a], keys[b]));
      int next = 0;
      for (int i = 0; i < nodes.length; i++) {
        if (i > 0 && !Arrays.equals(keys[nodes[i - 1]], keys[nodes[i]])) {
          next++;
        }
        rank[nodes[i]] = next;
      }
      // Keys one level down are no longer compared.
      if (level < height) {
        for (int i = levelStart[level + 1]; i < levelStart[level + 2]; i++) {
          keys[byLevel[i]] = null;
        }
      }
    }
  }

  /** Canonizes a valid level sequence; the array is read, never written. */
  static TreeCanonizer of(int[] levels) {
    return new TreeCanonizer(levels);
  }

  private static int[][] childArrays(int[] levels) {
    int n = levels.length;
    int[] parents = LevelSequence.parentsOf(levels);
    int[] counts = new int[n];
    for (int node = 1; node < n; node++) {
      counts[parents[node]]++;
    }
    int[][] children = new int[n][];
    for (int node = 0; node < n; node++) {
      children[node] = new int[counts[node]];
    }
    int[] filled = new int[n];
    for (int node = 1; node < n; node++) {
      int parent = parents[node];
      children[parent][filled[parent]++] = node;
    }
    return children;
  }

  private void sortByDecreasingRank(int[] nodes) {
    Integer[] boxed = new Integer[nodes.length];
    for (int i = 0; i < nodes.length; i++) {
      boxed[i] = nodes[i];
    }
    Arrays.sort(boxed, (a, b) -> Integer.compare(rank[b], rank[a]));
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = boxed[i];
    }
  }

  /** Heights in dominant order, as absolute as the input's. */
  int[] dominantLevels() {
    int[] result = new int[levels.length];
    int next = 0;
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(0);
    while (!stack.isEmpty()) {
      int node = stack.pop();
      result[next++] = levels[node];
      int[] below = children[node];
      for (int i = below.length - 1; i >= 0; i--) {
        stack.push(below[i]);
      }
    }
    return result;
  }

  /**
   * Size of the automorphism group: at every node, each run of {@code r} isomorphic children
   * contributes {@code r!} times their own automorphism counts.
   */
  BigInteger automorphisms() {
    BigInteger[] counts = new BigInteger[levels.length];
    // Pre-order puts every child after its parent.
    for (int node = levels.length - 1; node >= 0; node--) {
      BigInteger product = BigInteger.ONE;
      int[] below = children[node];
      int run = 0;
      for (int i = 0; i < below.length; i++) {
        product = product.multiply(counts[below[i]]);
        counts[below[i]] = null;
        run++;
        if (i + 1 == below.length || rank[below[i + 1]] != rank[below[i]]) {
          product = product.multiply(Counts.factorial(run));
          run = 0;
        }
      }
      counts[node] = product;
    }
    return counts[0];
  }
}
