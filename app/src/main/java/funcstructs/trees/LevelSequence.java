package funcstructs.trees;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import funcstructs.core.InvalidParameterException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An ordered rooted tree written as the heights of its nodes in depth-first pre-order. The root
 * has height 0 and every node is at most one level deeper than the node before it.
 *
 * <p>The explicit parent/child view ({@link #parents()}, {@link #children(int)}) is derived on
 * demand as an index arena; generation never builds it.
 */
public final class LevelSequence {
  private final int[] levels;

  private LevelSequence(int[] levels) {
    this.levels = levels;
  }

  public static LevelSequence of(int... levels) {
    Objects.requireNonNull(levels, "levels");
    return new LevelSequence(validate(levels.clone()));
  }

  public static LevelSequence of(List<Integer> levels) {
    Objects.requireNonNull(levels, "levels");
    return new LevelSequence(validate(Ints.toArray(levels)));
  }

  static LevelSequence trusted(int[] levels) {
    return new LevelSequence(levels);
  }

  static int[] validate(int[] levels) {
    if (levels.length == 0) {
      throw new InvalidParameterException("a level sequence needs at least the root");
    }
    if (levels[0] != 0) {
      throw new InvalidParameterException(
          "level sequence must start at the root height 0: " + Arrays.toString(levels));
    }
    for (int i = 1; i < levels.length; i++) {
      if (levels[i] < 1 || levels[i] > levels[i - 1] + 1) {
        throw new InvalidParameterException(
            "level sequence " + Arrays.toString(levels) + " is not a tree at position " + i);
      }
    }
    return levels;
  }

  public int size() {
    return levels.length;
  }

  public int level(int index) {
    return levels[index];
  }

  public int[] toArray() {
    return levels.clone();
  }

  public List<Integer> levels() {
    return ImmutableList.copyOf(Ints.asList(levels));
  }

  public int height() {
    return Ints.max(levels);
  }

  /** Parent index of every node; the root maps to -1. */
  public int[] parents() {
    return parentsOf(levels);
  }

  static int[] parentsOf(int[] levels) {
    int[] parents = new int[levels.length];
    int[] lastAtLevel = new int[levels.length];
    parents[0] = -1;
    for (int i = 1; i < levels.length; i++) {
      parents[i] = lastAtLevel[levels[i] - 1];
      lastAtLevel[levels[i]] = i;
    }
    return parents;
  }

  /** Indices of the direct children of {@code node}, in order. */
  public List<Integer> children(int node) {
    List<Integer> children = new ArrayList<>();
    for (int i = node + 1; i < levels.length && levels[i] > levels[node]; i++) {
      if (levels[i] == levels[node] + 1) {
        children.add(i);
      }
    }
    return children;
  }

  /** Main subtrees of the root, each rebased so its own root is at height 0. */
  public List<LevelSequence> subtrees() {
    List<LevelSequence> subtrees = new ArrayList<>();
    for (int[] subtree : subtreeArrays(levels)) {
      subtrees.add(new LevelSequence(subtree));
    }
    return subtrees;
  }

  /** The unordered tree's canonical (lexicographically greatest) ordering. */
  public DominantSequence dominant() {
    return DominantSequence.trusted(TreeCanonizer.of(levels).dominantLevels());
  }

  public RootedTree unordered() {
    return RootedTree.fromLevels(this);
  }

  static List<int[]> subtreeArrays(int[] levels) {
    List<int[]> subtrees = new ArrayList<>();
    int start = 1;
    while (start < levels.length) {
      int end = start + 1;
      while (end < levels.length && levels[end] > 1) {
        end++;
      }
      int[] subtree = new int[end - start];
      for (int i = start; i < end; i++) {
        subtree[i - start] = levels[i] - 1;
      }
      subtrees.add(subtree);
      start = end;
    }
    return subtrees;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LevelSequence)) {
      return false;
    }
    return Arrays.equals(levels, ((LevelSequence) o).levels);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(levels);
  }

  @Override
  public String toString() {
    return "LevelSequence" + Arrays.toString(levels);
  }
}
