package funcstructs.trees;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.primitives.Ints;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Canonical form of an unordered rooted tree: the lexicographically greatest level sequence among
 * all orderings of the tree. Two level sequences describe the same unordered tree iff their
 * dominant sequences are equal.
 */
public final class DominantSequence implements Comparable<DominantSequence> {
  private final int[] levels;
  private final int hash;

  private DominantSequence(int[] levels) {
    this.levels = levels;
    this.hash = Arrays.hashCode(levels);
  }

  /** Canonicalizes an arbitrary level sequence. */
  public static DominantSequence of(int... levels) {
    Objects.requireNonNull(levels, "levels");
    return LevelSequence.of(levels).dominant();
  }

  public static DominantSequence of(List<Integer> levels) {
    return LevelSequence.of(levels).dominant();
  }

  /** Wraps levels already known to be dominant; the array is owned by the new instance. */
  static DominantSequence trusted(int[] levels) {
    return new DominantSequence(levels);
  }

  public int size() {
    return levels.length;
  }

  public int level(int index) {
    return levels[index];
  }

  public int height() {
    return Ints.max(levels);
  }

  public int[] toArray() {
    return levels.clone();
  }

  public List<Integer> levels() {
    return ImmutableList.copyOf(Ints.asList(levels));
  }

  public LevelSequence asLevelSequence() {
    return LevelSequence.trusted(levels.clone());
  }

  /** Main subtrees in the order they appear, which is non-increasing. */
  public ImmutableList<DominantSequence> subtrees() {
    ImmutableList.Builder<DominantSequence> subtrees = ImmutableList.builder();
    for (int[] subtree : LevelSequence.subtreeArrays(levels)) {
      // Subtrees of a dominant sequence are dominant themselves.
      subtrees.add(new DominantSequence(subtree));
    }
    return subtrees.build();
  }

  /** The forest left behind by cutting off the root. */
  public ImmutableMultiset<DominantSequence> chop() {
    return ImmutableMultiset.copyOf(subtrees());
  }

  /**
   * Number of automorphisms of the tree, so that {@code size()! / degeneracy()} counts its distinct
   * labellings.
   */
  public BigInteger degeneracy() {
    return TreeCanonizer.of(levels).automorphisms();
  }

  public RootedTree toRootedTree() {
    return RootedTree.fromLevels(asLevelSequence());
  }

  @Override
  public int compareTo(DominantSequence other) {
    return Arrays.compare(levels, other.levels);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DominantSequence)) {
      return false;
    }
    DominantSequence other = (DominantSequence) o;
    return hash == other.hash && Arrays.equals(levels, other.levels);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return Arrays.toString(levels);
  }
}
