package funcstructs.trees;

import com.google.common.collect.ImmutableSortedMultiset;
import com.google.common.collect.Multiset;
import funcstructs.core.Counts;
import funcstructs.model.Partition;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** A multiset of rooted trees, each held by its dominant sequence. */
public final class Forest {
  private final ImmutableSortedMultiset<DominantSequence> trees;
  private final int nodeCount;

  private Forest(ImmutableSortedMultiset<DominantSequence> trees) {
    this.trees = trees;
    int nodes = 0;
    for (DominantSequence tree : trees) {
      nodes += tree.size();
    }
    this.nodeCount = nodes;
  }

  public static Forest of(Collection<DominantSequence> trees) {
    Objects.requireNonNull(trees, "trees");
    return new Forest(ImmutableSortedMultiset.copyOf(trees));
  }

  public static Forest of(DominantSequence... trees) {
    return of(Arrays.asList(trees));
  }

  /** Trees in increasing order, repeated by multiplicity. */
  public ImmutableSortedMultiset<DominantSequence> trees() {
    return trees;
  }

  public int nodeCount() {
    return nodeCount;
  }

  public int treeCount() {
    return trees.size();
  }

  public boolean isEmpty() {
    return trees.isEmpty();
  }

  /** The tree sizes as a partition of {@link #nodeCount()}. */
  public Partition sizes() {
    List<Integer> sizes = new ArrayList<>(trees.size());
    for (DominantSequence tree : trees) {
      sizes.add(tree.size());
    }
    return Partition.fromParts(sizes);
  }

  /** Grafts every tree onto a new common root. */
  public DominantSequence graft() {
    int[] levels = new int[nodeCount + 1];
    int offset = 1;
    for (DominantSequence tree : trees.descendingMultiset()) {
      for (int i = 0; i < tree.size(); i++) {
        levels[offset++] = tree.level(i) + 1;
      }
    }
    return DominantSequence.trusted(levels);
  }

  /** Product of the tree automorphism counts and the factorials of repeated trees. */
  public BigInteger degeneracy() {
    BigInteger degeneracy = BigInteger.ONE;
    for (Multiset.Entry<DominantSequence> entry : trees.entrySet()) {
      int count = entry.getCount();
      degeneracy =
          degeneracy
              .multiply(Counts.factorial(count))
              .multiply(entry.getElement().degeneracy().pow(count));
    }
    return degeneracy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Forest && trees.equals(((Forest) o).trees);
  }

  @Override
  public int hashCode() {
    return trees.hashCode();
  }

  @Override
  public String toString() {
    return "Forest" + trees;
  }
}
