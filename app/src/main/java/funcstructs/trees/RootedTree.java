package funcstructs.trees;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multiset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * An unlabelled, unordered rooted tree, characterised entirely by the multiset of its subtrees.
 * Equal trees are exactly the isomorphic ones.
 */
public final class RootedTree implements Comparable<RootedTree> {
  private static final RootedTree LEAF = new RootedTree(ImmutableMultiset.of());

  private final ImmutableMultiset<RootedTree> subtrees;
  private final int size;
  private final int hash;

  private RootedTree(ImmutableMultiset<RootedTree> subtrees) {
    this.subtrees = subtrees;
    int nodes = 1;
    for (RootedTree subtree : subtrees) {
      nodes += subtree.size;
    }
    this.size = nodes;
    this.hash = subtrees.hashCode();
  }

  public static RootedTree leaf() {
    return LEAF;
  }

  public static RootedTree of(Collection<RootedTree> subtrees) {
    Objects.requireNonNull(subtrees, "subtrees");
    return subtrees.isEmpty() ? LEAF : new RootedTree(ImmutableMultiset.copyOf(subtrees));
  }

  public static RootedTree of(RootedTree... subtrees) {
    return of(Arrays.asList(subtrees));
  }

  public static RootedTree fromLevels(LevelSequence levels) {
    Objects.requireNonNull(levels, "levels");
    int[] parents = levels.parents();
    // Pre-order puts every child after its parent, so children are built first.
    ListMultimap<Integer, RootedTree> built = ArrayListMultimap.create();
    RootedTree tree = LEAF;
    for (int node = parents.length - 1; node >= 0; node--) {
      tree = of(built.removeAll(node));
      if (node > 0) {
        built.put(parents[node], tree);
      }
    }
    return tree;
  }

  public ImmutableMultiset<RootedTree> subtrees() {
    return subtrees;
  }

  public int size() {
    return size;
  }

  public DominantSequence toDominantSequence() {
    int[] levels = new int[size];
    int next = 0;
    Deque<RootedTree> trees = new ArrayDeque<>();
    Deque<Integer> heights = new ArrayDeque<>();
    trees.push(this);
    heights.push(0);
    while (!trees.isEmpty()) {
      RootedTree tree = trees.pop();
      int height = heights.pop();
      levels[next++] = height;
      for (RootedTree subtree : tree.subtrees) {
        trees.push(subtree);
        heights.push(height + 1);
      }
    }
    return DominantSequence.trusted(TreeCanonizer.of(levels).dominantLevels());
  }

  @Override
  public int compareTo(RootedTree other) {
    return toDominantSequence().compareTo(other.toDominantSequence());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RootedTree)) {
      return false;
    }
    RootedTree other = (RootedTree) o;
    // Canonical forms compare without descending into the nested multisets.
    return size == other.size
        && hash == other.hash
        && toDominantSequence().equals(other.toDominantSequence());
  }

  @Override
  public int hashCode() {
    return hash;
  }

  /** Bracket form with repeated subtrees raised to their multiplicity, largest subtree first. */
  @Override
  public String toString() {
    StringBuilder out = new StringBuilder("{");
    List<Multiset.Entry<RootedTree>> entries = new ArrayList<>(subtrees.entrySet());
    entries.sort((a, b) -> b.getElement().compareTo(a.getElement()));
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        out.append(", ");
      }
      out.append(entries.get(i).getElement());
      if (entries.get(i).getCount() > 1) {
        out.append('^').append(entries.get(i).getCount());
      }
    }
    return out.append('}').toString();
  }
}
