package funcstructs.structures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import funcstructs.core.Counts;
import funcstructs.model.Partition;
import funcstructs.necklaces.Necklace;
import funcstructs.trees.DominantSequence;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * An endofunction up to relabeling of its domain: a multiset of cycles, each cycle a necklace of
 * the rooted trees hanging off its cyclic nodes.
 */
public final class EndofunctionStructure {
  private final ImmutableMultiset<Necklace<DominantSequence>> cycles;
  private final int nodeCount;

  private EndofunctionStructure(ImmutableMultiset<Necklace<DominantSequence>> cycles) {
    this.cycles = cycles;
    int nodes = 0;
    for (Necklace<DominantSequence> cycle : cycles) {
      for (DominantSequence tree : cycle.beads()) {
        nodes += tree.size();
      }
    }
    this.nodeCount = nodes;
  }

  public static EndofunctionStructure of(Collection<Necklace<DominantSequence>> cycles) {
    Objects.requireNonNull(cycles, "cycles");
    return new EndofunctionStructure(ImmutableMultiset.copyOf(cycles));
  }

  /** Structure of {@code function}: every cycle becomes the necklace of its attached trees. */
  public static EndofunctionStructure of(Endofunction function) {
    Objects.requireNonNull(function, "function");
    List<Necklace<DominantSequence>> cycles = new ArrayList<>();
    for (List<Integer> cycle : function.cycles()) {
      List<DominantSequence> trees = new ArrayList<>(cycle.size());
      for (int node : cycle) {
        trees.add(function.attachedLevelSequence(node).dominant());
      }
      cycles.add(Necklace.of(trees));
    }
    return of(cycles);
  }

  public ImmutableMultiset<Necklace<DominantSequence>> cycles() {
    return cycles;
  }

  public int nodeCount() {
    return nodeCount;
  }

  /** Cycle lengths as a partition of the number of cyclic nodes. */
  public Partition cycleType() {
    List<Integer> lengths = new ArrayList<>(cycles.size());
    for (Necklace<DominantSequence> cycle : cycles) {
      lengths.add(cycle.size());
    }
    return Partition.fromParts(lengths);
  }

  /**
   * Size of the automorphism group of any endofunction with this structure, so that {@code n! /
   * degeneracy()} labelled functions share it.
   */
  public BigInteger degeneracy() {
    BigInteger degeneracy = BigInteger.ONE;
    for (Multiset.Entry<Necklace<DominantSequence>> entry : cycles.entrySet()) {
      Necklace<DominantSequence> cycle = entry.getElement();
      BigInteger cycleDegeneracy = BigInteger.valueOf(cycle.degeneracy());
      for (DominantSequence tree : cycle.beads()) {
        cycleDegeneracy = cycleDegeneracy.multiply(tree.degeneracy());
      }
      degeneracy =
          degeneracy
              .multiply(Counts.factorial(entry.getCount()))
              .multiply(cycleDegeneracy.pow(entry.getCount()));
    }
    return degeneracy;
  }

  /**
   * Sizes of the images of {@code f, f^2, ..., f^(n-1)} for any {@code f} with this structure, or
   * a single entry when {@code n <= 1}. A non-root tree node lies in the image of {@code f^k}
   * exactly when some node sits {@code k} levels below it; cyclic nodes are in every image.
   */
  public ImmutableList<Integer> imagePath() {
    int steps = Math.max(nodeCount - 1, 1);
    // leaving[k]: tree nodes in the image of f^(k-1) but not of f^k.
    int[] leaving = new int[steps + 2];
    for (Necklace<DominantSequence> cycle : cycles) {
      for (DominantSequence tree : cycle.beads()) {
        int[] parents = tree.asLevelSequence().parents();
        int[] reach = new int[parents.length];
        for (int node = parents.length - 1; node > 0; node--) {
          reach[parents[node]] = Math.max(reach[parents[node]], reach[node] + 1);
          leaving[Math.min(reach[node] + 1, steps + 1)]++;
        }
      }
    }
    ImmutableList.Builder<Integer> path = ImmutableList.builderWithExpectedSize(steps);
    int size = nodeCount;
    for (int step = 1; step <= steps; step++) {
      size -= leaving[step];
      path.add(size);
    }
    return path.build();
  }

  /**
   * A representative endofunction. Trees are labelled consecutively in preorder; each non-root node
   * maps to its parent and each root to the root of the next tree on its cycle.
   */
  public Endofunction toEndofunction() {
    int[] images = new int[nodeCount];
    int next = 0;
    for (Necklace<DominantSequence> cycle : cycles) {
      ImmutableList<DominantSequence> trees = cycle.beads();
      int[] roots = new int[trees.size()];
      for (int c = 0; c < trees.size(); c++) {
        DominantSequence tree = trees.get(c);
        int[] parents = tree.asLevelSequence().parents();
        roots[c] = next;
        for (int i = 1; i < parents.length; i++) {
          images[next + i] = next + parents[i];
        }
        next += tree.size();
      }
      for (int c = 0; c < roots.length; c++) {
        images[roots[c]] = roots[(c + 1) % roots.length];
      }
    }
    return Endofunction.trusted(images);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof EndofunctionStructure
        && cycles.equals(((EndofunctionStructure) o).cycles);
  }

  @Override
  public int hashCode() {
    return cycles.hashCode();
  }

  @Override
  public String toString() {
    return "EndofunctionStructure" + cycles;
  }
}
