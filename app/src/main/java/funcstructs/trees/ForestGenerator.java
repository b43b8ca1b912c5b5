package funcstructs.trees;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import funcstructs.core.Counts;
import funcstructs.core.Enumerable;
import funcstructs.core.InvalidParameterException;
import funcstructs.model.Partition;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates every forest whose tree sizes are the parts of a partition.
 *
 * <p>Trees of equal size k occurring r times are chosen as a combination with repetition over the
 * output of {@link TreeGenerator}: the slots hold trees in generation order, and advancing a slot
 * resets every slot to its right to the same tree, so each multiset appears once. Distinct sizes
 * are combined as an odometer-style Cartesian product.
 */
public final class ForestGenerator implements Enumerable<Forest> {
  private final Partition partition;

  public ForestGenerator(Partition partition) {
    this.partition = Objects.requireNonNull(partition, "partition");
  }

  /** Every forest on {@code n} nodes: the trees on {@code n + 1} nodes with their root removed. */
  public static Enumerable<Forest> ofSize(int n) {
    InvalidParameterException.requireNonNegative(n, "n");
    TreeGenerator trees = new TreeGenerator(n + 1);
    return new Enumerable<>() {
      @Override
      public BigInteger cardinality() {
        return trees.cardinality();
      }

      @Override
      public Iterator<Forest> iterator() {
        return FluentIterable.from(trees).transform(tree -> Forest.of(tree.chop())).iterator();
      }

      @Override
      public String toString() {
        return "Forests(" + n + ")";
      }
    };
  }

  public Partition partition() {
    return partition;
  }

  @Override
  public BigInteger cardinality() {
    Map<Integer, Integer> multiplicities = partition.multiplicities();
    int largest = multiplicities.isEmpty() ? 0 : partition.part(0);
    BigInteger[] treeCounts = TreeGenerator.treeCounts(largest);
    BigInteger total = BigInteger.ONE;
    for (Map.Entry<Integer, Integer> entry : multiplicities.entrySet()) {
      total = total.multiply(Counts.multichoose(treeCounts[entry.getKey()], entry.getValue()));
    }
    return total;
  }

  @Override
  public Iterator<Forest> iterator() {
    List<SizeGroup> groups = new ArrayList<>();
    for (Map.Entry<Integer, Integer> entry : partition.multiplicities().entrySet()) {
      groups.add(new SizeGroup(entry.getKey(), entry.getValue()));
    }
    return new Odometer(groups);
  }

  @Override
  public String toString() {
    return "ForestGenerator(" + partition.parts() + ")";
  }

  /** Non-increasing (in generation order) choice of {@code slots.length} trees of one size. */
  private static final class SizeGroup {
    private final int size;
    private final DominantSequence[] slots;

    SizeGroup(int size, int count) {
      this.size = size;
      this.slots = new DominantSequence[count];
      reset();
    }

    void reset() {
      Arrays.fill(slots, TreeGenerator.first(size));
    }

    boolean advance() {
      for (int i = slots.length - 1; i >= 0; i--) {
        Optional<DominantSequence> next = TreeGenerator.next(slots[i]);
        if (next.isPresent()) {
          Arrays.fill(slots, i, slots.length, next.get());
          return true;
        }
      }
      return false;
    }

    void addTo(List<DominantSequence> trees) {
      trees.addAll(Arrays.asList(slots));
    }
  }

  private static final class Odometer extends AbstractIterator<Forest> {
    private final List<SizeGroup> groups;
    private boolean started;

    Odometer(List<SizeGroup> groups) {
      this.groups = groups;
    }

    @Override
    protected Forest computeNext() {
      if (started && !advance()) {
        return endOfData();
      }
      started = true;
      List<DominantSequence> trees = new ArrayList<>();
      for (SizeGroup group : groups) {
        group.addTo(trees);
      }
      return Forest.of(trees);
    }

    private boolean advance() {
      for (int i = groups.size() - 1; i >= 0; i--) {
        if (groups.get(i).advance()) {
          return true;
        }
        groups.get(i).reset();
      }
      return false;
    }
  }
}
