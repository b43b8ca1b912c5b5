package funcstructs.partitions;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.math.BigIntegerMath;
import com.google.common.primitives.Ints;
import funcstructs.core.Enumerable;
import funcstructs.core.InvalidParameterException;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered tuples of {@code parts} non-negative integers summing to {@code total}. Emitted in
 * lexicographic order, from {@code [0, ..., 0, total]} to {@code [total, 0, ..., 0]}.
 */
public final class WeakCompositions implements Enumerable<List<Integer>> {
  private final int total;
  private final int parts;

  public WeakCompositions(int total, int parts) {
    this.total = InvalidParameterException.requireNonNegative(total, "total");
    this.parts = InvalidParameterException.requireNonNegative(parts, "parts");
  }

  @Override
  public BigInteger cardinality() {
    if (parts == 0) {
      return total == 0 ? BigInteger.ONE : BigInteger.ZERO;
    }
    return BigIntegerMath.binomial(total + parts - 1, parts - 1);
  }

  @Override
  public Iterator<List<Integer>> iterator() {
    if (parts == 0) {
      return total == 0
          ? ImmutableList.<List<Integer>>of(ImmutableList.of()).iterator()
          : ImmutableList.<List<Integer>>of().iterator();
    }
    return new Successors(total, parts);
  }

  private static final class Successors extends AbstractIterator<List<Integer>> {
    private final int[] values;
    private boolean started;

    Successors(int total, int parts) {
      this.values = new int[parts];
      values[parts - 1] = total;
    }

    @Override
    protected List<Integer> computeNext() {
      if (started && !advance()) {
        return endOfData();
      }
      started = true;
      return ImmutableList.copyOf(Ints.asList(values));
    }

    private boolean advance() {
      int last = values.length - 1;
      if (values[last] > 0) {
        if (last == 0) {
          return false;
        }
        values[last - 1]++;
        values[last]--;
        return true;
      }
      // Empty tail: carry the rightmost non-zero entry one step left and refill the tail.
      int j = last - 1;
      while (j >= 0 && values[j] == 0) {
        j--;
      }
      if (j <= 0) {
        return false;
      }
      int carried = values[j];
      values[j] = 0;
      values[j - 1]++;
      values[last] = carried - 1;
      return true;
    }
  }
}
