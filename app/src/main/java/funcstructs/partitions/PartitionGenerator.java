package funcstructs.partitions;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import funcstructs.core.Enumerable;
import funcstructs.core.InvalidParameterException;
import funcstructs.model.Partition;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Generates every partition of {@code n} into exactly {@code length} positive parts.
 *
 * <p>Parts are held non-increasing and partitions are emitted in lexicographic order: the first is
 * the most balanced partition (parts differ by at most one) and the last is the spike {@code
 * [n - length + 1, 1, ..., 1]}.
 *
 * <p>Each successor step only touches the suffix of trailing parts that gets rebalanced, so the
 * amortized cost per partition is constant.
 */
public final class PartitionGenerator implements Enumerable<Partition> {
  private final int n;
  private final int length;
  private BigInteger cardinality;

  public PartitionGenerator(int n, int length) {
    this.n = InvalidParameterException.requireNonNegative(n, "n");
    this.length = InvalidParameterException.requireNonNegative(length, "length");
  }

  /** Every partition of {@code n}, grouped by length from 1 to n. */
  public static Enumerable<Partition> all(int n) {
    return new AllPartitions(InvalidParameterException.requireNonNegative(n, "n"));
  }

  public int n() {
    return n;
  }

  public int length() {
    return length;
  }

  @Override
  public BigInteger cardinality() {
    if (cardinality == null) {
      cardinality = count(n, length);
    }
    return cardinality;
  }

  @Override
  public Iterator<Partition> iterator() {
    if (length == 0) {
      return n == 0 ? ImmutableList.of(Partition.of()).iterator() : emptyIterator();
    }
    if (length == 1) {
      return n > 0 ? ImmutableList.of(Partition.of(n)).iterator() : emptyIterator();
    }
    if (n < length) {
      return emptyIterator();
    }
    return new Successors(n, length);
  }

  @Override
  public String toString() {
    return "PartitionGenerator(" + n + ", " + length + ")";
  }

  private static Iterator<Partition> emptyIterator() {
    return ImmutableList.<Partition>of().iterator();
  }

  /**
   * Number of partitions of {@code n} into exactly {@code length} parts. Taking one from every
   * part leaves a partition of {@code n - length} into at most {@code length} parts, which by
   * conjugation is one into parts no larger than {@code length}.
   */
  static BigInteger count(int n, int length) {
    if (length == 0) {
      return n == 0 ? BigInteger.ONE : BigInteger.ZERO;
    }
    return n < length ? BigInteger.ZERO : countWithPartsAtMost(n - length, length);
  }

  /** Partitions of {@code total} into parts of size at most {@code maxPart}, one row at a time. */
  static BigInteger countWithPartsAtMost(int total, int maxPart) {
    BigInteger[] row = new BigInteger[total + 1];
    Arrays.fill(row, BigInteger.ZERO);
    row[0] = BigInteger.ONE;
    for (int part = 1; part <= Math.min(maxPart, total); part++) {
      for (int m = part; m <= total; m++) {
        row[m] = row[m].add(row[m - part]);
      }
    }
    return row[total];
  }

  /**
   * Writes the most balanced partition of {@code total} into {@code count} parts at {@code
   * parts[offset..]} and returns how many of the written parts are ones.
   */
  private static int fillBalanced(int[] parts, int offset, int total, int count) {
    int quotient = total / count;
    int remainder = total % count;
    for (int i = 0; i < count; i++) {
      parts[offset + i] = i < remainder ? quotient + 1 : quotient;
    }
    return quotient == 1 ? count - remainder : 0;
  }

  private static final class Successors extends AbstractIterator<Partition> {
    private final int[] parts;
    // Number of trailing parts equal to one.
    private int ones;
    private boolean started;

    Successors(int n, int length) {
      this.parts = new int[length];
      this.ones = fillBalanced(parts, 0, n, length);
    }

    @Override
    protected Partition computeNext() {
      if (started && !advance()) {
        return endOfData();
      }
      started = true;
      return new Partition(Ints.asList(parts.clone()));
    }

    /**
     * Increments the rightmost part that can grow without breaking the ordering and rebalances
     * everything to its right. Returns false once only the spike remains.
     */
    private boolean advance() {
      int w = parts.length;
      if (ones >= w - 1) {
        return false;
      }
      // The suffix starts as the trailing ones plus the part just before them.
      int suffix = ones + 1;
      int freed = ones + parts[w - suffix] - 1;
      int pivot = w - suffix - 1;
      while (pivot > 0 && parts[pivot - 1] == parts[pivot]) {
        freed += parts[pivot];
        pivot--;
        suffix++;
      }
      parts[pivot]++;
      ones = fillBalanced(parts, pivot + 1, freed, suffix);
      return true;
    }
  }

  private static final class AllPartitions implements Enumerable<Partition> {
    private final int n;

    AllPartitions(int n) {
      this.n = n;
    }

    @Override
    public BigInteger cardinality() {
      return countWithPartsAtMost(n, n);
    }

    @Override
    public Iterator<Partition> iterator() {
      if (n == 0) {
        return new PartitionGenerator(0, 0).iterator();
      }
      return FluentIterable.concat(
              FluentIterable.from(Ints.asList(rangeClosed(n)))
                  .transform(length -> new PartitionGenerator(n, length)))
          .iterator();
    }

    private static int[] rangeClosed(int n) {
      int[] values = new int[n];
      for (int i = 0; i < n; i++) {
        values[i] = i + 1;
      }
      return values;
    }

    @Override
    public String toString() {
      return "Partitions(" + n + ")";
    }
  }
}
