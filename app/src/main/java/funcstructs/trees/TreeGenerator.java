package funcstructs.trees;

import com.google.common.collect.AbstractIterator;
import funcstructs.core.Counts;
import funcstructs.core.Enumerable;
import funcstructs.core.InvalidParameterException;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.Optional;

/**
 * Generates the dominant sequence of every unordered rooted tree on {@code n} nodes.
 *
 * <p>Uses the constant amortized time successor of T. Beyer and S. M. Hedetniemi, "Constant time
 * generation of rooted trees", SIAM J. Comput. 9(4), 1980. Trees come out in decreasing
 * lexicographic order, from the path {@code [0, 1, ..., n-1]} to the star {@code [0, 1, ..., 1]}.
 */
public final class TreeGenerator implements Enumerable<DominantSequence> {
  private final int n;

  public TreeGenerator(int n) {
    this.n = InvalidParameterException.requirePositive(n, "node count");
  }

  public int n() {
    return n;
  }

  /** The first tree emitted for {@code n} nodes: the path. */
  public static DominantSequence first(int n) {
    return DominantSequence.trusted(pathLevels(InvalidParameterException.requirePositive(n, "n")));
  }

  /** The tree emitted right after {@code tree}, or empty if {@code tree} is the last one. */
  public static Optional<DominantSequence> next(DominantSequence tree) {
    int[] levels = tree.toArray();
    return successor(levels) ? Optional.of(DominantSequence.trusted(levels)) : Optional.empty();
  }

  /**
   * Rewrites {@code levels} in place into the next dominant sequence. Returns false, leaving the
   * array untouched, when the sequence is already the star.
   */
  static boolean successor(int[] levels) {
    int size = levels.length;
    if (size <= 2 || levels[1] == levels[2]) {
      return false;
    }
    // Last node not on the leftmost branch's level.
    int p = size - 1;
    while (levels[p] == levels[1]) {
      p--;
    }
    // Its parent's position: the nearest earlier node strictly below it.
    int q = p - 1;
    while (levels[q] >= levels[p]) {
      q--;
    }
    int shift = p - q;
    for (int i = p; i < size; i++) {
      levels[i] = levels[i - shift];
    }
    return true;
  }

  private static int[] pathLevels(int n) {
    int[] levels = new int[n];
    for (int i = 0; i < n; i++) {
      levels[i] = i;
    }
    return levels;
  }

  /**
   * Otter's recurrence {@code (m-1) T(m) = sum_{i<m} (sum_{d | i} d T(d)) T(m-i)}, OEIS A000081.
   */
  @Override
  public BigInteger cardinality() {
    return treeCounts(n)[n];
  }

  /** Number of rooted trees on each node count from 0 to {@code max}. */
  public static BigInteger[] treeCounts(int max) {
    BigInteger[] counts = new BigInteger[max + 1];
    counts[0] = BigInteger.ZERO;
    if (max >= 1) {
      counts[1] = BigInteger.ONE;
    }
    for (int m = 2; m <= max; m++) {
      BigInteger sum = BigInteger.ZERO;
      for (int i = 1; i < m; i++) {
        BigInteger divisorSum = BigInteger.ZERO;
        for (int d : Counts.divisors(i)) {
          divisorSum = divisorSum.add(counts[d].multiply(BigInteger.valueOf(d)));
        }
        sum = sum.add(divisorSum.multiply(counts[m - i]));
      }
      counts[m] = sum.divide(BigInteger.valueOf(m - 1));
    }
    return counts;
  }

  @Override
  public Iterator<DominantSequence> iterator() {
    return new Successors(pathLevels(n));
  }

  @Override
  public String toString() {
    return "TreeGenerator(" + n + ")";
  }

  private static final class Successors extends AbstractIterator<DominantSequence> {
    private final int[] levels;
    private boolean started;

    Successors(int[] levels) {
      this.levels = levels;
    }

    @Override
    protected DominantSequence computeNext() {
      if (started && !successor(levels)) {
        return endOfData();
      }
      started = true;
      return DominantSequence.trusted(levels.clone());
    }
  }
}
