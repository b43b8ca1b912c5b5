package funcstructs.necklaces;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;
import com.google.common.primitives.Ints;
import funcstructs.core.Counts;
import funcstructs.core.Enumerable;
import funcstructs.core.InvalidParameterException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Generates every necklace with a fixed content: each bead of a given multiset is used exactly
 * once. Necklaces come out in lexicographic order.
 *
 * <p>Implements the simple fixed content algorithm from J. Sawada, "A fast algorithm to generate
 * necklaces with fixed content", Theoretical Computer Science 301 (2003). Words are grown one
 * position at a time, tracking the period of the longest prenecklace prefix; the usual recursion is
 * unrolled into per-position choice and period arrays so the iterator only holds that state.
 */
public final class NecklaceGenerator<T> implements Enumerable<Necklace<T>> {
  private final ImmutableList<T> elements;
  private final int[] multiplicities;

  private NecklaceGenerator(ImmutableList<T> elements, int[] multiplicities) {
    this.elements = elements;
    this.multiplicities = multiplicities;
  }

  /** Necklaces over the beads of a collection, ordered naturally. */
  public static <T extends Comparable<? super T>> NecklaceGenerator<T> of(Collection<T> beads) {
    return of(beads, Comparator.naturalOrder());
  }

  /**
   * Necklaces over the beads of a collection, ordered by {@code order}.
   *
   * @throws InvalidParameterException if {@code order} ties two beads that are not equal
   */
  public static <T> NecklaceGenerator<T> of(Collection<T> beads, Comparator<? super T> order) {
    Objects.requireNonNull(beads, "beads");
    Objects.requireNonNull(order, "order");
    TreeMultiset<T> sorted = TreeMultiset.create(order);
    for (T bead : beads) {
      T tied = sorted.elementSet().floor(bead);
      if (tied != null && order.compare(tied, bead) == 0 && !tied.equals(bead)) {
        throw new InvalidParameterException(
            "beads " + tied + " and " + bead + " are distinct but compare as equal");
      }
      sorted.add(bead);
    }
    ImmutableList.Builder<T> elements = ImmutableList.builder();
    int[] multiplicities = new int[sorted.elementSet().size()];
    int index = 0;
    for (Multiset.Entry<T> entry : sorted.entrySet()) {
      elements.add(entry.getElement());
      multiplicities[index++] = entry.getCount();
    }
    return new NecklaceGenerator<>(elements.build(), multiplicities);
  }

  /**
   * Necklaces over the symbols {@code 0 .. k-1} where symbol {@code i} occurs {@code
   * multiplicities[i]} times.
   */
  public static NecklaceGenerator<Integer> ofMultiplicities(int... multiplicities) {
    Objects.requireNonNull(multiplicities, "multiplicities");
    ImmutableList.Builder<Integer> symbols = ImmutableList.builder();
    for (int i = 0; i < multiplicities.length; i++) {
      if (multiplicities[i] < 1) {
        throw new InvalidParameterException(
            "bead multiplicities must be positive: " + Arrays.toString(multiplicities));
      }
      symbols.add(i);
    }
    return new NecklaceGenerator<>(symbols.build(), multiplicities.clone());
  }

  /** Distinct beads in increasing order. */
  public ImmutableList<T> elements() {
    return elements;
  }

  public List<Integer> multiplicities() {
    return Ints.asList(multiplicities.clone());
  }

  public int beadCount() {
    int total = 0;
    for (int multiplicity : multiplicities) {
      total += multiplicity;
    }
    return total;
  }

  /**
   * Number of necklaces of each period. Every period is {@code n / g} times a divisor of {@code g
   * = gcd(multiplicities)}; words repeating with period dividing {@code (n / g) f} are counted by a
   * multinomial coefficient, and the shorter periods are subtracted off.
   */
  public SortedMap<Integer, BigInteger> countByPeriod() {
    SortedMap<Integer, BigInteger> byPeriod = new TreeMap<>();
    if (multiplicities.length == 0) {
      return ImmutableSortedMap.of();
    }
    int n = beadCount();
    int g = Counts.gcd(multiplicities);
    int basePeriod = n / g;
    Map<Integer, BigInteger> necklacesByFactor = new TreeMap<>();
    for (int factor : Counts.divisors(g)) {
      int[] repeatedUnit = new int[multiplicities.length];
      for (int i = 0; i < multiplicities.length; i++) {
        repeatedUnit[i] = multiplicities[i] * factor / g;
      }
      BigInteger words = Counts.multinomial(repeatedUnit);
      for (Map.Entry<Integer, BigInteger> shorter : necklacesByFactor.entrySet()) {
        if (factor % shorter.getKey() == 0) {
          BigInteger period = BigInteger.valueOf((long) basePeriod * shorter.getKey());
          words = words.subtract(shorter.getValue().multiply(period));
        }
      }
      BigInteger necklaces = words.divide(BigInteger.valueOf((long) basePeriod * factor));
      necklacesByFactor.put(factor, necklaces);
      if (necklaces.signum() > 0) {
        byPeriod.put(basePeriod * factor, necklaces);
      }
    }
    return ImmutableSortedMap.copyOfSorted(byPeriod);
  }

  @Override
  public BigInteger cardinality() {
    return countByPeriod().values().stream().reduce(BigInteger.ZERO, BigInteger::add);
  }

  @Override
  public Iterator<Necklace<T>> iterator() {
    if (multiplicities.length == 0) {
      return ImmutableList.<Necklace<T>>of().iterator();
    }
    return new Words();
  }

  @Override
  public String toString() {
    return "NecklaceGenerator(" + elements + " x " + Arrays.toString(multiplicities) + ")";
  }

  private final class Words extends AbstractIterator<Necklace<T>> {
    private final int n = beadCount();
    private final int k = multiplicities.length;
    private final int[] word = new int[n];
    private final int[] remaining = multiplicities.clone();
    // Indexed by 1-based position t: prefix period so far, and the symbol currently tried at t.
    private final int[] period = new int[n + 2];
    private final int[] choice = new int[n + 2];
    private int t;

    Words() {
      // The smallest symbol always starts a necklace.
      remaining[0]--;
      t = 2;
      period[2] = 1;
      choice[2] = -1;
    }

    @Override
    protected Necklace<T> computeNext() {
      while (true) {
        if (t > n) {
          boolean necklace = n % period[t] == 0;
          t--;
          if (necklace) {
            return emit();
          }
          continue;
        }
        if (t < 2) {
          return endOfData();
        }
        int p = period[t];
        int symbol;
        if (choice[t] >= 0) {
          remaining[choice[t]]++;
          symbol = choice[t] + 1;
        } else {
          symbol = word[t - p - 1];
        }
        while (symbol < k && remaining[symbol] == 0) {
          symbol++;
        }
        if (symbol == k) {
          choice[t] = -1;
          t--;
          continue;
        }
        choice[t] = symbol;
        word[t - 1] = symbol;
        remaining[symbol]--;
        period[t + 1] = symbol == word[t - p - 1] ? p : t;
        t++;
        choice[t] = -1;
      }
    }

    private Necklace<T> emit() {
      ImmutableList.Builder<T> beads = ImmutableList.builderWithExpectedSize(n);
      for (int symbol : word) {
        beads.add(elements.get(symbol));
      }
      return Necklace.trusted(beads.build());
    }
  }
}
