package funcstructs.necklaces;

import com.google.common.collect.ImmutableList;
import funcstructs.core.NotOrderableException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The lexicographically smallest rotation of a word: the canonical representative of the word's
 * class under cyclic rotation. Two words are rotations of each other iff their necklaces are equal.
 */
public final class Necklace<T> {
  private final ImmutableList<T> beads;
  private final int period;

  private Necklace(ImmutableList<T> beads) {
    this.beads = beads;
    this.period = period(beads);
  }

  /**
   * Canonical necklace of {@code word} under the natural order of its elements.
   *
   * @throws NotOrderableException if the elements are not mutually comparable
   */
  public static <T> Necklace<T> of(List<T> word) {
    Objects.requireNonNull(word, "word");
    for (T bead : word) {
      if (!(Objects.requireNonNull(bead, "bead") instanceof Comparable)) {
        throw new NotOrderableException(
            "necklace beads must be comparable, got " + bead.getClass().getName(), null);
      }
    }
    try {
      return of(word, Necklace::compareNatural);
    } catch (ClassCastException ex) {
      throw new NotOrderableException("necklace beads have no common order: " + word, ex);
    }
  }

  public static <T> Necklace<T> of(List<T> word, Comparator<? super T> order) {
    Objects.requireNonNull(word, "word");
    Objects.requireNonNull(order, "order");
    ImmutableList<T> beads = ImmutableList.copyOf(word);
    int start = leastRotation(beads, order);
    if (start == 0) {
      return new Necklace<>(beads);
    }
    return new Necklace<>(
        ImmutableList.<T>builderWithExpectedSize(beads.size())
            .addAll(beads.subList(start, beads.size()))
            .addAll(beads.subList(0, start))
            .build());
  }

  /** Wraps a word already known to be its own smallest rotation. */
  static <T> Necklace<T> trusted(ImmutableList<T> beads) {
    return new Necklace<>(beads);
  }

  @SuppressWarnings("unchecked")
  private static int compareNatural(Object a, Object b) {
    return ((Comparable<Object>) a).compareTo(b);
  }

  /**
   * Start index of the least rotation, found by the two-candidate scan: candidates {@code i} and
   * {@code j} are compared over a common run of length {@code k}, and the losing candidate jumps
   * past the run.
   */
  static <T> int leastRotation(List<T> word, Comparator<? super T> order) {
    int n = word.size();
    int i = 0;
    int j = 1;
    int k = 0;
    while (i < n && j < n && k < n) {
      int cmp = order.compare(word.get((i + k) % n), word.get((j + k) % n));
      if (cmp == 0) {
        k++;
        continue;
      }
      if (cmp > 0) {
        i += k + 1;
      } else {
        j += k + 1;
      }
      if (i == j) {
        j++;
      }
      k = 0;
    }
    return n == 0 ? 0 : Math.min(i, j);
  }

  /** Smallest rotation under which the word is invariant, from its prefix function. */
  static int period(List<?> word) {
    int n = word.size();
    if (n <= 1) {
      return n;
    }
    int[] border = new int[n];
    for (int i = 1; i < n; i++) {
      int b = border[i - 1];
      while (b > 0 && !word.get(i).equals(word.get(b))) {
        b = border[b - 1];
      }
      if (word.get(i).equals(word.get(b))) {
        b++;
      }
      border[i] = b;
    }
    int candidate = n - border[n - 1];
    return n % candidate == 0 ? candidate : n;
  }

  public ImmutableList<T> beads() {
    return beads;
  }

  public int size() {
    return beads.size();
  }

  public T bead(int index) {
    return beads.get(index);
  }

  public int period() {
    return period;
  }

  /** Number of rotations that leave the necklace unchanged. */
  public int degeneracy() {
    return period == 0 ? 1 : beads.size() / period;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Necklace && beads.equals(((Necklace<?>) o).beads);
  }

  @Override
  public int hashCode() {
    return beads.hashCode();
  }

  @Override
  public String toString() {
    return "Necklace" + beads;
  }
}
