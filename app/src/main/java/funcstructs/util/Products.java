package funcstructs.util;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import funcstructs.core.InvalidParameterException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/** Lazy product and combination iterables over restartable sources. */
public final class Products {
  private Products() {}

  /**
   * Every tuple taking one element from each factor, with the last factor varying fastest. Each
   * factor is iterated again whenever a factor to its left advances, so factors must be
   * restartable. A product with no factors has exactly one empty tuple.
   */
  public static <T> Iterable<List<T>> cartesian(List<? extends Iterable<? extends T>> factors) {
    List<Iterable<? extends T>> copy = List.copyOf(Objects.requireNonNull(factors, "factors"));
    return () -> new Cartesian<>(copy);
  }

  /**
   * Every multiset of {@code r} elements drawn from {@code pool}, as lists whose pool indices are
   * non-decreasing. Elements are taken to be distinct by position.
   */
  public static <T> Iterable<List<T>> combinationsWithReplacement(List<T> pool, int r) {
    ImmutableList<T> items = ImmutableList.copyOf(Objects.requireNonNull(pool, "pool"));
    InvalidParameterException.requireNonNegative(r, "r");
    return () -> new Combinations<>(items, r);
  }

  private static final class Cartesian<T> extends AbstractIterator<List<T>> {
    private final List<Iterable<? extends T>> factors;
    private final List<Iterator<? extends T>> cursors;
    private final List<T> current;
    private boolean started;

    Cartesian(List<Iterable<? extends T>> factors) {
      this.factors = factors;
      this.cursors = new ArrayList<>(factors.size());
      this.current = new ArrayList<>(factors.size());
    }

    @Override
    protected List<T> computeNext() {
      if (!started) {
        started = true;
        for (Iterable<? extends T> factor : factors) {
          Iterator<? extends T> cursor = factor.iterator();
          if (!cursor.hasNext()) {
            return endOfData();
          }
          cursors.add(cursor);
          current.add(cursor.next());
        }
        return List.copyOf(current);
      }
      for (int i = factors.size() - 1; i >= 0; i--) {
        Iterator<? extends T> cursor = cursors.get(i);
        if (cursor.hasNext()) {
          current.set(i, cursor.next());
          for (int j = i + 1; j < factors.size(); j++) {
            Iterator<? extends T> restarted = factors.get(j).iterator();
            cursors.set(j, restarted);
            current.set(j, restarted.next());
          }
          return List.copyOf(current);
        }
      }
      return endOfData();
    }
  }

  private static final class Combinations<T> extends AbstractIterator<List<T>> {
    private final ImmutableList<T> pool;
    private final int[] indices;
    private boolean started;

    Combinations(ImmutableList<T> pool, int r) {
      this.pool = pool;
      this.indices = new int[r];
    }

    @Override
    protected List<T> computeNext() {
      if (!started) {
        started = true;
        if (pool.isEmpty() && indices.length > 0) {
          return endOfData();
        }
        return emit();
      }
      int last = pool.size() - 1;
      for (int i = indices.length - 1; i >= 0; i--) {
        if (indices[i] < last) {
          int next = indices[i] + 1;
          for (int j = i; j < indices.length; j++) {
            indices[j] = next;
          }
          return emit();
        }
      }
      return endOfData();
    }

    private List<T> emit() {
      ImmutableList.Builder<T> chosen = ImmutableList.builderWithExpectedSize(indices.length);
      for (int index : indices) {
        chosen.add(pool.get(index));
      }
      return chosen.build();
    }
  }
}
