package funcstructs.model;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.Ints;
import funcstructs.core.InvalidParameterException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Integer partition held as a non-increasing list of positive parts. Interpreted as a cycle type
 * when it lists the cycle lengths of an endofunction structure.
 */
public record Partition(List<Integer> parts) implements Comparable<Partition> {

  public Partition {
    Objects.requireNonNull(parts, "parts");
    parts = List.copyOf(parts);
    for (int i = 0; i < parts.size(); i++) {
      int part = parts.get(i);
      if (part < 1) {
        throw new InvalidParameterException("partition parts must be positive: " + parts);
      }
      if (i > 0 && part > parts.get(i - 1)) {
        throw new InvalidParameterException("partition parts must be non-increasing: " + parts);
      }
    }
  }

  public static Partition of(int... parts) {
    return new Partition(Ints.asList(parts));
  }

  /** Builds a partition from parts in any order. */
  public static Partition fromParts(Collection<Integer> parts) {
    Objects.requireNonNull(parts, "parts");
    List<Integer> sorted = new ArrayList<>(parts);
    sorted.sort(Collections.reverseOrder());
    return new Partition(sorted);
  }

  public int length() {
    return parts.size();
  }

  public int sum() {
    int total = 0;
    for (int part : parts) {
      total += part;
    }
    return total;
  }

  public int part(int index) {
    return parts.get(index);
  }

  public boolean isEmpty() {
    return parts.isEmpty();
  }

  /** Distinct parts in increasing order mapped to how often each occurs. */
  public ImmutableSortedMap<Integer, Integer> multiplicities() {
    Map<Integer, Integer> counts = new TreeMap<>();
    for (int part : parts) {
      counts.merge(part, 1, Integer::sum);
    }
    return ImmutableSortedMap.copyOf(counts);
  }

  public int[] toArray() {
    return Ints.toArray(parts);
  }

  @Override
  public int compareTo(Partition other) {
    int shared = Math.min(parts.size(), other.parts.size());
    for (int i = 0; i < shared; i++) {
      int cmp = Integer.compare(parts.get(i), other.parts.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(parts.size(), other.parts.size());
  }

  @Override
  public String toString() {
    return "Partition" + parts;
  }
}
