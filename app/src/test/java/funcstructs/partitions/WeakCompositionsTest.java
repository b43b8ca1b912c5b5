package funcstructs.partitions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import funcstructs.core.InvalidParameterException;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

final class WeakCompositionsTest {

  @Test
  void listsCompositionsInOrder() {
    assertEquals(
        List.of(
            List.of(0, 0, 2),
            List.of(0, 1, 1),
            List.of(0, 2, 0),
            List.of(1, 0, 1),
            List.of(1, 1, 0),
            List.of(2, 0, 0)),
        ImmutableList.copyOf(new WeakCompositions(2, 3)));
  }

  @Test
  void countIsStarsAndBars() {
    WeakCompositions compositions = new WeakCompositions(6, 4);
    List<List<Integer>> all = ImmutableList.copyOf(compositions);
    assertEquals(84, all.size());
    assertEquals(84, new HashSet<>(all).size());
    assertEquals(BigInteger.valueOf(84), compositions.cardinality());
    assertTrue(
        compositions.stream().allMatch(c -> c.stream().mapToInt(Integer::intValue).sum() == 6),
        "Every composition should sum to the total");
  }

  @Test
  void zeroParts() {
    assertEquals(List.of(List.of()), ImmutableList.copyOf(new WeakCompositions(0, 0)));
    assertFalse(new WeakCompositions(3, 0).iterator().hasNext());
    assertEquals(BigInteger.ZERO, new WeakCompositions(3, 0).cardinality());
  }

  @Test
  void rejectsNegativeArguments() {
    assertThrows(InvalidParameterException.class, () -> new WeakCompositions(-1, 2));
    assertThrows(InvalidParameterException.class, () -> new WeakCompositions(2, -1));
  }
}
