package funcstructs.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import funcstructs.core.InvalidParameterException;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ProductsTest {

  @Test
  void cartesianVariesTheLastFactorFastest() {
    List<List<String>> factors = List.of(List.of("a", "b"), List.of("x", "y", "z"));
    List<List<String>> product = ImmutableList.copyOf(Products.cartesian(factors));
    assertEquals(
        List.of(
            List.of("a", "x"),
            List.of("a", "y"),
            List.of("a", "z"),
            List.of("b", "x"),
            List.of("b", "y"),
            List.of("b", "z")),
        product);
  }

  @Test
  void cartesianEdgeCases() {
    assertEquals(List.of(List.of()), ImmutableList.copyOf(Products.cartesian(List.of())));
    assertEquals(
        List.of(),
        ImmutableList.copyOf(Products.cartesian(List.of(List.of(1, 2), List.<Integer>of()))));
  }

  @Test
  void combinationsWithReplacementAreNonDecreasing() {
    assertEquals(
        List.of(
            List.of(1, 1),
            List.of(1, 2),
            List.of(1, 3),
            List.of(2, 2),
            List.of(2, 3),
            List.of(3, 3)),
        ImmutableList.copyOf(Products.combinationsWithReplacement(List.of(1, 2, 3), 2)));
    Iterable<List<Integer>> triples =
        Products.combinationsWithReplacement(List.of(1, 2, 3, 4, 5), 3);
    assertEquals(35, ImmutableList.copyOf(triples).size());
  }

  @Test
  void combinationsEdgeCases() {
    List<Integer> single = List.of(1);
    assertEquals(
        List.of(List.of()), ImmutableList.copyOf(Products.combinationsWithReplacement(single, 0)));
    assertEquals(
        List.of(), ImmutableList.copyOf(Products.combinationsWithReplacement(List.of(), 2)));
    assertThrows(
        InvalidParameterException.class, () -> Products.combinationsWithReplacement(single, -1));
  }

  @Test
  void iterablesRestart() {
    Iterable<List<Integer>> product = Products.cartesian(List.of(List.of(1, 2), List.of(3)));
    assertEquals(ImmutableList.copyOf(product), ImmutableList.copyOf(product));
  }
}
