package funcstructs.necklaces;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import funcstructs.core.NotOrderableException;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;

final class NecklaceTest {

  @Test
  void rotationsShareOneNecklace() {
    Necklace<Integer> expected = Necklace.of(List.of(0, 1, 0, 2));
    assertEquals(List.of(0, 1, 0, 2), expected.beads());
    assertEquals(expected, Necklace.of(List.of(1, 0, 2, 0)));
    assertEquals(expected, Necklace.of(List.of(2, 0, 1, 0)));
    assertEquals(expected.hashCode(), Necklace.of(List.of(0, 2, 0, 1)).hashCode());
    assertNotEquals(expected, Necklace.of(List.of(0, 0, 1, 2)));
  }

  @Test
  void followsTheGivenOrder() {
    Necklace<Integer> reversed = Necklace.of(List.of(0, 1, 2), Comparator.reverseOrder());
    assertEquals(List.of(2, 0, 1), reversed.beads());
  }

  @Test
  void periodAndDegeneracy() {
    Necklace<String> repeated = Necklace.of(List.of("b", "a", "b", "a", "b", "a"));
    assertEquals(List.of("a", "b", "a", "b", "a", "b"), repeated.beads());
    assertEquals(2, repeated.period());
    assertEquals(3, repeated.degeneracy());

    Necklace<Integer> aperiodic = Necklace.of(List.of(0, 0, 1, 0, 1));
    assertEquals(5, aperiodic.period());
    assertEquals(1, aperiodic.degeneracy());

    assertEquals(1, Necklace.of(List.of(7, 7, 7)).period());
    assertEquals(1, Necklace.of(List.<Integer>of()).degeneracy());
  }

  @Test
  void leastRotationFindsTheSmallestStart() {
    assertEquals(3, Necklace.leastRotation(List.of(2, 1, 2, 1, 1, 2), Comparator.naturalOrder()));
    assertEquals(0, Necklace.leastRotation(List.of(4, 4, 4), Comparator.naturalOrder()));
  }

  @Test
  void rejectsBeadsWithoutAnOrder() {
    assertThrows(NotOrderableException.class, () -> Necklace.of(List.of(new Object(), "a")));
    assertThrows(NotOrderableException.class, () -> Necklace.of(List.<Object>of(1, "a")));
  }
}
