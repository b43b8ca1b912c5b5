package funcstructs.structures;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import funcstructs.core.InvalidParameterException;
import funcstructs.model.Partition;
import funcstructs.trees.LevelSequence;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

final class EndofunctionTest {
  // 0 -> 1 -> 2 -> 0 is a cycle; 3 and 4 hang off 0, 5 hangs off 3; 6 is a fixed point.
  private static final Endofunction SAMPLE = Endofunction.of(1, 2, 0, 0, 0, 3, 6);

  @Test
  void findsCyclesFromTheirSmallestNode() {
    assertEquals(List.of(List.of(0, 1, 2), List.of(6)), SAMPLE.cycles());
    assertTrue(SAMPLE.isCyclic(1));
    assertFalse(SAMPLE.isCyclic(3));
  }

  @Test
  void collectsPreimages() {
    assertEquals(
        List.of(
            List.of(2, 3, 4),
            List.of(0),
            List.of(1),
            List.of(5),
            List.of(),
            List.of(),
            List.of(6)),
        SAMPLE.preimage());
  }

  @Test
  void separatesAttachedTreeNodesFromTheCycle() {
    assertEquals(List.of(3, 4), SAMPLE.attachedTreeNodes(0));
    assertEquals(List.of(), SAMPLE.attachedTreeNodes(1));
    assertEquals(List.of(), SAMPLE.attachedTreeNodes(6));
  }

  @Test
  void readsTheTreeHangingOffANode() {
    assertEquals(LevelSequence.of(0, 1, 2, 1), SAMPLE.attachedLevelSequence(0));
    assertEquals(LevelSequence.of(0), SAMPLE.attachedLevelSequence(2));
    assertEquals(LevelSequence.of(0, 1), SAMPLE.attachedLevelSequence(3));
  }

  @Test
  void tracksImagesOfIterates() {
    assertEquals(List.of(5, 4, 4, 4, 4, 4), SAMPLE.imagePath());
    assertEquals(List.of(3, 2, 1), Endofunction.of(0, 0, 1, 2).imagePath());
    assertEquals(List.of(3, 3), Endofunction.of(1, 2, 0).imagePath(), "Permutations are onto");
    assertEquals(List.of(1), Endofunction.of(0).imagePath());
    assertEquals(List.of(0), Endofunction.of().imagePath());
  }

  @Test
  void handlesLongChainsWithoutRecursion() {
    int n = 50_000;
    int[] images = new int[n];
    for (int i = 1; i < n; i++) {
      images[i] = i - 1;
    }
    Endofunction chain = Endofunction.of(images);
    assertEquals(List.of(List.of(0)), chain.cycles());
    assertEquals(n - 1, chain.attachedLevelSequence(0).height());

    EndofunctionStructure structure = chain.structure();
    assertEquals(Partition.of(1), structure.cycleType());
    assertEquals(n, structure.nodeCount());
    assertEquals(BigInteger.ONE, structure.degeneracy(), "A path has no symmetry");
    assertEquals(structure, structure.toEndofunction().structure());
    List<Integer> path = structure.imagePath();
    assertEquals(n - 1, path.size());
    assertEquals(n - 1, path.get(0));
    assertEquals(1, path.get(n - 2));
  }

  @Test
  void rejectsImagesOutsideTheDomain() {
    assertThrows(InvalidParameterException.class, () -> Endofunction.of(0, 2));
    assertThrows(InvalidParameterException.class, () -> Endofunction.of(-1));
  }

  @Test
  void conjugateFunctionsShareAStructure() {
    // Relabel SAMPLE by x -> 6 - x.
    int[] relabelled = new int[7];
    for (int x = 0; x < 7; x++) {
      relabelled[6 - x] = 6 - SAMPLE.apply(x);
    }
    assertEquals(SAMPLE.structure(), Endofunction.of(relabelled).structure());
  }
}
