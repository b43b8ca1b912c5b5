package funcstructs.trees;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.math.BigIntegerMath;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

final class DominantSequenceTest {

  @Test
  void chopsOffTheRoot() {
    DominantSequence tree = DominantSequence.of(0, 1, 2, 1, 1);
    assertEquals(
        List.of(DominantSequence.of(0, 1), DominantSequence.of(0), DominantSequence.of(0)),
        tree.subtrees());
    DominantSequence leaf = DominantSequence.of(0);
    assertEquals(ImmutableMultiset.of(leaf, leaf, DominantSequence.of(0, 1)), tree.chop());
  }

  @Test
  void degeneracyCountsAutomorphisms() {
    assertEquals(BigInteger.ONE, DominantSequence.of(0, 1, 2, 3).degeneracy());
    assertEquals(BigInteger.valueOf(6), DominantSequence.of(0, 1, 1, 1).degeneracy());
    assertEquals(BigInteger.valueOf(2), DominantSequence.of(0, 1, 2, 2).degeneracy());
    // Two identical cherries under the root: 2! * 2^2.
    assertEquals(BigInteger.valueOf(8), DominantSequence.of(0, 1, 2, 2, 1, 2, 2).degeneracy());
  }

  @Test
  void labelledCountsSumToCayley() {
    for (int n = 1; n <= 8; n++) {
      BigInteger labelled = BigInteger.ZERO;
      BigInteger factorial = BigIntegerMath.factorial(n);
      for (DominantSequence tree : new TreeGenerator(n)) {
        labelled = labelled.add(factorial.divide(tree.degeneracy()));
      }
      assertEquals(BigInteger.valueOf(n).pow(n - 1), labelled, "Rooted labelled trees on " + n);
    }
  }

  @Test
  void comparesLexicographically() {
    assertTrue(DominantSequence.of(0, 1, 2).compareTo(DominantSequence.of(0, 1, 1)) > 0);
    assertTrue(DominantSequence.of(0, 1).compareTo(DominantSequence.of(0, 1, 1)) < 0);
    assertEquals(DominantSequence.of(0, 1, 1, 2), DominantSequence.of(0, 1, 2, 1));
  }

  @Test
  void convertsToRootedTreeAndBack() {
    DominantSequence tree = DominantSequence.of(0, 1, 2, 2, 1, 2, 1);
    assertEquals(tree, tree.toRootedTree().toDominantSequence());
    assertEquals(tree.levels(), tree.asLevelSequence().levels());
    assertEquals(2, tree.height());
  }

  @Test
  void generatedTreesAreAlreadyCanonical() {
    for (int n = 1; n <= 10; n++) {
      for (DominantSequence tree : new TreeGenerator(n)) {
        assertEquals(tree, tree.asLevelSequence().dominant(), "Canonical form of " + tree);
        assertEquals(tree, tree.toRootedTree().toDominantSequence());
      }
    }
  }

  @Test
  void canonicalizesTallTrees() {
    int depth = 25_000;
    // A path of depth - 1 edges, then a path of depth edges, both hanging off the root.
    int[] levels = new int[2 * depth];
    for (int i = 1; i < depth; i++) {
      levels[i] = i;
    }
    for (int i = 0; i < depth; i++) {
      levels[depth + i] = i + 1;
    }
    DominantSequence tree = DominantSequence.of(levels);
    assertEquals(depth, tree.height());
    assertEquals(1, tree.level(1));
    assertEquals(depth, tree.level(depth), "The longer path comes first");
    assertEquals(1, tree.level(depth + 1));
    assertEquals(BigInteger.ONE, tree.degeneracy());
    assertEquals(tree, tree.toRootedTree().toDominantSequence());
    assertEquals(LevelSequence.of(levels).unordered(), tree.toRootedTree());

    int[] twins = new int[2 * depth + 1];
    for (int i = 0; i < depth; i++) {
      twins[1 + i] = i + 1;
      twins[1 + depth + i] = i + 1;
    }
    assertEquals(BigInteger.TWO, DominantSequence.of(twins).degeneracy(), "Two equal paths swap");
  }
}
