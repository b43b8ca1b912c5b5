package funcstructs.structures;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import funcstructs.core.Counts;
import funcstructs.core.Enumerable;
import funcstructs.core.InvalidParameterException;
import funcstructs.model.Partition;
import funcstructs.necklaces.Necklace;
import funcstructs.necklaces.NecklaceGenerator;
import funcstructs.partitions.PartitionGenerator;
import funcstructs.partitions.WeakCompositions;
import funcstructs.trees.DominantSequence;
import funcstructs.trees.ForestGenerator;
import funcstructs.trees.TreeGenerator;
import funcstructs.util.Products;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates every endofunction structure on {@code n} nodes, optionally restricted to one cycle
 * type.
 *
 * <p>A cycle type is a partition of the cyclic nodes; the other nodes sit in trees attached to
 * them. For each cycle length the tree nodes allotted to that length are split between its cycles
 * by a partition, and the trees of one cycle are a forest arranged as a necklace. Cycles of the
 * same length and the same number of nodes are chosen as combinations with repetition, so every
 * structure comes out exactly once.
 */
public final class StructureGenerator implements Enumerable<EndofunctionStructure> {
  private static final Logger LOG = LoggerFactory.getLogger(StructureGenerator.class);

  private final int n;
  private final Partition cycleType;

  /** Every structure on {@code n} nodes. */
  public StructureGenerator(int n) {
    this.n = InvalidParameterException.requireNonNegative(n, "node count");
    this.cycleType = null;
  }

  /**
   * Structures on {@code n} nodes whose cycle lengths are the parts of {@code cycleType}.
   *
   * @throws InvalidParameterException if the cycle type has more nodes than {@code n}, or is empty
   *     while {@code n} is positive
   */
  public StructureGenerator(int n, Partition cycleType) {
    this.n = InvalidParameterException.requireNonNegative(n, "node count");
    this.cycleType = Objects.requireNonNull(cycleType, "cycleType");
    if (cycleType.sum() > n) {
      throw new InvalidParameterException(
          "cycle type " + cycleType.parts() + " has more than " + n + " nodes");
    }
    if (n > 0 && cycleType.isEmpty()) {
      throw new InvalidParameterException("a function on " + n + " nodes has at least one cycle");
    }
  }

  public int n() {
    return n;
  }

  public Optional<Partition> cycleType() {
    return Optional.ofNullable(cycleType);
  }

  @Override
  public Iterator<EndofunctionStructure> iterator() {
    Iterable<Partition> types = cycleType != null ? List.of(cycleType) : cycleTypes(n);
    return FluentIterable.from(types)
        .transformAndConcat(
            type -> {
              LOG.debug("Enumerating structures on {} nodes with cycle type {}", n, type);
              return withCycleType(n, type);
            })
        .iterator();
  }

  /** Every cycle type a function on {@code n} nodes can have. */
  static Iterable<Partition> cycleTypes(int n) {
    if (n == 0) {
      return List.of(Partition.of());
    }
    return FluentIterable.from(ContiguousSet.closed(1, n))
        .transformAndConcat(PartitionGenerator::all);
  }

  private static Iterable<EndofunctionStructure> withCycleType(int n, Partition cycleType) {
    List<Map.Entry<Integer, Integer>> lengths = cycleType.multiplicities().entrySet().asList();
    int treeNodes = n - cycleType.sum();
    return FluentIterable.from(new WeakCompositions(treeNodes, lengths.size()))
        .transformAndConcat(
            split -> {
              List<Iterable<List<Necklace<DominantSequence>>>> groups = new ArrayList<>();
              for (int i = 0; i < lengths.size(); i++) {
                Map.Entry<Integer, Integer> length = lengths.get(i);
                groups.add(cycleGroups(split.get(i), length.getKey(), length.getValue()));
              }
              return FluentIterable.from(Products.cartesian(groups))
                  .transform(bundle -> EndofunctionStructure.of(flatten(bundle)));
            });
  }

  /** Every multiset of {@code count} cycles of one length sharing {@code treeNodes} tree nodes. */
  private static Iterable<List<Necklace<DominantSequence>>> cycleGroups(
      int treeNodes, int length, int count) {
    return FluentIterable.from(new PartitionGenerator(treeNodes + count, count))
        .transformAndConcat(sizes -> sameLengthCycles(sizes, length));
  }

  /**
   * Cycles of one length, the {@code i}-th carrying {@code sizes.part(i) - 1} tree nodes. Cycles
   * with equally many nodes are drawn as a combination with repetition from a materialized pool.
   */
  private static Iterable<List<Necklace<DominantSequence>>> sameLengthCycles(
      Partition sizes, int length) {
    List<Iterable<List<Necklace<DominantSequence>>>> factors = new ArrayList<>();
    for (Map.Entry<Integer, Integer> entry : sizes.multiplicities().entrySet()) {
      Iterable<Necklace<DominantSequence>> cycles = attachments(entry.getKey() - 1, length);
      if (entry.getValue() == 1) {
        factors.add(FluentIterable.from(cycles).transform(cycle -> List.of(cycle)));
      } else {
        factors.add(
            Products.combinationsWithReplacement(ImmutableList.copyOf(cycles), entry.getValue()));
      }
    }
    return FluentIterable.from(Products.cartesian(factors)).transform(StructureGenerator::flatten);
  }

  /** Every cycle of {@code length} nodes with {@code treeNodes} tree nodes attached. */
  static Iterable<Necklace<DominantSequence>> attachments(int treeNodes, int length) {
    return FluentIterable.from(new PartitionGenerator(treeNodes + length, length))
        .transformAndConcat(sizes -> new ForestGenerator(sizes))
        .transformAndConcat(forest -> NecklaceGenerator.of(forest.trees()));
  }

  private static List<Necklace<DominantSequence>> flatten(
      List<List<Necklace<DominantSequence>>> groups) {
    return ImmutableList.copyOf(Iterables.concat(groups));
  }

  @Override
  public BigInteger cardinality() {
    return cycleType == null ? structureCount(n) : structureCount(n, cycleType);
  }

  /**
   * De Bruijn's count of functional digraphs, OEIS A001372. Sums, over partitions of {@code n}
   * with {@code b_i} parts equal to {@code i}, the product over {@code i} of {@code (sum_{d | i} d
   * b_d)^b_i / (i^b_i b_i!)}.
   */
  public static BigInteger structureCount(int n) {
    InvalidParameterException.requireNonNegative(n, "n");
    BigInteger numerator = BigInteger.ZERO;
    BigInteger denominator = BigInteger.ONE;
    for (Partition partition : PartitionGenerator.all(n)) {
      Map<Integer, Integer> counts = partition.multiplicities();
      BigInteger termNumerator = BigInteger.ONE;
      BigInteger termDenominator = BigInteger.ONE;
      for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
        int i = entry.getKey();
        int b = entry.getValue();
        long fixed = 0;
        for (int d : Counts.divisors(i)) {
          fixed += (long) d * counts.getOrDefault(d, 0);
        }
        termNumerator = termNumerator.multiply(BigInteger.valueOf(fixed).pow(b));
        termDenominator =
            termDenominator.multiply(BigInteger.valueOf(i).pow(b)).multiply(Counts.factorial(b));
      }
      numerator = numerator.multiply(termDenominator).add(termNumerator.multiply(denominator));
      denominator = denominator.multiply(termDenominator);
      BigInteger common = numerator.gcd(denominator);
      numerator = numerator.divide(common);
      denominator = denominator.divide(common);
    }
    return numerator.divide(denominator);
  }

  /** Number of structures on {@code n} nodes with the given cycle type. */
  public static BigInteger structureCount(int n, Partition cycleType) {
    int treeNodes = n - cycleType.sum();
    if (treeNodes < 0) {
      return BigInteger.ZERO;
    }
    BigInteger[] trees = TreeGenerator.treeCounts(n);
    BigInteger[] total = new BigInteger[treeNodes + 1];
    Arrays.fill(total, BigInteger.ZERO);
    total[0] = BigInteger.ONE;
    for (Map.Entry<Integer, Integer> entry : cycleType.multiplicities().entrySet()) {
      BigInteger[] groups = new BigInteger[treeNodes + 1];
      for (int t = 0; t <= treeNodes; t++) {
        groups[t] = groupCount(t, entry.getKey(), entry.getValue(), trees);
      }
      total = Counts.multiply(total, groups, treeNodes);
    }
    return total[treeNodes];
  }

  private static BigInteger groupCount(int treeNodes, int length, int count, BigInteger[] trees) {
    BigInteger total = BigInteger.ZERO;
    for (Partition sizes : new PartitionGenerator(treeNodes + count, count)) {
      BigInteger product = BigInteger.ONE;
      for (Map.Entry<Integer, Integer> entry : sizes.multiplicities().entrySet()) {
        BigInteger cycles = attachmentCount(entry.getKey() - 1, length, trees);
        product = product.multiply(Counts.multichoose(cycles, entry.getValue()));
      }
      total = total.add(product);
    }
    return total;
  }

  /**
   * Necklaces of {@code length} trees with {@code treeNodes + length} nodes in total, by Burnside's
   * lemma: each of the {@code phi(d)} rotations of order {@code d} fixes the words made of {@code
   * d} copies of a block of {@code length / d} trees.
   */
  static BigInteger attachmentCount(int treeNodes, int length, BigInteger[] trees) {
    int nodes = treeNodes + length;
    BigInteger fixed = BigInteger.ZERO;
    for (int d : Counts.divisors(length)) {
      if (nodes % d != 0) {
        continue;
      }
      BigInteger[] power = power(trees, length / d, nodes / d);
      fixed = fixed.add(power[nodes / d].multiply(BigInteger.valueOf(Counts.totient(d))));
    }
    return fixed.divide(BigInteger.valueOf(length));
  }

  private static BigInteger[] power(BigInteger[] series, int exponent, int degree) {
    BigInteger[] result = new BigInteger[degree + 1];
    Arrays.fill(result, BigInteger.ZERO);
    result[0] = BigInteger.ONE;
    for (int i = 0; i < exponent; i++) {
      result = Counts.multiply(result, series, degree);
    }
    return result;
  }

  @Override
  public String toString() {
    return cycleType == null
        ? "StructureGenerator(" + n + ")"
        : "StructureGenerator(" + n + ", " + cycleType.parts() + ")";
  }
}
