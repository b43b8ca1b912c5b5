package funcstructs.structures;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import funcstructs.core.InvalidParameterException;
import funcstructs.trees.LevelSequence;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * A function from {@code {0, ..., n-1}} to itself, stored as its image array. Only the parts needed
 * to read off the functional graph are provided: cycles, preimages and the trees hanging off each
 * cyclic node.
 */
public final class Endofunction {
  private final int[] images;
  private final boolean[] cyclic;

  private Endofunction(int[] images) {
    this.images = images;
    this.cyclic = markCyclic(images);
  }

  /**
   * Function sending {@code x} to {@code images[x]}.
   *
   * @throws InvalidParameterException if an image falls outside the domain
   */
  public static Endofunction of(int... images) {
    Objects.requireNonNull(images, "images");
    int[] copy = images.clone();
    for (int x = 0; x < copy.length; x++) {
      if (copy[x] < 0 || copy[x] >= copy.length) {
        throw new InvalidParameterException(
            "image of " + x + " must lie in [0, " + copy.length + "), got " + copy[x]);
      }
    }
    return new Endofunction(copy);
  }

  public static Endofunction of(List<Integer> images) {
    return of(Ints.toArray(Objects.requireNonNull(images, "images")));
  }

  static Endofunction trusted(int[] images) {
    return new Endofunction(images);
  }

  private static boolean[] markCyclic(int[] images) {
    int n = images.length;
    boolean[] cyclic = new boolean[n];
    // 0 unvisited, 1 on the current walk, 2 finished
    byte[] state = new byte[n];
    for (int start = 0; start < n; start++) {
      int x = start;
      while (state[x] == 0) {
        state[x] = 1;
        x = images[x];
      }
      if (state[x] == 1) {
        int y = x;
        do {
          cyclic[y] = true;
          y = images[y];
        } while (y != x);
      }
      for (x = start; state[x] == 1; x = images[x]) {
        state[x] = 2;
      }
    }
    return cyclic;
  }

  public int size() {
    return images.length;
  }

  public int apply(int x) {
    return images[x];
  }

  public int[] toArray() {
    return images.clone();
  }

  public boolean isCyclic(int x) {
    return cyclic[x];
  }

  /** Cycles of the functional graph, each starting at its smallest node, ordered by that node. */
  public ImmutableList<ImmutableList<Integer>> cycles() {
    ImmutableList.Builder<ImmutableList<Integer>> cycles = ImmutableList.builder();
    boolean[] seen = new boolean[images.length];
    for (int x = 0; x < images.length; x++) {
      if (!cyclic[x] || seen[x]) {
        continue;
      }
      ImmutableList.Builder<Integer> cycle = ImmutableList.builder();
      int y = x;
      do {
        seen[y] = true;
        cycle.add(y);
        y = images[y];
      } while (y != x);
      cycles.add(cycle.build());
    }
    return cycles.build();
  }

  /** For every node, the nodes mapping onto it in increasing order. */
  public ImmutableList<ImmutableList<Integer>> preimage() {
    List<List<Integer>> preimage = new ArrayList<>(images.length);
    for (int x = 0; x < images.length; x++) {
      preimage.add(new ArrayList<>());
    }
    for (int x = 0; x < images.length; x++) {
      preimage.get(images[x]).add(x);
    }
    ImmutableList.Builder<ImmutableList<Integer>> result = ImmutableList.builder();
    for (List<Integer> nodes : preimage) {
      result.add(ImmutableList.copyOf(nodes));
    }
    return result.build();
  }

  /** Non-cyclic nodes mapping directly onto {@code node}. */
  public ImmutableList<Integer> attachedTreeNodes(int node) {
    Objects.checkIndex(node, images.length);
    ImmutableList.Builder<Integer> attached = ImmutableList.builder();
    for (int x = 0; x < images.length; x++) {
      if (images[x] == node && !cyclic[x]) {
        attached.add(x);
      }
    }
    return attached.build();
  }

  /**
   * Level sequence of the tree rooted at {@code node}, made of {@code node} and every non-cyclic
   * node whose forward orbit reaches it before any other cyclic node. Children are visited in
   * increasing order.
   */
  public LevelSequence attachedLevelSequence(int node) {
    Objects.checkIndex(node, images.length);
    List<List<Integer>> children = new ArrayList<>(images.length);
    for (int x = 0; x < images.length; x++) {
      children.add(new ArrayList<>());
    }
    for (int x = 0; x < images.length; x++) {
      if (!cyclic[x]) {
        children.get(images[x]).add(x);
      }
    }
    List<Integer> levels = new ArrayList<>();
    Deque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] {node, 0});
    while (!stack.isEmpty()) {
      int[] top = stack.pop();
      levels.add(top[1]);
      List<Integer> below = children.get(top[0]);
      for (int i = below.size() - 1; i >= 0; i--) {
        stack.push(new int[] {below.get(i), top[1] + 1});
      }
    }
    return LevelSequence.of(levels);
  }

  /**
   * Sizes of the images of {@code f, f^2, ..., f^(n-1)}, or the single size of {@code f}'s image
   * when {@code n <= 1}. The sequence is non-increasing and settles at the number of cyclic nodes.
   */
  public ImmutableList<Integer> imagePath() {
    int n = images.length;
    int steps = Math.max(n - 1, 1);
    ImmutableList.Builder<Integer> path = ImmutableList.builderWithExpectedSize(steps);
    boolean[] image = new boolean[n];
    Arrays.fill(image, true);
    int previous = n;
    for (int step = 1; step <= steps; step++) {
      boolean[] next = new boolean[n];
      int size = 0;
      for (int x = 0; x < n; x++) {
        if (image[x] && !next[images[x]]) {
          next[images[x]] = true;
          size++;
        }
      }
      if (size == previous) {
        // Once the image stops shrinking it is the set of cyclic nodes.
        for (; step <= steps; step++) {
          path.add(size);
        }
        break;
      }
      path.add(size);
      image = next;
      previous = size;
    }
    return path.build();
  }

  /** The isomorphism class of this function's functional graph. */
  public EndofunctionStructure structure() {
    return EndofunctionStructure.of(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Endofunction && Arrays.equals(images, ((Endofunction) o).images);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(images);
  }

  @Override
  public String toString() {
    return "Endofunction" + Arrays.toString(images);
  }
}
