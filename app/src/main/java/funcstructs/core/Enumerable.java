package funcstructs.core;

import java.math.BigInteger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A finite, restartable enumeration of canonical combinatorial objects.
 *
 * <p>Every call to {@link #iterator()} starts an independent iteration from a fully reset state.
 * A single iterator is not safe to step from more than one thread.
 */
public interface Enumerable<T> extends Iterable<T> {

  /** Exact number of objects a full iteration yields, computed without enumerating them. */
  BigInteger cardinality();

  default Stream<T> stream() {
    return StreamSupport.stream(spliterator(), false);
  }
}
