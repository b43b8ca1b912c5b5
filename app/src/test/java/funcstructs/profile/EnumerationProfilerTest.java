package funcstructs.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.Iterators;
import com.google.common.util.concurrent.Uninterruptibles;
import funcstructs.core.Enumerable;
import funcstructs.profile.EnumerationProfiler.EnumerationProfile;
import funcstructs.profile.EnumerationProfiler.NamedEnumeration;
import funcstructs.profile.EnumerationProfiler.ProfileRun;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

final class EnumerationProfilerTest {

  @Test
  void profilesDefaultEnumerations() {
    EnumerationProfiler profiler = new EnumerationProfiler();
    List<NamedEnumeration> enumerations = EnumerationProfiler.defaultEnumerations();

    EnumerationProfile profile = profiler.profile(enumerations);
    assertEquals(enumerations.size(), profile.runs().size(), "Runs should match input count");
    assertTrue(profile.mismatches().isEmpty(), "Counts should match: " + profile.mismatches());
    for (ProfileRun run : profile.runs()) {
      assertTrue(run.elapsedMillis() >= 0, "Elapsed time should never be negative");
    }
  }

  @Test
  void reportsCountMismatches() {
    Enumerable<Integer> miscounted =
        new Enumerable<>() {
          @Override
          public BigInteger cardinality() {
            return BigInteger.TEN;
          }

          @Override
          public Iterator<Integer> iterator() {
            return List.of(1, 2, 3).iterator();
          }
        };
    EnumerationProfile profile =
        new EnumerationProfiler().profile(List.of(NamedEnumeration.of("miscounted", miscounted)));
    ProfileRun run = profile.runs().get(0);
    assertEquals(3, run.emitted());
    assertFalse(run.matches());
    assertEquals(List.of(run), profile.mismatches());
  }

  @Test
  void timesTheWholeIteration() {
    Enumerable<Integer> slow =
        new Enumerable<>() {
          @Override
          public BigInteger cardinality() {
            return BigInteger.ONE;
          }

          @Override
          public Iterator<Integer> iterator() {
            return Iterators.transform(List.of(1).iterator(), EnumerationProfilerTest::pause);
          }
        };
    ProfileRun run =
        new EnumerationProfiler().profile(List.of(NamedEnumeration.of("slow", slow))).runs().get(0);
    assertTrue(run.matches());
    assertTrue(run.elapsedMillis() >= 40, "Elapsed " + run.elapsedMillis() + " ms");
  }

  private static Integer pause(Integer value) {
    Uninterruptibles.sleepUninterruptibly(50, TimeUnit.MILLISECONDS);
    return value;
  }

  @Test
  void requiresAtLeastOneEnumeration() {
    EnumerationProfiler profiler = new EnumerationProfiler();
    assertThrows(IllegalArgumentException.class, () -> profiler.profile(List.of()));
  }
}
