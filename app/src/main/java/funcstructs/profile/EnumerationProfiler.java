package funcstructs.profile;

import com.google.common.base.Stopwatch;
import funcstructs.core.Enumerable;
import funcstructs.model.Partition;
import funcstructs.necklaces.NecklaceGenerator;
import funcstructs.partitions.PartitionGenerator;
import funcstructs.structures.StructureGenerator;
import funcstructs.trees.ForestGenerator;
import funcstructs.trees.TreeGenerator;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs enumerations to exhaustion and checks what they emit against their counting formula. */
public final class EnumerationProfiler {
  private static final Logger LOG = LoggerFactory.getLogger(EnumerationProfiler.class);

  /** Named enumeration input for profiling runs. */
  public record NamedEnumeration(String name, Enumerable<?> enumeration) {
    public NamedEnumeration {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(enumeration, "enumeration");
    }

    public static NamedEnumeration of(String name, Enumerable<?> enumeration) {
      return new NamedEnumeration(name, enumeration);
    }
  }

  /** Per-enumeration outcome. */
  public record ProfileRun(String name, long emitted, BigInteger expected, long elapsedMillis) {
    public ProfileRun {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(expected, "expected");
    }

    public boolean matches() {
      return expected.equals(BigInteger.valueOf(emitted));
    }
  }

  /** Aggregated profiling report. */
  public record EnumerationProfile(List<ProfileRun> runs) {
    public EnumerationProfile {
      runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }

    public long totalElapsedMillis() {
      return runs.stream().mapToLong(ProfileRun::elapsedMillis).sum();
    }

    public long totalEmitted() {
      return runs.stream().mapToLong(ProfileRun::emitted).sum();
    }

    public List<ProfileRun> mismatches() {
      return runs.stream().filter(run -> !run.matches()).toList();
    }
  }

  public EnumerationProfile profile(List<NamedEnumeration> enumerations) {
    Objects.requireNonNull(enumerations, "enumerations");
    if (enumerations.isEmpty()) {
      throw new IllegalArgumentException("Profiling requires at least one enumeration.");
    }
    List<ProfileRun> runs = new ArrayList<>(enumerations.size());
    for (NamedEnumeration enumeration : enumerations) {
      runs.add(run(enumeration));
    }
    EnumerationProfile profile = new EnumerationProfile(runs);
    LOG.info(
        "Profiled {} enumerations: {} objects in {} ms, {} count mismatches",
        runs.size(),
        profile.totalEmitted(),
        profile.totalElapsedMillis(),
        profile.mismatches().size());
    return profile;
  }

  private static ProfileRun run(NamedEnumeration enumeration) {
    BigInteger expected = enumeration.enumeration().cardinality();
    Stopwatch stopwatch = Stopwatch.createStarted();
    long emitted = 0;
    Iterator<?> iterator = enumeration.enumeration().iterator();
    while (iterator.hasNext()) {
      iterator.next();
      emitted++;
    }
    ProfileRun run =
        new ProfileRun(
            enumeration.name(), emitted, expected, stopwatch.elapsed(TimeUnit.MILLISECONDS));
    if (run.matches()) {
      LOG.debug("{}: {} objects in {} ms", run.name(), emitted, run.elapsedMillis());
    } else {
      LOG.warn("{}: emitted {} objects but expected {}", run.name(), emitted, expected);
    }
    return run;
  }

  /** One enumeration of each kind, sized to finish in well under a second. */
  public static List<NamedEnumeration> defaultEnumerations() {
    return List.of(
        NamedEnumeration.of("trees(10)", new TreeGenerator(10)),
        NamedEnumeration.of("partitions(20, 5)", new PartitionGenerator(20, 5)),
        NamedEnumeration.of("partitions(15)", PartitionGenerator.all(15)),
        NamedEnumeration.of("necklaces(3, 3, 2)", NecklaceGenerator.ofMultiplicities(3, 3, 2)),
        NamedEnumeration.of("forests(4, 3, 3)", new ForestGenerator(Partition.of(4, 3, 3))),
        NamedEnumeration.of("forests(7)", ForestGenerator.ofSize(7)),
        NamedEnumeration.of("structures(6)", new StructureGenerator(6)),
        NamedEnumeration.of(
            "structures(7, [2, 1])", new StructureGenerator(7, Partition.of(2, 1))));
  }
}
