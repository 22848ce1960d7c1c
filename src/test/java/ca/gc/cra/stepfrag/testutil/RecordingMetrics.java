package ca.gc.cra.stepfrag.testutil;

import ca.gc.cra.stepfrag.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RecordingMetrics implements MetricsPort {
  private final Map<String, Integer> counters = new LinkedHashMap<>();
  private final Map<String, List<Long>> observations = new LinkedHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1, Integer::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  public int count(String key) {
    return counters.getOrDefault(key, 0);
  }

  public List<Long> observed(String key) {
    return observations.getOrDefault(key, List.of());
  }
}
