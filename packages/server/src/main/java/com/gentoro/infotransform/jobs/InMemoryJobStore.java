package com.gentoro.infotransform.jobs;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Simple in-memory JobStore implementation. */
public final class InMemoryJobStore implements JobStore {
  private final Map<String, JobRecord> map = new ConcurrentHashMap<>();

  @Override
  public void put(JobRecord record) {
    map.put(record.id, record);
  }

  @Override
  public Optional<JobRecord> get(String id) {
    return Optional.ofNullable(map.get(id));
  }

  @Override
  public void remove(String id) {
    map.remove(id);
  }

  @Override
  public Collection<JobRecord> all() {
    return List.copyOf(map.values());
  }
}
