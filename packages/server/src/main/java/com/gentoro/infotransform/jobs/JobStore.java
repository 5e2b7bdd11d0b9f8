package com.gentoro.infotransform.jobs;

import java.util.Collection;
import java.util.Optional;

/** Abstraction for storing job records. */
public interface JobStore {
  void put(JobRecord record);

  Optional<JobRecord> get(String id);

  void remove(String id);

  Collection<JobRecord> all();
}
