/*
 * Copyright (C) 2014 zulily, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.zulily.cronlens.report;

import com.google.common.collect.ImmutableList;
import com.zulily.cronlens.job.JobRecord;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Recurring jobs that share the same pattern description
 */
public final class PatternGroup {
  private final String description;
  private final double frequencyScore;
  private final ImmutableList<JobRecord> jobs;

  PatternGroup(final String description, final Iterable<JobRecord> jobs) {
    this.description = checkNotNull(description, "description");
    this.frequencyScore = PatternDescriber.frequencyScore(description);
    this.jobs = ImmutableList.copyOf(checkNotNull(jobs, "jobs"));
  }

  public String getDescription() {
    return description;
  }

  public double getFrequencyScore() {
    return frequencyScore;
  }

  public ImmutableList<JobRecord> getJobs() {
    return jobs;
  }

  @Override
  public String toString() {
    return description + " " + jobs;
  }
}
