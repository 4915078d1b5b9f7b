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
 * The partition of a job collection into recurring and scheduled jobs, in input order
 */
public final class Classification {
  private final ImmutableList<Assignment> assignments;

  Classification(final ImmutableList<Assignment> assignments) {
    this.assignments = checkNotNull(assignments, "assignments");
  }

  /**
   * @return One assignment per job, in the order the jobs were given
   */
  public ImmutableList<Assignment> getAssignments() {
    return assignments;
  }

  public ImmutableList<JobRecord> getRecurring() {
    return jobsIn(Category.Recurring);
  }

  public ImmutableList<JobRecord> getScheduled() {
    return jobsIn(Category.Scheduled);
  }

  public ImmutableList<Assignment> getAssignments(final Category category) {
    checkNotNull(category, "category");

    return assignments
      .stream()
      .filter(assignment -> assignment.getCategory() == category)
      .collect(ImmutableList.toImmutableList());
  }

  private ImmutableList<JobRecord> jobsIn(final Category category) {
    return getAssignments(category)
      .stream()
      .map(Assignment::getJob)
      .collect(ImmutableList.toImmutableList());
  }
}
