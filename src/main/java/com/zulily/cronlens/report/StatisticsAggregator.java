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

import com.zulily.cronlens.job.JobRecord;

import static com.google.common.base.Preconditions.checkNotNull;

public final class StatisticsAggregator {
  private final JobClassifier classifier;

  public StatisticsAggregator(final JobClassifier classifier) {
    this.classifier = checkNotNull(classifier, "classifier");
  }

  public JobStatistics aggregate(final Iterable<JobRecord> jobs) {
    return aggregate(classifier.classify(checkNotNull(jobs, "jobs")));
  }

  /**
   * @param classification An already classified collection, to avoid expanding every job twice
   */
  public JobStatistics aggregate(final Classification classification) {
    checkNotNull(classification, "classification");

    int total = 0;
    int enabled = 0;
    int recurring = 0;

    for (final Assignment assignment : classification.getAssignments()) {
      total++;

      if (assignment.getJob().isEnabled()) {
        enabled++;
      }

      if (assignment.getCategory() == Category.Recurring) {
        recurring++;
      }
    }

    return new JobStatistics(total, enabled, recurring, total - recurring);
  }
}
