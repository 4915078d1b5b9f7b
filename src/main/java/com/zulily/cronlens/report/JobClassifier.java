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
import com.zulily.cronlens.conf.ConfigKey;
import com.zulily.cronlens.conf.Configuration;
import com.zulily.cronlens.crontab.Expansion;
import com.zulily.cronlens.crontab.OccurrenceExpander;
import com.zulily.cronlens.job.JobRecord;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits jobs into recurring and scheduled jobs.
 * <p>
 * A job is recurring when it fires more often than the occurrence threshold in a day, or when its
 * hours or minutes field contains a step ('/'). The step check applies even when the step leaves
 * only a few occurrences, so "0-23/12" is recurring with 2 occurrences.
 */
public final class JobClassifier {

  public static final int DEFAULT_OCCURRENCE_THRESHOLD = 8;

  private final int occurrenceThreshold;

  public JobClassifier() {
    this(DEFAULT_OCCURRENCE_THRESHOLD);
  }

  public JobClassifier(final int occurrenceThreshold) {
    checkArgument(occurrenceThreshold >= 0, "occurrenceThreshold must not be negative: %s", occurrenceThreshold);

    this.occurrenceThreshold = occurrenceThreshold;
  }

  public static JobClassifier fromConfiguration(final Configuration configuration) {
    checkNotNull(configuration, "configuration");

    return new JobClassifier(configuration.getInt(ConfigKey.RecurringOccurrenceThreshold));
  }

  public Classification classify(final Iterable<JobRecord> jobs) {
    checkNotNull(jobs, "jobs");

    final ImmutableList.Builder<Assignment> assignments = ImmutableList.builder();

    for (final JobRecord job : jobs) {
      assignments.add(assign(job));
    }

    return new Classification(assignments.build());
  }

  public Assignment assign(final JobRecord job) {
    checkNotNull(job, "job");

    final Expansion expansion = OccurrenceExpander.expand(job.getHours(), job.getMinutes());

    return new Assignment(categoryOf(job, expansion), job, expansion);
  }

  private Category categoryOf(final JobRecord job, final Expansion expansion) {
    if (expansion.getOccurrenceCount() > occurrenceThreshold) {
      return Category.Recurring;
    }

    return job.getHours().indexOf('/') >= 0 || job.getMinutes().indexOf('/') >= 0
      ? Category.Recurring
      : Category.Scheduled;
  }
}
