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
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.zulily.cronlens.conf.Configuration;
import com.zulily.cronlens.crontab.Occurrence;
import com.zulily.cronlens.job.JobRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Builds a {@link ScheduleReport} from a job collection.
 * <p>
 * Holds no state between calls; each call treats its input as a fresh snapshot.
 */
public final class ScheduleReporter {
  private final JobClassifier classifier;
  private final CivilTimeConverter converter;
  private final StatisticsAggregator statisticsAggregator;

  public ScheduleReporter(final JobClassifier classifier, final CivilTimeConverter converter) {
    this.classifier = checkNotNull(classifier, "classifier");
    this.converter = checkNotNull(converter, "converter");
    this.statisticsAggregator = new StatisticsAggregator(classifier);
  }

  public static ScheduleReporter fromConfiguration(final Configuration configuration) {
    checkNotNull(configuration, "configuration");

    return new ScheduleReporter(
      JobClassifier.fromConfiguration(configuration),
      CivilTimeConverter.fromConfiguration(configuration));
  }

  public ScheduleReport report(final List<JobRecord> jobs) {
    checkNotNull(jobs, "jobs");

    final Classification classification = classifier.classify(jobs);

    return new ScheduleReport(
      classification.getAssignments(),
      buildTimeline(classification.getAssignments(Category.Scheduled)),
      buildRecurringGroups(classification.getAssignments(Category.Recurring)),
      statisticsAggregator.aggregate(classification),
      converter.getZoneLabel()
    );
  }

  private ImmutableList<TimelineEntry> buildTimeline(final List<Assignment> scheduled) {
    // Sorted by local time, jobs kept in input order under each time
    final ListMultimap<CivilTime, JobRecord> jobsByTime = MultimapBuilder.treeKeys().arrayListValues().build();

    for (final Assignment assignment : scheduled) {
      for (final Occurrence occurrence : assignment.getExpansion().getOccurrences()) {
        jobsByTime.put(converter.toCivilTime(occurrence), assignment.getJob());
      }
    }

    final ImmutableList.Builder<TimelineEntry> timeline = ImmutableList.builder();

    for (final Map.Entry<CivilTime, Collection<JobRecord>> entry : jobsByTime.asMap().entrySet()) {
      timeline.add(new TimelineEntry(entry.getKey(), entry.getValue()));
    }

    return timeline.build();
  }

  private static ImmutableList<PatternGroup> buildRecurringGroups(final List<Assignment> recurring) {
    // Groups in first-seen order so equal scores keep that order after the stable sort
    final ListMultimap<String, JobRecord> jobsByDescription = MultimapBuilder.linkedHashKeys().arrayListValues().build();

    for (final Assignment assignment : recurring) {
      final JobRecord job = assignment.getJob();
      jobsByDescription.put(PatternDescriber.describe(job.getHours(), job.getMinutes()), job);
    }

    return jobsByDescription.asMap()
      .entrySet()
      .stream()
      .map(entry -> new PatternGroup(entry.getKey(), entry.getValue()))
      .sorted(Comparator.comparingDouble(PatternGroup::getFrequencyScore).reversed())
      .collect(ImmutableList.toImmutableList());
  }
}
