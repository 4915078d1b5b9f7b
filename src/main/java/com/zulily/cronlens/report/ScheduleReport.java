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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything a presentation layer needs to display one job collection
 */
public final class ScheduleReport {
  private final ImmutableList<Assignment> assignments;
  private final ImmutableList<TimelineEntry> timeline;
  private final ImmutableList<PatternGroup> recurringGroups;
  private final JobStatistics statistics;
  private final String zoneLabel;

  ScheduleReport(final ImmutableList<Assignment> assignments,
                 final ImmutableList<TimelineEntry> timeline,
                 final ImmutableList<PatternGroup> recurringGroups,
                 final JobStatistics statistics,
                 final String zoneLabel) {

    this.assignments = checkNotNull(assignments, "assignments");
    this.timeline = checkNotNull(timeline, "timeline");
    this.recurringGroups = checkNotNull(recurringGroups, "recurringGroups");
    this.statistics = checkNotNull(statistics, "statistics");
    this.zoneLabel = checkNotNull(zoneLabel, "zoneLabel");
  }

  /**
   * @return The category of every job, in input order
   */
  public ImmutableList<Assignment> getAssignments() {
    return assignments;
  }

  /**
   * @return Scheduled jobs grouped by local firing time, earliest first
   */
  public ImmutableList<TimelineEntry> getTimeline() {
    return timeline;
  }

  /**
   * @return Recurring jobs grouped by pattern, most frequent first
   */
  public ImmutableList<PatternGroup> getRecurringGroups() {
    return recurringGroups;
  }

  public JobStatistics getStatistics() {
    return statistics;
  }

  /**
   * @return The short name of the zone timeline times are expressed in
   */
  public String getZoneLabel() {
    return zoneLabel;
  }
}
