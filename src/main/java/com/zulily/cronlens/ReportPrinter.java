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
package com.zulily.cronlens;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.zulily.cronlens.job.JobRecord;
import com.zulily.cronlens.report.Assignment;
import com.zulily.cronlens.report.JobStatistics;
import com.zulily.cronlens.report.PatternGroup;
import com.zulily.cronlens.report.ScheduleReport;
import com.zulily.cronlens.report.TimelineEntry;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Renders a {@link ScheduleReport} as plain text lines
 */
public final class ReportPrinter {
  private static final ImmutableList<String> JOB_TABLE_HEADER = ImmutableList.of(
    "Name", "Enabled", "Minutes", "Hours", "Days of week", "Days of month", "Months", "Years", "Cron");

  private final int nameDisplayWidth;

  public ReportPrinter(final int nameDisplayWidth) {
    checkArgument(nameDisplayWidth > 3, "nameDisplayWidth must be greater than 3: %s", nameDisplayWidth);

    this.nameDisplayWidth = nameDisplayWidth;
  }

  public ImmutableList<String> render(final String title, final ScheduleReport report) {
    checkNotNull(title, "title");
    checkNotNull(report, "report");

    final ImmutableList.Builder<String> lines = ImmutableList.builder();

    final JobStatistics statistics = report.getStatistics();

    lines.add(title);
    lines.add(Strings.repeat("=", title.length()));

    if (statistics.getTotal() == 0) {
      lines.add("No jobs scheduled");
      return lines.build();
    }

    lines.add(String.format("%s jobs: %s enabled, %s disabled, %s recurring, %s scheduled",
      statistics.getTotal(),
      statistics.getEnabled(),
      statistics.getDisabled(),
      statistics.getRecurring(),
      statistics.getScheduled()));

    lines.add("");
    lines.add("Recurring");

    for (final PatternGroup group : report.getRecurringGroups()) {
      lines.add("  " + group.getDescription() + " (UTC)");
      group.getJobs().forEach(job -> lines.add("    " + label(job)));
    }

    lines.add("");
    lines.add("Scheduled (" + report.getZoneLabel() + ")");

    for (final TimelineEntry entry : report.getTimeline()) {
      lines.add(String.format("  %8s  %s", entry.getTime().toTwelveHourString(), labels(entry.getJobs())));
    }

    lines.add("");
    lines.add("Jobs");
    lines.addAll(jobTable(report));

    return lines.build();
  }

  /**
   * One row per job in feed order, columns padded to their widest cell
   */
  private List<String> jobTable(final ScheduleReport report) {
    final List<List<String>> rows = Lists.newArrayList();

    rows.add(JOB_TABLE_HEADER);

    for (final Assignment assignment : report.getAssignments()) {
      final JobRecord job = assignment.getJob();

      rows.add(ImmutableList.of(
        job.getDisplayName(nameDisplayWidth),
        job.isEnabled() ? "yes" : "NO",
        job.getMinutes(),
        job.getHours(),
        Strings.nullToEmpty(job.getDaysOfWeek()),
        Strings.nullToEmpty(job.getDaysOfMonth()),
        Strings.nullToEmpty(job.getMonths()),
        Strings.nullToEmpty(job.getYears()),
        Strings.nullToEmpty(job.getCron())));
    }

    final int[] widths = new int[JOB_TABLE_HEADER.size()];

    for (final List<String> row : rows) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }

    final List<String> tableLines = Lists.newArrayList();

    for (final List<String> row : rows) {
      final StringBuilder line = new StringBuilder("  ");

      for (int i = 0; i < widths.length; i++) {
        line.append(Strings.padEnd(row.get(i), widths[i] + 2, ' '));
      }

      tableLines.add(CharMatcher.whitespace().trimTrailingFrom(line));
    }

    return tableLines;
  }

  private String labels(final List<JobRecord> jobs) {
    return jobs.stream().map(this::label).collect(Collectors.joining(", "));
  }

  private String label(final JobRecord job) {
    return job.getDisplayName(nameDisplayWidth) + (job.isEnabled() ? "" : " [disabled]");
  }
}
