package com.zulily.cronlens.report;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import com.zulily.cronlens.conf.Configuration;
import com.zulily.cronlens.job.JobFeedReader;
import com.zulily.cronlens.job.JobRecord;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ScheduleReporterTest {

  private ImmutableList<JobRecord> jobs;
  private ScheduleReport report;

  @Before
  public void setUp() throws IOException {
    jobs = JobFeedReader.read(Resources.toString(Resources.getResource("scheduled-jobs.json"), StandardCharsets.UTF_8));
    report = ScheduleReporter.fromConfiguration(Configuration.defaults()).report(jobs);
  }

  @Test
  public void testAssignmentsFollowInputOrder() {
    assertEquals(jobs.size(), report.getAssignments().size());

    for (int index = 0; index < jobs.size(); index++) {
      assertEquals(jobs.get(index), report.getAssignments().get(index).getJob());
    }

    assertEquals(Category.Recurring, report.getAssignments().get(0).getCategory());
    assertEquals(Category.Scheduled, report.getAssignments().get(3).getCategory());
    assertEquals(Category.Recurring, report.getAssignments().get(4).getCategory());
  }

  @Test
  public void testTimelineIsChronologicalInMountainStandardTime() {
    final ImmutableList<TimelineEntry> timeline = report.getTimeline();

    assertEquals(
      ImmutableList.of("6:00 AM", "6:30 AM", "11:30 AM", "4:45 PM", "5:00 PM", "11:30 PM"),
      timeline.stream().map(entry -> entry.getTime().toTwelveHourString()).collect(ImmutableList.toImmutableList()));

    assertEquals(ImmutableList.of("Financial Aid Feed", "Alumni Mailing"), names(timeline.get(0).getJobs()));
    assertEquals(ImmutableList.of("Alumni Mailing"), names(timeline.get(1).getJobs()));
    assertEquals(ImmutableList.of("Library Patron Load"), names(timeline.get(2).getJobs()));
    assertEquals(ImmutableList.of("Transcript Requests"), names(timeline.get(3).getJobs()));
    assertEquals(ImmutableList.of("Library Patron Load"), names(timeline.get(5).getJobs()));
  }

  @Test
  public void testMalformedJobShowsAtMidnightUtc() {
    final TimelineEntry fivePm = report.getTimeline().get(4);

    assertEquals(new CivilTime(17, 0), fivePm.getTime());
    assertEquals(ImmutableList.of("Parking Permits"), names(fivePm.getJobs()));
  }

  @Test
  public void testRecurringGroupsAreOrderedByFrequency() {
    assertEquals(
      ImmutableList.of(
        "Once a minute",
        "Once every thirty minutes",
        "At minute 0 from 9:00 AM to 5:59 PM",
        "At minute 15 from 12:00 AM to 11:59 PM",
        "At minute 0 all day"),
      report.getRecurringGroups().stream().map(PatternGroup::getDescription).collect(ImmutableList.toImmutableList()));

    assertEquals(ImmutableList.of("Payroll Interface"), names(report.getRecurringGroups().get(4).getJobs()));
  }

  @Test
  public void testJobsWithTheSameDescriptionShareAGroup() {
    final ScheduleReport shared = ScheduleReporter.fromConfiguration(Configuration.defaults()).report(ImmutableList.of(
      JobRecord.named("first").hours("*").minutes("*/15").build(),
      JobRecord.named("second").hours("0-23").minutes("0-59/15").build(),
      JobRecord.named("third").hours("*").minutes("*/5").build()
    ));

    assertEquals(2, shared.getRecurringGroups().size());
    assertEquals("Once every five minutes", shared.getRecurringGroups().get(0).getDescription());
    assertEquals(ImmutableList.of("first", "second"), names(shared.getRecurringGroups().get(1).getJobs()));
  }

  @Test
  public void testStatistics() {
    final JobStatistics statistics = report.getStatistics();

    assertEquals(10, statistics.getTotal());
    assertEquals(7, statistics.getEnabled());
    assertEquals(3, statistics.getDisabled());
    assertEquals(5, statistics.getRecurring());
    assertEquals(5, statistics.getScheduled());
  }

  @Test
  public void testEmptyCollection() {
    final ScheduleReport empty = ScheduleReporter.fromConfiguration(Configuration.defaults()).report(ImmutableList.of());

    assertTrue(empty.getAssignments().isEmpty());
    assertTrue(empty.getTimeline().isEmpty());
    assertTrue(empty.getRecurringGroups().isEmpty());
    assertEquals(0, empty.getStatistics().getTotal());
  }

  private static List<String> names(final List<JobRecord> jobs) {
    return jobs.stream().map(JobRecord::getName).collect(Collectors.toList());
  }
}
