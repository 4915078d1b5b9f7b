package com.zulily.cronlens;

import com.google.common.collect.ImmutableList;
import com.zulily.cronlens.conf.Configuration;
import com.zulily.cronlens.job.JobRecord;
import com.zulily.cronlens.report.ScheduleReport;
import com.zulily.cronlens.report.ScheduleReporter;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ReportPrinterTest {

  private final ScheduleReporter reporter = ScheduleReporter.fromConfiguration(Configuration.defaults());

  @Test
  public void testRender() {
    final ScheduleReport report = reporter.report(ImmutableList.of(
      JobRecord.named("Enrollment Sync").enabled(true).hours("*").minutes("*").daysOfWeek("*").build(),
      JobRecord.named("Financial Aid Feed - Nightly Disbursement Reconciliation").enabled(false).hours("13").minutes("0")
        .daysOfMonth("1").months("*").years("2024").cron("0 0 13 1 * ?").build()
    ));

    final ImmutableList<String> lines = new ReportPrinter(20).render("Scheduled Jobs - nonprod-qa-atom", report);

    assertEquals("Scheduled Jobs - nonprod-qa-atom", lines.get(0));
    assertEquals("2 jobs: 1 enabled, 1 disabled, 1 recurring, 1 scheduled", lines.get(2));
    assertTrue(lines.contains("  Once a minute (UTC)"));
    assertTrue(lines.contains("    Enrollment Sync"));
    assertTrue(lines.contains("Scheduled (" + report.getZoneLabel() + ")"));
    assertTrue(lines.contains("   6:00 AM  Financial Aid Fee... [disabled]"));
  }

  @Test
  public void testRenderJobTable() {
    final ScheduleReport report = reporter.report(ImmutableList.of(
      JobRecord.named("Enrollment Sync").enabled(true).hours("*").minutes("*").daysOfWeek("*").build(),
      JobRecord.named("Financial Aid Feed - Nightly Disbursement Reconciliation").enabled(false).hours("13").minutes("0")
        .daysOfMonth("1").months("*").years("2024").cron("0 0 13 1 * ?").build()
    ));

    final ImmutableList<String> lines = new ReportPrinter(20).render("Scheduled Jobs", report);

    final int tableStart = lines.indexOf("Jobs");

    assertTrue(tableStart > 0);
    assertEquals(ImmutableList.of(
      "  Name                  Enabled  Minutes  Hours  Days of week  Days of month  Months  Years  Cron",
      "  Enrollment Sync       yes      *        *      *",
      "  Financial Aid Fee...  NO       0        13                   1              *       2024   0 0 13 1 * ?"
    ), lines.subList(tableStart + 1, lines.size()));
  }

  @Test
  public void testRenderEmpty() {
    final ImmutableList<String> lines = new ReportPrinter(20).render("Scheduled Jobs", reporter.report(ImmutableList.of()));

    assertEquals(ImmutableList.of("Scheduled Jobs", "==============", "No jobs scheduled"), lines);
  }
}
