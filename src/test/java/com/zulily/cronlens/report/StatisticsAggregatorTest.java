package com.zulily.cronlens.report;

import com.google.common.collect.ImmutableList;
import com.zulily.cronlens.job.JobRecord;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class StatisticsAggregatorTest {

  private final StatisticsAggregator aggregator = new StatisticsAggregator(new JobClassifier());

  @Test
  public void testMixedEnabledRepresentations() {
    final ImmutableList<JobRecord> jobs = ImmutableList.of(
      JobRecord.named("1").enabledValue(true).hours("*").minutes("*").build(),
      JobRecord.named("2").enabledValue("true").hours("*").minutes("0-59/30").build(),
      JobRecord.named("3").enabledValue(false).hours("9-17").minutes("0").build(),
      JobRecord.named("4").enabledValue("false").hours("13").minutes("0").build(),
      JobRecord.named("5").enabledValue(true).hours("0-23/12").minutes("15").build(),
      JobRecord.named("6").enabledValue("true").hours("6,18").minutes("30").build(),
      JobRecord.named("7").enabledValue("true").hours("abc").minutes("0").build(),
      JobRecord.named("8").enabledValue(true).build(),
      JobRecord.named("9").enabledValue(false).hours("13").minutes("0,30").build(),
      JobRecord.named("10").enabledValue("true").hours("23").minutes("45").build()
    );

    final JobStatistics statistics = aggregator.aggregate(jobs);

    assertEquals(10, statistics.getTotal());
    assertEquals(7, statistics.getEnabled());
    assertEquals(3, statistics.getDisabled());
    assertEquals(5, statistics.getRecurring());
    assertEquals(5, statistics.getScheduled());
    assertEquals(10, statistics.getRecurring() + statistics.getScheduled());
  }

  @Test
  public void testEmptyCollection() {
    final JobStatistics statistics = aggregator.aggregate(ImmutableList.<JobRecord>of());

    assertEquals(0, statistics.getTotal());
    assertEquals(0, statistics.getEnabled());
    assertEquals(0, statistics.getDisabled());
    assertEquals(0, statistics.getRecurring());
    assertEquals(0, statistics.getScheduled());
  }
}
