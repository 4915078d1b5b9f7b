package com.zulily.cronlens.job;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JobRecordTest {

  @Test
  public void testScheduleFieldsAreDefaulted() {
    final JobRecord job = JobRecord.named("Nightly extract").hours(" ").build();

    assertEquals("*", job.getHours());
    assertEquals("0", job.getMinutes());
    assertEquals("", job.getDaysOfWeek());
    assertFalse(job.getId().isPresent());
    assertFalse(job.isEnabled());
  }

  @Test
  public void testEnabledValueIsNormalized() {
    assertTrue(JobRecord.named("a").enabledValue("true").build().isEnabled());
    assertTrue(JobRecord.named("b").enabledValue(true).build().isEnabled());
    assertFalse(JobRecord.named("c").enabledValue("false").build().isEnabled());
  }

  @Test
  public void testDisplayNameIsShortenedButNameIsNot() {
    final JobRecord job = JobRecord.named("Student Information System - Enrollment Sync").build();

    assertEquals("Student Information...", job.getDisplayName(22));
    assertEquals("Student Information System - Enrollment Sync", job.getDisplayName(100));
    assertEquals("Student Information System - Enrollment Sync", job.getName());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNameIsRequired() {
    JobRecord.named("");
  }
}
