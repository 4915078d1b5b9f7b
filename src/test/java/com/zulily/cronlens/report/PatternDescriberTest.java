package com.zulily.cronlens.report;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PatternDescriberTest {

  @Test
  public void testEveryMinuteAllDay() {
    assertEquals("Once a minute", PatternDescriber.describe("*", "*"));
    assertEquals("Once a minute", PatternDescriber.describe("0-23", "*/1"));
  }

  @Test
  public void testIntervalAllDayDropsQualifier() {
    assertEquals("Once every thirty minutes", PatternDescriber.describe("*", "0-59/30"));
    assertEquals("Once every two minutes", PatternDescriber.describe("*", "*/2"));
    assertEquals("Once every 7 minutes", PatternDescriber.describe("*", "*/7"));
  }

  @Test
  public void testFixedMinuteWithinHourRange() {
    assertEquals("At minute 0 from 9:00 AM to 5:59 PM", PatternDescriber.describe("9-17", "0"));
  }

  @Test
  public void testHourClauses() {
    assertEquals("all day", PatternDescriber.describeHours("*"));
    assertEquals("all day", PatternDescriber.describeHours("0-23"));
    assertEquals("from 12:00 AM to 11:59 PM", PatternDescriber.describeHours("0-23/2"));
    assertEquals("from 8:00 AM to 6:59 PM", PatternDescriber.describeHours("8-18/2"));
    assertEquals("at 14 o'clock", PatternDescriber.describeHours("14"));
    assertEquals("during hours 6,18", PatternDescriber.describeHours("6,18"));
    assertEquals("during hours a-b", PatternDescriber.describeHours("a-b"));
    assertEquals("during hours */4", PatternDescriber.describeHours("*/4"));
  }

  @Test
  public void testMinuteClauses() {
    assertEquals("every minute", PatternDescriber.describeMinutes("*"));
    assertEquals("once a minute", PatternDescriber.describeMinutes("0-59/1"));
    assertEquals("once every five minutes", PatternDescriber.describeMinutes("*/5"));
    assertEquals("once every ten minutes", PatternDescriber.describeMinutes("0-59/10"));
    assertEquals("once every fifteen minutes", PatternDescriber.describeMinutes("*/15"));
    assertEquals("once an hour", PatternDescriber.describeMinutes("0-59/60"));
    assertEquals("once every 20 minutes", PatternDescriber.describeMinutes("*/20"));
    assertEquals("with pattern */x", PatternDescriber.describeMinutes("*/x"));
    assertEquals("every minute during 10-20", PatternDescriber.describeMinutes("10-20"));
    assertEquals("at minutes 0,20,40", PatternDescriber.describeMinutes("0,20,40"));
    assertEquals("at 4 specific times", PatternDescriber.describeMinutes("0,15,30,45"));
    assertEquals("at minute 5", PatternDescriber.describeMinutes("5"));
    assertEquals("with minute pattern abc", PatternDescriber.describeMinutes("abc"));
  }

  @Test
  public void testCombinationsWithHourWindow() {
    assertEquals("Once a minute from 9:00 AM to 5:59 PM", PatternDescriber.describe("9-17", "*/1"));
    assertEquals("Once every fifteen minutes from 9:00 AM to 5:59 PM", PatternDescriber.describe("9-17", "*/15"));
    assertEquals("Every minute at 3 o'clock", PatternDescriber.describe("3", "*"));
    assertEquals("At minutes 0,30 during hours 6,18", PatternDescriber.describe("6,18", "0,30"));
  }

  @Test
  public void testNonIntervalAllDay() {
    assertEquals("At minute 0 all day", PatternDescriber.describe("*", "0"));
    assertEquals("Once an hour all day", PatternDescriber.describe("*", "0-59/60"));
  }

  @Test
  public void testMissingFieldsAreDefaulted() {
    assertEquals("At minute 0 all day", PatternDescriber.describe(null, ""));
  }

  @Test
  public void testUnreadableFieldsNeverFail() {
    assertEquals("With minute pattern ??? during hours !!", PatternDescriber.describe("!!", "???"));
  }

  @Test
  public void testFrequencyScore() {
    assertEquals(1000, PatternDescriber.frequencyScore("Once a minute"), 0.0);
    assertEquals(1000, PatternDescriber.frequencyScore("Once a minute from 9:00 AM to 5:59 PM"), 0.0);
    assertEquals(500, PatternDescriber.frequencyScore("Once every two minutes"), 0.0);
    assertEquals(200, PatternDescriber.frequencyScore("Once every five minutes"), 0.0);
    assertEquals(1000.0 / 30, PatternDescriber.frequencyScore("Once every thirty minutes"), 0.0001);
    assertEquals(50, PatternDescriber.frequencyScore("Once every 20 minutes from 9:00 AM to 5:59 PM"), 0.0);
    assertEquals(10, PatternDescriber.frequencyScore("Once an hour all day"), 0.0);
    assertEquals(1, PatternDescriber.frequencyScore("At minute 0 all day"), 0.0);
    assertEquals(1, PatternDescriber.frequencyScore("With pattern */x all day"), 0.0);
  }

  @Test
  public void testTighterIntervalsScoreHigher() {
    assertTrue(PatternDescriber.frequencyScore(PatternDescriber.describe("*", "*"))
      > PatternDescriber.frequencyScore(PatternDescriber.describe("*", "*/2")));
    assertTrue(PatternDescriber.frequencyScore(PatternDescriber.describe("*", "*/2"))
      > PatternDescriber.frequencyScore(PatternDescriber.describe("*", "*/15")));
    assertTrue(PatternDescriber.frequencyScore(PatternDescriber.describe("*", "*/15"))
      > PatternDescriber.frequencyScore(PatternDescriber.describe("*", "*/60")));
  }
}
