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

import com.google.common.collect.ComparisonChain;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An hour and minute on the local clock of the display time zone
 */
public final class CivilTime implements Comparable<CivilTime> {
  private final int hour;
  private final int minute;

  public CivilTime(final int hour, final int minute) {
    checkArgument(hour >= 0 && hour <= 23, "hour out of range: %s", hour);
    checkArgument(minute >= 0 && minute <= 59, "minute out of range: %s", minute);

    this.hour = hour;
    this.minute = minute;
  }

  public int getHour() {
    return hour;
  }

  public int getMinute() {
    return minute;
  }

  /**
   * @return The time on a 12-hour clock, i.e. "1:05 PM"
   */
  public String toTwelveHourString() {
    return TimeFormat.twelveHour(hour, minute);
  }

  @Override
  public int hashCode() {
    return hour * 60 + minute;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CivilTime
      && this.hour == ((CivilTime) o).hour
      && this.minute == ((CivilTime) o).minute;
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }

  @SuppressWarnings("NullableProblems")
  @Override
  public int compareTo(CivilTime o) {
    checkNotNull(o, "comparing null to CivilTime instance");

    return ComparisonChain.start()
      .compare(this.hour, o.hour)
      .compare(this.minute, o.minute)
      .result();
  }
}
