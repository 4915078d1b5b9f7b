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
package com.zulily.cronlens.crontab;

import com.google.common.collect.ComparisonChain;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single hour/minute firing time on the 24-hour UTC clock
 */
public final class Occurrence implements Comparable<Occurrence> {

  public static final Occurrence MIDNIGHT = new Occurrence(0, 0);

  private final int hour;
  private final int minute;

  public Occurrence(final int hour, final int minute) {
    checkArgument(ExpressionPart.Hours.getAllowedRange().contains(hour), "hour out of range: %s", hour);
    checkArgument(ExpressionPart.Minutes.getAllowedRange().contains(minute), "minute out of range: %s", minute);

    this.hour = hour;
    this.minute = minute;
  }

  public int getHour() {
    return hour;
  }

  public int getMinute() {
    return minute;
  }

  @Override
  public int hashCode() {
    return hour * 60 + minute;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Occurrence
      && this.hour == ((Occurrence) o).hour
      && this.minute == ((Occurrence) o).minute;
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d UTC", hour, minute);
  }

  @SuppressWarnings("NullableProblems")
  @Override
  public int compareTo(Occurrence o) {
    checkNotNull(o, "comparing null to Occurrence instance");

    return ComparisonChain.start()
      .compare(this.hour, o.hour)
      .compare(this.minute, o.minute)
      .result();
  }
}
