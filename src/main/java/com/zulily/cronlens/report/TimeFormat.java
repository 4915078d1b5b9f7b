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

import static com.google.common.base.Preconditions.checkArgument;

final class TimeFormat {

  private TimeFormat() {
  }

  /**
   * @param hour   0 - 23
   * @param minute 0 - 59
   * @return The time on a 12-hour clock, i.e. 0:00 -> "12:00 AM", 13:05 -> "1:05 PM"
   */
  static String twelveHour(final int hour, final int minute) {
    checkArgument(hour >= 0 && hour <= 23, "hour out of range: %s", hour);
    checkArgument(minute >= 0 && minute <= 59, "minute out of range: %s", minute);

    final int clockHour = hour == 0 ? 12 : hour > 12 ? hour - 12 : hour;

    return String.format("%d:%02d %s", clockHour, minute, hour < 12 ? "AM" : "PM");
  }
}
