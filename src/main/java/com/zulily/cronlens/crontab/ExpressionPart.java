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

import com.google.common.collect.Range;
import com.google.common.primitives.Ints;

/**
 * Enum representing the expandable parts of a job schedule and the explicit ranges associated with each
 * <p>
 * Day, month and year fields are carried as display text only and have no entry here
 */
public enum ExpressionPart {
  Minutes(Range.closed(0, 59)),
  Hours(Range.closed(0, 23));

  private final Range<Integer> allowedRange;

  ExpressionPart(final Range<Integer> allowedRange) {
    this.allowedRange = allowedRange;
  }

  public Range<Integer> getAllowedRange() {
    return allowedRange;
  }

  /**
   * @param value The text unit to translate
   * @return The int value of the text unit, or null if it is not an integer
   */
  Integer textUnitToInt(final String value) {
    return Ints.tryParse(value);
  }

}
