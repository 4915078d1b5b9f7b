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

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;
import com.zulily.cronlens.Utils;

import java.util.List;
import java.util.TreeSet;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parses a single cron-style schedule field and returns the numerical set of values it denotes.
 * <p>
 * i.e.
 * 1-10/2 -> 1,3,5,7,9
 * <p>
 * Supported forms are '*', a single value, a hyphenated range, a range with a step,
 * '*' with a step, and comma separated lists of any of those. A single value followed by a
 * step (5/15) denotes only that value.
 * <p>
 * Ranges do not wrap: a range whose start is greater than its end contributes no values.
 */
public final class CronField {

  private CronField() {
  }

  /**
   * Does the actual work of tearing apart the field expression and making it
   * into a numerical set of values
   *
   * @param expression     The text expression to evaluate
   * @param expressionPart The field being evaluated, which bounds the allowed values
   * @return A set within the expression's allowed range
   * @throws IllegalArgumentException if the expression cannot be interpreted
   */
  public static ImmutableSortedSet<Integer> parse(final String expression, final ExpressionPart expressionPart) {
    checkNotNull(expression, "expression");
    checkNotNull(expressionPart, "expressionPart");

    // Order of operations ->
    // 1) Split value by commas (lists) and for each csv.n:
    // 2) Split value by slashes (range/rangeStep)
    // 3) Match all for '*' or split hyphenated range for rangeStart and rangeEnd

    final List<String> csvParts = Utils.COMMA_SPLITTER.splitToList(expression);

    checkArgument(!csvParts.isEmpty(), "Empty cron expression for %s", expressionPart.name());

    final TreeSet<Integer> results = Sets.newTreeSet();

    for (final String csvPart : csvParts) {

      final List<String> slashParts = Utils.FORWARD_SLASH_SPLITTER.splitToList(csvPart);

      // Range step of expression i.e. */2 (none is 1 obviously)
      int rangeStep = 1;

      checkArgument(slashParts.size() <= 2, "Invalid cron expression for %s: %s", expressionPart.name(), expression);

      if (slashParts.size() == 2) {
        // Ordinal definition: 0 = rangeExpression, 1 = stepExpression
        final Integer rangeStepInteger = expressionPart.textUnitToInt(slashParts.get(1));

        checkArgument(rangeStepInteger != null, "Invalid cron expression for %s (rangeStep is not an int): %s", expressionPart.name(), expression);

        checkArgument(rangeStepInteger > 0, "Invalid cron expression for %s (rangeStep must be positive): %s", expressionPart.name(), expression);

        rangeStep = rangeStepInteger;
      }

      final String rangeExpression = slashParts.get(0);

      final Range<Integer> allowedRange = expressionPart.getAllowedRange();

      int rangeStart = allowedRange.lowerEndpoint();
      int rangeEnd = allowedRange.upperEndpoint();

      // either * or 0 or 0-6, etc
      if (!"*".equals(rangeExpression)) {

        final List<String> hyphenParts = Utils.HYPHEN_SPLITTER.splitToList(rangeExpression);

        checkArgument(hyphenParts.size() <= 2, "Invalid cron expression for %s: %s", expressionPart.name(), expression);

        rangeStart = toBoundedInt(hyphenParts.get(0), expressionPart, expression);

        // A single value, with or without a step, is just that value
        rangeEnd = hyphenParts.size() == 2 ? toBoundedInt(hyphenParts.get(1), expressionPart, expression) : rangeStart;

      }

      // long so that a huge step cannot wrap around below rangeEnd
      for (long runTime = rangeStart; runTime <= rangeEnd; runTime += rangeStep) {
        results.add((int) runTime);
      }

    }

    return ImmutableSortedSet.copyOf(results);
  }

  private static int toBoundedInt(final String value, final ExpressionPart expressionPart, final String expression) {
    final Integer intValue = expressionPart.textUnitToInt(value);

    checkArgument(intValue != null, "Invalid cron expression for %s (%s is not an int): %s", expressionPart.name(), value, expression);

    checkArgument(expressionPart.getAllowedRange().contains(intValue), "Invalid cron expression for %s (valid range is %s): %s", expressionPart.name(), expressionPart.getAllowedRange(), expression);

    return intValue;
  }
}
