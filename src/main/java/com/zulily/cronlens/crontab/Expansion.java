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

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The outcome of expanding a job's hour and minute fields.
 * <p>
 * Either the full set of occurrences, or a fallback carrying the single
 * midnight occurrence together with the reason the fields could not be read.
 */
public final class Expansion {

  private final ImmutableSortedSet<Occurrence> occurrences;
  private final String failureReason;

  private Expansion(final ImmutableSortedSet<Occurrence> occurrences, final String failureReason) {
    this.occurrences = occurrences;
    this.failureReason = failureReason;
  }

  static Expansion of(final ImmutableSortedSet<Occurrence> occurrences) {
    checkNotNull(occurrences, "occurrences");

    return new Expansion(occurrences, null);
  }

  static Expansion fallback(final String failureReason) {
    checkNotNull(failureReason, "failureReason");
    checkArgument(!failureReason.isEmpty(), "failureReason must not be empty");

    return new Expansion(ImmutableSortedSet.of(Occurrence.MIDNIGHT), failureReason);
  }

  public ImmutableSortedSet<Occurrence> getOccurrences() {
    return occurrences;
  }

  public int getOccurrenceCount() {
    return occurrences.size();
  }

  /**
   * @return True if the fields were malformed and the midnight occurrence was substituted
   */
  public boolean isFallback() {
    return failureReason != null;
  }

  public Optional<String> getFailureReason() {
    return Optional.ofNullable(failureReason);
  }

  @Override
  public String toString() {
    return isFallback()
      ? String.format("fallback %s (%s)", occurrences, failureReason)
      : occurrences.toString();
  }
}
