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

/**
 * Counts over one job collection
 */
public final class JobStatistics {
  private final int total;
  private final int enabled;
  private final int recurring;
  private final int scheduled;

  JobStatistics(final int total, final int enabled, final int recurring, final int scheduled) {
    checkArgument(enabled >= 0 && enabled <= total, "enabled count %s out of range for total %s", enabled, total);
    checkArgument(recurring + scheduled == total, "categories (%s + %s) do not add up to total %s", recurring, scheduled, total);

    this.total = total;
    this.enabled = enabled;
    this.recurring = recurring;
    this.scheduled = scheduled;
  }

  public int getTotal() {
    return total;
  }

  public int getEnabled() {
    return enabled;
  }

  public int getDisabled() {
    return total - enabled;
  }

  public int getRecurring() {
    return recurring;
  }

  public int getScheduled() {
    return scheduled;
  }

  @Override
  public String toString() {
    return String.format("total: %s enabled: %s disabled: %s recurring: %s scheduled: %s",
      total, enabled, getDisabled(), recurring, scheduled);
  }
}
