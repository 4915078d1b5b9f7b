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
package com.zulily.cronlens.job;

import com.google.common.base.Strings;
import com.zulily.cronlens.crontab.OccurrenceExpander;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.zulily.cronlens.Utils.isNullOrEmpty;

/**
 * One scheduled job as reported by the upstream runtime.
 * <p>
 * All schedule fields are UTC. Only hours and minutes are ever expanded; the day,
 * month and year fields and the raw cron text are carried for display.
 */
public final class JobRecord {

  public static Builder named(final String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "name cannot be empty");
    return new Builder(name);
  }

  public static final class Builder {

    private final String name;
    private boolean enabled = false;
    private String id = null;
    private String hours = null;
    private String minutes = null;
    private String daysOfWeek = "";
    private String daysOfMonth = "";
    private String months = "";
    private String years = "";
    private String cron = "";

    private Builder(final String name) {
      this.name = name;
    }

    public Builder enabled(final boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * @param rawEnabled The enabled value exactly as the feed reported it
     */
    public Builder enabledValue(final Object rawEnabled) {
      this.enabled = EnabledFlag.normalize(rawEnabled);
      return this;
    }

    public Builder id(final String id) {
      this.id = id;
      return this;
    }

    public Builder hours(final String hours) {
      this.hours = hours;
      return this;
    }

    public Builder minutes(final String minutes) {
      this.minutes = minutes;
      return this;
    }

    public Builder daysOfWeek(final String daysOfWeek) {
      this.daysOfWeek = Strings.nullToEmpty(daysOfWeek);
      return this;
    }

    public Builder daysOfMonth(final String daysOfMonth) {
      this.daysOfMonth = Strings.nullToEmpty(daysOfMonth);
      return this;
    }

    public Builder months(final String months) {
      this.months = Strings.nullToEmpty(months);
      return this;
    }

    public Builder years(final String years) {
      this.years = Strings.nullToEmpty(years);
      return this;
    }

    public Builder cron(final String cron) {
      this.cron = Strings.nullToEmpty(cron);
      return this;
    }

    public JobRecord build() {
      return new JobRecord(this);
    }
  }

  private final String name;
  private final boolean enabled;
  private final String id;
  private final String hours;
  private final String minutes;
  private final String daysOfWeek;
  private final String daysOfMonth;
  private final String months;
  private final String years;
  private final String cron;

  private JobRecord(final Builder builder) {
    checkNotNull(builder, "builder");

    this.name = builder.name;
    this.enabled = builder.enabled;
    this.id = Strings.emptyToNull(builder.id);
    this.hours = isNullOrEmpty(builder.hours) ? OccurrenceExpander.DEFAULT_HOURS : builder.hours.trim();
    this.minutes = isNullOrEmpty(builder.minutes) ? OccurrenceExpander.DEFAULT_MINUTES : builder.minutes.trim();
    this.daysOfWeek = builder.daysOfWeek;
    this.daysOfMonth = builder.daysOfMonth;
    this.months = builder.months;
    this.years = builder.years;
    this.cron = builder.cron;
  }

  public String getName() {
    return name;
  }

  /**
   * @param maxWidth The widest label the caller can display
   * @return The name, shortened with a trailing ellipsis when longer than maxWidth
   */
  public String getDisplayName(final int maxWidth) {
    checkArgument(maxWidth > 3, "maxWidth must be greater than 3: %s", maxWidth);

    return name.length() <= maxWidth ? name : name.substring(0, maxWidth - 3) + "...";
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Optional<String> getId() {
    return Optional.ofNullable(id);
  }

  public String getHours() {
    return hours;
  }

  public String getMinutes() {
    return minutes;
  }

  public String getDaysOfWeek() {
    return daysOfWeek;
  }

  public String getDaysOfMonth() {
    return daysOfMonth;
  }

  public String getMonths() {
    return months;
  }

  public String getYears() {
    return years;
  }

  public String getCron() {
    return cron;
  }

  @Override
  public String toString() {
    return String.format("%s [hours: %s minutes: %s enabled: %s]", name, hours, minutes, enabled);
  }
}
