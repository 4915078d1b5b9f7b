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
package com.zulily.cronlens.conf;

/**
 * This enum represents the available defined values for
 * configuring cronlens, as well as the defaults for those values
 */
public enum ConfigKey {

  // {0} is replaced by the id of the selected environment
  FeedPath("feed.path", "/etc/cronlens/scheduled-jobs-{0}.json"),

  Environments("environments",
    "prod-trellis-molecule:eea33c78-01ad-4ebb-a511-b9c8bd0ea16a,"
      + "prod-trellis-atom:cdcca9c9-0797-4934-9b83-6e127385ef7f,"
      + "nonprod-qa-atom:81b83d93-cdcc-4801-ad79-d3557295b960,"
      + "nonprod-qa-molecule:76a40e65-b51a-4378-a48f-8ff4f7a90674"),

  // Schedules are reported in UTC and displayed in this zone, using the offset in force on reference.date
  TimeZone("timezone", "America/Denver"),
  ReferenceDate("reference.date", "2024-01-01"),

  RecurringOccurrenceThreshold("recurring.occurrence.threshold", "8"),
  NameDisplayWidth("name.display.width", "50"),

  Unknown("", "");

  private final String rawName;
  private final String defaultValue;

  ConfigKey(final String rawName, final String defaultValue) {
    this.rawName = rawName;
    this.defaultValue = defaultValue;
  }

  /**
   * Returns a ConfigKey that best matches the provided string name
   * or Unknown if the value is not recognized
   *
   * @param rawName The text name of the config key
   * @return A ConfigKey value, or Unknown if the config key name cannot be matched
   */
  public static ConfigKey fromString(final String rawName) {
    if (rawName != null) {

      final String trimmed = rawName.trim();

      for (ConfigKey configKey : ConfigKey.values()) {

        if (configKey.rawName.equalsIgnoreCase(trimmed)) {
          return configKey;
        }

      }

    }

    return Unknown;
  }

  /**
   * @return The raw name of the config key as it appears in the config file
   */
  public String getRawName() {
    return rawName;
  }

  /**
   * @return The default value of the config key if it is omitted from config
   */
  public String getDefaultValue() {
    return defaultValue;
  }
}
