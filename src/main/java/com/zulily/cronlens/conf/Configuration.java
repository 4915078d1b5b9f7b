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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.Files;
import com.zulily.cronlens.Utils;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.zulily.cronlens.Utils.info;
import static com.zulily.cronlens.Utils.warn;

/**
 * Configuration reads and stores values from the config file
 * which can be specified on the command line when cronlens is launched.
 * <p/>
 * See: {@link com.zulily.cronlens.conf.ConfigKey} for more details
 */
public class Configuration {

  private final ImmutableMap<ConfigKey, String> rawConfigMap;
  private final String configFilePath;

  /**
   * Constructor
   *
   * @param configFilePath The config file to read from
   */
  public Configuration(final String configFilePath) {
    this(loadConfig(checkNotNull(configFilePath, "configFilePath")), configFilePath);

    this.printConfig();
  }

  private Configuration(final ImmutableMap<ConfigKey, String> rawConfigMap, final String configFilePath) {
    this.rawConfigMap = checkNotNull(rawConfigMap, "rawConfigMap");
    this.configFilePath = configFilePath;
  }

  /**
   * @return A configuration holding only default values
   */
  public static Configuration defaults() {
    return new Configuration(ImmutableMap.of(), "");
  }

  private void printConfig() {
    for (ConfigKey configKey : ConfigKey.values()) {

      if (configKey == ConfigKey.Unknown) {
        continue;
      }

      info("{0} = {1}", configKey.getRawName(), getString(configKey));
    }

  }

  private static ImmutableMap<ConfigKey, String> loadConfig(final String configFilePath) {

    if (Strings.isNullOrEmpty(configFilePath.trim())) {

      info("No config file specified. Will use defaults.");

      return ImmutableMap.of();

    }

    final File configFile = new File(configFilePath);

    if (!Utils.fileExistsAndCanRead(configFile)) {

      info("Config file not found, not a file, or cannot be read. Will use defaults.");

      return ImmutableMap.of();

    }

    final HashMap<ConfigKey, String> config = Maps.newHashMap();

    try {

      final ImmutableList<String> configLines = Files.asCharSource(configFile, StandardCharsets.UTF_8).readLines();

      for (final String configLine : configLines) {

        final String trimmed = configLine.trim();

        //Skip commented/blank lines
        if (trimmed.isEmpty() || '#' == trimmed.charAt(0)) {
          continue;
        }

        final List<String> configLineParts = Utils.EQUAL_SPLITTER.splitToList(trimmed);

        if (configLineParts.size() != 2) {

          warn("Skipping malformed config line: {0}", trimmed);
          continue;

        }

        final ConfigKey configKey = ConfigKey.fromString(configLineParts.get(0));

        if (configKey == ConfigKey.Unknown) {

          warn("Skipping unknown config param: {0}", trimmed);
          continue;

        }

        config.put(configKey, configLineParts.get(1));

      }

    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read config file " + configFilePath, e);
    }

    if (config.isEmpty()) {
      warn("Config file values not loaded. Will use defaults.");
    }

    return ImmutableMap.copyOf(config);
  }

  /**
   * Reads a specified ConfigKey value as an int
   *
   * @param configKey The ConfigKey to get
   * @return An 'int' representation of the configured value
   */
  public int getInt(final ConfigKey configKey) {
    return Integer.parseInt(getString(configKey, rawConfigMap));
  }

  /**
   * Reads a specified ConfigKey value as a String
   *
   * @param configKey The ConfigKey to get
   * @return A 'String' representation of the configured value
   */
  public String getString(final ConfigKey configKey) {
    return getString(configKey, rawConfigMap);
  }

  private static String getString(final ConfigKey configKey, final Map<ConfigKey, String> configMap) {
    checkArgument(configKey != ConfigKey.Unknown, "Cannot get unknown config value");

    final String configValue = configMap.get(configKey);

    return configValue == null ? configKey.getDefaultValue() : configValue;
  }

  /**
   * @return The path to the config file used by cronlens
   */
  public String getConfigFilePath() {
    return configFilePath;
  }

  /**
   * @return The zone that UTC schedules are displayed in
   */
  public DateTimeZone getTimeZone() {
    return DateTimeZone.forID(getString(ConfigKey.TimeZone));
  }

  /**
   * @return The calendar date whose offset rule is applied to every displayed time
   */
  public LocalDate getReferenceDate() {
    return LocalDate.parse(getString(ConfigKey.ReferenceDate));
  }

  /**
   * Environments are configured as a comma separated list of name:id pairs
   *
   * @return The configured environments in the order they are listed
   */
  public ImmutableList<Environment> getEnvironments() {
    final ImmutableList.Builder<Environment> result = ImmutableList.builder();

    for (final String entry : Utils.COMMA_SPLITTER.split(getString(ConfigKey.Environments))) {

      final List<String> entryParts = Utils.COLON_SPLITTER.splitToList(entry);

      if (entryParts.size() != 2) {
        warn("Skipping malformed environment: {0}", entry);
        continue;
      }

      result.add(new Environment(entryParts.get(0), entryParts.get(1)));
    }

    return result.build();
  }

  /**
   * @param name The environment name, case-insensitive
   * @return The matching environment, if configured
   */
  public Optional<Environment> getEnvironment(final String name) {
    checkNotNull(name, "name");

    return getEnvironments()
      .stream()
      .filter(environment -> environment.getName().equalsIgnoreCase(name.trim()))
      .findFirst();
  }
}
