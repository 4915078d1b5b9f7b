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
package com.zulily.cronlens;

import com.google.common.base.Splitter;

import java.io.File;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A collection of utilities and shared static instances to support cronlens
 */
public final class Utils {
  private final static Logger LOG = Logger.getGlobal();

  public final static Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  public final static Splitter EQUAL_SPLITTER = Splitter.on('=').trimResults().omitEmptyStrings();
  public final static Splitter COLON_SPLITTER = Splitter.on(':').trimResults().omitEmptyStrings();

  // Slash and hyphen splitters keep empty parts so that "5-" and "/2" fail to parse
  public final static Splitter FORWARD_SLASH_SPLITTER = Splitter.on('/').trimResults();
  public final static Splitter HYPHEN_SPLITTER = Splitter.on('-').trimResults();

  private Utils() {
  }

  /**
   * Shortcut method to determine if a file object can actually be "read" as a file
   *
   * @param file The file to check
   * @return true if the path exists, is a file, and can be read from
   */
  public static boolean fileExistsAndCanRead(final File file) {
    return file != null && file.exists() && file.isFile() && file.canRead();
  }

  // Various shortcut logging functions
  private static void log(final Level level, final String message, final String... args) {
    LOG.log(level, message, args);
  }

  public static void info(final String message, final String... args) {
    log(Level.INFO, message, args);
  }

  public static void info(final String message) {
    info(message, "");
  }

  public static void warn(final String message, final String... args) {
    log(Level.WARNING, message, args);
  }

  public static void warn(final String message) {warn(message, "");}

  public static void error(final String message, final String... args) {
    log(Level.SEVERE, message, args);
  }

  public static void error(final String message) {
    error(message, "");
  }

  public static boolean isNullOrEmpty(final String value) {
    return value == null || value.trim().isEmpty();
  }

}
