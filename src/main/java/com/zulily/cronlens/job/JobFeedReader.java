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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.zulily.cronlens.Utils.info;
import static com.zulily.cronlens.Utils.warn;

/**
 * Decodes the scheduled-jobs payload returned by the upstream runtime into {@link JobRecord} values.
 * <p>
 * The payload is a JSON array of flat job objects. The enabled flag may arrive as a
 * boolean or as text, and the name key is "name" in newer payloads and "Name" in older ones.
 */
public final class JobFeedReader {

  // The endpoint answers an empty list (or an empty body) when no jobs are scheduled
  static final int EMPTY_PAYLOAD_MAX_LENGTH = 5;

  private static final ObjectMapper JSON = new ObjectMapper();

  private JobFeedReader() {
  }

  public static ImmutableList<JobRecord> read(final File feedFile) {
    checkNotNull(feedFile, "feedFile");

    try {
      return read(Files.asCharSource(feedFile, StandardCharsets.UTF_8).read());
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read job feed " + feedFile.getAbsolutePath(), e);
    }
  }

  /**
   * @param payload The raw JSON text of the feed
   * @return The jobs in payload order, or an empty list if no jobs are scheduled
   * @throws FeedFormatException if the payload is not a JSON array of objects
   */
  public static ImmutableList<JobRecord> read(final String payload) {
    checkNotNull(payload, "payload");

    if (payload.trim().length() <= EMPTY_PAYLOAD_MAX_LENGTH) {
      info("No jobs scheduled");
      return ImmutableList.of();
    }

    final JsonNode root;

    try {
      root = JSON.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new FeedFormatException("Job feed is not valid JSON: " + e.getOriginalMessage(), e);
    }

    if (root == null || !root.isArray()) {
      throw new FeedFormatException("Job feed must be a JSON array");
    }

    final ImmutableList.Builder<JobRecord> jobs = ImmutableList.builder();

    int index = 0;

    for (final JsonNode jobNode : root) {

      if (!jobNode.isObject()) {
        throw new FeedFormatException(String.format("Job feed entry %s is not an object: %s", index, jobNode));
      }

      jobs.add(toJobRecord(index, jobNode));

      index++;
    }

    return jobs.build();
  }

  private static JobRecord toJobRecord(final int index, final JsonNode jobNode) {
    String name = text(jobNode, "name");

    if (name == null) {
      name = text(jobNode, "Name");
    }

    if (name == null || name.trim().isEmpty()) {
      warn("Job feed entry {0} has no name", String.valueOf(index));
      name = "(unnamed job " + index + ")";
    }

    return JobRecord.named(name)
      .enabledValue(enabledValue(jobNode.get("enabled")))
      .id(text(jobNode, "id"))
      .hours(text(jobNode, "hours"))
      .minutes(text(jobNode, "minutes"))
      .daysOfWeek(text(jobNode, "daysOfWeek"))
      .daysOfMonth(text(jobNode, "daysOfMonth"))
      .months(text(jobNode, "months"))
      .years(text(jobNode, "years"))
      .cron(text(jobNode, "cron"))
      .build();
  }

  private static Object enabledValue(final JsonNode enabledNode) {
    if (enabledNode == null || enabledNode.isNull()) {
      return null;
    }

    return enabledNode.isBoolean() ? Boolean.valueOf(enabledNode.booleanValue()) : enabledNode.asText();
  }

  // Scalars only; numbers such as "minutes": 0 are read as their text form
  private static String text(final JsonNode jobNode, final String fieldName) {
    final JsonNode value = jobNode.get(fieldName);

    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }

    return value.asText();
  }
}
