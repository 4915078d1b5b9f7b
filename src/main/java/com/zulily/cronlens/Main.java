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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.zulily.cronlens.conf.ConfigKey;
import com.zulily.cronlens.conf.Configuration;
import com.zulily.cronlens.conf.Environment;
import com.zulily.cronlens.job.JobFeedReader;
import com.zulily.cronlens.job.JobRecord;
import com.zulily.cronlens.report.ScheduleReport;
import com.zulily.cronlens.report.ScheduleReporter;

import java.io.File;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.zulily.cronlens.Utils.error;
import static com.zulily.cronlens.Utils.info;

public final class Main {

  private static final String DEFAULT_CONFIG_PATH = "/etc/cronlens/cronlens.conf";
  private static final String DEFAULT_LOG_FORMAT = "[%1$tc] %4$s: %5$s %n";

  public static void main(final String[] args) {

    if (args == null || args.length == 0 || args[0].contains("?")) {
      printHelp();
      System.exit(0);
    }

    // see doc for java.util.logging.SimpleFormatter
    // log output will look like:
    // [Tue Dec 16 10:29:07 PST 2014] INFO: <message>
    System.setProperty("java.util.logging.SimpleFormatter.format", DEFAULT_LOG_FORMAT);

    try {

      final Configuration configuration = new Configuration(args.length > 1 ? args[1].trim() : DEFAULT_CONFIG_PATH);

      info("Loaded configuration from {0}", configuration.getConfigFilePath());

      final Optional<Environment> environment = configuration.getEnvironment(args[0]);

      if (!environment.isPresent()) {
        error("Unknown environment {0}. Configured environments: {1}", args[0], configuration.getEnvironments()
          .stream()
          .map(Environment::getName)
          .collect(Collectors.joining(", ")));
        System.exit(1);
      }

      final File feedFile = new File(environment.get().resolveFeedPath(configuration.getString(ConfigKey.FeedPath)));

      info("Reading scheduled jobs for {0} from {1}", environment.get().toString(), feedFile.getAbsolutePath());

      final ImmutableList<JobRecord> jobs = JobFeedReader.read(feedFile);

      final ScheduleReport report = ScheduleReporter.fromConfiguration(configuration).report(jobs);

      final ReportPrinter printer = new ReportPrinter(configuration.getInt(ConfigKey.NameDisplayWidth));

      printer
        .render("Scheduled Jobs - " + environment.get().getName(), report)
        .forEach(System.out::println);

    } catch (Exception e) {
      error("Caught exception in primary thread:\n{0}\n", Throwables.getStackTraceAsString(e));
      System.exit(1);
    }

    System.exit(0);
  }

  private static void printHelp() {
    System.out.println("CRONLENS - Reports on the scheduled jobs of a runtime environment");
    System.out.println("usage: java -jar cronlens.jar <environment name> <cronlens config path: defaults to /etc/cronlens/cronlens.conf>");
    System.out.println("Pass '?' as a parameter prints this message");
  }
}
