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

import com.zulily.cronlens.crontab.Expansion;
import com.zulily.cronlens.job.JobRecord;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A job together with the category it was placed in and the expansion that decided it
 */
public final class Assignment {
  private final Category category;
  private final JobRecord job;
  private final Expansion expansion;

  Assignment(final Category category, final JobRecord job, final Expansion expansion) {
    this.category = checkNotNull(category, "category");
    this.job = checkNotNull(job, "job");
    this.expansion = checkNotNull(expansion, "expansion");
  }

  public Category getCategory() {
    return category;
  }

  public JobRecord getJob() {
    return job;
  }

  public Expansion getExpansion() {
    return expansion;
  }

  @Override
  public String toString() {
    return category + ": " + job;
  }
}
