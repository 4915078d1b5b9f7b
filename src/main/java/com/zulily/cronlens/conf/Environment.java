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

import java.text.MessageFormat;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named runtime environment whose scheduled jobs can be reported on,
 * identified upstream by an opaque id
 */
public final class Environment {
  private final String name;
  private final String id;

  public Environment(final String name, final String id) {
    checkArgument(!Strings.isNullOrEmpty(name), "name cannot be empty");
    checkArgument(!Strings.isNullOrEmpty(id), "id cannot be empty");

    this.name = name;
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public String getId() {
    return id;
  }

  /**
   * @param pathTemplate A path containing {0} where the environment id belongs
   * @return The path of this environment's job feed
   */
  public String resolveFeedPath(final String pathTemplate) {
    checkNotNull(pathTemplate, "pathTemplate");

    return MessageFormat.format(pathTemplate, id);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Environment
      && this.name.equals(((Environment) o).name)
      && this.id.equals(((Environment) o).id);
  }

  @Override
  public String toString() {
    return name + " (" + id + ")";
  }
}
