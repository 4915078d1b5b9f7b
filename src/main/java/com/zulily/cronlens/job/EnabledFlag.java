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

/**
 * The upstream feed reports a job's enabled state either as a native boolean
 * or as the text "true"/"false" depending on which runtime version produced it.
 * This is the single place that representation is interpreted.
 */
public final class EnabledFlag {

  private EnabledFlag() {
  }

  /**
   * @param rawValue A Boolean, a String, or null
   * @return True for Boolean.TRUE or text equal to "true" ignoring case and surrounding whitespace, False otherwise
   */
  public static boolean normalize(final Object rawValue) {
    if (rawValue instanceof Boolean) {
      return (Boolean) rawValue;
    }

    if (rawValue instanceof CharSequence) {
      return "true".equalsIgnoreCase(rawValue.toString().trim());
    }

    return false;
  }
}
