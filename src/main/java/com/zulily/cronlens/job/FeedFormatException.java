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
 * Thrown when a scheduled-jobs payload is not shaped like a list of job objects
 */
public class FeedFormatException extends RuntimeException {

  public FeedFormatException(final String message) {
    super(message);
  }

  public FeedFormatException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
