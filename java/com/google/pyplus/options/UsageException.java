/*
 * Copyright 2016 Google Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.pyplus.options;

import com.google.common.base.Joiner;
import org.jspecify.annotations.Nullable;

/** Invalid command line usage. */
public class UsageException extends RuntimeException {

  private static final String[] USAGE = {
    "Usage: pyplus [options] --sources <file>...",
    "",
    "Options:",
    "  --sources <file>...  Python++ source files to parse",
    "  --tokens             Print the token stream instead of the syntax tree",
    "  --help               Print this message",
    "",
    "Arguments of the form @<file> are expanded from the whitespace-separated contents of <file>.",
  };

  public UsageException() {
    super(buildMessage(null));
  }

  public UsageException(String message) {
    super(buildMessage(message));
  }

  private static String buildMessage(@Nullable String message) {
    StringBuilder sb = new StringBuilder();
    if (message != null) {
      sb.append("Error: ").append(message).append(System.lineSeparator());
    }
    Joiner.on(System.lineSeparator()).appendTo(sb, USAGE);
    return sb.toString();
  }
}
