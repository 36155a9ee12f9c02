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

import com.google.auto.value.AutoBuilder;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Command line options.
 *
 * @param sources Paths to the source files to parse.
 * @param printTokens Print the token stream of each source instead of its syntax tree.
 * @param help Print usage information.
 */
public record ParseOptions(ImmutableList<String> sources, boolean printTokens, boolean help) {

  public static Builder builder() {
    return new AutoBuilder_ParseOptions_Builder().setPrintTokens(false).setHelp(false);
  }

  /** A {@link Builder} for {@link ParseOptions}. */
  @AutoBuilder
  public abstract static class Builder {

    abstract ImmutableList.Builder<String> sourcesBuilder();

    @CanIgnoreReturnValue
    public Builder addSources(Iterable<String> sources) {
      sourcesBuilder().addAll(sources);
      return this;
    }

    public abstract Builder setPrintTokens(boolean printTokens);

    public abstract Builder setHelp(boolean help);

    public abstract ParseOptions build();
  }
}
