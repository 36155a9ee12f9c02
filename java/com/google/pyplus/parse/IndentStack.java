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

package com.google.pyplus.parse;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;

/** The stack of enclosing indentation widths. The outermost level, 0, is never popped. */
final class IndentStack {

  /** The result of {@link #update}. */
  record Change(int indents, int dedents, boolean consistent) {}

  private final Deque<Integer> widths = new ArrayDeque<>();

  IndentStack() {
    widths.push(0);
  }

  int top() {
    return widths.peek();
  }

  int depth() {
    return widths.size() - 1;
  }

  /**
   * Moves to a line indented by {@code width} columns. An increase pushes one level; a decrease
   * pops every level wider than {@code width}, and is inconsistent if the remaining top is not
   * exactly {@code width}.
   */
  Change update(int width) {
    checkArgument(width >= 0, width);
    if (width > top()) {
      widths.push(width);
      return new Change(1, 0, true);
    }
    int dedents = 0;
    while (width < top()) {
      widths.pop();
      dedents++;
    }
    return new Change(0, dedents, width == top());
  }

  /** Pops every open level, returning the number of levels popped. */
  int close() {
    int dedents = depth();
    while (depth() > 0) {
      widths.pop();
    }
    checkState(top() == 0);
    return dedents;
  }
}
