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

package com.google.pyplus.diag;

import com.google.common.collect.ImmutableList;

/**
 * A parser state without a registered transition. This is an invariant violation of the parser
 * itself, and is never raised for any input by a correct parser.
 */
public class StructuralError extends PyPlusError {

  StructuralError(
      ErrorKind kind,
      String diagnostic,
      String message,
      int line,
      int column,
      ImmutableList<Object> args) {
    super(kind, diagnostic, message, line, column, args);
  }
}
