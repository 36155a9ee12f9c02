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

package com.google.pyplus.main;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.MoreFiles;
import com.google.pyplus.diag.PyPlusError;
import com.google.pyplus.diag.SourceFile;
import com.google.pyplus.options.ParseOptions;
import com.google.pyplus.options.ParseOptionsParser;
import com.google.pyplus.options.UsageException;
import com.google.pyplus.parse.Lexer;
import com.google.pyplus.parse.Parser;
import com.google.pyplus.parse.Token;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.Arrays;

/** Main entry point for the Python++ front end. */
public final class Main {

  public static void main(String[] args) throws IOException {
    boolean ok;
    PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, UTF_8), true);
    PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, UTF_8), true);
    try {
      ok = run(args, out, err);
    } catch (UsageException e) {
      err.println(e.getMessage());
      ok = false;
    } catch (Throwable crash) {
      crash.printStackTrace();
      ok = false;
    }
    out.flush();
    err.flush();
    System.exit(ok ? 0 : 1);
  }

  /**
   * Parses every source named by the arguments, printing each syntax tree (or token stream) to
   * {@code out} and each diagnostic to {@code err}. Returns true if every source parsed.
   */
  public static boolean run(String[] args, PrintWriter out, PrintWriter err) throws IOException {
    ParseOptions options = ParseOptionsParser.parse(Arrays.asList(args));
    usage(options);
    boolean ok = true;
    // one diagnostic per file; keep going with the next file
    for (String path : options.sources()) {
      SourceFile source;
      try {
        source = new SourceFile(path, MoreFiles.asCharSource(Paths.get(path), UTF_8).read());
      } catch (IOException e) {
        err.println(path + ": error: cannot read file: " + e.getMessage());
        ok = false;
        continue;
      }
      try {
        if (options.printTokens()) {
          for (Token token : Lexer.tokenize(source)) {
            out.println(token.line() + ":" + token.column() + " " + token);
          }
        } else {
          out.print(Parser.parse(source));
        }
      } catch (PyPlusError e) {
        err.println(e.getMessage());
        ok = false;
      }
    }
    out.flush();
    err.flush();
    return ok;
  }

  private static void usage(ParseOptions options) {
    if (options.help()) {
      throw new UsageException();
    }
    if (options.sources().isEmpty()) {
      throw new UsageException("no sources were provided");
    }
  }

  private Main() {}
}
