/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.ace;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.ace.eval.Prop;
import net.hydromatic.ace.translate.Driver;
import net.hydromatic.ace.translate.Tracers;
import net.hydromatic.ace.translate.TranslationReport;

/**
 * Command-line translator.
 *
 * <p>Translates each file named on the command line, or standard input if
 * there are none, and prints one line per statement. An argument of the
 * form {@code --name=value}, such as {@code --requireBoundHead=false}, sets
 * a {@link Prop property}.
 */
public class Main {
  private final List<String> fileList;
  private final Reader in;
  private final PrintWriter out;
  private final Driver driver;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    try {
      final Main main =
          new Main(ImmutableList.copyOf(args),
              new InputStreamReader(System.in, StandardCharsets.UTF_8),
              new OutputStreamWriter(System.out, StandardCharsets.UTF_8),
              new LinkedHashMap<>());
      final int failureCount = main.run();
      System.exit(failureCount == 0 ? 0 : 2);
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /**
   * Creates a Main.
   *
   * @throws IllegalArgumentException if an option names an unknown property
   *     or has an invalid value
   */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    final ImmutableList.Builder<String> files = ImmutableList.builder();
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        final int i = arg.indexOf('=');
        checkArgument(i > 2, "expected --name=value, got '%s'", arg);
        Prop.lookup(arg.substring(2, i)).setString(map, arg.substring(i + 1));
      } else {
        files.add(arg);
      }
    }
    this.fileList = files.build();
    this.in = in;
    this.out = new PrintWriter(new BufferedWriter(out));
    this.driver = new Driver(map, Tracers.empty());
  }

  /**
   * Translates the input and prints the report. Returns the number of
   * statements that could not be translated.
   */
  public int run() throws IOException {
    int failureCount = 0;
    try {
      if (fileList.isEmpty()) {
        failureCount += translate(CharStreams.toString(in));
      } else {
        for (String file : fileList) {
          final Path path = Paths.get(file);
          failureCount +=
              translate(new String(Files.readAllBytes(path),
                  StandardCharsets.UTF_8));
        }
      }
    } finally {
      out.flush();
    }
    return failureCount;
  }

  private int translate(String text) {
    final TranslationReport report = driver.translateText(text);
    out.print(report);
    return report.failures().size();
  }
}

// End Main.java
