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
package net.hydromatic.cas;

import static net.hydromatic.cas.ast.NodeBuilder.node;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.eval.Engine;
import net.hydromatic.cas.eval.ExactResult;
import net.hydromatic.cas.eval.Prop;
import net.hydromatic.cas.eval.Session;

/**
 * Command-line shell.
 *
 * <p>Reads expressions and equations, one per line, and prints their exact
 * values. The value of the {@code n}th expression is available to later
 * lines as {@code ans}<i>n</i>, starting from {@code ans0}.
 *
 * <p>The command "set name value" changes a property; for example,
 * "set precision 4" or "set numberFormat scientific".
 */
public class Main {
  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  private Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args), System.in, System.out);
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> args, InputStream in, PrintStream out) {
    this(args, new InputStreamReader(in, StandardCharsets.UTF_8),
        new OutputStreamWriter(out, StandardCharsets.UTF_8));
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out) {
    this.in = buffer(in);
    this.out = buffer(out);
    this.echo = argList.contains("--echo");
    this.session = Session.DEFAULT;
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  /** Reads lines until end of input. */
  public void run() {
    final Map<Integer, Expr.Exp> answers = new LinkedHashMap<>();
    try {
      for (; ; ) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        if (echo) {
          out.println("> " + line);
        }
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        if (trimmed.startsWith("set ")) {
          set(trimmed.substring("set ".length()).trim());
          continue;
        }
        final ExactResult result =
            new Engine(session).evaluate(node.literals(trimmed), answers);
        if (result.exp != null) {
          out.println("ans" + answers.size() + " = " + describe(result));
          answers.put(answers.size(), result.exp);
        } else if (result.solution != null) {
          out.println(result.solution);
        } else if (result.error != null) {
          out.println("error: " + result.error);
        } else {
          out.println("?");
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    out.flush();
  }

  /** Executes a command such as "precision 4". */
  private void set(String command) {
    final String[] words = command.split("\\s+", 2);
    try {
      final Prop prop = Prop.lookup(words[0]);
      session = session.withLenient(prop, words.length > 1 ? words[1] : null);
      out.println(prop.camelName + " = "
          + prop.get(session.map));
    } catch (IllegalArgumentException e) {
      out.println("error: " + e.getMessage());
    }
  }

  private static String describe(ExactResult result) {
    final String exact = String.valueOf(result.exp);
    if (result.value == null || result.value.isNaN()
        || result.isExact() && !exact.contains("/")) {
      return exact;
    }
    return exact + " ≈ " + result.decimal;
  }
}

// End Main.java
