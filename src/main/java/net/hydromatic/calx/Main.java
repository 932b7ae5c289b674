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
package net.hydromatic.calx;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.util.CalxException;
import net.hydromatic.calx.util.Tracers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented shell.
 *
 * <p>Each line is parsed, simplified and printed. A line that starts with a
 * colon is a command:
 *
 * <ul>
 *   <li>{@code :diff e} prints the derivative of {@code e};
 *   <li>{@code :int e} prints the integral of {@code e};
 *   <li>{@code :solve e} prints the roots of {@code e}, which is either an
 *     equation such as {@code x^2 == 9} or an expression that is to equal
 *     zero;
 *   <li>{@code :expand e} prints the simplified expansion of {@code e};
 *   <li>{@code :eval e} evaluates {@code e};
 *   <li>{@code :set prop value} sets a {@link Prop property};
 *   <li>{@code :quit} ends the session.
 * </ul>
 *
 * <p>Lines that are empty or start with {@code #} are ignored.
 */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  private Calx calx;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Main main =
        new Main(argList, System.in, System.out, new LinkedHashMap<>());
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> args, InputStream in, PrintStream out,
      Map<Prop, Object> propMap) {
    this(args, new InputStreamReader(in), new OutputStreamWriter(out),
        propMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    this.in = buffer(in);
    this.out = buffer(out);
    this.echo = argList.contains("--echo");
    this.calx = new Calx(new Session(propMap, Tracers.empty()));
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

  /** Reads and executes lines until end of input or {@code :quit}. */
  public void run() {
    try {
      for (;;) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        if (echo) {
          out.println("> " + line);
        }
        if (!command(line.trim())) {
          break;
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } finally {
      out.flush();
    }
  }

  /** Executes a line; returns false if the shell should stop. */
  private boolean command(String line) {
    if (line.isEmpty() || line.startsWith("#")) {
      return true;
    }
    try {
      if (!line.startsWith(":")) {
        out.println(calx.simplify(calx.parse(line)));
        return true;
      }
      final int space = line.indexOf(' ');
      final String command = space < 0 ? line : line.substring(0, space);
      final String rest = space < 0 ? "" : line.substring(space + 1).trim();
      switch (command) {
        case ":quit":
          return false;
        case ":diff":
          out.println(calx.differentiate(calx.parse(rest), null));
          break;
        case ":int":
          out.println(calx.integrate(calx.parse(rest), null));
          break;
        case ":solve":
          out.println(calx.solve(calx.parse(rest), null));
          break;
        case ":expand":
          final Ast.Exp e = calx.parse(rest);
          out.println(calx.simplify(calx.expand(e)));
          break;
        case ":eval":
          out.println(calx.evaluate(calx.parse(rest)));
          break;
        case ":set":
          set(rest);
          break;
        default:
          out.println("Unknown command '" + command + "'");
      }
    } catch (RuntimeException e) {
      handle(e);
    }
    return true;
  }

  /** Handles {@code :set prop value}. */
  private void set(String rest) {
    final String[] words = rest.split("\\s+", 2);
    if (words.length != 2) {
      out.println("Usage: :set property value");
      return;
    }
    final Prop prop = Prop.lookup(words[0]);
    calx = new Calx(calx.session().withLenient(prop, words[1]));
    out.println(prop.camelName + " = " + prop.get(calx.session().map));
  }

  private void handle(RuntimeException e) {
    if (e instanceof CalxException) {
      final StringBuilder buf = new StringBuilder();
      ((CalxException) e).describeTo(buf);
      out.println(buf);
    } else if (e instanceof IllegalArgumentException) {
      out.println("Error: " + e.getMessage());
    } else {
      LOGGER.error("Unexpected error", e);
      out.println("Error: " + e);
    }
  }
}

// End Main.java
