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
package net.hydromatic.cnf;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
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
import net.hydromatic.cnf.ast.Prop;
import net.hydromatic.cnf.eval.Setting;
import net.hydromatic.cnf.kb.KnowledgeBase;
import net.hydromatic.cnf.parse.PropParseException;
import net.hydromatic.cnf.parse.PropParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line tool that reads formulas, one per line, adds them to a
 * knowledge base, and prints the clauses.
 *
 * <p>Blank lines and lines that start with "#" are ignored. A line that is
 * not a valid formula is reported, and the remaining lines are still read.
 *
 * <p>Arguments:
 *
 * <ul>
 *   <li>{@code --echo} prints each formula, followed by the clauses it
 *       added, as it is read;
 *   <li>{@code --name=value} sets a {@link Setting}, for example
 *       {@code --output=tree} or {@code --checkPostconditions=true}.
 * </ul>
 */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  private final Map<Setting, Object> settings;

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
    final Map<Setting, Object> settings = new LinkedHashMap<>();
    boolean echo = false;
    for (String arg : argList) {
      if (arg.equals("--echo")) {
        echo = true;
      } else if (arg.startsWith("--") && arg.contains("=")) {
        final int i = arg.indexOf('=');
        Setting.lookup(arg.substring(2, i))
            .setLenient(settings, arg.substring(i + 1));
      } else {
        throw new IllegalArgumentException("unknown argument: " + arg);
      }
    }
    this.echo = echo;
    this.settings = ImmutableMap.copyOf(settings);
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

  /** Reads all formulas, then prints the clauses of the knowledge base. */
  public void run() {
    final KnowledgeBase kb = KnowledgeBase.empty(settings);
    try {
      int lineNumber = 0;
      for (;;) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        ++lineNumber;
        final String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        final int before = kb.size();
        try {
          kb.tell(PropParser.parse(line, "", lineNumber));
        } catch (PropParseException e) {
          LOGGER.warn("cannot parse line {}: {}", lineNumber, e.getMessage());
          out.println(e.describeTo(new StringBuilder()));
          continue;
        }
        if (echo) {
          out.println("> " + trimmed);
          print(kb.sentences().subList(before, kb.size()));
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    if (!echo) {
      print(kb.sentences());
    }
    out.flush();
  }

  private void print(List<Prop> clauses) {
    switch (Setting.OUTPUT.enumValue(settings, Setting.Output.class)) {
      case TREE:
        final String indent = Setting.PRINT_INDENT.stringValue(settings);
        for (Prop clause : clauses) {
          clause.printTree(out, indent);
        }
        break;
      default:
        for (Prop clause : clauses) {
          out.println(clause);
        }
    }
  }
}

// End Main.java
