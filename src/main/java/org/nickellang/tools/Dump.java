/*
 * Copyright 2025 The Nickel Authors
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
package org.nickellang.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.nickellang.syntax.Files;
import org.nickellang.syntax.ParseError;
import org.nickellang.syntax.TermParser;
import org.nickellang.term.FileId;
import org.nickellang.term.RichTerm;
import org.nickellang.transform.ShareNormalForm;

/**
 * A simple command-line tool that parses a single Nickel file and prints the resulting term.
 *
 * <p>Set the system property {@code share} to {@code true} to print the term after conversion to
 * share normal form, and {@code positions} to {@code true} to also list the source location of
 * each positioned subterm.
 */
public class Dump {
  private Dump() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: dump <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    boolean share = Boolean.parseBoolean(System.getProperty("share", "false"));
    boolean positions = Boolean.parseBoolean(System.getProperty("positions", "false"));
    checkUsage(args.length == 1);
    Path path = Path.of(args[0]);
    String contents = CharStreams.fromPath(path).toString();
    Files files = new Files();
    FileId file = files.add(path.getFileName().toString(), contents);
    RichTerm term;
    try {
      term = TermParser.parseTerm(file, contents);
    } catch (ParseError e) {
      System.err.printf("%s: %s\n", files.name(file), e.getMessage());
      System.exit(1);
      return;
    }
    if (share) {
      term = ShareNormalForm.transform(term);
    }
    System.out.printf("/* PARSE\n  %s\n*/\n", term);
    if (positions) {
      List<String> lines = new ArrayList<>();
      term.traverse(
          node -> {
            if (node.pos() != null) {
              lines.add(String.format("%s  %s", files.location(node.pos()), node));
            }
            return node;
          });
      lines.forEach(System.out::println);
    }
  }
}
