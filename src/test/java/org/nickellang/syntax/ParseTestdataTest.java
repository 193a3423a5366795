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
package org.nickellang.syntax;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.google.testing.junit.testparameterinjector.TestParameterValuesProvider;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.nickellang.term.FileId;
import org.nickellang.term.RichTerm;
import org.nickellang.testing.TestdataScanner;
import org.nickellang.testing.TestdataScanner.TestProgram;

/**
 * Parses Nickel source code from each of the .ncl files in the testdata directory, based on
 * comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class ParseTestdataTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/nickellang/syntax/testdata");

  /**
   * Each snippet of source code is followed by a comment that begins "{@code /* PARSE}". There are
   * two variants:
   *
   * <ul>
   *   <li>With an error description (e.g. "{@code PARSE: UNEXPECTED_EOF}"): the test passes if
   *       parsing fails with an error whose description starts with the given text. The
   *       description of a {@link SyntaxError} is its kind followed by its message; that of a
   *       {@link LexicalError} is "LEXICAL" followed by its message.
   *   <li>With the expected term, printed as by {@link RichTerm#toString}, on the following line.
   * </ul>
   *
   * <p>A single file may contain any number of snippets; each is parsed independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* PARSE(.*?)\\*/\\n*", Pattern.DOTALL);

  @Test
  public void parseTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram program) {
    String comment = checkNotNull(program.comment(), "No PARSE comment found");
    String errMsg = null;
    if (comment.startsWith(":")) {
      errMsg = comment.substring(1).trim();
    }
    try {
      RichTerm result = TermParser.parseTerm(new FileId(0), program.code());
      assertWithMessage("Expected error, parsed OK").that(errMsg).isNull();
      assertWithMessage("Parse results don't match")
          .that(result.toString())
          .isEqualTo(comment.trim());
    } catch (ParseError e) {
      errMsg = (errMsg == null) ? "(no error expected)" : errMsg;
      assertWithMessage("Unexpected error %s", e).that(describe(e)).startsWith(errMsg);
    }
  }

  /** Provides each code chunk from a ".ncl" file in our testdata directory. */
  public static final class AllPrograms extends TestParameterValuesProvider {
    @Override
    protected List<?> provideValues(Context context) {
      return TestdataScanner.scan(TESTDATA, ".ncl", COMMENT_PATTERN);
    }
  }

  private static String describe(ParseError e) {
    String kind = (e instanceof SyntaxError syntaxError) ? syntaxError.kind.name() : "LEXICAL";
    return kind + ": " + e.getMessage();
  }
}
