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
package org.nickellang.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class StringUtilTest {

  @Test
  public void quote() {
    assertThat(StringUtil.quote("plain")).isEqualTo("\"plain\"");
    assertThat(StringUtil.quote("a\"b\\c#d\n\t\r"))
        .isEqualTo("\"a\\\"b\\\\c\\#d\\n\\t\\r\"");
  }

  private static Object[] escapedChars() {
    return new Object[] {
      new Object[] {"n"}, new Object[] {"r"}, new Object[] {"t"}, new Object[] {"\""},
      new Object[] {"#"}
    };
  }

  @Test
  @Parameters(method = "escapedChars")
  public void unescapeRoundTrips(String c) {
    String escape = "\\" + c;
    assertThat(StringUtil.quote(String.valueOf(StringUtil.unescape(escape))))
        .isEqualTo("\"" + escape + "\"");
  }

  @Test
  public void unescapeBackslash() {
    assertThat(StringUtil.unescape("\\\\")).isEqualTo('\\');
  }

  @Test
  public void badEscapes() {
    assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("\\q"));
    assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("n"));
  }
}
