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
package org.nickellang.term;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.nickellang.syntax.TermParser;

@RunWith(JUnit4.class)
public class TraversalTest {

  private static RichTerm parse(String source) {
    return TermParser.parseTerm(new FileId(0), source);
  }

  @Test
  public void visitsChildrenBeforeParents() {
    List<String> visited = new ArrayList<>();
    parse("f (1 + 2)")
        .traverse(
            node -> {
              visited.add(node.toString());
              return node;
            });
    assertThat(visited)
        .containsExactly(
            "Var(f)", "Num(1)", "Num(2)", "Op2(Plus, Num(1), Num(2))",
            "App(Var(f), Op2(Plus, Num(1), Num(2)))")
        .inOrder();
  }

  @Test
  public void reachesEverySubterm() {
    RichTerm term =
        parse(
            "{ a = [n, \"#{n}\"]; $n = switch { x => n, _ => n } n; b | default = r$[n = n] }");
    RichTerm result =
        term.traverse(
            node ->
                (node.term() instanceof Term.Var var && var.id().label().equals("n"))
                    ? Terms.num(0).withPos(node.pos())
                    : node);
    assertThat(result.toString()).doesNotContain("Var(n)");
    assertThat(result.toString()).contains("Var(r)");
  }

  @Test
  public void keepsPositions() {
    RichTerm term = parse("1 + x");
    RichTerm result = term.traverse(node -> node);
    assertThat(result).isEqualTo(term);
  }
}
