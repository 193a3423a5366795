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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.nickellang.term.BinaryOp;
import org.nickellang.term.UnaryOp;

/**
 * A statics-only class mapping ANTLR token types (which are just ints) to the operators they
 * denote.
 *
 * <p>Rather than listing each token again, we find each operator's token by looking up its
 * spelling among the literal names of the lexer's Vocabulary.
 */
final class TokenType {

  // Statics only
  private TokenType() {}

  /**
   * A Map from token name to token type. Token names are either literals enclosed in single quotes
   * (e.g. "{@code '+'}") or symbolic names (e.g. "{@code NUM_LITERAL}").
   */
  static final ImmutableMap<String, Integer> MAP;

  static {
    // The ANTLR Vocabulary class provides a way to map token types to their names.  We count on
    // token types being densely allocated starting from 1 to find them all.  Tokens that only exist
    // to be retyped in a string mode may repeat a literal; the first (default mode) one wins.
    Vocabulary vocab = NickelLexer.VOCABULARY;
    Map<String, Integer> map = new LinkedHashMap<>();
    for (int i = 1; i <= vocab.getMaxTokenType(); i++) {
      String literal = vocab.getLiteralName(i);
      if (literal != null) {
        map.putIfAbsent(literal, i);
      }
      String symbolic = vocab.getSymbolicName(i);
      if (symbolic != null) {
        map.putIfAbsent(symbolic, i);
      }
    }
    MAP = ImmutableMap.copyOf(map);
  }

  /**
   * Returns the token type for the given name. Throws an exception if there is no such token name.
   */
  static int of(String name) {
    Integer result = MAP.get(name);
    if (result == null) {
      throw new IllegalArgumentException("No token named " + name);
    }
    return result;
  }

  /** Maps the token type of each prefix unary operator keyword to its operator. */
  static final ImmutableMap<Integer, UnaryOp.Kind> UNARY_OPS;

  /** Maps the token type of each infix or prefix binary operator to its operator. */
  static final ImmutableMap<Integer, BinaryOp.Kind> BINARY_OPS;

  static {
    ImmutableMap.Builder<Integer, UnaryOp.Kind> unaryBuilder = ImmutableMap.builder();
    for (UnaryOp.Kind kind : UnaryOp.Kind.values()) {
      if (kind.spelling != null) {
        unaryBuilder.put(of("'" + kind.spelling + "'"), kind);
      }
    }
    UNARY_OPS = unaryBuilder.buildOrThrow();
    ImmutableMap.Builder<Integer, BinaryOp.Kind> binaryBuilder = ImmutableMap.builder();
    for (BinaryOp.Kind kind : BinaryOp.Kind.values()) {
      if (kind.spelling != null) {
        binaryBuilder.put(of("'" + kind.spelling + "'"), kind);
      }
    }
    BINARY_OPS = binaryBuilder.buildOrThrow();
  }

  static UnaryOp.Kind unaryOp(Token token) {
    UnaryOp.Kind result = UNARY_OPS.get(token.getType());
    if (result == null) {
      throw new AssertionError("Not a unary operator: " + token.getText());
    }
    return result;
  }

  static BinaryOp.Kind binaryOp(Token token) {
    BinaryOp.Kind result = BINARY_OPS.get(token.getType());
    if (result == null) {
      throw new AssertionError("Not a binary operator: " + token.getText());
    }
    return result;
  }
}
