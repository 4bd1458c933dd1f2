/*
 * Copyright 2026 The Pasta Authors.
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

package com.google.pasta.syntax;

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * Operator tags for BIN_OP, AUG_ASSIGN, BOOL_OP, UNARY_OP and CMP_OP nodes, with their source
 * spelling and binding strength.
 */
public enum Operator {
  // Binary
  BIT_OR(Arity.BINARY, "|", 7),
  BIT_XOR(Arity.BINARY, "^", 8),
  BIT_AND(Arity.BINARY, "&", 9),
  LSHIFT(Arity.BINARY, "<<", 10),
  RSHIFT(Arity.BINARY, ">>", 10),
  ADD(Arity.BINARY, "+", 11),
  SUB(Arity.BINARY, "-", 11),
  MULT(Arity.BINARY, "*", 12),
  MAT_MULT(Arity.BINARY, "@", 12),
  DIV(Arity.BINARY, "/", 12),
  FLOOR_DIV(Arity.BINARY, "//", 12),
  MOD(Arity.BINARY, "%", 12),
  POW(Arity.BINARY, "**", 14),

  // Boolean
  OR(Arity.BOOLEAN, "or", 3),
  AND(Arity.BOOLEAN, "and", 4),

  // Unary
  NOT(Arity.UNARY, "not", 5),
  INVERT(Arity.UNARY, "~", 13),
  UADD(Arity.UNARY, "+", 13),
  USUB(Arity.UNARY, "-", 13),

  // Comparison
  EQ(Arity.COMPARISON, "==", 6),
  NOT_EQ(Arity.COMPARISON, "!=", 6),
  LT(Arity.COMPARISON, "<", 6),
  LT_E(Arity.COMPARISON, "<=", 6),
  GT(Arity.COMPARISON, ">", 6),
  GT_E(Arity.COMPARISON, ">=", 6),
  IS(Arity.COMPARISON, "is", 6),
  IS_NOT(Arity.COMPARISON, "is not", 6),
  IN(Arity.COMPARISON, "in", 6),
  NOT_IN(Arity.COMPARISON, "not in", 6);

  /** The operand shapes an operator applies to. */
  public enum Arity {
    BINARY,
    BOOLEAN,
    UNARY,
    COMPARISON
  }

  private final Arity arity;
  private final String text;
  private final int precedence;

  Operator(Arity arity, String text, int precedence) {
    this.arity = arity;
    this.text = text;
    this.precedence = precedence;
  }

  public Arity getArity() {
    return arity;
  }

  /** The canonical spelling; two-word comparisons are separated by a single space. */
  public String getText() {
    return text;
  }

  public int getPrecedence() {
    return precedence;
  }

  /** Whether the operator is spelled with more than one token. */
  public boolean isTwoWords() {
    return text.indexOf(' ') >= 0;
  }

  /**
   * Returns the operator with the given spelling and arity, or null if there is none. Two-word
   * comparisons are looked up by their canonical spelling.
   */
  public static @Nullable Operator forText(Arity arity, String text) {
    checkNotNull(text);
    for (Operator op : values()) {
      if (op.arity == arity && op.text.equals(text)) {
        return op;
      }
    }
    return null;
  }
}
