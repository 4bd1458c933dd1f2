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

package com.google.pasta.base;

import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Operator;
import com.google.pasta.syntax.Prop;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful syntax tree utilities. */
public final class NodeUtil {

  /** Binding strength of atoms, calls, subscripts and attribute references. */
  static final int ATOM_PRECEDENCE = 16;

  private NodeUtil() {}

  /**
   * The binding strength of an expression: higher binds tighter. Tuples and yields bind loosest
   * and need parentheses wherever an operand is expected.
   */
  public static int precedence(Node n) {
    switch (n.getKind()) {
      case TUPLE:
      case YIELD:
      case YIELD_FROM:
        return 0;
      case LAMBDA:
        return 1;
      case IF_EXP:
        return 2;
      case BOOL_OP:
      case BIN_OP:
      case UNARY_OP:
        return ((Operator) n.getProp(Prop.OP)).getPrecedence();
      case COMPARE:
        return Operator.EQ.getPrecedence();
      case STARRED:
        return Operator.BIT_OR.getPrecedence();
      default:
        return ATOM_PRECEDENCE;
    }
  }

  /** Returns the field of {@code parent} that holds {@code child}, or null if none does. */
  public static @Nullable Field fieldOf(Node parent, Node child) {
    for (Kind.FieldSpec spec : parent.getKind().getFields()) {
      Field field = spec.getField();
      if (spec.getArity().isList()) {
        for (Node n : parent.getChildren(field)) {
          if (n == child) {
            return field;
          }
        }
      } else if (parent.getChild(field) == child) {
        return field;
      }
    }
    return null;
  }

  /**
   * Whether {@code child}, spelled without parentheses of its own, would parse as a different
   * tree under {@code parent}.
   */
  static boolean needsParentheses(@Nullable Node parent, Node child) {
    if (parent == null || !parent.getKind().isExpression()) {
      return false;
    }
    Field field = fieldOf(parent, child);
    if (child.isKind(Kind.NUM)) {
      return numberNeedsParentheses(parent, field, child);
    }
    int p = precedence(child);
    switch (parent.getKind()) {
      case BIN_OP:
        {
          boolean rightAssociative = parent.getProp(Prop.OP) == Operator.POW;
          if (rightAssociative && field == Field.RIGHT) {
            // The exponent may be a unary operation: 2 ** -1.
            return p < Operator.USUB.getPrecedence();
          }
          int q = precedence(parent);
          boolean grouped = field == Field.LEFT ? rightAssociative : !rightAssociative;
          return grouped ? p <= q : p < q;
        }
      case BOOL_OP:
      case COMPARE:
        return p <= precedence(parent);
      case UNARY_OP:
        return p < precedence(parent);
      case IF_EXP:
        // The else branch may be a lambda or another conditional; test and body may not.
        return field == Field.ORELSE ? p == 0 : p <= precedence(parent);
      case ATTRIBUTE:
      case CALL:
        return (field == Field.VALUE || field == Field.FUNC) && p < ATOM_PRECEDENCE;
      case SUBSCRIPT:
        return field == Field.VALUE ? p < ATOM_PRECEDENCE : p == 0 && !child.isKind(Kind.TUPLE);
      case STARRED:
        return p < precedence(parent);
      default:
        return p == 0 && !child.isKind(Kind.TUPLE);
    }
  }

  /**
   * Number literals are atoms, but a decimal integer runs into a following attribute dot, and a
   * negative number is spelled with a unary minus that binds looser than {@code **} and trailers.
   */
  private static boolean numberNeedsParentheses(Node parent, @Nullable Field field, Node number) {
    boolean negative = isNegative(number);
    switch (parent.getKind()) {
      case ATTRIBUTE:
        return negative || (number.getProp(Prop.VALUE) instanceof BigInteger
            && !number.getBoolean(Prop.IMAGINARY));
      case CALL:
        return negative && field == Field.FUNC;
      case SUBSCRIPT:
        return negative && field == Field.VALUE;
      case BIN_OP:
        return negative && field == Field.LEFT && parent.getProp(Prop.OP) == Operator.POW;
      default:
        return false;
    }
  }

  private static boolean isNegative(Node number) {
    Number value = (Number) number.getProp(Prop.VALUE);
    if (value instanceof BigInteger) {
      return ((BigInteger) value).signum() < 0;
    }
    // Also catches -0.0.
    return Math.copySign(1.0, value.doubleValue()) < 0;
  }
}
