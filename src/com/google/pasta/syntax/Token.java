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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single token of Python source. The span {@code [start, end)} indexes into the source text;
 * characters between two consecutive tokens (spaces, tabs, line continuations) belong to no
 * token.
 */
public final class Token {
  private final TokenType type;
  private final String text;
  private final int start;
  private final int end;
  private final int lineno;
  private final int charno;

  public Token(TokenType type, String text, int start, int lineno, int charno) {
    checkArgument(start >= 0, "negative offset %s", start);
    this.type = checkNotNull(type);
    this.text = checkNotNull(text);
    this.start = start;
    this.end = start + text.length();
    this.lineno = lineno;
    this.charno = charno;
  }

  public TokenType getType() {
    return type;
  }

  public String getText() {
    return text;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  /** One-based line number of the first character. */
  public int getLineno() {
    return lineno;
  }

  /** Zero-based column of the first character. */
  public int getCharno() {
    return charno;
  }

  public boolean is(TokenType type, String text) {
    return this.type == type && this.text.equals(text);
  }

  /** Whether this is the operator or delimiter {@code op}. */
  public boolean isOp(String op) {
    return is(TokenType.OP, op);
  }

  /** Whether this is the name or keyword {@code name}. */
  public boolean isName(String name) {
    return is(TokenType.NAME, name);
  }

  @Override
  public String toString() {
    return type + " '" + text.replace("\n", "\\n") + "' at " + lineno + ":" + charno;
  }
}
