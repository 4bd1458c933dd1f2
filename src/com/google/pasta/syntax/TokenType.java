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

/** Lexical token types, mirroring the token types of the Python tokenizer. */
public enum TokenType {
  NAME,
  NUMBER,
  STRING,
  OP,
  COMMENT,
  /** A newline that does not end a logical line (blank lines, inside brackets). */
  NL,
  /** The end of a logical line. Empty text when the source has no trailing newline. */
  NEWLINE,
  /** The indentation of the first line of a block; its text is the indentation itself. */
  INDENT,
  /** Zero-width marker for the end of a block. */
  DEDENT,
  ENDMARKER;

  /** Whether this token carries no syntax of its own and may be skipped by lookahead. */
  public boolean isFormatting() {
    return this == COMMENT || this == NL || this == INDENT || this == DEDENT;
  }
}
