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

/**
 * Thrown by the {@link Tokenizer} and the {@link Parser} for source text they cannot accept.
 */
@SuppressWarnings("serial")
public class ParseException extends RuntimeException {
  private final int lineNumber;
  private final int columnNumber;

  public ParseException(String details, int lineNumber, int columnNumber) {
    super(details);
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  ParseException(String details, Token token) {
    this(details + " (found " + token + ")", token.getLineno(), token.getCharno());
  }

  @Override
  public final String getMessage() {
    return details() + " (line " + lineNumber + ", column " + columnNumber + ")";
  }

  public String details() {
    return super.getMessage();
  }

  /** One-based line of the offending text. */
  public final int lineNumber() {
    return lineNumber;
  }

  /** Zero-based column of the offending text. */
  public final int columnNumber() {
    return columnNumber;
  }
}
