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

import com.google.pasta.syntax.Token;
import org.jspecify.annotations.Nullable;

/**
 * Base class of the failures of an annotation pass. The source position is that of the token the
 * pass stopped at, or -1 when the stream had no token left.
 */
@SuppressWarnings("serial")
public class AnnotationException extends RuntimeException {
  private final int lineNumber;
  private final int columnNumber;

  public AnnotationException(String details, int lineNumber, int columnNumber) {
    super(details);
    this.lineNumber = lineNumber;
    this.columnNumber = columnNumber;
  }

  AnnotationException(String details, @Nullable Token token) {
    this(
        token == null ? details : details + " (found " + token + ")",
        token == null ? -1 : token.getLineno(),
        token == null ? -1 : token.getCharno());
  }

  @Override
  public final String getMessage() {
    if (lineNumber < 0) {
      return details();
    }
    return details() + " (line " + lineNumber + ", column " + columnNumber + ")";
  }

  public String details() {
    return super.getMessage();
  }

  public final int lineNumber() {
    return lineNumber;
  }

  public final int columnNumber() {
    return columnNumber;
  }
}
