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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Options for regenerating source from an annotated tree. */
public class PrinterOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  static final String DEFAULT_INDENT_UNIT = "    ";

  private String indentUnit = DEFAULT_INDENT_UNIT;
  private boolean parenthesizeByPrecedence = true;

  /**
   * The text added to the enclosing indentation for blocks that have no annotated statement to
   * copy their indentation from.
   */
  public String getIndentUnit() {
    return indentUnit;
  }

  public void setIndentUnit(String indentUnit) {
    checkArgument(
        !indentUnit.isEmpty() && indentUnit.chars().allMatch(c -> c == ' ' || c == '\t'),
        "indent unit must be spaces or tabs: '%s'",
        indentUnit);
    this.indentUnit = indentUnit;
  }

  /**
   * Whether to parenthesize new operands that bind more loosely than their parent requires.
   * Without it, new subtrees must already have the shape their spelling parses to.
   */
  public boolean shouldParenthesizeByPrecedence() {
    return parenthesizeByPrecedence;
  }

  public void setParenthesizeByPrecedence(boolean parenthesizeByPrecedence) {
    this.parenthesizeByPrecedence = parenthesizeByPrecedence;
  }
}
