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

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {

  private boolean lastReplayed;

  /** Retrieve the last character of the last string sent to append, or 0 if there is none. */
  abstract char getLastChar();

  /** Appends a string to the code exactly as given. */
  abstract void append(String str);

  /**
   * Appends a piece of code, separating it from the previous one if two word characters would
   * otherwise run together.
   */
  void add(String newcode) {
    add(newcode, false);
  }

  /**
   * Appends a piece of code. Two pieces that were both spelled as read from the source are never
   * separated: the source already separates them where needed.
   */
  void add(String newcode, boolean replayed) {
    if (newcode.isEmpty()) {
      return;
    }
    char c = newcode.charAt(0);
    if (!(replayed && lastReplayed) && isWordChar(c) && isWordChar(getLastChar())) {
      // need space to separate. This is not pretty printing.
      // For example: "return x"
      append(" ");
    }
    append(newcode);
    lastReplayed = replayed;
  }

  static boolean isWordChar(char ch) {
    return ch == '_' || Character.isLetterOrDigit(ch);
  }

  /** Called when we're at the end of a file. */
  void endFile() {}
}
