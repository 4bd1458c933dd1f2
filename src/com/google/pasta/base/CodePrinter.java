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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.pasta.syntax.Node;

/**
 * CodePrinter regenerates Python source from a syntax tree, annotated or not.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {

  private CodePrinter() {}

  /** Collects the generated code in memory. */
  private static final class StringCodePrinter extends CodeConsumer {
    private final StringBuilder code = new StringBuilder(1024);

    @Override
    char getLastChar() {
      return code.length() == 0 ? '\0' : code.charAt(code.length() - 1);
    }

    @Override
    void append(String str) {
      code.append(str);
    }

    String getCode() {
      return code.toString();
    }
  }

  public static final class Builder {
    private final Node root;
    private PrinterOptions options = new PrinterOptions();

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    public Builder setOptions(PrinterOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      StringCodePrinter printer = new StringCodePrinter();
      new CodeGenerator(printer, options).generate(root);
      printer.endFile();
      return printer.getCode();
    }
  }
}
