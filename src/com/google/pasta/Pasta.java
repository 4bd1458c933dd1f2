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

package com.google.pasta;

import com.google.pasta.base.Annotator;
import com.google.pasta.base.CodePrinter;
import com.google.pasta.base.PrinterOptions;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Parser;

/**
 * Entry points for format-preserving edits of Python source.
 *
 * <pre>{@code
 * Node tree = Pasta.parse(source);
 * // ... edit the tree ...
 * String edited = Pasta.dump(tree);
 * }</pre>
 *
 * For any source that parses, {@code dump(parse(source))} is {@code source}.
 */
public final class Pasta {

  private Pasta() {}

  /**
   * Parses {@code source} into a module with formatting attached to every node.
   *
   * @throws com.google.pasta.syntax.ParseException if the source is not valid Python
   * @throws com.google.pasta.base.AnnotationException if the formatting cannot be captured
   */
  public static Node parse(String source) {
    Node tree = Parser.parse(source);
    Annotator.annotate(source, tree);
    return tree;
  }

  /** Attaches formatting read from {@code source} to a tree parsed from it. */
  public static void annotate(String source, Node tree) {
    Annotator.annotate(source, tree);
  }

  /** Generates source for {@code tree}, keeping the captured formatting of unchanged nodes. */
  public static String dump(Node tree) {
    return dump(tree, new PrinterOptions());
  }

  public static String dump(Node tree, PrinterOptions options) {
    return new CodePrinter.Builder(tree).setOptions(options).build();
  }
}
