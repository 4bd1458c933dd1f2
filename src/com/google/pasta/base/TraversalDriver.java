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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pasta.syntax.Dependency;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.JoinedForm;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Slot;
import java.util.List;

/**
 * The operations the {@link TraversalProtocol} is written against. The {@link Annotator} reads
 * each operation's text from the source; the {@link CodeGenerator} writes it out.
 */
interface TraversalDriver {

  /** Visits a statement, clause or group child. */
  void visit(Node child);

  /**
   * Visits a child, capturing its PREFIX and SUFFIX if its kind has them. Expressions also carry
   * their enclosing parentheses in the affixes. Groups receive {@code defaultPrefix} as the
   * default spacing before their first element.
   */
  void visit(Node child, String defaultPrefix, String defaultSuffix);

  /** Visits a statement spelled as part of its parent; see {@link JoinedForm}. */
  void visitJoined(Node parent, Node child, JoinedForm form);

  /** A bare token whose text follows from the tree. */
  void token(String text);

  /**
   * A formatting slot. Returns the slot's text: the consumed source when annotating, the emitted
   * text when generating.
   */
  @CanIgnoreReturnValue
  String attr(
      Node node, Slot slot, List<Part> parts, String defaultText, Dependency... dependencies);

  /** An indexed formatting slot, captured once per element of a list field. */
  @CanIgnoreReturnValue
  String attr(
      Node node,
      Slot slot,
      int index,
      List<Part> parts,
      String defaultText,
      Dependency... dependencies);

  /** Called right after the PREFIX of a statement that may start a line. */
  void statementStarted(Node statement);

  /** The indentation of statements in the innermost block being traversed. */
  String indent();

  void beginBlock(Node parent, Field field);

  void endBlock();

  /** Whether the single ORELSE statement of {@code node} is spelled {@code elif}. */
  boolean isElif(Node node);

  /** Whether the single body statement of a WITH continues its item list. */
  boolean isContinuedWith(Node node);

  /** Whether the single body statement of a TRY_FINALLY shares its {@code try:} line. */
  boolean isJoinedTry(Node node);

  /**
   * Whether the next argument of a call or class definition is taken from KEYWORDS, given how
   * many positional and keyword arguments have been traversed.
   */
  boolean keywordNext(Node node, int positionalSeen, int keywordsSeen);
}
