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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.pasta.syntax.Dependency;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.Formatting;
import com.google.pasta.syntax.JoinedForm;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Slot;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * CodeGenerator generates code from a syntax tree, sending it to the specified CodeConsumer.
 *
 * <p>Each formatting slot replays the text the {@link Annotator} captured, as long as the values
 * it was captured under are unchanged. Slots of new or edited nodes fall back to a default
 * spelling. The tree is never modified.
 */
public class CodeGenerator implements TraversalDriver {

  /** Slots holding the line break and indentation before a statement or clause keyword. */
  private static final ImmutableSet<Slot> LINE_START_SLOTS =
      Sets.immutableEnumSet(Slot.PREFIX, Slot.ELSE_PREFIX, Slot.FINALLY_PREFIX);

  private static final CharMatcher SPACING = CharMatcher.anyOf(" \t\f");
  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  private final CodeConsumer cc;
  private final PrinterOptions options;
  private final TraversalProtocol protocol = new TraversalProtocol(this);

  private final Deque<String> indents = new ArrayDeque<>();
  private final Deque<Node> ancestors = new ArrayDeque<>();
  private final Deque<Reindent> reindents = new ArrayDeque<>();

  /**
   * Moves captured indentation of a statement that was read joined to its parent and is now
   * generated nested: lines indented under {@code from} in the source are indented under {@code
   * to} in the output.
   */
  private static final class Reindent {
    final String from;
    final String to;

    Reindent(String from, String to) {
      this.from = from;
      this.to = to;
    }

    String apply(String indentation) {
      return indentation.startsWith(from) ? to + indentation.substring(from.length()) : indentation;
    }
  }

  CodeGenerator(CodeConsumer consumer, PrinterOptions options) {
    this.cc = consumer;
    this.options = options;
  }

  void generate(Node root) {
    visit(root);
    checkState(indents.isEmpty() && ancestors.isEmpty(), "unbalanced traversal");
  }

  @Override
  public void visit(Node child) {
    visit(child, "", "");
  }

  @Override
  public void visit(Node child, String defaultPrefix, String defaultSuffix) {
    Formatting formatting = child.getFormatting();
    if (!child.getKind().getCategory().hasAffixes()) {
      if (formatting != null
          && formatting.getJoinedForm() != null
          && formatting.getJoinedIndentation() != null) {
        // Read joined to its parent, generated nested.
        reindents.push(new Reindent(formatting.getJoinedIndentation(), indent()));
        traverse(child, defaultPrefix);
        reindents.pop();
      } else {
        traverse(child, defaultPrefix);
      }
      return;
    }
    boolean prefixReplayed =
        isReplayed(child, formatting, Slot.PREFIX) && keepsPrefix(formatting, defaultPrefix);
    String prefix = prefixReplayed ? formatting.get(Slot.PREFIX).getText() : defaultPrefix;
    boolean parenthesize = !prefix.contains("(") && needsParentheses(child, formatting);
    add(prefix, prefixReplayed);
    if (parenthesize) {
      cc.add("(");
    }
    traverse(child, "");
    if (parenthesize) {
      cc.add(")");
    }
    String suffix = replay(child, formatting, Slot.SUFFIX, defaultSuffix);
    add(suffix, isReplayed(child, formatting, Slot.SUFFIX));
  }

  /**
   * Whether a captured PREFIX fits where the node now stands. Plain spacing read at a position with
   * another default does not, as when the first element of a list is removed and the second takes
   * its place.
   */
  private static boolean keepsPrefix(Formatting formatting, String defaultPrefix) {
    String captured = formatting.get(Slot.PREFIX).getText();
    return formatting.getPrefixDefault() == null
        || formatting.getPrefixDefault().equals(defaultPrefix)
        || !SPACING.matchesAllOf(captured);
  }

  private void add(String text, boolean replayed) {
    cc.add(text, replayed);
  }

  private void traverse(Node node, String lead) {
    ancestors.push(node);
    protocol.traverse(node, lead);
    ancestors.pop();
  }

  private boolean needsParentheses(Node child, @Nullable Formatting formatting) {
    if (!child.getKind().isExpression()) {
      return false;
    }
    Node parent = ancestors.peek();
    if (child.isKind(Kind.NUM) && isReplayed(child, formatting, Slot.CONTENT)) {
      // The source spelling is already valid where it stands, as in "1 .real".
      return false;
    }
    boolean isNew = formatting == null || formatting.get(Slot.PREFIX) == null;
    if (isNew && (child.isKind(Kind.TUPLE) || child.isKind(Kind.GENERATOR_EXP))) {
      boolean isSlice =
          parent != null
              && parent.isKind(Kind.SUBSCRIPT)
              && NodeUtil.fieldOf(parent, child) == Field.SLICE;
      return !isSlice;
    }
    return options.shouldParenthesizeByPrecedence() && NodeUtil.needsParentheses(parent, child);
  }

  @Override
  public void visitJoined(Node parent, Node child, JoinedForm form) {
    ancestors.push(child);
    protocol.traverseJoined(child, form);
    ancestors.pop();
  }

  /** Tokens of an annotated node are spelled as they were read. */
  @Override
  public void token(String text) {
    Node node = ancestors.peek();
    cc.add(text, node != null && node.getFormatting() != null);
  }

  @Override
  public String attr(
      Node node, Slot slot, List<Part> parts, String defaultText, Dependency... dependencies) {
    Formatting formatting = node.getFormatting();
    boolean replayed = isReplayed(node, formatting, slot);
    String text = replayed ? formatting.get(slot).getText() : defaultText;
    if (LINE_START_SLOTS.contains(slot)) {
      text = startLine(node, slot, text, replayed);
    }
    add(text, replayed);
    return text;
  }

  /**
   * Adjusts the text that leads up to a statement or clause keyword: breaks the line if the
   * output so far does not end one, and moves captured indentation under a {@link Reindent}.
   */
  private String startLine(Node node, Slot slot, String text, boolean replayed) {
    char last = cc.getLastChar();
    boolean startsOwnLine =
        !replayed
            || slot != Slot.PREFIX
            || !node.getKind().isStatement()
            || node.getFormatting().getIndentation() != null;
    boolean atLineStart = last == '\0' || last == '\n' || last == '\r';
    boolean lineBreak =
        startsOwnLine && !atLineStart && text.indexOf('\n') < 0 && text.indexOf('\r') < 0;
    if (replayed && !reindents.isEmpty()) {
      text = reindent(text, lineBreak || atLineStart, reindents.peek());
    }
    return lineBreak ? "\n" + text : text;
  }

  /**
   * Applies {@code reindent} to every line of {@code text} that starts a statement or a comment.
   * The first line counts only if the text starts at the beginning of a line.
   */
  private static String reindent(String text, boolean atLineStart, Reindent reindent) {
    List<String> lines = LINE_SPLITTER.splitToList(text);
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (i > 0) {
        sb.append('\n');
      }
      boolean last = i == lines.size() - 1;
      boolean blank = SPACING.or(CharMatcher.is('\r')).matchesAllOf(line);
      if ((i > 0 || atLineStart) && (last || !blank)) {
        int end = SPACING.negate().indexIn(line);
        end = end < 0 ? line.length() : end;
        sb.append(reindent.apply(line.substring(0, end))).append(line, end, line.length());
      } else {
        sb.append(line);
      }
    }
    return sb.toString();
  }

  @Override
  public String attr(
      Node node,
      Slot slot,
      int index,
      List<Part> parts,
      String defaultText,
      Dependency... dependencies) {
    Formatting formatting = node.getFormatting();
    Formatting.Entry entry = formatting == null ? null : formatting.get(slot, index);
    boolean replayed = entry != null && entry.isValidFor(node);
    String text = replayed ? entry.getText() : defaultText;
    add(text, replayed);
    return text;
  }

  private static String replay(
      Node node, @Nullable Formatting formatting, Slot slot, String defaultText) {
    return isReplayed(node, formatting, slot) ? formatting.get(slot).getText() : defaultText;
  }

  private static boolean isReplayed(Node node, @Nullable Formatting formatting, Slot slot) {
    Formatting.Entry entry = formatting == null ? null : formatting.get(slot);
    return entry != null && entry.isValidFor(node);
  }

  @Override
  public void statementStarted(Node statement) {}

  @Override
  public String indent() {
    return indents.isEmpty() ? "" : indents.peek();
  }

  /**
   * Enters a block. Its indentation is copied from the first of its statements that was
   * annotated at the start of a line, so that new statements line up with existing ones.
   */
  @Override
  public void beginBlock(Node parent, Field field) {
    String indentation = null;
    for (Node statement : parent.getNonNullChildren(field)) {
      Formatting formatting = statement.getFormatting();
      if (formatting != null && formatting.getIndentation() != null) {
        indentation = formatting.getIndentation();
        if (!reindents.isEmpty()) {
          indentation = reindents.peek().apply(indentation);
        }
        break;
      }
    }
    indents.push(indentation != null ? indentation : indent() + options.getIndentUnit());
  }

  @Override
  public void endBlock() {
    indents.pop();
  }

  @Override
  public boolean isElif(Node node) {
    List<Node> orelse = node.getNonNullChildren(Field.ORELSE);
    return orelse.size() == 1
        && orelse.get(0).isKind(Kind.IF)
        && joinedFormOf(orelse.get(0), JoinedForm.ELIF) == JoinedForm.ELIF;
  }

  @Override
  public boolean isContinuedWith(Node node) {
    List<Node> body = node.getNonNullChildren(Field.BODY);
    return body.size() == 1
        && body.get(0).isKind(Kind.WITH)
        && joinedFormOf(body.get(0), null) == JoinedForm.CONTINUED_WITH;
  }

  @Override
  public boolean isJoinedTry(Node node) {
    List<Node> body = node.getNonNullChildren(Field.BODY);
    return body.size() == 1
        && body.get(0).isKind(Kind.TRY_EXCEPT)
        && joinedFormOf(body.get(0), JoinedForm.JOINED_TRY) == JoinedForm.JOINED_TRY;
  }

  /** The recorded joined form of a statement, or {@code unannotated} if it has no formatting. */
  private static @Nullable JoinedForm joinedFormOf(
      Node statement, @Nullable JoinedForm unannotated) {
    Formatting formatting = statement.getFormatting();
    return formatting == null ? unannotated : formatting.getJoinedForm();
  }

  /**
   * Replays the recorded argument order if the argument counts are unchanged; otherwise puts
   * positional arguments first.
   */
  @Override
  public boolean keywordNext(Node node, int positionalSeen, int keywordsSeen) {
    Field positionalField = node.isKind(Kind.CLASS_DEF) ? Field.BASES : Field.ARGS;
    int positionalCount = node.childCount(positionalField);
    int keywordCount = node.childCount(Field.KEYWORDS);
    Formatting formatting = node.getFormatting();
    ImmutableList<Field> order = formatting == null ? null : formatting.getArgumentOrder();
    if (order != null
        && order.size() == positionalCount + keywordCount
        && countOf(order, Field.KEYWORDS) == keywordCount) {
      return order.get(positionalSeen + keywordsSeen) == Field.KEYWORDS;
    }
    return positionalSeen >= positionalCount;
  }

  private static int countOf(List<Field> order, Field field) {
    int count = 0;
    for (Field f : order) {
      if (f == field) {
        count++;
      }
    }
    return count;
  }
}
