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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.pasta.syntax.Dependency;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.Formatting;
import com.google.pasta.syntax.JoinedForm;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Slot;
import com.google.pasta.syntax.Token;
import com.google.pasta.syntax.TokenType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Attaches {@link Formatting} to every node of a tree, reading the source the tree was parsed
 * from. The source is consumed once, left to right, and every character of it ends up in exactly
 * one slot, so that the {@link CodeGenerator} reproduces the source exactly.
 *
 * <p>Opening parentheses around an expression are read greedily with the prefix of the
 * outermost expression that starts after them. Each is later claimed by the innermost expression
 * that ends right before the matching closing parenthesis, and moved into that expression's
 * prefix.
 *
 * <p>Formatting is attached only once the whole source has been read. If annotation fails, the
 * tree is left as it was.
 */
public final class Annotator implements TraversalDriver {

  private static final Logger logger = Logger.getLogger(Annotator.class.getName());

  /** An opening parenthesis read with an expression's prefix and not yet claimed. */
  private static final class PendingParen {
    /** The expression whose prefix holds the parenthesis until it is claimed. */
    final Node holder;

    /** The parenthesis and the whitespace after it. */
    final String text;

    /** The source offset right after {@link #text}. */
    final int end;

    PendingParen(Node holder, String text, int end) {
      this.holder = holder;
      this.text = text;
      this.end = end;
    }
  }

  private final TokenStream stream;
  private final TraversalProtocol protocol = new TraversalProtocol(this);
  private final Map<Node, Formatting> formattings = new IdentityHashMap<>();
  private final Map<Node, List<Field>> argumentOrders = new IdentityHashMap<>();
  private final Deque<PendingParen> pendingParens = new ArrayDeque<>();

  private Annotator(String source) {
    this.stream = new TokenStream(source);
  }

  /**
   * Annotates {@code tree}, which must have been parsed from {@code source}.
   *
   * @throws AnnotationException if the tree does not match the source
   */
  public static void annotate(String source, Node tree) {
    checkArgument(tree.isKind(Kind.MODULE), "can only annotate modules, not %s", tree);
    Annotator annotator = new Annotator(source);
    annotator.visit(tree);
    annotator.finish();
    logger.fine(
        "Annotated " + annotator.formattings.size() + " nodes from " + source.length()
            + " characters");
  }

  private void finish() {
    if (!stream.isExhausted()) {
      throw new TokenMismatchException("source left after the end of the tree", stream.peek());
    }
    if (stream.depth() != 0 || !pendingParens.isEmpty()) {
      throw new TokenMismatchException("unclosed parentheses at the end of the source", null);
    }
    for (Map.Entry<Node, List<Field>> order : argumentOrders.entrySet()) {
      formattingOf(order.getKey()).setArgumentOrder(order.getValue());
    }
    for (Map.Entry<Node, Formatting> entry : formattings.entrySet()) {
      entry.getKey().setFormatting(entry.getValue());
    }
  }

  private Formatting formattingOf(Node node) {
    return formattings.computeIfAbsent(node, n -> new Formatting(n.getKind()));
  }

  @Override
  public void visit(Node child) {
    visit(child, "", "");
  }

  @Override
  public void visit(Node child, String defaultPrefix, String defaultSuffix) {
    Formatting formatting = formattingOf(child);
    if (!child.getKind().getCategory().hasAffixes()) {
      protocol.traverse(child, defaultPrefix);
      return;
    }

    int prefixStart = stream.position();
    StringBuilder prefix = new StringBuilder(stream.whitespace(true));
    if (child.getKind().isExpression()) {
      while (!stream.isExhausted() && stream.peek().isOp("(")) {
        String text = stream.token("(") + stream.whitespace(true);
        prefix.append(text);
        pendingParens.push(new PendingParen(child, text, stream.position()));
      }
    }
    int contentStart = stream.position();
    formatting.put(
        Slot.PREFIX, Formatting.Entry.capture(prefix.toString(), child, ImmutableList.of()));
    formatting.setPrefixDefault(defaultPrefix);

    protocol.traverse(child, "");

    // Once a parenthesis is claimed, only one opened right before it can enclose the child too.
    StringBuilder suffix = new StringBuilder();
    int claimedStart = -1;
    while (!pendingParens.isEmpty()) {
      PendingParen paren = pendingParens.peek();
      boolean encloses =
          claimedStart < 0
              ? paren.end >= prefixStart && paren.end <= contentStart
              : paren.end == claimedStart;
      if (!encloses || !stream.peekSignificant().isOp(")")) {
        break;
      }
      suffix.append(stream.whitespace(true)).append(stream.token(")"));
      pendingParens.pop();
      claimedStart = paren.end - paren.text.length();
      if (paren.holder != child) {
        moveParen(paren, child);
      }
    }
    if (stream.depth() > 0 || !atEndOfLine()) {
      suffix.append(stream.whitespace(true));
    }
    formatting.put(
        Slot.SUFFIX, Formatting.Entry.capture(suffix.toString(), child, ImmutableList.of()));
  }

  /** Whether only spaces remain before a comment or the end of the line. */
  private boolean atEndOfLine() {
    TokenType type = stream.peek().getType();
    return type == TokenType.COMMENT
        || type == TokenType.NL
        || type == TokenType.NEWLINE
        || type == TokenType.ENDMARKER;
  }

  /** Moves a claimed parenthesis from the end of its holder's prefix to the claimer's prefix. */
  private void moveParen(PendingParen paren, Node claimer) {
    Formatting holder = formattingOf(paren.holder);
    Formatting.Entry holderPrefix = holder.get(Slot.PREFIX);
    String text = holderPrefix.getText();
    checkState(text.endsWith(paren.text), "'%s' is not at the end of '%s'", paren.text, text);
    holder.put(
        Slot.PREFIX, holderPrefix.withText(text.substring(0, text.length() - paren.text.length())));

    Formatting claimed = formattingOf(claimer);
    Formatting.Entry claimerPrefix = claimed.get(Slot.PREFIX);
    claimed.put(Slot.PREFIX, claimerPrefix.withText(paren.text + claimerPrefix.getText()));
  }

  /**
   * Records the joined form, and the indentation of the line the joined statement's header shares,
   * which is where its block is indented from.
   */
  @Override
  public void visitJoined(Node parent, Node child, JoinedForm form) {
    Formatting formatting = formattingOf(child);
    formatting.setJoinedForm(form);
    formatting.setJoinedIndentation(
        form == JoinedForm.ELIF ? currentLineIndentation() : lineIndentationOf(parent));
    protocol.traverseJoined(child, form);
  }

  private String lineIndentationOf(Node statement) {
    Formatting formatting = formattingOf(statement);
    if (formatting.getIndentation() != null) {
      return formatting.getIndentation();
    }
    return formatting.getJoinedIndentation() != null ? formatting.getJoinedIndentation() : "";
  }

  /** The leading spaces and tabs of the line holding the current position. */
  private String currentLineIndentation() {
    String source = stream.getSource();
    int lineStart = stream.position();
    while (lineStart > 0 && !isLineBreak(source.charAt(lineStart - 1))) {
      lineStart--;
    }
    int end = lineStart;
    while (end < source.length() && isIndentation(source.charAt(end))) {
      end++;
    }
    return source.substring(lineStart, end);
  }

  @Override
  public void token(String text) {
    stream.token(text);
  }

  @Override
  public String attr(
      Node node, Slot slot, List<Part> parts, String defaultText, Dependency... dependencies) {
    String text = consume(parts);
    formattingOf(node)
        .put(slot, Formatting.Entry.capture(text, node, ImmutableList.copyOf(dependencies)));
    return text;
  }

  @Override
  public String attr(
      Node node,
      Slot slot,
      int index,
      List<Part> parts,
      String defaultText,
      Dependency... dependencies) {
    String text = consume(parts);
    formattingOf(node)
        .put(slot, index, Formatting.Entry.capture(text, node, ImmutableList.copyOf(dependencies)));
    return text;
  }

  private String consume(List<Part> parts) {
    StringBuilder text = new StringBuilder();
    for (Part part : parts) {
      text.append(part.consume(stream));
    }
    return text.toString();
  }

  /** Records the indentation of statements that start their own line. */
  @Override
  public void statementStarted(Node statement) {
    String source = stream.getSource();
    int pos = stream.position();
    int lineStart = pos;
    while (lineStart > 0 && !isLineBreak(source.charAt(lineStart - 1))) {
      lineStart--;
    }
    String indentation = source.substring(lineStart, pos);
    if (indentation.chars().allMatch(c -> isIndentation((char) c))) {
      formattingOf(statement).setIndentation(indentation);
    }
  }

  private static boolean isLineBreak(char c) {
    return c == '\n' || c == '\r';
  }

  private static boolean isIndentation(char c) {
    return c == ' ' || c == '\t' || c == '\f';
  }

  @Override
  public String indent() {
    return "";
  }

  @Override
  public void beginBlock(Node parent, Field field) {}

  @Override
  public void endBlock() {}

  @Override
  public boolean isElif(Node node) {
    Token next = stream.peekSignificant();
    if (next.isName("else")) {
      return false;
    }
    List<Node> orelse = node.getNonNullChildren(Field.ORELSE);
    if (next.isName("elif") && orelse.size() == 1 && orelse.get(0).isKind(Kind.IF)) {
      return true;
    }
    throw new AmbiguityResolutionException("expected 'else' or 'elif' for " + node, next);
  }

  @Override
  public boolean isContinuedWith(Node node) {
    Token next = stream.peekSignificant();
    if (next.isOp(":")) {
      return false;
    }
    List<Node> body = node.getNonNullChildren(Field.BODY);
    if (next.isOp(",") && body.size() == 1 && body.get(0).isKind(Kind.WITH)) {
      return true;
    }
    throw new AmbiguityResolutionException("expected ':' or ',' for " + node, next);
  }

  /**
   * Looks ahead for the clause that ends the {@code try} block: {@code except} means the single
   * TRY_EXCEPT in the body shares the {@code try:} line.
   */
  @Override
  public boolean isJoinedTry(Node node) {
    List<Node> body = node.getNonNullChildren(Field.BODY);
    boolean canJoin = body.size() == 1 && body.get(0).isKind(Kind.TRY_EXCEPT);
    int depth = 0;
    for (int i = 0; ; i++) {
      Token token = stream.lookahead(i);
      if (token.getType() == TokenType.INDENT) {
        depth++;
      } else if (token.getType() == TokenType.DEDENT) {
        depth--;
      } else if (depth == 0 && token.isName("except") && canJoin) {
        return true;
      } else if (depth == 0 && token.isName("finally")) {
        return false;
      } else if (depth == 0 && token.isName("except")) {
        throw new AmbiguityResolutionException("unexpected 'except' in " + node, token);
      } else if (token.getType() == TokenType.ENDMARKER) {
        throw new AmbiguityResolutionException("no 'finally' found for " + node, token);
      }
    }
  }

  /** Reads whether the next argument is a keyword argument and records the outcome. */
  @Override
  public boolean keywordNext(Node node, int positionalSeen, int keywordsSeen) {
    Field positionalField = node.isKind(Kind.CLASS_DEF) ? Field.BASES : Field.ARGS;
    boolean keyword;
    if (positionalSeen >= node.childCount(positionalField)) {
      keyword = true;
    } else if (keywordsSeen >= node.childCount(Field.KEYWORDS)) {
      keyword = false;
    } else {
      Token next = stream.peekSignificant();
      keyword =
          next.isOp("**")
              || (next.getType() == TokenType.NAME && stream.peekSignificant(1).isOp("="));
    }
    argumentOrders
        .computeIfAbsent(node, n -> new ArrayList<>())
        .add(keyword ? Field.KEYWORDS : positionalField);
    return keyword;
  }
}
