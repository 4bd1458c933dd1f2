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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pasta.syntax.Token;
import com.google.pasta.syntax.TokenType;
import com.google.pasta.syntax.Tokenizer;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A forward-only cursor over the tokens of one source text. Every method that advances returns
 * the exact source text it consumed, so that a sequence of calls partitions the source.
 *
 * <p>Text between two tokens (the gap) holds only spaces, tabs and line continuations. It is
 * consumed by {@link #whitespace}; the strict methods {@link #next} and {@link #token} refuse to
 * skip it.
 *
 * <p>The stream also tracks the open grouping tokens, {@code (}, {@code [} and {@code {}. While
 * one is open, line breaks and comments are part of the whitespace of a single logical line.
 */
public final class TokenStream {

  private final String source;
  private final ImmutableList<Token> tokens;
  private final Deque<Token> groups = new ArrayDeque<>();

  private int index = 0;
  private int pos = 0;

  private int markedIndex = -1;
  private int markedPos = -1;

  public TokenStream(String source) {
    this.source = source;
    this.tokens = Tokenizer.tokenize(source);
  }

  public String getSource() {
    return source;
  }

  /** The offset of the first source character not yet consumed. */
  public int position() {
    return pos;
  }

  /** The number of grouping tokens currently open. */
  public int depth() {
    return groups.size();
  }

  /** Whether every token, the final ENDMARKER included, has been consumed. */
  public boolean isExhausted() {
    return index >= tokens.size();
  }

  /** Returns the next token without consuming it or the gap before it. */
  public Token peek() {
    if (isExhausted()) {
      throw new ExhaustedStreamException("no tokens left", null);
    }
    return tokens.get(index);
  }

  /** Returns the next token that is not a comment, line break within a statement or indent. */
  public Token peekSignificant() {
    return peekSignificant(0);
  }

  /** Returns the significant token {@code ahead} positions after the next one. */
  public Token peekSignificant(int ahead) {
    int seen = 0;
    for (int i = index; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.getType().isFormatting()) {
        continue;
      }
      if (seen++ == ahead) {
        return token;
      }
    }
    throw new ExhaustedStreamException("no significant tokens left", null);
  }

  /**
   * Consumes and returns the next token.
   *
   * @throws ExhaustedStreamException if no tokens remain
   * @throws TokenMismatchException if whitespace before the token was not consumed first
   */
  public Token next() {
    Token token = peek();
    if (token.getStart() != pos) {
      throw new TokenMismatchException(
          "uncaptured text '" + source.substring(pos, token.getStart()) + "'", token);
    }
    index++;
    pos = token.getEnd();
    return token;
  }

  /**
   * Consumes the next token, which must have the given text. Grouping tokens are pushed onto and
   * popped off the grouping stack.
   */
  @CanIgnoreReturnValue
  public String token(String text) {
    Token token = peek();
    if (!token.getText().equals(text) || token.getType() == TokenType.STRING) {
      throw new TokenMismatchException("expected '" + text + "'", token);
    }
    next();
    if (token.getType() == TokenType.OP) {
      if (isOpening(text)) {
        hintOpen(token);
      } else if (isClosing(text)) {
        hintClosed(token);
      }
    }
    return text;
  }

  /**
   * Consumes whitespace and {@code text} if {@code text} is the next significant token; consumes
   * nothing otherwise.
   */
  public String optional(String text) {
    if (!peekSignificant().getText().equals(text)) {
      return "";
    }
    int start = pos;
    whitespace(true);
    token(text);
    return source.substring(start, pos);
  }

  /**
   * Greedily consumes gaps and formatting tokens: comments, line breaks, indents and dedents.
   * With {@code oneline}, line breaks and comments are only consumed while a grouping token is
   * open.
   */
  public String whitespace(boolean oneline) {
    int start = pos;
    while (!isExhausted()) {
      Token token = tokens.get(index);
      pos = token.getStart();
      boolean lineBreak =
          token.getType() == TokenType.COMMENT
              || token.getType() == TokenType.NL
              || token.getType() == TokenType.NEWLINE;
      if (lineBreak && oneline && groups.isEmpty()) {
        break;
      }
      if (!lineBreak
          && token.getType() != TokenType.INDENT
          && token.getType() != TokenType.DEDENT) {
        break;
      }
      index++;
      pos = token.getEnd();
    }
    return source.substring(start, pos);
  }

  /**
   * Consumes the end of a simple statement: trailing spaces, an optional semicolon, an optional
   * comment and the line break. Stops before the next statement if the semicolon is followed by
   * one on the same line.
   */
  public String endOfLine() {
    int start = pos;
    skipGap();
    if (!isExhausted() && tokens.get(index).isOp(";")) {
      next();
      skipGap();
    }
    if (!isExhausted() && tokens.get(index).getType() == TokenType.COMMENT) {
      next();
    }
    if (!isExhausted() && tokens.get(index).getType() == TokenType.NEWLINE) {
      next();
    }
    return source.substring(start, pos);
  }

  /** Consumes a string literal, including the implicit concatenation of adjacent ones. */
  public String str() {
    int start = pos;
    Token first = next();
    if (first.getType() != TokenType.STRING) {
      throw new TokenMismatchException("expected a string literal", first);
    }
    while (true) {
      mark();
      whitespace(true);
      if (isExhausted() || tokens.get(index).getType() != TokenType.STRING) {
        reset();
        break;
      }
      next();
    }
    return source.substring(start, pos);
  }

  /** Consumes a number literal. */
  public String number() {
    Token token = next();
    if (token.getType() != TokenType.NUMBER) {
      throw new TokenMismatchException("expected a number literal", token);
    }
    return token.getText();
  }

  /**
   * Consumes everything up to and including the next token of {@code type}.
   *
   * @throws LexicalMismatchException if the stream ends first
   */
  public String nextOfType(TokenType type) {
    int start = pos;
    for (int i = index; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.getType() == type) {
        index = i + 1;
        pos = token.getEnd();
        return source.substring(start, pos);
      }
    }
    throw new LexicalMismatchException("no " + type + " token found", null);
  }

  /** Consumes the dots of a relative import, possibly spelled as ellipses. */
  public String dots(int level) {
    checkArgument(level >= 0);
    int start = pos;
    int seen = 0;
    while (seen < level) {
      if (seen > 0) {
        whitespace(true);
      }
      Token token = next();
      if (token.isOp(".")) {
        seen++;
      } else if (token.isOp("...")) {
        seen += 3;
      } else {
        throw new TokenMismatchException("expected " + (level - seen) + " more dots", token);
      }
    }
    if (seen != level) {
      throw new TokenMismatchException("too many dots", tokens.get(index - 1));
    }
    return source.substring(start, pos);
  }

  /** Consumes a dotted name such as {@code os.path}, whitespace included. */
  public String dottedName(String name) {
    int start = pos;
    boolean first = true;
    for (String part : name.split("\\.", -1)) {
      if (!first) {
        whitespace(true);
        token(".");
      }
      whitespace(true);
      token(part);
      first = false;
    }
    return source.substring(start, pos);
  }

  /** Consumes the end marker, which must be the next token. */
  public String endOfFile() {
    Token token = next();
    if (token.getType() != TokenType.ENDMARKER) {
      throw new TokenMismatchException("expected the end of the file", token);
    }
    return token.getText();
  }

  /** Records that a grouping token was opened. */
  public void hintOpen(Token token) {
    groups.push(token);
  }

  /** Records that the innermost grouping token was closed. */
  public void hintClosed(Token token) {
    if (groups.isEmpty()) {
      throw new TokenMismatchException("no open group to close", token);
    }
    groups.pop();
  }

  /** Returns the token {@code offset} positions after the next one, formatting tokens included. */
  Token lookahead(int offset) {
    int i = index + offset;
    if (i >= tokens.size()) {
      throw new ExhaustedStreamException("no tokens left", null);
    }
    return tokens.get(i);
  }

  void mark() {
    markedIndex = index;
    markedPos = pos;
  }

  void reset() {
    checkState(markedIndex >= 0, "reset without mark");
    index = markedIndex;
    pos = markedPos;
    markedIndex = -1;
    markedPos = -1;
  }

  private void skipGap() {
    if (!isExhausted()) {
      pos = tokens.get(index).getStart();
    }
  }

  private static boolean isOpening(String text) {
    return text.equals("(") || text.equals("[") || text.equals("{");
  }

  private static boolean isClosing(String text) {
    return text.equals(")") || text.equals("]") || text.equals("}");
  }
}
