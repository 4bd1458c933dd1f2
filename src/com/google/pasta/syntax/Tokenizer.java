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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Python source into {@link Token}s the way the standard {@code tokenize} module does.
 *
 * <p>Every character of the source is either inside exactly one token or in the gap between two
 * tokens. Gaps hold only spaces, tabs, form feeds and backslash line continuations; newlines and
 * comments are always tokens. Indentation that opens a block is the text of its INDENT token, all
 * other indentation is gap text.
 */
public final class Tokenizer {

  private static final String DIGITS = "[0-9](?:_?[0-9])*";

  private static final Pattern NUMBER =
      Pattern.compile(
          "0[xX](?:_?[0-9a-fA-F])+"
              + "|0[bB](?:_?[01])+"
              + "|0[oO](?:_?[0-7])+"
              + "|(?:(?:" + DIGITS + ")?\\." + DIGITS + "|" + DIGITS + "\\.?)"
              + "(?:[eE][-+]?" + DIGITS + ")?[jJ]?");

  /** Operators and delimiters, longest first so that matching is greedy. */
  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "**=", "//=", ">>=", "<<=", "...",
          "->", "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "+=", "-=", "*=", "/=", "%=",
          "&=", "|=", "^=", "@=", ":=",
          "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{",
          "}", ",", ":", ";", ".", "=");

  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "u", "b", "br", "rb", "f", "fr", "rf");

  private final String source;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private final Deque<Integer> indents = new ArrayDeque<>();

  private int pos = 0;
  private int lineno = 1;
  private int lineStart = 0;
  private int depth = 0;
  private boolean lineHasTokens = false;

  private Tokenizer(String source) {
    this.source = source;
    indents.push(0);
  }

  /** Tokenizes {@code source}; the result always ends with an ENDMARKER. */
  public static ImmutableList<Token> tokenize(String source) {
    Tokenizer tokenizer = new Tokenizer(source);
    tokenizer.run();
    return tokenizer.tokens.build();
  }

  private void run() {
    while (pos < source.length()) {
      if (depth == 0 && !lineHasTokens && !startLogicalLine()) {
        break;
      }
      scanLine();
    }
    if (depth > 0) {
      throw error("unexpected end of file inside brackets");
    }
    if (lineHasTokens) {
      emit(TokenType.NEWLINE, pos, pos);
    }
    while (indents.peek() > 0) {
      indents.pop();
      emit(TokenType.DEDENT, pos, pos);
    }
    emit(TokenType.ENDMARKER, pos, pos);
  }

  /**
   * Handles the indentation of a physical line that starts a logical line. Returns false if only
   * whitespace remains in the source.
   */
  private boolean startLogicalLine() {
    int p = pos;
    int column = 0;
    while (p < source.length()) {
      char c = source.charAt(p);
      if (c == ' ') {
        column++;
      } else if (c == '\t') {
        column = (column / 8 + 1) * 8;
      } else if (c != '\f') {
        break;
      }
      p++;
    }
    if (p >= source.length()) {
      pos = p;
      return false;
    }
    char c = source.charAt(p);
    if (c == '#' || c == '\n' || c == '\r' || (c == '\\' && isLineBreakAt(p + 1))) {
      // Blank and comment-only lines never change the indentation.
      pos = p;
      return true;
    }
    if (column > indents.peek()) {
      indents.push(column);
      emit(TokenType.INDENT, pos, p);
    } else {
      while (column < indents.peek()) {
        indents.pop();
        emit(TokenType.DEDENT, p, p);
      }
      if (column != indents.peek()) {
        pos = p;
        throw error("unindent does not match any outer indentation level");
      }
    }
    pos = p;
    return true;
  }

  /** Scans tokens up to and including the next NEWLINE or NL, or to the end of the source. */
  private void scanLine() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\f') {
        pos++;
      } else if (c == '\\' && isLineBreakAt(pos + 1)) {
        pos++;
        pos += lineBreakLength(pos);
        newLine();
      } else if (c == '#') {
        int end = pos;
        while (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != '\r') {
          end++;
        }
        emit(TokenType.COMMENT, pos, end);
      } else if (c == '\n' || c == '\r') {
        int end = pos + lineBreakLength(pos);
        if (depth > 0 || !lineHasTokens) {
          emit(TokenType.NL, pos, end);
        } else {
          emit(TokenType.NEWLINE, pos, end);
          lineHasTokens = false;
        }
        newLine();
        return;
      } else if (isIdentifierStart(c)) {
        scanName();
      } else if (Character.isDigit(c)
          || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
        scanNumber();
      } else if (c == '\'' || c == '"') {
        scanString(pos, pos);
      } else {
        scanOperator();
      }
    }
  }

  private void scanName() {
    int end = pos + 1;
    while (end < source.length() && isIdentifierPart(source.charAt(end))) {
      end++;
    }
    if (end < source.length()
        && (source.charAt(end) == '\'' || source.charAt(end) == '"')
        && STRING_PREFIXES.contains(Ascii.toLowerCase(source.substring(pos, end)))) {
      scanString(pos, end);
      return;
    }
    emit(TokenType.NAME, pos, end);
  }

  private void scanNumber() {
    Matcher m = NUMBER.matcher(source).region(pos, source.length());
    if (!m.lookingAt()) {
      throw error("malformed number");
    }
    emit(TokenType.NUMBER, pos, m.end());
  }

  /** Scans a string literal whose prefix starts at {@code start} and quote at {@code quote}. */
  private void scanString(int start, int quote) {
    char q = source.charAt(quote);
    boolean triple = source.startsWith(String.valueOf(q).repeat(3), quote);
    int p = quote + (triple ? 3 : 1);
    int startLineno = lineno;
    int startCharno = start - lineStart;
    while (true) {
      if (p >= source.length()) {
        throw new ParseException("unterminated string literal", startLineno, startCharno);
      }
      char c = source.charAt(p);
      if (c == '\\' && p + 1 < source.length()) {
        if (isLineBreakAt(p + 1)) {
          p += 1 + lineBreakLength(p + 1);
          newLineAt(p);
        } else {
          p += 2;
        }
      } else if (triple && source.startsWith(String.valueOf(q).repeat(3), p)) {
        p += 3;
        break;
      } else if (!triple && c == q) {
        p++;
        break;
      } else if (c == '\n' || c == '\r') {
        if (!triple) {
          throw new ParseException("unterminated string literal", startLineno, startCharno);
        }
        p += lineBreakLength(p);
        newLineAt(p);
      } else {
        p++;
      }
    }
    tokens.add(new Token(TokenType.STRING, source.substring(start, p), start, startLineno,
        startCharno));
    lineHasTokens = true;
    pos = p;
  }

  private void scanOperator() {
    for (String op : OPERATORS) {
      if (source.startsWith(op, pos)) {
        if (op.equals("(") || op.equals("[") || op.equals("{")) {
          depth++;
        } else if (op.equals(")") || op.equals("]") || op.equals("}")) {
          if (depth == 0) {
            throw error("unmatched '" + op + "'");
          }
          depth--;
        }
        emit(TokenType.OP, pos, pos + op.length());
        return;
      }
    }
    throw error("unexpected character '" + source.charAt(pos) + "'");
  }

  private void emit(TokenType type, int start, int end) {
    tokens.add(new Token(type, source.substring(start, end), start, lineno, start - lineStart));
    if (type != TokenType.COMMENT && type != TokenType.NL && type != TokenType.INDENT
        && type != TokenType.DEDENT) {
      lineHasTokens = true;
    }
    pos = end;
  }

  private void newLine() {
    newLineAt(pos);
  }

  private void newLineAt(int offset) {
    lineno++;
    lineStart = offset;
  }

  private boolean isLineBreakAt(int p) {
    return p < source.length() && (source.charAt(p) == '\n' || source.charAt(p) == '\r');
  }

  private int lineBreakLength(int p) {
    return source.startsWith("\r\n", p) ? 2 : 1;
  }

  private ParseException error(String message) {
    return new ParseException(message, lineno, pos - lineStart);
  }

  private static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  private static boolean isIdentifierPart(char c) {
    return c == '_'
        || Character.isLetterOrDigit(c)
        || Character.getType(c) == Character.NON_SPACING_MARK;
  }
}
