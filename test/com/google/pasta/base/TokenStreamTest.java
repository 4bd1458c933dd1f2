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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.pasta.syntax.TokenType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TokenStreamTest {

  @Test
  public void testConsumesEverySourceCharacter() {
    TokenStream stream = new TokenStream("x = (1,\n  2)\n");
    StringBuilder consumed = new StringBuilder();
    consumed.append(stream.token("x"));
    consumed.append(stream.whitespace(true)).append(stream.token("="));
    consumed.append(stream.whitespace(true)).append(stream.token("("));
    assertThat(stream.depth()).isEqualTo(1);
    consumed.append(stream.number()).append(stream.token(","));
    String lineBreak = stream.whitespace(true);
    assertThat(lineBreak).isEqualTo("\n  ");
    consumed.append(lineBreak).append(stream.number()).append(stream.token(")"));
    assertThat(stream.depth()).isEqualTo(0);
    assertThat(stream.whitespace(true)).isEmpty();
    consumed.append(stream.endOfLine()).append(stream.endOfFile());

    assertThat(consumed.toString()).isEqualTo("x = (1,\n  2)\n");
    assertThat(stream.isExhausted()).isTrue();
  }

  @Test
  public void testOnelineWhitespaceStopsAtLineEnd() {
    TokenStream stream = new TokenStream("a  # comment\n\nb\n");
    stream.token("a");
    assertThat(stream.whitespace(true)).isEqualTo("  ");
    assertThat(stream.peek().getType()).isEqualTo(TokenType.COMMENT);
    assertThat(stream.endOfLine()).isEqualTo("# comment\n");
    assertThat(stream.whitespace(false)).isEqualTo("\n");
    assertThat(stream.peek().getText()).isEqualTo("b");
  }

  @Test
  public void testMultilineWhitespaceIncludesIndentation() {
    TokenStream stream = new TokenStream("if a:\n    # note\n    b\nc\n");
    stream.token("if");
    stream.whitespace(true);
    stream.token("a");
    stream.token(":");
    stream.endOfLine();
    assertThat(stream.whitespace(false)).isEqualTo("    # note\n    ");
    stream.token("b");
    stream.endOfLine();
    assertThat(stream.whitespace(false)).isEmpty();
    assertThat(stream.peek().getText()).isEqualTo("c");
  }

  @Test
  public void testStrictNextRefusesToSkipWhitespace() {
    TokenStream stream = new TokenStream("a  b\n");
    stream.token("a");
    TokenMismatchException e = assertThrows(TokenMismatchException.class, stream::next);
    assertThat(e.getMessage()).contains("uncaptured text '  '");
    assertThat(e.lineNumber()).isEqualTo(1);
    assertThat(e.columnNumber()).isEqualTo(3);
  }

  @Test
  public void testTokenMismatch() {
    TokenStream stream = new TokenStream("a\n");
    assertThrows(TokenMismatchException.class, () -> stream.token("b"));
    assertThat(stream.position()).isEqualTo(0);
  }

  @Test
  public void testPeekIsIdempotent() {
    TokenStream stream = new TokenStream("  # c\nfoo\n");
    assertThat(stream.peek()).isSameInstanceAs(stream.peek());
    assertThat(stream.peekSignificant().getText()).isEqualTo("foo");
    assertThat(stream.position()).isEqualTo(0);
  }

  @Test
  public void testImplicitlyConcatenatedStrings() {
    TokenStream stream = new TokenStream("'a' \"b\"\n'c'\n");
    assertThat(stream.str()).isEqualTo("'a' \"b\"");
    assertThat(stream.endOfLine()).isEqualTo("\n");
    assertThat(stream.str()).isEqualTo("'c'");
  }

  @Test
  public void testStringsConcatenatedAcrossLinesInsideParentheses() {
    TokenStream stream = new TokenStream("('a'\n 'b')\n");
    stream.token("(");
    assertThat(stream.str()).isEqualTo("'a'\n 'b'");
    stream.token(")");
  }

  @Test
  public void testNextOfType() {
    TokenStream stream = new TokenStream("a + b  # c\nd\n");
    assertThat(stream.nextOfType(TokenType.COMMENT)).isEqualTo("a + b  # c");
    assertThrows(LexicalMismatchException.class, () -> stream.nextOfType(TokenType.STRING));
  }

  @Test
  public void testOptional() {
    TokenStream stream = new TokenStream("(a , )\n");
    stream.token("(");
    stream.token("a");
    assertThat(stream.optional(")")).isEmpty();
    assertThat(stream.optional(",")).isEqualTo(" ,");
    assertThat(stream.optional(",")).isEmpty();
    assertThat(stream.whitespace(true)).isEqualTo(" ");
    stream.token(")");
  }

  @Test
  public void testEndOfLineWithSemicolon() {
    TokenStream stream = new TokenStream("a ; b\n");
    stream.token("a");
    assertThat(stream.endOfLine()).isEqualTo(" ; ");
    assertThat(stream.peek().getText()).isEqualTo("b");
  }

  @Test
  public void testDots() {
    TokenStream stream = new TokenStream("from .... import x\n");
    stream.token("from");
    stream.whitespace(true);
    assertThat(stream.dots(4)).isEqualTo("....");
    assertThat(stream.dottedName("import")).isEqualTo(" import");
  }

  @Test
  public void testDottedName() {
    TokenStream stream = new TokenStream("import os . path\n");
    stream.token("import");
    assertThat(stream.dottedName("os.path")).isEqualTo(" os . path");
  }

  @Test
  public void testExhausted() {
    TokenStream stream = new TokenStream("");
    assertThat(stream.endOfFile()).isEmpty();
    assertThat(stream.isExhausted()).isTrue();
    assertThrows(ExhaustedStreamException.class, stream::peek);
  }

  @Test
  public void testUnbalancedClose() {
    TokenStream stream = new TokenStream("a\n");
    assertThrows(
        TokenMismatchException.class, () -> stream.hintClosed(stream.peek()));
  }
}
