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

import static com.google.common.truth.Truth.assertWithMessage;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Resources;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Parser;
import java.io.IOException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Checks that annotating a parsed module and printing it reproduces its source exactly. */
@RunWith(JUnit4.class)
public final class RoundTripTest {

  @Test
  public void testStatementsFile() throws IOException {
    assertRoundTrip(testdata("statements.in"));
  }

  @Test
  public void testExpressionsFile() throws IOException {
    assertRoundTrip(testdata("expressions.in"));
  }

  @Test
  public void testFunctionsFile() throws IOException {
    assertRoundTrip(testdata("functions.in"));
  }

  @Test
  public void testCommentsFile() throws IOException {
    assertRoundTrip(testdata("comments.in"));
  }

  @Test
  public void testTabsFile() throws IOException {
    assertRoundTrip(testdata("tabs.in"));
  }

  @Test
  public void testEmptyModule() {
    assertRoundTrip("");
    assertRoundTrip("\n");
    assertRoundTrip("# only a comment\n");
    assertRoundTrip("\n\n  \n");
  }

  @Test
  public void testMissingFinalNewline() {
    assertRoundTrip("x = 1");
    assertRoundTrip("if a:\n  pass");
    assertRoundTrip("x = 1  # comment");
  }

  @Test
  public void testWindowsLineEndings() {
    assertRoundTrip("x = 1\r\ny = 2\r\n");
    assertRoundTrip("if a:\r\n    b\r\nelse:\r\n    c\r\n");
  }

  @Test
  public void testUnusualSpacing() {
    assertRoundTrip("x=1\n");
    assertRoundTrip("x   =    1\n");
    assertRoundTrip("foo  (  a ,b  )\n");
    assertRoundTrip("a [ 1 : 2 ]\n");
    assertRoundTrip("a . b . c\n");
    assertRoundTrip("x = 1 ;y = 2;\n");
    assertRoundTrip("def f (  a ,  b = 1 ) :\n  pass\n");
    assertRoundTrip("class A ( B ) :\n  pass\n");
    assertRoundTrip("import  a . b  as  c\n");
    assertRoundTrip("from  .  a  import  b  as  c\n");
  }

  @Test
  public void testRedundantParentheses() {
    assertRoundTrip("x = (a)\n");
    assertRoundTrip("x = ((a))\n");
    assertRoundTrip("x = (a) + b\n");
    assertRoundTrip("x = ((a) + b)\n");
    assertRoundTrip("x = ( ( a ) + ( b ) )\n");
    assertRoundTrip("f((a), (b))\n");
    assertRoundTrip("if (a):\n  pass\n");
    assertRoundTrip("return (yield)\n");
    assertRoundTrip("(a).b\n");
    assertRoundTrip("((a, b)) = c\n");
    assertRoundTrip("x = ((a)) + b\n");
    assertRoundTrip("((a)).b\n");
    assertRoundTrip("((a))[0]\n");
    assertRoundTrip("((a))(b)\n");
    assertRoundTrip("(((a)), b)\n");
    assertRoundTrip("((a, b)), c\n");
    assertRoundTrip("((a)) if b else c\n");
    assertRoundTrip("(((1)) + 2)\n");
    assertRoundTrip("x = ( ( a ) ) * b\n");
  }

  @Test
  public void testKeywordsRightAfterNumbers() {
    assertRoundTrip("x = 1if a else 2\n");
    assertRoundTrip("[1for x in y]\n");
    assertRoundTrip("x = 0or 1\n");
    assertRoundTrip("x = 1 .real\n");
  }

  @Test
  public void testParenthesesAcrossLines() {
    assertRoundTrip("x = (\n    a +\n    b\n)\n");
    assertRoundTrip("x = [\n    1,  # one\n    2,\n]\n");
    assertRoundTrip("f(a,\n  b)\n");
  }

  @Test
  public void testTuples() {
    assertRoundTrip("x = 1,\n");
    assertRoundTrip("x = 1, 2\n");
    assertRoundTrip("x = (1, 2,)\n");
    assertRoundTrip("a, b = b, a\n");
    assertRoundTrip("for a, b in c:\n  pass\n");
    assertRoundTrip("x = ()\n");
  }

  @Test
  public void testJoinedStatements() {
    assertRoundTrip("if a:\n  b\nelif c:\n  d\nelif e:\n  f\nelse:\n  g\n");
    assertRoundTrip("if a:\n  b\nelse:\n  if c:\n    d\n");
    assertRoundTrip("with a as b, c as d:\n  pass\n");
    assertRoundTrip("with a:\n  with c:\n    pass\n");
    assertRoundTrip("try:\n  a\nexcept E:\n  b\nfinally:\n  c\n");
    assertRoundTrip("try:\n  try:\n    a\n  except E:\n    b\nfinally:\n  c\n");
  }

  @Test
  public void testCallArgumentOrder() {
    assertRoundTrip("f(a, b=1, *c, d=2, **e)\n");
    assertRoundTrip("f(b=1, *c)\n");
    assertRoundTrip("class A(B, metaclass=M, *bases):\n  pass\n");
  }

  @Test
  public void testStrings() {
    assertRoundTrip("x = 'a' 'b'\n");
    assertRoundTrip("x = 'a' \\\n    'b'\n");
    assertRoundTrip("x = \"\"\"line one\nline two\"\"\"\n");
    assertRoundTrip("x = u'unicode', R'raw', Rb'raw bytes'\n");
    assertRoundTrip("x = '\\n\\t\\x41'\n");
    assertRoundTrip("x = b'\\xff', f'{a!r:>10}'\n");
  }

  @Test
  public void testDecorators() {
    assertRoundTrip("@a\n@b.c(1)\ndef f():\n  pass\n");
    assertRoundTrip("# comment\n@a  # trailing\n\nclass C:\n  pass\n");
  }

  @Test
  public void testNestedBlocksWithComments() {
    assertRoundTrip(
        "def f():\n"
            + "    if a:\n"
            + "        # only a comment line here\n"
            + "        b\n"
            + "  # oddly indented comment\n"
            + "    c\n"
            + "\n"
            + "\n"
            + "d\n");
  }

  private static String testdata(String name) throws IOException {
    return Resources.toString(
        Resources.getResource(RoundTripTest.class, "testdata/" + name), UTF_8);
  }

  private static void assertRoundTrip(String source) {
    Node tree = Parser.parse(source);
    Annotator.annotate(source, tree);
    assertWithMessage(source).that(new CodePrinter.Builder(tree).build()).isEqualTo(source);
  }
}
