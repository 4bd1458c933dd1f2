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

import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.Formatting;
import com.google.pasta.syntax.JoinedForm;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Parser;
import com.google.pasta.syntax.Slot;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AnnotatorTest {

  @Test
  public void testStatementAffixes() {
    Node module = annotate("x = 1\n\n# note\ny = 2  # trailing\n");
    Node first = statement(module, 0);
    Node second = statement(module, 1);
    assertThat(text(first, Slot.PREFIX)).isEmpty();
    assertThat(text(first, Slot.SUFFIX)).isEqualTo("\n");
    assertThat(text(second, Slot.PREFIX)).isEqualTo("\n# note\n");
    assertThat(text(second, Slot.SUFFIX)).isEqualTo("  # trailing\n");
  }

  @Test
  public void testExpressionAffixes() {
    Node module = annotate("x = foo ( a )\n");
    Node call = statement(module, 0).getRequiredChild(Field.VALUE);
    assertThat(text(call, Slot.PREFIX)).isEqualTo(" ");
    Node func = call.getRequiredChild(Field.FUNC);
    assertThat(text(func, Slot.CONTENT)).isEqualTo("foo");
    assertThat(text(func, Slot.SUFFIX)).isEqualTo(" ");
    Node arg = call.getNonNullChildren(Field.ARGS).get(0);
    assertThat(text(arg, Slot.PREFIX)).isEqualTo(" ");
    assertThat(text(arg, Slot.SUFFIX)).isEqualTo(" ");
  }

  @Test
  public void testParenthesesBelongToTheExpressionTheyEnclose() {
    Node module = annotate("x = ((a) + b)\n");
    Node binOp = statement(module, 0).getRequiredChild(Field.VALUE);
    Node left = binOp.getRequiredChild(Field.LEFT);
    Node right = binOp.getRequiredChild(Field.RIGHT);
    assertThat(text(binOp, Slot.PREFIX)).isEqualTo(" (");
    assertThat(text(binOp, Slot.SUFFIX)).isEqualTo(")");
    assertThat(text(left, Slot.PREFIX)).isEqualTo("(");
    assertThat(text(left, Slot.SUFFIX)).isEqualTo(") ");
    assertThat(text(right, Slot.PREFIX)).isEqualTo(" ");
    assertThat(text(right, Slot.SUFFIX)).isEmpty();
  }

  @Test
  public void testParenthesesOfAFirstOperand() {
    Node module = annotate("(a) + b\n");
    Node binOp = statement(module, 0).getRequiredChild(Field.VALUE);
    assertThat(text(binOp, Slot.PREFIX)).isEmpty();
    assertThat(text(binOp.getRequiredChild(Field.LEFT), Slot.PREFIX)).isEqualTo("(");
  }

  @Test
  public void testIndentationIsRecorded() {
    Node module = annotate("if a:\n   b\n   c; d\n");
    Node ifNode = statement(module, 0);
    assertThat(ifNode.getFormatting().getIndentation()).isEmpty();
    assertThat(text(ifNode, Slot.HEADER)).isEqualTo(":\n");
    Node b = ifNode.getNonNullChildren(Field.BODY).get(0);
    Node c = ifNode.getNonNullChildren(Field.BODY).get(1);
    Node d = ifNode.getNonNullChildren(Field.BODY).get(2);
    assertThat(b.getFormatting().getIndentation()).isEqualTo("   ");
    assertThat(text(b, Slot.PREFIX)).isEqualTo("   ");
    assertThat(c.getFormatting().getIndentation()).isEqualTo("   ");
    assertThat(text(c, Slot.SUFFIX)).isEqualTo("; ");
    assertThat(d.getFormatting().getIndentation()).isNull();
  }

  @Test
  public void testInlineBody() {
    Node module = annotate("while x: y\n");
    Node whileNode = statement(module, 0);
    assertThat(text(whileNode, Slot.HEADER)).isEqualTo(": ");
    assertThat(whileNode.getNonNullChildren(Field.BODY).get(0).getFormatting().getIndentation())
        .isNull();
  }

  @Test
  public void testElifIsRecorded() {
    Node module = annotate("if a:\n  b\nelif c:\n  d\n");
    Node inner = statement(module, 0).getNonNullChildren(Field.ORELSE).get(0);
    assertThat(inner.getFormatting().getJoinedForm()).isEqualTo(JoinedForm.ELIF);
  }

  @Test
  public void testNestedIfIsNotElif() {
    Node module = annotate("if a:\n  b\nelse:\n  if c:\n    d\n");
    Node inner = statement(module, 0).getNonNullChildren(Field.ORELSE).get(0);
    assertThat(inner.getFormatting().getJoinedForm()).isNull();
  }

  @Test
  public void testContinuedWithIsRecorded() {
    Node module = annotate("with a, b:\n  pass\nwith c:\n  with d:\n    pass\n");
    Node continued = statement(module, 0).getNonNullChildren(Field.BODY).get(0);
    Node nested = statement(module, 1).getNonNullChildren(Field.BODY).get(0);
    assertThat(continued.getFormatting().getJoinedForm()).isEqualTo(JoinedForm.CONTINUED_WITH);
    assertThat(nested.getFormatting().getJoinedForm()).isNull();
  }

  @Test
  public void testJoinedTryIsRecorded() {
    Node module = annotate("try:\n  a\nexcept:\n  b\nfinally:\n  c\n");
    Node inner = statement(module, 0).getNonNullChildren(Field.BODY).get(0);
    assertThat(inner.getFormatting().getJoinedForm()).isEqualTo(JoinedForm.JOINED_TRY);
  }

  @Test
  public void testNestedTryIsNotJoined() {
    Node module = annotate("try:\n  try:\n    a\n  except:\n    b\nfinally:\n  c\n");
    Node inner = statement(module, 0).getNonNullChildren(Field.BODY).get(0);
    assertThat(inner.getFormatting().getJoinedForm()).isNull();
  }

  @Test
  public void testArgumentOrderIsRecorded() {
    Node module = annotate("f(a, k=1, *b, **c)\n");
    Node call = statement(module, 0).getRequiredChild(Field.VALUE);
    assertThat(call.getFormatting().getArgumentOrder())
        .containsExactly(Field.ARGS, Field.KEYWORDS, Field.ARGS, Field.KEYWORDS)
        .inOrder();
  }

  @Test
  public void testSourceMismatch() {
    Node tree = Parser.parse("a = 1\n");
    TokenMismatchException e =
        assertThrows(TokenMismatchException.class, () -> Annotator.annotate("b = 1\n", tree));
    assertThat(e.lineNumber()).isEqualTo(1);
    assertThat(e.columnNumber()).isEqualTo(0);
  }

  @Test
  public void testFailedAnnotationLeavesTreeUnannotated() {
    Node tree = Parser.parse("a = 1\nb = 2\n");
    assertThrows(
        TokenMismatchException.class, () -> Annotator.annotate("a = 1\nc = 2\n", tree));
    assertThat(tree.getFormatting()).isNull();
    assertThat(statement(tree, 0).getFormatting()).isNull();
  }

  @Test
  public void testSourceLeftOver() {
    Node tree = Parser.parse("a\n");
    assertThrows(TokenMismatchException.class, () -> Annotator.annotate("a\nb\n", tree));
  }

  @Test
  public void testUnresolvableElif() {
    Node tree = Parser.parse("if a:\n  pass\nelse:\n  pass\n");
    assertThrows(
        AmbiguityResolutionException.class,
        () -> Annotator.annotate("if a:\n  pass\nelif b:\n  pass\n", tree));
  }

  @Test
  public void testOnlyModulesCanBeAnnotated() {
    Node statement = statement(Parser.parse("a\n"), 0);
    assertThrows(IllegalArgumentException.class, () -> Annotator.annotate("a\n", statement));
  }

  @Test
  public void testAnnotatingTwiceIsStable() {
    String source = "def f(a,  b):\n    return (a +  b)  # sum\n";
    Node tree = Parser.parse(source);
    Annotator.annotate(source, tree);
    String first = new CodePrinter.Builder(tree).build();
    Annotator.annotate(first, tree);
    assertThat(new CodePrinter.Builder(tree).build()).isEqualTo(source);
  }

  private static Node annotate(String source) {
    Node tree = Parser.parse(source);
    Annotator.annotate(source, tree);
    return tree;
  }

  private static Node statement(Node module, int index) {
    return module.getNonNullChildren(Field.BODY).get(index);
  }

  private static String text(Node node, Slot slot) {
    Formatting.Entry entry = node.getFormatting().get(slot);
    assertThat(entry).isNotNull();
    return entry.getText();
  }
}
