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

import com.google.common.collect.ImmutableList;
import com.google.pasta.syntax.Context;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.IR;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Operator;
import com.google.pasta.syntax.Parser;
import com.google.pasta.syntax.Prop;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodeGeneratorTest {

  @Test
  public void testUnannotatedStatements() {
    Node module =
        IR.module(
            ImmutableList.of(
                IR.assign(IR.name("x"), IR.number(1)),
                IR.exprStatement(IR.call(IR.name("print"), IR.string("hi"))),
                IR.returnStatement(null)));
    assertPrint(module, "x = 1\nprint('hi')\nreturn\n");
  }

  @Test
  public void testUnannotatedImports() {
    assertPrint(
        IR.module(ImmutableList.of(IR.importStatement(IR.alias("os"), IR.alias("a.b", "c")))),
        "import os, a.b as c\n");
    assertPrint(
        IR.module(ImmutableList.of(IR.importFrom("pkg", 0, IR.alias("x"), IR.alias("y", "z")))),
        "from pkg import x, y as z\n");
    assertPrint(
        IR.module(ImmutableList.of(IR.importFrom(null, 2, IR.alias("y")))),
        "from .. import y\n");
  }

  @Test
  public void testUnannotatedCallPutsPositionalArgumentsFirst() {
    Node call =
        IR.call(
            IR.name("f"),
            IR.keyword("k", IR.number(1)),
            IR.name("a"),
            IR.keyword(null, IR.name("rest")));
    assertPrint(IR.module(ImmutableList.of(IR.exprStatement(call))), "f(a, k=1, **rest)\n");
  }

  @Test
  public void testUnannotatedLiterals() {
    Node tuple =
        IR.tuple(
            IR.number(3.5),
            IR.number(1e20),
            IR.string("it's"),
            IR.nameConstant(null),
            IR.nameConstant(true));
    assertPrint(
        IR.module(ImmutableList.of(IR.assign(IR.name("x"), tuple))),
        "x = (3.5, 1e+20, \"it's\", None, True)\n");
  }

  @Test
  public void testNewTuplesAreParenthesized() {
    assertPrint(
        IR.module(ImmutableList.of(IR.assign(IR.name("x"), IR.tuple(IR.number(1))))),
        "x = (1,)\n");
    assertPrint(
        IR.module(ImmutableList.of(IR.assign(IR.name("x"), IR.tuple()))),
        "x = ()\n");
  }

  @Test
  public void testNewTupleAsSubscriptIsNotParenthesized() {
    Node subscript =
        new Node(Kind.SUBSCRIPT)
            .setChild(Field.VALUE, IR.name("a"))
            .setChild(Field.SLICE, IR.tuple(IR.number(1), IR.number(2)))
            .setProp(Prop.CONTEXT, Context.LOAD);
    assertPrint(IR.module(ImmutableList.of(IR.exprStatement(subscript))), "a[1, 2]\n");
  }

  @Test
  public void testParenthesesFromPrecedence() {
    Node product =
        IR.binOp(
            Operator.MULT,
            IR.binOp(Operator.ADD, IR.name("a"), IR.name("b")),
            IR.name("c"));
    Node module = IR.module(ImmutableList.of(IR.exprStatement(product)));
    assertPrint(module, "(a + b) * c\n");

    PrinterOptions options = new PrinterOptions();
    options.setParenthesizeByPrecedence(false);
    assertThat(new CodePrinter.Builder(module).setOptions(options).build())
        .isEqualTo("a + b * c\n");
  }

  @Test
  public void testParenthesesFromAssociativity() {
    Node difference =
        IR.binOp(
            Operator.SUB,
            IR.name("a"),
            IR.binOp(Operator.SUB, IR.name("b"), IR.name("c")));
    Node power =
        IR.binOp(
            Operator.POW,
            IR.binOp(Operator.POW, IR.name("a"), IR.name("b")),
            IR.name("c"));
    assertPrint(
        IR.module(
            ImmutableList.of(IR.exprStatement(difference), IR.exprStatement(power))),
        "a - (b - c)\n(a ** b) ** c\n");
  }

  @Test
  public void testNoParenthesesWhenPrecedenceAllows() {
    Node sum =
        IR.binOp(
            Operator.ADD,
            IR.binOp(Operator.MULT, IR.name("a"), IR.name("b")),
            IR.binOp(Operator.ADD, IR.name("c"), IR.name("d")));
    assertPrint(IR.module(ImmutableList.of(IR.exprStatement(sum))), "a * b + (c + d)\n");
  }

  @Test
  public void testChangedNameUsesNewSpelling() {
    Node module = parse("foo( bar )  # call\n");
    Node arg =
        statement(module, 0).getRequiredChild(Field.VALUE).getNonNullChildren(Field.ARGS).get(0);
    arg.setProp(Prop.ID, "baz");
    assertPrint(module, "foo( baz )  # call\n");
  }

  @Test
  public void testChangedNumberUsesCanonicalSpelling() {
    Node module = parse("y = 0x10  # hex\n");
    Node number = statement(module, 0).getRequiredChild(Field.VALUE);
    number.setProp(Prop.VALUE, BigInteger.valueOf(16));
    assertPrint(module, "y = 0x10  # hex\n");
    number.setProp(Prop.VALUE, BigInteger.valueOf(17));
    assertPrint(module, "y = 17  # hex\n");
  }

  @Test
  public void testChangedStringUsesCanonicalSpelling() {
    Node module = parse("x = \"a\"\n");
    statement(module, 0).getRequiredChild(Field.VALUE).setProp(Prop.VALUE, "b");
    assertPrint(module, "x = 'b'\n");
  }

  @Test
  public void testChangedBytesKeepsItsKind() {
    Node module = parse("x = b'a'\n");
    statement(module, 0).getRequiredChild(Field.VALUE).setProp(Prop.VALUE, "c\u00ff");
    assertPrint(module, "x = b'c\\xff'\n");
  }

  @Test
  public void testChangedFormattedStringKeepsItsKind() {
    Node module = parse("x = f'{a}'\n");
    statement(module, 0).getRequiredChild(Field.VALUE).setProp(Prop.VALUE, "{b}");
    assertPrint(module, "x = f'{b}'\n");
  }

  @Test
  public void testChangedImportModule() {
    Node module = parse("from  a.b  import c\n");
    statement(module, 0).setProp(Prop.MODULE, "x");
    assertPrint(module, "from x  import c\n");
  }

  @Test
  public void testChangedAliasName() {
    Node module = parse("import a  as  b\n");
    Node alias = statement(module, 0).getNonNullChildren(Field.NAMES).get(0);
    alias.setProp(Prop.ASNAME, "c");
    assertPrint(module, "import a as c\n");
    alias.setProp(Prop.ASNAME, null);
    assertPrint(module, "import a\n");
  }

  @Test
  public void testNewNumbersBeforeTrailers() {
    assertPrint(
        IR.module(ImmutableList.of(IR.exprStatement(IR.attribute(IR.number(1), "real")))),
        "(1).real\n");
    assertPrint(
        IR.module(ImmutableList.of(IR.exprStatement(IR.attribute(IR.number(1.5), "real")))),
        "1.5.real\n");
    assertPrint(
        IR.module(ImmutableList.of(IR.exprStatement(IR.call(IR.number(-1))))), "(-1)()\n");
    Node power = IR.binOp(Operator.POW, IR.number(-2), IR.name("b"));
    assertPrint(IR.module(ImmutableList.of(IR.exprStatement(power))), "(-2) ** b\n");
  }

  @Test
  public void testRemovedFirstArgument() {
    Node module = parse("f(a,  b,  c)\nx = [a,  b]\n");
    statement(module, 0).getRequiredChild(Field.VALUE).getNonNullChildren(Field.ARGS).remove(0);
    statement(module, 1).getRequiredChild(Field.VALUE).getNonNullChildren(Field.ELTS).remove(0);
    assertPrint(module, "f(b,  c)\nx = [b]\n");
  }

  @Test
  public void testRemovedTrailingCommaElement() {
    Node module = parse("x = (1, 2,)\n");
    Node tuple = statement(module, 0).getRequiredChild(Field.VALUE);
    tuple.getNonNullChildren(Field.ELTS).remove(1);
    assertPrint(module, "x = (1,)\n");
  }

  @Test
  public void testAppendedStatementUsesBlockIndentation() {
    Node module = parse("def f():\n  a = 1\n");
    statement(module, 0).addChild(Field.BODY, IR.returnStatement(IR.name("a")));
    assertPrint(module, "def f():\n  a = 1\n  return a\n");
  }

  @Test
  public void testAppendedModuleStatement() {
    Node module = parse("import os  # os\n");
    module.addChild(Field.BODY, IR.exprStatement(IR.name("os")));
    assertPrint(module, "import os  # os\nos\n");
  }

  @Test
  public void testNewBlockUsesIndentUnit() {
    Node ifNode =
        new Node(Kind.IF).setChild(Field.TEST, IR.name("a")).addChild(Field.BODY, IR.pass());
    Node module = IR.module(ImmutableList.of(ifNode));
    assertPrint(module, "if a:\n    pass\n");

    PrinterOptions options = new PrinterOptions();
    options.setIndentUnit("\t");
    assertThat(new CodePrinter.Builder(module).setOptions(options).build())
        .isEqualTo("if a:\n\tpass\n");
  }

  @Test
  public void testNewNestedIfInElseIsElif() {
    Node inner =
        new Node(Kind.IF).setChild(Field.TEST, IR.name("b")).addChild(Field.BODY, IR.pass());
    Node outer =
        new Node(Kind.IF)
            .setChild(Field.TEST, IR.name("a"))
            .addChild(Field.BODY, IR.pass())
            .addChild(Field.ORELSE, inner);
    assertPrint(
        IR.module(ImmutableList.of(outer)), "if a:\n    pass\nelif b:\n    pass\n");
  }

  @Test
  public void testAnnotatedNestedIfStaysNested() {
    Node module = parse("if a:\n  pass\nelse:\n  if b:\n    pass\n");
    assertPrint(module, "if a:\n  pass\nelse:\n  if b:\n    pass\n");
  }

  @Test
  public void testElifGeneratedNestedIsReindented() {
    Node module = parse("if a:\n  pass\nelif b:\n  pass\n");
    statement(module, 0).addChild(Field.ORELSE, IR.pass());
    assertPrint(module, "if a:\n  pass\nelse:\n    if b:\n      pass\n    pass\n");
  }

  @Test
  public void testContinuedWithGeneratedNestedIsReindented() {
    Node module = parse("with a, b:\n    pass\n");
    statement(module, 0).addChild(Field.BODY, IR.pass());
    assertPrint(module, "with a:\n    with b:\n        pass\n    pass\n");
  }

  @Test
  public void testJoinedTryGeneratedNestedIsReindented() {
    Node module = parse("try:\n  a\nexcept E:\n  # why\n  b\nfinally:\n  c\n");
    statement(module, 0).addChild(Field.BODY, IR.pass());
    assertPrint(
        module,
        "try:\n"
            + "    try:\n"
            + "      a\n"
            + "    except E:\n"
            + "      # why\n"
            + "      b\n"
            + "    pass\n"
            + "finally:\n"
            + "  c\n");
  }

  @Test
  public void testStatementAfterUnterminatedLine() {
    Node module = parse("x = 1");
    module.addChild(Field.BODY, IR.exprStatement(IR.name("y")));
    assertPrint(module, "x = 1\ny\n");

    Node semicolons = parse("a; b");
    assertPrint(semicolons, "a; b");
  }

  private static Node parse(String source) {
    Node tree = Parser.parse(source);
    Annotator.annotate(source, tree);
    return tree;
  }

  private static Node statement(Node module, int index) {
    return module.getNonNullChildren(Field.BODY).get(index);
  }

  private static void assertPrint(Node node, String expected) {
    assertThat(new CodePrinter.Builder(node).build()).isEqualTo(expected);
  }
}
