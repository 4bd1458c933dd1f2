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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParserTest {

  @Test
  public void testChainedAssignment() {
    Node assign = parseStatement("a = b = 1\n");
    assertThat(assign.getKind()).isEqualTo(Kind.ASSIGN);
    List<Node> targets = assign.getNonNullChildren(Field.TARGETS);
    assertThat(targets).hasSize(2);
    assertThat(targets.get(1).getString(Prop.ID)).isEqualTo("b");
    assertThat(targets.get(1).getProp(Prop.CONTEXT)).isEqualTo(Context.STORE);
    assertThat(assign.getRequiredChild(Field.VALUE).getProp(Prop.VALUE))
        .isEqualTo(BigInteger.ONE);
  }

  @Test
  public void testElifIsNestedIf() {
    Node ifNode = parseStatement("if a:\n  pass\nelif b:\n  pass\nelse:\n  pass\n");
    List<Node> orelse = ifNode.getNonNullChildren(Field.ORELSE);
    assertThat(orelse).hasSize(1);
    Node elif = orelse.get(0);
    assertThat(elif.getKind()).isEqualTo(Kind.IF);
    assertThat(elif.getRequiredChild(Field.TEST).getString(Prop.ID)).isEqualTo("b");
    assertThat(elif.getNonNullChildren(Field.ORELSE)).hasSize(1);
    assertThat(elif.getNonNullChildren(Field.ORELSE).get(0).getKind()).isEqualTo(Kind.PASS);
  }

  @Test
  public void testWithItemsAreNested() {
    Node with = parseStatement("with a as x, b:\n  pass\n");
    assertThat(with.getRequiredChild(Field.OPTIONAL_VARS).getString(Prop.ID)).isEqualTo("x");
    Node inner = with.getNonNullChildren(Field.BODY).get(0);
    assertThat(inner.getKind()).isEqualTo(Kind.WITH);
    assertThat(inner.getRequiredChild(Field.CONTEXT_EXPR).getString(Prop.ID)).isEqualTo("b");
    assertThat(inner.getChild(Field.OPTIONAL_VARS)).isNull();
  }

  @Test
  public void testTryExceptFinally() {
    Node tryNode =
        parseStatement("try:\n  a\nexcept E as e:\n  b\nelse:\n  c\nfinally:\n  d\n");
    assertThat(tryNode.getKind()).isEqualTo(Kind.TRY_FINALLY);
    Node tryExcept = tryNode.getNonNullChildren(Field.BODY).get(0);
    assertThat(tryExcept.getKind()).isEqualTo(Kind.TRY_EXCEPT);
    assertThat(tryExcept.getNonNullChildren(Field.HANDLERS).get(0).getString(Prop.NAME))
        .isEqualTo("e");
    assertThat(tryExcept.getNonNullChildren(Field.ORELSE)).hasSize(1);
    assertThat(tryNode.getNonNullChildren(Field.FINALBODY)).hasSize(1);
  }

  @Test
  public void testTryFinallyWithoutHandlers() {
    Node tryNode = parseStatement("try:\n  a\nfinally:\n  d\n");
    assertThat(tryNode.getKind()).isEqualTo(Kind.TRY_FINALLY);
    assertThat(tryNode.getNonNullChildren(Field.BODY).get(0).getKind()).isEqualTo(Kind.EXPR);
  }

  @Test
  public void testCallArguments() {
    Node call = parseExpression("f(a, *b, c=1, **d)\n");
    assertThat(call.getKind()).isEqualTo(Kind.CALL);
    List<Node> args = call.getNonNullChildren(Field.ARGS);
    assertThat(args).hasSize(2);
    assertThat(args.get(1).getKind()).isEqualTo(Kind.STARRED);
    List<Node> keywords = call.getNonNullChildren(Field.KEYWORDS);
    assertThat(keywords).hasSize(2);
    assertThat(keywords.get(0).getString(Prop.ARG)).isEqualTo("c");
    assertThat(keywords.get(1).getString(Prop.ARG)).isNull();
  }

  @Test
  public void testGeneratorArgument() {
    Node call = parseExpression("f(x for x in y)\n");
    assertThat(call.getNonNullChildren(Field.ARGS).get(0).getKind())
        .isEqualTo(Kind.GENERATOR_EXP);
  }

  @Test
  public void testFunctionParameters() {
    Node def = parseStatement("def f(a, b=1, *args, c, d=2, **kw) -> int:\n  pass\n");
    Node arguments = def.getRequiredChild(Field.ARGS);
    assertThat(arguments.getNonNullChildren(Field.ARGS)).hasSize(2);
    assertThat(arguments.getNonNullChildren(Field.DEFAULTS)).hasSize(1);
    assertThat(arguments.getRequiredChild(Field.VARARG).getString(Prop.ARG)).isEqualTo("args");
    assertThat(arguments.getNonNullChildren(Field.KWONLYARGS)).hasSize(2);
    List<Node> kwDefaults = arguments.getChildren(Field.KW_DEFAULTS);
    assertThat(kwDefaults.get(0)).isNull();
    assertThat(kwDefaults.get(1).getProp(Prop.VALUE)).isEqualTo(BigInteger.valueOf(2));
    assertThat(arguments.getRequiredChild(Field.KWARG).getString(Prop.ARG)).isEqualTo("kw");
    assertThat(def.getRequiredChild(Field.RETURNS).getString(Prop.ID)).isEqualTo("int");
  }

  @Test
  public void testDecoratedClass() {
    Node classDef = parseStatement("@a.b\n@c()\nclass A(B, metaclass=M):\n  pass\n");
    assertThat(classDef.getKind()).isEqualTo(Kind.CLASS_DEF);
    assertThat(classDef.getNonNullChildren(Field.DECORATOR_LIST)).hasSize(2);
    assertThat(classDef.getNonNullChildren(Field.BASES)).hasSize(1);
    assertThat(classDef.getNonNullChildren(Field.KEYWORDS).get(0).getString(Prop.ARG))
        .isEqualTo("metaclass");
  }

  @Test
  public void testRelativeImport() {
    Node importFrom = parseStatement("from ..a.b import (c as d, e,)\n");
    assertThat(importFrom.getInt(Prop.LEVEL)).isEqualTo(2);
    assertThat(importFrom.getString(Prop.MODULE)).isEqualTo("a.b");
    List<Node> names = importFrom.getNonNullChildren(Field.NAMES);
    assertThat(names).hasSize(2);
    assertThat(names.get(0).getString(Prop.ASNAME)).isEqualTo("d");
  }

  @Test
  public void testImportFromCurrentPackage() {
    Node importFrom = parseStatement("from . import x\n");
    assertThat(importFrom.getInt(Prop.LEVEL)).isEqualTo(1);
    assertThat(importFrom.getString(Prop.MODULE)).isNull();
  }

  @Test
  public void testLiterals() {
    assertThat(parseExpression("'a' \"b\"\n").getString(Prop.VALUE)).isEqualTo("ab");
    assertThat(parseExpression("b'a' B'b'\n").getBoolean(Prop.BYTES)).isTrue();
    assertThat(parseExpression("'a' f'{b}'\n").getBoolean(Prop.FORMATTED)).isTrue();
    assertThat(parseExpression("'a'\n").getBoolean(Prop.BYTES)).isFalse();
    assertThat(parseExpression("0x10\n").getProp(Prop.VALUE)).isEqualTo(BigInteger.valueOf(16));
    assertThat(parseExpression("1.5\n").getProp(Prop.VALUE)).isEqualTo(1.5);
    Node imaginary = parseExpression("2j\n");
    assertThat(imaginary.getBoolean(Prop.IMAGINARY)).isTrue();
    assertThat(parseExpression("None\n").getProp(Prop.VALUE)).isNull();
    assertThat(parseExpression("True\n").getProp(Prop.VALUE)).isEqualTo(true);
  }

  @Test
  public void testComparisonOperators() {
    Node compare = parseExpression("a is not b not in c\n");
    List<Node> ops = compare.getNonNullChildren(Field.OPS);
    assertThat(ops.get(0).getProp(Prop.OP)).isEqualTo(Operator.IS_NOT);
    assertThat(ops.get(1).getProp(Prop.OP)).isEqualTo(Operator.NOT_IN);
    assertThat(compare.getNonNullChildren(Field.COMPARATORS)).hasSize(2);
  }

  @Test
  public void testPrecedence() {
    Node sum = parseExpression("a + b * c\n");
    assertThat(sum.getProp(Prop.OP)).isEqualTo(Operator.ADD);
    assertThat(sum.getRequiredChild(Field.RIGHT).getProp(Prop.OP)).isEqualTo(Operator.MULT);

    Node negation = parseExpression("-x ** 2\n");
    assertThat(negation.getProp(Prop.OP)).isEqualTo(Operator.USUB);
    assertThat(negation.getRequiredChild(Field.OPERAND).getProp(Prop.OP))
        .isEqualTo(Operator.POW);

    Node or = parseExpression("a or b and not c\n");
    assertThat(or.getProp(Prop.OP)).isEqualTo(Operator.OR);
    assertThat(or.getNonNullChildren(Field.VALUES).get(1).getProp(Prop.OP))
        .isEqualTo(Operator.AND);
  }

  @Test
  public void testParentheses() {
    assertThat(parseExpression("(a)\n").getKind()).isEqualTo(Kind.NAME);
    assertThat(parseExpression("()\n").getKind()).isEqualTo(Kind.TUPLE);
    assertThat(parseExpression("(a,)\n").getNonNullChildren(Field.ELTS)).hasSize(1);
    assertThat(parseExpression("(yield)\n").getKind()).isEqualTo(Kind.YIELD);
  }

  @Test
  public void testSlices() {
    Node subscript = parseExpression("a[1:2, ::3]\n");
    Node slice = subscript.getRequiredChild(Field.SLICE);
    assertThat(slice.getKind()).isEqualTo(Kind.TUPLE);
    Node second = slice.getNonNullChildren(Field.ELTS).get(1);
    assertThat(second.getKind()).isEqualTo(Kind.SLICE);
    assertThat(second.getChild(Field.LOWER)).isNull();
    assertThat(second.getChild(Field.UPPER)).isNull();
    assertThat(second.getRequiredChild(Field.STEP).getProp(Prop.VALUE))
        .isEqualTo(BigInteger.valueOf(3));
  }

  @Test
  public void testLambda() {
    Node lambda = parseExpression("lambda x, *y: x\n");
    Node arguments = lambda.getRequiredChild(Field.ARGS);
    assertThat(arguments.getNonNullChildren(Field.ARGS)).hasSize(1);
    assertThat(arguments.getRequiredChild(Field.VARARG).getString(Prop.ARG)).isEqualTo("y");
  }

  @Test
  public void testComprehensions() {
    Node listComp = parseExpression("[x for x in y if x if not x for z in x]\n");
    assertThat(listComp.getKind()).isEqualTo(Kind.LIST_COMP);
    List<Node> generators = listComp.getNonNullChildren(Field.GENERATORS);
    assertThat(generators).hasSize(2);
    assertThat(generators.get(0).getNonNullChildren(Field.IFS)).hasSize(2);
    assertThat(parseExpression("{k: v for k, v in x}\n").getKind()).isEqualTo(Kind.DICT_COMP);
    assertThat(parseExpression("{x for x in y}\n").getKind()).isEqualTo(Kind.SET_COMP);
  }

  @Test
  public void testDictUnpacking() {
    Node dict = parseExpression("{**a, 'b': 1}\n");
    List<Node> keys = dict.getChildren(Field.KEYS);
    assertThat(keys.get(0)).isNull();
    assertThat(keys.get(1).getString(Prop.VALUE)).isEqualTo("b");
  }

  @Test
  public void testSemicolons() {
    Node module = Parser.parse("a; b;\nc\n");
    assertThat(module.getNonNullChildren(Field.BODY)).hasSize(3);
  }

  @Test
  public void testPositions() {
    Node module = Parser.parse("x = 1\nif y:\n    z\n");
    Node ifNode = module.getNonNullChildren(Field.BODY).get(1);
    assertThat(ifNode.getLineno()).isEqualTo(2);
    Node z = ifNode.getNonNullChildren(Field.BODY).get(0);
    assertThat(z.getLineno()).isEqualTo(3);
    assertThat(z.getCharno()).isEqualTo(4);
  }

  @Test
  public void testUnsupportedSyntax() {
    assertThrows(ParseException.class, () -> Parser.parse("async def f():\n  pass\n"));
    assertThrows(ParseException.class, () -> Parser.parse("await x\n"));
    assertThrows(ParseException.class, () -> Parser.parse("if (x := 1):\n  pass\n"));
    assertThrows(ParseException.class, () -> Parser.parse("def f(a, /):\n  pass\n"));
  }

  @Test
  public void testSyntaxErrors() {
    ParseException e = assertThrows(ParseException.class, () -> Parser.parse("x = = 1\n"));
    assertThat(e.lineNumber()).isEqualTo(1);
    assertThrows(ParseException.class, () -> Parser.parse("def f(a=1, b):\n  pass\n"));
    assertThrows(ParseException.class, () -> Parser.parse("try:\n  pass\n"));
  }

  private static Node parseStatement(String source) {
    return Parser.parse(source).getNonNullChildren(Field.BODY).get(0);
  }

  private static Node parseExpression(String source) {
    Node statement = parseStatement(source);
    assertThat(statement.getKind()).isEqualTo(Kind.EXPR);
    return statement.getRequiredChild(Field.VALUE);
  }
}
