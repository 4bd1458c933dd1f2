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

package com.google.pasta.refactoring;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.pasta.Pasta;
import com.google.pasta.base.RootScope;
import com.google.pasta.base.ScopeAnalyzer;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.IR;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Prop;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ImportUtilsTest {

  private static final String IMPORT = "import aaa, bbb, ccc";

  private static final ImmutableList<String> NESTED_TEMPLATES =
      ImmutableList.of(
          "def foo():\n  %s\n",
          "class Foo(object):\n  %s\n",
          "if foo:\n  %s\nelse:\n  pass\n",
          "if foo:\n  pass\nelse:\n  %s\n",
          "if foo:\n  pass\nelif bar:\n  %s\n",
          "try:\n  %s\nexcept:\n  pass\n",
          "try:\n  pass\nexcept:\n  %s\n",
          "try:\n  pass\nfinally:\n  %s\n",
          "for i in foo:\n  %s\n",
          "for i in foo:\n  pass\nelse:\n  %s\n",
          "while foo:\n  %s\n");

  @Test
  public void testSplitImport() {
    Node module = Pasta.parse("import aaa, bbb, ccc\n");
    Node importNode = statement(module, 0);
    Node newImport =
        ImportUtils.splitImport(ScopeAnalyzer.analyze(module), importNode, alias(importNode, 1));

    assertThat(module.getNonNullChildren(Field.BODY))
        .containsExactly(importNode, newImport)
        .inOrder();
    assertThat(newImport.getKind()).isEqualTo(Kind.IMPORT);
    assertThat(aliasNames(importNode)).containsExactly("aaa", "ccc").inOrder();
    assertThat(aliasNames(newImport)).containsExactly("bbb");
    assertThat(Pasta.dump(module)).isEqualTo("import aaa, ccc\nimport bbb\n");
  }

  @Test
  public void testSplitFromImport() {
    Node module = Pasta.parse("from aaa import bbb, ccc, ddd\n");
    Node importNode = statement(module, 0);
    Node newImport =
        ImportUtils.splitImport(ScopeAnalyzer.analyze(module), importNode, alias(importNode, 1));

    assertThat(newImport.getKind()).isEqualTo(Kind.IMPORT_FROM);
    assertThat(newImport.getString(Prop.MODULE)).isEqualTo("aaa");
    assertThat(aliasNames(importNode)).containsExactly("bbb", "ddd").inOrder();
    assertThat(Pasta.dump(module))
        .isEqualTo("from aaa import bbb, ddd\nfrom aaa import ccc\n");
  }

  @Test
  public void testSplitRelativeImport() {
    Node module = Pasta.parse("from .. import x, y\n");
    Node importNode = statement(module, 0);
    Node newImport =
        ImportUtils.splitImport(ScopeAnalyzer.analyze(module), importNode, alias(importNode, 1));

    assertThat(newImport.getInt(Prop.LEVEL)).isEqualTo(2);
    assertThat(newImport.getString(Prop.MODULE)).isNull();
    assertThat(Pasta.dump(module)).isEqualTo("from .. import x\nfrom .. import y\n");
  }

  @Test
  public void testSplitImportWithAlias() {
    Node module = Pasta.parse("import aaa as a, bbb as b, ccc as c\n");
    Node importNode = statement(module, 0);
    Node newImport =
        ImportUtils.splitImport(ScopeAnalyzer.analyze(module), importNode, alias(importNode, 1));

    assertThat(aliasNames(importNode)).containsExactly("aaa", "ccc").inOrder();
    assertThat(alias(newImport, 0).getString(Prop.ASNAME)).isEqualTo("b");
    assertThat(Pasta.dump(module)).isEqualTo("import aaa as a, ccc as c\nimport bbb as b\n");
  }

  @Test
  public void testSplitImportTwice() {
    Node module = Pasta.parse("import aaa, bbb, ccc\n");
    Node importNode = statement(module, 0);
    Node bbb = alias(importNode, 1);
    Node ccc = alias(importNode, 2);
    RootScope scope = ScopeAnalyzer.analyze(module);
    ImportUtils.splitImport(scope, importNode, bbb);
    ImportUtils.splitImport(scope, importNode, ccc);

    assertThat(Pasta.dump(module)).isEqualTo("import aaa\nimport ccc\nimport bbb\n");
  }

  @Test
  public void testSplitImportWithoutFinalNewline() {
    Node module = Pasta.parse("import aaa, bbb");
    Node importNode = statement(module, 0);
    ImportUtils.splitImport(ScopeAnalyzer.analyze(module), importNode, alias(importNode, 1));

    assertThat(Pasta.dump(module)).isEqualTo("import aaa\nimport bbb\n");
  }

  @Test
  public void testSplitKeepsSurroundingFormatting() {
    Node module = Pasta.parse("# header\nimport aaa,  bbb  # both\n\nx = 1\n");
    Node importNode = statement(module, 0);
    ImportUtils.splitImport(ScopeAnalyzer.analyze(module), importNode, alias(importNode, 1));

    assertThat(Pasta.dump(module))
        .isEqualTo("# header\nimport aaa  # both\nimport bbb\n\nx = 1\n");
  }

  @Test
  public void testSplitNestedImports() {
    for (String template : NESTED_TEMPLATES) {
      String source = String.format(template, IMPORT);
      Node module = Pasta.parse(source);
      List<Node> imports = new ArrayList<>();
      collectImports(module, imports);
      Node importNode = imports.get(0);
      ImportUtils.splitImport(ScopeAnalyzer.analyze(module), importNode, alias(importNode, 1));

      assertWithMessage(source).that(module.getNonNullChildren(Field.BODY)).hasSize(1);
      assertWithMessage(source)
          .that(Pasta.dump(module))
          .isEqualTo(String.format(template, "import aaa, ccc\n  import bbb"));
    }
  }

  @Test
  public void testSplitRejectsForeignAlias() {
    Node module = Pasta.parse("import aaa, bbb\n");
    RootScope scope = ScopeAnalyzer.analyze(module);
    assertThrows(
        IllegalArgumentException.class,
        () -> ImportUtils.splitImport(scope, statement(module, 0), IR.alias("bbb")));
  }

  @Test
  public void testSplitRejectsSingleName() {
    Node module = Pasta.parse("import aaa\n");
    Node importNode = statement(module, 0);
    RootScope scope = ScopeAnalyzer.analyze(module);
    assertThrows(
        IllegalArgumentException.class,
        () -> ImportUtils.splitImport(scope, importNode, alias(importNode, 0)));
  }

  @Test
  public void testSplitRejectsNonImport() {
    Node module = Pasta.parse("x = 1\n");
    Node statement = statement(module, 0);
    RootScope scope = ScopeAnalyzer.analyze(module);
    assertThrows(
        IllegalArgumentException.class,
        () -> ImportUtils.splitImport(scope, statement, IR.alias("x")));
  }

  private static Node statement(Node module, int index) {
    return module.getNonNullChildren(Field.BODY).get(index);
  }

  private static Node alias(Node importNode, int index) {
    return importNode.getNonNullChildren(Field.NAMES).get(index);
  }

  private static ImmutableList<String> aliasNames(Node importNode) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Node alias : importNode.getNonNullChildren(Field.NAMES)) {
      names.add(alias.getString(Prop.NAME));
    }
    return names.build();
  }

  private static void collectImports(Node node, List<Node> imports) {
    if (node.isKind(Kind.IMPORT)) {
      imports.add(node);
    }
    for (Node child : node.children()) {
      collectImports(child, imports);
    }
  }
}
