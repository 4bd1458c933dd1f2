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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.math.BigInteger;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A syntax tree construction helper class. Nodes built here carry no formatting. */
public final class IR {

  private IR() {}

  public static Node module(List<Node> body) {
    Node module = new Node(Kind.MODULE);
    for (Node statement : body) {
      checkState(statement.getKind().isStatement(), statement);
      module.addChild(Field.BODY, statement);
    }
    return module;
  }

  public static Node exprStatement(Node value) {
    checkState(value.getKind().isExpression(), value);
    return new Node(Kind.EXPR).setChild(Field.VALUE, value);
  }

  public static Node pass() {
    return new Node(Kind.PASS);
  }

  public static Node returnStatement(@Nullable Node value) {
    return new Node(Kind.RETURN).setChild(Field.VALUE, value);
  }

  public static Node assign(Node target, Node value) {
    return new Node(Kind.ASSIGN)
        .addChild(Field.TARGETS, withContext(target, Context.STORE))
        .setChild(Field.VALUE, value);
  }

  public static Node importStatement(Node... aliases) {
    checkArgument(aliases.length > 0, "an import needs at least one alias");
    Node node = new Node(Kind.IMPORT);
    for (Node alias : aliases) {
      checkState(alias.isKind(Kind.ALIAS), alias);
      node.addChild(Field.NAMES, alias);
    }
    return node;
  }

  public static Node importFrom(@Nullable String module, int level, Node... aliases) {
    checkArgument(module != null || level > 0, "an absolute import needs a module");
    checkArgument(aliases.length > 0, "an import needs at least one alias");
    Node node = new Node(Kind.IMPORT_FROM).setProp(Prop.MODULE, module).setProp(Prop.LEVEL, level);
    for (Node alias : aliases) {
      checkState(alias.isKind(Kind.ALIAS), alias);
      node.addChild(Field.NAMES, alias);
    }
    return node;
  }

  public static Node alias(String name) {
    return alias(name, null);
  }

  public static Node alias(String name, @Nullable String asname) {
    checkArgument(!name.isEmpty());
    return new Node(Kind.ALIAS).setProp(Prop.NAME, name).setProp(Prop.ASNAME, asname);
  }

  public static Node name(String id) {
    return name(id, Context.LOAD);
  }

  public static Node name(String id, Context context) {
    checkArgument(!id.isEmpty());
    return new Node(Kind.NAME).setProp(Prop.ID, id).setProp(Prop.CONTEXT, context);
  }

  public static Node attribute(Node value, String attr) {
    checkState(value.getKind().isExpression(), value);
    return new Node(Kind.ATTRIBUTE)
        .setChild(Field.VALUE, value)
        .setProp(Prop.ATTR, attr)
        .setProp(Prop.CONTEXT, Context.LOAD);
  }

  public static Node call(Node func, Node... args) {
    Node call = new Node(Kind.CALL).setChild(Field.FUNC, func);
    for (Node arg : args) {
      call.addChild(arg.isKind(Kind.KEYWORD) ? Field.KEYWORDS : Field.ARGS, arg);
    }
    return call;
  }

  public static Node keyword(@Nullable String arg, Node value) {
    return new Node(Kind.KEYWORD).setProp(Prop.ARG, arg).setChild(Field.VALUE, value);
  }

  public static Node binOp(Operator op, Node left, Node right) {
    checkArgument(op.getArity() == Operator.Arity.BINARY, op);
    return new Node(Kind.BIN_OP)
        .setProp(Prop.OP, op)
        .setChild(Field.LEFT, left)
        .setChild(Field.RIGHT, right);
  }

  public static Node tuple(Node... elts) {
    Node tuple = new Node(Kind.TUPLE).setProp(Prop.CONTEXT, Context.LOAD);
    for (Node elt : elts) {
      tuple.addChild(Field.ELTS, elt);
    }
    return tuple;
  }

  public static Node number(long value) {
    return new Node(Kind.NUM).setProp(Prop.VALUE, BigInteger.valueOf(value));
  }

  public static Node number(double value) {
    return new Node(Kind.NUM).setProp(Prop.VALUE, value);
  }

  public static Node string(String value) {
    return new Node(Kind.STR).setProp(Prop.VALUE, value);
  }

  /** {@code True}, {@code False}, or {@code None} for a null value. */
  public static Node nameConstant(@Nullable Boolean value) {
    return new Node(Kind.NAME_CONSTANT).setProp(Prop.VALUE, value);
  }

  /** Sets the context of an assignable expression, and of the elements of tuples and lists. */
  public static Node withContext(Node target, Context context) {
    switch (target.getKind()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
        target.setProp(Prop.CONTEXT, context);
        break;
      case STARRED:
        target.setProp(Prop.CONTEXT, context);
        withContext(target.getRequiredChild(Field.VALUE), context);
        break;
      case TUPLE:
      case LIST:
        target.setProp(Prop.CONTEXT, context);
        for (Node elt : target.getNonNullChildren(Field.ELTS)) {
          withContext(elt, context);
        }
        break;
      default:
        throw new IllegalArgumentException("cannot assign to " + target.getKind());
    }
    return target;
  }
}
