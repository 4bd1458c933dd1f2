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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Recursive descent parser for Python 3 modules. Produces a tree without formatting; source
 * positions are recorded on each node for diagnostics only.
 *
 * <p>{@code async} functions and statements, {@code await}, assignment expressions and
 * positional-only parameters are not supported and raise a {@link ParseException}.
 */
public final class Parser {

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
          "return", "try", "while", "with", "yield");

  /** Binary operator precedence levels, loosest first, below unary operators. */
  private static final ImmutableList<ImmutableSet<String>> BINARY_LEVELS =
      ImmutableList.of(
          ImmutableSet.of("|"),
          ImmutableSet.of("^"),
          ImmutableSet.of("&"),
          ImmutableSet.of("<<", ">>"),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "@", "/", "%", "//"));

  private static final ImmutableSet<String> AUGMENTED_ASSIGNMENTS =
      ImmutableSet.of(
          "+=", "-=", "*=", "@=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=");

  private static final ImmutableSet<String> COMPARISONS =
      ImmutableSet.of("<", ">", "==", ">=", "<=", "!=");

  private final ImmutableList<Token> tokens;
  private int index = 0;

  private Parser(List<Token> allTokens) {
    ImmutableList.Builder<Token> significant = ImmutableList.builder();
    for (Token token : allTokens) {
      if (token.getType() != TokenType.COMMENT && token.getType() != TokenType.NL) {
        significant.add(token);
      }
    }
    this.tokens = significant.build();
  }

  /** Parses a whole module. */
  public static Node parse(String source) {
    return new Parser(Tokenizer.tokenize(source)).parseModule();
  }

  /** Whether {@code name} is a reserved word that cannot be used as an identifier. */
  public static boolean isKeyword(String name) {
    return KEYWORDS.contains(name);
  }

  private Node parseModule() {
    Node module = new Node(Kind.MODULE).setLinenoCharno(1, 0);
    while (!at(TokenType.ENDMARKER)) {
      if (at(TokenType.NEWLINE)) {
        next();
        continue;
      }
      statement(module.getNonNullChildren(Field.BODY));
    }
    return module;
  }

  // Statements

  private void statement(List<Node> out) {
    Token t = peek();
    if (t.getType() == TokenType.NAME) {
      switch (t.getText()) {
        case "if":
          out.add(ifStatement());
          return;
        case "while":
          out.add(whileStatement());
          return;
        case "for":
          out.add(forStatement());
          return;
        case "try":
          out.add(tryStatement());
          return;
        case "with":
          out.add(withStatement());
          return;
        case "def":
          out.add(functionDef(new ArrayList<>()));
          return;
        case "class":
          out.add(classDef(new ArrayList<>()));
          return;
        case "async":
          throw error("async statements are not supported");
        default:
          break;
      }
    }
    if (atOp("@")) {
      out.add(decorated());
      return;
    }
    simpleStatements(out);
  }

  private void simpleStatements(List<Node> out) {
    do {
      out.add(smallStatement());
      if (!acceptOp(";")) {
        break;
      }
    } while (!at(TokenType.NEWLINE));
    expect(TokenType.NEWLINE);
  }

  private Node smallStatement() {
    Token t = peek();
    if (t.getType() == TokenType.NAME) {
      switch (t.getText()) {
        case "pass":
          next();
          return node(Kind.PASS, t);
        case "break":
          next();
          return node(Kind.BREAK, t);
        case "continue":
          next();
          return node(Kind.CONTINUE, t);
        case "return":
          next();
          return node(Kind.RETURN, t)
              .setChild(Field.VALUE, atEndOfStatement() ? null : testListStarExpr());
        case "raise":
          return raiseStatement();
        case "global":
        case "nonlocal":
          return scopeDeclaration();
        case "del":
          return deleteStatement();
        case "assert":
          next();
          Node assertNode = node(Kind.ASSERT, t).setChild(Field.TEST, test());
          if (acceptOp(",")) {
            assertNode.setChild(Field.MSG, test());
          }
          return assertNode;
        case "import":
          return importStatement();
        case "from":
          return importFrom();
        default:
          break;
      }
    }
    return expressionStatement();
  }

  private Node raiseStatement() {
    Node raise = node(Kind.RAISE, next());
    if (!atEndOfStatement()) {
      raise.setChild(Field.EXC, test());
      if (acceptKeyword("from")) {
        raise.setChild(Field.CAUSE, test());
      }
    }
    return raise;
  }

  private Node scopeDeclaration() {
    Token t = next();
    Node node = node(t.getText().equals("global") ? Kind.GLOBAL : Kind.NONLOCAL, t);
    ImmutableList.Builder<String> names = ImmutableList.builder();
    do {
      names.add(expectName().getText());
    } while (acceptOp(","));
    return node.setProp(Prop.NAMES, names.build());
  }

  private Node deleteStatement() {
    Node delete = node(Kind.DELETE, next());
    do {
      delete.addChild(Field.TARGETS, IR.withContext(expr(), Context.DEL));
    } while (acceptOp(","));
    return delete;
  }

  private Node importStatement() {
    Node node = node(Kind.IMPORT, next());
    do {
      Token start = peek();
      Node alias = node(Kind.ALIAS, start).setProp(Prop.NAME, dottedName());
      if (acceptKeyword("as")) {
        alias.setProp(Prop.ASNAME, expectName().getText());
      }
      node.addChild(Field.NAMES, alias);
    } while (acceptOp(","));
    return node;
  }

  private Node importFrom() {
    Node node = node(Kind.IMPORT_FROM, next());
    int level = 0;
    while (atOp(".") || atOp("...")) {
      level += next().getText().length();
    }
    node.setProp(Prop.LEVEL, level);
    if (!atKeyword("import")) {
      node.setProp(Prop.MODULE, dottedName());
    } else if (level == 0) {
      throw error("expected a module name");
    }
    expectKeyword("import");
    if (atOp("*")) {
      node.addChild(Field.NAMES, node(Kind.ALIAS, next()).setProp(Prop.NAME, "*"));
      return node;
    }
    boolean parenthesized = acceptOp("(");
    do {
      if (parenthesized && atOp(")")) {
        break;
      }
      Token start = expectName();
      Node alias = node(Kind.ALIAS, start).setProp(Prop.NAME, start.getText());
      if (acceptKeyword("as")) {
        alias.setProp(Prop.ASNAME, expectName().getText());
      }
      node.addChild(Field.NAMES, alias);
    } while (acceptOp(","));
    if (parenthesized) {
      expectOp(")");
    }
    if (node.childCount(Field.NAMES) == 0) {
      throw error("expected a name to import");
    }
    return node;
  }

  private String dottedName() {
    StringBuilder name = new StringBuilder(expectName().getText());
    while (acceptOp(".")) {
      name.append('.').append(expectName().getText());
    }
    return name.toString();
  }

  private Node expressionStatement() {
    Token start = peek();
    Node first = atKeyword("yield") ? yieldExpression() : testListStarExpr();
    if (atOp(":")) {
      next();
      Node annAssign =
          node(Kind.ANN_ASSIGN, start)
              .setChild(Field.TARGET, IR.withContext(first, Context.STORE))
              .setChild(Field.ANNOTATION, test());
      if (acceptOp("=")) {
        annAssign.setChild(
            Field.VALUE, atKeyword("yield") ? yieldExpression() : testListStarExpr());
      }
      return annAssign;
    }
    if (peek().getType() == TokenType.OP && AUGMENTED_ASSIGNMENTS.contains(peek().getText())) {
      String text = next().getText();
      Operator op =
          Operator.forText(Operator.Arity.BINARY, text.substring(0, text.length() - 1));
      return node(Kind.AUG_ASSIGN, start)
          .setProp(Prop.OP, op)
          .setChild(Field.TARGET, IR.withContext(first, Context.STORE))
          .setChild(Field.VALUE, atKeyword("yield") ? yieldExpression() : testList());
    }
    if (atOp("=")) {
      List<Node> parts = new ArrayList<>();
      parts.add(first);
      while (acceptOp("=")) {
        parts.add(atKeyword("yield") ? yieldExpression() : testListStarExpr());
      }
      Node assign = node(Kind.ASSIGN, start);
      for (Node target : parts.subList(0, parts.size() - 1)) {
        assign.addChild(Field.TARGETS, IR.withContext(target, Context.STORE));
      }
      return assign.setChild(Field.VALUE, parts.get(parts.size() - 1));
    }
    if (atOp(":=")) {
      throw error("assignment expressions are not supported");
    }
    return node(Kind.EXPR, start).setChild(Field.VALUE, first);
  }

  private Node ifStatement() {
    Node ifNode = node(Kind.IF, next()).setChild(Field.TEST, namedTest());
    expectOp(":");
    suite(ifNode.getNonNullChildren(Field.BODY));
    Node current = ifNode;
    while (atKeyword("elif")) {
      Node elif = node(Kind.IF, next()).setChild(Field.TEST, namedTest());
      expectOp(":");
      suite(elif.getNonNullChildren(Field.BODY));
      current.addChild(Field.ORELSE, elif);
      current = elif;
    }
    elseClause(current);
    return ifNode;
  }

  private Node whileStatement() {
    Node whileNode = node(Kind.WHILE, next()).setChild(Field.TEST, namedTest());
    expectOp(":");
    suite(whileNode.getNonNullChildren(Field.BODY));
    elseClause(whileNode);
    return whileNode;
  }

  private Node forStatement() {
    Node forNode = node(Kind.FOR, next());
    forNode.setChild(Field.TARGET, IR.withContext(exprList(), Context.STORE));
    expectKeyword("in");
    forNode.setChild(Field.ITER, testList());
    expectOp(":");
    suite(forNode.getNonNullChildren(Field.BODY));
    elseClause(forNode);
    return forNode;
  }

  private void elseClause(Node node) {
    if (acceptKeyword("else")) {
      expectOp(":");
      suite(node.getNonNullChildren(Field.ORELSE));
    }
  }

  private Node tryStatement() {
    Token tryToken = next();
    expectOp(":");
    List<Node> body = new ArrayList<>();
    suite(body);
    Node tryExcept = node(Kind.TRY_EXCEPT, tryToken);
    while (atKeyword("except")) {
      Node handler = node(Kind.EXCEPT_HANDLER, next());
      if (!atOp(":")) {
        handler.setChild(Field.TYPE, test());
        if (acceptKeyword("as")) {
          handler.setProp(Prop.NAME, expectName().getText());
        }
      }
      expectOp(":");
      suite(handler.getNonNullChildren(Field.BODY));
      tryExcept.addChild(Field.HANDLERS, handler);
    }
    boolean hasHandlers = tryExcept.childCount(Field.HANDLERS) > 0;
    if (hasHandlers) {
      tryExcept.getNonNullChildren(Field.BODY).addAll(body);
      elseClause(tryExcept);
    }
    if (!acceptKeyword("finally")) {
      if (!hasHandlers) {
        throw error("expected 'except' or 'finally' block");
      }
      return tryExcept;
    }
    expectOp(":");
    Node tryFinally = node(Kind.TRY_FINALLY, tryToken);
    if (hasHandlers) {
      tryFinally.addChild(Field.BODY, tryExcept);
    } else {
      tryFinally.getNonNullChildren(Field.BODY).addAll(body);
    }
    suite(tryFinally.getNonNullChildren(Field.FINALBODY));
    return tryFinally;
  }

  private Node withStatement() {
    Token withToken = next();
    List<Node> items = new ArrayList<>();
    do {
      Token start = items.isEmpty() ? withToken : peek();
      Node item = node(Kind.WITH, start).setChild(Field.CONTEXT_EXPR, test());
      if (acceptKeyword("as")) {
        item.setChild(Field.OPTIONAL_VARS, IR.withContext(expr(), Context.STORE));
      }
      if (!items.isEmpty()) {
        items.get(items.size() - 1).addChild(Field.BODY, item);
      }
      items.add(item);
    } while (acceptOp(","));
    expectOp(":");
    suite(items.get(items.size() - 1).getNonNullChildren(Field.BODY));
    return items.get(0);
  }

  private Node decorated() {
    List<Node> decorators = new ArrayList<>();
    while (atOp("@")) {
      Node decorator = node(Kind.DECORATOR, next()).setChild(Field.VALUE, namedTest());
      expect(TokenType.NEWLINE);
      decorators.add(decorator);
    }
    if (atKeyword("def")) {
      return functionDef(decorators);
    } else if (atKeyword("class")) {
      return classDef(decorators);
    }
    throw error("expected a function or class definition");
  }

  private Node functionDef(List<Node> decorators) {
    Node def = node(Kind.FUNCTION_DEF, next());
    def.getNonNullChildren(Field.DECORATOR_LIST).addAll(decorators);
    def.setProp(Prop.NAME, expectName().getText());
    expectOp("(");
    def.setChild(Field.ARGS, arguments(true, ")"));
    expectOp(")");
    if (acceptOp("->")) {
      def.setChild(Field.RETURNS, test());
    }
    expectOp(":");
    suite(def.getNonNullChildren(Field.BODY));
    return def;
  }

  private Node classDef(List<Node> decorators) {
    Node classDef = node(Kind.CLASS_DEF, next());
    classDef.getNonNullChildren(Field.DECORATOR_LIST).addAll(decorators);
    classDef.setProp(Prop.NAME, expectName().getText());
    if (acceptOp("(")) {
      callArguments(classDef, Field.BASES);
    }
    expectOp(":");
    suite(classDef.getNonNullChildren(Field.BODY));
    return classDef;
  }

  private void suite(List<Node> out) {
    if (!at(TokenType.NEWLINE)) {
      simpleStatements(out);
      return;
    }
    next();
    expect(TokenType.INDENT);
    do {
      statement(out);
    } while (!at(TokenType.DEDENT));
    expect(TokenType.DEDENT);
  }

  /** Parses parameters up to, but not including, {@code closer}. */
  private Node arguments(boolean annotated, String closer) {
    Node arguments = node(Kind.ARGUMENTS, peek());
    boolean keywordOnly = false;
    while (!atOp(closer)) {
      if (acceptOp("**")) {
        arguments.setChild(Field.KWARG, parameter(annotated));
        acceptOp(",");
        break;
      } else if (atOp("*")) {
        next();
        keywordOnly = true;
        if (peek().getType() == TokenType.NAME) {
          arguments.setChild(Field.VARARG, parameter(annotated));
        }
      } else if (atOp("/")) {
        throw error("positional-only parameters are not supported");
      } else {
        Node arg = parameter(annotated);
        Node defaultValue = acceptOp("=") ? test() : null;
        if (keywordOnly) {
          arguments.addChild(Field.KWONLYARGS, arg);
          arguments.addChild(Field.KW_DEFAULTS, defaultValue);
        } else {
          arguments.addChild(Field.ARGS, arg);
          if (defaultValue != null) {
            arguments.addChild(Field.DEFAULTS, defaultValue);
          } else if (arguments.childCount(Field.DEFAULTS) > 0) {
            throw error("non-default argument follows default argument");
          }
        }
      }
      if (!acceptOp(",")) {
        break;
      }
    }
    return arguments;
  }

  private Node parameter(boolean annotated) {
    Token name = expectName();
    Node arg = node(Kind.ARG, name).setProp(Prop.ARG, name.getText());
    if (annotated && acceptOp(":")) {
      arg.setChild(Field.ANNOTATION, test());
    }
    return arg;
  }

  // Expressions

  private Node namedTest() {
    Node test = test();
    if (atOp(":=")) {
      throw error("assignment expressions are not supported");
    }
    return test;
  }

  private Node test() {
    if (atKeyword("lambda")) {
      return lambda(true);
    }
    Node body = orTest();
    if (!atKeyword("if")) {
      return body;
    }
    next();
    Node test = orTest();
    expectKeyword("else");
    return position(new Node(Kind.IF_EXP), body)
        .setChild(Field.BODY, body)
        .setChild(Field.TEST, test)
        .setChild(Field.ORELSE, test());
  }

  private Node testNoCond() {
    return atKeyword("lambda") ? lambda(false) : orTest();
  }

  private Node lambda(boolean allowConditional) {
    Node lambda = node(Kind.LAMBDA, next()).setChild(Field.ARGS, arguments(false, ":"));
    expectOp(":");
    return lambda.setChild(Field.BODY, allowConditional ? test() : testNoCond());
  }

  private Node orTest() {
    return booleanChain(Operator.OR, this::andTest);
  }

  private Node andTest() {
    return booleanChain(Operator.AND, this::notTest);
  }

  private Node booleanChain(Operator op, Supplier<Node> operand) {
    Node first = operand.get();
    if (!atKeyword(op.getText())) {
      return first;
    }
    Node chain = position(new Node(Kind.BOOL_OP), first).setProp(Prop.OP, op);
    chain.addChild(Field.VALUES, first);
    while (acceptKeyword(op.getText())) {
      chain.addChild(Field.VALUES, operand.get());
    }
    return chain;
  }

  private Node notTest() {
    if (atKeyword("not")) {
      Token not = next();
      return node(Kind.UNARY_OP, not)
          .setProp(Prop.OP, Operator.NOT)
          .setChild(Field.OPERAND, notTest());
    }
    return comparison();
  }

  private Node comparison() {
    Node left = expr();
    Node compare = null;
    while (true) {
      Token t = peek();
      Operator op;
      if (t.getType() == TokenType.OP && COMPARISONS.contains(t.getText())) {
        op = Operator.forText(Operator.Arity.COMPARISON, t.getText());
      } else if (t.isName("in")) {
        op = Operator.IN;
      } else if (t.isName("not") && peek(1).isName("in")) {
        op = Operator.NOT_IN;
      } else if (t.isName("is")) {
        op = peek(1).isName("not") ? Operator.IS_NOT : Operator.IS;
      } else {
        break;
      }
      next();
      if (op.isTwoWords()) {
        next();
      }
      if (compare == null) {
        compare = position(new Node(Kind.COMPARE), left).setChild(Field.LEFT, left);
      }
      compare.addChild(Field.OPS, node(Kind.CMP_OP, t).setProp(Prop.OP, op));
      compare.addChild(Field.COMPARATORS, expr());
    }
    return compare == null ? left : compare;
  }

  private Node starExpr() {
    Token star = next();
    return starred(star, expr());
  }

  /** A bitwise-or level expression. */
  private Node expr() {
    return binary(0);
  }

  private Node binary(int level) {
    if (level == BINARY_LEVELS.size()) {
      return factor();
    }
    Node left = binary(level + 1);
    while (peek().getType() == TokenType.OP
        && BINARY_LEVELS.get(level).contains(peek().getText())) {
      Operator op = Operator.forText(Operator.Arity.BINARY, next().getText());
      Node right = binary(level + 1);
      left =
          position(new Node(Kind.BIN_OP), left)
              .setProp(Prop.OP, op)
              .setChild(Field.LEFT, left)
              .setChild(Field.RIGHT, right);
    }
    return left;
  }

  private Node factor() {
    Token t = peek();
    if (t.isOp("+") || t.isOp("-") || t.isOp("~")) {
      next();
      Operator op = t.isOp("~") ? Operator.INVERT : t.isOp("+") ? Operator.UADD : Operator.USUB;
      return node(Kind.UNARY_OP, t).setProp(Prop.OP, op).setChild(Field.OPERAND, factor());
    }
    return power();
  }

  private Node power() {
    Node base = atomExpr();
    if (acceptOp("**")) {
      return position(new Node(Kind.BIN_OP), base)
          .setProp(Prop.OP, Operator.POW)
          .setChild(Field.LEFT, base)
          .setChild(Field.RIGHT, factor());
    }
    return base;
  }

  private Node atomExpr() {
    if (atKeyword("await")) {
      throw error("await is not supported");
    }
    Node node = atom();
    while (true) {
      if (acceptOp("(")) {
        Node call = position(new Node(Kind.CALL), node).setChild(Field.FUNC, node);
        callArguments(call, Field.ARGS);
        node = call;
      } else if (acceptOp("[")) {
        node =
            position(new Node(Kind.SUBSCRIPT), node)
                .setProp(Prop.CONTEXT, Context.LOAD)
                .setChild(Field.VALUE, node)
                .setChild(Field.SLICE, subscriptList());
        expectOp("]");
      } else if (acceptOp(".")) {
        node =
            position(new Node(Kind.ATTRIBUTE), node)
                .setProp(Prop.CONTEXT, Context.LOAD)
                .setChild(Field.VALUE, node)
                .setProp(Prop.ATTR, expectName().getText());
      } else {
        return node;
      }
    }
  }

  /**
   * Parses call arguments after the opening parenthesis, through the closing one. Positional
   * arguments go to {@code positionalField}, keyword arguments to KEYWORDS.
   */
  private void callArguments(Node call, Field positionalField) {
    while (!atOp(")")) {
      if (atOp("*")) {
        call.addChild(positionalField, starred(next(), test()));
      } else if (atOp("**")) {
        Token star = next();
        call.addChild(Field.KEYWORDS, node(Kind.KEYWORD, star).setChild(Field.VALUE, test()));
      } else if (peek().getType() == TokenType.NAME && peek(1).isOp("=")) {
        Token name = expectName();
        next();
        call.addChild(
            Field.KEYWORDS,
            node(Kind.KEYWORD, name)
                .setProp(Prop.ARG, name.getText())
                .setChild(Field.VALUE, test()));
      } else {
        Node arg = test();
        if (atKeyword("for")) {
          arg = comprehension(Kind.GENERATOR_EXP, arg);
        }
        call.addChild(positionalField, arg);
      }
      if (!acceptOp(",")) {
        break;
      }
    }
    expectOp(")");
  }

  private Node subscriptList() {
    Node first = subscript();
    if (!atOp(",")) {
      return first;
    }
    Node tuple = position(new Node(Kind.TUPLE), first).setProp(Prop.CONTEXT, Context.LOAD);
    tuple.addChild(Field.ELTS, first);
    while (acceptOp(",")) {
      if (atOp("]")) {
        break;
      }
      tuple.addChild(Field.ELTS, subscript());
    }
    return tuple;
  }

  private Node subscript() {
    Token start = peek();
    Node lower = atOp(":") ? null : test();
    if (!atOp(":")) {
      return lower;
    }
    next();
    Node slice = node(Kind.SLICE, start).setChild(Field.LOWER, lower);
    if (!atOp(":") && !atOp(",") && !atOp("]")) {
      slice.setChild(Field.UPPER, test());
    }
    if (acceptOp(":") && !atOp(",") && !atOp("]")) {
      slice.setChild(Field.STEP, test());
    }
    return slice;
  }

  private Node atom() {
    Token t = peek();
    switch (t.getType()) {
      case NUMBER:
        next();
        return node(Kind.NUM, t)
            .setProp(Prop.VALUE, Literals.decodeNumber(t.getText()))
            .setProp(Prop.IMAGINARY, Literals.isImaginary(t.getText()) ? true : null);
      case STRING:
        {
          StringBuilder value = new StringBuilder();
          boolean formatted = false;
          while (at(TokenType.STRING)) {
            String spelling = next().getText();
            formatted |= Literals.isFormatted(spelling);
            value.append(Literals.decodeString(spelling));
          }
          return node(Kind.STR, t)
              .setProp(Prop.VALUE, value.toString())
              .setProp(Prop.BYTES, Literals.isBytes(t.getText()) ? true : null)
              .setProp(Prop.FORMATTED, formatted ? true : null);
        }
      case NAME:
        switch (t.getText()) {
          case "True":
            next();
            return node(Kind.NAME_CONSTANT, t).setProp(Prop.VALUE, true);
          case "False":
            next();
            return node(Kind.NAME_CONSTANT, t).setProp(Prop.VALUE, false);
          case "None":
            next();
            return node(Kind.NAME_CONSTANT, t);
          default:
            Token name = expectName();
            return node(Kind.NAME, name)
                .setProp(Prop.ID, name.getText())
                .setProp(Prop.CONTEXT, Context.LOAD);
        }
      case OP:
        switch (t.getText()) {
          case "(":
            return parenthesized();
          case "[":
            return listDisplay();
          case "{":
            return braceDisplay();
          case "...":
            next();
            return node(Kind.ELLIPSIS, t);
          default:
            break;
        }
        break;
      default:
        break;
    }
    throw error("expected an expression");
  }

  private Node parenthesized() {
    Token open = next();
    if (acceptOp(")")) {
      return node(Kind.TUPLE, open).setProp(Prop.CONTEXT, Context.LOAD);
    }
    if (atKeyword("yield")) {
      Node yield = yieldExpression();
      expectOp(")");
      return yield;
    }
    Node first = testOrStar();
    if (atKeyword("for")) {
      Node generator = comprehension(Kind.GENERATOR_EXP, first);
      expectOp(")");
      return generator;
    }
    if (atOp(":=")) {
      throw error("assignment expressions are not supported");
    }
    if (!atOp(",")) {
      expectOp(")");
      return first;
    }
    Node tuple = node(Kind.TUPLE, open).setProp(Prop.CONTEXT, Context.LOAD);
    tuple.addChild(Field.ELTS, first);
    while (acceptOp(",")) {
      if (atOp(")")) {
        break;
      }
      tuple.addChild(Field.ELTS, testOrStar());
    }
    expectOp(")");
    return tuple;
  }

  private Node listDisplay() {
    Token open = next();
    if (acceptOp("]")) {
      return node(Kind.LIST, open).setProp(Prop.CONTEXT, Context.LOAD);
    }
    Node first = testOrStar();
    if (atKeyword("for")) {
      Node comp = comprehension(Kind.LIST_COMP, first);
      expectOp("]");
      return position(comp, open);
    }
    Node list = node(Kind.LIST, open).setProp(Prop.CONTEXT, Context.LOAD);
    list.addChild(Field.ELTS, first);
    while (acceptOp(",")) {
      if (atOp("]")) {
        break;
      }
      list.addChild(Field.ELTS, testOrStar());
    }
    expectOp("]");
    return list;
  }

  private Node braceDisplay() {
    Token open = next();
    if (acceptOp("}")) {
      return node(Kind.DICT, open);
    }
    if (atOp("**")) {
      next();
      Node dict = node(Kind.DICT, open);
      dict.addChild(Field.KEYS, null);
      dict.addChild(Field.VALUES, expr());
      return dictItems(dict);
    }
    Node first = testOrStar();
    if (acceptOp(":")) {
      Node value = test();
      if (atKeyword("for")) {
        Node comp =
            node(Kind.DICT_COMP, open).setChild(Field.KEY, first).setChild(Field.VALUE, value);
        generators(comp);
        expectOp("}");
        return comp;
      }
      Node dict = node(Kind.DICT, open);
      dict.addChild(Field.KEYS, first);
      dict.addChild(Field.VALUES, value);
      return dictItems(dict);
    }
    if (atKeyword("for")) {
      Node comp = comprehension(Kind.SET_COMP, first);
      expectOp("}");
      return position(comp, open);
    }
    Node set = node(Kind.SET, open);
    set.addChild(Field.ELTS, first);
    while (acceptOp(",")) {
      if (atOp("}")) {
        break;
      }
      set.addChild(Field.ELTS, testOrStar());
    }
    expectOp("}");
    return set;
  }

  private Node dictItems(Node dict) {
    while (acceptOp(",")) {
      if (atOp("}")) {
        break;
      }
      if (acceptOp("**")) {
        dict.addChild(Field.KEYS, null);
        dict.addChild(Field.VALUES, expr());
      } else {
        dict.addChild(Field.KEYS, test());
        expectOp(":");
        dict.addChild(Field.VALUES, test());
      }
    }
    expectOp("}");
    return dict;
  }

  private Node comprehension(Kind kind, Node elt) {
    Node comp = position(new Node(kind), elt).setChild(Field.ELT, elt);
    generators(comp);
    return comp;
  }

  private void generators(Node comp) {
    while (atKeyword("for")) {
      Node generator = node(Kind.COMPREHENSION, next());
      generator.setChild(Field.TARGET, IR.withContext(exprList(), Context.STORE));
      expectKeyword("in");
      generator.setChild(Field.ITER, orTest());
      while (acceptKeyword("if")) {
        generator.addChild(Field.IFS, testNoCond());
      }
      comp.addChild(Field.GENERATORS, generator);
    }
    if (atKeyword("async")) {
      throw error("async comprehensions are not supported");
    }
  }

  private Node yieldExpression() {
    Token yield = next();
    if (acceptKeyword("from")) {
      return node(Kind.YIELD_FROM, yield).setChild(Field.VALUE, test());
    }
    Node node = node(Kind.YIELD, yield);
    if (startsExpression(peek())) {
      node.setChild(Field.VALUE, testListStarExpr());
    }
    return node;
  }

  private Node testOrStar() {
    return atOp("*") ? starExpr() : test();
  }

  private Node testList() {
    return tupleOf(this::test);
  }

  private Node testListStarExpr() {
    return tupleOf(this::testOrStar);
  }

  private Node exprList() {
    return tupleOf(() -> atOp("*") ? starExpr() : expr());
  }

  /** Parses one element, or a tuple of them if commas follow. */
  private Node tupleOf(Supplier<Node> element) {
    Node first = element.get();
    if (!atOp(",")) {
      return first;
    }
    Node tuple = position(new Node(Kind.TUPLE), first).setProp(Prop.CONTEXT, Context.LOAD);
    tuple.addChild(Field.ELTS, first);
    while (acceptOp(",")) {
      if (!startsExpression(peek()) || atKeyword("in")) {
        break;
      }
      tuple.addChild(Field.ELTS, element.get());
    }
    return tuple;
  }

  private static Node starred(Token star, Node value) {
    return new Node(Kind.STARRED)
        .setLinenoCharno(star.getLineno(), star.getCharno())
        .setProp(Prop.CONTEXT, Context.LOAD)
        .setChild(Field.VALUE, value);
  }

  private static boolean startsExpression(Token t) {
    switch (t.getType()) {
      case NUMBER:
      case STRING:
        return true;
      case NAME:
        return !KEYWORDS.contains(t.getText())
            || ImmutableSet.of("lambda", "not", "None", "True", "False").contains(t.getText());
      case OP:
        return ImmutableSet.of("(", "[", "{", "-", "+", "~", "*", "...").contains(t.getText());
      default:
        return false;
    }
  }

  // Token helpers

  private boolean atEndOfStatement() {
    return at(TokenType.NEWLINE) || atOp(";") || at(TokenType.ENDMARKER);
  }

  private Token peek() {
    return tokens.get(index);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(index + ahead, tokens.size() - 1));
  }

  private Token next() {
    Token t = tokens.get(index);
    if (t.getType() != TokenType.ENDMARKER) {
      index++;
    }
    return t;
  }

  private boolean at(TokenType type) {
    return peek().getType() == type;
  }

  private boolean atOp(String op) {
    return peek().isOp(op);
  }

  private boolean atKeyword(String keyword) {
    return peek().isName(keyword);
  }

  private boolean acceptOp(String op) {
    if (atOp(op)) {
      next();
      return true;
    }
    return false;
  }

  private boolean acceptKeyword(String keyword) {
    if (atKeyword(keyword)) {
      next();
      return true;
    }
    return false;
  }

  private Token expect(TokenType type) {
    if (!at(type)) {
      throw error("expected " + type);
    }
    return next();
  }

  private Token expectOp(String op) {
    if (!atOp(op)) {
      throw error("expected '" + op + "'");
    }
    return next();
  }

  private Token expectKeyword(String keyword) {
    if (!atKeyword(keyword)) {
      throw error("expected '" + keyword + "'");
    }
    return next();
  }

  private Token expectName() {
    Token t = peek();
    if (t.getType() != TokenType.NAME || KEYWORDS.contains(t.getText())) {
      throw error("expected a name");
    }
    return next();
  }

  private ParseException error(String message) {
    return new ParseException(message, peek());
  }

  private static Node node(Kind kind, Token start) {
    return new Node(kind).setLinenoCharno(start.getLineno(), start.getCharno());
  }

  private static Node position(Node node, @Nullable Node start) {
    return start == null ? node : node.setLinenoCharno(start.getLineno(), start.getCharno());
  }

  private static Node position(Node node, Token start) {
    return node.setLinenoCharno(start.getLineno(), start.getCharno());
  }
}
