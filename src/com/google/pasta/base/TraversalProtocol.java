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

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.pasta.syntax.Field;
import com.google.pasta.syntax.JoinedForm;
import com.google.pasta.syntax.Kind;
import com.google.pasta.syntax.Literals;
import com.google.pasta.syntax.Node;
import com.google.pasta.syntax.Operator;
import com.google.pasta.syntax.Prop;
import com.google.pasta.syntax.Slot;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The source order of every node kind: which child nodes, tokens and formatting slots make up its
 * spelling, and in which order. This is the only per-kind description of the syntax; the
 * {@link Annotator} and the {@link CodeGenerator} both drive it.
 *
 * <p>Expression and item children have their PREFIX and SUFFIX handled by the driver. Every
 * other slot, including the affixes of statements, is spelled out here.
 */
final class TraversalProtocol {

  private static final ImmutableList<Part> WS = ImmutableList.of(Part.whitespace());
  private static final ImmutableList<Part> MULTILINE_WS =
      ImmutableList.of(Part.multilineWhitespace());
  private static final ImmutableList<Part> END_OF_LINE = ImmutableList.of(Part.endOfLine());
  private static final ImmutableList<Part> COLON_LINE =
      ImmutableList.of(Part.whitespace(), Part.token(":"), Part.endOfLine());
  private static final ImmutableList<Part> TRAILING_COMMA = ImmutableList.of(Part.optional(","));

  private final TraversalDriver d;

  TraversalProtocol(TraversalDriver driver) {
    this.d = driver;
  }

  /** Traverses {@code node}; {@code lead} is the default spacing before a group's content. */
  void traverse(Node node, String lead) {
    traverse(node, null, lead);
  }

  void traverseJoined(Node node, JoinedForm form) {
    checkArgument(node.isKind(form.getKind()), "%s cannot be spelled as %s", node, form);
    traverse(node, form, "");
  }

  private void traverse(Node node, @Nullable JoinedForm form, String lead) {
    switch (node.getKind()) {
      case MODULE:
        for (Node statement : node.getNonNullChildren(Field.BODY)) {
          d.visit(statement);
        }
        d.attr(
            node,
            Slot.SUFFIX,
            ImmutableList.of(Part.multilineWhitespace(), Part.endOfFile()),
            "");
        return;

      // Simple statements
      case EXPR:
        prefix(node);
        d.visit(node.getRequiredChild(Field.VALUE), "", "");
        suffix(node);
        return;
      case ASSIGN:
        prefix(node);
        List<Node> targets = node.getNonNullChildren(Field.TARGETS);
        for (int i = 0; i < targets.size(); i++) {
          d.visit(targets.get(i), i == 0 ? "" : " ", " ");
          d.token("=");
        }
        d.visit(node.getRequiredChild(Field.VALUE), " ", "");
        suffix(node);
        return;
      case AUG_ASSIGN:
        prefix(node);
        d.visit(node.getRequiredChild(Field.TARGET), "", " ");
        d.token(operator(node).getText() + "=");
        d.visit(node.getRequiredChild(Field.VALUE), " ", "");
        suffix(node);
        return;
      case ANN_ASSIGN:
        {
          prefix(node);
          Node value = node.getChild(Field.VALUE);
          d.visit(node.getRequiredChild(Field.TARGET), "", "");
          d.token(":");
          d.visit(node.getRequiredChild(Field.ANNOTATION), " ", value != null ? " " : "");
          if (value != null) {
            d.token("=");
            d.visit(value, " ", "");
          }
          suffix(node);
          return;
        }
      case DELETE:
        prefix(node);
        d.token("del");
        commaSeparated(node.getNonNullChildren(Field.TARGETS), " ");
        suffix(node);
        return;
      case PASS:
      case BREAK:
      case CONTINUE:
        prefix(node);
        d.token(Ascii.toLowerCase(node.getKind().name()));
        suffix(node);
        return;
      case RETURN:
        prefix(node);
        d.token("return");
        visitOptional(node.getChild(Field.VALUE), " ", "");
        suffix(node);
        return;
      case RAISE:
        {
          prefix(node);
          d.token("raise");
          Node cause = node.getChild(Field.CAUSE);
          visitOptional(node.getChild(Field.EXC), " ", cause != null ? " " : "");
          if (cause != null) {
            d.token("from");
            d.visit(cause, " ", "");
          }
          suffix(node);
          return;
        }
      case GLOBAL:
      case NONLOCAL:
        {
          prefix(node);
          d.token(node.isKind(Kind.GLOBAL) ? "global" : "nonlocal");
          List<String> names = names(node);
          d.attr(
              node,
              Slot.NAMES,
              ImmutableList.of(Part.nameList(names)),
              " " + Joiner.on(", ").join(names),
              Prop.NAMES);
          suffix(node);
          return;
        }
      case ASSERT:
        {
          prefix(node);
          d.token("assert");
          Node msg = node.getChild(Field.MSG);
          d.visit(node.getRequiredChild(Field.TEST), " ", "");
          if (msg != null) {
            d.token(",");
            d.visit(msg, " ", "");
          }
          suffix(node);
          return;
        }
      case IMPORT:
        prefix(node);
        d.token("import");
        commaSeparated(node.getNonNullChildren(Field.NAMES), " ");
        suffix(node);
        return;
      case IMPORT_FROM:
        importFrom(node);
        return;

      // Compound statements
      case IF:
        if (form == JoinedForm.ELIF) {
          d.token("elif");
        } else {
          prefix(node);
          d.token("if");
        }
        d.visit(node.getRequiredChild(Field.TEST), " ", "");
        header(node);
        block(node, Field.BODY);
        orelse(node);
        return;
      case WHILE:
        prefix(node);
        d.token("while");
        d.visit(node.getRequiredChild(Field.TEST), " ", "");
        header(node);
        block(node, Field.BODY);
        orelse(node);
        return;
      case FOR:
        prefix(node);
        d.token("for");
        d.visit(node.getRequiredChild(Field.TARGET), " ", " ");
        d.token("in");
        d.visit(node.getRequiredChild(Field.ITER), " ", "");
        header(node);
        block(node, Field.BODY);
        orelse(node);
        return;
      case WITH:
        with(node, form);
        return;
      case TRY_EXCEPT:
        if (form != JoinedForm.JOINED_TRY) {
          prefix(node);
          d.token("try");
          header(node);
        }
        block(node, Field.BODY);
        for (Node handler : node.getNonNullChildren(Field.HANDLERS)) {
          d.visit(handler);
        }
        orelse(node);
        return;
      case TRY_FINALLY:
        prefix(node);
        d.token("try");
        header(node);
        if (d.isJoinedTry(node)) {
          d.visitJoined(node, node.getNonNullChildren(Field.BODY).get(0), JoinedForm.JOINED_TRY);
        } else {
          block(node, Field.BODY);
        }
        d.attr(node, Slot.FINALLY_PREFIX, MULTILINE_WS, d.indent());
        d.token("finally");
        d.attr(node, Slot.FINALLY, COLON_LINE, ":\n");
        block(node, Field.FINALBODY);
        return;
      case FUNCTION_DEF:
        functionDef(node);
        return;
      case CLASS_DEF:
        classDef(node);
        return;

      // Clauses
      case EXCEPT_HANDLER:
        {
          d.attr(node, Slot.PREFIX, MULTILINE_WS, d.indent());
          d.token("except");
          String name = node.getString(Prop.NAME);
          visitOptional(node.getChild(Field.TYPE), " ", name != null ? " " : "");
          if (name != null) {
            d.attr(
                node,
                Slot.AS,
                ImmutableList.of(
                    Part.whitespace(), Part.token("as"), Part.whitespace(), Part.token(name)),
                "as " + name,
                Prop.NAME);
          }
          header(node);
          block(node, Field.BODY);
          return;
        }
      case DECORATOR:
        d.attr(node, Slot.PREFIX, MULTILINE_WS, d.indent());
        d.token("@");
        d.visit(node.getRequiredChild(Field.VALUE), "", "");
        d.attr(node, Slot.SUFFIX, END_OF_LINE, "\n");
        return;

      // Items
      case ARG:
        {
          d.token(node.getString(Prop.ARG));
          Node annotation = node.getChild(Field.ANNOTATION);
          if (annotation != null) {
            d.attr(node, Slot.COLON, ImmutableList.of(Part.whitespace(), Part.token(":")), ":");
            d.visit(annotation, " ", "");
          }
          return;
        }
      case KEYWORD:
        {
          String arg = node.getString(Prop.ARG);
          if (arg == null) {
            d.token("**");
          } else {
            d.token(arg);
            d.attr(node, Slot.EQUALS, ImmutableList.of(Part.whitespace(), Part.token("=")), "=");
          }
          d.visit(node.getRequiredChild(Field.VALUE), "", "");
          return;
        }
      case ALIAS:
        {
          String name = node.getString(Prop.NAME);
          String asname = node.getString(Prop.ASNAME);
          d.attr(node, Slot.CONTENT, ImmutableList.of(Part.dottedName(name)), name, Prop.NAME);
          if (asname != null) {
            d.attr(
                node,
                Slot.AS,
                ImmutableList.of(
                    Part.whitespace(), Part.token("as"), Part.whitespace(), Part.token(asname)),
                " as " + asname,
                Prop.ASNAME);
          }
          return;
        }
      case COMPREHENSION:
        {
          List<Node> ifs = node.getNonNullChildren(Field.IFS);
          d.token("for");
          d.visit(node.getRequiredChild(Field.TARGET), " ", " ");
          d.token("in");
          d.visit(node.getRequiredChild(Field.ITER), " ", ifs.isEmpty() ? "" : " ");
          for (int i = 0; i < ifs.size(); i++) {
            d.token("if");
            d.visit(ifs.get(i), " ", i < ifs.size() - 1 ? " " : "");
          }
          return;
        }

      // Groups
      case ARGUMENTS:
        arguments(node, lead);
        return;
      case CMP_OP:
        {
          Operator op = operator(node);
          List<Part> parts = new ArrayList<>();
          for (String word : op.getText().split(" ")) {
            if (!parts.isEmpty()) {
              parts.add(Part.whitespace());
            }
            parts.add(Part.token(word));
          }
          d.attr(node, Slot.CONTENT, parts, op.getText(), Prop.OP);
          return;
        }

      // Expressions
      case BOOL_OP:
        {
          List<Node> values = node.getNonNullChildren(Field.VALUES);
          for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
              d.token(operator(node).getText());
            }
            d.visit(values.get(i), i == 0 ? "" : " ", i < values.size() - 1 ? " " : "");
          }
          return;
        }
      case BIN_OP:
        d.visit(node.getRequiredChild(Field.LEFT), "", " ");
        d.token(operator(node).getText());
        d.visit(node.getRequiredChild(Field.RIGHT), " ", "");
        return;
      case UNARY_OP:
        {
          Operator op = operator(node);
          d.token(op.getText());
          d.visit(node.getRequiredChild(Field.OPERAND), op == Operator.NOT ? " " : "", "");
          return;
        }
      case LAMBDA:
        d.token("lambda");
        d.visit(node.getRequiredChild(Field.ARGS), " ", "");
        d.attr(node, Slot.COLON, ImmutableList.of(Part.whitespace(), Part.token(":")), ":");
        d.visit(node.getRequiredChild(Field.BODY), " ", "");
        return;
      case IF_EXP:
        d.visit(node.getRequiredChild(Field.BODY), "", " ");
        d.token("if");
        d.visit(node.getRequiredChild(Field.TEST), " ", " ");
        d.token("else");
        d.visit(node.getRequiredChild(Field.ORELSE), " ", "");
        return;
      case DICT:
        dict(node);
        return;
      case SET:
        d.token("{");
        commaSeparated(node.getNonNullChildren(Field.ELTS), "");
        d.attr(node, Slot.TRAILING, TRAILING_COMMA, "", Field.ELTS);
        close(node, "}");
        return;
      case LIST:
        d.token("[");
        commaSeparated(node.getNonNullChildren(Field.ELTS), "");
        d.attr(node, Slot.TRAILING, TRAILING_COMMA, "", Field.ELTS);
        close(node, "]");
        return;
      case TUPLE:
        {
          List<Node> elts = node.getNonNullChildren(Field.ELTS);
          commaSeparated(elts, "");
          d.attr(node, Slot.TRAILING, TRAILING_COMMA, elts.size() == 1 ? "," : "", Field.ELTS);
          return;
        }
      case LIST_COMP:
        d.token("[");
        d.visit(node.getRequiredChild(Field.ELT), "", "");
        generators(node);
        close(node, "]");
        return;
      case SET_COMP:
        d.token("{");
        d.visit(node.getRequiredChild(Field.ELT), "", "");
        generators(node);
        close(node, "}");
        return;
      case DICT_COMP:
        d.token("{");
        d.visit(node.getRequiredChild(Field.KEY), "", "");
        d.token(":");
        d.visit(node.getRequiredChild(Field.VALUE), " ", "");
        generators(node);
        close(node, "}");
        return;
      case GENERATOR_EXP:
        d.visit(node.getRequiredChild(Field.ELT), "", "");
        generators(node);
        return;
      case YIELD:
        d.token("yield");
        visitOptional(node.getChild(Field.VALUE), " ", "");
        return;
      case YIELD_FROM:
        d.token("yield");
        d.attr(node, Slot.FROM, ImmutableList.of(Part.whitespace(), Part.token("from")), " from");
        d.visit(node.getRequiredChild(Field.VALUE), " ", "");
        return;
      case COMPARE:
        {
          List<Node> ops = node.getNonNullChildren(Field.OPS);
          List<Node> comparators = node.getNonNullChildren(Field.COMPARATORS);
          checkArgument(ops.size() == comparators.size(), "unbalanced comparison %s", node);
          d.visit(node.getRequiredChild(Field.LEFT), "", " ");
          for (int i = 0; i < ops.size(); i++) {
            d.visit(ops.get(i));
            d.visit(comparators.get(i), " ", i < ops.size() - 1 ? " " : "");
          }
          return;
        }
      case CALL:
        d.visit(node.getRequiredChild(Field.FUNC), "", "");
        d.token("(");
        callArguments(node, Field.ARGS);
        d.attr(node, Slot.TRAILING, TRAILING_COMMA, "", Field.ARGS, Field.KEYWORDS);
        close(node, ")");
        return;
      case NUM:
        {
          Number value = (Number) node.getProp(Prop.VALUE);
          d.attr(
              node,
              Slot.CONTENT,
              ImmutableList.of(Part.number()),
              Literals.numberRepr(value, node.getBoolean(Prop.IMAGINARY)),
              Prop.VALUE,
              Prop.IMAGINARY);
          return;
        }
      case STR:
        d.attr(
            node,
            Slot.CONTENT,
            ImmutableList.of(Part.string()),
            Literals.stringRepr(
                node.getString(Prop.VALUE),
                node.getBoolean(Prop.BYTES),
                node.getBoolean(Prop.FORMATTED)),
            Prop.VALUE,
            Prop.BYTES,
            Prop.FORMATTED);
        return;
      case NAME_CONSTANT:
        {
          Object value = node.getProp(Prop.VALUE);
          d.token(value == null ? "None" : Boolean.TRUE.equals(value) ? "True" : "False");
          return;
        }
      case ELLIPSIS:
        d.token("...");
        return;
      case ATTRIBUTE:
        {
          String attr = node.getString(Prop.ATTR);
          d.visit(node.getRequiredChild(Field.VALUE), "", "");
          d.token(".");
          d.attr(
              node,
              Slot.ATTR,
              ImmutableList.of(Part.whitespace(), Part.token(attr)),
              attr,
              Prop.ATTR);
          return;
        }
      case SUBSCRIPT:
        d.visit(node.getRequiredChild(Field.VALUE), "", "");
        d.token("[");
        d.visit(node.getRequiredChild(Field.SLICE), "", "");
        close(node, "]");
        return;
      case SLICE:
        {
          Node step = node.getChild(Field.STEP);
          visitOptional(node.getChild(Field.LOWER), "", "");
          d.token(":");
          visitOptional(node.getChild(Field.UPPER), "", "");
          d.attr(
              node,
              Slot.STEP_COLON,
              ImmutableList.of(Part.optional(":")),
              step != null ? ":" : "",
              Field.STEP);
          visitOptional(step, "", "");
          return;
        }
      case STARRED:
        d.token("*");
        d.visit(node.getRequiredChild(Field.VALUE), "", "");
        return;
      case NAME:
        {
          String id = node.getString(Prop.ID);
          d.attr(node, Slot.CONTENT, ImmutableList.of(Part.token(id)), id, Prop.ID);
          return;
        }
    }
    throw new IllegalStateException("unexpected kind " + node.getKind());
  }

  private void prefix(Node statement) {
    d.attr(statement, Slot.PREFIX, MULTILINE_WS, d.indent());
    d.statementStarted(statement);
  }

  private void suffix(Node statement) {
    d.attr(statement, Slot.SUFFIX, END_OF_LINE, "\n");
  }

  private void header(Node node) {
    d.attr(node, Slot.HEADER, COLON_LINE, ":\n");
  }

  private void close(Node node, String bracket) {
    d.attr(node, Slot.CLOSE, ImmutableList.of(Part.whitespace(), Part.token(bracket)), bracket);
  }

  private void block(Node parent, Field field) {
    d.beginBlock(parent, field);
    for (Node statement : parent.getNonNullChildren(field)) {
      d.visit(statement);
    }
    d.endBlock();
  }

  private void orelse(Node node) {
    List<Node> orelse = node.getNonNullChildren(Field.ORELSE);
    if (orelse.isEmpty()) {
      return;
    }
    d.attr(node, Slot.ELSE_PREFIX, MULTILINE_WS, d.indent());
    if (d.isElif(node)) {
      d.visitJoined(node, orelse.get(0), JoinedForm.ELIF);
      return;
    }
    d.token("else");
    d.attr(node, Slot.ELSE, COLON_LINE, ":\n");
    block(node, Field.ORELSE);
  }

  private void visitOptional(@Nullable Node child, String defaultPrefix, String defaultSuffix) {
    if (child != null) {
      d.visit(child, defaultPrefix, defaultSuffix);
    }
  }

  private void commaSeparated(List<Node> items, String firstPrefix) {
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        d.token(",");
      }
      d.visit(items.get(i), i == 0 ? firstPrefix : " ", "");
    }
  }

  private void generators(Node node) {
    for (Node generator : node.getNonNullChildren(Field.GENERATORS)) {
      d.visit(generator, " ", "");
    }
  }

  private void importFrom(Node node) {
    prefix(node);
    d.token("from");
    int level = node.getInt(Prop.LEVEL);
    String module = node.getString(Prop.MODULE);
    List<Part> moduleParts = new ArrayList<>();
    moduleParts.add(Part.whitespace());
    moduleParts.add(Part.dots(level));
    if (module != null) {
      moduleParts.add(Part.dottedName(module));
    }
    d.attr(
        node,
        Slot.MODULE,
        moduleParts,
        " " + ".".repeat(level) + (module == null ? "" : module),
        Prop.MODULE,
        Prop.LEVEL);
    d.attr(node, Slot.IMPORT, ImmutableList.of(Part.whitespace(), Part.token("import")), " import");
    String open = d.attr(node, Slot.OPEN, ImmutableList.of(Part.optional("(")), "");
    commaSeparated(node.getNonNullChildren(Field.NAMES), " ");
    if (open.contains("(")) {
      d.attr(node, Slot.TRAILING, TRAILING_COMMA, "", Field.NAMES);
      close(node, ")");
    }
    suffix(node);
  }

  private void with(Node node, @Nullable JoinedForm form) {
    if (form != JoinedForm.CONTINUED_WITH) {
      prefix(node);
      d.token("with");
    }
    Node vars = node.getChild(Field.OPTIONAL_VARS);
    d.visit(node.getRequiredChild(Field.CONTEXT_EXPR), " ", vars != null ? " " : "");
    if (vars != null) {
      d.token("as");
      d.visit(vars, " ", "");
    }
    if (d.isContinuedWith(node)) {
      d.token(",");
      d.visitJoined(
          node, node.getNonNullChildren(Field.BODY).get(0), JoinedForm.CONTINUED_WITH);
      return;
    }
    header(node);
    block(node, Field.BODY);
  }

  private void functionDef(Node node) {
    for (Node decorator : node.getNonNullChildren(Field.DECORATOR_LIST)) {
      d.visit(decorator);
    }
    prefix(node);
    d.token("def");
    String name = node.getString(Prop.NAME);
    d.attr(
        node,
        Slot.NAME,
        ImmutableList.of(Part.whitespace(), Part.token(name), Part.whitespace(), Part.token("(")),
        " " + name + "(",
        Prop.NAME);
    d.visit(node.getRequiredChild(Field.ARGS), "", "");
    close(node, ")");
    Node returns = node.getChild(Field.RETURNS);
    if (returns != null) {
      d.attr(node, Slot.ARROW, ImmutableList.of(Part.whitespace(), Part.token("->")), " ->");
      d.visit(returns, " ", "");
    }
    header(node);
    block(node, Field.BODY);
  }

  private void classDef(Node node) {
    for (Node decorator : node.getNonNullChildren(Field.DECORATOR_LIST)) {
      d.visit(decorator);
    }
    prefix(node);
    d.token("class");
    String name = node.getString(Prop.NAME);
    d.attr(
        node,
        Slot.NAME,
        ImmutableList.of(Part.whitespace(), Part.token(name)),
        " " + name,
        Prop.NAME);
    boolean hasArguments =
        node.childCount(Field.BASES) > 0 || node.childCount(Field.KEYWORDS) > 0;
    String open =
        d.attr(
            node,
            Slot.OPEN,
            ImmutableList.of(Part.optional("(")),
            hasArguments ? "(" : "",
            Field.BASES,
            Field.KEYWORDS);
    if (open.contains("(")) {
      callArguments(node, Field.BASES);
      d.attr(node, Slot.TRAILING, TRAILING_COMMA, "", Field.BASES, Field.KEYWORDS);
      close(node, ")");
    }
    header(node);
    block(node, Field.BODY);
  }

  /** Positional and keyword arguments, interleaved in source order. */
  private void callArguments(Node node, Field positionalField) {
    List<Node> positional = node.getNonNullChildren(positionalField);
    List<Node> keywords = node.getNonNullChildren(Field.KEYWORDS);
    int positionalSeen = 0;
    int keywordsSeen = 0;
    while (positionalSeen < positional.size() || keywordsSeen < keywords.size()) {
      boolean first = positionalSeen + keywordsSeen == 0;
      if (!first) {
        d.token(",");
      }
      Node argument =
          d.keywordNext(node, positionalSeen, keywordsSeen)
              ? keywords.get(keywordsSeen++)
              : positional.get(positionalSeen++);
      d.visit(argument, first ? "" : " ", "");
    }
  }

  private void arguments(Node node, String lead) {
    List<Node> args = node.getNonNullChildren(Field.ARGS);
    List<Node> defaults = node.getNonNullChildren(Field.DEFAULTS);
    List<Node> kwonlyArgs = node.getNonNullChildren(Field.KWONLYARGS);
    List<@Nullable Node> kwDefaults = node.getChildren(Field.KW_DEFAULTS);
    Node vararg = node.getChild(Field.VARARG);
    Node kwarg = node.getChild(Field.KWARG);
    checkArgument(defaults.size() <= args.size(), "more defaults than arguments in %s", node);
    checkArgument(
        kwDefaults.size() == kwonlyArgs.size(), "misaligned keyword defaults in %s", node);

    int firstDefault = args.size() - defaults.size();
    int count = 0;
    for (int i = 0; i < args.size(); i++) {
      Node defaultValue = i < firstDefault ? null : defaults.get(i - firstDefault);
      parameter(args.get(i), defaultValue, count++, lead);
    }
    if (vararg != null || !kwonlyArgs.isEmpty()) {
      if (count > 0) {
        d.token(",");
      }
      String spacing = count++ == 0 ? lead : " ";
      if (vararg != null) {
        d.attr(
            node, Slot.STAR, ImmutableList.of(Part.whitespace(), Part.token("*")), spacing + "*");
        d.visit(vararg, "", "");
      } else {
        d.attr(
            node,
            Slot.STAR,
            ImmutableList.of(Part.whitespace(), Part.token("*"), Part.whitespace()),
            spacing + "*");
      }
    }
    for (int i = 0; i < kwonlyArgs.size(); i++) {
      parameter(kwonlyArgs.get(i), kwDefaults.get(i), count++, lead);
    }
    if (kwarg != null) {
      if (count > 0) {
        d.token(",");
      }
      d.attr(
          node,
          Slot.DOUBLE_STAR,
          0,
          ImmutableList.of(Part.whitespace(), Part.token("**")),
          (count++ == 0 ? lead : " ") + "**");
      d.visit(kwarg, "", "");
    }
    d.attr(
        node,
        Slot.TRAILING,
        TRAILING_COMMA,
        "",
        Field.ARGS,
        Field.DEFAULTS,
        Field.VARARG,
        Field.KWONLYARGS,
        Field.KWARG);
  }

  private void parameter(Node arg, @Nullable Node defaultValue, int index, String lead) {
    if (index > 0) {
      d.token(",");
    }
    boolean annotated = arg.getChild(Field.ANNOTATION) != null;
    String spacing = annotated ? " " : "";
    d.visit(arg, index == 0 ? lead : " ", defaultValue != null ? spacing : "");
    if (defaultValue != null) {
      d.token("=");
      d.visit(defaultValue, spacing, "");
    }
  }

  private void dict(Node node) {
    List<@Nullable Node> keys = node.getChildren(Field.KEYS);
    List<Node> values = node.getNonNullChildren(Field.VALUES);
    checkArgument(keys.size() == values.size(), "unbalanced dictionary %s", node);
    d.token("{");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        d.token(",");
      }
      Node key = keys.get(i);
      if (key == null) {
        d.attr(
            node,
            Slot.DOUBLE_STAR,
            i,
            ImmutableList.of(Part.whitespace(), Part.token("**")),
            i == 0 ? "**" : " **");
        d.visit(values.get(i), "", "");
      } else {
        d.visit(key, i == 0 ? "" : " ", "");
        d.token(":");
        d.visit(values.get(i), " ", "");
      }
    }
    d.attr(node, Slot.TRAILING, TRAILING_COMMA, "", Field.VALUES);
    close(node, "}");
  }

  private static Operator operator(Node node) {
    return (Operator) node.getProp(Prop.OP);
  }

  @SuppressWarnings("unchecked")
  private static List<String> names(Node node) {
    return (List<String>) node.getProp(Prop.NAMES);
  }
}
