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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of syntax tree nodes. Each kind declares its schema: the child {@link Field}s in
 * schema order with their arity, the {@link Prop}s it carries and the formatting {@link Slot}s
 * its traversal may capture.
 */
public enum Kind {
  MODULE(Category.MODULE, fields(list(Field.BODY))),

  // Simple statements
  EXPR(Category.SIMPLE_STATEMENT, fields(one(Field.VALUE))),
  ASSIGN(Category.SIMPLE_STATEMENT, fields(list(Field.TARGETS), one(Field.VALUE))),
  AUG_ASSIGN(
      Category.SIMPLE_STATEMENT,
      fields(one(Field.TARGET), one(Field.VALUE)),
      props(Prop.OP),
      slots()),
  ANN_ASSIGN(
      Category.SIMPLE_STATEMENT,
      fields(one(Field.TARGET), one(Field.ANNOTATION), optional(Field.VALUE))),
  DELETE(Category.SIMPLE_STATEMENT, fields(list(Field.TARGETS))),
  PASS(Category.SIMPLE_STATEMENT, fields()),
  BREAK(Category.SIMPLE_STATEMENT, fields()),
  CONTINUE(Category.SIMPLE_STATEMENT, fields()),
  RETURN(Category.SIMPLE_STATEMENT, fields(optional(Field.VALUE))),
  RAISE(Category.SIMPLE_STATEMENT, fields(optional(Field.EXC), optional(Field.CAUSE))),
  GLOBAL(Category.SIMPLE_STATEMENT, fields(), props(Prop.NAMES), slots(Slot.NAMES)),
  NONLOCAL(Category.SIMPLE_STATEMENT, fields(), props(Prop.NAMES), slots(Slot.NAMES)),
  ASSERT(Category.SIMPLE_STATEMENT, fields(one(Field.TEST), optional(Field.MSG))),
  IMPORT(Category.SIMPLE_STATEMENT, fields(list(Field.NAMES))),
  IMPORT_FROM(
      Category.SIMPLE_STATEMENT,
      fields(list(Field.NAMES)),
      props(Prop.MODULE, Prop.LEVEL),
      slots(Slot.MODULE, Slot.IMPORT, Slot.OPEN, Slot.TRAILING, Slot.CLOSE)),

  // Compound statements
  IF(
      Category.COMPOUND_STATEMENT,
      fields(one(Field.TEST), list(Field.BODY), list(Field.ORELSE)),
      props(),
      slots(Slot.ELSE_PREFIX, Slot.ELSE)),
  WHILE(
      Category.COMPOUND_STATEMENT,
      fields(one(Field.TEST), list(Field.BODY), list(Field.ORELSE)),
      props(),
      slots(Slot.ELSE_PREFIX, Slot.ELSE)),
  FOR(
      Category.COMPOUND_STATEMENT,
      fields(one(Field.TARGET), one(Field.ITER), list(Field.BODY), list(Field.ORELSE)),
      props(),
      slots(Slot.ELSE_PREFIX, Slot.ELSE)),
  /** A single-item with statement; {@code with a, b:} nests a second WITH as the only body. */
  WITH(
      Category.COMPOUND_STATEMENT,
      fields(one(Field.CONTEXT_EXPR), optional(Field.OPTIONAL_VARS), list(Field.BODY))),
  TRY_EXCEPT(
      Category.COMPOUND_STATEMENT,
      fields(list(Field.BODY), list(Field.HANDLERS), list(Field.ORELSE)),
      props(),
      slots(Slot.ELSE_PREFIX, Slot.ELSE)),
  /** {@code try/except/finally} is a TRY_FINALLY whose only body statement is a TRY_EXCEPT. */
  TRY_FINALLY(
      Category.COMPOUND_STATEMENT,
      fields(list(Field.BODY), list(Field.FINALBODY)),
      props(),
      slots(Slot.FINALLY_PREFIX, Slot.FINALLY)),
  FUNCTION_DEF(
      Category.COMPOUND_STATEMENT,
      fields(
          list(Field.DECORATOR_LIST), one(Field.ARGS), optional(Field.RETURNS), list(Field.BODY)),
      props(Prop.NAME),
      slots(Slot.NAME, Slot.CLOSE, Slot.ARROW)),
  CLASS_DEF(
      Category.COMPOUND_STATEMENT,
      fields(
          list(Field.DECORATOR_LIST), list(Field.BASES), list(Field.KEYWORDS), list(Field.BODY)),
      props(Prop.NAME),
      slots(Slot.NAME, Slot.OPEN, Slot.TRAILING, Slot.CLOSE)),

  // Clauses
  EXCEPT_HANDLER(
      Category.CLAUSE,
      fields(optional(Field.TYPE), list(Field.BODY)),
      props(Prop.NAME),
      slots(Slot.PREFIX, Slot.AS, Slot.HEADER)),
  DECORATOR(Category.CLAUSE, fields(one(Field.VALUE)), props(), slots(Slot.PREFIX, Slot.SUFFIX)),

  // Items of lists that are not expressions
  ARG(Category.ITEM, fields(optional(Field.ANNOTATION)), props(Prop.ARG), slots(Slot.COLON)),
  KEYWORD(Category.ITEM, fields(one(Field.VALUE)), props(Prop.ARG), slots(Slot.EQUALS)),
  ALIAS(Category.ITEM, fields(), props(Prop.NAME, Prop.ASNAME), slots(Slot.CONTENT, Slot.AS)),
  COMPREHENSION(
      Category.ITEM, fields(one(Field.TARGET), one(Field.ITER), list(Field.IFS))),

  // Groups without formatting of their own
  ARGUMENTS(
      Category.GROUP,
      fields(
          list(Field.ARGS),
          list(Field.DEFAULTS),
          optional(Field.VARARG),
          list(Field.KWONLYARGS),
          nullableList(Field.KW_DEFAULTS),
          optional(Field.KWARG)),
      props(),
      slots(Slot.STAR, Slot.DOUBLE_STAR, Slot.TRAILING)),
  CMP_OP(Category.GROUP, fields(), props(Prop.OP), slots(Slot.CONTENT)),

  // Expressions
  BOOL_OP(Category.EXPRESSION, fields(list(Field.VALUES)), props(Prop.OP), slots()),
  BIN_OP(Category.EXPRESSION, fields(one(Field.LEFT), one(Field.RIGHT)), props(Prop.OP), slots()),
  UNARY_OP(Category.EXPRESSION, fields(one(Field.OPERAND)), props(Prop.OP), slots()),
  LAMBDA(
      Category.EXPRESSION,
      fields(one(Field.ARGS), one(Field.BODY)),
      props(),
      slots(Slot.COLON)),
  IF_EXP(Category.EXPRESSION, fields(one(Field.TEST), one(Field.BODY), one(Field.ORELSE))),
  /** A dictionary display; a null key marks a {@code **mapping} item. */
  DICT(
      Category.EXPRESSION,
      fields(nullableList(Field.KEYS), list(Field.VALUES)),
      props(),
      slots(Slot.TRAILING, Slot.CLOSE, Slot.DOUBLE_STAR)),
  SET(Category.EXPRESSION, fields(list(Field.ELTS)), props(), slots(Slot.TRAILING, Slot.CLOSE)),
  LIST_COMP(
      Category.EXPRESSION,
      fields(one(Field.ELT), list(Field.GENERATORS)),
      props(),
      slots(Slot.CLOSE)),
  SET_COMP(
      Category.EXPRESSION,
      fields(one(Field.ELT), list(Field.GENERATORS)),
      props(),
      slots(Slot.CLOSE)),
  DICT_COMP(
      Category.EXPRESSION,
      fields(one(Field.KEY), one(Field.VALUE), list(Field.GENERATORS)),
      props(),
      slots(Slot.CLOSE)),
  GENERATOR_EXP(Category.EXPRESSION, fields(one(Field.ELT), list(Field.GENERATORS))),
  YIELD(Category.EXPRESSION, fields(optional(Field.VALUE))),
  YIELD_FROM(Category.EXPRESSION, fields(one(Field.VALUE)), props(), slots(Slot.FROM)),
  COMPARE(
      Category.EXPRESSION,
      fields(one(Field.LEFT), list(Field.OPS), list(Field.COMPARATORS))),
  CALL(
      Category.EXPRESSION,
      fields(one(Field.FUNC), list(Field.ARGS), list(Field.KEYWORDS)),
      props(),
      slots(Slot.TRAILING, Slot.CLOSE)),
  NUM(Category.EXPRESSION, fields(), props(Prop.VALUE, Prop.IMAGINARY), slots(Slot.CONTENT)),
  STR(
      Category.EXPRESSION,
      fields(),
      props(Prop.VALUE, Prop.BYTES, Prop.FORMATTED),
      slots(Slot.CONTENT)),
  NAME_CONSTANT(Category.EXPRESSION, fields(), props(Prop.VALUE), slots()),
  ELLIPSIS(Category.EXPRESSION, fields()),
  ATTRIBUTE(
      Category.EXPRESSION,
      fields(one(Field.VALUE)),
      props(Prop.ATTR, Prop.CONTEXT),
      slots(Slot.ATTR)),
  SUBSCRIPT(
      Category.EXPRESSION,
      fields(one(Field.VALUE), one(Field.SLICE)),
      props(Prop.CONTEXT),
      slots(Slot.CLOSE)),
  SLICE(
      Category.EXPRESSION,
      fields(optional(Field.LOWER), optional(Field.UPPER), optional(Field.STEP)),
      props(),
      slots(Slot.STEP_COLON)),
  STARRED(Category.EXPRESSION, fields(one(Field.VALUE)), props(Prop.CONTEXT), slots()),
  NAME(Category.EXPRESSION, fields(), props(Prop.ID, Prop.CONTEXT), slots(Slot.CONTENT)),
  LIST(
      Category.EXPRESSION,
      fields(list(Field.ELTS)),
      props(Prop.CONTEXT),
      slots(Slot.TRAILING, Slot.CLOSE)),
  TUPLE(Category.EXPRESSION, fields(list(Field.ELTS)), props(Prop.CONTEXT), slots(Slot.TRAILING));

  /** Broad syntactic roles, which decide how a node's outer formatting is captured. */
  public enum Category {
    MODULE(Slot.SUFFIX),
    SIMPLE_STATEMENT(Slot.PREFIX, Slot.SUFFIX),
    COMPOUND_STATEMENT(Slot.PREFIX, Slot.HEADER),
    CLAUSE,
    ITEM(Slot.PREFIX, Slot.SUFFIX),
    GROUP,
    EXPRESSION(Slot.PREFIX, Slot.SUFFIX);

    private final ImmutableSet<Slot> implicitSlots;

    Category(Slot... implicitSlots) {
      this.implicitSlots = ImmutableSet.copyOf(implicitSlots);
    }

    public boolean isStatement() {
      return this == SIMPLE_STATEMENT || this == COMPOUND_STATEMENT;
    }

    /** Whether PREFIX and SUFFIX are captured around the node by whoever visits it. */
    public boolean hasAffixes() {
      return this == ITEM || this == EXPRESSION;
    }
  }

  /** How many nodes a field holds. */
  public enum Arity {
    ONE,
    OPTIONAL,
    LIST,
    /** A list whose elements may be null. */
    NULLABLE_LIST;

    public boolean isList() {
      return this == LIST || this == NULLABLE_LIST;
    }
  }

  /** A child field of a kind together with its arity. */
  public static final class FieldSpec {
    private final Field field;
    private final Arity arity;

    FieldSpec(Field field, Arity arity) {
      this.field = field;
      this.arity = arity;
    }

    public Field getField() {
      return field;
    }

    public Arity getArity() {
      return arity;
    }
  }

  private final Category category;
  private final ImmutableList<FieldSpec> fields;
  private final ImmutableMap<Field, FieldSpec> fieldsByName;
  private final ImmutableSet<Prop> props;
  private final ImmutableSet<Slot> slots;

  Kind(Category category, ImmutableList<FieldSpec> fields) {
    this(category, fields, props(), slots());
  }

  Kind(
      Category category,
      ImmutableList<FieldSpec> fields,
      ImmutableSet<Prop> props,
      ImmutableSet<Slot> slots) {
    this.category = category;
    this.fields = fields;
    ImmutableMap.Builder<Field, FieldSpec> byName = ImmutableMap.builder();
    for (FieldSpec spec : fields) {
      byName.put(spec.field, spec);
    }
    this.fieldsByName = byName.buildOrThrow();
    this.props = props;
    this.slots = Sets.union(category.implicitSlots, slots).immutableCopy();
  }

  public Category getCategory() {
    return category;
  }

  public boolean isStatement() {
    return category.isStatement();
  }

  public boolean isExpression() {
    return category == Category.EXPRESSION;
  }

  /** The child fields in schema order. */
  public ImmutableList<FieldSpec> getFields() {
    return fields;
  }

  public @Nullable FieldSpec getFieldSpec(Field field) {
    return fieldsByName.get(field);
  }

  public boolean hasField(Field field) {
    return fieldsByName.containsKey(field);
  }

  public boolean hasProp(Prop prop) {
    return props.contains(prop);
  }

  public boolean hasSlot(Slot slot) {
    return slots.contains(slot);
  }

  public ImmutableSet<Slot> getSlots() {
    return slots;
  }

  private static ImmutableList<FieldSpec> fields(FieldSpec... specs) {
    return ImmutableList.copyOf(specs);
  }

  private static FieldSpec one(Field field) {
    return new FieldSpec(field, Arity.ONE);
  }

  private static FieldSpec optional(Field field) {
    return new FieldSpec(field, Arity.OPTIONAL);
  }

  private static FieldSpec list(Field field) {
    return new FieldSpec(field, Arity.LIST);
  }

  private static FieldSpec nullableList(Field field) {
    return new FieldSpec(field, Arity.NULLABLE_LIST);
  }

  private static ImmutableSet<Prop> props(Prop... props) {
    return ImmutableSet.copyOf(props);
  }

  private static ImmutableSet<Slot> slots(Slot... slots) {
    return ImmutableSet.copyOf(slots);
  }
}
