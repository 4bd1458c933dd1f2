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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The source formatting captured for one node: the text of each {@link Slot} its kind declares,
 * plus the few disambiguation outcomes needed to replay the node's exact spelling.
 */
public final class Formatting {

  /** Captured text of one slot together with the dependency values it was captured under. */
  public static final class Entry {
    private final String text;
    private final ImmutableList<Dependency> dependencies;
    private final List<@Nullable Object> snapshot;

    private Entry(
        String text, ImmutableList<Dependency> dependencies, List<@Nullable Object> snapshot) {
      this.text = text;
      this.dependencies = dependencies;
      this.snapshot = snapshot;
    }

    /** Captures {@code text}, snapshotting the current values of {@code dependencies}. */
    public static Entry capture(String text, Node node, List<? extends Dependency> dependencies) {
      List<@Nullable Object> snapshot = new ArrayList<>();
      for (Dependency dependency : dependencies) {
        snapshot.add(dependency.valueOf(node));
      }
      return new Entry(
          checkNotNull(text),
          ImmutableList.copyOf(dependencies),
          Collections.unmodifiableList(snapshot));
    }

    public String getText() {
      return text;
    }

    /** Returns a copy of this entry with different text and the same snapshot. */
    public Entry withText(String newText) {
      return new Entry(checkNotNull(newText), dependencies, snapshot);
    }

    /** Whether every dependency of this entry still has its captured value on {@code node}. */
    public boolean isValidFor(Node node) {
      for (int i = 0; i < dependencies.size(); i++) {
        if (!Objects.equals(snapshot.get(i), dependencies.get(i).valueOf(node))) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return "'" + text.replace("\n", "\\n") + "'";
    }
  }

  private final Kind kind;
  private final EnumMap<Slot, Entry> entries = new EnumMap<>(Slot.class);
  private final EnumMap<Slot, Map<Integer, Entry>> indexedEntries = new EnumMap<>(Slot.class);
  private @Nullable JoinedForm joinedForm;
  private @Nullable String indentation;
  private @Nullable String joinedIndentation;
  private @Nullable String prefixDefault;
  private @Nullable ImmutableList<Field> argumentOrder;

  public Formatting(Kind kind) {
    this.kind = checkNotNull(kind);
  }

  public Kind getKind() {
    return kind;
  }

  public @Nullable Entry get(Slot slot) {
    checkSlot(slot, false);
    return entries.get(slot);
  }

  public void put(Slot slot, Entry entry) {
    checkSlot(slot, false);
    entries.put(slot, checkNotNull(entry));
  }

  public @Nullable Entry get(Slot slot, int index) {
    checkSlot(slot, true);
    Map<Integer, Entry> byIndex = indexedEntries.get(slot);
    return byIndex == null ? null : byIndex.get(index);
  }

  public void put(Slot slot, int index, Entry entry) {
    checkSlot(slot, true);
    indexedEntries.computeIfAbsent(slot, s -> new HashMap<>()).put(index, checkNotNull(entry));
  }

  /** The joined spelling this node was found in, or null if it was spelled on its own. */
  public @Nullable JoinedForm getJoinedForm() {
    return joinedForm;
  }

  public void setJoinedForm(@Nullable JoinedForm joinedForm) {
    checkArgument(joinedForm == null || joinedForm.getKind() == kind,
        "%s does not apply to %s", joinedForm, kind);
    this.joinedForm = joinedForm;
  }

  /** The indentation of the line a statement starts, or null if it shares its line. */
  public @Nullable String getIndentation() {
    return indentation;
  }

  public void setIndentation(@Nullable String indentation) {
    this.indentation = indentation;
  }

  /**
   * For a statement read in a {@link JoinedForm}, the indentation of the line its header shares
   * with its parent's.
   */
  public @Nullable String getJoinedIndentation() {
    return joinedIndentation;
  }

  public void setJoinedIndentation(@Nullable String joinedIndentation) {
    this.joinedIndentation = joinedIndentation;
  }

  /** The default spacing of the position the PREFIX was read at, or null if not recorded. */
  public @Nullable String getPrefixDefault() {
    return prefixDefault;
  }

  public void setPrefixDefault(@Nullable String prefixDefault) {
    this.prefixDefault = prefixDefault;
  }

  /**
   * For calls and class definitions, the field (ARGS or KEYWORDS, or BASES or KEYWORDS) each
   * argument was taken from, in source order.
   */
  public @Nullable ImmutableList<Field> getArgumentOrder() {
    return argumentOrder;
  }

  public void setArgumentOrder(@Nullable List<Field> argumentOrder) {
    this.argumentOrder = argumentOrder == null ? null : ImmutableList.copyOf(argumentOrder);
  }

  private void checkSlot(Slot slot, boolean indexed) {
    checkArgument(kind.hasSlot(slot), "%s has no slot %s", kind, slot);
    checkArgument(slot.isIndexed() == indexed, "%s indexed access mismatch", slot);
  }

  @Override
  public String toString() {
    return kind + entries.toString();
  }
}
