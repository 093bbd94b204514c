/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * Copyright 2025-2026 The TurnKey Authors
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

package tools.aqua.prover.context;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * An append-only collection organized as a stack of layers. Items are added to the top layer;
 * iteration visits every layer from the bottom up, i.e. in the order the items were recorded
 * along the current path.
 *
 * @param <T> the item type.
 */
public final class LayeredRegister<T> implements Iterable<T> {

  /** The next layer down, or {@code null} for the root. */
  private final LayeredRegister<T> parent;

  /** The items of this layer. */
  private final List<T> layer = new ArrayList<>();

  private LayeredRegister(final LayeredRegister<T> parent) {
    this.parent = parent;
  }

  /**
   * Create an empty register without parent layers.
   *
   * @param <T> the item type.
   * @return the register.
   */
  public static <T> LayeredRegister<T> root() {
    return new LayeredRegister<>(null);
  }

  /**
   * Create a register whose single fresh layer sits on top of this one.
   *
   * @return the child register.
   */
  public LayeredRegister<T> child() {
    return new LayeredRegister<>(this);
  }

  /**
   * Append an item to the top layer.
   *
   * @param item the item.
   */
  public void add(final T item) {
    layer.add(requireNonNull(item));
  }

  /**
   * Get the items of the top layer only.
   *
   * @return an unmodifiable view of the top layer.
   */
  public List<T> layer() {
    return unmodifiableList(layer);
  }

  /** Iterate over all layers, bottom layer first. */
  @Override
  public Iterator<T> iterator() {
    final Deque<List<T>> layers = new ArrayDeque<>();
    for (LayeredRegister<T> register = this; register != null; register = register.parent) {
      layers.push(register.layer);
    }
    final List<T> items = new ArrayList<>();
    layers.forEach(items::addAll);
    return unmodifiableList(items).iterator();
  }
}
