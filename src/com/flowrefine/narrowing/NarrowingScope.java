/*
 * Copyright 2026 The Flowrefine Authors.
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

package com.flowrefine.narrowing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.flowrefine.ast.Node;
import com.flowrefine.types.Type;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * The facts known along one branch, in the order they were learned.
 *
 * <p>Scopes are persistent: adding facts creates a child that links to this scope instead of
 * copying it, so sibling branches can share everything learned before they split. Types are
 * always computed through {@link NarrowingFact#applyTo}, so a later fact refines an earlier one on
 * the same expression.
 */
public final class NarrowingScope {

  private static final NarrowingScope EMPTY = new NarrowingScope(null, ImmutableList.of());

  private final @Nullable NarrowingScope parent;
  private final ImmutableList<NarrowingFact> facts;

  private NarrowingScope(@Nullable NarrowingScope parent, ImmutableList<NarrowingFact> facts) {
    this.parent = parent;
    this.facts = facts;
  }

  /** Returns the scope that knows nothing. */
  public static NarrowingScope empty() {
    return EMPTY;
  }

  /** Returns a scope that knows the given facts after everything this scope knows. */
  public NarrowingScope withFacts(Iterable<NarrowingFact> newFacts) {
    ImmutableList<NarrowingFact> copy = ImmutableList.copyOf(newFacts);
    return copy.isEmpty() ? this : new NarrowingScope(this, copy);
  }

  public NarrowingScope withFact(NarrowingFact fact) {
    return new NarrowingScope(this, ImmutableList.of(checkNotNull(fact)));
  }

  /**
   * Returns the scope for the branch taken when the test had the given outcome. Null results
   * carry no information and leave this scope unchanged.
   */
  public NarrowingScope withOutcome(
      @Nullable ConditionalNarrowingResults results, boolean outcome) {
    if (results == null) {
      return this;
    }
    return withFacts(outcome ? results.getIfFacts() : results.getElseFacts());
  }

  /** Returns every fact known in this scope, oldest first. */
  public ImmutableList<NarrowingFact> getFacts() {
    ImmutableList.Builder<NarrowingFact> all = ImmutableList.builder();
    for (NarrowingScope scope : lineage()) {
      all.addAll(scope.facts);
    }
    return all.build();
  }

  /**
   * Returns the type of {@code expression} in this scope, given the type it has without any
   * narrowing.
   */
  public Type getType(Node expression, Type declaredType) {
    checkNotNull(expression);
    Type type = checkNotNull(declaredType);
    for (NarrowingScope scope : lineage()) {
      for (NarrowingFact fact : scope.facts) {
        type = fact.applyTo(expression, type);
      }
    }
    return type;
  }

  /** Returns this scope and its ancestors, root first. */
  private Deque<NarrowingScope> lineage() {
    Deque<NarrowingScope> lineage = new ArrayDeque<>();
    for (NarrowingScope scope = this; scope != null; scope = scope.parent) {
      lineage.addFirst(scope);
    }
    return lineage;
  }
}
