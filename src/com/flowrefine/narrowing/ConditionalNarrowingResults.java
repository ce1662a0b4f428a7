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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * The facts learned from one test expression: those that hold where the test evaluated to true,
 * and those that hold where it evaluated to false. The two lists are not mirror images; a
 * {@code Union[int, None]} loses {@code None} when the test {@code x} holds, but keeps it when the
 * test fails, since {@code 0} is falsy too.
 */
@AutoValue
public abstract class ConditionalNarrowingResults {

  public abstract ImmutableList<NarrowingFact> getIfFacts();

  public abstract ImmutableList<NarrowingFact> getElseFacts();

  public static ConditionalNarrowingResults create(
      Iterable<NarrowingFact> ifFacts, Iterable<NarrowingFact> elseFacts) {
    return new AutoValue_ConditionalNarrowingResults(
        ImmutableList.copyOf(ifFacts), ImmutableList.copyOf(elseFacts));
  }

  /** Returns the results for the negation of the test. */
  public ConditionalNarrowingResults invert() {
    return new AutoValue_ConditionalNarrowingResults(getElseFacts(), getIfFacts());
  }
}
