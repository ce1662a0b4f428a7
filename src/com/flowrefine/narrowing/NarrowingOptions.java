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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import java.io.Serializable;

/**
 * Options controlling which test idioms produce narrowing facts. A disabled idiom yields no
 * information, exactly like an unsupported expression.
 */
public class NarrowingOptions implements Serializable {

  private static final long serialVersionUID = 1L;

  /** Narrows on {@code x is None} and {@code x is not None}. */
  private boolean noneNarrowing = true;

  /** Narrows on {@code type(x) is C} and {@code type(x) is not C}. */
  private boolean typeIdentityNarrowing = true;

  /** Narrows on {@code isinstance(x, C)}. */
  private boolean isinstanceNarrowing = true;

  /** Narrows on bare {@code x} and {@code x.y} tests. */
  private boolean truthinessNarrowing = true;

  private String isinstanceFunctionName = "isinstance";

  public NarrowingOptions() {}

  /** Returns an independent copy, so later changes to this object are not observed. */
  NarrowingOptions copy() {
    NarrowingOptions copy = new NarrowingOptions();
    copy.noneNarrowing = noneNarrowing;
    copy.typeIdentityNarrowing = typeIdentityNarrowing;
    copy.isinstanceNarrowing = isinstanceNarrowing;
    copy.truthinessNarrowing = truthinessNarrowing;
    copy.isinstanceFunctionName = isinstanceFunctionName;
    return copy;
  }

  public void setNoneNarrowing(boolean noneNarrowing) {
    this.noneNarrowing = noneNarrowing;
  }

  public boolean isNoneNarrowing() {
    return noneNarrowing;
  }

  public void setTypeIdentityNarrowing(boolean typeIdentityNarrowing) {
    this.typeIdentityNarrowing = typeIdentityNarrowing;
  }

  public boolean isTypeIdentityNarrowing() {
    return typeIdentityNarrowing;
  }

  public void setIsinstanceNarrowing(boolean isinstanceNarrowing) {
    this.isinstanceNarrowing = isinstanceNarrowing;
  }

  public boolean isIsinstanceNarrowing() {
    return isinstanceNarrowing;
  }

  public void setTruthinessNarrowing(boolean truthinessNarrowing) {
    this.truthinessNarrowing = truthinessNarrowing;
  }

  public boolean isTruthinessNarrowing() {
    return truthinessNarrowing;
  }

  /** Sets the name a call must be made through to be treated as an isinstance test. */
  public void setIsinstanceFunctionName(String isinstanceFunctionName) {
    checkArgument(
        !isinstanceFunctionName.isEmpty(), "the isinstance function name must not be empty");
    this.isinstanceFunctionName = isinstanceFunctionName;
  }

  public String getIsinstanceFunctionName() {
    return isinstanceFunctionName;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("noneNarrowing", noneNarrowing)
        .add("typeIdentityNarrowing", typeIdentityNarrowing)
        .add("isinstanceNarrowing", isinstanceNarrowing)
        .add("truthinessNarrowing", truthinessNarrowing)
        .add("isinstanceFunctionName", isinstanceFunctionName)
        .toString();
  }
}
