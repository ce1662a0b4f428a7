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

package com.flowrefine.types;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A class definition, viewed as a value (the {@code CLASS} category). Instances of the class are
 * represented by {@link ObjectType}.
 *
 * <p>Specializing a generic class ({@code Tuple} into {@code Tuple[int, str]}) produces a new
 * ClassType that shares its generic class with the original, which is what {@link
 * #isSameGenericClass} compares.
 */
public final class ClassType extends Type {

  /** Name of the built-in tuple class. */
  public static final String TUPLE = "Tuple";

  private final String name;
  private final boolean builtIn;
  private final boolean specialBuiltIn;
  private final boolean alwaysFalsy;
  private final ImmutableList<ClassType> baseClasses;
  private final ImmutableSet<String> members;
  private final @Nullable ImmutableList<Type> typeArguments;
  private final ClassType genericClass;

  private ClassType(Builder builder) {
    this.name = builder.name;
    this.builtIn = builder.builtIn;
    this.specialBuiltIn = builder.specialBuiltIn;
    this.alwaysFalsy = builder.alwaysFalsy;
    this.baseClasses = builder.baseClasses.build();
    this.members = builder.members.build();
    this.typeArguments = null;
    this.genericClass = this;
  }

  private ClassType(ClassType genericClass, ImmutableList<Type> typeArguments) {
    this.name = genericClass.name;
    this.builtIn = genericClass.builtIn;
    this.specialBuiltIn = genericClass.specialBuiltIn;
    this.alwaysFalsy = genericClass.alwaysFalsy;
    this.baseClasses = genericClass.baseClasses;
    this.members = genericClass.members;
    this.typeArguments = typeArguments;
    this.genericClass = genericClass;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public TypeCategory getCategory() {
    return TypeCategory.CLASS;
  }

  @Override
  public ClassType toMaybeClassType() {
    return this;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<ClassType> getBaseClasses() {
    return baseClasses;
  }

  /** Returns the explicit type arguments, or null if this class has not been specialized. */
  public @Nullable ImmutableList<Type> getTypeArguments() {
    return typeArguments;
  }

  /** Returns the unspecialized class this one was created from, or this. */
  public ClassType getGenericClass() {
    return genericClass;
  }

  /** Returns this class specialized with the given type arguments. */
  public ClassType specialize(List<? extends Type> typeArguments) {
    return new ClassType(genericClass, ImmutableList.copyOf(typeArguments));
  }

  /** Returns the type of an instance of this class. */
  public ObjectType instance() {
    return ObjectType.create(this);
  }

  public boolean isBuiltIn(String builtInName) {
    return builtIn && name.equals(builtInName);
  }

  public boolean isBuiltIn() {
    return builtIn;
  }

  /**
   * Whether this is one of the built-in markers ({@code Callable}, {@code Tuple}, ...) whose type
   * the evaluator synthesizes through its own code path.
   */
  public boolean isSpecialBuiltIn() {
    return specialBuiltIn;
  }

  /** Whether instances of this class are known to be falsy under the truth-value protocol. */
  public boolean isAlwaysFalsy() {
    return alwaysFalsy;
  }

  public boolean isSameGenericClass(ClassType other) {
    return genericClass == other.genericClass;
  }

  /** Returns true if this class is {@code base} or inherits from it, directly or not. */
  public boolean isDerivedFrom(ClassType base) {
    if (isSameGenericClass(base)) {
      return true;
    }
    for (ClassType baseClass : baseClasses) {
      if (baseClass.isDerivedFrom(base)) {
        return true;
      }
    }
    return false;
  }

  /** Looks up a member on this class and its bases. */
  public boolean hasMember(String memberName) {
    if (members.contains(memberName)) {
      return true;
    }
    for (ClassType baseClass : baseClasses) {
      if (baseClass.hasMember(memberName)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof ClassType)) {
      return false;
    }
    ClassType that = (ClassType) other;
    return genericClass == that.genericClass
        && Objects.equals(typeArguments, that.typeArguments);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(genericClass) + Objects.hashCode(typeArguments);
  }

  @Override
  public String toString() {
    return "Type[" + getDisplayName() + "]";
  }

  /** Returns the name of the class with its type arguments, if any. */
  String getDisplayName() {
    if (typeArguments == null) {
      return name;
    }
    if (typeArguments.isEmpty()) {
      return name + "[()]";
    }
    return name + "[" + Joiner.on(", ").join(typeArguments) + "]";
  }

  /** Builder for unspecialized classes. */
  public static final class Builder {
    private final String name;
    private boolean builtIn;
    private boolean specialBuiltIn;
    private boolean alwaysFalsy;
    private final ImmutableList.Builder<ClassType> baseClasses = ImmutableList.builder();
    private final ImmutableSet.Builder<String> members = ImmutableSet.builder();
    private boolean built;

    private Builder(String name) {
      checkArgument(!name.isEmpty(), "class name must not be empty");
      this.name = name;
    }

    public Builder withBaseClass(ClassType baseClass) {
      baseClasses.add(checkNotNull(baseClass));
      return this;
    }

    public Builder withMember(String memberName) {
      members.add(memberName);
      return this;
    }

    public Builder withBuiltIn() {
      this.builtIn = true;
      return this;
    }

    public Builder withSpecialBuiltIn() {
      this.builtIn = true;
      this.specialBuiltIn = true;
      return this;
    }

    public Builder withAlwaysFalsy() {
      this.alwaysFalsy = true;
      return this;
    }

    public ClassType build() {
      checkState(!built, "builder for %s has already been used", name);
      built = true;
      return new ClassType(this);
    }
  }
}
