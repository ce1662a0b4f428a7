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

package com.flowrefine.testing;

import com.flowrefine.types.ClassType;
import com.flowrefine.types.ObjectType;
import com.flowrefine.types.Type;
import com.flowrefine.types.Types;
import java.util.Arrays;

/**
 * A base class for tests that need a small class hierarchy:
 *
 * <pre>
 *   object
 *     int (__bool__) -- bool
 *     str (__len__)
 *     Animal -- Dog, Cat
 * </pre>
 *
 * plus the built-ins {@code type}, {@code Tuple} and {@code Callable}. Every test instance gets
 * fresh classes.
 */
public abstract class TypeTestBase {

  protected final ClassType objectClass = ClassType.builder("object").withBuiltIn().build();
  protected final ClassType intClass =
      ClassType.builder("int")
          .withBuiltIn()
          .withBaseClass(objectClass)
          .withMember("__bool__")
          .build();
  protected final ClassType boolClass =
      ClassType.builder("bool").withBuiltIn().withBaseClass(intClass).build();
  protected final ClassType strClass =
      ClassType.builder("str")
          .withBuiltIn()
          .withBaseClass(objectClass)
          .withMember("__len__")
          .build();
  protected final ClassType typeClass =
      ClassType.builder("type").withBuiltIn().withBaseClass(objectClass).build();
  protected final ClassType tupleClass =
      ClassType.builder(ClassType.TUPLE)
          .withSpecialBuiltIn()
          .withBaseClass(objectClass)
          .withMember("__len__")
          .build();
  protected final ClassType callableClass =
      ClassType.builder("Callable").withSpecialBuiltIn().withBaseClass(objectClass).build();
  protected final ClassType animalClass =
      ClassType.builder("Animal").withBaseClass(objectClass).build();
  protected final ClassType dogClass = ClassType.builder("Dog").withBaseClass(animalClass).build();
  protected final ClassType catClass = ClassType.builder("Cat").withBaseClass(animalClass).build();

  protected final ObjectType intType = intClass.instance();
  protected final ObjectType boolType = boolClass.instance();
  protected final ObjectType strType = strClass.instance();
  protected final ObjectType animalType = animalClass.instance();
  protected final ObjectType dogType = dogClass.instance();
  protected final ObjectType catType = catClass.instance();

  protected static Type union(Type... types) {
    return Types.combine(types);
  }

  /** Returns an instance of {@code Tuple[elements...]}. */
  protected ObjectType tupleOf(Type... elements) {
    return tupleClass.specialize(Arrays.asList(elements)).instance();
  }
}
