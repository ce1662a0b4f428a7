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
import com.flowrefine.ast.Token;
import com.flowrefine.types.ClassType;
import com.flowrefine.types.ObjectType;
import com.flowrefine.types.Type;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Derives narrowing facts from branch conditions and assignments.
 *
 * <p>A test expression is decomposed recursively: {@code and}, {@code or} and {@code not} combine
 * the facts of their operands, while {@code x is None}, {@code type(x) is C}, {@code
 * isinstance(x, C)} and bare truthiness tests on names and property chains produce facts directly.
 * Anything else yields null, meaning nothing is known; declining to narrow is always sound.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
@CheckReturnValue
public final class NarrowingFactBuilder {

  private static final Logger logger = Logger.getLogger(NarrowingFactBuilder.class.getName());

  private final NarrowingOptions options;

  private NarrowingFactBuilder(NarrowingOptions options) {
    this.options = options;
  }

  /** Creates a builder that recognizes every supported idiom. */
  public static NarrowingFactBuilder create() {
    return new NarrowingFactBuilder(new NarrowingOptions());
  }

  public static NarrowingFactBuilder create(NarrowingOptions options) {
    return new NarrowingFactBuilder(options.copy());
  }

  /**
   * Returns the facts that hold where {@code test} evaluates to true and where it evaluates to
   * false, or null if the test tells us nothing.
   *
   * @param test the condition of an if, while, ternary or similar construct
   * @param evaluator the types of expressions at the point of the test
   */
  public @Nullable ConditionalNarrowingResults buildForConditional(
      Node test, TypeEvaluator evaluator) {
    checkNotNull(test);
    checkNotNull(evaluator);
    ConditionalNarrowingResults results = decompose(test, evaluator);
    if (results != null && logger.isLoggable(Level.FINER)) {
      logger.finer(
          "Test "
              + test
              + " yields "
              + results.getIfFacts().size()
              + " if-fact(s) and "
              + results.getElseFacts().size()
              + " else-fact(s)");
    }
    return results;
  }

  /**
   * Returns a fact binding the assignment target to {@code assignedType}, or null if the target
   * is not a name or property chain. Tuple targets are left to the caller.
   */
  public @Nullable NarrowingFact buildForAssignment(Node target, Type assignedType) {
    checkNotNull(assignedType);
    if (target.isAnnotated()) {
      return buildForAssignment(target.getFirstChild(), assignedType);
    }
    if (NarrowableExpressions.isSupportedExpression(target)) {
      return NarrowingFact.create(target, assignedType);
    }
    return null;
  }

  private @Nullable ConditionalNarrowingResults decompose(Node test, TypeEvaluator evaluator) {
    switch (test.getToken()) {
      case IS:
      case IS_NOT:
        return caseIs(test, evaluator);
      case AND:
        return caseAnd(test, evaluator);
      case OR:
        return caseOr(test, evaluator);
      case NOT:
        {
          ConditionalNarrowingResults operand = decompose(test.getFirstChild(), evaluator);
          return operand != null ? operand.invert() : null;
        }
      case NAME:
      case GETPROP:
        return caseTruthiness(test, evaluator);
      case CALL:
        return caseIsInstance(test, evaluator);
      default:
        return null;
    }
  }

  private @Nullable ConditionalNarrowingResults caseIs(Node test, TypeEvaluator evaluator) {
    Node left = test.getFirstChild();
    Node right = test.getLastChild();
    boolean isPositive = test.getToken() == Token.IS;

    // x is None
    if (options.isNoneNarrowing()
        && right.isNone()
        && NarrowableExpressions.isSupportedExpression(left)) {
      Type originalType = evaluator.evaluate(left);
      return forPolarity(
          left,
          TypeTransforms.narrowForIsNone(originalType, true),
          TypeTransforms.narrowForIsNone(originalType, false),
          isPositive);
    }

    // type(x) is C
    if (options.isTypeIdentityNarrowing() && left.isCall()) {
      Node argument = getSolePositionalArgument(left);
      if (argument != null
          && NarrowableExpressions.isSupportedExpression(argument)
          && isTypeFunction(left.getFirstChild(), evaluator)) {
        ClassType classType = evaluator.evaluate(right).toMaybeClassType();
        if (classType != null) {
          Type originalType = evaluator.evaluate(argument);
          return forPolarity(
              argument,
              TypeTransforms.narrowForIsType(originalType, classType, true),
              TypeTransforms.narrowForIsType(originalType, classType, false),
              isPositive);
        }
      }
    }
    return null;
  }

  /**
   * All the "if" facts of both operands must hold when the conjunction holds. When it fails we
   * cannot tell which operand failed, so nothing is known.
   */
  private @Nullable ConditionalNarrowingResults caseAnd(Node test, TypeEvaluator evaluator) {
    ImmutableList<NarrowingFact> ifFacts =
        concatOperandFacts(test, evaluator, ConditionalNarrowingResults::getIfFacts);
    if (ifFacts.isEmpty()) {
      return null;
    }
    return ConditionalNarrowingResults.create(ifFacts, ImmutableList.of());
  }

  /** The dual of {@link #caseAnd}: only a failed disjunction tells us about both operands. */
  private @Nullable ConditionalNarrowingResults caseOr(Node test, TypeEvaluator evaluator) {
    ImmutableList<NarrowingFact> elseFacts =
        concatOperandFacts(test, evaluator, ConditionalNarrowingResults::getElseFacts);
    if (elseFacts.isEmpty()) {
      return null;
    }
    return ConditionalNarrowingResults.create(ImmutableList.of(), elseFacts);
  }

  private ImmutableList<NarrowingFact> concatOperandFacts(
      Node test,
      TypeEvaluator evaluator,
      Function<ConditionalNarrowingResults, ImmutableList<NarrowingFact>> side) {
    ImmutableList.Builder<NarrowingFact> facts = ImmutableList.builder();
    for (Node operand : test.children()) {
      ConditionalNarrowingResults results = decompose(operand, evaluator);
      if (results != null) {
        facts.addAll(side.apply(results));
      }
    }
    return facts.build();
  }

  private @Nullable ConditionalNarrowingResults caseTruthiness(
      Node test, TypeEvaluator evaluator) {
    if (!options.isTruthinessNarrowing() || !NarrowableExpressions.isSupportedExpression(test)) {
      return null;
    }
    Type originalType = evaluator.evaluate(test);
    return forPolarity(
        test,
        TypeTransforms.narrowForTruthiness(originalType, true),
        TypeTransforms.narrowForTruthiness(originalType, false),
        true);
  }

  private @Nullable ConditionalNarrowingResults caseIsInstance(
      Node call, TypeEvaluator evaluator) {
    Node callee = call.getFirstChild();
    if (!options.isIsinstanceNarrowing()
        || !callee.isName()
        || !callee.getString().equals(options.getIsinstanceFunctionName())
        || call.getChildCount() != 3) {
      return null;
    }

    Node instance = valueOf(callee.getNext());
    Node classInfo = valueOf(call.getLastChild());
    if (!NarrowableExpressions.isSupportedExpression(instance)) {
      return null;
    }
    Type classInfoType = evaluator.evaluate(classInfo);
    ImmutableList<ClassType> filters = getIsInstanceFilters(classInfoType);
    if (filters == null) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Not narrowing " + instance + ": isinstance given " + classInfoType);
      }
      return null;
    }

    Type originalType = evaluator.evaluate(instance);
    return forPolarity(
        instance,
        TypeTransforms.narrowForIsInstance(originalType, filters, true),
        TypeTransforms.narrowForIsInstance(originalType, filters, false),
        true);
  }

  /**
   * Returns the classes an isinstance test checks against: a single class, or every element of a
   * tuple of classes. Returns null if any element is not a class.
   */
  private static @Nullable ImmutableList<ClassType> getIsInstanceFilters(Type classInfoType) {
    ClassType classType = classInfoType.toMaybeClassType();
    if (classType != null) {
      return ImmutableList.of(classType);
    }

    ObjectType objectType = classInfoType.toMaybeObjectType();
    if (objectType == null) {
      return null;
    }
    ClassType tupleClass = objectType.getClassType();
    ImmutableList<Type> typeArguments = tupleClass.getTypeArguments();
    if (!tupleClass.isBuiltIn(ClassType.TUPLE) || typeArguments == null) {
      return null;
    }
    ImmutableList.Builder<ClassType> filters = ImmutableList.builder();
    for (Type typeArgument : typeArguments) {
      ClassType element = typeArgument.toMaybeClassType();
      if (element == null) {
        return null;
      }
      filters.add(element);
    }
    return filters.build();
  }

  private static boolean isTypeFunction(Node callee, TypeEvaluator evaluator) {
    ClassType calleeType = evaluator.evaluate(callee).toMaybeClassType();
    return calleeType != null && calleeType.isBuiltIn("type");
  }

  /** Returns the only argument of the call if it is passed positionally, otherwise null. */
  private static @Nullable Node getSolePositionalArgument(Node call) {
    if (call.getChildCount() != 2) {
      return null;
    }
    Node argument = call.getLastChild();
    return argument.isArgumentWrapper() ? null : argument;
  }

  /** Unwraps keyword and star arguments. */
  private static Node valueOf(Node argument) {
    return argument.isArgumentWrapper() ? argument.getFirstChild() : argument;
  }

  /**
   * Pairs the facts for the positive and negative narrowing of {@code expression}. When the test
   * is negated ({@code is not}), the positive fact belongs to the else branch.
   */
  private static ConditionalNarrowingResults forPolarity(
      Node expression, Type positiveType, Type negativeType, boolean isPositive) {
    NarrowingFact positive = NarrowingFact.create(expression, positiveType);
    NarrowingFact negative = NarrowingFact.create(expression, negativeType);
    return ConditionalNarrowingResults.create(
        ImmutableList.of(isPositive ? positive : negative),
        ImmutableList.of(isPositive ? negative : positive));
  }
}
