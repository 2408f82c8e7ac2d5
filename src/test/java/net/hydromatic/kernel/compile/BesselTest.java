/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kernel.compile;

import static net.hydromatic.kernel.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Visitor;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link BesselGetter}, {@link BesselOrderGatherer} and {@link
 * BesselDerivativeReplacer}.
 */
public class BesselTest {
  private final Expr.Var x = expr.var("x");
  private final Expr.Var z = expr.var("z");

  private static final String H0 = "cse[hank1_01_result](hank1_01(z)).order0";
  private static final String H1 = "cse[hank1_01_result](hank1_01(z)).order1";

  private static Expr.Call hankel1(int order, Expr.Exp arg) {
    return expr.call(BuiltIn.HANKEL_1, expr.intLiteral(order), arg);
  }

  private static Expr.Call besselJ(int order, Expr.Exp arg) {
    return expr.call(BuiltIn.BESSEL_J, expr.intLiteral(order), arg);
  }

  /** Returns the orders of the calls to {@code bessel_jv} in an
   * expression. */
  static Set<Integer> directOrders(Expr.Exp e) {
    final Set<Integer> orders = new TreeSet<>();
    e.accept(
        new Visitor() {
          @Override
          protected void visit(Expr.Call call) {
            if (call.isCallTo(BuiltIn.BESSEL_JV)) {
              orders.add(BesselSubstitutor.intOrder(call));
            }
            super.visit(call);
          }
        });
    return orders;
  }

  @Test
  void testHankel() {
    final BesselGetter getter = new BesselGetter(ImmutableMap.of());
    assertThat(getter.hankel1(0, z), hasToString(H0));
    assertThat(getter.hankel1(1, z), hasToString(H1));
    assertThat(getter.hankel1(2, z),
        hasToString("cse[hank1_2](2 / z * " + H1 + " + -1 * " + H0 + ")"));
    assertThat(getter.hankel1(3, z).toString(),
        is("cse[hank1_3](4 / z * " + getter.hankel1(2, z) + " + -1 * "
            + H1 + ")"));

    // orders 0 and 1 share one evaluation
    assertThat(((Expr.Lookup) getter.hankel1(0, z)).aggregate,
        sameInstance(((Expr.Lookup) getter.hankel1(1, z)).aggregate));
    assertThat(getter.hankel1(3, z), sameInstance(getter.hankel1(3, z)));
  }

  /** Tests the reflection formula H(-n, z) = (-1)^n H(n, z). */
  @Test
  void testHankelReflection() {
    final BesselGetter getter = new BesselGetter(ImmutableMap.of());
    assertThat(getter.hankel1(-1, z),
        hasToString("cse[hank1_neg1](-1 * " + H1 + ")"));
    assertThat(getter.hankel1(-3, z).toString(),
        is("cse[hank1_neg3](-1 * " + getter.hankel1(3, z) + ")"));

    // an even reflection is the positive order
    assertThat(getter.hankel1(-2, z), sameInstance(getter.hankel1(2, z)));

    final ExprEvaluator evaluator =
        new ExprEvaluator(ImmutableMap.of("z", 5.5));
    for (int n = -4; n <= 4; n++) {
      assertThat(evaluator.real(getter.hankel1(n, z)),
          closeTo(ExprEvaluator.besselJ(n, 5.5), 1e-10));
    }
  }

  @Test
  void testBesselJ() {
    final BesselGetter getter =
        new BesselGetter(ImmutableMap.<Expr.Exp, Integer>of(z, 3));
    assertThat(getter.besselJ(3, z, z),
        hasToString("cse[bessel_j_3](bessel_jv(3, z))"));
    assertThat(getter.besselJ(2, z, z),
        hasToString("cse[bessel_j_2](bessel_jv(2, z))"));
    assertThat(getter.besselJ(1, z, z),
        hasToString("cse[bessel_j_1](4 / z * cse[bessel_j_2](bessel_jv(2, z))"
            + " + -1 * cse[bessel_j_3](bessel_jv(3, z)))"));
    assertThat(getter.besselJ(-1, z, z).toString(),
        is("-1 * " + getter.besselJ(1, z, z)));
    assertThat(getter.besselJ(-2, z, z),
        sameInstance(getter.besselJ(2, z, z)));
    assertThat(directOrders(getter.besselJ(0, z, z)), hasToString("[2, 3]"));
  }

  /** Tests that the memo is keyed on the argument as it was before
   * substitution, while the expression uses the rewritten argument. */
  @Test
  void testBesselJKey() {
    final Expr.Exp key = hankel1(0, x);
    final BesselGetter getter = new BesselGetter(ImmutableMap.of(key, 2));
    final Expr.Exp arg = getter.hankel1(0, x);
    assertThat(getter.besselJ(2, key, arg),
        hasToString("cse[bessel_j_2](bessel_jv(2, "
            + "cse[hank1_01_result](hank1_01(x)).order0))"));
    assertThrows(AssertionError.class, () -> getter.besselJ(2, arg, arg));
  }

  @Test
  void testBesselJInvalid() {
    final BesselGetter getter =
        new BesselGetter(ImmutableMap.<Expr.Exp, Integer>of(z, 3));
    assertThrows(AssertionError.class, () -> getter.besselJ(4, z, z));
    assertThrows(AssertionError.class, () -> getter.besselJ(-4, z, z));
    assertThrows(AssertionError.class, () -> getter.besselJ(0, x, x));
  }

  /** Tests that an order must be an integer whose magnitude is an
   * {@code int}. */
  @Test
  void testIntOrder() {
    assertThat(
        BesselSubstitutor.intOrder(
            expr.call(BuiltIn.HANKEL_1, expr.intLiteral(-Integer.MAX_VALUE),
                z)),
        is(-Integer.MAX_VALUE));
    final long[] orders = {Integer.MIN_VALUE, 1L << 31, -(1L << 32)};
    for (long order : orders) {
      final Expr.Call call =
          expr.call(BuiltIn.BESSEL_J, expr.intLiteral(order), z);
      assertThrows(AssertionError.class,
          () -> BesselSubstitutor.intOrder(call));
      assertThrows(AssertionError.class,
          () -> call.accept(new BesselOrderGatherer()));
    }
    assertThrows(AssertionError.class,
        () -> BesselSubstitutor.intOrder(
            expr.call(BuiltIn.HANKEL_1, expr.realLiteral(1.5), z)));
  }

  /** Tests that every order up to the top order matches Commons Math,
   * although only the top two orders are evaluated directly. */
  @Test
  void testBesselJValue() {
    final int top = 12;
    final BesselGetter getter =
        new BesselGetter(ImmutableMap.<Expr.Exp, Integer>of(z, top));
    for (double value : new double[] {0.5, 2.5, 7.25, 15}) {
      final ExprEvaluator evaluator =
          new ExprEvaluator(ImmutableMap.of("z", value));
      for (int n = -top; n <= top; n++) {
        final Expr.Exp e = getter.besselJ(n, z, z);
        assertThat(ImmutableSet.of(top - 1, top).containsAll(directOrders(e)),
            is(true));
        final double expected = ExprEvaluator.besselJ(n, value);
        assertThat("J(" + n + ", " + value + ")", evaluator.real(e),
            closeTo(expected, 1e-12 + Math.abs(expected) * 1e-9));
      }
    }
  }

  @Test
  void testGatherer() {
    final Expr.Exp kr = expr.product(expr.var("k"), expr.var("r"));
    final Expr.Exp rk = expr.product(expr.var("r"), expr.var("k"));
    final BesselOrderGatherer gatherer = new BesselOrderGatherer();
    expr.sum(besselJ(3, z), besselJ(-5, z)).accept(gatherer);
    besselJ(1, besselJ(4, z)).accept(gatherer);
    expr.product(besselJ(2, kr), besselJ(2, rk), hankel1(7, z))
        .accept(gatherer);
    assertThat(gatherer.topOrders(),
        hasToString("{z=5, bessel_j(4, z)=1, k * r=2, r * k=2}"));

    final BesselOrderGatherer gatherer2 = new BesselOrderGatherer();
    assertThrows(AssertionError.class,
        () -> expr.call(BuiltIn.BESSEL_J, expr.var("n"), z)
            .accept(gatherer2));
  }

  @Test
  void testDerivative() {
    final Expr.Exp d =
        expr.derivative(hankel1(0, x), ImmutableList.of("x"), z);
    final Expr.Exp e = new BesselDerivativeReplacer().apply(d);
    assertThat(e,
        hasToString("cse[d1_hankel_1_0](0.5 * (hankel_1(-1, z) "
            + "+ -1 * hankel_1(1, z)))"));

    final Expr.Exp d2 =
        expr.derivative(besselJ(-1, x), ImmutableList.of("x", "x"),
            expr.product(expr.var("k"), expr.var("r")));
    assertThat(new BesselDerivativeReplacer().apply(d2),
        hasToString("cse[d2_bessel_j_m1](0.25 * (bessel_j(-3, k * r) "
            + "+ -2 * bessel_j(-1, k * r) + bessel_j(1, k * r)))"));

    // derivatives of other functions are unchanged
    final Expr.Exp d3 =
        expr.derivative(expr.call("f", x), ImmutableList.of("x"), z);
    assertThat(new BesselDerivativeReplacer().apply(d3), sameInstance(d3));
  }

  @Test
  void testDerivativeInvalid() {
    final Expr.Exp mixed =
        expr.derivative(hankel1(0, x), ImmutableList.of("x", "y"), z);
    assertThrows(AssertionError.class,
        () -> new BesselDerivativeReplacer().apply(mixed));
    final Expr.Exp compound =
        expr.derivative(hankel1(0, expr.product(expr.intLiteral(2), x)),
            ImmutableList.of("x"), z);
    assertThrows(AssertionError.class,
        () -> new BesselDerivativeReplacer().apply(compound));
    final Expr.Exp symbolicOrder =
        expr.derivative(expr.call(BuiltIn.BESSEL_J, expr.var("n"), x),
            ImmutableList.of("x"), z);
    assertThrows(AssertionError.class,
        () -> new BesselDerivativeReplacer().apply(symbolicOrder));
  }
}

// End BesselTest.java
