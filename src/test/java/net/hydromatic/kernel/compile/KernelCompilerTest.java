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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.DoubleUnaryOperator;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.foreign.SreprParseException;
import net.hydromatic.kernel.type.NumericType;
import net.hydromatic.kernel.type.StructType;
import org.junit.jupiter.api.Test;

/** Tests for {@link KernelCompiler}. */
public class KernelCompilerTest {
  private static final String H1 =
      "cse[hank1_01_result](hank1_01(z)).order1";

  /** Creates an ordered map from alternating names and values. */
  private static Map<String, String> map(String... namesAndValues) {
    final Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      map.put(namesAndValues[i], namesAndValues[i + 1]);
    }
    return map;
  }

  private static CompiledBatch compile(CompilerConfig config,
      String... namesAndValues) {
    return new KernelCompiler(config).compile(map(namesAndValues));
  }

  private static CompiledBatch compile(String... namesAndValues) {
    return compile(CompilerConfig.DEFAULT, namesAndValues);
  }

  private static String besselJ(int order, String arg) {
    return "besselj(Integer(" + order + "), " + arg + ")";
  }

  private static String hankel1(int order, String arg) {
    return "hankel1(Integer(" + order + "), " + arg + ")";
  }

  /** Returns the srepr of a derivative of {@code f(_x)}, evaluated at
   * {@code point}. */
  private static String derivative(String f, int count, String point) {
    return "Subs(Derivative(" + f + ", Tuple(Symbol('_x'), Integer(" + count
        + "))), Tuple(Symbol('_x')), Tuple(" + point + "))";
  }

  /** Returns the value of an instruction when {@code z} has a given
   * value. */
  private static double valueAt(CompiledBatch batch, String name, double z) {
    return new ExprEvaluator(ImmutableMap.of("z", z))
        .real(batch.instruction(name).expression);
  }

  /** Tests that compiling the same batch twice gives the same
   * instructions. */
  @Test
  void testDeterministic() {
    final Map<String, String> map =
        map("a",
            derivative(hankel1(2, "Symbol('_x')"), 1,
                "Mul(Symbol('k'), Symbol('r'))"),
            "b", besselJ(4, "Mul(Symbol('k'), Symbol('r'))"),
            "c", "Pow(Symbol('r'), Rational(-3, 2))",
            "d", "Add(Mul(Integer(-1), Symbol('a')), Symbol('b'))");
    final KernelCompiler compiler = new KernelCompiler(CompilerConfig.DEFAULT);
    final CompiledBatch batch1 = compiler.compile(map);
    final CompiledBatch batch2 = compiler.compile(map);
    assertThat(batch2.instructions, is(batch1.instructions));
    assertThat(batch2.toString(), is(batch1.toString()));
    assertThat(new KernelCompiler(CompilerConfig.DEFAULT).compile(map)
        .instructions, is(batch1.instructions));
  }

  /** Tests that Bessel J of every order is computed from direct evaluations
   * of the two highest orders requested for the same argument. */
  @Test
  void testBesselJ() {
    final CompiledBatch batch =
        compile("a", besselJ(5, "Symbol('z')"),
            "b", besselJ(2, "Symbol('z')"),
            "c", besselJ(-3, "Symbol('z')"),
            "d", besselJ(0, "Symbol('z')"));
    assertThat(batch.besselOrders, hasToString("{z=5}"));
    assertThat(batch.instruction("a"),
        hasToString("a <- cse[bessel_j_5](bessel_jv(5, z))"));
    final Set<Integer> orders = new TreeSet<>();
    for (Instruction instruction : batch.instructions) {
      orders.addAll(BesselTest.directOrders(instruction.expression));
    }
    assertThat(orders, hasToString("[4, 5]"));

    for (double z : new double[] {0.75, 3.2, 9.5}) {
      assertThat(valueAt(batch, "a", z),
          closeTo(ExprEvaluator.besselJ(5, z), 1e-12));
      assertThat(valueAt(batch, "b", z),
          closeTo(ExprEvaluator.besselJ(2, z), 1e-12));
      assertThat(valueAt(batch, "c", z),
          closeTo(ExprEvaluator.besselJ(-3, z), 1e-12));
      assertThat(valueAt(batch, "d", z),
          closeTo(ExprEvaluator.besselJ(0, z), 1e-12));
    }
  }

  /** Tests that the top order is gathered over all assignments, and
   * separately for each argument. */
  @Test
  void testBesselJGathering() {
    final CompiledBatch batch =
        compile("a", besselJ(2, "Symbol('z')"),
            "b", besselJ(6, "Symbol('z')"),
            "c", besselJ(3, "Mul(Integer(2), Symbol('z'))"),
            "e", besselJ(1, "Mul(Integer(2), Symbol('z'))"));
    assertThat(batch.besselOrders, hasToString("{z=6, 2 * z=3}"));
    assertThat(BesselTest.directOrders(batch.instruction("a").expression),
        hasToString("[5, 6]"));
    assertThat(BesselTest.directOrders(batch.instruction("c").expression),
        hasToString("[3]"));
    assertThat(BesselTest.directOrders(batch.instruction("e").expression),
        hasToString("[2, 3]"));
    assertThat(valueAt(batch, "e", 1.25),
        closeTo(ExprEvaluator.besselJ(1, 2.5), 1e-12));

    // Each batch gathers its own orders
    final CompiledBatch batch2 = compile("a", besselJ(2, "Symbol('z')"));
    assertThat(batch2.besselOrders, hasToString("{z=2}"));
    assertThat(BesselTest.directOrders(batch2.instruction("a").expression),
        hasToString("[2]"));
  }

  @Test
  void testHankel() {
    final CompiledBatch batch =
        compile("a", hankel1(-3, "Symbol('z')"),
            "b", hankel1(-2, "Symbol('z')"),
            "c", hankel1(2, "Symbol('z')"),
            "d", hankel1(0, "Symbol('z')"),
            "e", hankel1(-1, "Symbol('z')"),
            "f", hankel1(1, "Symbol('z')"));
    assertThat(batch.instruction("a").expression.toString(),
        startsWith("cse[hank1_neg3](-1 * cse[hank1_3]("));
    assertThat(batch.instruction("b").expression,
        is(batch.instruction("c").expression));
    assertThat(batch.instruction("d"),
        hasToString("d <- cse[hank1_01_result](hank1_01(z)).order0"));
    assertThat(batch.besselOrders.isEmpty(), is(true));

    // An odd reflection negates the positive order, real and imaginary parts
    final Expr.Exp e = batch.instruction("e").expression;
    assertThat(e, instanceOf(Expr.Cse.class));
    assertThat(((Expr.Cse) e).exp,
        is(expr.product(
            ImmutableList.of(expr.intLiteral(-1),
                batch.instruction("f").expression))));

    // Bessel J stands in for the Hankel function; see ExprEvaluator
    assertThat(valueAt(batch, "a", 4.5),
        closeTo(ExprEvaluator.besselJ(-3, 4.5), 1e-10));
    assertThat(valueAt(batch, "c", 4.5),
        closeTo(ExprEvaluator.besselJ(2, 4.5), 1e-10));
  }

  /** Tests that the derivative of the Hankel function of order 0 is the
   * Hankel function of order 1, negated. */
  @Test
  void testDerivativeIdentity() {
    final CompiledBatch batch =
        compile("d", derivative(hankel1(0, "Symbol('_x')"), 1,
            "Symbol('z')"));
    assertThat(batch.instruction("d").expression,
        hasToString("cse[d1_hankel_1_0](0.5 * (cse[hank1_neg1](-1 * " + H1
            + ") + -1 * " + H1 + "))"));
    for (double z : new double[] {0.5, 2, 7.5}) {
      assertThat(valueAt(batch, "d", z),
          closeTo(-ExprEvaluator.besselJ(1, z), 1e-12));
    }
  }

  /** Tests derivatives against finite differences. */
  @Test
  void testDerivativeValue() {
    final CompiledBatch batch =
        compile("j2", derivative(besselJ(2, "Symbol('_x')"), 2,
                "Symbol('z')"),
            "h1", derivative(hankel1(1, "Symbol('_x')"), 3, "Symbol('z')"));
    assertThat(batch.besselOrders, hasToString("{z=4}"));
    for (double z : new double[] {1.5, 3, 6.25}) {
      final DoubleUnaryOperator j2 = x -> ExprEvaluator.besselJ(2, x);
      final double h = 1e-4;
      final double secondDerivative =
          (j2.applyAsDouble(z + h) - 2 * j2.applyAsDouble(z)
              + j2.applyAsDouble(z - h)) / (h * h);
      assertThat(valueAt(batch, "j2", z), closeTo(secondDerivative, 1e-6));

      final DoubleUnaryOperator j1 = x -> ExprEvaluator.besselJ(1, x);
      final double k = 1e-3;
      final double thirdDerivative =
          (j1.applyAsDouble(z + 2 * k) - 2 * j1.applyAsDouble(z + k)
              + 2 * j1.applyAsDouble(z - k) - j1.applyAsDouble(z - 2 * k))
              / (2 * k * k * k);
      assertThat(valueAt(batch, "h1", z), closeTo(thirdDerivative, 1e-5));
    }
  }

  /** Tests that indexed names become subscripts only if their prefix is a
   * vector name. */
  @Test
  void testVectorNames() {
    final String sum =
        "Add(Symbol('r0'), Symbol('q0'), Symbol('r12'), Symbol('r'), "
            + "Symbol('rr1'))";
    assertThat(compile("a", sum).instruction("a"),
        hasToString("a <- r0 + q0 + r12 + r + rr1"));
    final CompilerConfig config =
        CompilerConfig.DEFAULT.withVectorNames(ImmutableList.of("r"));
    assertThat(compile(config, "a", sum).instruction("a"),
        hasToString("a <- r[0] + q0 + r[12] + r + rr1"));
  }

  @Test
  void testPowersAndFractions() {
    final CompiledBatch batch =
        compile("a", "Mul(Rational(1, 2), Pow(Symbol('r'), Integer(-2)))",
            "b", "Pow(Symbol('r'), Rational(-1, 2))",
            "c", "Add(Mul(Integer(-1), Symbol('a')), Symbol('b'))",
            "d", "Mul(Rational(6, 4), Pow(Symbol('r'), Integer(3)))");
    assertThat(batch.toString(),
        is("a <- 0.5 * cse(cse(1 / r) * cse(1 / r))\n"
            + "b <- cse(rsqrt(r))\n"
            + "c <- b + -1 * a\n"
            + "d <- 1.5 * (cse(r * r) * r)\n"));
  }

  @Test
  void testComplexWidth() {
    final String product = "Mul(Integer(2), I, Symbol('k'))";
    final String sum = "Add(Float('1.5', precision=53), I)";
    assertThat(compile("a", product).instruction("a"),
        hasToString("a <- 2 * (0.0+1.0j) * k"));
    final CompilerConfig config =
        CompilerConfig.DEFAULT.with(Prop.COMPLEX_WIDTH, NumericType.COMPLEX64);
    assertThat(compile(config, "a", product).instruction("a"),
        hasToString("a <- 2 * complex64(0.0+1.0j) * k"));
    final CompilerConfig config2 =
        CompilerConfig.DEFAULT.withLenient("complexWidth", "complex128");
    assertThat(compile(config2, "a", sum).instruction("a"),
        hasToString("a <- 1.5 + complex128(0.0+1.0j)"));
  }

  @Test
  void testMathConstants() {
    final String product = "Mul(pi, Symbol('r'))";
    assertThat(compile("a", product).instruction("a"),
        hasToString("a <- pi * r"));
    final CompilerConfig config =
        CompilerConfig.DEFAULT.with(Prop.REWRITE_MATH_CONSTANTS, true);
    assertThat(compile(config, "a", product).instruction("a"),
        hasToString("a <- M_PI * r"));
  }

  /** Tests that extra passes run last, in the order given. */
  @Test
  void testExtraPasses() {
    final CompilerConfig config =
        CompilerConfig.DEFAULT
            .withExtraPass(e -> expr.wrap(e, "result"))
            .withExtraPass(new MathConstantRewriter());
    assertThat(compile(config, "a", "Mul(pi, Symbol('r'))").instruction("a"),
        hasToString("a <- cse[result](M_PI * r)"));
  }

  /** Tests that the type system holds the types of the functions that the
   * instructions call, and that the preamble defines them. */
  @Test
  void testTypesAndPreamble() {
    final CompiledBatch hankel = compile("a", hankel1(1, "Symbol('z')"));
    assertThat(hankel.typeSystem.mangle("hank1_01"),
        hasToString("hank1_01(complex128) -> hank1_01_result"));
    assertThat(hankel.typeSystem.mangle("bessel_jv"), nullValue());
    assertThat(hankel.typeSystem.lookup("hank1_01_result"),
        instanceOf(StructType.class));
    assertThat(hankel.preambles, hasSize(1));
    final String preamble = hankel.preambles.get(0);
    assertThat(preamble, containsString("#include <pyopencl-complex.h>"));
    assertThat(preamble,
        containsString("typedef struct hank1_01_result_str\n"
            + "{\n"
            + "    cdouble_t order0;\n"
            + "    cdouble_t order1;\n"
            + "} hank1_01_result;\n"));
    assertThat(preamble.indexOf("typedef struct"),
        lessThan(preamble.indexOf("hank1_01_result hank1_01(")));
    assertThat(preamble, containsString("double bessel_jv(int order"));

    final CompiledBatch bessel = compile("a", besselJ(1, "Symbol('z')"));
    assertThat(bessel.typeSystem.mangle("bessel_jv"),
        hasToString("bessel_jv(int32, float64) -> float64"));
    assertThat(bessel.typeSystem.mangle("hank1_01"), nullValue());
    assertThat(bessel.typeSystem.lookupOpt("hank1_01_result"),
        notNullValue());
    assertThat(bessel.preambles, hasSize(1));

    // Square roots need no preamble
    final CompiledBatch plain =
        compile("a", "Pow(Symbol('r'), Rational(1, 2))");
    assertThat(plain.instruction("a"), hasToString("a <- cse(sqrt(r))"));
    assertThat(plain.preambles.isEmpty(), is(true));
    assertThat(plain.typeSystem.fnTypes().isEmpty(), is(true));
    assertThat(plain.typeSystem.structTypes().isEmpty(), is(true));

    // Each batch has its own type system
    assertThat(hankel.typeSystem.mangle("bessel_jv"), nullValue());
  }

  @Test
  void testTracer() {
    final List<String> converted = new ArrayList<>();
    final List<String> orders = new ArrayList<>();
    final List<String> substituted = new ArrayList<>();
    final List<String> sized = new ArrayList<>();
    final List<String> instructions = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnConvert(tracer,
        (name, exp) -> converted.add(name + "=" + exp));
    tracer = Tracers.withOnBesselOrders(tracer,
        topOrders -> orders.add(topOrders.toString()));
    tracer = Tracers.withOnPass(tracer, Phase.SUBSTITUTION,
        (name, exp) -> substituted.add(name + "=" + exp));
    tracer = Tracers.withOnPass(tracer, Phase.COMPLEX_WIDTH,
        (name, exp) -> sized.add(name + "=" + exp));
    tracer = Tracers.withOnInstructions(tracer,
        list -> instructions.add(list.toString()));

    new KernelCompiler(CompilerConfig.DEFAULT, tracer)
        .compile(map("a", besselJ(1, "Symbol('z')"), "b", "Symbol('x')"));
    assertThat(converted, hasToString("[a=bessel_j(1, z), b=x]"));
    assertThat(orders, hasToString("[{z=1}]"));
    assertThat(substituted,
        hasToString("[a=cse[bessel_j_1](bessel_jv(1, z)), b=x]"));
    assertThat(sized.isEmpty(), is(true));
    assertThat(instructions,
        hasToString("[[a <- cse[bessel_j_1](bessel_jv(1, z)), b <- x]]"));
  }

  @Test
  void testInstructions() {
    final CompiledBatch batch =
        compile("z", "Symbol('x')", "a", "Integer(1)", "m", "Symbol('y')");
    final List<String> assignees = new ArrayList<>();
    for (Instruction instruction : batch.instructions) {
      assignees.add(instruction.assignee);
      assertThat(instruction.storageType, is(Instruction.StorageType.INFER));
    }
    assertThat(assignees, hasToString("[z, a, m]"));
    assertThat(batch.instruction("m"), hasToString("m <- y"));
    assertThrows(IllegalArgumentException.class,
        () -> batch.instruction("b"));
  }

  /** Tests compiling assignments that are already expressions. */
  @Test
  void testCompileAssignments() {
    final Expr.Exp h =
        expr.call(BuiltIn.HANKEL_1, expr.intLiteral(0), expr.var("z"));
    final CompiledBatch batch =
        new KernelCompiler(CompilerConfig.DEFAULT)
            .compileAssignments(
                ImmutableList.of(new Assignment("h", h),
                    new Assignment("p",
                        expr.power(expr.var("z"), expr.intLiteral(2)))));
    assertThat(batch.toString(),
        is("h <- cse[hank1_01_result](hank1_01(z)).order0\n"
            + "p <- cse(z * z)\n"));
  }

  /** Tests that an error anywhere in the batch aborts compilation. */
  @Test
  void testErrors() {
    final KernelCompiler compiler = new KernelCompiler(CompilerConfig.DEFAULT);
    assertThrows(SreprParseException.class,
        () -> compiler.compile(map("a", "Symbol('x')", "b", "Add(")));
    assertThrows(AssertionError.class,
        () -> compiler.compile(
            map("a", "besselj(Symbol('n'), Symbol('z'))")));
  }
}

// End KernelCompilerTest.java
