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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Visitor;
import net.hydromatic.kernel.foreign.SympyConverter;
import net.hydromatic.kernel.type.NumericType;
import net.hydromatic.kernel.type.StructType;
import net.hydromatic.kernel.type.TypeSystem;

/**
 * Compiles kernel expressions into instructions for a loop-nest code
 * generator.
 *
 * <p>Each call to {@link #compile} or {@link #compileAssignments} compiles one
 * batch. Every pass gets fresh state for each batch, so a compiler may be
 * used for any number of batches.
 *
 * <p>The phases run in a fixed order (see {@link Phase}). Derivatives are
 * expanded in every assignment, then the top orders of Bessel J are gathered
 * over the whole batch, and only then does substitution begin.
 */
public class KernelCompiler {
  private static final Supplier<String> BESSEL_INCLUDES =
      Suppliers.memoize(() -> resource("bessel-includes.cl"));

  private static final Supplier<String> BESSEL_FUNCTIONS =
      Suppliers.memoize(() -> resource("bessel-functions.cl"));

  private final CompilerConfig config;
  private final Tracer tracer;

  /** Creates a KernelCompiler. */
  public KernelCompiler(CompilerConfig config, Tracer tracer) {
    this.config = requireNonNull(config);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a KernelCompiler that does not trace. */
  public KernelCompiler(CompilerConfig config) {
    this(config, Tracers.empty());
  }

  private static String resource(String name) {
    try {
      return Resources.toString(
          Resources.getResource(KernelCompiler.class, name), UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Compiles a batch of assignments whose expressions are in SymPy's {@code
   * srepr} format.
   *
   * @param sreprs Map from assignee name to expression; iteration order is
   *     the order of the instructions
   */
  public CompiledBatch compile(Map<String, String> sreprs) {
    final SympyConverter converter = new SympyConverter();
    final List<Assignment> assignments = new ArrayList<>();
    sreprs.forEach((name, srepr) -> {
      final Expr.Exp exp = converter.convert(srepr);
      tracer.onConvert(name, exp);
      assignments.add(new Assignment(name, exp));
    });
    return compileAssignments(assignments);
  }

  /** Compiles a batch of assignments. */
  public CompiledBatch compileAssignments(List<Assignment> assignments) {
    final List<Assignment> expanded =
        rewrite(assignments, Phase.DERIVATIVES, new BesselDerivativeReplacer());

    final BesselOrderGatherer gatherer = new BesselOrderGatherer();
    for (Assignment assignment : expanded) {
      assignment.exp.accept(gatherer);
    }
    final ImmutableMap<Expr.Exp, Integer> topOrders = gatherer.topOrders();
    tracer.onBesselOrders(topOrders);

    List<Assignment> list = expanded;
    for (Map.Entry<Phase, UnaryOperator<Expr.Exp>> pass : passes(topOrders)) {
      list = rewrite(list, pass.getKey(), pass.getValue());
    }

    final ImmutableList.Builder<Instruction> instructions =
        ImmutableList.builder();
    final UsedBuiltIns usedBuiltIns = new UsedBuiltIns();
    for (Assignment assignment : list) {
      instructions.add(
          new Instruction(assignment.name, assignment.exp,
              Instruction.StorageType.INFER));
      assignment.exp.accept(usedBuiltIns);
    }

    final TypeSystem typeSystem = new TypeSystem();
    final ImmutableList<String> preambles =
        register(typeSystem, usedBuiltIns.builtIns);
    final CompiledBatch batch =
        new CompiledBatch(instructions.build(), typeSystem, topOrders,
            preambles);
    tracer.onInstructions(batch.instructions);
    return batch;
  }

  /** Returns the passes that follow gathering, in order. */
  private List<Map.Entry<Phase, UnaryOperator<Expr.Exp>>> passes(
      Map<Expr.Exp, Integer> topOrders) {
    final List<Map.Entry<Phase, UnaryOperator<Expr.Exp>>> passes =
        new ArrayList<>();
    passes.add(
        Maps.immutableEntry(Phase.SUBSTITUTION,
            new BesselSubstitutor(new BesselGetter(topOrders))));
    passes.add(
        Maps.immutableEntry(Phase.VECTOR_COMPONENTS,
            new VectorComponentRewriter(config.vectorNames)));
    passes.add(Maps.immutableEntry(Phase.POWERS, new PowerRewriter()));
    passes.add(Maps.immutableEntry(Phase.FRACTIONS, new FractionReducer()));
    passes.add(Maps.immutableEntry(Phase.SIGNS, new SumSignGrouper()));
    final NumericType complexWidth = config.complexWidth();
    if (complexWidth != null) {
      passes.add(
          Maps.immutableEntry(Phase.COMPLEX_WIDTH,
              new ComplexConstantSizer(complexWidth)));
    }
    if (config.rewriteMathConstants()) {
      passes.add(
          Maps.immutableEntry(Phase.MATH_CONSTANTS,
              new MathConstantRewriter()));
    }
    for (UnaryOperator<Expr.Exp> extraPass : config.extraPasses) {
      passes.add(Maps.immutableEntry(Phase.EXTRA, extraPass));
    }
    return passes;
  }

  /** Applies a pass to every assignment. */
  private List<Assignment> rewrite(List<Assignment> assignments, Phase phase,
      UnaryOperator<Expr.Exp> pass) {
    final List<Assignment> list = new ArrayList<>(assignments.size());
    for (Assignment assignment : assignments) {
      final Assignment assignment2 =
          assignment.withExp(pass.apply(assignment.exp));
      tracer.onPass(phase, assignment2.name, assignment2.exp);
      list.add(assignment2);
    }
    return list;
  }

  /**
   * Registers the signatures of built-in functions in a type system, and
   * returns the preambles that generated code calling those functions needs.
   */
  private static ImmutableList<String> register(TypeSystem typeSystem,
      Set<BuiltIn> builtIns) {
    boolean preamble = false;
    for (BuiltIn builtIn : builtIns) {
      builtIn.register(typeSystem);
      preamble |= builtIn.needsPreamble();
    }
    if (!preamble) {
      return ImmutableList.of();
    }
    // The helper functions in the preamble return this struct, whether or
    // not the instructions call them.
    BuiltIn.hank1_01ResultType(typeSystem);
    final StringBuilder b = new StringBuilder(BESSEL_INCLUDES.get());
    for (StructType structType : typeSystem.structTypes()) {
      b.append('\n').append(structType.declaration());
    }
    b.append('\n').append(BESSEL_FUNCTIONS.get());
    return ImmutableList.of(b.toString());
  }

  /** Finds calls to built-in functions. */
  private static class UsedBuiltIns extends Visitor {
    final Set<BuiltIn> builtIns = EnumSet.noneOf(BuiltIn.class);

    @Override
    protected void visit(Expr.Call call) {
      final BuiltIn builtIn = BuiltIn.lookup(call.name);
      if (builtIn != null && builtIn.functionName.equals(call.name)) {
        builtIns.add(builtIn);
      }
      super.visit(call);
    }
  }
}

// End KernelCompiler.java
