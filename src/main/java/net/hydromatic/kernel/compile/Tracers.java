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

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.kernel.ast.Expr;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each converted
   * expression, then calls the underlying tracer. */
  public static Tracer withOnConvert(Tracer tracer,
      BiConsumer<String, Expr.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onConvert(String name, Expr.Exp exp) {
        consumer.accept(name, exp);
        super.onConvert(name, exp);
      }
    };
  }

  /** Returns a tracer that performs the given action on the gathered top
   * orders, then calls the underlying tracer. */
  public static Tracer withOnBesselOrders(Tracer tracer,
      Consumer<Map<Expr.Exp, Integer>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBesselOrders(Map<Expr.Exp, Integer> topOrders) {
        consumer.accept(topOrders);
        super.onBesselOrders(topOrders);
      }
    };
  }

  /** Returns a tracer that performs the given action on each expression
   * produced by a given phase, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, Phase phase,
      BiConsumer<String, Expr.Exp> consumer) {
    final Phase expectedPhase = phase;
    return new DelegatingTracer(tracer) {
      @Override
      public void onPass(Phase phase, String name, Expr.Exp exp) {
        if (phase == expectedPhase) {
          consumer.accept(name, exp);
        }
        super.onPass(phase, name, exp);
      }
    };
  }

  /** Returns a tracer that performs the given action on the instructions,
   * then calls the underlying tracer. */
  public static Tracer withOnInstructions(Tracer tracer,
      Consumer<List<Instruction>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInstructions(List<Instruction> instructions) {
        consumer.accept(instructions);
        super.onInstructions(instructions);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onConvert(String name, Expr.Exp exp) {}

    @Override
    public void onBesselOrders(Map<Expr.Exp, Integer> topOrders) {}

    @Override
    public void onPass(Phase phase, String name, Expr.Exp exp) {}

    @Override
    public void onInstructions(List<Instruction> instructions) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onConvert(String name, Expr.Exp exp) {
      tracer.onConvert(name, exp);
    }

    @Override
    public void onBesselOrders(Map<Expr.Exp, Integer> topOrders) {
      tracer.onBesselOrders(topOrders);
    }

    @Override
    public void onPass(Phase phase, String name, Expr.Exp exp) {
      tracer.onPass(phase, name, exp);
    }

    @Override
    public void onInstructions(List<Instruction> instructions) {
      tracer.onInstructions(instructions);
    }
  }
}

// End Tracers.java
