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
package net.hydromatic.kernel.foreign;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.kernel.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.compile.BuiltIn;
import net.hydromatic.kernel.compile.Replacer;

/**
 * Converts expressions from SymPy's {@code srepr} format to kernel
 * expressions.
 *
 * <p>For example, the text
 *
 * <blockquote><pre>
 * Mul(Rational(1, 2), Pow(Symbol('r'), Integer(-1)))</pre></blockquote>
 *
 * <p>converts to {@code 1 / 2 * r ** -1}.
 *
 * <p>Undefined functions, such as {@code Function('hankel_1')}, become calls;
 * SymPy's {@code hankel1} and {@code besselj} become calls to {@link
 * BuiltIn#HANKEL_1} and {@link BuiltIn#BESSEL_J}. A derivative evaluated at a
 * point, {@code Subs(Derivative(f(x), x), x, p)}, becomes a {@link
 * Expr.Derivative}.
 */
public class SympyConverter {
  /** Converts a string in {@code srepr} format to an expression.
   *
   * @throws SreprParseException if the text is invalid or unsupported */
  public Expr.Exp convert(String srepr) {
    final Node node = new Parser(srepr).parse();
    return toExp(node);
  }

  private Expr.Exp toExp(Node node) {
    if (node instanceof Num) {
      return ((Num) node).toLiteral();
    }
    if (node instanceof Atom) {
      return atom((Atom) node);
    }
    if (node instanceof Apply) {
      final Apply apply = (Apply) node;
      if (apply.head instanceof Atom) {
        return apply(((Atom) apply.head).name, apply);
      }
      final String name = functionName(apply.head);
      return expr.call(mapName(name), toExps(apply.args));
    }
    throw new SreprParseException("unexpected " + node.describe(),
        node.offset);
  }

  private List<Expr.Exp> toExps(List<Node> nodes) {
    final List<Expr.Exp> list = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      list.add(toExp(node));
    }
    return list;
  }

  private Expr.Exp atom(Atom atom) {
    switch (atom.name) {
      case "I":
        return expr.complexLiteral(0, 1);
      case "pi":
        return expr.var("pi");
      case "E":
        return expr.realLiteral(Math.E);
      default:
        throw new SreprParseException("unsupported atom '" + atom.name + "'",
            atom.offset);
    }
  }

  private Expr.Exp apply(String name, Apply apply) {
    switch (name) {
      case "Symbol":
      case "Dummy":
        return expr.var(symbolName(apply));
      case "Integer":
        checkArgCount(apply, 1);
        return expr.intLiteral(num(apply.args.get(0)).intValue());
      case "Rational":
        checkArgCount(apply, 2);
        final BigInteger p = num(apply.args.get(0)).intValue();
        final BigInteger q = num(apply.args.get(1)).intValue();
        if (q.signum() == 0) {
          throw new SreprParseException("zero denominator", apply.offset);
        }
        return q.equals(BigInteger.ONE)
            ? expr.intLiteral(p)
            : expr.rational(p, q);
      case "Float":
        checkArgCount(apply, 1);
        return expr.realLiteral(floatValue(apply.args.get(0)));
      case "Zero":
        checkArgCount(apply, 0);
        return expr.intLiteral(0);
      case "One":
        checkArgCount(apply, 0);
        return expr.intLiteral(1);
      case "NegativeOne":
        checkArgCount(apply, 0);
        return expr.intLiteral(-1);
      case "Half":
        checkArgCount(apply, 0);
        return expr.rational(BigInteger.ONE, BigInteger.valueOf(2));
      case "ImaginaryUnit":
        checkArgCount(apply, 0);
        return expr.complexLiteral(0, 1);
      case "Pi":
        checkArgCount(apply, 0);
        return expr.var("pi");
      case "Exp1":
        checkArgCount(apply, 0);
        return expr.realLiteral(Math.E);
      case "Add":
        checkMinArgCount(apply, 1);
        return apply.args.size() == 1
            ? toExp(apply.args.get(0))
            : expr.sum(toExps(apply.args));
      case "Mul":
        checkMinArgCount(apply, 1);
        return apply.args.size() == 1
            ? toExp(apply.args.get(0))
            : expr.product(toExps(apply.args));
      case "Pow":
        checkArgCount(apply, 2);
        return expr.power(toExp(apply.args.get(0)), toExp(apply.args.get(1)));
      case "Derivative":
        return derivative(apply);
      case "Subs":
        return subs(apply);
      case "Function":
      case "Tuple":
        throw new SreprParseException("unexpected " + name, apply.offset);
      default:
        // A SymPy function such as exp, log or besselj
        return expr.call(mapName(name), toExps(apply.args));
    }
  }

  /** Converts "Derivative(f(x), Tuple(x, 2))" or "Derivative(f(x), x, x)". */
  private Expr.Exp derivative(Apply apply) {
    checkMinArgCount(apply, 2);
    final Expr.Exp e = toExp(apply.args.get(0));
    if (!(e instanceof Expr.Call)) {
      throw new SreprParseException("derivative of non-function " + e,
          apply.offset);
    }
    final List<String> variables = new ArrayList<>();
    for (Node spec : apply.args.subList(1, apply.args.size())) {
      final List<Node> items = items(spec);
      if (items.size() == 1) {
        variables.add(symbolName(items.get(0)));
      } else if (items.size() == 2) {
        final String variable = symbolName(items.get(0));
        final BigInteger count = integerValue(items.get(1));
        if (count.signum() <= 0 || count.bitLength() > 16) {
          throw new SreprParseException("invalid derivative count " + count,
              spec.offset);
        }
        for (int i = 0; i < count.intValue(); i++) {
          variables.add(variable);
        }
      } else {
        throw new SreprParseException("invalid derivative variable",
            spec.offset);
      }
    }
    return expr.derivative((Expr.Call) e, variables,
        expr.var(variables.get(0)));
  }

  /** Converts "Subs(e, Tuple(x, y), Tuple(a, b))". */
  private Expr.Exp subs(Apply apply) {
    checkArgCount(apply, 3);
    final Expr.Exp e = toExp(apply.args.get(0));
    final List<Node> variables = items(apply.args.get(1));
    final List<Node> values = items(apply.args.get(2));
    if (variables.size() != values.size()) {
      throw new SreprParseException("substitution has " + variables.size()
          + " variables but " + values.size() + " values", apply.offset);
    }
    final Map<String, Expr.Exp> map = new LinkedHashMap<>();
    for (int i = 0; i < variables.size(); i++) {
      map.put(symbolName(variables.get(i)), toExp(values.get(i)));
    }
    try {
      return Replacer.substitute(map, e);
    } catch (IllegalArgumentException ex) {
      throw new SreprParseException(ex.getMessage(), apply.offset);
    }
  }

  /** Returns the name of an undefined function, "Function('f')". */
  private static String functionName(Node node) {
    if (node instanceof Apply
        && ((Apply) node).head instanceof Atom
        && ((Atom) ((Apply) node).head).name.equals("Function")) {
      final Apply apply = (Apply) node;
      checkArgCount(apply, 1);
      return string(apply.args.get(0));
    }
    throw new SreprParseException("expected function, got "
        + node.describe(), node.offset);
  }

  /** Maps a SymPy function name to the name of the built-in function, if
   * there is one. */
  private static String mapName(String name) {
    final BuiltIn builtIn = BuiltIn.lookup(name);
    return builtIn == null ? name : builtIn.functionName;
  }

  /** Returns the name of "Symbol('x')" or "Dummy('x')". */
  private static String symbolName(Node node) {
    if (node instanceof Apply && ((Apply) node).head instanceof Atom) {
      final Apply apply = (Apply) node;
      final String head = ((Atom) apply.head).name;
      if (head.equals("Symbol") || head.equals("Dummy")) {
        checkArgCount(apply, 1);
        return string(apply.args.get(0));
      }
    }
    throw new SreprParseException("expected symbol, got " + node.describe(),
        node.offset);
  }

  /** Returns the value of "3" or "Integer(3)". */
  private static BigInteger integerValue(Node node) {
    if (node instanceof Apply
        && ((Apply) node).head instanceof Atom
        && ((Atom) ((Apply) node).head).name.equals("Integer")) {
      checkArgCount((Apply) node, 1);
      return num(((Apply) node).args.get(0)).intValue();
    }
    return num(node).intValue();
  }

  private static double floatValue(Node node) {
    final String text =
        node instanceof Str ? ((Str) node).value : num(node).text;
    try {
      return Double.parseDouble(text.trim());
    } catch (NumberFormatException e) {
      throw new SreprParseException("invalid float '" + text + "'",
          node.offset);
    }
  }

  private static String string(Node node) {
    if (node instanceof Str) {
      return ((Str) node).value;
    }
    throw new SreprParseException("expected string, got " + node.describe(),
        node.offset);
  }

  private static Num num(Node node) {
    if (node instanceof Num) {
      return (Num) node;
    }
    throw new SreprParseException("expected number, got " + node.describe(),
        node.offset);
  }

  /** Returns the items of a tuple, "Tuple(a, b)" or "(a, b)"; or a list
   * containing just the node if it is not a tuple. */
  private static List<Node> items(Node node) {
    if (node instanceof Tup) {
      return ((Tup) node).items;
    }
    if (node instanceof Apply
        && ((Apply) node).head instanceof Atom
        && ((Atom) ((Apply) node).head).name.equals("Tuple")) {
      return ((Apply) node).args;
    }
    return ImmutableList.of(node);
  }

  private static void checkArgCount(Apply apply, int count) {
    if (apply.args.size() != count) {
      throw new SreprParseException(apply.head.describe() + " expects "
          + count + " argument(s), got " + apply.args.size(), apply.offset);
    }
  }

  private static void checkMinArgCount(Apply apply, int count) {
    if (apply.args.size() < count) {
      throw new SreprParseException(apply.head.describe() + " expects at least "
          + count + " argument(s), got " + apply.args.size(), apply.offset);
    }
  }

  /** Parse tree of {@code srepr} text. */
  private abstract static class Node {
    final int offset;

    Node(int offset) {
      this.offset = offset;
    }

    abstract String describe();
  }

  /** Bare identifier, such as "I" or "Symbol". */
  private static class Atom extends Node {
    final String name;

    Atom(int offset, String name) {
      super(offset);
      this.name = requireNonNull(name);
    }

    @Override
    String describe() {
      return name;
    }
  }

  /** Numeric token, such as "-3" or "2.5". */
  private static class Num extends Node {
    final String text;

    Num(int offset, String text) {
      super(offset);
      this.text = requireNonNull(text);
    }

    boolean isInt() {
      return text.indexOf('.') < 0
          && text.indexOf('e') < 0
          && text.indexOf('E') < 0;
    }

    BigInteger intValue() {
      if (!isInt()) {
        throw new SreprParseException("expected integer, got " + text,
            offset);
      }
      return new BigInteger(text.startsWith("+") ? text.substring(1) : text);
    }

    Expr.Literal toLiteral() {
      return isInt()
          ? expr.intLiteral(intValue())
          : expr.realLiteral(Double.parseDouble(text));
    }

    @Override
    String describe() {
      return "number " + text;
    }
  }

  /** Quoted string. */
  private static class Str extends Node {
    final String value;

    Str(int offset, String value) {
      super(offset);
      this.value = requireNonNull(value);
    }

    @Override
    String describe() {
      return "string '" + value + "'";
    }
  }

  /** Parenthesized tuple, "(a, b)". */
  private static class Tup extends Node {
    final ImmutableList<Node> items;

    Tup(int offset, List<Node> items) {
      super(offset);
      this.items = ImmutableList.copyOf(items);
    }

    @Override
    String describe() {
      return "tuple";
    }
  }

  /** Application, "head(arg, ...)". Keyword arguments, such as
   * "real=True", are discarded. */
  private static class Apply extends Node {
    final Node head;
    final ImmutableList<Node> args;

    Apply(int offset, Node head, List<Node> args) {
      super(offset);
      this.head = requireNonNull(head);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    String describe() {
      return head.describe() + "(...)";
    }
  }

  /** Recursive-descent parser of {@code srepr} text. */
  private static class Parser {
    private final String s;
    private int pos;

    Parser(String s) {
      this.s = requireNonNull(s);
    }

    Node parse() {
      final Node node = node();
      skipSpace();
      if (pos < s.length()) {
        throw new SreprParseException("unexpected '" + s.charAt(pos) + "'",
            pos);
      }
      return node;
    }

    private void skipSpace() {
      while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
        ++pos;
      }
    }

    private boolean lookingAt(char c) {
      skipSpace();
      return pos < s.length() && s.charAt(pos) == c;
    }

    private void expect(char c) {
      if (!lookingAt(c)) {
        throw new SreprParseException("expected '" + c + "'", pos);
      }
      ++pos;
    }

    private Node node() {
      skipSpace();
      if (pos >= s.length()) {
        throw new SreprParseException("unexpected end of input", pos);
      }
      final int start = pos;
      final char c = s.charAt(pos);
      if (Character.isLetter(c) || c == '_') {
        Node node = new Atom(start, identifier());
        while (lookingAt('(')) {
          node = arguments(start, node);
        }
        return node;
      }
      if (Character.isDigit(c) || c == '-' || c == '+') {
        return number();
      }
      if (c == '\'' || c == '"') {
        return string();
      }
      if (c == '(') {
        return tuple();
      }
      throw new SreprParseException("unexpected '" + c + "'", pos);
    }

    private String identifier() {
      final int start = pos;
      while (pos < s.length()
          && (Character.isLetterOrDigit(s.charAt(pos))
              || s.charAt(pos) == '_')) {
        ++pos;
      }
      return s.substring(start, pos);
    }

    private Num number() {
      final int start = pos;
      if (s.charAt(pos) == '-' || s.charAt(pos) == '+') {
        ++pos;
      }
      while (pos < s.length()) {
        final char c = s.charAt(pos);
        if (Character.isDigit(c) || c == '.') {
          ++pos;
        } else if ((c == 'e' || c == 'E') && pos + 1 < s.length()) {
          ++pos;
          if (s.charAt(pos) == '-' || s.charAt(pos) == '+') {
            ++pos;
          }
        } else {
          break;
        }
      }
      final String text = s.substring(start, pos);
      if (text.isEmpty() || !Character.isDigit(text.charAt(text.length() - 1))
          && text.charAt(text.length() - 1) != '.') {
        throw new SreprParseException("invalid number '" + text + "'", start);
      }
      return new Num(start, text);
    }

    private Str string() {
      final int start = pos;
      final char quote = s.charAt(pos++);
      final StringBuilder b = new StringBuilder();
      while (pos < s.length() && s.charAt(pos) != quote) {
        char c = s.charAt(pos++);
        if (c == '\\' && pos < s.length()) {
          c = s.charAt(pos++);
        }
        b.append(c);
      }
      if (pos >= s.length()) {
        throw new SreprParseException("unterminated string", start);
      }
      ++pos;
      return new Str(start, b.toString());
    }

    private Tup tuple() {
      final int start = pos;
      expect('(');
      final List<Node> items = new ArrayList<>();
      while (!lookingAt(')')) {
        items.add(node());
        if (!lookingAt(',')) {
          break;
        }
        ++pos;
      }
      expect(')');
      return new Tup(start, items);
    }

    private Apply arguments(int start, Node head) {
      expect('(');
      final List<Node> args = new ArrayList<>();
      boolean keywords = false;
      while (!lookingAt(')')) {
        if (keyword()) {
          node();
          keywords = true;
        } else if (keywords) {
          throw new SreprParseException(
              "positional argument follows keyword argument", pos);
        } else {
          args.add(node());
        }
        if (!lookingAt(',')) {
          break;
        }
        ++pos;
      }
      expect(')');
      return new Apply(start, head, args);
    }

    /** If the input is at "identifier =", consumes it and returns true;
     * otherwise returns false and consumes nothing. */
    private boolean keyword() {
      skipSpace();
      final int start = pos;
      if (pos < s.length()
          && (Character.isLetter(s.charAt(pos)) || s.charAt(pos) == '_')) {
        identifier();
        if (lookingAt('=')) {
          ++pos;
          return true;
        }
      }
      pos = start;
      return false;
    }
  }
}

// End SympyConverter.java
