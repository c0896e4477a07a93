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
package net.hydromatic.ace.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Abstract syntax tree of the logic programs produced by translation.
 *
 * <p>Every node renders itself, via {@link Object#toString()}, in the
 * clause/goal grammar that the inference engine accepts: {@code
 * functor(arg1, ..., argN)}, {@code head :- body}, {@code ,} for conjunction
 * and {@code ;} for disjunction.
 */
public class LogicAst {
  private LogicAst() {
    // Utility class
  }

  /** Base class for terms. */
  public abstract static class Term {
    /** Returns whether this term is, or contains, the given variable. */
    public abstract boolean mentions(Variable variable);
  }

  /** An atom, such as {@code john} or {@code self_employed}. */
  public static class Atom extends Term {
    public final String name;

    public Atom(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public boolean mentions(Variable variable) {
      return false;
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Atom && name.equals(((Atom) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** A logic variable, such as {@code X} or {@code SOMEONE}. */
  public static class Variable extends Term {
    /** The answer variable of every query goal. */
    public static final Variable ANSWER = new Variable("X");

    /** The anonymous variable, {@code _}. */
    public static final Variable ANONYMOUS = new Variable("_");

    public final String name;

    public Variable(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public boolean mentions(Variable variable) {
      return equals(variable);
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** A numeric literal, kept exactly as written (e.g. {@code 2500.50}). */
  public static class Numeral extends Term {
    public final String text;

    public Numeral(String text) {
      this.text = requireNonNull(text);
    }

    @Override
    public boolean mentions(Variable variable) {
      return false;
    }

    @Override
    public String toString() {
      return text;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Numeral && text.equals(((Numeral) o).text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }
  }

  /** A compound term, such as {@code date(1985, 6, 15)}. */
  public static class Compound extends Term {
    public final String functor;
    public final List<Term> args;

    public Compound(String functor, List<? extends Term> args) {
      this.functor = requireNonNull(functor);
      this.args = ImmutableList.copyOf(args);
      checkArgument(!this.args.isEmpty(), "compound term needs arguments");
    }

    @Override
    public boolean mentions(Variable variable) {
      for (Term arg : args) {
        if (arg.mentions(variable)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return functor + "(" + join(args) + ")";
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Compound)) {
        return false;
      }
      Compound that = (Compound) o;
      return functor.equals(that.functor) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(functor, args);
    }
  }

  /** Base class for goals, which may appear in rule bodies and queries. */
  public abstract static class Goal {
    /** Returns whether this goal mentions the given variable. */
    public abstract boolean mentions(Variable variable);
  }

  /** A predicate application: {@code name(term, ...)}. */
  public static class Predication extends Goal {
    public final String name;
    public final List<Term> terms;

    public Predication(String name, List<? extends Term> terms) {
      this.name = requireNonNull(name);
      this.terms = ImmutableList.copyOf(terms);
    }

    /** Creates a predicate application. */
    public static Predication of(String name, Term... terms) {
      return new Predication(name, ImmutableList.copyOf(terms));
    }

    public int arity() {
      return terms.size();
    }

    /**
     * Returns a pattern that matches every clause of this predicate, such as
     * {@code likes(_, _)}.
     */
    public String pattern() {
      return pattern(name, arity());
    }

    /** Returns a pattern that matches every clause of a predicate. */
    public static String pattern(String name, int arity) {
      final StringBuilder b = new StringBuilder(name).append('(');
      for (int i = 0; i < arity; i++) {
        b.append(i == 0 ? "_" : ", _");
      }
      return b.append(')').toString();
    }

    @Override
    public boolean mentions(Variable variable) {
      for (Term term : terms) {
        if (term.mentions(variable)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return name + "(" + join(terms) + ")";
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Predication)) {
        return false;
      }
      Predication that = (Predication) o;
      return name.equals(that.name) && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, terms);
    }
  }

  /** Numeric comparison operators. */
  public enum CompOp {
    GT(">"),
    LT("<"),
    GE(">="),
    EQ("=:=");

    public final String symbol;

    CompOp(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /** A numeric comparison, such as {@code Count > 3}. */
  public static class Comparison extends Goal {
    public final Term left;
    public final CompOp op;
    public final Term right;

    public Comparison(Term left, CompOp op, Term right) {
      this.left = requireNonNull(left);
      this.op = requireNonNull(op);
      this.right = requireNonNull(right);
    }

    @Override
    public boolean mentions(Variable variable) {
      return left.mentions(variable) || right.mentions(variable);
    }

    @Override
    public String toString() {
      return left + " " + op + " " + right;
    }
  }

  /** Connective that joins the goals of a {@link Junction}. */
  public enum Connective {
    AND(", "),
    OR("; ");

    public final String separator;

    Connective(String separator) {
      this.separator = separator;
    }
  }

  /** Goals joined uniformly by conjunction or uniformly by disjunction. */
  public static class Junction extends Goal {
    public final Connective connective;
    public final List<Goal> goals;

    public Junction(Connective connective, List<? extends Goal> goals) {
      this.connective = requireNonNull(connective);
      this.goals = ImmutableList.copyOf(goals);
      checkArgument(!this.goals.isEmpty(), "junction needs at least one goal");
    }

    /** Creates a conjunction. */
    public static Junction and(Goal... goals) {
      return new Junction(Connective.AND, ImmutableList.copyOf(goals));
    }

    @Override
    public boolean mentions(Variable variable) {
      for (Goal goal : goals) {
        if (goal.mentions(variable)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      for (Goal goal : goals) {
        if (b.length() > 0) {
          b.append(connective.separator);
        }
        // "," binds tighter than ";", so only a disjunction inside a
        // conjunction needs parentheses
        if (connective == Connective.AND
            && goal instanceof Junction
            && ((Junction) goal).connective == Connective.OR) {
          b.append('(').append(goal).append(')');
        } else {
          b.append(goal);
        }
      }
      return b.toString();
    }
  }

  /** Base class for the results of translating a statement. */
  public abstract static class Sentence {
    // Marker class
  }

  /** A ground fact, such as {@code person(john)}. */
  public static class Fact extends Sentence {
    public final Predication predication;

    public Fact(Predication predication) {
      this.predication = requireNonNull(predication);
    }

    @Override
    public String toString() {
      return predication.toString();
    }
  }

  /** A rule: {@code head :- body}. */
  public static class Clause extends Sentence {
    public final Predication head;
    public final Goal body;

    public Clause(Predication head, Goal body) {
      this.head = requireNonNull(head);
      this.body = requireNonNull(body);
    }

    @Override
    public String toString() {
      return head + " :- " + body;
    }
  }

  /** A query: a goal, tagged with the shape of question it came from. */
  public static class Query extends Sentence {
    public final QueryType type;
    public final Goal goal;

    public Query(QueryType type, Goal goal) {
      this.type = requireNonNull(type);
      this.goal = requireNonNull(goal);
    }

    @Override
    public String toString() {
      return goal.toString();
    }
  }

  private static String join(List<?> list) {
    final StringBuilder b = new StringBuilder();
    for (Object o : list) {
      if (b.length() > 0) {
        b.append(", ");
      }
      b.append(o);
    }
    return b.toString();
  }
}

// End LogicAst.java
