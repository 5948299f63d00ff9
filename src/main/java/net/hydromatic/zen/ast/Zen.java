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
package net.hydromatic.zen.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression nodes.
 *
 * <p>Nodes are immutable and form a directed acyclic graph; a node may be
 * shared by several parents. Each node has an {@link Exp#id} that is unique
 * for the lifetime of the process, and evaluators use it, not object
 * identity, as the key of their caches.
 *
 * <p>Create nodes using {@link ZenBuilder}, which checks operand types.
 */
public class Zen {
  private Zen() {}

  /** Source of node ids. */
  private static final AtomicInteger NEXT_ID = new AtomicInteger();

  /** Base class for an expression node. */
  public abstract static class Exp {
    public final Op op;
    public final Type type;
    public final int id;

    Exp(Op op, Type type) {
      this.op = requireNonNull(op);
      this.type = requireNonNull(type);
      this.id = NEXT_ID.getAndIncrement();
    }

    /** Calls the method of the visitor that handles this kind of node. */
    public abstract <R, P> R accept(ExpVisitor<R, P> visitor, P p);

    @Override
    public final String toString() {
      return unparse(new StringBuilder()).toString();
    }

    abstract StringBuilder unparse(StringBuilder b);
  }

  /** Constant. The value is a host value of the node's type. */
  public static class Constant extends Exp {
    public final Object value;

    Constant(Type type, Object value) {
      super(Op.CONSTANT, type);
      this.value = requireNonNull(value);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      if (value instanceof String) {
        return b.append('"').append(value).append('"');
      }
      if (value instanceof Character) {
        return b.append('\'').append(value).append('\'');
      }
      return b.append(value);
    }
  }

  /** Free variable, whose value the solver chooses. */
  public static class Arbitrary extends Exp {
    public final @Nullable String name;

    Arbitrary(Type type, @Nullable String name) {
      super(Op.ARBITRARY, type);
      this.name = name;
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return name != null ? b.append(name) : b.append('$').append(id);
    }
  }

  /** Placeholder for a value that an {@link
   * net.hydromatic.zen.eval.Environment} binds at evaluation time. */
  public static class Argument extends Exp {
    Argument(Type type) {
      super(Op.ARGUMENT, type);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append('#').append(id);
    }
  }

  /** Application of a built-in operator to a fixed number of operands. */
  public static class Call extends Exp {
    public final ImmutableList<Exp> args;

    Call(Op op, Type type, ImmutableList<Exp> args) {
      super(op, type);
      this.args = requireNonNull(args);
      checkArgument(op.arity == args.size(), "%s expects %s operands",
          op, op.arity);
    }

    /** Returns the {@code i}th operand. */
    public Exp arg(int i) {
      return args.get(i);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      if (op.isInfix()) {
        b.append('(');
        args.get(0).unparse(b).append(op.opString);
        return args.get(1).unparse(b).append(')');
      }
      b.append(op.opString);
      if (args.isEmpty()) {
        return b;
      }
      b.append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        args.get(i).unparse(b);
      }
      return b.append(')');
    }
  }

  /** Conditional expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF, ifTrue.type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append("if ");
      condition.unparse(b).append(" then ");
      ifTrue.unparse(b).append(" else ");
      return ifFalse.unparse(b);
    }
  }

  /** Creates a record from one expression per field. */
  public static class CreateObject extends Exp {
    public final ImmutableSortedMap<String, Exp> fields;

    CreateObject(RecordType type, ImmutableSortedMap<String, Exp> fields) {
      super(Op.CREATE_OBJECT, type);
      this.fields = requireNonNull(fields);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append('{');
      fields.forEach((name, exp) -> {
        if (b.charAt(b.length() - 1) != '{') {
          b.append(", ");
        }
        exp.unparse(b.append(name).append(" = "));
      });
      return b.append('}');
    }
  }

  /** Reads a field of a record. */
  public static class GetField extends Exp {
    public final Exp exp;
    public final String fieldName;

    GetField(Type type, Exp exp, String fieldName) {
      super(Op.GET_FIELD, type);
      this.exp = requireNonNull(exp);
      this.fieldName = requireNonNull(fieldName);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return exp.unparse(b).append('.').append(fieldName);
    }
  }

  /** Copy of a record with one field replaced. */
  public static class WithField extends Exp {
    public final Exp exp;
    public final String fieldName;
    public final Exp value;

    WithField(Exp exp, String fieldName, Exp value) {
      super(Op.WITH_FIELD, exp.type);
      this.exp = requireNonNull(exp);
      this.fieldName = requireNonNull(fieldName);
      this.value = requireNonNull(value);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      exp.unparse(b).append(" with {").append(fieldName).append(" = ");
      return value.unparse(b).append('}');
    }
  }

  /** Case split on a list or finite sequence: one expression if it is
   * empty, another built from its head and tail if it is not.
   *
   * <p>The non-empty case is a function. The node applies it, at most once
   * and only when an evaluator first asks, to two arguments that it owns,
   * {@link #head} and {@link #tail}. Because construction is deferred, a
   * function may recursively case-split the tail; evaluation stops at the
   * lengths that the list can actually have. */
  public static class ListCase extends Exp {
    public final Exp list;
    public final Exp emptyCase;
    public final Argument head;
    public final Argument tail;
    private final Supplier<Exp> consCase;

    ListCase(Type type, Exp list, Exp emptyCase, Type elementType,
        BiFunction<Exp, Exp, Exp> consFunction) {
      super(Op.LIST_CASE, type);
      this.list = requireNonNull(list);
      this.emptyCase = requireNonNull(emptyCase);
      this.head = new Argument(elementType);
      this.tail = new Argument(list.type);
      requireNonNull(consFunction);
      this.consCase = Suppliers.memoize(() -> {
        final Exp exp = consFunction.apply(head, tail);
        checkArgument(exp.type.equals(type),
            "non-empty case has type %s, expected %s", exp.type, type);
        return exp;
      });
    }

    /** Returns the expression for the non-empty case, in terms of
     * {@link #head} and {@link #tail}. */
    public Exp consCase() {
      return consCase.get();
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append("case ");
      list.unparse(b).append(" of [] => ");
      emptyCase.unparse(b).append(" | ");
      head.unparse(b).append(" :: ");
      return tail.unparse(b).append(" => ...");
    }
  }

  /** Reads the value of a key in a const map. */
  public static class ConstMapGet extends Exp {
    public final Exp map;
    public final Object key;

    ConstMapGet(Exp map, Object key) {
      super(Op.CONST_MAP_GET, ((ConstMapType) map.type).valueType);
      this.map = requireNonNull(map);
      this.key = requireNonNull(key);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return map.unparse(b).append('[').append(key).append(']');
    }
  }

  /** Copy of a const map with the value of one key replaced. */
  public static class ConstMapSet extends Exp {
    public final Exp map;
    public final Object key;
    public final Exp value;

    ConstMapSet(Exp map, Object key, Exp value) {
      super(Op.CONST_MAP_SET, map.type);
      this.map = requireNonNull(map);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      map.unparse(b).append(" with [").append(key).append("] = ");
      return value.unparse(b);
    }
  }

  /** Whether a string matches a regular expression. */
  public static class SeqMatches extends Exp {
    public final Exp seq;
    public final Regex regex;

    SeqMatches(Type type, Exp seq, Regex regex) {
      super(Op.SEQ_MATCHES, type);
      this.seq = requireNonNull(seq);
      this.regex = requireNonNull(regex);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return seq.unparse(b.append("matches(")).append(", /")
          .append(regex).append("/)");
    }
  }

  /** Reinterprets a value as another type with the same representation,
   * for example a string as a sequence of characters. */
  public static class Cast extends Exp {
    public final Exp exp;

    Cast(Type type, Exp exp) {
      super(Op.CAST, type);
      this.exp = requireNonNull(exp);
    }

    @Override
    public <R, P> R accept(ExpVisitor<R, P> visitor, P p) {
      return visitor.visit(this, p);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return exp.unparse(b.append("cast(")).append(" as ")
          .append(type).append(')');
    }
  }

  /** Returns the operands of a node, in the order an evaluator visits
   * them. The non-empty case of a {@link ListCase} is not an operand. */
  public static List<Exp> operands(Exp exp) {
    switch (exp.op) {
    case CONSTANT:
    case ARBITRARY:
    case ARGUMENT:
      return ImmutableList.of();
    case IF:
      final If anIf = (If) exp;
      return ImmutableList.of(anIf.condition, anIf.ifTrue, anIf.ifFalse);
    case CREATE_OBJECT:
      return ((CreateObject) exp).fields.values().asList();
    case GET_FIELD:
      return ImmutableList.of(((GetField) exp).exp);
    case WITH_FIELD:
      return ImmutableList.of(((WithField) exp).exp, ((WithField) exp).value);
    case LIST_CASE:
      return ImmutableList.of(((ListCase) exp).list,
          ((ListCase) exp).emptyCase);
    case CONST_MAP_GET:
      return ImmutableList.of(((ConstMapGet) exp).map);
    case CONST_MAP_SET:
      return ImmutableList.of(((ConstMapSet) exp).map,
          ((ConstMapSet) exp).value);
    case SEQ_MATCHES:
      return ImmutableList.of(((SeqMatches) exp).seq);
    case CAST:
      return ImmutableList.of(((Cast) exp).exp);
    default:
      return ((Call) exp).args;
    }
  }
}

// End Zen.java
