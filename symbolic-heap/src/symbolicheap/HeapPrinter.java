/*
 * Copyright 2010 Google Inc.
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

package symbolicheap;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Var;

import java.util.List;
import java.util.Set;

/**
 * Printing of symbolic heaps for logs and debugging. None of the formats is
 * meant to be parsed back.
 */
public final class HeapPrinter {
  private static final Joiner STAR = Joiner.on(" * ");
  private static final Joiner AND = Joiner.on(" && ");
  private static final Joiner COMMA = Joiner.on(", ");

  private HeapPrinter() {}

  /**
   * Prints q with the terms of its pure part and segments in normal form
   * through its context, followed by the equalities of the context.
   */
  public static String pp(SymbolicHeap q) {
    return print(q, q.ctx(), true, null);
  }

  /** Prints q as it is stored, without normalizing anything */
  public static String ppRaw(SymbolicHeap q) {
    return print(q, Context.empty(), false, null);
  }

  /**
   * Prints q normalized through {@code ctx}, leaving out the pure facts and
   * context equalities that {@code ctx} already entails.
   */
  public static String ppDiffEq(Context ctx, SymbolicHeap q) {
    return print(q, ctx.union(q.ctx()), true, ctx);
  }

  /** Prints a disjunction, one disjunct per line */
  public static String ppDjn(Disjunction djn) {
    if (djn.isEmpty()) {
      return "false";
    }
    List<String> disjuncts = Lists.newArrayList();
    for (SymbolicHeap d : djn) {
      disjuncts.add(pp(d));
    }
    return "( " + Joiner.on("\n  \\/ ").join(disjuncts) + " )";
  }

  /** @return {@code prefix} followed by the variables, or "" if there are none */
  public static String ppUs(String prefix, Set<Var> vs) {
    if (vs.isEmpty()) {
      return "";
    }
    return prefix + COMMA.join(vs) + " .";
  }

  private static String print(SymbolicHeap q, Context ctx, boolean showCtx,
      Context known) {
    if (q.isCanonicalFalse()) {
      return "false";
    }
    List<String> pures = Lists.newArrayList();
    if (showCtx) {
      for (Formula atom : q.ctx().toFormula().conjuncts()) {
        if (known == null || !known.entails(atom)) {
          pures.add(atom.toString());
        }
      }
    }
    Formula pure = showCtx ? ctx.normalize(q.pure()) : q.pure();
    for (Formula atom : pure.conjuncts()) {
      if (known == null || !known.entails(atom)) {
        pures.add(atom.toString());
      }
    }
    List<String> spatial = Lists.newArrayList();
    for (Segment s : q.heap()) {
      spatial.add(showCtx ? s.toString(ctx) : s.toString());
    }
    for (Disjunction djn : q.djns()) {
      List<String> disjuncts = Lists.newArrayList();
      for (SymbolicHeap d : djn) {
        disjuncts.add(print(d, showCtx ? ctx.union(d.ctx()) : ctx, showCtx,
            known));
      }
      spatial.add("( " + Joiner.on(" \\/ ").join(disjuncts) + " )");
    }
    StringBuilder sb = new StringBuilder(ppUs("exists ", q.xs()));
    if (sb.length() > 0) {
      sb.append(' ');
    }
    if (!pures.isEmpty()) {
      sb.append(AND.join(pures));
      sb.append(spatial.isEmpty() ? "" : " && ");
    }
    if (!spatial.isEmpty()) {
      sb.append(STAR.join(spatial));
    } else if (pures.isEmpty()) {
      sb.append("emp");
    }
    return sb.toString();
  }
}
