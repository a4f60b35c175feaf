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

import com.google.common.collect.ImmutableList;

import junit.framework.TestCase;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Solution;
import symbolicheap.fol.Term;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

/**
 * Tests for conjunction with pure facts, normalization and simplification.
 */
public class NormalizerTest extends TestCase {
  private final Var p = Var.create("p");
  private final Var x = Var.create("x");
  private final Var y = Var.create("y");
  private final Var z = Var.create("z");
  private final Term one = Term.integer(1);
  private final Term eight = Term.integer(8);

  private final Segment s1 = Segment.create(p, p, eight, eight, x);
  private final Segment s2 =
      Segment.create(Term.add(p, eight), p, eight, eight, y);
  private final Segment s3 = Segment.create(p, p, eight, eight, y);

  public void testAndExtendsVocabulary() {
    SymbolicHeap q = SymbolicHeap.seg(s1).and(Formula.eq(x, y));
    assertEquals(Vars.of(p, x, y), q.us());
    assertEquals(Formula.eq(x, y), q.pure());
    assertTrue(q.ctx().entails(Formula.eq(y, x)));
    assertSame(q, q.and(Formula.tt()));
  }

  public void testAndRenamesClashingExistential() {
    SymbolicHeap q = SymbolicHeap.seg(s1).exists(Vars.of(x));
    SymbolicHeap r = q.and(Formula.eq(x, one));
    assertEquals(Vars.of(p, x), r.us());
    assertEquals(Vars.of(Var.create("x", 1)), r.xs());
    assertEquals(Var.create("x", 1), r.heap().get(0).seq());
  }

  public void testAndInconsistent() {
    SymbolicHeap q = SymbolicHeap.seg(s1).and(Formula.dq(x, one));
    SymbolicHeap r = q.and(Formula.eq(x, one));
    assertTrue(r.isCanonicalFalse());
    assertEquals(Vars.of(p, x), r.us());
  }

  public void testAndCtx() {
    Context c = Context.empty().and(Formula.eq(x, one));
    SymbolicHeap q = SymbolicHeap.seg(s3).andCtx(c);
    assertEquals(Vars.of(p, x, y), q.us());
    assertTrue(q.ctx().entails(Formula.eq(x, one)));
    assertTrue(q.pure().isTrue());
    assertSame(q, q.andCtx(Context.empty()));
  }

  public void testAndCtxInconsistent() {
    SymbolicHeap q = SymbolicHeap.pure(Formula.dq(x, one));
    SymbolicHeap r = q.andCtx(Context.empty().and(Formula.eq(x, one)));
    assertTrue(r.isCanonicalFalse());
    assertEquals(Vars.of(x), r.fv());
  }

  public void testAndSubst() {
    SymbolicHeap q = SymbolicHeap.seg(s1).andSubst(Solution.of(x, y));
    assertEquals(Vars.of(p, x, y), q.us());
    assertEquals(Formula.eq(x, y), q.pure());
    assertTrue(q.ctx().entails(Formula.eq(x, y)));
  }

  public void testNorm() {
    SymbolicHeap q = SymbolicHeap.seg(s1);
    SymbolicHeap r = q.norm(Solution.of(x, y));
    assertEquals(Vars.of(p, x, y), r.us());
    assertEquals(y, r.heap().get(0).seq());
    assertSame(q, q.norm(Solution.empty()));
  }

  public void testNormRewritesNestedDisjuncts() {
    SymbolicHeap q = SymbolicHeap.or(SymbolicHeap.seg(s1),
        SymbolicHeap.seg(Segment.create(p, p, eight, eight, z)));
    SymbolicHeap r = q.norm(Solution.of(p, Term.integer(0)));
    for (SymbolicHeap d : r.djns().get(0)) {
      assertEquals(Term.integer(0), d.heap().get(0).loc());
      assertEquals(q.us(), d.us());
    }
  }

  public void testNormThroughContextSolution() {
    SymbolicHeap q = SymbolicHeap.seg(s3).and(Formula.eq(x, y));
    Solution sol = q.ctx().solution();
    SymbolicHeap r = SymbolicHeap.seg(s3).norm(sol);
    assertEquals(x, r.heap().get(0).seq());
  }

  public void testSimplifyDropsFalseDisjuncts() {
    SymbolicHeap bad = SymbolicHeap.seg(s3).withPure(Formula.ff());
    SymbolicHeap q = SymbolicHeap.or(SymbolicHeap.seg(s1), bad);
    assertEquals(2, q.djns().get(0).size());
    SymbolicHeap r = q.simplify();
    assertTrue(r.djns().isEmpty());
    assertEquals(ImmutableList.of(s1), r.heap());
    assertEquals(q.us(), r.us());
  }

  public void testSimplifyMergesSingleDisjunctIntoParent() {
    SymbolicHeap bad = SymbolicHeap.seg(s3).withPure(Formula.ff());
    SymbolicHeap inner = SymbolicHeap.or(SymbolicHeap.seg(s2), bad);
    SymbolicHeap q = SymbolicHeap.star(SymbolicHeap.seg(s1), inner);
    SymbolicHeap r = q.simplify();
    assertTrue(r.djns().isEmpty());
    assertEquals(ImmutableList.of(s1, s2), r.heap());
  }

  public void testSimplifyKeepsRealDisjunctions() {
    SymbolicHeap q = SymbolicHeap.or(SymbolicHeap.seg(s1),
        SymbolicHeap.seg(s3));
    SymbolicHeap r = q.simplify();
    assertEquals(1, r.djns().size());
    assertEquals(2, r.djns().get(0).size());
  }

  public void testSimplifyAllFalse() {
    SymbolicHeap bad1 = SymbolicHeap.seg(s1).withPure(Formula.ff());
    SymbolicHeap bad2 = SymbolicHeap.seg(s3).withPure(Formula.ff());
    SymbolicHeap r = SymbolicHeap.or(bad1, bad2).simplify();
    assertTrue(r.isCanonicalFalse());
    assertEquals(Vars.of(p, x, y), r.us());
  }

  public void testSimplifyNormalizesHeapThroughContext() {
    SymbolicHeap q = SymbolicHeap.seg(s3).and(Formula.eq(x, y));
    SymbolicHeap r = q.simplify();
    assertEquals(x, r.heap().get(0).seq());
    assertEquals(Formula.eq(x, y), r.pure());
    assertTrue(r.ctx().entails(Formula.eq(x, y)));
  }

  public void testSimplifyDropsUnusedExistentials() {
    SymbolicHeap q = SymbolicHeap.seg(s1).extendUs(Vars.of(z))
        .exists(Vars.of(x, z));
    assertEquals(Vars.of(x, z), q.xs());
    SymbolicHeap r = q.simplify();
    assertEquals(Vars.of(p), r.us());
    assertEquals(Vars.of(x), r.xs());
  }
}
