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
import com.google.common.collect.ImmutableMap;

import junit.framework.TestCase;

import symbolicheap.fol.Formula;
import symbolicheap.fol.Renaming;
import symbolicheap.fol.Substitution;
import symbolicheap.fol.Term;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

/**
 * Tests for quantification, renaming and substitution of symbolic heaps.
 */
public class VocabularyTest extends TestCase {
  private final Var p = Var.create("p");
  private final Var x = Var.create("x");
  private final Var x1 = Var.create("x", 1);
  private final Var y = Var.create("y");
  private final Var y1 = Var.create("y", 1);
  private final Var z = Var.create("z");
  private final Term eight = Term.integer(8);

  private final Segment s1 = Segment.create(p, p, eight, eight, x);
  private final Segment s2 =
      Segment.create(Term.add(p, eight), p, eight, eight, y);

  public void testExistsOnlyBindsVocabulary() {
    SymbolicHeap q = SymbolicHeap.seg(s1);
    SymbolicHeap e = q.exists(Vars.of(x, z));
    assertEquals(Vars.of(p), e.us());
    assertEquals(Vars.of(x), e.xs());
    assertSame(q, q.exists(Vars.of(z)));
  }

  public void testExistsOfFalse() {
    SymbolicHeap e = SymbolicHeap.ff(Vars.of(x, y)).exists(Vars.of(x));
    assertTrue(e.isCanonicalFalse());
    assertEquals(Vars.of(y), e.us());
  }

  public void testExtendUsRenamesClashingExistential() {
    SymbolicHeap q = SymbolicHeap.seg(s1).exists(Vars.of(x));
    SymbolicHeap r = q.extendUs(Vars.of(x));
    assertEquals(Vars.of(p, x), r.us());
    assertEquals(Vars.of(x1), r.xs());
    assertEquals(x1, r.heap().get(0).seq());
    assertSame(q, q.extendUs(Vars.of(p)));
  }

  public void testExtendUsReachesNestedDisjuncts() {
    SymbolicHeap q = SymbolicHeap.or(SymbolicHeap.seg(s1).exists(Vars.of(x)),
        SymbolicHeap.seg(Segment.create(p, p, eight, eight, y)));
    assertEquals(Vars.of(p, y), q.us());
    SymbolicHeap r = q.extendUs(Vars.of(x));
    SymbolicHeap first = r.djns().get(0).get(0);
    assertEquals(Vars.of(p, x, y), first.us());
    assertEquals(Vars.of(x1), first.xs());
    assertEquals(x1, first.heap().get(0).seq());
  }

  public void testBindExists() {
    SymbolicHeap q = SymbolicHeap.seg(s1).exists(Vars.of(x));
    SymbolicHeap.Bound bound = q.bindExists(Vars.of(x));
    assertEquals(Vars.of(x1), bound.vars());
    assertEquals(Vars.of(p, x1), bound.heap().us());
    assertTrue(bound.heap().xs().isEmpty());
    assertEquals(x1, bound.heap().heap().get(0).seq());

    SymbolicHeap.Bound apart = q.bindExists(Vars.of(y));
    assertEquals(Vars.of(x), apart.vars());
    assertEquals(Vars.of(p, x), apart.heap().us());
  }

  public void testRename() {
    SymbolicHeap q = SymbolicHeap.seg(s1);
    SymbolicHeap r = q.rename(Renaming.of(x, y));
    assertEquals(Vars.of(p, y), r.us());
    assertEquals(y, r.heap().get(0).seq());
    assertSame(q, q.rename(Renaming.of(z, y)));
  }

  public void testRenameAvoidsCapture() {
    SymbolicHeap q = SymbolicHeap.star(SymbolicHeap.seg(s1),
        SymbolicHeap.seg(s2)).exists(Vars.of(y));
    SymbolicHeap r = q.rename(Renaming.of(x, y));
    assertEquals(Vars.of(p, y), r.us());
    assertEquals(Vars.of(y1), r.xs());
    assertEquals(y, r.heap().get(0).seq());
    assertEquals(y1, r.heap().get(1).seq());
  }

  public void testSubstMapsContextAndPure() {
    SymbolicHeap q = SymbolicHeap.seg(s1).and(Formula.eq(x, y));
    SymbolicHeap r = q.subst(Substitution.of(x, Term.integer(1)));
    assertEquals(Vars.of(p, y), r.us());
    assertEquals(Formula.eq(Term.integer(1), y), r.pure());
    assertTrue(r.ctx().entails(Formula.eq(y, Term.integer(1))));
    assertEquals(Term.integer(1), r.heap().get(0).seq());
  }

  public void testSubstAddsVariablesOfImages() {
    SymbolicHeap q = SymbolicHeap.seg(s1);
    SymbolicHeap r = q.subst(Substitution.of(x, Term.add(z, eight)));
    assertEquals(Vars.of(p, z), r.us());
    assertEquals(Term.add(z, eight), r.heap().get(0).seq());
  }

  public void testSubstCanMakeFalse() {
    SymbolicHeap q = SymbolicHeap.pure(Formula.dq(x, y));
    SymbolicHeap r = q.subst(Substitution.of(x, y));
    assertTrue(r.isCanonicalFalse());
    assertEquals(Vars.of(y), r.us());
  }

  public void testSubstOutsideVocabularyIsIgnored() {
    SymbolicHeap q = SymbolicHeap.seg(s1);
    assertSame(q, q.subst(Substitution.of(z, y)));
  }

  public void testSubstIntoNestedDisjuncts() {
    SymbolicHeap q = SymbolicHeap.or(SymbolicHeap.seg(s1),
        SymbolicHeap.seg(Segment.create(p, p, eight, eight, y)));
    SymbolicHeap r = q.subst(Substitution.of(
        ImmutableMap.<Var, Term>of(x, z, y, z)));
    assertEquals(Vars.of(p, z), r.us());
    for (SymbolicHeap d : r.djns().get(0)) {
      assertEquals(Vars.of(p, z), d.us());
      assertEquals(z, d.heap().get(0).seq());
    }
  }

  public void testFreshenRoundTrip() {
    SymbolicHeap q = SymbolicHeap.seg(s1);
    SymbolicHeap.Freshened f = q.freshen(Vars.of(x, z));
    SymbolicHeap fresh = f.heap();
    assertEquals(Vars.of(x), f.renaming().domain());
    assertEquals(Vars.of(p, x, x1, z), fresh.us());
    assertTrue(Vars.disjoint(fresh.fv(), Vars.of(x, z)));

    SymbolicHeap back = fresh.rename(f.renaming().invert());
    assertEquals(Vars.of(p, x, z), back.us());
    assertEquals(ImmutableList.of(s1), back.heap());
  }

  public void testFreshenWithoutClash() {
    SymbolicHeap q = SymbolicHeap.seg(s1);
    SymbolicHeap.Freshened f = q.freshen(Vars.of(y));
    assertTrue(f.renaming().isEmpty());
    assertEquals(Vars.of(p, x, y), f.heap().us());
    assertEquals(q.heap(), f.heap().heap());
  }

  public void testFreshenRenamesExistentialsOutOfTheWay() {
    SymbolicHeap q = SymbolicHeap.star(SymbolicHeap.seg(s1),
        SymbolicHeap.seg(s2)).exists(Vars.of(y));
    SymbolicHeap.Freshened f = q.freshen(Vars.of(y));
    assertTrue(f.renaming().isEmpty());
    assertEquals(Vars.of(p, x, y), f.heap().us());
    assertEquals(Vars.of(y1), f.heap().xs());
  }
}
