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

import junit.framework.TestCase;

import symbolicheap.fol.Context;
import symbolicheap.fol.Formula;
import symbolicheap.fol.Term;
import symbolicheap.fol.Var;
import symbolicheap.fol.Vars;

/**
 * Tests for {@link HeapPrinter}.
 */
public class HeapPrinterTest extends TestCase {
  private final Var p = Var.create("p");
  private final Var x = Var.create("x");
  private final Var y = Var.create("y");
  private final Term eight = Term.integer(8);

  private final Segment s1 = Segment.create(p, p, eight, eight, x);
  private final Segment s2 =
      Segment.create(Term.add(p, eight), p, eight, eight, y);
  private final Segment s3 = Segment.create(p, p, eight, eight, y);

  public void testEmpAndFalse() {
    assertEquals("emp", HeapPrinter.pp(SymbolicHeap.emp()));
    assertEquals("false", HeapPrinter.pp(SymbolicHeap.ff(Vars.of(x))));
    assertEquals("false", HeapPrinter.ppDjn(Disjunction.of()));
  }

  public void testSegments() {
    SymbolicHeap q = SymbolicHeap.star(SymbolicHeap.seg(s1),
        SymbolicHeap.seg(s2));
    assertEquals("p -[ 8 ]-> <8,x> * (p + 8) -[p, 8)-> <8,y>",
        HeapPrinter.pp(q));
    assertEquals(HeapPrinter.pp(q), q.toString());
  }

  public void testExistentials() {
    SymbolicHeap q = SymbolicHeap.seg(s1).exists(Vars.of(x));
    assertEquals("exists x . p -[ 8 ]-> <8,x>", HeapPrinter.pp(q));
  }

  public void testNormalAndRawForms() {
    SymbolicHeap q = SymbolicHeap.seg(s3).and(Formula.eq(x, y));
    assertEquals("x = y && p -[ 8 ]-> <8,x>", HeapPrinter.pp(q));
    assertEquals("x = y && p -[ 8 ]-> <8,y>", HeapPrinter.ppRaw(q));
  }

  public void testDiffAgainstContext() {
    SymbolicHeap q = SymbolicHeap.seg(s3).and(Formula.eq(x, y));
    Context known = Context.empty().and(Formula.eq(x, y));
    assertEquals("p -[ 8 ]-> <8,x>", HeapPrinter.ppDiffEq(known, q));
    assertEquals(HeapPrinter.pp(q),
        HeapPrinter.ppDiffEq(Context.empty(), q));
  }

  public void testDisjunction() {
    SymbolicHeap q = SymbolicHeap.or(SymbolicHeap.seg(s1),
        SymbolicHeap.seg(s3));
    assertEquals("( p -[ 8 ]-> <8,x> \\/ p -[ 8 ]-> <8,y> )",
        HeapPrinter.pp(q));
    assertEquals("( p -[ 8 ]-> <8,x>\n  \\/ p -[ 8 ]-> <8,y> )",
        HeapPrinter.ppDjn(q.djns().get(0)));
  }

  public void testVocabulary() {
    assertEquals("", HeapPrinter.ppUs("us: ", Vars.of()));
    assertEquals("us: p, x .", HeapPrinter.ppUs("us: ", Vars.of(p, x)));
  }
}
