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

import java.util.Iterator;

/**
 * An ordered list of symbolic heaps, read as their disjunction. An empty
 * disjunction is false.
 */
public final class Disjunction implements Iterable<SymbolicHeap> {
  static final Disjunction EMPTY =
      new Disjunction(ImmutableList.<SymbolicHeap>of());

  private final ImmutableList<SymbolicHeap> disjuncts;

  private Disjunction(ImmutableList<SymbolicHeap> disjuncts) {
    this.disjuncts = disjuncts;
  }

  public static Disjunction of(Iterable<SymbolicHeap> disjuncts) {
    ImmutableList<SymbolicHeap> list = ImmutableList.copyOf(disjuncts);
    return list.isEmpty() ? EMPTY : new Disjunction(list);
  }

  public static Disjunction of(SymbolicHeap... disjuncts) {
    return of(ImmutableList.copyOf(disjuncts));
  }

  public ImmutableList<SymbolicHeap> disjuncts() {
    return disjuncts;
  }

  public int size() {
    return disjuncts.size();
  }

  public boolean isEmpty() {
    return disjuncts.isEmpty();
  }

  public SymbolicHeap get(int i) {
    return disjuncts.get(i);
  }

  @Override
  public Iterator<SymbolicHeap> iterator() {
    return disjuncts.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Disjunction
        && disjuncts.equals(((Disjunction) o).disjuncts);
  }

  @Override
  public int hashCode() {
    return disjuncts.hashCode();
  }

  @Override
  public String toString() {
    return HeapPrinter.ppDjn(this);
  }
}
