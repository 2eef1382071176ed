// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sigfile.java.tree;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of tree ownership and qualified names. */
@RunWith(JUnit4.class)
public final class ScopeTest {

  @Test
  public void attach_movesFromPreviousParent() {
    ModuleScope a = new ModuleScope("A");
    ModuleScope b = new ModuleScope("B");
    Const c = new Const("C", "1");
    a.attach(c);
    b.attach(c);
    assertThat(a.getBody()).isEmpty();
    assertThat(b.getBody()).containsExactly(c);
    assertThat(c.getParent()).isSameInstanceAs(b);
  }

  @Test
  public void attach_sameParentMovesToEnd() {
    ModuleScope a = new ModuleScope("A");
    Const x = new Const("X", null);
    Const y = new Const("Y", null);
    a.attachAll(ImmutableList.of(x, y));
    a.attach(x);
    assertThat(a.getBody()).containsExactly(y, x).inOrder();
  }

  @Test
  public void insert_atIndex() {
    ModuleScope a = new ModuleScope("A");
    Const x = new Const("X", null);
    Const y = new Const("Y", null);
    a.attach(x);
    a.insert(0, y);
    assertThat(a.getBody()).containsExactly(y, x).inOrder();
    assertThrows(IndexOutOfBoundsException.class, () -> a.insert(5, new Const("Z", null)));
  }

  @Test
  public void insert_rejectedIndexLeavesChildInPlace() {
    ModuleScope p = new ModuleScope("P");
    ModuleScope q = new ModuleScope("Q");
    Const c = new Const("C", null);
    p.attach(c);
    assertThrows(IndexOutOfBoundsException.class, () -> q.insert(5, c));
    assertThat(p.getBody()).containsExactly(c);
    assertThat(c.getParent()).isSameInstanceAs(p);

    Const d = new Const("D", null);
    p.attach(d);
    assertThrows(IndexOutOfBoundsException.class, () -> p.insert(2, c));
    assertThat(p.getBody()).containsExactly(c, d).inOrder();
    p.insert(1, c);
    assertThat(p.getBody()).containsExactly(d, c).inOrder();
  }

  @Test
  public void detach() {
    ModuleScope a = new ModuleScope("A");
    Const x = new Const("X", null);
    a.attach(x);
    a.detach(x);
    assertThat(a.getBody()).isEmpty();
    assertThat(x.getParent()).isNull();
    assertThrows(IllegalArgumentException.class, () -> a.detach(x));
  }

  @Test
  public void attach_rejectsCyclesAndRoots() {
    Root root = new Root();
    ModuleScope a = new ModuleScope("A");
    ModuleScope b = new ModuleScope("B");
    root.attach(a);
    a.attach(b);
    assertThrows(IllegalArgumentException.class, () -> b.attach(a));
    assertThrows(IllegalArgumentException.class, () -> b.insert(0, a));
    assertThrows(IllegalArgumentException.class, () -> a.attach(a));
    assertThrows(IllegalArgumentException.class, () -> a.attach(new Root()));

    assertThat(root.getBody()).containsExactly(a);
    assertThat(a.getParent()).isSameInstanceAs(root);
    assertThat(a.getBody()).containsExactly(b);
    assertThat(b.getParent()).isSameInstanceAs(a);
  }

  @Test
  public void attach_faultsWhenParentDoesNotListChild() {
    ModuleScope a = new ModuleScope("A");
    ModuleScope b = new ModuleScope("B");
    Const c = new Const("C", null);
    a.attach(c);
    c.setParent(b);
    StructuralFaultException e =
        assertThrows(StructuralFaultException.class, () -> new ModuleScope("D").attach(c));
    assertThat(e).hasMessageThat().contains("which does not list it");
  }

  @Test
  public void qualifiedNames() {
    Root root = new Root();
    ModuleScope a = new ModuleScope("A");
    ClassScope b = new ClassScope("B");
    Def m = new Def("m");
    Def s = new Def("s", true);
    Const k = new Const("K", "1");
    Mixin include = Mixin.include("Foo", "Bar");
    root.attach(a);
    a.attach(b);
    b.attachAll(ImmutableList.of(m, s, k, include));

    assertThat(root.qualifiedName()).isEmpty();
    assertThat(a.qualifiedName()).isEqualTo("A");
    assertThat(b.qualifiedName()).isEqualTo("A::B");
    assertThat(m.qualifiedName()).isEqualTo("A::B#m");
    assertThat(s.qualifiedName()).isEqualTo("A::B::s");
    assertThat(k.qualifiedName()).isEqualTo("A::B::K");
    assertThat(include.qualifiedName()).isEqualTo("A::B.include(Foo,Bar)");
  }

  @Test
  public void qualifiedNames_absoluteAndTopLevel() {
    Root root = new Root();
    ModuleScope a = new ModuleScope("A");
    ModuleScope absolute = new ModuleScope("::X");
    Def m = new Def("m");
    root.attachAll(ImmutableList.of(a, m));
    a.attach(absolute);
    absolute.attach(new Const("Y", null));

    assertThat(absolute.qualifiedName()).isEqualTo("::X");
    assertThat(absolute.getBody().get(0).qualifiedName()).isEqualTo("::X::Y");
    assertThat(m.qualifiedName()).isEqualTo("#m");
    assertThat(new TypeMember("Elem", TypeMember.TYPE_MEMBER).qualifiedName()).isEqualTo("Elem");
  }

  @Test
  public void copy_isDeepAndUnattached() {
    Root root = new Root();
    ClassScope a = new ClassScope("A", "B");
    a.addComment(new Comment("doc"));
    Def m =
        new Def("m", false, ImmutableList.of(new Param.Required("x", "Integer")), "String", null);
    a.attach(m);
    root.attach(a);

    Scope copy = a.copy();
    assertThat(copy.getParent()).isNull();
    assertThat(copy.getBody()).hasSize(1);
    assertThat(copy.getBody().get(0)).isNotSameInstanceAs(m);
    assertThat(copy.getBody().get(0).getParent()).isSameInstanceAs(copy);
    assertThat(Printer.render(copy)).isEqualTo(Printer.render(a));
  }

  @Test
  public void comments_areAttachedInOrder() {
    Const c = new Const("C", null);
    c.addComment(new Comment("first"));
    c.addComment(new Comment("second"));
    assertThat(c.getComments()).hasSize(2);
    assertThat(c.getComments().get(0).getText()).isEqualTo("first");
    assertThat(c.hasComment("second")).isTrue();
    assertThat(c.hasComment("third")).isFalse();
  }
}
