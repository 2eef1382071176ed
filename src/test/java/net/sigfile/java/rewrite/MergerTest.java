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
package net.sigfile.java.rewrite;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import net.sigfile.java.tree.ClassScope;
import net.sigfile.java.tree.Comment;
import net.sigfile.java.tree.Const;
import net.sigfile.java.tree.Def;
import net.sigfile.java.tree.Location;
import net.sigfile.java.tree.Mixin;
import net.sigfile.java.tree.ModuleScope;
import net.sigfile.java.tree.Param;
import net.sigfile.java.tree.Printer;
import net.sigfile.java.tree.Root;
import net.sigfile.java.tree.StandaloneComment;
import net.sigfile.java.tree.Stmt;
import net.sigfile.java.tree.Visibility;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MergerTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private static Root tree(Stmt... stmts) {
    Root root = new Root();
    for (Stmt stmt : stmts) {
      root.attach(stmt);
    }
    return root;
  }

  private static ClassScope classWith(String name, Stmt... body) {
    ClassScope scope = new ClassScope(name);
    for (Stmt stmt : body) {
      scope.attach(stmt);
    }
    return scope;
  }

  private static MergeResult merge(Root... trees) {
    return Merger.merge(ImmutableList.copyOf(trees));
  }

  @Test
  public void merge_emptyClasses() {
    MergeResult result = merge(tree(new ClassScope("C")), tree(new ClassScope("C")));
    assertThat(result.conflicts()).isEmpty();
    assertThat(result.tree().getBody()).hasSize(1);
    assertThat(Printer.render(result.tree())).isEqualTo(lines("class C; end"));
  }

  @Test
  public void merge_combinesBodiesInFirstSeenOrder() {
    MergeResult result =
        merge(
            tree(classWith("A", Mixin.include("M"), new Def("foo")), new ModuleScope("X")),
            tree(classWith("A", Mixin.include("M"), new Def("bar"), new Def("foo"))));
    assertThat(result.hasConflicts()).isFalse();
    assertThat(Printer.render(result.tree()))
        .isEqualTo(
            lines(
                "class A",
                "  include M",
                "  def foo; end",
                "  def bar; end",
                "end",
                "",
                "module X; end"));
  }

  @Test
  public void merge_unionsComments() {
    Def first = new Def("foo");
    first.addComment(new Comment("Does foo."));
    Def second = new Def("foo");
    second.addComment(new Comment("Does foo."));
    second.addComment(new Comment("@shim"));
    Root one = tree(first);
    one.addComment(new Comment("Header."));
    MergeResult result = merge(one, tree(second));

    assertThat(result.conflicts()).isEmpty();
    assertThat(Printer.render(result.tree()))
        .isEqualTo(lines("# Header.", "", "# Does foo.", "# @shim", "def foo; end"));
  }

  @Test
  public void merge_superclass_firstNonNullWins() {
    MergeResult result = merge(tree(new ClassScope("A")), tree(new ClassScope("A", "B")));
    assertThat(result.conflicts()).isEmpty();
    assertThat(Printer.render(result.tree())).isEqualTo(lines("class A < B; end"));
  }

  @Test
  public void merge_superclassMismatch() {
    Location first = Location.create("a.rbi", 1, 0, 1, 16);
    Location second = Location.create("b.rbi", 3, 0, 3, 16);
    MergeResult result =
        merge(tree(new ClassScope("A", "B", first)), tree(new ClassScope("A", "C", second)));

    assertThat(result.conflicts()).hasSize(1);
    Conflict conflict = result.conflicts().get(0);
    assertThat(conflict.kind()).isEqualTo(Conflict.Kind.SUPERCLASS_MISMATCH);
    assertThat(conflict.qualifiedName()).isEqualTo("A");
    assertThat(conflict.firstLocation()).isEqualTo(first);
    assertThat(conflict.secondLocation()).isEqualTo(second);
    assertThat(Printer.render(result.tree())).isEqualTo(lines("class A < B; end"));
  }

  @Test
  public void merge_constValueMismatch() {
    MergeResult result = merge(tree(new Const("A", "1")), tree(new Const("A", "2")));
    assertThat(result.conflicts()).hasSize(1);
    assertThat(result.conflicts().get(0).kind()).isEqualTo(Conflict.Kind.CONST_VALUE_MISMATCH);
    assertThat(Printer.render(result.tree())).isEqualTo(lines("A = 1"));
  }

  @Test
  public void merge_signatureMismatch() {
    Def one = new Def("foo", false, ImmutableList.of(new Param.Required("a")), null, null);
    Def two =
        new Def(
            "foo",
            false,
            ImmutableList.of(new Param.Required("a"), new Param.Required("b")),
            null,
            null);
    MergeResult result = merge(tree(classWith("A", one)), tree(classWith("A", two)));
    assertThat(result.conflicts()).hasSize(1);
    Conflict conflict = result.conflicts().get(0);
    assertThat(conflict.kind()).isEqualTo(Conflict.Kind.SIGNATURE_MISMATCH);
    assertThat(conflict.qualifiedName()).isEqualTo("A#foo");
    assertThat(Printer.render(result.tree())).contains("def foo(a); end");
  }

  @Test
  public void merge_scopeKindMismatch() {
    MergeResult result = merge(tree(new ModuleScope("A")), tree(new ClassScope("A")));
    assertThat(result.conflicts()).hasSize(1);
    assertThat(result.conflicts().get(0).kind()).isEqualTo(Conflict.Kind.SCOPE_KIND_MISMATCH);
    assertThat(Printer.render(result.tree())).isEqualTo(lines("module A; end"));
  }

  @Test
  public void merge_scopeAndDeclarationMismatch() {
    MergeResult result = merge(tree(new ModuleScope("A")), tree(new Const("A", "1")));
    assertThat(result.conflicts()).hasSize(1);
    assertThat(result.conflicts().get(0).kind()).isEqualTo(Conflict.Kind.DECLARATION_MISMATCH);
  }

  @Test
  public void merge_absoluteNamesMatchTopLevelNames() {
    MergeResult result = merge(tree(new ClassScope("::A")), tree(new ClassScope("A")));
    assertThat(result.conflicts()).isEmpty();
    assertThat(result.tree().getBody()).hasSize(1);
  }

  @Test
  public void merge_keepsEveryVisibilityMarker() {
    ClassScope a =
        classWith(
            "A",
            new Visibility(Visibility.Level.PRIVATE),
            new Def("foo"),
            new Visibility(Visibility.Level.PUBLIC),
            new Def("bar"),
            new Visibility(Visibility.Level.PRIVATE),
            new Def("baz"));
    MergeResult result = merge(tree(a));
    assertThat(Printer.render(result.tree())).isEqualTo(Printer.render(a.getParent()));
  }

  @Test
  public void merge_keepsVisibilityOfLaterDeclarations() {
    ClassScope first = classWith("C", new Visibility(Visibility.Level.PRIVATE), new Def("secret"));
    ClassScope second = classWith("C", new Def("open"));
    MergeResult result = merge(tree(first), tree(second));
    assertThat(result.conflicts()).isEmpty();
    assertThat(Printer.render(result.tree()))
        .isEqualTo(
            lines(
                "class C",
                "  private",
                "  def secret; end",
                "  public",
                "  def open; end",
                "end"));
  }

  @Test
  public void merge_doesNotRepeatVisibilityMarkers() {
    ClassScope first = classWith("C", new Visibility(Visibility.Level.PRIVATE), new Def("a"));
    ClassScope second =
        classWith(
            "C",
            new Visibility(Visibility.Level.PRIVATE),
            new Visibility(Visibility.Level.PRIVATE),
            new Def("b"));
    MergeResult result = merge(tree(first), tree(second));
    assertThat(Printer.render(result.tree()))
        .isEqualTo(lines("class C", "  private", "  def a; end", "  def b; end", "end"));
  }

  @Test
  public void merge_visibilityMismatch() {
    ClassScope first = classWith("C", new Visibility(Visibility.Level.PRIVATE), new Def("foo"));
    ClassScope second = classWith("C", new Def("foo"));
    MergeResult result = merge(tree(first), tree(second));
    assertThat(result.conflicts()).hasSize(1);
    Conflict conflict = result.conflicts().get(0);
    assertThat(conflict.kind()).isEqualTo(Conflict.Kind.SIGNATURE_MISMATCH);
    assertThat(conflict.qualifiedName()).isEqualTo("C#foo");
    assertThat(conflict.message()).isEqualTo("declared public, but private before");
  }

  @Test
  public void merge_doesNotRepeatCommentsWithTrailingNewline() {
    Def first = new Def("foo");
    first.addComment(new Comment("Does foo.\n"));
    Def second = new Def("foo");
    second.addComment(new Comment("Does foo.\n"));
    MergeResult result = merge(tree(first), tree(second));
    Stmt merged = result.tree().getBody().get(0);
    assertThat(merged.getComments()).hasSize(1);
  }

  @Test
  public void merge_standaloneComments() {
    MergeResult result =
        merge(
            tree(classWith("A", new StandaloneComment("section"))),
            tree(classWith("A", new StandaloneComment("section"), new Def("x"))));
    assertThat(result.conflicts()).isEmpty();
    assertThat(Printer.render(result.tree()))
        .isEqualTo(lines("class A", "  # section", "  def x; end", "end"));
  }

  @Test
  public void merge_doesNotModifyInputs() {
    Root one = tree(classWith("A", new Def("foo")), new Const("K", "1"));
    Root two = tree(classWith("A", new Def("bar")), new Const("K", "2"));
    String before = Printer.render(one) + Printer.render(two);
    MergeResult result = merge(one, two);
    assertThat(Printer.render(one) + Printer.render(two)).isEqualTo(before);
    assertThat(result.tree().getBody().get(0)).isNotSameInstanceAs(one.getBody().get(0));
  }
}
