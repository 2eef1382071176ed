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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Printer}. */
@RunWith(JUnit4.class)
public final class PrinterTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private static void assertRenders(Node node, String... expected) {
    assertThat(Printer.render(node)).isEqualTo(lines(expected));
  }

  private static void assertRenders(Node node, PrinterOptions options, String... expected) {
    assertThat(Printer.render(node, options)).isEqualTo(lines(expected));
  }

  @Test
  public void def_allParameterKindsOnOneLine() {
    Def def =
        new Def(
            "foo",
            false,
            ImmutableList.of(
                new Param.Required("a"),
                new Param.Optional("b", "42"),
                new Param.Rest("c"),
                new Param.Keyword("d"),
                new Param.KeywordOptional("e", "'bar'"),
                new Param.KeywordRest("f"),
                new Param.Block("g")),
            null,
            null);
    assertRenders(def, "def foo(a, b = 42, *c, d:, e: 'bar', **f, &g); end");
  }

  @Test
  public void def_singletonWithVisibility() {
    Def def = new Def("bar", true).setVisibility(Visibility.Level.PRIVATE);
    assertRenders(def, "private def self.bar; end");
  }

  @Test
  public void blankLines_areNeverCollapsed() {
    Root root = new Root();
    root.attach(new Const("A", "1"));
    root.attach(new BlankLine());
    root.attach(new BlankLine());
    root.attach(new BlankLine());
    root.attach(new Const("B", "2"));
    assertRenders(root, "A = 1", "", "", "", "B = 2");
  }

  @Test
  public void standaloneCommentsAndBlankLines() {
    ModuleScope foo = new ModuleScope("Foo");
    foo.attach(new BlankLine());
    foo.attach(new Def("foo"));
    foo.attach(new BlankLine());
    foo.attach(new BlankLine());
    foo.attach(new BlankLine());
    ClassScope bar = new ClassScope("Bar");
    bar.attach(new StandaloneComment("begin"));
    bar.attach(new BlankLine());
    bar.attach(new BlankLine());
    bar.attach(new StandaloneComment("middle"));
    bar.attach(new BlankLine());
    bar.attach(new BlankLine());
    bar.attach(new StandaloneComment("end"));
    foo.attach(bar);
    assertRenders(
        foo,
        "module Foo",
        "",
        "  def foo; end",
        "",
        "",
        "",
        "  class Bar",
        "    # begin",
        "",
        "",
        "    # middle",
        "",
        "",
        "    # end",
        "  end",
        "end");
  }

  @Test
  public void standaloneComment_multiLineAtBodyIndent() {
    ClassScope a = new ClassScope("A");
    a.attach(new Def("foo"));
    a.attach(new StandaloneComment("first\n\nlast"));
    assertRenders(a, "class A", "  def foo; end", "  # first", "  #", "  # last", "end");
  }

  @Test
  public void nestedScopes() {
    Root root = new Root();
    ModuleScope a = new ModuleScope("A");
    ClassScope b = new ClassScope("B", "C");
    b.attach(new Def("m"));
    a.attach(b);
    root.attach(a);
    assertRenders(
        root,
        "module A",
        "  class B < C",
        "    def m; end",
        "  end",
        "end");
  }

  @Test
  public void emptyScopes_foldedOrNot() {
    Root root = new Root();
    root.attach(new ClassScope("C"));
    root.attach(new SingletonClassScope());
    root.attach(new Def("m"));
    assertRenders(root, "class C; end", "class << self; end", "def m; end");

    PrinterOptions fold = PrinterOptions.builder().foldEmptyScopes(true).build();
    assertRenders(
        root,
        fold,
        "class C",
        "end",
        "class << self",
        "end",
        "def m",
        "end");
  }

  @Test
  public void emptySig_rendersOnOneLineInBothModes() {
    Def def = new Def("foo").addSig(new Sig());
    assertRenders(def, "sig { void }", "def foo; end");
    PrinterOptions fold = PrinterOptions.builder().foldEmptyScopes(true).build();
    assertRenders(def, fold, "sig { void }", "def foo", "end");
  }

  @Test
  public void indentWidth() {
    ModuleScope a = new ModuleScope("A");
    a.attach(new Const("B", null));
    assertRenders(a, PrinterOptions.builder().indentWidth(4).build(), "module A", "    B", "end");
  }

  @Test
  public void sig_synthesizedFromTypedParams() {
    Def def =
        new Def(
            "foo", false, ImmutableList.of(new Param.Required("a", "Integer")), "String", null);
    assertRenders(def, "sig { params(a: Integer).returns(String) }", "def foo(a); end");
  }

  @Test
  public void sig_chainOrder() {
    Sig sig =
        new Sig()
            .setChecked("never")
            .markOverride()
            .addTypeParameter("U")
            .addParam(new Param.Required("x", "T.type_parameter(:U)"))
            .markAbstract();
    assertRenders(
        sig,
        "sig { type_parameters(:U).params(x: T.type_parameter(:U)).override.abstract.void"
            + ".checked(:never) }");
  }

  @Test
  public void sig_blockFormWhenParamsHaveComments() {
    Param a = new Param.Required("a", "Integer");
    a.addComment(new Comment("the first"));
    Sig sig =
        new Sig().addParam(a).addParam(new Param.Required("b", "String")).setReturnType("void");
    assertRenders(
        sig,
        "sig do",
        "  params(",
        "    a: Integer, # the first",
        "    b: String",
        "  ).void",
        "end");
  }

  @Test
  public void def_multiLineParamsWhenParamsHaveComments() {
    Param a = new Param.Required("a");
    a.addComment(new Comment("first"));
    Param b = new Param.Optional("b", "1");
    b.addComment(new Comment("line one\nline two"));
    Def def = new Def("foo", false, ImmutableList.of(a, b), null, null);
    assertRenders(
        def,
        "def foo(",
        "  a, # first",
        "  b = 1 # line one",
        "        # line two",
        "); end");
  }

  @Test
  public void blankLineSeparatesMultiLineSiblings() {
    ClassScope a = new ClassScope("A");
    a.attach(new Def("foo").addSig(new Sig()));
    a.attach(new Def("bar"));
    a.attach(new Def("baz"));
    assertRenders(
        a,
        "class A",
        "  sig { void }",
        "  def foo; end",
        "",
        "  def bar; end",
        "  def baz; end",
        "end");
  }

  @Test
  public void sends() {
    ClassScope a = new ClassScope("A");
    a.attach(Mixin.include("B"));
    a.attach(Mixin.extend("T::Sig"));
    a.attach(new Helper(Helper.ABSTRACT));
    a.attach(new MixesInClassMethods("ClassMethods"));
    a.attach(new TypeMember("Elem", TypeMember.TYPE_MEMBER));
    a.attach(Attr.reader("foo", "bar"));
    a.attach(new Send("delegate", ImmutableList.of(":baz", "to: :qux")));
    a.attach(new Visibility(Visibility.Level.PRIVATE));
    assertRenders(
        a,
        "class A",
        "  include B",
        "  extend T::Sig",
        "  abstract!",
        "  mixes_in_class_methods ClassMethods",
        "  Elem = type_member",
        "  attr_reader :foo, :bar",
        "  delegate :baz, to: :qux",
        "  private",
        "end");

    PrinterOptions parens =
        PrinterOptions.builder().parenthesizeIncludes(true).parenthesizeMixins(true).build();
    assertThat(Printer.render(a, parens))
        .contains(
            lines(
                "  include(B)",
                "  extend(T::Sig)",
                "  abstract!",
                "  mixes_in_class_methods(ClassMethods)"));
  }

  @Test
  public void attr_typedWriterWithVisibility() {
    Attr attr = new Attr(Attr.Access.WRITER, ImmutableList.of("foo"), "String", null);
    attr.setVisibility(Visibility.Level.PROTECTED);
    assertRenders(attr, "sig { params(foo: String).void }", "protected attr_writer :foo");
  }

  @Test
  public void structsAndEnums() {
    Root root = new Root();
    root.attach(new StructScope("Point", ImmutableList.of("x", "y"), true, null));
    ClassScope c = new ClassScope("C", ClassScope.T_STRUCT);
    c.attach(new StructField(StructField.Type.CONST, "c", "String"));
    c.attach(new StructField(StructField.Type.PROP, "d", "Integer", "0", null));
    root.attach(c);
    ClassScope e = new ClassScope("E", ClassScope.T_ENUM);
    e.attach(new EnumsBlock("A", "B"));
    root.attach(e);
    assertRenders(
        root,
        "Point = ::Struct.new(:x, :y, keyword_init: true)",
        "",
        "class C < ::T::Struct",
        "  const :c, String",
        "  prop :d, Integer, default: 0",
        "end",
        "",
        "class E < ::T::Enum",
        "  enums do",
        "    A = new",
        "    B = new",
        "  end",
        "end");
  }

  @Test
  public void comments() {
    Const a = new Const("A", null);
    a.addComment(new Comment("line one\n\nline three\n"));
    a.addComment(new Comment(""));
    assertRenders(a, "# line one", "#", "# line three", "#", "A");
  }

  @Test
  public void rootComments_andStrictnessHeader() {
    Root root = new Root();
    root.addComment(new Comment("Generated file."));
    root.attach(new ModuleScope("A"));
    assertRenders(
        root,
        PrinterOptions.builder().strictness("strict").build(),
        "# typed: strict",
        "",
        "# Generated file.",
        "",
        "module A; end");
  }

  @Test
  public void locations() {
    Root root = new Root();
    root.attach(new Const("A", "1", Location.create("a.rbi", 1, 0, 1, 5)));
    ModuleScope b = new ModuleScope("B", Location.create("a.rbi", 2, 0, 4, 3));
    b.attach(
        new Def("m", false, ImmutableList.of(), null, Location.create("a.rbi", 3, 2, 3, 12)));
    root.attach(b);
    assertRenders(
        root,
        PrinterOptions.builder().printLocations(true).build(),
        "# a.rbi:1:0-1:5",
        "A = 1",
        "",
        "# a.rbi:2:0-4:3",
        "module B",
        "  # a.rbi:3:2-3:12",
        "  def m; end",
        "end");
    assertRenders(root, "A = 1", "", "module B", "  def m; end", "end");
  }

  @Test
  public void colorize_onlyAddsEscapes() {
    Root root = new Root();
    ClassScope a = new ClassScope("A", "B");
    a.addComment(new Comment("doc"));
    a.attach(Mixin.extend("T::Sig"));
    a.attach(
        new Def("foo", false, ImmutableList.of(new Param.Required("x", "Integer")), null, null));
    root.attach(a);
    String colored = Printer.render(root, PrinterOptions.builder().colorize(true).build());
    assertThat(colored).contains("\u001b[");
    assertThat(colored.replaceAll("\u001b\\[[0-9;]*m", "")).isEqualTo(Printer.render(root));
  }

  @Test
  public void render_isPure() {
    Root root = new Root();
    ClassScope a = new ClassScope("A");
    a.attach(new Def("foo").addSig(new Sig()));
    root.attach(a);
    String first = Printer.render(root);
    assertThat(Printer.render(root)).isEqualTo(first);
    assertThat(a.getParent()).isSameInstanceAs(root);
    assertThat(root.toString()).isEqualTo(first);
  }
}
