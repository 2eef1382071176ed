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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Renders a declaration tree, or any node of it, to canonical text.
 *
 * <p>Rendering is a pure function of the node and the {@link PrinterOptions}: the tree is only
 * read, and a fresh printer is used for each call.
 *
 * <p>Siblings are separated by one blank line, except when the previous sibling is a {@link
 * BlankLine} or when both siblings fit on one line (see {@link #isOneLine}). Explicit blank lines
 * are printed as they are, never collapsed.
 *
 * <p>Subclasses may override {@link #printComments} and {@link #printLocation} to alter which
 * decorations are rendered.
 */
public class Printer extends NodeVisitor {

  private static final Joiner COMMA_JOINER = Joiner.on(", ");
  private static final Joiner DOT_JOINER = Joiner.on('.');

  private static final String KEYWORD_COLOR = "\u001b[34m";
  private static final String COMMENT_COLOR = "\u001b[90m";
  private static final String RESET_COLOR = "\u001b[0m";

  private final StringBuilder out;
  private final PrinterOptions options;
  private int indent;

  // The sibling printed just before the current statement, or null at the start of a body.
  @Nullable private Stmt previous;

  protected Printer(StringBuilder out, PrinterOptions options) {
    this.out = out;
    this.options = options;
  }

  /** Renders {@code node} with the default options. */
  public static String render(Node node) {
    return render(node, PrinterOptions.DEFAULT);
  }

  /** Renders {@code node} with the given options. */
  public static String render(Node node, PrinterOptions options) {
    StringBuilder buf = new StringBuilder();
    new Printer(buf, options).visit(node);
    return buf.toString();
  }

  protected final PrinterOptions getOptions() {
    return options;
  }

  // ==== Miscellaneous node types ====

  @Override
  public void visit(Comment node) {
    ImmutableList<String> lines = node.getLines();
    if (lines.isEmpty()) {
      printLine(comment("#"));
      return;
    }
    for (String line : lines) {
      printLine(comment(commentLine(line)));
    }
  }

  @Override
  public void visit(Param node) {
    out.append(param(node));
  }

  @Override
  public void visit(Sig node) {
    printLocation(node);
    // A sig always has a return op to print ("void" when absent), so it is never empty.
    if (node.hasParamComments()) {
      printSigBlock(node);
    } else {
      printLine(keyword("sig") + " { " + DOT_JOINER.join(sigChain(node)) + " }");
    }
  }

  // ==== Scopes ====

  @Override
  public void visit(Root node) {
    if (options.strictness() != null) {
      printLine(comment("# typed: " + options.strictness()));
      newline();
    }
    printComments(node);
    if (!node.getComments().isEmpty() && !node.isEmpty()) {
      newline();
    }
    printBody(node.getBody());
  }

  @Override
  public void visit(ModuleScope node) {
    printScope(node, keyword("module") + " " + node.getName());
  }

  @Override
  public void visit(ClassScope node) {
    String header = keyword("class") + " " + node.getName();
    if (node.getSuperclass() != null) {
      header += " < " + node.getSuperclass();
    }
    printScope(node, header);
  }

  @Override
  public void visit(SingletonClassScope node) {
    printScope(node, keyword("class") + " << self");
  }

  @Override
  public void visit(StructScope node) {
    List<String> args = new ArrayList<>();
    for (String member : node.getMembers()) {
      args.add(":" + member);
    }
    if (node.isKeywordInit()) {
      args.add("keyword_init: true");
    }
    String header = node.getName() + " = ::Struct.new(" + COMMA_JOINER.join(args) + ")";
    printStmtPrefix(node);
    if (node.isEmpty()) {
      printLine(header);
      return;
    }
    printLine(header + " " + keyword("do"));
    printNestedBody(node);
    printLine(keyword("end"));
  }

  private void printScope(Scope node, String header) {
    printStmtPrefix(node);
    if (node.isEmpty() && !options.foldEmptyScopes()) {
      printLine(header + "; " + keyword("end"));
      return;
    }
    printLine(header);
    printNestedBody(node);
    printLine(keyword("end"));
  }

  private void printNestedBody(Scope node) {
    indent++;
    printBody(node.getBody());
    indent--;
  }

  private void printBody(List<Stmt> body) {
    Stmt saved = previous;
    previous = null;
    for (Stmt stmt : body) {
      visit(stmt);
      previous = stmt;
    }
    previous = saved;
  }

  // ==== Declarations ====

  @Override
  public void visit(Const node) {
    printStmtPrefix(node);
    printLine(node.getValue() == null ? node.getName() : node.getName() + " = " + node.getValue());
  }

  @Override
  public void visit(Def node) {
    printBlankLineBefore(node);
    printComments(node);
    visitAll(node.getSigs());
    printLocation(node);

    StringBuilder head = new StringBuilder();
    head.append(visibilityPrefix(node.getVisibility())).append(keyword("def")).append(' ');
    if (node.isSingleton()) {
      head.append(keyword("self")).append('.');
    }
    head.append(node.getName());

    List<Param> params = node.getParams();
    printIndent();
    out.append(head);
    if (!params.isEmpty() && !node.hasParamComments()) {
      List<String> rendered = new ArrayList<>();
      for (Param param : params) {
        rendered.add(param(param));
      }
      out.append('(').append(COMMA_JOINER.join(rendered)).append(')');
    } else if (!params.isEmpty()) {
      out.append('(');
      newline();
      indent++;
      for (int i = 0; i < params.size(); i++) {
        Param param = params.get(i);
        printParamLine(param(param), param, i == params.size() - 1);
      }
      indent--;
      printIndent();
      out.append(')');
    }
    if (options.foldEmptyScopes()) {
      newline();
      printLine(keyword("end"));
    } else {
      out.append("; ").append(keyword("end"));
      newline();
    }
  }

  @Override
  public void visit(BlankLine node) {
    newline();
  }

  @Override
  public void visit(StandaloneComment node) {
    printStmtPrefix(node);
    visit(node.getComment());
  }

  // ==== Sends ====

  @Override
  public void visit(Send node) {
    printStmtPrefix(node);
    StringBuilder line = new StringBuilder(node.getMethod());
    if (!node.getArgs().isEmpty()) {
      line.append(' ').append(COMMA_JOINER.join(node.getArgs()));
    }
    if (node.getBlock() != null) {
      line.append(" { ").append(node.getBlock()).append(" }");
    }
    printLine(line.toString());
  }

  @Override
  public void visit(Attr node) {
    printBlankLineBefore(node);
    printComments(node);
    visitAll(node.getSigs());
    printLocation(node);
    List<String> names = new ArrayList<>();
    for (String name : node.getNames()) {
      names.add(":" + name);
    }
    printLine(
        visibilityPrefix(node.getVisibility())
            + keyword(node.getAccess().keyword())
            + " "
            + COMMA_JOINER.join(names));
  }

  @Override
  public void visit(Mixin node) {
    printStmtPrefix(node);
    printLine(call(keyword(node.getMethod()), node.getNames(), options.parenthesizeIncludes()));
  }

  @Override
  public void visit(Visibility node) {
    printStmtPrefix(node);
    printLine(keyword(node.getLevel().keyword()));
  }

  @Override
  public void visit(Helper node) {
    printStmtPrefix(node);
    printLine(node.getMethod());
  }

  @Override
  public void visit(MixesInClassMethods node) {
    printStmtPrefix(node);
    printLine(call(node.getMethod(), node.getNames(), options.parenthesizeMixins()));
  }

  @Override
  public void visit(TypeMember node) {
    printStmtPrefix(node);
    printLine(node.getName() + " = " + node.getValue());
  }

  @Override
  public void visit(StructField node) {
    printStmtPrefix(node);
    printLine(node.getMethod() + " " + COMMA_JOINER.join(node.getArgs()));
  }

  @Override
  public void visit(EnumsBlock node) {
    printStmtPrefix(node);
    if (node.getNames().isEmpty() && !options.foldEmptyScopes()) {
      printLine("enums " + keyword("do") + "; " + keyword("end"));
      return;
    }
    printLine("enums " + keyword("do"));
    indent++;
    for (String name : node.getNames()) {
      printLine(name + " = new");
    }
    indent--;
    printLine(keyword("end"));
  }

  // ==== Signatures ====

  /**
   * Returns the builder operations of {@code sig} in rendering order: type parameters, params,
   * modifiers in the order they were added, the return (void if absent), and the checked level.
   */
  private ImmutableList<String> sigChain(Sig sig) {
    ImmutableList.Builder<String> chain = ImmutableList.builder();
    chain.addAll(sigPrefix(sig));
    List<Param> params = sig.getParams();
    if (!params.isEmpty()) {
      List<String> rendered = new ArrayList<>();
      for (Param param : params) {
        rendered.add(sigParam(param));
      }
      chain.add("params(" + COMMA_JOINER.join(rendered) + ")");
    }
    chain.addAll(sigSuffix(sig));
    return chain.build();
  }

  private static ImmutableList<String> sigPrefix(Sig sig) {
    List<String> typeParameters = sig.getTypeParameters();
    if (typeParameters.isEmpty()) {
      return ImmutableList.of();
    }
    List<String> symbols = new ArrayList<>();
    for (String name : typeParameters) {
      symbols.add(":" + name);
    }
    return ImmutableList.of("type_parameters(" + COMMA_JOINER.join(symbols) + ")");
  }

  private static ImmutableList<String> sigSuffix(Sig sig) {
    ImmutableList.Builder<String> suffix = ImmutableList.builder();
    for (SigOp.Modifier modifier : sig.getModifiers()) {
      suffix.add(modifier.keyword());
    }
    String returnType = sig.getReturnType();
    suffix.add(returnType == null ? "void" : "returns(" + returnType + ")");
    if (sig.getChecked() != null) {
      suffix.add("checked(:" + sig.getChecked() + ")");
    }
    return suffix.build();
  }

  /** Prints {@code sig do ... end} with one parameter per line, for params that carry comments. */
  private void printSigBlock(Sig sig) {
    printLine(keyword("sig") + " " + keyword("do"));
    indent++;
    List<Param> params = sig.getParams();
    printIndent();
    for (String op : sigPrefix(sig)) {
      out.append(op).append('.');
    }
    out.append("params(");
    newline();
    indent++;
    for (int i = 0; i < params.size(); i++) {
      Param param = params.get(i);
      printParamLine(sigParam(param), param, i == params.size() - 1);
    }
    indent--;
    printLine(")." + DOT_JOINER.join(sigSuffix(sig)));
    indent--;
    printLine(keyword("end"));
  }

  // ==== Parameters ====

  private static String param(Param param) {
    switch (param.kind()) {
      case REQUIRED:
        return param.getName();
      case OPTIONAL:
        return param.getName() + " = " + param.getDefaultValue();
      case REST:
        return "*" + param.getName();
      case KEYWORD:
        return param.getName() + ":";
      case KEYWORD_OPTIONAL:
        return param.getName() + ": " + param.getDefaultValue();
      case KEYWORD_REST:
        return "**" + param.getName();
      case BLOCK:
        return "&" + param.getName();
    }
    throw new IllegalStateException("unexpected parameter kind: " + param.kind());
  }

  private static String sigParam(Param param) {
    return param.getName() + ": " + (param.getType() == null ? Sig.UNTYPED : param.getType());
  }

  /**
   * Prints one parameter of a multi-line parameter list followed by its comments. The first comment
   * line trails the parameter; the others are padded to start in the same column.
   */
  private void printParamLine(String text, Param param, boolean last) {
    String item = last ? text : text + ",";
    printIndent();
    out.append(item);
    ImmutableList<String> lines = Comment.linesOf(param.getComments());
    for (int i = 0; i < lines.size(); i++) {
      if (i == 0) {
        out.append(' ');
      } else {
        newline();
        printIndent();
        out.append(" ".repeat(item.length() + 1));
      }
      out.append(comment(commentLine(lines.get(i))));
    }
    newline();
  }

  // ==== Decorations ====

  /** Prints the blank line, location and comments that precede a statement. */
  private void printStmtPrefix(Stmt node) {
    printBlankLineBefore(node);
    printLocation(node);
    printComments(node);
  }

  private void printBlankLineBefore(Stmt node) {
    if (previous == null || previous.kind() == Stmt.Kind.BLANK_LINE) {
      return;
    }
    if (isOneLine(previous) && isOneLine(node)) {
      return;
    }
    newline();
  }

  /** Prints the comments of {@code node}, one {@code #} line per comment line. */
  protected void printComments(Stmt node) {
    visitAll(node.getComments());
  }

  /** Prints {@code # <location>} if locations are enabled and {@code node} has one. */
  protected void printLocation(Node node) {
    if (options.printLocations() && node.getLocation() != null) {
      printLine(comment("# " + node.getLocation()));
    }
  }

  /**
   * Returns true if {@code node} renders on a single line with no comments, so that it may run
   * into an adjacent one-line sibling without a separating blank line.
   */
  static boolean isOneLine(Stmt node) {
    switch (node.kind()) {
      case ROOT:
      case MODULE:
      case CLASS:
      case SINGLETON_CLASS:
      case STRUCT:
        return node.getComments().isEmpty() && ((Scope) node).isEmpty();
      case DEF:
        Def def = (Def) node;
        return def.getComments().isEmpty() && def.getSigs().isEmpty() && !def.hasParamComments();
      case ATTR:
        return node.getComments().isEmpty() && ((Attr) node).getSigs().isEmpty();
      case BLANK_LINE:
        return true;
      case COMMENT:
      case CONST:
      case SEND:
      case MIXIN:
      case VISIBILITY:
      case HELPER:
      case MIXES_IN_CLASS_METHODS:
      case TYPE_MEMBER:
      case STRUCT_FIELD:
      case ENUMS_BLOCK:
        return node.getComments().isEmpty();
    }
    throw new IllegalStateException("unexpected statement kind: " + node.kind());
  }

  private static String call(String method, List<String> args, boolean parenthesize) {
    return parenthesize
        ? method + "(" + COMMA_JOINER.join(args) + ")"
        : method + " " + COMMA_JOINER.join(args);
  }

  private String visibilityPrefix(@Nullable Visibility.Level visibility) {
    return visibility == null || visibility == Visibility.Level.PUBLIC
        ? ""
        : keyword(visibility.keyword()) + " ";
  }

  private static String commentLine(String line) {
    return line.isEmpty() ? "#" : "# " + line;
  }

  private String keyword(String text) {
    return options.colorize() ? KEYWORD_COLOR + text + RESET_COLOR : text;
  }

  private String comment(String text) {
    return options.colorize() ? COMMENT_COLOR + text + RESET_COLOR : text;
  }

  // ==== Output ====

  private void printIndent() {
    out.append(" ".repeat(indent * options.indentWidth()));
  }

  private void printLine(String text) {
    printIndent();
    out.append(text);
    newline();
  }

  private void newline() {
    out.append('\n');
  }
}
