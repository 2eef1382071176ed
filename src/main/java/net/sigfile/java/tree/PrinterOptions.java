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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;

/**
 * PrinterOptions is the set of options that affect how a declaration tree is rendered to text. A
 * value is immutable and is passed unchanged through a whole rendering; equal options applied to
 * an equal tree always produce identical text.
 *
 * <p>The {@link #DEFAULT} options produce the canonical layout.
 */
@AutoValue
public abstract class PrinterOptions {

  /** The default options for rendering. */
  public static final PrinterOptions DEFAULT = builder().build();

  /**
   * The strictness level written as a leading {@code # typed: <level>} comment followed by one
   * blank line, or null for no header. The level is opaque text.
   */
  @Nullable
  public abstract String strictness();

  /** Precede each statement and signature that has a location with a {@code # <location>} line. */
  public abstract boolean printLocations();

  /**
   * When false, a scope, method or {@code enums} block with an empty body is collapsed onto one
   * line ending in {@code ; end}. When true, empty bodies are still rendered across multiple lines.
   * Signatures always render as {@code sig { ... }} unless their parameters carry comments.
   */
  public abstract boolean foldEmptyScopes();

  /** Render {@code include}, {@code extend} and {@code prepend} arguments in parentheses. */
  public abstract boolean parenthesizeIncludes();

  /** Render {@code mixes_in_class_methods} arguments in parentheses. */
  public abstract boolean parenthesizeMixins();

  /**
   * Wrap keywords and comments in ANSI color escapes. Removing the escapes yields exactly the text
   * rendered without this option.
   */
  public abstract boolean colorize();

  /** Number of spaces per indentation level. */
  public abstract int indentWidth();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_PrinterOptions.Builder()
        .strictness(null)
        .printLocations(false)
        .foldEmptyScopes(false)
        .parenthesizeIncludes(false)
        .parenthesizeMixins(false)
        .colorize(false)
        .indentWidth(2);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link PrinterOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder strictness(@Nullable String value);

    public abstract Builder printLocations(boolean value);

    public abstract Builder foldEmptyScopes(boolean value);

    public abstract Builder parenthesizeIncludes(boolean value);

    public abstract Builder parenthesizeMixins(boolean value);

    public abstract Builder colorize(boolean value);

    public abstract Builder indentWidth(int value);

    abstract PrinterOptions autoBuild();

    public final PrinterOptions build() {
      PrinterOptions options = autoBuild();
      checkArgument(options.indentWidth() >= 0, "negative indent width");
      return options;
    }
  }
}
