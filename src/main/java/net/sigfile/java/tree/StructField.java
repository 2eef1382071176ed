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

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/** A typed struct property, {@code prop :name, Type} or {@code const :name, Type, default: x}. */
public final class StructField extends Send {

  /** Whether the field is mutable ({@code prop}) or read-only ({@code const}). */
  public enum Type {
    PROP("prop"),
    CONST("const");

    private final String keyword;

    Type(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }
  }

  private final Type fieldType;
  private final String name;
  private final String type;
  @Nullable private final String defaultValue;

  public StructField(Type fieldType, String name, String type) {
    this(fieldType, name, type, null, null);
  }

  public StructField(
      Type fieldType,
      String name,
      String type,
      @Nullable String defaultValue,
      @Nullable Location location) {
    super(Kind.STRUCT_FIELD, fieldType.keyword(), args(name, type, defaultValue), null, location);
    this.fieldType = fieldType;
    this.name = name;
    this.type = type;
    this.defaultValue = defaultValue;
  }

  private static ImmutableList<String> args(
      String name, String type, @Nullable String defaultValue) {
    ImmutableList.Builder<String> args = ImmutableList.<String>builder().add(":" + name, type);
    if (defaultValue != null) {
      args.add("default: " + defaultValue);
    }
    return args.build();
  }

  public Type getFieldType() {
    return fieldType;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  @Nullable
  public String getDefaultValue() {
    return defaultValue;
  }

  /** A field defines an accessor, so it is named like an instance method. */
  @Override
  public String qualifiedName() {
    return parentQualifiedName() + "#" + name;
  }

  @Override
  public StructField copy() {
    return withCommonPartsOf(new StructField(fieldType, name, type, defaultValue, null));
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
