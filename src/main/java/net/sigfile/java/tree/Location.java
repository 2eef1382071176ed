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

/**
 * A source span: the file a declaration was read from, and its first and last line and column.
 *
 * <p>Locations are supplied by the front-end that built the tree; nodes created by rewriters
 * usually have none.
 */
@AutoValue
public abstract class Location {

  public abstract String file();

  public abstract int beginLine();

  public abstract int beginColumn();

  public abstract int endLine();

  public abstract int endColumn();

  public static Location create(
      String file, int beginLine, int beginColumn, int endLine, int endColumn) {
    checkArgument(beginLine <= endLine, "span ends before it begins: %s > %s", beginLine, endLine);
    return new AutoValue_Location(file, beginLine, beginColumn, endLine, endColumn);
  }

  /** Returns the span in {@code file:beginLine:beginColumn-endLine:endColumn} form. */
  @Override
  public final String toString() {
    return file() + ":" + beginLine() + ":" + beginColumn() + "-" + endLine() + ":" + endColumn();
  }
}
