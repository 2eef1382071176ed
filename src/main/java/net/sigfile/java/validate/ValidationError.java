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
package net.sigfile.java.validate;

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;
import net.sigfile.java.tree.Location;
import net.sigfile.java.tree.Stmt;

/** A problem reported by a {@link Validator}. */
@AutoValue
public abstract class ValidationError {

  @Nullable
  public abstract Location location();

  public abstract String message();

  public static ValidationError create(@Nullable Location location, String message) {
    return new AutoValue_ValidationError(location, message);
  }

  /** Returns an error located at {@code node}, with a printf-style message. */
  public static ValidationError at(Stmt node, String format, Object... args) {
    return create(node.getLocation(), String.format(format, args));
  }

  @Override
  public final String toString() {
    return location() == null ? message() : location() + ": " + message();
  }
}
