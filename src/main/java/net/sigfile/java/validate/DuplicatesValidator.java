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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multimaps;
import java.util.List;
import java.util.Map;
import net.sigfile.java.tree.Scope;
import net.sigfile.java.tree.Stmt;

/**
 * Reports declarations made more than once under the same qualified name. Reopening a scope is
 * allowed unless the validator is created with {@code allowScopeReopening} unset.
 */
public final class DuplicatesValidator implements Validator {

  private final boolean allowScopeReopening;

  public DuplicatesValidator() {
    this(true);
  }

  public DuplicatesValidator(boolean allowScopeReopening) {
    this.allowScopeReopening = allowScopeReopening;
  }

  @Override
  public ImmutableList<ValidationError> validate(DeclarationIndex index) {
    ImmutableList.Builder<ValidationError> errors = ImmutableList.builder();
    for (Map.Entry<String, List<Stmt>> entry : Multimaps.asMap(index.asMultimap()).entrySet()) {
      List<Stmt> nodes = entry.getValue();
      Stmt first = nodes.get(0);
      for (Stmt duplicate : nodes.subList(1, nodes.size())) {
        if (allowScopeReopening && first instanceof Scope && duplicate instanceof Scope) {
          continue;
        }
        String where = first.getLocation() == null ? "" : " (first at " + first.getLocation() + ")";
        errors.add(
            ValidationError.at(duplicate, "duplicate definition of %s%s", entry.getKey(), where));
      }
    }
    return errors.build();
  }
}
