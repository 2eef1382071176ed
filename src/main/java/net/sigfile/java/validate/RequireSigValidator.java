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
import net.sigfile.java.tree.Attr;
import net.sigfile.java.tree.Def;
import net.sigfile.java.tree.Stmt;

/** Reports methods and attributes that have no signature. */
public final class RequireSigValidator implements Validator {

  @Override
  public ImmutableList<ValidationError> validate(DeclarationIndex index) {
    ImmutableList.Builder<ValidationError> errors = ImmutableList.builder();
    for (Stmt node : index.all()) {
      if (node instanceof Def && ((Def) node).getSigs().isEmpty()) {
        errors.add(ValidationError.at(node, "method %s has no sig", node.qualifiedName()));
      } else if (node instanceof Attr && ((Attr) node).getSigs().isEmpty()) {
        errors.add(ValidationError.at(node, "attribute %s has no sig", node.qualifiedName()));
      }
    }
    return errors.build();
  }
}
