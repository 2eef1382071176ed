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
import net.sigfile.java.tree.Comment;
import net.sigfile.java.tree.Stmt;

/**
 * Reports methods and attributes without documentation. Comments consisting only of annotation
 * tags such as {@code @shim} do not count as documentation.
 */
public final class RequireDocValidator implements Validator {

  @Override
  public ImmutableList<ValidationError> validate(DeclarationIndex index) {
    ImmutableList.Builder<ValidationError> errors = ImmutableList.builder();
    for (Stmt node : index.all()) {
      if ((node.kind() == Stmt.Kind.DEF || node.kind() == Stmt.Kind.ATTR) && !isDocumented(node)) {
        errors.add(ValidationError.at(node, "%s is not documented", node.qualifiedName()));
      }
    }
    return errors.build();
  }

  private static boolean isDocumented(Stmt node) {
    for (Comment comment : node.getComments()) {
      String text = comment.getText().strip();
      if (!text.isEmpty() && !text.startsWith("@")) {
        return true;
      }
    }
    return false;
  }
}
