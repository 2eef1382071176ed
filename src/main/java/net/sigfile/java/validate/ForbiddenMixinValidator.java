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
import com.google.common.collect.ImmutableSet;
import net.sigfile.java.tree.Mixin;
import net.sigfile.java.tree.Stmt;

/** Reports mixins of a forbidden module, by default {@code extend T::Sig}. */
public final class ForbiddenMixinValidator implements Validator {

  private final Mixin.Type type;
  private final ImmutableSet<String> forbidden;

  public ForbiddenMixinValidator() {
    this(Mixin.Type.EXTEND, ImmutableSet.of("T::Sig", "::T::Sig"));
  }

  public ForbiddenMixinValidator(Mixin.Type type, Iterable<String> forbidden) {
    this.type = type;
    this.forbidden = ImmutableSet.copyOf(forbidden);
  }

  @Override
  public ImmutableList<ValidationError> validate(DeclarationIndex index) {
    ImmutableList.Builder<ValidationError> errors = ImmutableList.builder();
    for (Stmt node : index.all()) {
      if (!(node instanceof Mixin) || ((Mixin) node).getType() != type) {
        continue;
      }
      for (String name : ((Mixin) node).getNames()) {
        if (forbidden.contains(name)) {
          errors.add(
              ValidationError.at(
                  node, "'%s %s' is not allowed in %s", type.keyword(), name, describe(node)));
        }
      }
    }
    return errors.build();
  }

  private static String describe(Stmt node) {
    if (node.getParent() == null) {
      return "an unattached declaration";
    }
    String scope = node.getParent().qualifiedName();
    return scope.isEmpty() ? "the top level" : scope;
  }
}
