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
package net.sigfile.java.rewrite;

import com.google.common.flogger.GoogleLogger;
import net.sigfile.java.tree.Attr;
import net.sigfile.java.tree.Def;
import net.sigfile.java.tree.Scope;
import net.sigfile.java.tree.Stmt;

/**
 * Gives every method and attribute that has no signature a template one, with all parameters and
 * the result typed {@code T.untyped}. Attribute writers return {@code void}.
 */
public final class SigTemplates {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private SigTemplates() {}

  /** Adds template signatures throughout {@code scope}, and returns how many were added. */
  public static int addMissing(Scope scope) {
    int added = 0;
    for (Stmt child : scope.getBody()) {
      if (child instanceof Scope) {
        added += addMissing((Scope) child);
      } else if (child instanceof Def) {
        Def def = (Def) child;
        if (def.getSigs().isEmpty()) {
          def.addSig(def.templateSig());
          added++;
        }
      } else if (child instanceof Attr) {
        Attr attr = (Attr) child;
        if (attr.getSigs().isEmpty()) {
          attr.addSig(attr.templateSig());
          added++;
        }
      }
    }
    logger.atFinest().log("added %d template sigs in '%s'", added, scope.qualifiedName());
    return added;
  }
}
