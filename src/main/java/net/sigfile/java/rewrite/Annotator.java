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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.GoogleLogger;
import net.sigfile.java.tree.Comment;
import net.sigfile.java.tree.Root;
import net.sigfile.java.tree.Scope;
import net.sigfile.java.tree.Stmt;

/**
 * Adds {@code # @tag} comments to declarations, in place.
 *
 * <p>Every top-level declaration is tagged. Nested scopes are tagged only if {@code
 * annotateScopes} is set, and nested constants, attributes, methods, type members and struct
 * fields only if {@code annotateProperties} is set. A declaration already carrying the same tag is
 * skipped; a different tag is appended after its existing comments.
 */
public final class Annotator {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final String annotation;
  private final boolean annotateScopes;
  private final boolean annotateProperties;
  private int added;

  private Annotator(String tag, boolean annotateScopes, boolean annotateProperties) {
    this.annotation = "@" + tag;
    this.annotateScopes = annotateScopes;
    this.annotateProperties = annotateProperties;
  }

  /** Tags the top-level declarations of {@code tree} only. */
  public static void annotate(Root tree, String tag) {
    annotate(tree, tag, false, false);
  }

  public static void annotate(
      Root tree, String tag, boolean annotateScopes, boolean annotateProperties) {
    checkArgument(!tag.isEmpty() && tag.indexOf('\n') < 0, "invalid tag: '%s'", tag);
    Annotator annotator = new Annotator(tag, annotateScopes, annotateProperties);
    for (Stmt child : tree.getBody()) {
      if (child.kind() == Stmt.Kind.BLANK_LINE || child.kind() == Stmt.Kind.COMMENT) {
        continue;
      }
      annotator.tag(child);
      if (child instanceof Scope) {
        annotator.annotateNested((Scope) child);
      }
    }
    logger.atFine().log("added %d '%s' annotations", annotator.added, annotator.annotation);
  }

  private void annotateNested(Scope scope) {
    for (Stmt child : scope.getBody()) {
      if (child instanceof Scope) {
        if (annotateScopes) {
          tag(child);
        }
        annotateNested((Scope) child);
      } else if (annotateProperties && isProperty(child)) {
        tag(child);
      }
    }
  }

  private void tag(Stmt node) {
    if (!node.hasComment(annotation)) {
      node.addComment(new Comment(annotation));
      added++;
    }
  }

  private static boolean isProperty(Stmt node) {
    switch (node.kind()) {
      case CONST:
      case ATTR:
      case DEF:
      case TYPE_MEMBER:
      case STRUCT_FIELD:
        return true;
      default:
        return false;
    }
  }
}
