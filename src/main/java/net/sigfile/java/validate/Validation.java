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
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import net.sigfile.java.tree.Root;

/** Runs validators over a set of trees. */
public final class Validation {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private Validation() {}

  /**
   * Returns the errors reported by each of {@code validators}, in validator order. The trees are
   * indexed once and shared by all validators.
   */
  public static ImmutableList<ValidationError> validate(
      List<Root> trees, List<? extends Validator> validators) {
    DeclarationIndex index = DeclarationIndex.of(trees);
    ImmutableList.Builder<ValidationError> errors = ImmutableList.builder();
    for (Validator validator : validators) {
      ImmutableList<ValidationError> found = validator.validate(index);
      logger.atFine().log(
          "%s reported %d errors", validator.getClass().getSimpleName(), found.size());
      errors.addAll(found);
    }
    return errors.build();
  }
}
