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
package net.sigfile.java.load;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import net.sigfile.java.tree.Const;
import net.sigfile.java.tree.Root;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TreeLoaderTest {

  // Accepts "NAME = VALUE" sources only.
  private static final SourceParser PARSER =
      (filename, text) -> {
        int eq = text.indexOf(" = ");
        if (eq < 0) {
          return null;
        }
        Root root = new Root();
        root.attach(new Const(text.substring(0, eq), text.substring(eq + 3).strip()));
        return root;
      };

  @Test
  public void loadAll_skipsFailures() {
    ImmutableMap<String, Root> trees =
        TreeLoader.loadAll(
            PARSER,
            ImmutableMap.of(
                "b.rbi", "B = 2\n",
                "bad.rbi", "class\n",
                "a.rbi", "A = 1\n"));
    assertThat(trees.keySet()).containsExactly("b.rbi", "a.rbi").inOrder();
    assertThat(trees.get("a.rbi").toString()).isEqualTo("A = 1\n");
  }

  @Test
  public void loadAll_empty() {
    assertThat(TreeLoader.loadAll(PARSER, ImmutableMap.of())).isEmpty();
  }
}
