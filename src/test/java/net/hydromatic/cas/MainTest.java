/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cas;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Main}. */
public class MainTest {
  private static List<String> run(List<String> args, String... lines) {
    final StringReader in = new StringReader(String.join("\n", lines));
    final StringWriter out = new StringWriter();
    new Main(args, in, out).run();
    return ImmutableList.copyOf(out.toString().split("\\R"));
  }

  @Test void testRun() {
    final List<String> output =
        run(ImmutableList.of(),
            "1+2",
            "1/3",
            "",
            "ans0*2",
            "x+5=10",
            "2+",
            "x+1");
    assertThat(output,
        is(
            ImmutableList.of("ans0 = 3",
                "ans1 = 1/3 ≈ 0.3333333333",
                "ans2 = 6",
                "x = 5",
                "?",
                "ans3 = x + 1")));
  }

  @Test void testSet() {
    final List<String> output =
        run(ImmutableList.of(),
            "set precision 4",
            "1/3",
            "set numberFormat plain",
            "set foo 1",
            "set maxDepth 0");
    assertThat(output,
        is(
            ImmutableList.of("precision = 4",
                "ans0 = 1/3 ≈ 0.3333",
                "numberFormat = PLAIN",
                "error: property foo not found",
                "error: value for property maxDepth must be positive")));
  }

  @Test void testEcho() {
    final List<String> output =
        run(ImmutableList.of("--echo"), "x^2-5x+6=0");
    assertThat(output,
        is(ImmutableList.of("> x^2-5x+6=0", "x = 3", "x = 2")));
  }
}

// End MainTest.java
