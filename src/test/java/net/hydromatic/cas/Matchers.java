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

import com.google.common.collect.ImmutableMultiset;
import java.util.Arrays;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.compile.Simplifier;
import net.hydromatic.cas.eval.ExactResult;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an expression by its string representation, and checks that
   * it is in canonical form. */
  public static Matcher<Expr.Exp> isExp(String expected) {
    return new CustomTypeSafeMatcher<Expr.Exp>("expression " + expected) {
      @Override protected boolean matchesSafely(Expr.Exp exp) {
        assertThat("not canonical: " + exp, Simplifier.simplify(exp),
            is(exp));
        return exp.toString().equals(expected);
      }
    };
  }

  /** Matches a result whose nodes have a given description. */
  public static Matcher<ExactResult> hasText(String expected) {
    return new TypeSafeMatcher<ExactResult>() {
      @Override protected boolean matchesSafely(ExactResult result) {
        return result.nodes != null && result.text().equals(expected);
      }

      @Override public void describeTo(Description description) {
        description.appendText("result with text " + expected);
      }

      @Override protected void describeMismatchSafely(ExactResult result,
          Description description) {
        description.appendText("was ").appendValue(result);
      }
    };
  }

  /** Matches a result whose lines are the given lines, in any order. */
  public static Matcher<ExactResult> hasLines(String... lines) {
    final ImmutableMultiset<String> expected =
        ImmutableMultiset.copyOf(lines);
    return new CustomTypeSafeMatcher<ExactResult>("result with lines "
        + Arrays.toString(lines)) {
      @Override protected boolean matchesSafely(ExactResult result) {
        return expected.equals(
            ImmutableMultiset.copyOf(result.text().split("\n")));
      }
    };
  }

  /** Matches an empty result. */
  public static Matcher<ExactResult> isEmptyResult() {
    return new CustomTypeSafeMatcher<ExactResult>("empty result") {
      @Override protected boolean matchesSafely(ExactResult result) {
        return result.isEmpty();
      }
    };
  }

  /** Matches an error result whose message contains a string. */
  public static Matcher<ExactResult> isErrorResult(String message) {
    return new CustomTypeSafeMatcher<ExactResult>("error containing "
        + message) {
      @Override protected boolean matchesSafely(ExactResult result) {
        return result.error != null && result.error.contains(message);
      }
    };
  }
}

// End Matchers.java
