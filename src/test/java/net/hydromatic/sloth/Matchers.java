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
package net.hydromatic.sloth;

import net.hydromatic.sloth.eval.EvalException;
import net.hydromatic.sloth.eval.EvalPanic;
import net.hydromatic.sloth.eval.Value;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in Sloth tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a value with a given tag. */
  public static Matcher<Value> hasTag(Value.Tag tag) {
    return new CustomTypeSafeMatcher<Value>("value with tag " + tag) {
      @Override
      protected boolean matchesSafely(Value value) {
        return value.tag == tag;
      }
    };
  }

  /** Matches an evaluation error of a given kind whose message contains a
   * given string. */
  public static Matcher<EvalException> isEvalError(EvalException.Kind kind,
      String messageFragment) {
    return new TypeSafeMatcher<EvalException>() {
      @Override
      protected boolean matchesSafely(EvalException e) {
        return e.kind == kind && e.getMessage().contains(messageFragment);
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("evaluation error " + kind
            + " containing '" + messageFragment + "'");
      }
    };
  }

  /** Matches a panic whose diagnostic lines include one that contains a
   * given string. */
  public static Matcher<EvalPanic> isPanic(String detailFragment) {
    return new TypeSafeMatcher<EvalPanic>() {
      @Override
      protected boolean matchesSafely(EvalPanic e) {
        return e.details.stream().anyMatch(d -> d.contains(detailFragment));
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("panic mentioning '" + detailFragment + "'");
      }
    };
  }
}

// End Matchers.java
