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
package net.hydromatic.calx;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.util.CalxException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in Calx tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an expression by its string representation. */
  public static Matcher<Ast.Exp> isAst(String expected) {
    return new CustomTypeSafeMatcher<Ast.Exp>("ast with value " + expected) {
      @Override protected boolean matchesSafely(Ast.Exp e) {
        return e.toString().equals(expected);
      }
    };
  }

  /** Matches a number that is within a tolerance of a given value. */
  public static Matcher<Num> closeTo(double expected, double tolerance) {
    return new TypeSafeMatcher<Num>() {
      @Override protected boolean matchesSafely(Num num) {
        return num.closeTo(Num.of(expected), tolerance);
      }

      @Override public void describeTo(Description description) {
        description.appendText("number within " + tolerance + " of ")
            .appendValue(expected);
      }
    };
  }

  /** Matches a list of numbers whose string values, sorted, are as
   * given. */
  public static Matcher<List<Num>> hasSortedValues(String... expected) {
    final List<String> expectedList = List.of(expected);
    return new TypeSafeMatcher<List<Num>>() {
      @Override protected boolean matchesSafely(List<Num> nums) {
        final List<String> list = new ArrayList<>();
        nums.forEach(num -> list.add(num.toString()));
        list.sort(null);
        return list.equals(expectedList);
      }

      @Override public void describeTo(Description description) {
        description.appendText("sorted values ").appendValue(expectedList);
      }
    };
  }

  /** Returns the description of an exception, including its position. */
  public static String describe(CalxException e) {
    return e.describeTo(new StringBuilder()).toString();
  }
}

// End Matchers.java
