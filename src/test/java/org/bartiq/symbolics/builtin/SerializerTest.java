/*
 * Copyright 2025 The Bartiq Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.bartiq.symbolics.builtin;

import static com.google.common.truth.Truth.assertWithMessage;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class SerializerTest {

  private static Object[] forms() {
    return new Object[] {
      new Object[] {"x**2 + 2*x + 1", "2*x + x^2 + 1"},
      new Object[] {"a - b", "a - b"},
      new Object[] {"x - 1", "x - 1"},
      new Object[] {"-x", "-x"},
      new Object[] {"x/y", "x/y"},
      new Object[] {"2*x/3", "2*x/3"},
      new Object[] {"1/(a*b)", "1/(a*b)"},
      new Object[] {"sqrt(x)", "sqrt(x)"},
      new Object[] {"sqrt(8)", "sqrt(8)"},
      new Object[] {"(a + b)^2", "(a + b)^2"},
      new Object[] {"x^(1/3)", "x^(1/3)"},
      new Object[] {"2^(x + 1)", "2^(x + 1)"},
      new Object[] {"PI*r^2", "PI*r^2"},
      new Object[] {"1.5*x", "1.5*x"},
      new Object[] {"3/4", "3/4"},
      new Object[] {"f(x, 2)", "f(x, 2)"},
      new Object[] {"log2(n)", "log(n, 2)"},
      new Object[] {"7 % n", "mod(7, n)"},
      new Object[] {"oo", "oo"},
      new Object[] {"sum_over(log(i), i, 1, N)", "sum_over(log(i), i, 1, N)"},
    };
  }

  @Test
  @Parameters(method = "forms")
  public void serialize(String input, String expected) {
    Expr expr = BuiltinEngine.INSTANCE.parse(input);
    assertWithMessage(input).that(Serializer.serialize(expr)).isEqualTo(expected);
  }
}
