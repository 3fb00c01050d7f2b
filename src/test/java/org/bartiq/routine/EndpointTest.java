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


package org.bartiq.routine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EndpointTest {

  @Test
  public void parse() {
    Endpoint own = Endpoint.parse("in_0");
    assertThat(own.isOwn()).isTrue();
    assertThat(own).isEqualTo(Endpoint.own("in_0"));
    assertThat(own.toString()).isEqualTo("in_0");

    Endpoint child = Endpoint.parse("a.out_0");
    assertThat(child.isOwn()).isFalse();
    assertThat(child.routineName).isEqualTo("a");
    assertThat(child.portName).isEqualTo("out_0");
    assertThat(child.toString()).isEqualTo("a.out_0");
  }

  @Test
  public void onlyDirectChildren() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Endpoint.parse("a.b.out_0"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Endpoints may only refer to direct children: a.b.out_0");
  }

  @Test
  public void parameterLink() {
    ParameterLink link = new ParameterLink("a.b", "N");
    assertThat(link).isEqualTo(new ParameterLink("a.b", "N"));
    assertThat(link).isNotEqualTo(new ParameterLink("a", "b.N"));
    assertThat(link.toString()).isEqualTo("a.b.N");
  }
}
