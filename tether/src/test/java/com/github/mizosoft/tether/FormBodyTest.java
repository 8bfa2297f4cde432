/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.tether;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FormBodyTest {
  @Test
  void multiValuedFields() {
    var fields = new LinkedHashMap<String, List<String>>(); // Preserve order.
    fields.put("purpose", List.of("idk"));
    fields.put("help", List.of("now", "pls"));
    fields.put("none", List.of());
    assertThat(FormBody.of(fields).encodedString()).isEqualTo("purpose=idk&help=now&help=pls");
  }

  @Test
  void encodedStringSafe() {
    var fields = new LinkedHashMap<String, List<String>>();
    fields.put("stranger", List.of("danger"));
    fields.put("safe", List.of("*.-_"));
    assertThat(FormBody.of(fields).encodedString()).isEqualTo("stranger=danger&safe=*.-_");
  }

  @Test
  void encodedStringUnsafe() {
    var fields = new LinkedHashMap<String, List<String>>();
    fields.put("some_unsafe", List.of("&(@___@)&"));
    fields.put("more uns@fe", List.of("¥£$"));
    assertThat(FormBody.of(fields).toByteArray())
        .isEqualTo(
            "some_unsafe=%26%28%40___%40%29%26&more+uns%40fe=%C2%A5%C2%A3%24".getBytes(US_ASCII));
  }

  @Test
  void emptyForm() {
    assertThat(FormBody.of(Map.of()).encodedString()).isEmpty();
  }
}
