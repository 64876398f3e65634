package io.aitk.hubingest.rows;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/// Turns the shapes an image byte cell takes after decoding into a byte array.
public final class ByteCoercion {

  private ByteCoercion() {
  }

  /// Accepted shapes: `byte[]`, a [ByteBuffer] (its remaining bytes), a list of numbers
  /// (one byte per element, as typed arrays decode), and a string (its UTF-8 bytes).
  /// @param value a cell value, possibly null
  /// @return the bytes, or null for a null value
  /// @throws IllegalArgumentException for any other shape
  public static byte[] toBytes(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof byte[] bytes) {
      return bytes;
    }
    if (value instanceof ByteBuffer buffer) {
      ByteBuffer view = buffer.duplicate();
      byte[] bytes = new byte[view.remaining()];
      view.get(bytes);
      return bytes;
    }
    if (value instanceof List<?> list) {
      byte[] bytes = new byte[list.size()];
      for (int i = 0; i < bytes.length; i++) {
        Object element = list.get(i);
        if (!(element instanceof Number number)) {
          throw new IllegalArgumentException("Unsupported image byte list element at " + i + ": "
                                             + (element == null ? "null" : element.getClass().getSimpleName()));
        }
        bytes[i] = (byte) number.intValue();
      }
      return bytes;
    }
    if (value instanceof String text) {
      return text.getBytes(StandardCharsets.UTF_8);
    }
    throw new IllegalArgumentException("Unsupported image bytes type: " + value.getClass().getSimpleName());
  }
}
