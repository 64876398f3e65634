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

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/// Guesses an image file extension from leading magic bytes.
public final class ImageSignatures {

  private ImageSignatures() {
  }

  /// @param data image bytes
  /// @return the extension without a dot, or empty when the format is not recognized
  public static Optional<String> sniff(byte[] data) {
    if (data == null || data.length < 4) {
      return Optional.empty();
    }
    if (startsWith(data, 0xFF, 0xD8, 0xFF)) {
      return Optional.of("jpg");
    }
    if (startsWith(data, 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A)) {
      return Optional.of("png");
    }
    if (ascii(data, 0, 6).equals("GIF87a") || ascii(data, 0, 6).equals("GIF89a")) {
      return Optional.of("gif");
    }
    if (ascii(data, 0, 4).equals("RIFF") && ascii(data, 8, 4).equals("WEBP")) {
      return Optional.of("webp");
    }
    if (startsWith(data, 'B', 'M')) {
      return Optional.of("bmp");
    }
    if (startsWith(data, 'I', 'I', 0x2A, 0x00) || startsWith(data, 'M', 'M', 0x00, 0x2A)) {
      return Optional.of("tif");
    }
    if (startsWith(data, 0x00, 0x00, 0x01, 0x00)) {
      return Optional.of("ico");
    }
    if (ascii(data, 4, 4).equals("ftyp")) {
      String brand = ascii(data, 8, 4);
      if (brand.equals("avif") || brand.equals("avis")) {
        return Optional.of("avif");
      }
      if (brand.startsWith("hei") || brand.startsWith("hev") || brand.equals("mif1")) {
        return Optional.of("heic");
      }
    }
    return Optional.empty();
  }

  private static boolean startsWith(byte[] data, int... signature) {
    if (data.length < signature.length) {
      return false;
    }
    for (int i = 0; i < signature.length; i++) {
      if ((data[i] & 0xff) != signature[i]) {
        return false;
      }
    }
    return true;
  }

  private static String ascii(byte[] data, int offset, int length) {
    if (data.length < offset + length) {
      return "";
    }
    return new String(data, offset, length, StandardCharsets.US_ASCII);
  }
}
