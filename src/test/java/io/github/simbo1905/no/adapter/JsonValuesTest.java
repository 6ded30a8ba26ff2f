// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonValuesTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void plainJsonWritesBytesAsBase64Text() {
    assertThat(JsonValues.toJsonString(Value.map("raw", Value.of(new byte[]{1, 2, 3}))))
        .isEqualTo("{\"raw\":\"AQID\"}");
    assertThat(JsonValues.parse("{\"$bytes\":\"AQID\"}")).isEqualTo(Value.map("$bytes", Value.of("AQID")));
  }

  @Test
  void taggedJsonKeepsBytesApartFromText() {
    final var value = Value.seq(Value.of(new byte[]{1, 2, 3}), Value.of("AQID"));
    final var json = JsonValues.toTaggedJsonString(value);
    assertThat(json).isEqualTo("[{\"$bytes\":\"AQID\"},\"AQID\"]");
    assertThat(JsonValues.parseTagged(json)).isEqualTo(value);
  }

  @Test
  void mapsWithDollarKeysAreWrapped() {
    final var value = Value.map("$bytes", Value.of("AQID"), "plain", Value.map("$map", Value.TRUE));
    final var json = JsonValues.toTaggedJsonString(value);
    assertThat(json).isEqualTo("{\"$map\":{\"$bytes\":\"AQID\",\"plain\":{\"$map\":{\"$map\":true}}}}");
    assertThat(JsonValues.parseTagged(json)).isEqualTo(value);
    assertThat(JsonValues.toTaggedJsonString(Value.map("a", Value.of(1)))).isEqualTo("{\"a\":1}");
  }

  @Test
  void malformedTagsAreDecodeErrors() {
    assertThatThrownBy(() -> JsonValues.parseTagged("{\"$other\":1}"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Untagged key '$other'");
    assertThatThrownBy(() -> JsonValues.parseTagged("{\"$bytes\":\"AQID\",\"more\":1}"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("has more members");
    assertThatThrownBy(() -> JsonValues.parseTagged("{\"$bytes\":\"not base64!\"}"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Invalid base64");
    assertThatThrownBy(() -> JsonValues.parseTagged("{\"$bytes\":7}"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Expected base64 text");
    assertThatThrownBy(() -> JsonValues.parseTagged("{\"a\":1,\"$x\":2}"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("$x");
  }
}
