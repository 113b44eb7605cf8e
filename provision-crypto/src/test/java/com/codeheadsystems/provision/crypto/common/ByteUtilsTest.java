package com.codeheadsystems.provision.crypto.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── Fixed-width integers ─────────────────────────────────────────────────

  @Test
  void uint32_bigEndian() {
    assertThat(ByteUtils.uint32(0x01020304)).containsExactly(1, 2, 3, 4);
  }

  @Test
  void uint32_negativeThrows() {
    assertThatThrownBy(() -> ByteUtils.uint32(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Negative");
  }

  @Test
  void uint64_bigEndian() {
    assertThat(ByteUtils.uint64(0x0102030405060708L)).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
  }

  // ─── concat / wipe ────────────────────────────────────────────────────────

  @Test
  void concat_preservesOrder() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[0], new byte[]{2, 3})).containsExactly(1, 2, 3);
  }

  @Test
  void wipe_zeroesEveryBufferAndSkipsNulls() {
    byte[] a = {1, 2};
    byte[] b = {3};
    ByteUtils.wipe(a, null, b);
    assertThat(a).containsOnly(0);
    assertThat(b).containsOnly(0);
  }

  // ─── base64 ───────────────────────────────────────────────────────────────

  @Test
  void base64Url_hasNoPaddingAndAcceptsPadded() {
    String encoded = ByteUtils.toBase64Url(new byte[]{(byte) 0xFB, (byte) 0xFF});
    assertThat(encoded).isEqualTo("-_8");
    assertThat(ByteUtils.fromBase64Url("-_8=")).containsExactly(0xFB, 0xFF);
  }

  @Test
  void fromBase64_rejectsNull() {
    assertThatThrownBy(() -> ByteUtils.fromBase64(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ByteUtils.fromBase64Url(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
