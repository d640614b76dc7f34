package com.codeheadsystems.eccsim.cipher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.eccsim.codec.HexCodec;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LcgKeystreamTest {

  @ParameterizedTest
  @CsvSource({
      "0, 5f32e9",
      "1, 6cdb7ec5",
      "53, 102fc23944d3167d",
      "4294967295, 528954"
  })
  void knownKeystreams(long seed, String expectedHex) {
    int length = expectedHex.length() / 2;
    assertThat(HexCodec.encode(LcgKeystream.generateKeystream(seed, length))).isEqualTo(expectedHex);
  }

  @Test
  void deterministic() {
    assertThat(LcgKeystream.generateKeystream(123456789L, 256))
        .isEqualTo(LcgKeystream.generateKeystream(123456789L, 256));
  }

  @Test
  void prefixStable() {
    byte[] longer = LcgKeystream.generateKeystream(53L, 32);
    byte[] shorter = LcgKeystream.generateKeystream(53L, 8);
    assertThat(longer).startsWith(shorter);
  }

  @Test
  void differentSeedsDiffer() {
    assertThat(LcgKeystream.generateKeystream(1L, 16)).isNotEqualTo(LcgKeystream.generateKeystream(2L, 16));
  }

  @Test
  void zeroLength() {
    assertThat(LcgKeystream.generateKeystream(5L, 0)).isEmpty();
  }

  @Test
  void apply_twiceRestoresInput() {
    byte[] plain = "attack at dawn".getBytes(StandardCharsets.UTF_8);
    byte[] cipher = LcgKeystream.apply(53L, plain);
    assertThat(cipher).isNotEqualTo(plain);
    assertThat(LcgKeystream.apply(53L, cipher)).isEqualTo(plain);
  }

  @Test
  void seedOutside32BitsThrows() {
    assertThatThrownBy(() -> LcgKeystream.generateKeystream(-1L, 4))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> LcgKeystream.generateKeystream(1L << 32, 4))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void negativeLengthThrows() {
    assertThatThrownBy(() -> LcgKeystream.generateKeystream(0L, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
