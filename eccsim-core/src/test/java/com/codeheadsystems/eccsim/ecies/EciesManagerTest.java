package com.codeheadsystems.eccsim.ecies;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.eccsim.agreement.KeyAgreement;
import com.codeheadsystems.eccsim.agreement.KeyPair;
import com.codeheadsystems.eccsim.config.EccSimConfig;
import com.codeheadsystems.eccsim.curve.Point;
import com.codeheadsystems.eccsim.exceptions.MalformedHexInputException;
import com.codeheadsystems.eccsim.exceptions.MalformedPointInputException;
import com.codeheadsystems.eccsim.exceptions.PointNotOnCurveException;
import com.codeheadsystems.eccsim.exceptions.ScalarOutOfRangeException;
import java.math.BigInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class EciesManagerTest {

  private static final BigInteger D = BigInteger.valueOf(7);
  private static final BigInteger K = BigInteger.valueOf(5);
  private static final Point Q = Point.of(10, 76);

  private EciesManager manager;

  @BeforeEach
  void setUp() {
    manager = new EciesManager(EccSimConfig.forTesting(42L));
  }

  static Stream<String> messages() {
    return Stream.of("", "hi", "Hello ECC 👋", "The quick brown fox jumps over the lazy dog", "ünïcödé ✓");
  }

  @Test
  void concreteScenario() {
    KeyAgreement keyAgreement = manager.keyAgreement();
    Point q = keyAgreement.derivePublicKey(D);
    Point c1 = keyAgreement.derivePublicKey(K);
    assertThat(q).isEqualTo(Q);
    assertThat(c1).isEqualTo(Point.of(88, 56));
    assertThat(keyAgreement.deriveSharedSecret(K, q)).isEqualTo(keyAgreement.deriveSharedSecret(D, c1));

    EncryptedMessage encrypted = manager.encrypt("hi", K, q);

    assertThat(encrypted.c1()).isEqualTo(c1);
    assertThat(encrypted.ciphertextHex()).isEqualTo("7846");
    assertThat(manager.decrypt(encrypted.ciphertextHex(), encrypted.c1(), D)).isEqualTo("hi");
  }

  @Test
  void knownCiphertextForHello() {
    assertThat(manager.encrypt("hello", K, Q).ciphertextHex()).isEqualTo("784aae552b");
  }

  @Test
  void encryptIsIdempotent() {
    assertThat(manager.encrypt("same input", K, Q)).isEqualTo(manager.encrypt("same input", K, Q));
  }

  @Test
  void decryptIsIdempotent() {
    assertThat(manager.decrypt("7846", Point.of(88, 56), D)).isEqualTo(manager.decrypt("7846", Point.of(88, 56), D));
  }

  @Nested
  class RoundTrip {

    @ParameterizedTest
    @MethodSource("com.codeheadsystems.eccsim.ecies.EciesManagerTest#messages")
    void everyScalarPair(String message) {
      KeyAgreement keyAgreement = manager.keyAgreement();
      for (int d = 1; d < 50; d++) {
        KeyPair recipient = keyAgreement.keyPair(BigInteger.valueOf(d));
        for (int k = 1; k < 50; k++) {
          EncryptedMessage encrypted = manager.encrypt(message, BigInteger.valueOf(k), recipient.publicPoint());
          assertThat(manager.decrypt(encrypted.ciphertextHex(), encrypted.c1(), recipient.privateScalar()))
              .as("d=%d k=%d", d, k)
              .isEqualTo(message);
        }
      }
    }

    @Test
    void randomEphemeralScalar() {
      KeyPair recipient = manager.keyAgreement().generateKeyPair();
      EncryptedMessage encrypted = manager.encrypt("random k", recipient.publicPoint());
      assertThat(manager.decrypt(encrypted, recipient.privateScalar())).isEqualTo("random k");
    }

    @Test
    void c1AsText() {
      EncryptedMessage encrypted = manager.encrypt("text c1", K, Q);
      assertThat(manager.decrypt(encrypted.ciphertextHex(), "88, 56", D)).isEqualTo("text c1");
    }

    @Test
    void degenerateSharedPointStillRoundTrips() {
      // d=25, k=2 gives 50*G = identity and a zero seed
      KeyPair recipient = manager.keyAgreement().keyPair(BigInteger.valueOf(25));
      EncryptedMessage encrypted = manager.encrypt("weak", BigInteger.TWO, recipient.publicPoint());
      assertThat(manager.decrypt(encrypted, recipient.privateScalar())).isEqualTo("weak");
    }

    @Test
    void wrongPrivateScalarDoesNotDecrypt() {
      EncryptedMessage encrypted = manager.encrypt("secret", K, Q);
      assertThat(manager.decrypt(encrypted, BigInteger.valueOf(8))).isNotEqualTo("secret");
    }
  }

  @Nested
  class Rejections {

    @Test
    void encrypt_ephemeralScalarOutOfRange() {
      assertThatThrownBy(() -> manager.encrypt("x", BigInteger.valueOf(50), Q))
          .isInstanceOf(ScalarOutOfRangeException.class);
      assertThatThrownBy(() -> manager.encrypt("x", BigInteger.ZERO, Q))
          .isInstanceOf(ScalarOutOfRangeException.class);
    }

    @Test
    void encrypt_recipientKeyOffCurve() {
      assertThatThrownBy(() -> manager.encrypt("x", K, Point.of(10, 75)))
          .isInstanceOf(PointNotOnCurveException.class);
    }

    @Test
    void decrypt_c1OffCurve() {
      assertThatThrownBy(() -> manager.decrypt("7846", Point.of(88, 55), D))
          .isInstanceOf(PointNotOnCurveException.class)
          .hasMessageContaining("(88, 55)");
    }

    @Test
    void decrypt_c1WithUnreducedCoordinates() {
      // 185 = 88 + 97 and 177 = 80 + 97; neither is taken as its reduced point
      assertThatThrownBy(() -> manager.decrypt("7846", "185,56", D))
          .isInstanceOf(PointNotOnCurveException.class)
          .hasMessageContaining("(185, 56)");
      assertThatThrownBy(() -> manager.decrypt("7846", "177,10", K))
          .isInstanceOf(PointNotOnCurveException.class);
      assertThatThrownBy(() -> manager.decrypt("7846", "97,10", BigInteger.ONE))
          .isInstanceOf(PointNotOnCurveException.class);
      assertThat(manager.decrypt("7846", "88,56", D)).isEqualTo("hi");
    }

    @Test
    void encrypt_recipientKeyWithUnreducedCoordinates() {
      assertThatThrownBy(() -> manager.encrypt("hi", K, Point.of(10 + 97, 76)))
          .isInstanceOf(PointNotOnCurveException.class);
    }

    @Test
    void decrypt_oddHex() {
      assertThatThrownBy(() -> manager.decrypt("784", Point.of(88, 56), D))
          .isInstanceOf(MalformedHexInputException.class);
    }

    @Test
    void decrypt_privateScalarOutOfRange() {
      assertThatThrownBy(() -> manager.decrypt("7846", Point.of(88, 56), BigInteger.valueOf(-7)))
          .isInstanceOf(ScalarOutOfRangeException.class);
    }

    @Test
    void decrypt_unparseableC1() {
      assertThatThrownBy(() -> manager.decrypt("7846", "88;56", D))
          .isInstanceOf(MalformedPointInputException.class);
    }

    @Test
    void decrypt_hexWithSeparatorsIsAccepted() {
      assertThat(manager.decrypt("78 46", Point.of(88, 56), D)).isEqualTo("hi");
    }
  }

  @Nested
  class Message {

    @Test
    void ciphertextIsDefensivelyCopied() {
      byte[] raw = {1, 2, 3};
      EncryptedMessage message = new EncryptedMessage(Point.of(88, 56), raw);
      raw[0] = 9;
      message.ciphertext()[1] = 9;
      assertThat(message.ciphertext()).containsExactly(1, 2, 3);
    }

    @Test
    void equalityUsesContent() {
      EncryptedMessage a = new EncryptedMessage(Point.of(88, 56), new byte[]{1, 2});
      EncryptedMessage b = new EncryptedMessage(Point.of(88, 56), new byte[]{1, 2});
      assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
      assertThat(a).hasToString("EncryptedMessage[c1=(88, 56), ciphertext=0102]");
    }
  }
}
