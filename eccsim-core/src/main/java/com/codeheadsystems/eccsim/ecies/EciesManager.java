package com.codeheadsystems.eccsim.ecies;

import com.codeheadsystems.eccsim.agreement.KeyAgreement;
import com.codeheadsystems.eccsim.cipher.LcgKeystream;
import com.codeheadsystems.eccsim.codec.HexCodec;
import com.codeheadsystems.eccsim.codec.PointCodec;
import com.codeheadsystems.eccsim.codec.TextCodec;
import com.codeheadsystems.eccsim.config.EccSimConfig;
import com.codeheadsystems.eccsim.curve.Point;
import com.codeheadsystems.eccsim.exceptions.MalformedHexInputException;
import com.codeheadsystems.eccsim.exceptions.MalformedPointInputException;
import com.codeheadsystems.eccsim.exceptions.PointNotOnCurveException;
import com.codeheadsystems.eccsim.exceptions.ScalarOutOfRangeException;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ECIES-style encryption on the toy curve: an ECDH shared point seeds the LCG keystream,
 * which is XORed with the UTF-8 plaintext.
 *
 * <p>There is no MAC and no KDF. Ciphertexts are malleable and the keystream seed has at
 * most p distinct values. For demonstration only.
 */
public class EciesManager {

  private static final Logger log = LoggerFactory.getLogger(EciesManager.class);

  private final KeyAgreement keyAgreement;

  /**
   * Instantiates a new Ecies manager.
   *
   * @param config the config
   */
  public EciesManager(final EccSimConfig config) {
    this(new KeyAgreement(config));
  }

  /**
   * Instantiates a new Ecies manager.
   *
   * @param keyAgreement the key agreement
   */
  public EciesManager(final KeyAgreement keyAgreement) {
    log.info("EciesManager(p={})", keyAgreement.group().params().p());
    this.keyAgreement = keyAgreement;
  }

  public KeyAgreement keyAgreement() {
    return keyAgreement;
  }

  /**
   * Encrypts with a freshly drawn ephemeral scalar.
   *
   * @param plaintext          the plaintext
   * @param recipientPublicKey the recipient's Q
   * @return the encrypted message
   */
  public EncryptedMessage encrypt(final String plaintext, final Point recipientPublicKey) {
    return encrypt(plaintext, keyAgreement.generatePrivateScalar(), recipientPublicKey);
  }

  /**
   * Encrypts for the holder of {@code recipientPublicKey}: {@code C1 = k*G}, seed from
   * {@code k*Q}, ciphertext = plaintext XOR keystream.
   *
   * @param plaintext          the plaintext
   * @param ephemeralScalar    k in [1, n-1]
   * @param recipientPublicKey the recipient's Q
   * @return the encrypted message
   * @throws ScalarOutOfRangeException if k is out of range
   * @throws PointNotOnCurveException  if Q is not on the curve
   */
  public EncryptedMessage encrypt(final String plaintext,
                                  final BigInteger ephemeralScalar,
                                  final Point recipientPublicKey) {
    final byte[] message = TextCodec.encode(plaintext);
    log.trace("encrypt(length={})", message.length);
    final Point shared = keyAgreement.deriveSharedSecret(ephemeralScalar, recipientPublicKey);
    final Point c1 = keyAgreement.group().scalarMultiplyGenerator(ephemeralScalar);
    final long seed = keyAgreement.seedFromPoint(shared);
    return new EncryptedMessage(c1, LcgKeystream.apply(seed, message));
  }

  /**
   * Decrypts a hex ciphertext given C1 and the recipient's private scalar.
   *
   * @param ciphertextHex the ciphertext as hex; non-hex characters are ignored
   * @param c1            the ephemeral point from the sender
   * @param privateScalar d in [1, n-1]
   * @return the plaintext
   * @throws ScalarOutOfRangeException  if d is out of range
   * @throws PointNotOnCurveException   if C1 is not on the curve
   * @throws MalformedHexInputException if the hex has an odd digit count
   */
  public String decrypt(final String ciphertextHex, final Point c1, final BigInteger privateScalar) {
    log.trace("decrypt(c1={})", c1);
    final Point shared = keyAgreement.deriveSharedSecret(privateScalar, c1);
    final byte[] ciphertext = HexCodec.decode(ciphertextHex);
    final long seed = keyAgreement.seedFromPoint(shared);
    return TextCodec.decode(LcgKeystream.apply(seed, ciphertext));
  }

  /**
   * Decrypts with C1 given in its {@code "x,y"} text form.
   *
   * @param ciphertextHex the ciphertext as hex
   * @param c1Text        C1 as "x,y"
   * @param privateScalar d in [1, n-1]
   * @return the plaintext
   * @throws MalformedPointInputException if C1 cannot be parsed
   */
  public String decrypt(final String ciphertextHex, final String c1Text, final BigInteger privateScalar) {
    return decrypt(ciphertextHex, PointCodec.parse(c1Text), privateScalar);
  }

  /**
   * Decrypts an {@link EncryptedMessage}.
   *
   * @param message       the message
   * @param privateScalar d in [1, n-1]
   * @return the plaintext
   */
  public String decrypt(final EncryptedMessage message, final BigInteger privateScalar) {
    return decrypt(message.ciphertextHex(), message.c1(), privateScalar);
  }
}
