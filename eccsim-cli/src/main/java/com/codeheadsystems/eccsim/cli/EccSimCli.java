package com.codeheadsystems.eccsim.cli;

import com.codeheadsystems.eccsim.agreement.KeyAgreement;
import com.codeheadsystems.eccsim.agreement.KeyPair;
import com.codeheadsystems.eccsim.codec.PointCodec;
import com.codeheadsystems.eccsim.config.EccSimConfig;
import com.codeheadsystems.eccsim.curve.CurveEnumerator;
import com.codeheadsystems.eccsim.curve.CurveParams;
import com.codeheadsystems.eccsim.curve.CurveSummary;
import com.codeheadsystems.eccsim.curve.Point;
import com.codeheadsystems.eccsim.ecies.EciesManager;
import com.codeheadsystems.eccsim.ecies.EncryptedMessage;
import com.codeheadsystems.eccsim.exceptions.EccSimException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line driver that plays both ends of the toy ECIES channel.
 *
 * <pre>
 * Usage:
 *   eccsim [--d &lt;scalar&gt;] [--k &lt;scalar&gt;] [--json] encrypt &lt;message&gt;
 *   eccsim --d &lt;scalar&gt; decrypt &lt;c1 "x,y"&gt; &lt;hex&gt;
 *   eccsim points
 *   eccsim summary
 * </pre>
 *
 * <p>Without {@code --d} or {@code --k} the scalars are drawn at random. Exit code is 0 on
 * success, 1 on a usage error and 2 when the simulator rejects the input.
 */
public class EccSimCli {

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_REJECTED = 2;

  private static final Logger log = LoggerFactory.getLogger(EccSimCli.class);

  private final EccSimConfig config;
  private final ObjectMapper objectMapper;
  private final PrintStream out;
  private final PrintStream err;

  /**
   * Instantiates a new Ecc sim cli.
   *
   * @param config       the config
   * @param objectMapper the object mapper
   * @param out          standard output
   * @param err          standard error
   */
  public EccSimCli(final EccSimConfig config,
                   final ObjectMapper objectMapper,
                   final PrintStream out,
                   final PrintStream err) {
    this.config = config;
    this.objectMapper = objectMapper;
    this.out = out;
    this.err = err;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int code = new EccSimCli(EccSimConfig.DEFAULT, new ObjectMapper(), System.out, System.err).run(args);
    System.exit(code);
  }

  /**
   * Runs one command.
   *
   * @param args the arguments
   * @return the exit code
   */
  public int run(final String[] args) {
    BigInteger d = null;
    BigInteger k = null;
    boolean json = false;
    final List<String> positional = new ArrayList<>();

    try {
      for (int i = 0; i < args.length; i++) {
        if ("--d".equals(args[i]) && i + 1 < args.length) {
          d = new BigInteger(args[++i]);
        } else if ("--k".equals(args[i]) && i + 1 < args.length) {
          k = new BigInteger(args[++i]);
        } else if ("--json".equals(args[i])) {
          json = true;
        } else if (args[i].startsWith("--")) {
          return usage("Unknown option: " + args[i]);
        } else {
          positional.add(args[i]);
        }
      }
    } catch (NumberFormatException e) {
      return usage("Scalars must be decimal integers");
    }

    if (positional.isEmpty()) {
      return usage(null);
    }

    try {
      switch (positional.get(0)) {
        case "encrypt":
          if (positional.size() != 2) {
            return usage("encrypt takes exactly one message argument");
          }
          return encrypt(positional.get(1), d, k, json);
        case "decrypt":
          if (positional.size() != 3 || d == null) {
            return usage("decrypt needs --d and the arguments <c1> <hex>");
          }
          return decrypt(positional.get(1), positional.get(2), d);
        case "points":
          return points();
        case "summary":
          return summary();
        default:
          return usage("Unknown command: " + positional.get(0));
      }
    } catch (EccSimException e) {
      log.debug("Command rejected", e);
      err.println("Error: " + e.getMessage());
      return EXIT_REJECTED;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize encrypted message", e);
    }
  }

  private int encrypt(final String message, final BigInteger d, final BigInteger k, final boolean json)
      throws JsonProcessingException {
    final EciesManager manager = new EciesManager(config);
    final KeyAgreement keyAgreement = manager.keyAgreement();
    final KeyPair recipient = d == null ? keyAgreement.generateKeyPair() : keyAgreement.keyPair(d);
    final BigInteger ephemeral = k == null ? keyAgreement.generatePrivateScalar() : k;
    final EncryptedMessage encrypted = manager.encrypt(message, ephemeral, recipient.publicPoint());

    if (json) {
      out.println(objectMapper.writeValueAsString(EncryptedMessageView.of(encrypted)));
      return EXIT_OK;
    }
    final Point shared = keyAgreement.deriveSharedSecret(ephemeral, recipient.publicPoint());
    out.println("d          : " + recipient.privateScalar());
    out.println("Q = d*G    : " + PointCodec.format(recipient.publicPoint()));
    out.println("k          : " + ephemeral);
    out.println("C1 = k*G   : " + PointCodec.format(encrypted.c1()));
    out.println("k*Q        : " + PointCodec.format(shared));
    out.println("ciphertext : " + encrypted.ciphertextHex());
    out.println("decrypted  : " + manager.decrypt(encrypted, recipient.privateScalar()));
    return EXIT_OK;
  }

  private int decrypt(final String c1Text, final String hex, final BigInteger d) {
    final EciesManager manager = new EciesManager(config);
    out.println(manager.decrypt(hex, c1Text, d));
    return EXIT_OK;
  }

  private int points() {
    for (Point.Affine point : CurveEnumerator.enumeratePoints(config.curveParams())) {
      out.println(PointCodec.format(point));
    }
    return EXIT_OK;
  }

  private int summary() {
    final CurveParams params = config.curveParams();
    final CurveSummary summary = CurveEnumerator.summarize(params);
    out.println("curve           : y^2 = x^3 + " + params.a() + "x + " + params.b() + " mod " + params.p());
    out.println("points on curve : " + summary.pointCount());
    out.println("order of G      : " + summary.orderOfG());
    out.println("prime p         : " + summary.p());
    return EXIT_OK;
  }

  private int usage(final String problem) {
    if (problem != null) {
      err.println(problem);
      err.println();
    }
    err.println("Usage:");
    err.println("  eccsim [--d <scalar>] [--k <scalar>] [--json] encrypt <message>");
    err.println("  eccsim --d <scalar> decrypt <c1 \"x,y\"> <hex>");
    err.println("  eccsim points");
    err.println("  eccsim summary");
    err.println();
    err.println("Toy curve only. Not secure.");
    return EXIT_USAGE;
  }
}
