package com.codeheadsystems.provision.crypto.exchange;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Domain parameters of the curve used for ephemeral key agreement.
 */
public record Curve(ECDomainParameters params, ECCurve curve, ECPoint g, BigInteger n, int fieldLength) {

  public static final Curve P256_CURVE = loadCurve("P-256");

  public Curve(ECDomainParameters params) {
    this(params, params.getCurve(), params.getG(), params.getN(), (params.getCurve().getFieldSize() + 7) / 8);
  }

  /**
   * Length of an uncompressed SEC1 point: the 0x04 prefix then both coordinates.
   *
   * @return the length in bytes
   */
  public int uncompressedPointLength() {
    return 1 + 2 * fieldLength;
  }

  private static Curve loadCurve(String name) {
    X9ECParameters params = CustomNamedCurves.getByName(name);
    if (params == null) {
      throw new IllegalArgumentException("Unsupported curve: " + name);
    }
    return new Curve(new ECDomainParameters(params.getCurve(), params.getG(), params.getN(), params.getH()));
  }
}
