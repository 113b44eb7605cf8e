package com.codeheadsystems.provision.server.exception;

import com.codeheadsystems.provision.crypto.exception.FreshnessException;
import com.codeheadsystems.provision.crypto.exception.IntegrityException;
import com.codeheadsystems.provision.crypto.exception.InvalidKeyFormatException;
import com.codeheadsystems.provision.crypto.exception.InvalidSecretException;
import com.codeheadsystems.provision.crypto.exception.ProvisionCryptoException;
import com.codeheadsystems.provision.crypto.exception.UnknownMasterKeyException;
import com.codeheadsystems.provision.crypto.exception.UnsupportedVersionException;

/**
 * Maps crypto-layer exceptions onto wire error codes. Messages are replaced with fixed
 * strings so nothing about key material or internals leaks to callers.
 */
public final class CryptoErrors {

  private CryptoErrors() {
  }

  public static ErrorCode codeFor(ProvisionCryptoException e) {
    if (e instanceof InvalidSecretException) {
      return ErrorCode.INVALID_SECRET;
    } else if (e instanceof InvalidKeyFormatException) {
      return ErrorCode.INVALID_KEY_FORMAT;
    } else if (e instanceof UnsupportedVersionException) {
      return ErrorCode.UNSUPPORTED_VERSION;
    } else if (e instanceof UnknownMasterKeyException) {
      return ErrorCode.UNKNOWN_MASTER_KEY;
    } else if (e instanceof FreshnessException) {
      return ErrorCode.PAYLOAD_EXPIRED;
    } else if (e instanceof IntegrityException) {
      return ErrorCode.INTEGRITY_FAILURE;
    }
    return ErrorCode.INTERNAL;
  }

  public static ProvisioningException translate(ProvisionCryptoException e) {
    ErrorCode code = codeFor(e);
    return new ProvisioningException(code, messageFor(code, e), e);
  }

  private static String messageFor(ErrorCode code, ProvisionCryptoException e) {
    switch (code) {
      case INVALID_SECRET:
      case INVALID_KEY_FORMAT:
      case UNSUPPORTED_VERSION:
        return e.getMessage();
      case PAYLOAD_EXPIRED:
        return "Sealed payload has expired";
      case INTEGRITY_FAILURE:
        return "Stored data failed its integrity check";
      case UNKNOWN_MASTER_KEY:
        return "Stored data references an unavailable master key";
      default:
        return "Internal error";
    }
  }
}
