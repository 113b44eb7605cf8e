package com.codeheadsystems.provision.server.manager;

import com.codeheadsystems.provision.crypto.common.ByteUtils;
import com.codeheadsystems.provision.crypto.envelope.StoredSecret;
import com.codeheadsystems.provision.server.model.ProviderSecret;
import com.codeheadsystems.provision.server.store.SecretStore;
import java.time.Instant;

final class Tampering {

  private Tampering() {
  }

  /**
   * Flips one bit of the body tag of a stored credential in place.
   */
  static ProviderSecret corrupt(SecretStore store, String userId, String provider) {
    ProviderSecret current = store.load(userId, provider).orElseThrow();
    StoredSecret s = current.secret();
    byte[] tag = ByteUtils.fromBase64(s.tag());
    tag[0] ^= 0x01;
    StoredSecret bad = new StoredSecret(s.ciphertext(), s.nonce(), ByteUtils.toBase64(tag), s.wrappedDataKey(),
        s.dataKeyNonce(), s.dataKeyTag(), s.keyVersion(), s.masterKeyId());
    ProviderSecret corrupted = current.withSecret(bad, Instant.EPOCH);
    if (!store.replace(current, corrupted)) {
      throw new IllegalStateException("Could not corrupt " + provider);
    }
    return corrupted;
  }
}
