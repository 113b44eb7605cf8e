package com.codeheadsystems.provision.server.model;

import java.util.Map;

/**
 * Plaintext credentials of one user, by provider, plus how many stored records were
 * attempted and how many could not be decrypted.
 */
public record DecryptedCredentials(Map<String, String> secrets, int attempted, int failed) {

  @Override
  public String toString() {
    return "DecryptedCredentials{providers=" + secrets.keySet() + ", attempted=" + attempted + ", failed=" + failed + "}";
  }
}
