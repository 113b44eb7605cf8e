package com.codeheadsystems.provision.crypto.envelope;

/**
 * Source of the durable master key, consulted once at process start.
 */
@FunctionalInterface
public interface MasterKeyProvider {

  /**
   * Loads the master key.
   *
   * @return the master key
   * @throws IllegalStateException if the key is missing or malformed
   */
  MasterKey load();
}
