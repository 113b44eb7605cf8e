package com.codeheadsystems.provision.crypto.envelope;

/**
 * A credential at rest: the ciphertext under a per-secret data key, and that data key
 * wrapped under a master key. Byte fields are standard base64. Stores must persist all
 * eight fields verbatim.
 *
 * @param ciphertext     credential ciphertext
 * @param nonce          12-byte nonce of the credential encryption
 * @param tag            16-byte tag of the credential encryption
 * @param wrappedDataKey the data key encrypted under the master key
 * @param dataKeyNonce   12-byte nonce of the data key wrap
 * @param dataKeyTag     16-byte tag of the data key wrap
 * @param keyVersion     version, strictly increasing across rotations
 * @param masterKeyId    id of the master key that wrapped the data key
 */
public record StoredSecret(String ciphertext,
                           String nonce,
                           String tag,
                           String wrappedDataKey,
                           String dataKeyNonce,
                           String dataKeyTag,
                           int keyVersion,
                           String masterKeyId) {
}
