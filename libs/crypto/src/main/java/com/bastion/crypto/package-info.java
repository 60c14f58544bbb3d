/**
 * Deterministic, queryable field encryption.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.bastion.crypto.KeyMaterial}: PBKDF2 key derivation from a configured secret
 *   <li>{@link com.bastion.crypto.DeterministicCipher}: AES-256-CTR with an HMAC-derived IV
 *   <li>{@link com.bastion.crypto.EncryptedFieldCodec}: encode-on-write / decode-on-read of
 *       designated fields, identity when disabled
 * </ul>
 */
package com.bastion.crypto;
