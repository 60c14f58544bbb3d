package com.bastion.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;

/**
 * Deterministic AES-256-CTR encryption of a single text value.
 * <p>
 * The IV is the first 16 bytes of {@code HMAC-SHA256(key, plaintext)}, so equal plaintexts
 * always produce equal ciphertexts and the ciphertext can be used as an exact-match lookup
 * key. The IV is stored as a prefix: the output is {@code base64(iv || ciphertext)}.
 * <p>
 * This scheme provides confidentiality only. It does not authenticate: decrypting with the
 * wrong key returns garbage rather than failing, and equal values are visibly equal.
 * <p>
 * Instances are immutable and thread-safe; JCA objects are created per call.
 */
public final class DeterministicCipher {

    /** AES block size, and therefore IV length, in bytes. */
    public static final int IV_LENGTH = 16;

    static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String CIPHER_TRANSFORMATION = "AES/CTR/NoPadding";

    private final KeyMaterial key;

    public DeterministicCipher(KeyMaterial key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        this.key = key;
    }

    /**
     * Encrypts {@code plaintext} deterministically.
     *
     * @param plaintext text to encrypt, must not be null
     * @return {@code base64(iv || ciphertext)}
     */
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        byte[] input = plaintext.getBytes(StandardCharsets.UTF_8);
        byte[] iv = deriveIv(input);
        byte[] body = ctr(Cipher.ENCRYPT_MODE, iv, input);

        byte[] out = new byte[IV_LENGTH + body.length];
        System.arraycopy(iv, 0, out, 0, IV_LENGTH);
        System.arraycopy(body, 0, out, IV_LENGTH, body.length);
        return Base64.getEncoder().encodeToString(out);
    }

    /**
     * Decrypts a value produced by {@link #encrypt(String)}.
     *
     * @param ciphertext {@code base64(iv || ciphertext)}
     * @return the plaintext (garbage if the key differs from the encrypting key)
     * @throws CipherException if the input is not base64 or is shorter than an IV
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null) {
            throw new IllegalArgumentException("ciphertext must not be null");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new CipherException("Stored value is not valid base64", e);
        }
        if (raw.length < IV_LENGTH) {
            throw new CipherException(
                    "Stored value is %d bytes, shorter than the %d-byte IV prefix".formatted(raw.length, IV_LENGTH));
        }
        byte[] iv = Arrays.copyOfRange(raw, 0, IV_LENGTH);
        byte[] body = Arrays.copyOfRange(raw, IV_LENGTH, raw.length);
        return new String(ctr(Cipher.DECRYPT_MODE, iv, body), StandardCharsets.UTF_8);
    }

    private byte[] deriveIv(byte[] input) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key.hmacKey());
            return Arrays.copyOf(mac.doFinal(input), IV_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new CipherException("IV derivation failed", e);
        }
    }

    private byte[] ctr(int mode, byte[] iv, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            cipher.init(mode, key.aesKey(), new IvParameterSpec(iv));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new CipherException("AES-CTR operation failed", e);
        }
    }
}
