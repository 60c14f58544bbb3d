package com.bastion.crypto;

/**
 * Thrown when a value cannot be encrypted or decrypted: the stored text is not
 * base64, is too short to carry an IV, or the JCA provider rejected the operation.
 * <p>
 * A wrong key does NOT raise this exception. Counter mode has no integrity tag,
 * so decrypting with the wrong key returns unrelated text.
 */
public class CipherException extends RuntimeException {

    public CipherException(String message) {
        super(message);
    }

    public CipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
