package com.bastion.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Base64;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DeterministicCipher}: round-trip, determinism, distinctness and the
 * {@code base64(iv || ciphertext)} layout.
 */
@DisplayName("DeterministicCipher")
class DeterministicCipherTest {

    private static DeterministicCipher cipher;

    @BeforeAll
    static void deriveKey() {
        cipher = new DeterministicCipher(KeyMaterial.derive("unit-test-secret"));
    }

    @Nested
    @DisplayName("round-trip")
    class RoundTrip {

        @Test
        @DisplayName("decrypt(encrypt(p)) == p for ASCII, unicode and empty input")
        void roundTrips() {
            for (String p : new String[] {"alice", "manage_users", "", "Zoë 日本語 🚀", "x".repeat(1000)}) {
                assertThat(cipher.decrypt(cipher.encrypt(p))).isEqualTo(p);
            }
        }

        @Test
        @DisplayName("round-trips many random strings")
        void roundTripsRandomStrings() {
            Random random = new Random(42);
            for (int i = 0; i < 500; i++) {
                String p = randomString(random, 1 + random.nextInt(40));
                assertThat(cipher.decrypt(cipher.encrypt(p))).isEqualTo(p);
            }
        }
    }

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @Test
        @DisplayName("same plaintext yields the same ciphertext")
        void samePlaintextSameCiphertext() {
            assertThat(cipher.encrypt("alice")).isEqualTo(cipher.encrypt("alice"));
        }

        @Test
        @DisplayName("independent instances over the same secret agree")
        void independentInstancesAgree() {
            var other = new DeterministicCipher(KeyMaterial.derive("unit-test-secret"));
            assertThat(other.encrypt("manage_users")).isEqualTo(cipher.encrypt("manage_users"));
        }
    }

    @Nested
    @DisplayName("distinctness")
    class Distinctness {

        @Test
        @DisplayName("distinct short strings never collide")
        void distinctInputsDistinctOutputs() {
            Set<String> plaintexts = new HashSet<>();
            Set<String> ciphertexts = new HashSet<>();
            Random random = new Random(7);
            while (plaintexts.size() < 2000) {
                String p = randomString(random, 1 + random.nextInt(6));
                if (plaintexts.add(p)) {
                    ciphertexts.add(cipher.encrypt(p));
                }
            }
            assertThat(ciphertexts).hasSameSizeAs(plaintexts);
        }

        @Test
        @DisplayName("strings sharing a prefix get different IVs")
        void prefixesGetDifferentIvs() {
            byte[] a = Base64.getDecoder().decode(cipher.encrypt("user1"));
            byte[] b = Base64.getDecoder().decode(cipher.encrypt("user2"));
            assertThat(Arrays.copyOf(a, 16)).isNotEqualTo(Arrays.copyOf(b, 16));
        }
    }

    @Nested
    @DisplayName("format")
    class Format {

        @Test
        @DisplayName("output is base64 of a 16-byte IV plus one byte per plaintext byte")
        void ivPrefixLayout() {
            byte[] raw = Base64.getDecoder().decode(cipher.encrypt("alice"));
            assertThat(raw).hasSize(DeterministicCipher.IV_LENGTH + "alice".length());
        }

        @Test
        @DisplayName("rejects input that is not base64")
        void rejectsNonBase64() {
            assertThatThrownBy(() -> cipher.decrypt("not base64 !!"))
                    .isInstanceOf(CipherException.class)
                    .hasMessageContaining("base64");
        }

        @Test
        @DisplayName("rejects input shorter than the IV")
        void rejectsShortInput() {
            String tooShort = Base64.getEncoder().encodeToString(new byte[8]);
            assertThatThrownBy(() -> cipher.decrypt(tooShort))
                    .isInstanceOf(CipherException.class)
                    .hasMessageContaining("IV");
        }
    }

    @Test
    @DisplayName("a wrong key yields different text, not an exception")
    void wrongKeyYieldsGarbage() {
        var other = new DeterministicCipher(KeyMaterial.derive("another-secret"));
        String stored = cipher.encrypt("alice");
        assertThat(other.decrypt(stored)).isNotEqualTo("alice");
    }

    private static String randomString(Random random, int length) {
        String alphabet = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789_-";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
