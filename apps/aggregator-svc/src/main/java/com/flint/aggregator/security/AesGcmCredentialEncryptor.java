package com.flint.aggregator.security;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM for provider credentials at rest. Output is Base64 of the 12-byte IV followed by the
 * ciphertext and tag.
 */
@Component
public class AesGcmCredentialEncryptor implements CredentialEncryptor {

    private static final Logger log = LoggerFactory.getLogger(AesGcmCredentialEncryptor.class);
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH_BITS = 128;
    private static final int IV_LENGTH_BYTES = 12;
    private static final int KEY_LENGTH_BYTES = 32;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public AesGcmCredentialEncryptor(@Value("${FLINT_CREDENTIAL_KEY:}") String keyMaterial) {
        byte[] keyBytes;
        if (keyMaterial != null && !keyMaterial.isBlank()) {
            keyBytes = Base64.getDecoder().decode(keyMaterial.trim());
            if (keyBytes.length != KEY_LENGTH_BYTES) {
                throw new IllegalArgumentException("FLINT_CREDENTIAL_KEY must decode to " + KEY_LENGTH_BYTES + " bytes");
            }
        } else {
            keyBytes = new byte[KEY_LENGTH_BYTES];
            secureRandom.nextBytes(keyBytes);
            log.warn("FLINT_CREDENTIAL_KEY not provided; stored provider credentials will not survive a restart");
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("Credential must not be blank");
        }
        try {
            byte[] iv = new byte[IV_LENGTH_BYTES];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(ByteBuffer.allocate(iv.length + sealed.length)
                    .put(iv)
                    .put(sealed)
                    .array());
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to encrypt provider credential", ex);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new IllegalArgumentException("Ciphertext must not be blank");
        }
        byte[] decoded = Base64.getDecoder().decode(ciphertext);
        if (decoded.length <= IV_LENGTH_BYTES) {
            throw new IllegalArgumentException("Ciphertext is too short");
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(decoded);
            byte[] iv = new byte[IV_LENGTH_BYTES];
            buffer.get(iv);
            byte[] sealed = new byte[buffer.remaining()];
            buffer.get(sealed);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to decrypt provider credential", ex);
        }
    }
}
