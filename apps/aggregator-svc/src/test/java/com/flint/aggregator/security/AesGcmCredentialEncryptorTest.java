package com.flint.aggregator.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;
import org.junit.jupiter.api.Test;

class AesGcmCredentialEncryptorTest {

    private static final String KEY = Base64.getEncoder().encodeToString("0123456789abcdef0123456789abcdef".getBytes());

    @Test
    void decryptsWhatItEncrypted() {
        AesGcmCredentialEncryptor encryptor = new AesGcmCredentialEncryptor(KEY);

        String sealed = encryptor.encrypt("token_abc");

        assertThat(sealed).doesNotContain("token_abc");
        assertThat(encryptor.decrypt(sealed)).isEqualTo("token_abc");
    }

    @Test
    void freshIvEveryTime() {
        AesGcmCredentialEncryptor encryptor = new AesGcmCredentialEncryptor(KEY);

        assertThat(encryptor.encrypt("token_abc")).isNotEqualTo(encryptor.encrypt("token_abc"));
    }

    @Test
    void anotherKeyCannotDecrypt() {
        String sealed = new AesGcmCredentialEncryptor(KEY).encrypt("token_abc");
        AesGcmCredentialEncryptor other = new AesGcmCredentialEncryptor("");

        assertThatThrownBy(() -> other.decrypt(sealed)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsWrongKeyLengthAndTruncatedInput() {
        assertThatThrownBy(() -> new AesGcmCredentialEncryptor(Base64.getEncoder().encodeToString(new byte[16])))
                .isInstanceOf(IllegalArgumentException.class);
        AesGcmCredentialEncryptor encryptor = new AesGcmCredentialEncryptor(KEY);
        assertThatThrownBy(() -> encryptor.decrypt(Base64.getEncoder().encodeToString(new byte[8])))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> encryptor.encrypt(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
