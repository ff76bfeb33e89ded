package com.flint.aggregator.security;

public interface CredentialEncryptor {

    String encrypt(String plaintext);

    String decrypt(String ciphertext);
}
