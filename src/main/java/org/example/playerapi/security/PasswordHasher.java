package org.example.playerapi.security;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted one-way hashing of user passwords.
 */
@Component
public class PasswordHasher {

    @Autowired
    private PasswordEncoder passwordEncoder;

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    /**
     * @return {@code false} for a wrong password and for a missing or unreadable digest
     */
    public boolean verify(String plaintext, String digest) {
        if (plaintext == null || digest == null || digest.isEmpty()) {
            return false;
        }
        return passwordEncoder.matches(plaintext, digest);
    }
}
