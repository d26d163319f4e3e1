package com.hal9001.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted adaptive hashing of user secrets. Each hash embeds its own salt and cost, so
 * hashing the same secret twice yields different strings that both verify.
 * bcrypt reads at most {@value #MAX_SECRET_BYTES} bytes of input, so longer secrets are
 * refused on hash and never verify.
 */
@Component
public class CredentialHasher {

    public static final int MAX_SECRET_BYTES = 72;

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;

    public CredentialHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        if (exceedsLimit(secret)) {
            throw new IllegalArgumentException("secret must be at most " + MAX_SECRET_BYTES + " bytes in UTF-8");
        }
        return passwordEncoder.encode(secret);
    }

    /**
     * @throws MalformedHashException when {@code storedHash} is not a bcrypt hash
     */
    public boolean verify(String secret, String storedHash) {
        if (storedHash == null || !BCRYPT_PATTERN.matcher(storedHash).matches()) {
            throw new MalformedHashException("Stored credential hash is not a recognised bcrypt hash");
        }
        if (secret == null || exceedsLimit(secret)) {
            return false;
        }
        return passwordEncoder.matches(secret, storedHash);
    }

    public static boolean exceedsLimit(String secret) {
        return secret.getBytes(StandardCharsets.UTF_8).length > MAX_SECRET_BYTES;
    }
}
