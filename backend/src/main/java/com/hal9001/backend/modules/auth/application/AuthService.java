package com.hal9001.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.hal9001.backend.modules.auth.application.TokenService.InvalidTokenException;
import com.hal9001.backend.modules.auth.application.TokenService.IssuedToken;
import com.hal9001.backend.modules.auth.domain.User;
import com.hal9001.backend.modules.auth.infrastructure.persistence.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Login and per-request bearer checks. Never consults the permission matrix.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final TokenService tokenService;
    private final String dummyHash;

    public AuthService(UserRepository userRepository, CredentialHasher credentialHasher, TokenService tokenService) {
        this.userRepository = userRepository;
        this.credentialHasher = credentialHasher;
        this.tokenService = tokenService;
        this.dummyHash = credentialHasher.hash(UUID.randomUUID().toString());
    }

    @Transactional(readOnly = true, noRollbackFor = InvalidCredentialsException.class)
    public IssuedToken authenticate(String email, String secret) {
        Optional<User> user = (email == null || email.isBlank())
                ? Optional.empty()
                : userRepository.findByEmailIgnoreCase(email.trim());

        if (user.isEmpty()) {
            // keep the unknown-user path as slow as a real mismatch
            credentialHasher.verify(secret, dummyHash);
            throw new InvalidCredentialsException();
        }

        User account = user.get();
        if (!credentialHasher.verify(secret, account.getCredentialHash())) {
            throw new InvalidCredentialsException();
        }

        IssuedToken token = tokenService.issue(account.getId());
        log.debug("Issued access token for user {} expiring at {}", account.getId(), token.expiresAt());
        return token;
    }

    /**
     * @return the subject id of a valid bearer token
     * @throws UnauthenticatedException for any invalid, tampered or expired token
     */
    public String authorize(String token) {
        try {
            return tokenService.validate(token);
        } catch (InvalidTokenException ex) {
            throw new UnauthenticatedException(ex);
        }
    }
}
