package com.hal9001.backend.modules.auth.application;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

import com.hal9001.backend.global.error.ProblemException;
import com.hal9001.backend.modules.auth.domain.User;
import com.hal9001.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.hal9001.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * User provisioning and password changes. This is the only writer of {@code credential_hash}.
 */
@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    static final String USER_ID_PREFIX = "usr_";
    static final int MIN_PASSWORD_LENGTH = 8;
    private static final int GENERATED_ID_BYTES = 6;
    private static final String EMAIL_CONSTRAINT = "uq_users_email";

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final SecureRandom random = new SecureRandom();

    public UserAccountService(UserRepository userRepository, CredentialHasher credentialHasher) {
        this.userRepository = userRepository;
        this.credentialHasher = credentialHasher;
    }

    @Transactional(readOnly = true)
    public List<UserProfileResponse> listUsers() {
        return userRepository.findAllByOrderByNameAsc().stream()
                .map(UserProfileResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(String userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user_not_found", "User not found: " + userId));
        return UserProfileResponse.from(user);
    }

    @Transactional
    public UserProfileResponse provision(ProvisionUserCommand command) {
        requireText(command.name(), "name");
        requireText(command.role(), "role");
        requireText(command.email(), "email");
        requirePassword(command.password(), "password");

        String email = command.email().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw emailTaken(email);
        }

        String id = (command.id() == null || command.id().isBlank()) ? generateId() : command.id().trim();
        if (userRepository.existsById(id)) {
            throw idTaken(id);
        }

        User user = new User();
        user.setId(id);
        user.setName(command.name().trim());
        user.setRole(command.role().trim());
        user.setEmail(email);
        user.setCredentialHash(credentialHasher.hash(command.password()));
        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent provisioning won the race between the checks above and the insert
            log.warn("Provisioning {} lost a uniqueness race: {}", id, ex.getMostSpecificCause().getMessage());
            throw violatesEmailConstraint(ex) ? emailTaken(email) : idTaken(id);
        }

        log.info("Provisioned user {} ({})", id, user.getRole());
        return UserProfileResponse.from(user);
    }

    @Transactional(noRollbackFor = InvalidCredentialsException.class)
    public void changePassword(String userId, String currentPassword, String newPassword) {
        requirePassword(newPassword, "new_password");

        User user = userRepository.findById(userId)
                .orElseThrow(UnauthenticatedException::new);

        if (!credentialHasher.verify(currentPassword, user.getCredentialHash())) {
            throw new InvalidCredentialsException();
        }

        user.setCredentialHash(credentialHasher.hash(newPassword));
        log.info("Password changed for user {}", userId);
    }

    private static boolean violatesEmailConstraint(DataIntegrityViolationException ex) {
        String message = ex.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(EMAIL_CONSTRAINT);
    }

    private static ProblemException emailTaken(String email) {
        return new ProblemException(HttpStatus.CONFLICT, "user_email_taken", "Email already registered: " + email);
    }

    private static ProblemException idTaken(String id) {
        return new ProblemException(HttpStatus.CONFLICT, "user_id_taken", "User id already exists: " + id);
    }

    private String generateId() {
        byte[] bytes = new byte[GENERATED_ID_BYTES];
        String candidate;
        do {
            random.nextBytes(bytes);
            candidate = USER_ID_PREFIX + HexFormat.of().formatHex(bytes);
        } while (userRepository.existsById(candidate));
        return candidate;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "validation_error", field + " is required");
        }
    }

    private static void requirePassword(String value, String field) {
        if (value == null || value.length() < MIN_PASSWORD_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "validation_error",
                    field + " must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (CredentialHasher.exceedsLimit(value)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "validation_error",
                    field + " must be at most " + CredentialHasher.MAX_SECRET_BYTES + " bytes in UTF-8");
        }
    }
}
