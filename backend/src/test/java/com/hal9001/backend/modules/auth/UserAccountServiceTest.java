package com.hal9001.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;

import com.hal9001.backend.global.error.ProblemException;
import com.hal9001.backend.modules.auth.application.CredentialHasher;
import com.hal9001.backend.modules.auth.application.ProvisionUserCommand;
import com.hal9001.backend.modules.auth.application.UserAccountService;
import com.hal9001.backend.modules.auth.domain.User;
import com.hal9001.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.hal9001.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class UserAccountServiceTest {

    @Mock
    UserRepository userRepository;

    private UserAccountService userAccountService;

    @BeforeEach
    void setUp() {
        userAccountService = new UserAccountService(userRepository, new CredentialHasher(new BCryptPasswordEncoder(4)));
    }

    private static ProvisionUserCommand command(String id, String email) {
        return new ProvisionUserCommand(id, "Heywood Floyd", "Data Viewer", email, "monolith-tma1");
    }

    @Test
    void provisionStoresLowerCasedEmail() {
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        UserProfileResponse profile = userAccountService.provision(command("usr_100", "  H.Floyd@Clavius.MOON "));

        assertThat(profile.email()).isEqualTo("h.floyd@clavius.moon");
        verify(userRepository).existsByEmailIgnoreCase("h.floyd@clavius.moon");
    }

    @Test
    void concurrentDuplicateEmailIsConflictNotStorageError() {
        when(userRepository.saveAndFlush(any(User.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("duplicate key value violates unique constraint \"uq_users_email\"")));

        assertThatThrownBy(() -> userAccountService.provision(command("usr_100", "h.floyd@clavius.moon")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("user_email_taken");
                });
    }

    @Test
    void concurrentDuplicateIdIsConflict() {
        when(userRepository.saveAndFlush(any(User.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("duplicate key value violates unique constraint \"pk_users\"")));

        assertThatThrownBy(() -> userAccountService.provision(command("usr_100", "h.floyd@clavius.moon")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("user_id_taken");
                });
    }

    @Test
    void passwordOverBcryptByteLimitIsRejectedBeforeAnyLookup() {
        ProvisionUserCommand longSecret = new ProvisionUserCommand(null, "Long", "Data Viewer",
                "long@discovery.co", "한".repeat(24) + "ab");

        assertThatThrownBy(() -> userAccountService.provision(longSecret))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("validation_error");
                });
        verify(userRepository, never()).existsByEmailIgnoreCase(anyString());
    }
}
