package com.hal9001.backend.support;

import com.hal9001.backend.modules.auth.application.CredentialHasher;
import com.hal9001.backend.modules.auth.domain.User;
import com.hal9001.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.hal9001.backend.modules.permission.infrastructure.persistence.PermissionGrantRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "open-the-pod-bay-doors";

    private final UserRepository userRepository;
    private final PermissionGrantRepository permissionGrantRepository;
    private final CredentialHasher credentialHasher;

    public TestUserFactory(
            UserRepository userRepository,
            PermissionGrantRepository permissionGrantRepository,
            CredentialHasher credentialHasher
    ) {
        this.userRepository = userRepository;
        this.permissionGrantRepository = permissionGrantRepository;
        this.credentialHasher = credentialHasher;
    }

    public User ensureUser(String id, String name, String role, String email, String rawPassword) {
        User user = userRepository.findById(id).orElseGet(User::new);
        user.setId(id);
        user.setName(name);
        user.setRole(role);
        user.setEmail(email);
        user.setCredentialHash(credentialHasher.hash(rawPassword));
        return userRepository.save(user);
    }

    public User ensureDaveBowman() {
        return ensureUser("usr_001", "Dave Bowman", "Data Editor", "d.bowman@discovery.co", DEFAULT_PASSWORD);
    }

    public User ensureFrankPoole() {
        return ensureUser("usr_002", "Frank Poole", "Data Viewer", "f.poole@discovery.co", DEFAULT_PASSWORD);
    }

    public void deleteAll() {
        permissionGrantRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }
}
