package com.cred.freestyle.commerce.config;

import com.cred.freestyle.commerce.domain.model.Admin;
import com.cred.freestyle.commerce.repository.AdminRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the first SUPER_ADMIN account on startup when
 * {@code commerce.admin.bootstrap.enabled=true} and the username is not taken yet.
 *
 * @author Commerce Platform Team
 */
@Component
@ConditionalOnProperty(name = "commerce.admin.bootstrap.enabled", havingValue = "true")
public class AdminAccountInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final AdminRepository adminRepository;
    private final PasswordEncoder passwordEncoder;
    private final String username;
    private final String email;
    private final String password;

    public AdminAccountInitializer(
            AdminRepository adminRepository,
            PasswordEncoder passwordEncoder,
            @Value("${commerce.admin.bootstrap.username:admin}") String username,
            @Value("${commerce.admin.bootstrap.email:admin@example.com}") String email,
            @Value("${commerce.admin.bootstrap.password:}") String password
    ) {
        this.adminRepository = adminRepository;
        this.passwordEncoder = passwordEncoder;
        this.username = username;
        this.email = email;
        this.password = password;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (password == null || password.isBlank()) {
            throw new IllegalStateException("commerce.admin.bootstrap.password must be set when bootstrap is enabled");
        }
        if (adminRepository.existsByUsername(username)) {
            logger.info("Bootstrap admin '{}' already exists", username);
            return;
        }

        Admin admin = Admin.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordEncoder.encode(password))
                .role(Admin.AdminRole.SUPER_ADMIN)
                .build();
        adminRepository.save(admin);
        logger.info("Created bootstrap admin '{}'", username);
    }
}
