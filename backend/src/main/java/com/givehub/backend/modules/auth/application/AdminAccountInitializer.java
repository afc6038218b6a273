package com.givehub.backend.modules.auth.application;

import java.util.Locale;

import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Creates the administrator account on startup when bootstrap credentials are configured and
 * the email is not yet registered.
 */
@Component
public class AdminAccountInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final UnitOfWork unitOfWork;
    private final String email;
    private final String password;
    private final String name;

    public AdminAccountInitializer(
            UserAccountRepository userAccountRepository,
            PasswordEncoder passwordEncoder,
            UnitOfWork unitOfWork,
            @Value("${app.bootstrap.admin.email:}") String email,
            @Value("${app.bootstrap.admin.password:}") String password,
            @Value("${app.bootstrap.admin.name:Administrator}") String name
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
        this.unitOfWork = unitOfWork;
        this.email = email;
        this.password = password;
        this.name = name;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            log.debug("Admin bootstrap skipped: credentials not configured");
            return;
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        boolean created = unitOfWork.execute("auth.bootstrapAdmin", () -> {
            if (userAccountRepository.existsByEmailIgnoreCase(normalized)) {
                return false;
            }
            UserAccount admin = new UserAccount();
            admin.setName(name);
            admin.setEmail(normalized);
            admin.setPasswordHash(passwordEncoder.encode(password));
            admin.setRole(UserRole.ADMIN);
            userAccountRepository.save(admin);
            return true;
        });
        if (created) {
            log.info("Created bootstrap admin account email={}", normalized);
        } else {
            log.info("Admin bootstrap skipped: account already exists email={}", normalized);
        }
    }
}
