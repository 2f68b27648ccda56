package com.library.management.config;

import com.library.management.dto.request.RegisterUserRequest;
import com.library.management.entity.UserRole;
import com.library.management.service.UserService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Seeds the first administrator from {@code library.admin.*}; a no-op once it exists. */
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrap.class);

    private final AdminBootstrapProperties properties;
    private final UserService userService;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isComplete()) {
            log.debug("library.admin.* not configured, skipping admin bootstrap");
            return;
        }
        if (userService.existsByUsername(properties.username())) {
            log.debug("Admin account '{}' already present", properties.username());
            return;
        }

        userService.create(new RegisterUserRequest(
            properties.username(), properties.email(), properties.password(), properties.fullName()),
            UserRole.ADMIN);
        log.info("Bootstrapped admin account '{}'", properties.username());
    }
}
