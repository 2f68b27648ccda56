package com.library.management.service;

import com.library.management.dto.request.ChangePasswordRequest;
import com.library.management.dto.request.RegisterUserRequest;
import com.library.management.dto.request.UpdateUserRequest;
import com.library.management.dto.response.UserResponse;
import com.library.management.entity.User;
import com.library.management.entity.UserRole;
import com.library.management.exception.DuplicateValueException;
import com.library.management.exception.InvalidCredentialsException;
import com.library.management.exception.ResourceInUseException;
import com.library.management.exception.ResourceNotFoundException;
import com.library.management.mapper.UserMapper;
import com.library.management.repository.TransactionRepository;
import com.library.management.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final TransactionRepository transactionRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional
    public UserResponse register(RegisterUserRequest request) {
        return UserMapper.toResponse(create(request, UserRole.REGULAR));
    }

    @Transactional
    public User create(RegisterUserRequest request, UserRole role) {
        if (userRepository.existsByUsername(request.username())) {
            throw new DuplicateValueException("Username", request.username());
        }
        if (userRepository.existsByEmail(request.email())) {
            throw new DuplicateValueException("Email", request.email());
        }

        User user = new User();
        user.setUsername(request.username());
        user.setEmail(request.email());
        user.setFullName(request.fullName());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(role);
        user.setActive(true);

        User saved = userRepository.save(user);
        log.info("Created {} account '{}' with id {}", role, saved.getUsername(), saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return userRepository.existsByUsername(username);
    }

    @Transactional(readOnly = true)
    public UserResponse findById(Long id) {
        return UserMapper.toResponse(load(id));
    }

    @Transactional(readOnly = true)
    public Page<UserResponse> findAll(UserRole role, Boolean active, Pageable pageable) {
        Specification<User> spec = Specification.where(null);

        if (role != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("role"), role));
        }
        if (active != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("active"), active));
        }

        return userRepository.findAll(spec, pageable)
            .map(UserMapper::toResponse);
    }

    /** Expects privileged fields to be filtered by the caller's access layer already. */
    @Transactional
    public UserResponse update(Long id, UpdateUserRequest request) {
        User user = load(id);

        if (request.email() != null && !request.email().equals(user.getEmail())
                && userRepository.existsByEmailAndIdNot(request.email(), id)) {
            throw new DuplicateValueException("Email", request.email());
        }

        UserMapper.updateEntity(user, request);
        return UserMapper.toResponse(userRepository.saveAndFlush(user));
    }

    /**
     * @param verifyCurrent {@code false} only when an admin resets the password, in which case
     *                      {@code currentPassword} is not checked
     */
    @Transactional
    public void changePassword(Long id, ChangePasswordRequest request, boolean verifyCurrent) {
        User user = load(id);

        if (verifyCurrent && (request.currentPassword() == null
                || !passwordEncoder.matches(request.currentPassword(), user.getPasswordHash()))) {
            throw new InvalidCredentialsException();
        }

        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        userRepository.save(user);
        log.info("Password changed for user {}", id);
    }

    @Transactional
    public UserResponse changeRole(Long id, UserRole role) {
        User user = load(id);
        user.setRole(role);
        log.info("User {} is now {}", id, role);
        return UserMapper.toResponse(userRepository.saveAndFlush(user));
    }

    @Transactional
    public void delete(Long id) {
        User user = load(id);

        if (transactionRepository.existsByUserId(id)) {
            throw new ResourceInUseException("Cannot delete a user with borrowing history");
        }

        userRepository.delete(user);
    }

    private User load(Long id) {
        return userRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("User", id));
    }
}
