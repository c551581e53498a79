package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.counter.CounterAllocator;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.ConflictException;
import com.openforge.taskmanager.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * User records and password verification.
 *
 * create() opens no transaction of its own: the id comes from
 * {@link CounterAllocator} first, and saveAndFlush runs the INSERT in the
 * repository's transaction.
 *
 * The digest stays on the entity; outward-facing views are built from
 * {@link com.openforge.taskmanager.auth.dto.UserResponse}, which has no field for it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    private final UserRepository   userRepository;
    private final CounterAllocator counterAllocator;
    private final PasswordEncoder  passwordEncoder;
    private final Clock            clock;

    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    @Transactional(readOnly = true)
    public Optional<User> findByUsername(String username) {
        return userRepository.findByUsername(username);
    }

    @Transactional(readOnly = true)
    public Optional<User> findById(long id) {
        return userRepository.findById(id);
    }

    /**
     * Persist a new active, non-admin user.
     *
     * @throws ConflictException when the unique index on email or username
     *         rejects the row, including when a concurrent registration won
     */
    public User create(String email, String username, String fullName, String password) {
        long id = counterAllocator.nextId(CounterAllocator.USERS);

        User user = new User();
        user.setId(id);
        user.setEmail(email);
        user.setUsername(username);
        user.setFullName(fullName);
        user.setPasswordDigest(passwordEncoder.encode(password));
        user.setActive(true);
        user.setAdmin(false);
        user.setCreatedAt(LocalDateTime.now(clock));
        user.setLastLogin(null);

        try {
            User saved = userRepository.saveAndFlush(user);
            log.info("[Auth] New user registered: id={}, username={}", saved.getId(), saved.getUsername());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("[Auth] Registration rejected by unique index: email={}, username={}", email, username);
            throw new ConflictException("Email or username already registered");
        }
    }

    /**
     * Returns the user when the email exists and the password matches, and
     * records the login time. Empty otherwise; callers cannot tell which check failed.
     */
    @Transactional
    public Optional<User> verifyCredentials(String email, String password) {
        Optional<User> found = userRepository.findByEmail(email);
        if (found.isEmpty() || !passwordEncoder.matches(password, found.get().getPasswordDigest())) {
            return Optional.empty();
        }
        User user = found.get();
        user.setLastLogin(LocalDateTime.now(clock));
        return Optional.of(user);
    }
}
