package com.nosota.splitpay.service;

import com.nosota.splitpay.dto.UserIdentity;
import com.nosota.splitpay.error.AuthenticationFailedException;
import com.nosota.splitpay.error.GroupNotFoundException;
import com.nosota.splitpay.error.UserAlreadyExistsException;
import com.nosota.splitpay.error.UserNotFoundException;
import com.nosota.splitpay.mapper.UserAccountMapper;
import com.nosota.splitpay.model.UserAccount;
import com.nosota.splitpay.repository.UserAccountRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Credential store: registers users and verifies their passwords.
 *
 * <p>Passwords are stored as salted BCrypt hashes. Nothing returned by this service
 * carries the hash; callers get a {@link UserIdentity}.
 */
@Service
@Validated
@Slf4j
public class CredentialService {

    public static final String DEFAULT_ROLE = "user";

    private final UserAccountRepository userAccountRepository;
    private final GroupLedgerService groupLedgerService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    /**
     * Hash checked against when the username is unknown, so both failure paths cost one hash comparison.
     */
    private final String dummyPasswordHash;

    public CredentialService(UserAccountRepository userAccountRepository,
                             GroupLedgerService groupLedgerService,
                             PasswordEncoder passwordEncoder,
                             Clock clock) {
        this.userAccountRepository = userAccountRepository;
        this.groupLedgerService = groupLedgerService;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.dummyPasswordHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Registers a user and adds them to the listed groups.
     *
     * <p>Every listed group must already exist. Joining goes through
     * {@link GroupLedgerService#addMember}, so each group's split is recomputed and a payment
     * record is created. If any group is missing, nothing is stored.
     *
     * @param username      Unique username
     * @param password      Plaintext password, only its hash is stored
     * @param initialRole   Role to assign, {@value #DEFAULT_ROLE} when null or blank
     * @param initialGroups Names of existing groups to join; blanks and duplicates are ignored
     * @return The created identity
     * @throws UserAlreadyExistsException if the username is taken
     * @throws GroupNotFoundException     if a listed group does not exist
     */
    @Transactional
    public UserIdentity register(
            @NotBlank String username,
            @NotBlank String password,
            String initialRole,
            @NotNull Collection<String> initialGroups) {

        if (userAccountRepository.existsById(username)) {
            throw new UserAlreadyExistsException("User already exists: " + username);
        }

        String role = initialRole == null || initialRole.isBlank() ? DEFAULT_ROLE : initialRole.trim();

        UserAccount account = new UserAccount();
        account.setUsername(username);
        account.setPasswordHash(passwordEncoder.encode(password));
        account.setRoles(new HashSet<>(Set.of(role)));
        account.setGroups(new HashSet<>());
        account.setCreatedAt(LocalDateTime.now(clock));

        try {
            account = userAccountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw new UserAlreadyExistsException("User already exists: " + username);
        }

        for (String groupName : normalizeGroupNames(initialGroups)) {
            groupLedgerService.addMember(groupName, username);
        }

        log.info("User registered: username={}, roles={}, groups={}", username, account.getRoles(), account.getGroups());
        return UserAccountMapper.INSTANCE.toIdentity(account);
    }

    /**
     * Verifies a username/password pair.
     *
     * @return The identity on a match
     * @throws AuthenticationFailedException on unknown user or wrong password, indistinguishably
     */
    @Transactional
    public UserIdentity authenticate(@NotNull String username, @NotNull String password) {
        Optional<UserAccount> account = userAccountRepository.findById(username);
        String hash = account.map(UserAccount::getPasswordHash).orElse(dummyPasswordHash);
        boolean matches = passwordEncoder.matches(password, hash);

        if (account.isEmpty() || !matches) {
            log.warn("Authentication failed: username={}", username);
            throw new AuthenticationFailedException("Invalid credentials");
        }

        log.debug("Authentication succeeded: username={}", username);
        return UserAccountMapper.INSTANCE.toIdentity(account.get());
    }

    /**
     * @throws UserNotFoundException if the username is not registered
     */
    @Transactional
    public UserIdentity get(@NotBlank String username) {
        return userAccountRepository.findById(username)
                .map(UserAccountMapper.INSTANCE::toIdentity)
                .orElseThrow(() -> new UserNotFoundException("User not found: " + username));
    }

    @Transactional
    public List<UserIdentity> listUsers() {
        return UserAccountMapper.INSTANCE.toIdentityList(userAccountRepository.findAllByOrderByUsernameAsc());
    }

    /**
     * Splits a comma-separated group list as sent on registration.
     */
    public static List<String> parseGroupNames(String groups) {
        if (groups == null || groups.isBlank()) {
            return List.of();
        }
        return normalizeGroupNames(List.of(groups.split(",")));
    }

    private static List<String> normalizeGroupNames(Collection<String> groupNames) {
        Set<String> names = new LinkedHashSet<>();
        for (String name : groupNames) {
            if (name != null && !name.isBlank()) {
                names.add(name.trim());
            }
        }
        return List.copyOf(names);
    }
}
