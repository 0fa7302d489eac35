package com.nosota.splitpay.tests;

import com.nosota.splitpay.TestBase;
import com.nosota.splitpay.dto.UserIdentity;
import com.nosota.splitpay.error.AuthenticationFailedException;
import com.nosota.splitpay.error.GroupNotFoundException;
import com.nosota.splitpay.error.UserAlreadyExistsException;
import com.nosota.splitpay.error.UserNotFoundException;
import com.nosota.splitpay.model.UserAccount;
import com.nosota.splitpay.service.CredentialService;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the credential store.
 *
 * <ul>
 *   <li>Registration stores a hash, never the password</li>
 *   <li>Usernames are unique</li>
 *   <li>Unknown user and wrong password fail the same way</li>
 *   <li>Joining groups at registration goes through the ledger</li>
 * </ul>
 */
@DisplayName("1. Credential Store Tests")
public class CredentialServiceTest extends TestBase {

    @Test
    void register_StoresHashAndDefaultRole() {
        String username = uniqueName("alice");

        UserIdentity identity = credentialService.register(username, PASSWORD, null, List.of());

        assertThat(identity.username()).isEqualTo(username);
        assertThat(identity.roles()).containsExactly(CredentialService.DEFAULT_ROLE);
        assertThat(identity.groups()).isEmpty();

        UserAccount stored = userAccountRepository.findById(username).orElseThrow();
        assertThat(stored.getPasswordHash())
                .isNotEqualTo(PASSWORD)
                .startsWith("$2");
    }

    @Test
    void register_KeepsRequestedRole() {
        String username = uniqueName("root");

        UserIdentity identity = credentialService.register(username, PASSWORD, "admin", List.of());

        assertThat(identity.roles()).containsExactly("admin");
    }

    @Test
    void register_DuplicateUsername_Fails() {
        String username = registerUser("bob");

        assertThatThrownBy(() -> credentialService.register(username, "another-password", null, List.of()))
                .isInstanceOf(UserAlreadyExistsException.class)
                .hasMessageContaining(username);
    }

    @Test
    void register_WithBlankUsername_FailsValidation() {
        assertThatThrownBy(() -> credentialService.register(" ", PASSWORD, null, List.of()))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void register_WithExistingGroups_JoinsThemAndRecomputesSplit() {
        String admin = registerUser("admin");
        String group = createGroup(admin, "300");
        String username = uniqueName("carol");

        UserIdentity identity = credentialService.register(
                username, PASSWORD, null, CredentialService.parseGroupNames(" " + group + ", ," + group));

        assertThat(identity.groups()).containsExactly(group);
        assertThat(groupRepository.findById(group).orElseThrow().getSplitAmount())
                .isEqualByComparingTo("150.00");
        assertThat(paymentRepository.existsByGroupNameAndUsername(group, username)).isTrue();
    }

    @Test
    void register_WithUnknownGroup_StoresNothing() {
        String username = uniqueName("dave");

        assertThatThrownBy(() -> credentialService.register(
                username, PASSWORD, null, List.of("no-such-group-" + username)))
                .isInstanceOf(GroupNotFoundException.class);

        assertThat(userAccountRepository.existsById(username)).isFalse();
    }

    @Test
    void authenticate_WithCorrectPassword_ReturnsIdentity() {
        String username = registerUser("erin");

        UserIdentity identity = credentialService.authenticate(username, PASSWORD);

        assertThat(identity.username()).isEqualTo(username);
        assertThat(identity.roles()).containsExactly(CredentialService.DEFAULT_ROLE);
    }

    @Test
    void authenticate_WrongPasswordAndUnknownUser_FailIdentically() {
        String username = registerUser("frank");

        Throwable wrongPassword = catchFailure(username, "wrong-password");
        Throwable unknownUser = catchFailure(uniqueName("ghost"), PASSWORD);

        assertThat(wrongPassword).isInstanceOf(AuthenticationFailedException.class);
        assertThat(unknownUser).isInstanceOf(AuthenticationFailedException.class);
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownUser.getMessage());
    }

    @Test
    void get_UnknownUser_Fails() {
        assertThatThrownBy(() -> credentialService.get(uniqueName("nobody")))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    void listUsers_IsSortedAndOmitsHashes() {
        String first = registerUser("list");
        String second = registerUser("list");

        List<UserIdentity> users = credentialService.listUsers();

        List<String> names = users.stream().map(UserIdentity::username).toList();
        assertThat(names).contains(first, second);
        assertThat(names).isSorted();
    }

    @Test
    void parseGroupNames_TrimsAndDropsBlanks() {
        assertThat(CredentialService.parseGroupNames(null)).isEmpty();
        assertThat(CredentialService.parseGroupNames("  ")).isEmpty();
        assertThat(CredentialService.parseGroupNames("trip, dinner,,trip ")).containsExactly("trip", "dinner");
    }

    private Throwable catchFailure(String username, String password) {
        try {
            credentialService.authenticate(username, password);
        } catch (RuntimeException e) {
            return e;
        }
        return null;
    }
}
