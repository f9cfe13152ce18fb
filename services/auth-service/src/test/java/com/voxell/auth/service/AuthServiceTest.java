package com.voxell.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxell.auth.config.AuthProperties;
import com.voxell.auth.dto.ProfileResponse;
import com.voxell.auth.entity.User;
import com.voxell.auth.exception.AuthErrorCode;
import com.voxell.auth.exception.AuthException;
import com.voxell.auth.security.PasswordHasher;
import com.voxell.auth.security.TokenCodec;
import com.voxell.auth.store.UserStore;
import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String SECRET = "test-secret-must-be-at-least-32-bytes!";

    @Mock private UserStore userStore;

    private PasswordHasher passwordHasher;
    private TokenCodec tokenCodec;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        AuthProperties.Hashing hashing = new AuthProperties.Hashing();
        hashing.setMemoryKib(1024);
        hashing.setIterations(1);
        passwordHasher = spy(new PasswordHasher(hashing));
        tokenCodec = new TokenCodec(SECRET, Duration.ofDays(7));
        authService = new AuthService(userStore, passwordHasher, tokenCodec);
    }

    private User storedPlayer(String email, String password) {
        return User.builder()
                .id(UUID.randomUUID())
                .email(email)
                .passwordHash(passwordHasher.hash(password))
                .nickname("Alice")
                .build();
    }

    @Test
    void register_newEmail_insertsPlayerWithDefaultsAndReturnsToken() {
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.empty());
        when(userStore.insert(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            user.setId(UUID.randomUUID());
            return user;
        });

        String token = authService.register(" A@X.com ", "pw123", "Alice", "https://cdn.example.com/a.png");

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userStore).insert(captor.capture());
        User inserted = captor.getValue();
        assertThat(inserted.getEmail()).isEqualTo("a@x.com");
        assertThat(inserted.getNickname()).isEqualTo("Alice");
        assertThat(inserted.getAvatarUrl()).isEqualTo("https://cdn.example.com/a.png");
        assertThat(inserted.getRoles()).containsExactly("player");
        assertThat(inserted.isActive()).isTrue();
        assertThat(inserted.getPasswordHash()).isNotEqualTo("pw123");
        assertThat(passwordHasher.verify("pw123", inserted.getPasswordHash())).isTrue();
        assertThat(tokenCodec.verify(token)).contains("a@x.com");
    }

    @Test
    void register_existingEmail_failsWithDuplicateEmailAndDoesNotInsert() {
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.of(storedPlayer("a@x.com", "pw123")));

        assertThatThrownBy(() -> authService.register("a@x.com", "other", "Bob", null))
                .isInstanceOf(AuthException.class)
                .extracting("code")
                .isEqualTo(AuthErrorCode.DUPLICATE_EMAIL);
        verify(userStore, never()).insert(any());
    }

    @Test
    void register_conflictOnInsert_failsWithDuplicateEmail() {
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.empty());
        when(userStore.insert(any(User.class))).thenThrow(AuthException.duplicateEmail());

        AuthException e = catchThrowableOfType(
                () -> authService.register("a@x.com", "pw123", "Alice", null), AuthException.class);

        assertThat(e.getCode()).isEqualTo(AuthErrorCode.DUPLICATE_EMAIL);
        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void register_storeUnavailable_isRetryable() {
        when(userStore.findByEmail("a@x.com"))
                .thenThrow(AuthException.storeUnavailable(new QueryTimeoutException("timed out")));

        AuthException e = catchThrowableOfType(
                () -> authService.register("a@x.com", "pw123", "Alice", null), AuthException.class);

        assertThat(e.getCode()).isEqualTo(AuthErrorCode.STORE_UNAVAILABLE);
        assertThat(e.isRetryable()).isTrue();
    }

    @Test
    void login_correctPassword_returnsTokenForEmail() {
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.of(storedPlayer("a@x.com", "pw123")));

        String token = authService.login("A@x.com", "pw123");

        assertThat(tokenCodec.verify(token)).contains("a@x.com");
    }

    @Test
    void login_wrongPasswordAndUnknownEmail_failIdentically() {
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.of(storedPlayer("a@x.com", "pw123")));
        when(userStore.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

        AuthException wrongPassword = catchThrowableOfType(
                () -> authService.login("a@x.com", "nope"), AuthException.class);
        AuthException unknownEmail = catchThrowableOfType(
                () -> authService.login("ghost@x.com", "pw123"), AuthException.class);

        assertThat(wrongPassword.getCode()).isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThat(unknownEmail.getCode()).isEqualTo(wrongPassword.getCode());
        assertThat(unknownEmail.getMessage()).isEqualTo(wrongPassword.getMessage());
    }

    @Test
    void login_unknownEmail_stillVerifiesAPassword() {
        when(userStore.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login("ghost@x.com", "pw123"))
                .isInstanceOf(AuthException.class);
        verify(passwordHasher).verify(eq("pw123"), anyString());
    }

    @Test
    void login_malformedStoredHash_isInvalidCredentials() {
        User broken = storedPlayer("a@x.com", "pw123");
        broken.setPasswordHash("corrupted");
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.of(broken));

        assertThatThrownBy(() -> authService.login("a@x.com", "pw123"))
                .isInstanceOf(AuthException.class)
                .extracting("code")
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    void resolveProfile_validToken_returnsPublicProjection() {
        User player = storedPlayer("a@x.com", "pw123");
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.of(player));

        ProfileResponse profile = authService.resolveProfile(tokenCodec.issue("a@x.com"));

        assertThat(profile.getId()).isEqualTo(player.getId().toString());
        assertThat(profile.getEmail()).isEqualTo("a@x.com");
        assertThat(profile.getNickname()).isEqualTo("Alice");
        assertThat(profile.getAvatarUrl()).isNull();
        assertThat(profile.getRoles()).containsExactly("player");
    }

    @Test
    void resolveProfile_serializedProfileHasNoPasswordKey() throws Exception {
        User player = storedPlayer("a@x.com", "pw123");
        player.setAvatarUrl("https://cdn.example.com/a.png");
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.of(player));

        ProfileResponse profile = authService.resolveProfile(tokenCodec.issue("a@x.com"));
        JsonNode json = new ObjectMapper().valueToTree(profile);

        assertThat(json.fieldNames()).toIterable()
                .containsExactlyInAnyOrder("id", "email", "nickname", "avatar_url", "roles")
                .noneMatch(name -> name.toLowerCase().contains("password"));
        assertThat(json.toString()).doesNotContain(player.getPasswordHash());
    }

    @Test
    void resolveProfile_rolesAreSortedAndEmptyRolesFallBackToDefault() {
        User admin = storedPlayer("a@x.com", "pw123");
        admin.setRoles(new HashSet<>(Set.of("player", "moderator", "admin")));
        User roleless = storedPlayer("b@x.com", "pw123");
        roleless.setRoles(new HashSet<>());
        when(userStore.findByEmail("a@x.com")).thenReturn(Optional.of(admin));
        when(userStore.findByEmail("b@x.com")).thenReturn(Optional.of(roleless));

        assertThat(authService.resolveProfile(tokenCodec.issue("a@x.com")).getRoles())
                .containsExactly("admin", "moderator", "player");
        assertThat(authService.resolveProfile(tokenCodec.issue("b@x.com")).getRoles())
                .containsExactly("player");
    }

    @Test
    void resolveProfile_invalidToken_failsWithoutTouchingStore() {
        assertThatThrownBy(() -> authService.resolveProfile("not-a-real-token"))
                .isInstanceOf(AuthException.class)
                .extracting("code")
                .isEqualTo(AuthErrorCode.INVALID_TOKEN);
        verify(userStore, never()).findByEmail(anyString());
    }

    @Test
    void resolveProfile_playerNoLongerExists_failsWithUserNotFound() {
        when(userStore.findByEmail("gone@x.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.resolveProfile(tokenCodec.issue("gone@x.com")))
                .isInstanceOf(AuthException.class)
                .extracting("code")
                .isEqualTo(AuthErrorCode.USER_NOT_FOUND);
    }

    @Test
    void normalizeEmail_trimsAndLowerCases() {
        assertThat(AuthService.normalizeEmail("  Alice@Example.COM ")).isEqualTo("alice@example.com");
        assertThat(AuthService.normalizeEmail(null)).isEmpty();
    }
}
