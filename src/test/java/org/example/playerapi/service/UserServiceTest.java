package org.example.playerapi.service;

import org.example.playerapi.exception.DuplicateEmailException;
import org.example.playerapi.exception.DuplicateUsernameException;
import org.example.playerapi.exception.InvalidCredentialsException;
import org.example.playerapi.model.User;
import org.example.playerapi.repository.UserRepository;
import org.example.playerapi.security.JwtTokenService;
import org.example.playerapi.security.PasswordHasher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordHasher passwordHasher;

    @Mock
    private AuthenticationManager authenticationManager;

    @Mock
    private JwtTokenService jwtTokenService;

    @InjectMocks
    private UserService userService;

    @Test
    void registerStoresHashedPasswordAndActiveFlag() {
        when(userRepository.existsByUsername("alice")).thenReturn(false);
        when(userRepository.existsByEmail("alice@example.com")).thenReturn(false);
        when(passwordHasher.hash("pw")).thenReturn("hashed-pw");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        User user = userService.registerUser("alice@example.com", "alice", "pw");

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertThat(saved.getValue().getHashedPassword()).isEqualTo("hashed-pw");
        assertThat(user.isActive()).isTrue();
        assertThat(user.getUsername()).isEqualTo("alice");
        assertThat(user.getEmail()).isEqualTo("alice@example.com");
        assertThat(user.getCreatedAt()).isNotNull();
    }

    @Test
    void duplicateUsernameCreatesNoUser() {
        when(userRepository.existsByUsername("alice")).thenReturn(true);

        assertThatThrownBy(() -> userService.registerUser("other@example.com", "alice", "pw"))
                .isInstanceOf(DuplicateUsernameException.class)
                .hasMessage("Username already registered");
        verify(userRepository, never()).save(any());
        verify(passwordHasher, never()).hash(anyString());
    }

    @Test
    void duplicateEmailCreatesNoUser() {
        when(userRepository.existsByUsername("bob")).thenReturn(false);
        when(userRepository.existsByEmail("alice@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.registerUser("alice@example.com", "bob", "pw"))
                .isInstanceOf(DuplicateEmailException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    void loginIssuesTokenForUsername() {
        when(jwtTokenService.issueToken("alice")).thenReturn("jwt");

        assertThat(userService.login("alice", "pw")).isEqualTo("jwt");
        verify(authenticationManager).authenticate(any(UsernamePasswordAuthenticationToken.class));
    }

    @Test
    void failedAuthenticationIsInvalidCredentials() {
        when(authenticationManager.authenticate(any())).thenThrow(new BadCredentialsException("Bad credentials"));

        assertThatThrownBy(() -> userService.login("alice", "wrong"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Incorrect username or password");
        verify(jwtTokenService, never()).issueToken(anyString());
    }
}
