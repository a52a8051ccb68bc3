package org.example.playerapi.service;

import org.example.playerapi.exception.DuplicateEmailException;
import org.example.playerapi.exception.DuplicateUsernameException;
import org.example.playerapi.exception.InvalidCredentialsException;
import org.example.playerapi.model.User;
import org.example.playerapi.repository.UserRepository;
import org.example.playerapi.security.JwtTokenService;
import org.example.playerapi.security.PasswordHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordHasher passwordHasher;

    @Autowired
    private AuthenticationManager authenticationManager;

    @Autowired
    private JwtTokenService jwtTokenService;

    /**
     * Registers a new active user.
     */
    @Transactional
    public User registerUser(String email, String username, String password) {
        if (existsByUsername(username)) {
            throw new DuplicateUsernameException();
        }
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException();
        }

        User user = new User();
        user.setEmail(email);
        user.setUsername(username);
        user.setHashedPassword(passwordHasher.hash(password));
        user.setActive(true);
        User saved = userRepository.save(user);
        logger.info("Registered user '{}' (id={})", saved.getUsername(), saved.getId());
        return saved;
    }

    /**
     * Checks the credentials and issues an access token for the user.
     */
    public String login(String username, String password) {
        try {
            authenticationManager.authenticate(
                    new UsernamePasswordAuthenticationToken(username, password)
            );
        } catch (AuthenticationException ex) {
            logger.warn("Failed login for '{}': {}", username, ex.getMessage());
            throw new InvalidCredentialsException();
        }
        logger.info("User '{}' logged in", username);
        return jwtTokenService.issueToken(username);
    }

    /**
     * Tokens are stateless, so there is nothing to invalidate; a token stays valid until it expires.
     */
    public void logout(User user) {
        logger.info("User '{}' logged out", user.getUsername());
    }

    public boolean existsByUsername(String username) {
        return userRepository.existsByUsername(username);
    }
}
