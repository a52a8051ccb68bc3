package org.example.playerapi.security;

import org.example.playerapi.exception.InvalidTokenException;
import org.example.playerapi.exception.UnauthorizedException;
import org.example.playerapi.model.User;
import org.example.playerapi.repository.UserRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Resolves a presented bearer token to the active user it was issued for.
 */
@Component
public class BearerTokenAuthenticator {

    @Autowired
    private JwtTokenService jwtTokenService;

    @Autowired
    private UserRepository userRepository;

    /**
     * @throws UnauthorizedException if the token does not verify, names an unknown user,
     *                               or the user is inactive
     */
    public User authenticate(String token) {
        String username;
        try {
            username = jwtTokenService.verifyToken(token);
        } catch (InvalidTokenException e) {
            throw new UnauthorizedException(e.getMessage(), e);
        }

        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new UnauthorizedException("Unknown user '" + username + "'"));
        if (!user.isActive()) {
            throw new UnauthorizedException("Inactive user '" + username + "'");
        }
        return user;
    }
}
