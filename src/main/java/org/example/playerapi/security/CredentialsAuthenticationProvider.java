package org.example.playerapi.security;

import org.example.playerapi.model.User;
import org.example.playerapi.repository.UserRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks a username/password pair against the stored user records.
 */
@Component
public class CredentialsAuthenticationProvider implements AuthenticationProvider {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordHasher passwordHasher;

    @Override
    public Authentication authenticate(Authentication authentication) throws AuthenticationException {
        String username = authentication.getName();
        Object credentials = authentication.getCredentials();
        String password = credentials == null ? null : credentials.toString();

        // unknown user and wrong password are indistinguishable to the caller
        User user = userRepository.findByUsername(username)
                .filter(u -> passwordHasher.verify(password, u.getHashedPassword()))
                .orElseThrow(() -> new BadCredentialsException("Bad credentials"));
        if (!user.isActive()) {
            throw new DisabledException("User is inactive");
        }
        return new UsernamePasswordAuthenticationToken(user, null, List.of());
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(authentication);
    }
}
