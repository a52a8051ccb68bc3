package org.example.playerapi.controller;


import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.example.playerapi.dto.LoginRequest;
import org.example.playerapi.dto.MessageResponse;
import org.example.playerapi.dto.SignupRequest;
import org.example.playerapi.dto.TokenResponse;
import org.example.playerapi.dto.UserResponse;
import org.example.playerapi.model.User;
import org.example.playerapi.service.UserService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Authentication", description = "Operations with authentication")
public class AuthController {

    @Autowired
    private UserService userService;

    @Operation(summary = "Register a new user")
    @PostMapping("/signup")
    public UserResponse signup(@Valid @RequestBody SignupRequest signupRequest) {
        User user = userService.registerUser(
                signupRequest.getEmail(),
                signupRequest.getUsername(),
                signupRequest.getPassword()
        );
        return UserResponse.from(user);
    }

    @Operation(summary = "Exchange username and password for a bearer token")
    @PostMapping("/token")
    public TokenResponse login(@Valid @RequestBody LoginRequest loginRequest) {
        String jwt = userService.login(loginRequest.getUsername(), loginRequest.getPassword());
        return new TokenResponse(jwt);
    }

    @Operation(summary = "Log out the current user")
    @PostMapping("/logout")
    public MessageResponse logout(@AuthenticationPrincipal User currentUser) {
        userService.logout(currentUser);
        return new MessageResponse("Successfully logged out");
    }
}
