package org.example.playerapi.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import org.example.playerapi.model.User;

import java.time.LocalDateTime;

/**
 * Public view of a user; never exposes the password hash.
 */
@Getter
public class UserResponse {

    private final Long id;
    private final String email;
    private final String username;
    private final boolean active;
    private final LocalDateTime createdAt;

    private UserResponse(User user) {
        this.id = user.getId();
        this.email = user.getEmail();
        this.username = user.getUsername();
        this.active = user.isActive();
        this.createdAt = user.getCreatedAt();
    }

    public static UserResponse from(User user) {
        return new UserResponse(user);
    }

    @JsonProperty("is_active")
    public boolean isActive() {
        return active;
    }
}
