package org.example.playerapi.dto;

import lombok.Getter;

@Getter
public class TokenResponse {

    private final String accessToken;
    private final String tokenType = "bearer";

    public TokenResponse(String accessToken) {
        this.accessToken = accessToken;
    }
}
