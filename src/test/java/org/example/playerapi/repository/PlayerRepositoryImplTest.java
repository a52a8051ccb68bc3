package org.example.playerapi.repository;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerRepositoryImplTest {

    @Test
    void likeWildcardsAreEscaped() {
        assertThat(PlayerRepositoryImpl.escapeLike("100%_a!b")).isEqualTo("100!%!_a!!b");
        assertThat(PlayerRepositoryImpl.escapeLike("alice")).isEqualTo("alice");
    }
}
