package org.example.playerapi.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.example.playerapi.model.Player;

@Getter
@Setter
@NoArgsConstructor
public class PlayerRequest {

    @NotBlank
    @Size(max = Player.MAX_TEXT_LENGTH)
    private String name;

    @Size(max = Player.MAX_TEXT_LENGTH)
    private String position;

    @Size(max = Player.MAX_TEXT_LENGTH)
    private String team;

    private Integer age;

    private Integer jerseyNumber;
}
