package org.example.playerapi.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.example.playerapi.model.Player;

import java.util.HashSet;
import java.util.Set;

/**
 * Partial update. Every setter records its field as supplied, so a field sent as JSON
 * {@code null} is cleared while a field left out of the body keeps its value.
 */
@Getter
@NoArgsConstructor
public class PlayerUpdateRequest {

    public static final String NAME = "name";
    public static final String POSITION = "position";
    public static final String TEAM = "team";
    public static final String AGE = "age";
    public static final String JERSEY_NUMBER = "jerseyNumber";

    @Getter(AccessLevel.NONE)
    private final Set<String> suppliedFields = new HashSet<>();

    @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank")
    @Size(max = Player.MAX_TEXT_LENGTH)
    private String name;

    @Size(max = Player.MAX_TEXT_LENGTH)
    private String position;

    @Size(max = Player.MAX_TEXT_LENGTH)
    private String team;

    private Integer age;

    private Integer jerseyNumber;

    public void setName(String name) {
        this.name = name;
        suppliedFields.add(NAME);
    }

    public void setPosition(String position) {
        this.position = position;
        suppliedFields.add(POSITION);
    }

    public void setTeam(String team) {
        this.team = team;
        suppliedFields.add(TEAM);
    }

    public void setAge(Integer age) {
        this.age = age;
        suppliedFields.add(AGE);
    }

    public void setJerseyNumber(Integer jerseyNumber) {
        this.jerseyNumber = jerseyNumber;
        suppliedFields.add(JERSEY_NUMBER);
    }

    public boolean isSupplied(String field) {
        return suppliedFields.contains(field);
    }

    // the name can be replaced but never cleared
    @JsonIgnore
    @AssertTrue(message = "must not be null")
    public boolean isNameNotCleared() {
        return !isSupplied(NAME) || name != null;
    }
}
