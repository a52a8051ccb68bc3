package org.example.playerapi.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Getter
@Setter
@Table(name="players", indexes = @Index(name = "ix_players_name", columnList = "name"))
public class Player {

    /** Column width of the text fields; requests and CSV rows are checked against it. */
    public static final int MAX_TEXT_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = MAX_TEXT_LENGTH)
    private String name;

    @Column(length = MAX_TEXT_LENGTH)
    private String position;

    @Column(length = MAX_TEXT_LENGTH)
    private String team;

    private Integer age;

    private Integer jerseyNumber;

    @Column(updatable = false)
    private LocalDateTime createdAt = LocalDateTime.now();

    private LocalDateTime updatedAt;
}
