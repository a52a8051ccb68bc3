package org.example.playerapi.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.example.playerapi.dto.MessageResponse;
import org.example.playerapi.dto.PlayerRequest;
import org.example.playerapi.dto.PlayerUpdateRequest;
import org.example.playerapi.model.Player;
import org.example.playerapi.service.PlayerCsvImportService;
import org.example.playerapi.service.PlayerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Players", description = "Operations with players")
public class PlayerController {

    @Autowired
    private PlayerService playerService;

    @Autowired
    private PlayerCsvImportService playerCsvImportService;

    @Operation(summary = "Get players, paginated by offset")
    @GetMapping({"/players", "/players/"})
    public List<Player> getPlayers(@RequestParam(name = "skip", defaultValue = "0") @Min(0) int skip,
                                   @RequestParam(name = "limit", defaultValue = "100") @Min(0) int limit) {
        return playerService.getPlayers(skip, limit);
    }

    @Operation(summary = "Get a player by ID")
    @GetMapping("/players/{id}")
    public Player getPlayerById(@PathVariable Long id) {
        return playerService.getPlayerById(id);
    }

    @Operation(summary = "Create a new player")
    @PostMapping({"/players", "/players/"})
    public Player createPlayer(@Valid @RequestBody PlayerRequest player) {
        return playerService.createPlayer(player);
    }

    @Operation(summary = "Update the supplied fields of a player")
    @PutMapping("/players/{id}")
    public Player updatePlayer(@PathVariable Long id, @Valid @RequestBody PlayerUpdateRequest player) {
        return playerService.updatePlayer(id, player);
    }

    @Operation(summary = "Delete a player by ID")
    @DeleteMapping("/players/{id}")
    public MessageResponse deletePlayer(@PathVariable Long id) {
        playerService.deletePlayer(id);
        return new MessageResponse("Player deleted successfully");
    }

    @Operation(summary = "Search players by name (case-insensitive substring)")
    @GetMapping("/search")
    public List<Player> searchPlayers(@RequestParam(name = "name") String name,
                                      @RequestParam(name = "skip", defaultValue = "0") @Min(0) int skip,
                                      @RequestParam(name = "limit", defaultValue = "100") @Min(0) int limit) {
        return playerService.searchByName(name, skip, limit);
    }

    @Operation(summary = "Create players from an uploaded CSV file")
    @PostMapping(value = "/players/upload-csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public List<Player> uploadCsv(@RequestParam("file") MultipartFile file) throws IOException {
        try (InputStream content = file.getInputStream()) {
            return playerCsvImportService.importCsv(file.getOriginalFilename(), content);
        }
    }
}
