package org.example.playerapi.service;

import org.example.playerapi.dto.PlayerRequest;
import org.example.playerapi.dto.PlayerUpdateRequest;
import org.example.playerapi.exception.ResourceNotFoundException;
import org.example.playerapi.model.Player;
import org.example.playerapi.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class PlayerService {

    static final String PLAYER_NOT_FOUND = "Player not found";
    static final String NO_MATCHES = "No players found with the given name";

    private static final Logger logger = LoggerFactory.getLogger(PlayerService.class);

    @Autowired
    private PlayerRepository playerRepository;

    /**
     * Retrieves a page of players ordered by id.
     */
    public List<Player> getPlayers(int skip, int limit) {
        return playerRepository.findSlice(skip, limit);
    }

    /**
     * Retrieves a specific player by ID.
     */
    public Player getPlayerById(Long id) {
        return playerRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(PLAYER_NOT_FOUND));
    }

    /**
     * Case-insensitive substring search on the player name. An empty result is an error.
     */
    public List<Player> searchByName(String name, int skip, int limit) {
        List<Player> players = playerRepository.searchByName(name, skip, limit);
        if (players.isEmpty()) {
            throw new ResourceNotFoundException(NO_MATCHES);
        }
        return players;
    }

    public Player createPlayer(PlayerRequest request) {
        Player player = new Player();
        player.setName(request.getName().trim());
        player.setPosition(request.getPosition());
        player.setTeam(request.getTeam());
        player.setAge(request.getAge());
        player.setJerseyNumber(request.getJerseyNumber());
        return playerRepository.save(player);
    }

    /**
     * Overwrites the fields supplied in the request, including those supplied as null.
     */
    @Transactional
    public Player updatePlayer(Long id, PlayerUpdateRequest update) {
        Player player = getPlayerById(id);
        if (update.isSupplied(PlayerUpdateRequest.NAME)) {
            player.setName(update.getName().trim());
        }
        if (update.isSupplied(PlayerUpdateRequest.POSITION)) {
            player.setPosition(update.getPosition());
        }
        if (update.isSupplied(PlayerUpdateRequest.TEAM)) {
            player.setTeam(update.getTeam());
        }
        if (update.isSupplied(PlayerUpdateRequest.AGE)) {
            player.setAge(update.getAge());
        }
        if (update.isSupplied(PlayerUpdateRequest.JERSEY_NUMBER)) {
            player.setJerseyNumber(update.getJerseyNumber());
        }
        player.setUpdatedAt(LocalDateTime.now());
        return playerRepository.save(player);
    }

    @Transactional
    public void deletePlayer(Long id) {
        Player player = getPlayerById(id);
        playerRepository.delete(player);
        logger.info("Deleted player {} ('{}')", player.getId(), player.getName());
    }
}
