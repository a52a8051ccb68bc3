package org.example.playerapi.repository;

import org.example.playerapi.model.Player;

import java.util.List;

/**
 * Offset/limit queries over players.
 *
 * Spring Data's {@code Pageable} is page-number based, so an arbitrary {@code skip}
 * cannot be expressed with it; these go through the entity manager directly.
 */
public interface PlayerRepositoryCustom {

    /** Players ordered by id, skipping the first {@code skip} rows. */
    List<Player> findSlice(int skip, int limit);

    /**
     * Players whose name contains {@code fragment}, ignoring case.
     * {@code %} and {@code _} in the fragment match literally.
     */
    List<Player> searchByName(String fragment, int skip, int limit);
}
