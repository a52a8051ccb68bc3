package org.example.playerapi.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.example.playerapi.model.Player;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Repository
public class PlayerRepositoryImpl implements PlayerRepositoryCustom {

    private static final char LIKE_ESCAPE = '!';

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional(readOnly = true)
    public List<Player> findSlice(int skip, int limit) {
        if (limit == 0) return List.of();
        return em.createQuery("SELECT p FROM Player p ORDER BY p.id", Player.class)
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Player> searchByName(String fragment, int skip, int limit) {
        if (limit == 0) return List.of();
        String pattern = "%" + escapeLike(fragment.toLowerCase(Locale.ROOT)) + "%";
        return em.createQuery(
                        "SELECT p FROM Player p " +
                                "WHERE LOWER(p.name) LIKE :pattern ESCAPE '!' " +
                                "ORDER BY p.id", Player.class)
                .setParameter("pattern", pattern)
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }

    static String escapeLike(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
