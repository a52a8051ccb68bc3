package org.example.playerapi.service;

import org.example.playerapi.csv.CsvRow;
import org.example.playerapi.csv.CsvRowReader;
import org.example.playerapi.exception.BadFileTypeException;
import org.example.playerapi.exception.CsvImportException;
import org.example.playerapi.model.Player;
import org.example.playerapi.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Bulk import of players from an uploaded CSV document.
 *
 * Rows are inserted one at a time, each in its own transaction. The first row without a name
 * aborts the import, as does a name, position or team longer than
 * {@link Player#MAX_TEXT_LENGTH}; rows inserted before it stay committed. Unparseable {@code age} or
 * {@code jersey_number} values are dropped for that row.
 */
@Service
public class PlayerCsvImportService {

    static final String NAME_REQUIRED = "Name field is required";

    private static final Logger logger = LoggerFactory.getLogger(PlayerCsvImportService.class);

    @Autowired
    private PlayerRepository playerRepository;

    /**
     * @param filename the name the client gave the upload; must end in {@code .csv}
     * @param content  the document, UTF-8 encoded
     * @return the players created, in row order
     * @throws BadFileTypeException if the filename is not a CSV filename
     * @throws CsvImportException   if a row has no name, a too long value or cannot be stored,
     *                              or the document cannot be read
     */
    public List<Player> importCsv(String filename, InputStream content) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new BadFileTypeException();
        }

        List<Player> created = new ArrayList<>();
        InputStreamReader decoder = new InputStreamReader(content, StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT));
        try (CsvRowReader reader = new CsvRowReader(decoder)) {
            CsvRow row;
            while ((row = reader.next()) != null) {
                created.add(save(toPlayer(row, created.size()), row.getLineNumber(), created.size()));
            }
        } catch (IOException e) {
            logger.warn("CSV import of '{}' aborted after {} rows: {}", filename, created.size(), e.getMessage());
            throw new CsvImportException("Error processing CSV file: " + e.getMessage());
        }

        logger.info("Imported {} players from '{}'", created.size(), filename);
        return created;
    }

    private Player save(Player player, int lineNumber, int importedSoFar) {
        try {
            return playerRepository.save(player);
        } catch (DataAccessException e) {
            logger.warn("CSV import aborted at line {} after {} rows", lineNumber, importedSoFar, e);
            throw new CsvImportException("Error processing row (line " + lineNumber + "): "
                    + e.getMostSpecificCause().getMessage());
        }
    }

    private Player toPlayer(CsvRow row, int importedSoFar) {
        String name = row.get("name");
        if (name == null || name.isBlank()) {
            logger.warn("CSV import aborted at line {} after {} rows: missing name", row.getLineNumber(), importedSoFar);
            throw new CsvImportException(NAME_REQUIRED + " (line " + row.getLineNumber() + ")");
        }

        for (String column : List.of("name", "position", "team")) {
            String value = text(row.get(column));
            if (value != null && value.length() > Player.MAX_TEXT_LENGTH) {
                logger.warn("CSV import aborted at line {} after {} rows: {} too long", row.getLineNumber(), importedSoFar, column);
                throw new CsvImportException("Error processing row (line " + row.getLineNumber() + "): "
                        + column + " exceeds " + Player.MAX_TEXT_LENGTH + " characters");
            }
        }

        Player player = new Player();
        player.setName(name.trim());
        player.setPosition(text(row.get("position")));
        player.setTeam(text(row.get("team")));
        player.setAge(integer(row.get("age")));
        player.setJerseyNumber(integer(row.get("jersey_number")));
        return player;
    }

    private static String text(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }

    // malformed numbers are dropped, not reported
    private static Integer integer(String raw) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
