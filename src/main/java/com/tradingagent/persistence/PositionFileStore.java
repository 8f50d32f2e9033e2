package com.tradingagent.persistence;

import com.tradingagent.domain.enums.Universe;
import com.tradingagent.domain.model.Position;
import com.tradingagent.exception.CorruptStateException;
import com.tradingagent.exception.PersistenceException;
import com.tradingagent.ledger.LedgerConfig;
import com.tradingagent.mapper.LedgerJson;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * JSON file storage for one ledger universe per file.
 *
 * <p>Writes go to {@code <file>.tmp}, are forced to disk, then renamed over the target, so a
 * reader (or a restart after a crash) sees either the previous or the new file, never a partial
 * one. A file that cannot be parsed, or that holds a row which is not a valid position, is moved
 * aside as {@code <file>.corrupted.<timestamp>} and the universe starts empty.
 */
@Component
public class PositionFileStore {

    private static final Logger log = LoggerFactory.getLogger(PositionFileStore.class);

    private static final DateTimeFormatter QUARANTINE_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path dataDir;
    private final Clock clock;

    @Autowired
    public PositionFileStore(LedgerConfig ledgerConfig, Clock clock) {
        this(Paths.get(ledgerConfig.getDataDir()), clock);
    }

    public PositionFileStore(Path dataDir, Clock clock) {
        this.dataDir = dataDir;
        this.clock = clock;
    }

    /**
     * Loads a universe. A missing file is an empty universe; an unreadable one is quarantined
     * and also yields an empty universe.
     */
    public Map<String, Position> load(Universe universe) {
        Path file = fileFor(universe);
        if (!Files.exists(file)) {
            log.info("No {} ledger at {}, starting empty", universe, file);
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Position> positions = read(file);
            log.info("Loaded {} {} positions from {}", positions.size(), universe, file);
            return positions;
        } catch (CorruptStateException e) {
            Path quarantined = quarantine(file);
            log.error("Ledger file {} is corrupt, moved to {} and starting empty", file, quarantined, e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Atomically replaces the universe file with {@code positions}.
     *
     * @throws PersistenceException if the file cannot be written; the previous file is untouched
     */
    public void save(Universe universe, Map<String, Position> positions) {
        write(fileFor(universe), positions);
    }

    /**
     * Copies the current universe file to {@code <name>.backup.<yyyyMMdd>.json}.
     *
     * @return the backup path, or null when there was nothing to back up
     */
    public Path backup(Universe universe) {
        Path file = fileFor(universe);
        if (!Files.exists(file)) {
            return null;
        }
        String baseName = universe.getFileName().replace(".json", "");
        Path target = dataDir.resolve(baseName + ".backup." + LocalDate.now(clock).format(BACKUP_SUFFIX) + ".json");
        try {
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up {} ledger to {}", universe, target);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to back up ledger", target.toString(), e);
        }
    }

    public Path fileFor(Universe universe) {
        return dataDir.resolve(universe.getFileName());
    }

    private Map<String, Position> read(Path file) {
        Map<String, Position> positions;
        try {
            positions = LedgerJson.readPositions(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new CorruptStateException(file.toString(), e);
        }
        positions.forEach((key, position) -> {
            String problem = validate(position);
            if (problem != null) {
                throw new CorruptStateException(file.toString(), "row '" + key + "' " + problem);
            }
        });
        return positions;
    }

    private static String validate(Position position) {
        if (position == null) {
            return "is null";
        }
        if (position.getTicker() == null || position.getTicker().isBlank()) {
            return "has no ticker";
        }
        if (position.getSide() == null) {
            return "has no side";
        }
        if (position.getContracts() <= 0) {
            return "has contracts " + position.getContracts();
        }
        if (position.getEntryPrice() < 1 || position.getEntryPrice() > 99) {
            return "has entry price " + position.getEntryPrice();
        }
        if (position.getStatus() == null) {
            return "has no status";
        }
        return null;
    }

    private void write(Path file, Map<String, Position> positions) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(dataDir);
            byte[] bytes = LedgerJson.writePositions(positions);
            try (FileChannel channel = FileChannel.open(
                    tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            moveIntoPlace(tmp, file);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("Failed to write ledger file", file.toString(), e);
        }
    }

    private void moveIntoPlace(Path tmp, Path file) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path quarantine(Path file) {
        Path target = file.resolveSibling(
                file.getFileName() + ".corrupted." + LocalDateTime.now(clock).format(QUARANTINE_SUFFIX));
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to quarantine corrupt ledger file", file.toString(), e);
        }
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
