package kds.domain.queue;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * JSON snapshot of the retry queue on disk, rewritten after every change and read back at start-up.
 * A disabled journal (no path) does nothing.
 * @since 07/10/2026
 */
public class PendingQueueJournal {
    private static final Logger logger = LoggerFactory.getLogger(PendingQueueJournal.class);

    private final Path file;
    private final Gson gson;

    public PendingQueueJournal(Path file, Gson gson) {
        this.file = file;
        this.gson = gson;
    }

    public static PendingQueueJournal disabled() {
        return new PendingQueueJournal(null, null);
    }

    public boolean isEnabled() {
        return file != null;
    }

    /**
     * Write the snapshot through a temp file so a crash mid-write leaves the previous journal intact
     */
    public void save(List<PendingQueueEntry> pending, List<PendingQueueEntry> deadLetters) {
        if (!isEnabled()) {
            return;
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(new Snapshot(pending, deadLetters), writer);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            logger.trace("Journal written: {} pending, {} dead letters", pending.size(), deadLetters.size());
        } catch (IOException e) {
            logger.error("Failed to write retry queue journal {}: {}", file, e.getMessage());
        }
    }

    /**
     * @return stored snapshot, empty when there is no journal or it cannot be read
     */
    public Snapshot load() {
        if (!isEnabled() || !Files.isRegularFile(file)) {
            return Snapshot.empty();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Snapshot snapshot = gson.fromJson(reader, Snapshot.class);
            if (snapshot == null) {
                return Snapshot.empty();
            }
            return new Snapshot(
                    snapshot.pending() == null ? List.of() : snapshot.pending(),
                    snapshot.deadLetters() == null ? List.of() : snapshot.deadLetters());
        } catch (IOException | JsonParseException e) {
            logger.error("Ignoring unreadable retry queue journal {}: {}", file, e.getMessage());
            return Snapshot.empty();
        }
    }

    public Path getFile() {
        return file;
    }

    public record Snapshot(List<PendingQueueEntry> pending, List<PendingQueueEntry> deadLetters) {
        static Snapshot empty() {
            return new Snapshot(List.of(), List.of());
        }
    }
}
