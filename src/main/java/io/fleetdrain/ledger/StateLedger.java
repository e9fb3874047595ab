package io.fleetdrain.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetdrain.model.AuditEntry;
import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.util.Jsons;
import io.fleetdrain.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class StateLedger {
    private static final Logger LOG = LoggerFactory.getLogger(StateLedger.class);

    private final Path ledgerFile;
    private final Ticker ticker;
    private final ConcurrentHashMap<String, LifecyclePhase> phases;
    private final ConcurrentHashMap<String, ObservedState> latestObservations;
    private String previousHash;
    private long seq;

    public StateLedger(Path ledgerFile, Ticker ticker) {
        this.ledgerFile = ledgerFile;
        this.ticker = ticker;
        this.phases = new ConcurrentHashMap<>();
        this.latestObservations = new ConcurrentHashMap<>();
        this.previousHash = "";
        this.seq = 0L;
        try {
            Files.createDirectories(ledgerFile.toAbsolutePath().getParent());
            if (!Files.exists(ledgerFile)) {
                try {
                    Files.createFile(ledgerFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new LedgerException("Failed to initialize ledger file: " + ledgerFile, e);
        }
        load();
    }

    public Path file() {
        return ledgerFile;
    }

    public synchronized AuditEntry append(AuditEntry entry) {
        validate(entry);
        AuditEntry stamped = new AuditEntry(
                seq + 1L,
                entry.timestamp() == null ? ticker.now() : entry.timestamp(),
                entry.kind(),
                entry.workerId(),
                entry.priorPhase(),
                entry.newPhase(),
                entry.actor(),
                entry.reason(),
                entry.observation()
        );
        Map<String, Object> row = LedgerCodec.toRow(stamped, previousHash);
        String line = Jsons.toCompactJson(row) + "\n";
        try {
            Files.writeString(ledgerFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE,
                    StandardOpenOption.DSYNC);
        } catch (IOException e) {
            throw new LedgerException("Failed to append to ledger " + ledgerFile, e);
        }
        previousHash = (String) row.get("hash");
        seq = stamped.seq();
        apply(stamped);
        return stamped;
    }

    /**
     * Moves {@code workerId} from {@code expected} to {@code next} if and only if it is
     * currently in {@code expected}.
     */
    public synchronized TransitionResult transition(
            String workerId,
            LifecyclePhase expected,
            LifecyclePhase next,
            String actor,
            String reason
    ) {
        if (!expected.isNextStep(next)) {
            throw new IllegalArgumentException("Not a forward single-step transition: " + expected + " -> " + next);
        }
        LifecyclePhase current = phase(workerId);
        if (current != expected) {
            return TransitionResult.rejected(current);
        }
        AuditEntry written = append(new AuditEntry(
                0L, null, AuditEntry.Kind.TRANSITION, workerId, expected, next, actor, reason, null));
        LOG.info("[{}] {} -> {} ({}: {})", workerId, expected, next, actor, reason);
        return TransitionResult.applied(written);
    }

    public synchronized AuditEntry reset(String workerId, LifecyclePhase target, String operator, String reason) {
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("reset requires an operator");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reset requires a reason");
        }
        LifecyclePhase current = phase(workerId);
        if (current == target) {
            throw new IllegalArgumentException("worker " + workerId + " is already " + target);
        }
        AuditEntry written = append(new AuditEntry(
                0L, null, AuditEntry.Kind.RESET, workerId, current, target, operator, reason, null));
        LOG.warn("[{}] operator reset {} -> {} by {}: {}", workerId, current, target, operator, reason);
        return written;
    }

    public AuditEntry recordObservation(ObservedState state) {
        synchronized (this) {
            LifecyclePhase current = phase(state.workerId());
            return append(new AuditEntry(
                    0L, state.timestamp(), AuditEntry.Kind.OBSERVATION, state.workerId(),
                    current, current, "probe", state.clientState().name(), state));
        }
    }

    public LifecyclePhase phase(String workerId) {
        return phases.getOrDefault(workerId, LifecyclePhase.ACTIVE);
    }

    public Map<String, LifecyclePhase> phases() {
        return Map.copyOf(phases);
    }

    public Optional<ObservedState> latestObservation(String workerId) {
        return Optional.ofNullable(latestObservations.get(workerId));
    }

    public Map<String, LifecyclePhase> replay() {
        Map<String, LifecyclePhase> out = new LinkedHashMap<>();
        for (AuditEntry entry : readEntries()) {
            if (entry.changesPhase()) {
                out.put(entry.workerId(), entry.newPhase());
            }
        }
        return out;
    }

    public List<AuditEntry> history(String workerId) {
        List<AuditEntry> out = new ArrayList<>();
        for (AuditEntry entry : readEntries()) {
            if (workerId == null || workerId.equals(entry.workerId())) {
                out.add(entry);
            }
        }
        return out;
    }

    public VerifyOutcome verify() {
        String expectedPrev = "";
        long rows = 0L;
        for (String line : readLines()) {
            rows++;
            JsonNode row;
            try {
                row = LedgerCodec.parseLine(line);
            } catch (IOException e) {
                return new VerifyOutcome(false, rows, rows, "unparseable row " + rows);
            }
            long rowSeq = row.path("seq").asLong();
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return new VerifyOutcome(false, rows, rowSeq, "prev_hash mismatch at seq " + rowSeq);
            }
            String hash = row.path("hash").asText("");
            if (!hash.equals(LedgerCodec.hashOf(row))) {
                return new VerifyOutcome(false, rows, rowSeq, "hash mismatch at seq " + rowSeq);
            }
            expectedPrev = hash;
        }
        return new VerifyOutcome(true, rows, -1L, "ok");
    }

    private void validate(AuditEntry entry) {
        if (entry.workerId() == null || entry.workerId().isBlank()) {
            throw new IllegalArgumentException("ledger entry requires a worker id");
        }
        switch (entry.kind()) {
            case TRANSITION -> {
                LifecyclePhase current = phase(entry.workerId());
                if (entry.priorPhase() != current) {
                    throw new IllegalStateException("worker " + entry.workerId() + " is " + current
                            + ", entry claims " + entry.priorPhase());
                }
                if (!current.isNextStep(entry.newPhase())) {
                    throw new IllegalStateException("illegal transition " + current + " -> " + entry.newPhase()
                            + " for " + entry.workerId());
                }
            }
            case RESET -> {
                if (entry.newPhase() == null || entry.actor() == null || entry.reason() == null) {
                    throw new IllegalArgumentException("reset entries need a target, an operator and a reason");
                }
            }
            case OBSERVATION -> {
                if (entry.observation() == null) {
                    throw new IllegalArgumentException("observation entry without observation");
                }
            }
        }
    }

    private void apply(AuditEntry entry) {
        if (entry.changesPhase()) {
            phases.put(entry.workerId(), entry.newPhase());
        } else if (entry.observation() != null) {
            latestObservations.put(entry.workerId(), entry.observation());
        }
    }

    private void load() {
        String content;
        try {
            content = Files.readString(ledgerFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LedgerException("Failed to read ledger " + ledgerFile, e);
        }
        long goodBytes = 0L;
        int cursor = 0;
        boolean torn = false;
        while (cursor < content.length()) {
            int newline = content.indexOf('\n', cursor);
            boolean terminated = newline >= 0;
            String line = terminated ? content.substring(cursor, newline) : content.substring(cursor);
            int next = terminated ? newline + 1 : content.length();
            boolean last = next >= content.length();
            if (line.isBlank()) {
                goodBytes += utf8Length(content, cursor, next);
                cursor = next;
                continue;
            }
            JsonNode row;
            try {
                row = LedgerCodec.parseLine(line);
            } catch (IOException e) {
                if (last) {
                    torn = true;
                    break;
                }
                throw new LedgerException("Corrupt ledger row in " + ledgerFile + " at byte " + goodBytes, e);
            }
            AuditEntry entry = LedgerCodec.fromRow(row);
            apply(entry);
            seq = entry.seq();
            previousHash = row.path("hash").asText("");
            goodBytes += utf8Length(content, cursor, next);
            if (!terminated) {
                repairMissingNewline();
            }
            cursor = next;
        }
        if (torn) {
            LOG.warn("Dropping torn final row of {} left by an interrupted write", ledgerFile);
            truncate(goodBytes);
        }
        if (seq > 0L) {
            LOG.debug("Ledger {} replayed: {} row(s), {} worker(s)", ledgerFile, seq, phases.size());
        }
    }

    private List<AuditEntry> readEntries() {
        List<AuditEntry> out = new ArrayList<>();
        for (String line : readLines()) {
            try {
                out.add(LedgerCodec.fromRow(LedgerCodec.parseLine(line)));
            } catch (IOException e) {
                throw new LedgerException("Corrupt ledger row in " + ledgerFile, e);
            }
        }
        return out;
    }

    private List<String> readLines() {
        List<String> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(ledgerFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
        } catch (IOException e) {
            throw new LedgerException("Failed to read ledger " + ledgerFile, e);
        }
        return out;
    }

    private void repairMissingNewline() {
        try {
            Files.writeString(ledgerFile, "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new LedgerException("Failed to repair ledger tail " + ledgerFile, e);
        }
    }

    private void truncate(long size) {
        try (FileChannel channel = FileChannel.open(ledgerFile, StandardOpenOption.WRITE)) {
            channel.truncate(size);
        } catch (IOException e) {
            throw new LedgerException("Failed to drop torn row from " + ledgerFile, e);
        }
    }

    private static long utf8Length(String content, int from, int to) {
        return content.substring(from, to).getBytes(StandardCharsets.UTF_8).length;
    }

    public record VerifyOutcome(boolean valid, long rows, long firstBadSeq, String message) {
    }
}
