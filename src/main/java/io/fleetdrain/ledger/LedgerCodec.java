package io.fleetdrain.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleetdrain.model.AuditEntry;
import io.fleetdrain.model.ClientState;
import io.fleetdrain.model.LifecyclePhase;
import io.fleetdrain.model.ObservedState;
import io.fleetdrain.model.ProbeError;
import io.fleetdrain.util.Hashing;
import io.fleetdrain.util.Jsons;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

final class LedgerCodec {
    private LedgerCodec() {
    }

    static Map<String, Object> toRow(AuditEntry entry, String prevHash) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("seq", entry.seq());
        row.put("timestamp", entry.timestamp().toString());
        row.put("kind", entry.kind().name().toLowerCase(Locale.ROOT));
        row.put("worker_id", entry.workerId());
        row.put("prior_phase", entry.priorPhase() == null ? null : entry.priorPhase().name());
        row.put("new_phase", entry.newPhase() == null ? null : entry.newPhase().name());
        row.put("actor", entry.actor());
        row.put("reason", entry.reason());
        row.put("observation", entry.observation() == null ? null : observationRow(entry.observation()));
        row.put("prev_hash", prevHash);
        row.put("hash", Hashing.sha256Hex(Jsons.toCompactJson(row)));
        return row;
    }

    static String hashOf(JsonNode row) {
        ObjectNode copy = row.deepCopy();
        copy.remove("hash");
        return Hashing.sha256Hex(Jsons.toCompactJson(copy));
    }

    static JsonNode parseLine(String line) throws IOException {
        JsonNode node = Jsons.compactMapper().readTree(line);
        if (node == null || !node.isObject() || !node.has("seq") || !node.has("hash")) {
            throw new IOException("not a ledger row");
        }
        return node;
    }

    static AuditEntry fromRow(JsonNode row) {
        AuditEntry.Kind kind = AuditEntry.Kind.valueOf(row.path("kind").asText().toUpperCase(Locale.ROOT));
        JsonNode obs = row.path("observation");
        String workerId = row.path("worker_id").asText();
        return new AuditEntry(
                row.path("seq").asLong(),
                Instant.parse(row.path("timestamp").asText()),
                kind,
                workerId,
                phaseOrNull(row.path("prior_phase")),
                phaseOrNull(row.path("new_phase")),
                textOrNull(row.path("actor")),
                textOrNull(row.path("reason")),
                obs.isObject() ? observationFrom(workerId, obs) : null
        );
    }

    private static Map<String, Object> observationRow(ObservedState state) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", state.timestamp().toString());
        row.put("reachable", state.reachable());
        row.put("client_state", state.clientState().name());
        row.put("units_in_flight", state.unitsInFlight());
        row.put("probe_error", state.probeError() == null ? null : state.probeError().name());
        row.put("detail", state.detail());
        return row;
    }

    private static ObservedState observationFrom(String workerId, JsonNode obs) {
        String probeError = textOrNull(obs.path("probe_error"));
        return new ObservedState(
                workerId,
                Instant.parse(obs.path("timestamp").asText()),
                obs.path("reachable").asBoolean(false),
                ClientState.valueOf(obs.path("client_state").asText(ClientState.UNKNOWN.name())),
                obs.path("units_in_flight").asInt(-1),
                probeError == null ? null : ProbeError.valueOf(probeError),
                textOrNull(obs.path("detail"))
        );
    }

    private static LifecyclePhase phaseOrNull(JsonNode node) {
        String text = textOrNull(node);
        return text == null ? null : LifecyclePhase.valueOf(text);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }
}
