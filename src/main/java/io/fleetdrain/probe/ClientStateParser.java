package io.fleetdrain.probe;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetdrain.model.ClientState;
import io.fleetdrain.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

final class ClientStateParser {
    private ClientStateParser() {
    }

    static Optional<ClientState> parseState(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(raw.strip());
        } catch (Exception e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        List<Flags> scopes = new ArrayList<>();
        collect(root, scopes);
        collect(root.path("config"), scopes);
        JsonNode groups = root.path("groups");
        if (groups.isObject()) {
            Iterator<JsonNode> it = groups.elements();
            while (it.hasNext()) {
                JsonNode group = it.next();
                collect(group, scopes);
                collect(group.path("config"), scopes);
            }
        }
        if (scopes.isEmpty()) {
            return Optional.empty();
        }
        boolean allPaused = scopes.stream().allMatch(Flags::paused);
        if (allPaused) {
            return Optional.of(ClientState.PAUSED);
        }
        boolean finishing = scopes.stream().anyMatch(f -> f.finish() && !f.paused());
        return Optional.of(finishing ? ClientState.FINISHING : ClientState.RUNNING);
    }

    static OptionalInt parseUnits(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalInt.empty();
        }
        String last = "";
        for (String line : raw.split("\\R")) {
            if (!line.isBlank()) {
                last = line.trim();
            }
        }
        try {
            int value = Integer.parseInt(last);
            return value < 0 ? OptionalInt.empty() : OptionalInt.of(value);
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private static void collect(JsonNode node, List<Flags> out) {
        if (node == null || !node.isObject()) {
            return;
        }
        JsonNode paused = node.get("paused");
        JsonNode finish = node.get("finish");
        boolean hasPaused = paused != null && paused.isBoolean();
        boolean hasFinish = finish != null && finish.isBoolean();
        if (!hasPaused && !hasFinish) {
            return;
        }
        out.add(new Flags(hasPaused && paused.booleanValue(), hasFinish && finish.booleanValue()));
    }

    private record Flags(boolean paused, boolean finish) {
    }
}
