package io.fleetdrain.support;

import io.fleetdrain.remote.RemoteResult;
import io.fleetdrain.remote.RemoteShell;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class SimulatedFleetShell implements RemoteShell {
    private final Map<String, SimulatedClient> clients = new ConcurrentHashMap<>();

    public SimulatedFleetShell with(String address, SimulatedClient client) {
        clients.put(address, client);
        return this;
    }

    public SimulatedClient client(String address) {
        return clients.get(address);
    }

    @Override
    public RemoteResult execute(String address, String command, long connectTimeoutMs, long commandTimeoutMs) {
        SimulatedClient client = clients.get(address);
        if (client == null) {
            return new RemoteResult(RemoteResult.Outcome.CONNECT_FAILED, 255, "", "No route to host");
        }
        return client.handle(command);
    }
}
