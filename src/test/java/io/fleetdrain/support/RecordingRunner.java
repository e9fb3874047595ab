package io.fleetdrain.support;

import io.fleetdrain.remote.CommandResult;
import io.fleetdrain.remote.CommandRunner;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public final class RecordingRunner implements CommandRunner {
    private final List<List<String>> commands = new ArrayList<>();
    private final Function<List<String>, CommandResult> responder;

    public RecordingRunner(Function<List<String>, CommandResult> responder) {
        this.responder = responder;
    }

    public static RecordingRunner always(CommandResult result) {
        return new RecordingRunner(command -> result);
    }

    @Override
    public synchronized CommandResult run(List<String> command, long timeoutMs) {
        commands.add(List.copyOf(command));
        return responder.apply(command);
    }

    public synchronized List<List<String>> commands() {
        return List.copyOf(commands);
    }

    public synchronized List<String> last() {
        return commands.get(commands.size() - 1);
    }
}
