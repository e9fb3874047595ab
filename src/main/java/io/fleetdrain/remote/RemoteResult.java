package io.fleetdrain.remote;

public record RemoteResult(Outcome outcome, int exitCode, String output, String error) {
    public enum Outcome {
        OK,
        CONNECT_FAILED,
        AUTH_FAILED,
        COMMAND_FAILED
    }

    public boolean ok() {
        return outcome == Outcome.OK;
    }

    public boolean transportFailure() {
        return outcome == Outcome.CONNECT_FAILED || outcome == Outcome.AUTH_FAILED;
    }
}
