package io.fleetdrain.provider;

import io.fleetdrain.remote.CommandResult;

import java.util.List;
import java.util.Locale;

final class CliErrors {
    private static final List<String> PERMANENT_MARKERS = List.of(
            "authorizationfailed",
            "authenticationfailed",
            "az login",
            "notauthorizedornotfound",
            "resourcenotfound",
            "not found",
            "notfound",
            "invalidparameter",
            "invalid parameter",
            "forbidden",
            "unauthorized"
    );
    private static final List<String> TRANSIENT_MARKERS = List.of(
            "toomanyrequests",
            "too many requests",
            "throttl",
            "timed out",
            "timeout",
            "temporarily unavailable",
            "serviceunavailable",
            "service unavailable",
            "internalservererror",
            "internal server error",
            "bad gateway",
            "gateway timeout",
            "connection reset",
            "connection aborted",
            "connection refused",
            "anotheroperationinprogress",
            "retryable"
    );

    private CliErrors() {
    }

    static ProviderError classify(CommandResult result) {
        if (result.status() == CommandResult.Status.TIMED_OUT) {
            return ProviderError.TRANSIENT;
        }
        if (result.status() == CommandResult.Status.SPAWN_FAILED) {
            return ProviderError.PERMANENT;
        }
        String text = result.combinedOutput().toLowerCase(Locale.ROOT);
        for (String marker : PERMANENT_MARKERS) {
            if (text.contains(marker)) {
                return ProviderError.PERMANENT;
            }
        }
        for (String marker : TRANSIENT_MARKERS) {
            if (text.contains(marker)) {
                return ProviderError.TRANSIENT;
            }
        }
        return ProviderError.PERMANENT;
    }

    static String describe(CommandResult result) {
        String text = result.combinedOutput().replace("\r", " ").replace("\n", " ").trim();
        if (text.length() > 300) {
            text = text.substring(0, 300) + "...";
        }
        return result.status() == CommandResult.Status.COMPLETED
                ? "exit=" + result.exitCode() + " " + text
                : result.status().name().toLowerCase(Locale.ROOT) + " " + text;
    }
}
