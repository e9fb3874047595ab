package io.fleetdrain.model;

public enum ProbeError {
    CONNECT_TIMEOUT,
    AUTH_FAILURE,
    PARSE_ERROR
}
