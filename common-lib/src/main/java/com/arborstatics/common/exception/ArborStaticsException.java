package com.arborstatics.common.exception;

public class ArborStaticsException extends RuntimeException {
    private final String component;

    public ArborStaticsException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public ArborStaticsException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
