package com.arborstatics.common.exception;

public class CatalogueLoadException extends ArborStaticsException {

    public CatalogueLoadException(String catalogue, String message) {
        super(catalogue, message);
    }

    public CatalogueLoadException(String catalogue, String message, Throwable cause) {
        super(catalogue, message, cause);
    }
}
