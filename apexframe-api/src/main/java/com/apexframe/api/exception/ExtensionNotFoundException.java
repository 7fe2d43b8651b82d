package com.apexframe.api.exception;

public class ExtensionNotFoundException extends ApexException {

    public ExtensionNotFoundException(String extensionId) {
        super(ErrorKind.EXTENSION_NOT_FOUND, "Extension not found: " + extensionId);
    }
}
