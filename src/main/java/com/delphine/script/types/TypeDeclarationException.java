package com.delphine.script.types;

/** A script declaration the registry refuses (duplicate, unknown parent, bad override...). */
public class TypeDeclarationException extends RuntimeException {

    public TypeDeclarationException(String message) {
        super(message);
    }
}
