package com.delphine.script.types;

public enum TypeKind {
    INTEGER, FLOAT, STRING, BOOLEAN, VARIANT, NIL, ENUM, ARRAY, SET, RECORD, CLASS, INTERFACE, FUNCTION, JSON, UNKNOWN
}
