package io.github.flameyossnowy.simpledb.api.codec;

/**
 * The kinds of values an attribute codec can translate.
 */
public enum FieldKind {
    NUMBER,
    BOOLEAN,
    TIMESTAMP,
    OPAQUE
}
