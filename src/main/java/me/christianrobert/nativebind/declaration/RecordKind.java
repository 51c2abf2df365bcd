package me.christianrobert.nativebind.declaration;

public enum RecordKind {
    STRUCT,
    CLASS,
    UNION
}
