package me.christianrobert.nativebind.declaration;

/**
 * Field shapes the declaration model knows about but cannot lay out yet.
 */
public enum UnimplementedFieldKind {
    VIRTUAL_BASE("Virtual base"),
    VIRTUAL_BASE_TABLE_POINTER("Virtual base table pointer"),
    NO_UNIQUE_ADDRESS("No-unique-address"),
    UNKNOWN("Unknown");

    private final String description;

    UnimplementedFieldKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
