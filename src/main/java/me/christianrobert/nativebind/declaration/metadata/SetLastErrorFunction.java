package me.christianrobert.nativebind.declaration.metadata;

/**
 * Marks a function whose foreign call must capture the platform error code
 * ({@code errno} / {@code GetLastError}) immediately after returning.
 */
public final class SetLastErrorFunction implements DeclarationMetadataItem {

    public static final SetLastErrorFunction INSTANCE = new SetLastErrorFunction();

    private SetLastErrorFunction() {
    }

    @Override
    public String toString() {
        return "SetLastErrorFunction";
    }
}
