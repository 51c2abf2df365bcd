package me.christianrobert.nativebind.declaration;

/**
 * Source file a declaration originated from.
 */
public final class TranslatedFile {

    /**
     * Placeholder for declarations that were synthesized without any source file.
     */
    public static final TranslatedFile SYNTHESIZED = new TranslatedFile("<>Synthesized", false);

    private final String filePath;
    private final boolean wasInScope;

    public TranslatedFile(String filePath, boolean wasInScope) {
        if (filePath == null || filePath.trim().isEmpty()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }
        this.filePath = filePath;
        this.wasInScope = wasInScope;
    }

    public TranslatedFile(String filePath) {
        this(filePath, true);
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * Whether the file was one of the files requested for translation, as opposed to a header that
     * was only pulled in through an include.
     */
    public boolean wasInScope() {
        return wasInScope;
    }

    @Override
    public String toString() {
        return filePath;
    }
}
