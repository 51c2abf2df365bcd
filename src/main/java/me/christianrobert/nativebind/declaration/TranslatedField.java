package me.christianrobert.nativebind.declaration;

/**
 * Base class for instance fields laid out inside a record.
 *
 * @param <SELF> the concrete field class
 */
public abstract class TranslatedField<SELF extends TranslatedField<SELF>> extends AbstractTranslatedDeclaration<SELF> {

    private final int offset;

    TranslatedField(DeclarationInfo info, int offset) {
        super(info);
        this.offset = offset;
    }

    /**
     * Byte offset of the field within its record.
     */
    public int getOffset() {
        return offset;
    }

    public abstract SELF withOffset(int newOffset);
}
