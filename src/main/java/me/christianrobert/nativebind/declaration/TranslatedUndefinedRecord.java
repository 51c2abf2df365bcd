package me.christianrobert.nativebind.declaration;

/**
 * A record that was only ever forward-declared. Usable behind pointers only.
 */
public final class TranslatedUndefinedRecord extends AbstractTranslatedDeclaration<TranslatedUndefinedRecord> {

    private final RecordKind recordKind;

    public TranslatedUndefinedRecord(TranslatedFile file, String name, RecordKind recordKind) {
        this(new DeclarationInfo(file, name), recordKind);
    }

    private TranslatedUndefinedRecord(DeclarationInfo info, RecordKind recordKind) {
        super(info);
        this.recordKind = recordKind == null ? RecordKind.STRUCT : recordKind;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.UNDEFINED_RECORD;
    }

    public RecordKind getRecordKind() {
        return recordKind;
    }

    @Override
    TranslatedUndefinedRecord withInfo(DeclarationInfo newInfo) {
        return new TranslatedUndefinedRecord(newInfo, recordKind);
    }

    @Override
    TranslatedUndefinedRecord self() {
        return this;
    }
}
