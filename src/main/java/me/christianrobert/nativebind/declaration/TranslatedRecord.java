package me.christianrobert.nativebind.declaration;

import java.util.List;

/**
 * A C++ struct, class or union with a known layout.
 *
 * <p>The designated {@link #getVTable() vtable}, {@link #getVTableField() vtable field} and
 * {@link #getNonVirtualBaseField() non-virtual base field} are expected to be members of the record.
 * The verifier reports records where they are not, or where only one of vtable / vtable field is set.</p>
 */
public final class TranslatedRecord extends AbstractTranslatedDeclaration<TranslatedRecord> {

    private final RecordKind recordKind;
    private final int size;
    private final List<TranslatedDeclaration> members;
    private final TranslatedVTable vTable;
    private final TranslatedVTableField vTableField;
    private final TranslatedBaseField nonVirtualBaseField;
    private final List<TranslatedDeclaration> unsupportedMembers;

    public TranslatedRecord(TranslatedFile file, String name, RecordKind recordKind, int size) {
        this(new DeclarationInfo(file, name), recordKind == null ? RecordKind.STRUCT : recordKind, size,
                List.of(), null, null, null, List.of());
    }

    public TranslatedRecord(TranslatedFile file, String name) {
        this(file, name, RecordKind.STRUCT, 0);
    }

    private TranslatedRecord(DeclarationInfo info,
                             RecordKind recordKind,
                             int size,
                             List<? extends TranslatedDeclaration> members,
                             TranslatedVTable vTable,
                             TranslatedVTableField vTableField,
                             TranslatedBaseField nonVirtualBaseField,
                             List<? extends TranslatedDeclaration> unsupportedMembers) {
        super(info);
        this.recordKind = recordKind;
        this.size = size;
        this.members = List.copyOf(members);
        this.vTable = vTable;
        this.vTableField = vTableField;
        this.nonVirtualBaseField = nonVirtualBaseField;
        this.unsupportedMembers = List.copyOf(unsupportedMembers);
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.RECORD;
    }

    @Override
    public List<TranslatedDeclaration> getChildren() {
        return members;
    }

    public RecordKind getRecordKind() {
        return recordKind;
    }

    public int getSize() {
        return size;
    }

    public List<TranslatedDeclaration> getMembers() {
        return members;
    }

    public TranslatedVTable getVTable() {
        return vTable;
    }

    public TranslatedVTableField getVTableField() {
        return vTableField;
    }

    public TranslatedBaseField getNonVirtualBaseField() {
        return nonVirtualBaseField;
    }

    /**
     * Native members the front end found but could not model (they are not part of {@link #getMembers()}).
     */
    public List<TranslatedDeclaration> getUnsupportedMembers() {
        return unsupportedMembers;
    }

    public TranslatedRecord withMembers(List<? extends TranslatedDeclaration> newMembers) {
        return new TranslatedRecord(getInfo(), recordKind, size, newMembers, vTable, vTableField, nonVirtualBaseField, unsupportedMembers);
    }

    public TranslatedRecord withVTable(TranslatedVTable newVTable) {
        return new TranslatedRecord(getInfo(), recordKind, size, members, newVTable, vTableField, nonVirtualBaseField, unsupportedMembers);
    }

    public TranslatedRecord withVTableField(TranslatedVTableField newVTableField) {
        return new TranslatedRecord(getInfo(), recordKind, size, members, vTable, newVTableField, nonVirtualBaseField, unsupportedMembers);
    }

    public TranslatedRecord withNonVirtualBaseField(TranslatedBaseField newNonVirtualBaseField) {
        return new TranslatedRecord(getInfo(), recordKind, size, members, vTable, vTableField, newNonVirtualBaseField, unsupportedMembers);
    }

    public TranslatedRecord withUnsupportedMembers(List<? extends TranslatedDeclaration> newUnsupportedMembers) {
        return new TranslatedRecord(getInfo(), recordKind, size, members, vTable, vTableField, nonVirtualBaseField, newUnsupportedMembers);
    }

    public TranslatedRecord withSize(int newSize) {
        return new TranslatedRecord(getInfo(), recordKind, newSize, members, vTable, vTableField, nonVirtualBaseField, unsupportedMembers);
    }

    @Override
    TranslatedRecord withInfo(DeclarationInfo newInfo) {
        return new TranslatedRecord(newInfo, recordKind, size, members, vTable, vTableField, nonVirtualBaseField, unsupportedMembers);
    }

    @Override
    TranslatedRecord self() {
        return this;
    }
}
