package me.christianrobert.nativebind.declaration;

public enum VTableEntryKind {
    VCALL_OFFSET,
    VBASE_OFFSET,
    OFFSET_TO_TOP,
    RTTI,
    FUNCTION_POINTER,
    COMPLETE_DTOR_POINTER,
    DELETING_DTOR_POINTER,
    UNUSED_FUNCTION_POINTER;

    public boolean isFunctionPointer() {
        return switch (this) {
            case FUNCTION_POINTER, COMPLETE_DTOR_POINTER, DELETING_DTOR_POINTER, UNUSED_FUNCTION_POINTER -> true;
            case VCALL_OFFSET, VBASE_OFFSET, OFFSET_TO_TOP, RTTI -> false;
        };
    }
}
