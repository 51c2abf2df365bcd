package me.christianrobert.nativebind.declaration;

/**
 * Closed set of declaration node kinds.
 *
 * <p>Every transformation dispatches on this enum with an exhaustive switch, so adding a kind here
 * forces each dispatcher to decide how the new kind is handled.</p>
 */
public enum DeclarationKind {
    RECORD,
    ENUM,
    ENUM_CONSTANT,
    FUNCTION,
    PARAMETER,
    NORMAL_FIELD,
    BASE_FIELD,
    VTABLE_FIELD,
    BIT_FIELD,
    UNIMPLEMENTED_FIELD,
    STATIC_FIELD,
    VTABLE,
    TYPEDEF,
    UNDEFINED_RECORD,
    UNSUPPORTED_DECLARATION,
    SYNTHESIZED_LOOSE_DECLARATIONS
}
