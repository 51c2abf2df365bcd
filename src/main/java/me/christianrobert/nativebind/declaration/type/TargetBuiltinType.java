package me.christianrobert.nativebind.declaration.type;

/**
 * Built-in types of the emission target.
 *
 * <p>{@code integral} marks types usable as bit field storage; {@code validUnderlyingEnumType}
 * marks types an emitted enum may be backed by.</p>
 */
public enum TargetBuiltinType {
    VOID("void", 0, false, false),
    BOOL("bool", 1, false, false),
    BYTE("byte", 1, true, true),
    SBYTE("sbyte", 1, true, true),
    SHORT("short", 2, true, true),
    USHORT("ushort", 2, true, true),
    INT("int", 4, true, true),
    UINT("uint", 4, true, true),
    LONG("long", 8, true, true),
    ULONG("ulong", 8, true, true),
    CHAR("char", 2, false, false),
    FLOAT("float", 4, false, false),
    DOUBLE("double", 8, false, false);

    private final String keyword;
    private final int sizeOf;
    private final boolean integral;
    private final boolean validUnderlyingEnumType;

    TargetBuiltinType(String keyword, int sizeOf, boolean integral, boolean validUnderlyingEnumType) {
        this.keyword = keyword;
        this.sizeOf = sizeOf;
        this.integral = integral;
        this.validUnderlyingEnumType = validUnderlyingEnumType;
    }

    public String getKeyword() {
        return keyword;
    }

    public int getSizeOf() {
        return sizeOf;
    }

    public boolean isIntegral() {
        return integral;
    }

    public boolean isValidUnderlyingEnumType() {
        return validUnderlyingEnumType;
    }
}
