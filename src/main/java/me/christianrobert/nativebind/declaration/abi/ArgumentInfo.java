package me.christianrobert.nativebind.declaration.abi;

/**
 * Passing classification of one argument slot or of the return value.
 */
public final class ArgumentInfo {

    private final ArgumentKind kind;
    private final boolean inRegister;

    public ArgumentInfo(ArgumentKind kind, boolean inRegister) {
        if (kind == null) {
            throw new IllegalArgumentException("Argument kind cannot be null");
        }
        this.kind = kind;
        this.inRegister = inRegister;
    }

    public static ArgumentInfo of(ArgumentKind kind) {
        return new ArgumentInfo(kind, false);
    }

    public ArgumentKind getKind() {
        return kind;
    }

    public boolean isInRegister() {
        return inRegister;
    }

    @Override
    public String toString() {
        return inRegister ? kind + "(inreg)" : kind.toString();
    }
}
