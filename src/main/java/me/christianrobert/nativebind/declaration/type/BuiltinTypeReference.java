package me.christianrobert.nativebind.declaration.type;

import java.util.EnumMap;
import java.util.Map;

/**
 * Reference to a {@link TargetBuiltinType}.
 */
public final class BuiltinTypeReference extends TypeReference {

    private static final Map<TargetBuiltinType, BuiltinTypeReference> CACHE = new EnumMap<>(TargetBuiltinType.class);

    static {
        for (TargetBuiltinType type : TargetBuiltinType.values()) {
            CACHE.put(type, new BuiltinTypeReference(type));
        }
    }

    private final TargetBuiltinType type;

    private BuiltinTypeReference(TargetBuiltinType type) {
        this.type = type;
    }

    public static BuiltinTypeReference of(TargetBuiltinType type) {
        if (type == null) {
            throw new IllegalArgumentException("Builtin type cannot be null");
        }
        return CACHE.get(type);
    }

    public TargetBuiltinType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return type == ((BuiltinTypeReference) o).type;
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.getKeyword();
    }
}
