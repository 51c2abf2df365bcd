package me.christianrobert.nativebind.declaration;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque handle identifying a declaration across its immutable revisions.
 *
 * <p>A handle is allocated when a declaration is first created (by the front end or by a pass that
 * synthesizes it) and is carried over by every {@code with...} copy. Two declarations are "the same
 * declaration" when their handles are the same object; structural equality plays no part.</p>
 */
public final class DeclarationId {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long value;

    private DeclarationId(long value) {
        this.value = value;
    }

    public static DeclarationId newId() {
        return new DeclarationId(NEXT_ID.getAndIncrement());
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
