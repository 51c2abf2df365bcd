package me.christianrobert.nativebind.emission;

import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.transformation.context.TransformationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Hands a verified library to a {@link DeclarationEmitter}, depth first in tree order.
 *
 * <p>A declaration with an Error diagnostic is not emitted, and neither is anything below it.</p>
 */
public class EmissionWalker {

    private static final Logger log = LoggerFactory.getLogger(EmissionWalker.class);

    private final DeclarationEmitter emitter;

    public EmissionWalker(DeclarationEmitter emitter) {
        if (emitter == null) {
            throw new IllegalArgumentException("Emitter cannot be null");
        }
        this.emitter = emitter;
    }

    /**
     * @return number of declarations handed to the emitter
     */
    public int emit(TranslatedLibrary library) {
        if (library == null) {
            throw new IllegalArgumentException("Library cannot be null");
        }
        Counts counts = new Counts();
        walk(new TransformationContext(library), library.getDeclarations(), counts);
        log.info("Emitted {} declarations, skipped {} erroring declarations", counts.emitted, counts.skipped);
        return counts.emitted;
    }

    private void walk(TransformationContext context, List<TranslatedDeclaration> declarations, Counts counts) {
        for (TranslatedDeclaration declaration : declarations) {
            if (!declaration.isEmittable()) {
                log.debug("Skipping {}: has errors", context.describe(declaration));
                counts.skipped++;
                continue;
            }
            emitter.emit(declaration, context);
            counts.emitted++;
            walk(context.add(declaration), declaration.getChildren(), counts);
        }
    }

    private static class Counts {
        int emitted;
        int skipped;
    }
}
