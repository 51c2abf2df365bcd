package me.christianrobert.nativebind.transformation.common;

import me.christianrobert.nativebind.declaration.TranslatedDeclaration;
import me.christianrobert.nativebind.declaration.TranslatedLibrary;
import me.christianrobert.nativebind.transformation.TransformationBase;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves root declarations carrying Error diagnostics out of the tree and into
 * {@link TranslatedLibrary#getBrokenDeclarations()}.
 *
 * <p>Nested declarations with errors stay where they are; the emission walker skips them individually.</p>
 */
public class BrokenDeclarationExtractor extends TransformationBase {

    @Override
    protected TranslatedLibrary postTransformLibrary(TranslatedLibrary library) {
        List<TranslatedDeclaration> kept = new ArrayList<>();
        List<TranslatedDeclaration> broken = new ArrayList<>(library.getBrokenDeclarations());

        for (TranslatedDeclaration declaration : library.getDeclarations()) {
            if (declaration.hasErrors()) {
                broken.add(declaration);
            } else {
                kept.add(declaration);
            }
        }

        if (broken.size() == library.getBrokenDeclarations().size()) {
            return library;
        }
        return library.withDeclarations(kept).withBrokenDeclarations(broken);
    }
}
