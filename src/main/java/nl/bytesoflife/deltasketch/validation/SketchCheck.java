package nl.bytesoflife.deltasketch.validation;

import nl.bytesoflife.deltasketch.model.SketchDocument;

import java.util.List;

/**
 * One family of structural checks. Implementations must not modify the document.
 */
public interface SketchCheck {

    List<ValidationIssue> check(SketchDocument document);
}
