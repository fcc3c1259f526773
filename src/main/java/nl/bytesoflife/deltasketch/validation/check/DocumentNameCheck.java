package nl.bytesoflife.deltasketch.validation.check;

import nl.bytesoflife.deltasketch.model.SketchDocument;
import nl.bytesoflife.deltasketch.validation.SketchCheck;
import nl.bytesoflife.deltasketch.validation.ValidationCode;
import nl.bytesoflife.deltasketch.validation.ValidationIssue;

import java.util.List;

public class DocumentNameCheck implements SketchCheck {

    @Override
    public List<ValidationIssue> check(SketchDocument document) {
        if (document.getName() == null || document.getName().isBlank()) {
            return List.of(new ValidationIssue(ValidationCode.SKETCH_NO_NAME, "Sketch must have a name"));
        }
        return List.of();
    }
}
