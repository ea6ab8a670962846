package org.carma.deception.safety;

import java.util.*;

/**
 * Raised when run parameters fail validation. Nothing has been computed when this is
 * thrown; the caller must fix the listed fields and resubmit.
 */
public class InvalidParametersException extends IllegalArgumentException {

    private final List<ParameterValidator.ValidationError> errors;

    public InvalidParametersException(List<ParameterValidator.ValidationError> errors) {
        super(buildMessage(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<ParameterValidator.ValidationError> getErrors() {
        return errors;
    }

    /** Field of the first error, for callers that report a single field. */
    public String getField() {
        return errors.isEmpty() ? null : errors.get(0).getField();
    }

    private static String buildMessage(List<ParameterValidator.ValidationError> errors) {
        if (errors.isEmpty()) return "Invalid parameters";
        if (errors.size() == 1) return errors.get(0).toString();
        StringBuilder sb = new StringBuilder("Invalid parameters (" + errors.size() + " errors):");
        for (ParameterValidator.ValidationError error : errors) {
            sb.append("\n  ").append(error);
        }
        return sb.toString();
    }
}
