package uk.gegc.questionextractor.features.math.domain;

/**
 * Exception thrown when a legacy equation blob cannot be converted to MathML.
 */
public class EquationConversionException extends Exception {

    public EquationConversionException(String message) {
        super(message);
    }

    public EquationConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
