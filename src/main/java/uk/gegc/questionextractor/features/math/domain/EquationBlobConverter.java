package uk.gegc.questionextractor.features.math.domain;

/**
 * Converts the binary payload of an embedded legacy equation object to MathML.
 * Strategy interface so the converter can be swapped or mocked without touching the scanner.
 */
public interface EquationBlobConverter {

    /**
     * Converts one equation blob.
     *
     * @param blob raw bytes of the embedded object part
     * @return converter output containing a {@code <math>} element
     * @throws EquationConversionException if the blob cannot be converted
     */
    String toMathMl(byte[] blob) throws EquationConversionException;
}
