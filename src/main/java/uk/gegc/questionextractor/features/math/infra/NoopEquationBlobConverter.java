package uk.gegc.questionextractor.features.math.infra;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.questionextractor.features.math.domain.EquationBlobConverter;
import uk.gegc.questionextractor.features.math.domain.EquationConversionException;

/**
 * Converter used when no external equation converter is configured.
 * Every call fails, so legacy equations are left out of the extracted text.
 * <p>
 * Activated when: app.extractor.equations.converter=none (default)
 */
@Slf4j
public class NoopEquationBlobConverter implements EquationBlobConverter {

    public NoopEquationBlobConverter() {
        log.info("NoopEquationBlobConverter initialized - legacy equations will be skipped");
    }

    @Override
    public String toMathMl(byte[] blob) throws EquationConversionException {
        throw new EquationConversionException("Legacy equation conversion is disabled");
    }
}
