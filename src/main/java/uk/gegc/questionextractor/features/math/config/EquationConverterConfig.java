package uk.gegc.questionextractor.features.math.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.questionextractor.features.extraction.config.ExtractorProperties;
import uk.gegc.questionextractor.features.math.domain.EquationBlobConverter;
import uk.gegc.questionextractor.features.math.infra.CommandEquationBlobConverter;
import uk.gegc.questionextractor.features.math.infra.NoopEquationBlobConverter;

/**
 * Selects the {@link EquationBlobConverter} from app.extractor.equations.converter.
 * <p>
 * Supported values:
 * - command: external converter program (app.extractor.equations.command)
 * - none: legacy equations are skipped (default)
 */
@Slf4j
@Configuration
public class EquationConverterConfig {

    @Bean
    @ConditionalOnProperty(name = "app.extractor.equations.converter", havingValue = "command")
    public EquationBlobConverter commandEquationBlobConverter(ExtractorProperties properties) {
        ExtractorProperties.Equations equations = properties.getEquations();
        log.info("Activating command equation converter: {}", equations.getCommand());
        return new CommandEquationBlobConverter(equations.getCommand(), equations.getTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "app.extractor.equations.converter", havingValue = "none", matchIfMissing = true)
    public EquationBlobConverter noopEquationBlobConverter() {
        log.info("Activating no-op equation converter (legacy equations will be skipped)");
        return new NoopEquationBlobConverter();
    }
}
