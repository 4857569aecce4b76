package uk.gegc.questionextractor.features.extraction.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Type-safe configuration for question extraction.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.extractor")
public class ExtractorProperties {

    /**
     * Letters that introduce multiple-choice options, in order ("a)", "b)", ...).
     */
    @NotBlank
    @Pattern(regexp = "[a-z]+", message = "Option letters must be lower-case ASCII letters")
    private String optionLetters = "abcd";

    /**
     * Extension given to extracted images whose part name has none.
     */
    @NotBlank
    private String defaultImageExtension = "png";

    /**
     * Largest document accepted for extraction (default 20MB).
     */
    @Positive
    private long maxDocumentSizeBytes = 20L * 1024 * 1024;

    @Valid
    @NotNull
    private Equations equations = new Equations();

    @Valid
    @NotNull
    private Cli cli = new Cli();

    @Data
    public static class Equations {
        /**
         * Legacy equation converter: none or command.
         */
        @NotBlank
        private String converter = "none";

        /**
         * Converter program and arguments; {file} is replaced by the path of the equation blob.
         */
        private List<String> command = new ArrayList<>();

        /**
         * Maximum time one conversion may take.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * ProgID prefixes of embedded objects that are treated as equations.
         * Objects without a ProgID are always treated as equations.
         */
        @NotEmpty
        private List<String> progIdPrefixes = new ArrayList<>(List.of("Equation."));
    }

    @Data
    public static class Cli {
        /**
         * Runs a single extraction from command-line arguments on startup.
         */
        private boolean enabled = false;
    }
}
