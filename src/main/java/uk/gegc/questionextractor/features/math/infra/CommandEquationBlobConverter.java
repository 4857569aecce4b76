package uk.gegc.questionextractor.features.math.infra;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.questionextractor.features.math.domain.EquationBlobConverter;
import uk.gegc.questionextractor.features.math.domain.EquationConversionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external converter program for each legacy equation blob.
 * <p>
 * The blob is written to a temporary file whose path replaces the {@code {file}} placeholder in
 * the configured command (or is appended when there is no placeholder). Standard output is the
 * result. Temporary files are removed on every exit path.
 */
@Slf4j
public class CommandEquationBlobConverter implements EquationBlobConverter {

    static final String FILE_PLACEHOLDER = "{file}";

    private final List<String> command;
    private final Duration timeout;

    public CommandEquationBlobConverter(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty() || command.get(0).isBlank()) {
            throw new IllegalArgumentException("Equation converter command must not be empty");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Equation converter timeout must be positive");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public String toMathMl(byte[] blob) throws EquationConversionException {
        Path input = null;
        Path output = null;
        Process process = null;
        try {
            input = Files.createTempFile("equation", ".bin");
            output = Files.createTempFile("equation", ".out");
            Files.write(input, blob);

            process = new ProcessBuilder(resolveCommand(input))
                    .redirectOutput(output.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new EquationConversionException("Equation converter timed out after " + timeout);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new EquationConversionException("Equation converter exited with status " + exitCode);
            }
            return Files.readString(output, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new EquationConversionException("Failed to run equation converter: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EquationConversionException("Interrupted while converting equation", ex);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteTempFile(input);
            deleteTempFile(output);
        }
    }

    List<String> resolveCommand(Path input) {
        List<String> resolved = new ArrayList<>(command.size() + 1);
        boolean placeholderUsed = false;
        for (String part : command) {
            if (part.contains(FILE_PLACEHOLDER)) {
                resolved.add(part.replace(FILE_PLACEHOLDER, input.toString()));
                placeholderUsed = true;
            } else {
                resolved.add(part);
            }
        }
        if (!placeholderUsed) {
            resolved.add(input.toString());
        }
        return resolved;
    }

    private void deleteTempFile(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Could not delete temporary equation file {}: {}", file, ex.getMessage());
        }
    }
}
