package uk.gegc.questionextractor.features.math.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import uk.gegc.questionextractor.features.math.domain.EquationConversionException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CommandEquationBlobConverter")
class CommandEquationBlobConverterTest {

    private static final byte[] MATHML = "<math><mi>x</mi></math>".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("resolveCommand: replaces the placeholder with the blob path")
    void resolveCommand_placeholder() {
        CommandEquationBlobConverter converter =
                new CommandEquationBlobConverter(List.of("convert", "--in={file}", "--mathml"), Duration.ofSeconds(1));

        assertThat(converter.resolveCommand(Path.of("/tmp/eq.bin")))
                .containsExactly("convert", "--in=/tmp/eq.bin", "--mathml");
    }

    @Test
    @DisplayName("resolveCommand: appends the blob path when there is no placeholder")
    void resolveCommand_appendsPath() {
        CommandEquationBlobConverter converter =
                new CommandEquationBlobConverter(List.of("convert"), Duration.ofSeconds(1));

        assertThat(converter.resolveCommand(Path.of("/tmp/eq.bin"))).containsExactly("convert", "/tmp/eq.bin");
    }

    @Test
    @DisplayName("constructor: rejects an empty command or a non-positive timeout")
    void constructor_validates() {
        assertThatThrownBy(() -> new CommandEquationBlobConverter(List.of(), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CommandEquationBlobConverter(List.of("cat"), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("toMathMl: returns the standard output of the command")
    void toMathMl_returnsStdout() throws Exception {
        CommandEquationBlobConverter converter =
                new CommandEquationBlobConverter(List.of("cat", "{file}"), Duration.ofSeconds(10));

        assertThat(converter.toMathMl(MATHML)).isEqualTo("<math><mi>x</mi></math>");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("toMathMl: non-zero exit status fails the conversion")
    void toMathMl_nonZeroExit() {
        CommandEquationBlobConverter converter =
                new CommandEquationBlobConverter(List.of("sh", "-c", "exit 3"), Duration.ofSeconds(10));

        assertThatThrownBy(() -> converter.toMathMl(MATHML))
                .isInstanceOf(EquationConversionException.class)
                .hasMessageContaining("status 3");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("toMathMl: a command that outlives the timeout fails the conversion")
    void toMathMl_timeout() {
        CommandEquationBlobConverter converter =
                new CommandEquationBlobConverter(List.of("sh", "-c", "sleep 5"), Duration.ofMillis(200));

        assertThatThrownBy(() -> converter.toMathMl(MATHML))
                .isInstanceOf(EquationConversionException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("toMathMl: the temporary blob file is removed afterwards")
    void toMathMl_deletesTemporaryFile() throws Exception {
        // The appended path becomes $0 of the shell script
        CommandEquationBlobConverter converter =
                new CommandEquationBlobConverter(List.of("sh", "-c", "echo \"$0\""), Duration.ofSeconds(10));

        Path blobFile = Path.of(converter.toMathMl(MATHML).trim());

        assertThat(blobFile.getFileName().toString()).endsWith(".bin");
        assertThat(Files.exists(blobFile)).isFalse();
    }

    @Test
    @DisplayName("NoopEquationBlobConverter: every conversion fails")
    void noopConverter_alwaysFails() {
        assertThatThrownBy(() -> new NoopEquationBlobConverter().toMathMl(MATHML))
                .isInstanceOf(EquationConversionException.class)
                .hasMessageContaining("disabled");
    }
}
