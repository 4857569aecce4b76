package uk.gegc.questionextractor.features.extraction.application;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import uk.gegc.questionextractor.features.extraction.domain.DocumentExtractionException;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;
import uk.gegc.questionextractor.features.math.infra.NoopEquationBlobConverter;
import uk.gegc.questionextractor.testsupport.DocxTestDocuments;
import uk.gegc.questionextractor.testsupport.TestExtractors;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.questionextractor.testsupport.DocxTestDocuments.drawing;
import static uk.gegc.questionextractor.testsupport.DocxTestDocuments.text;

@DisplayName("QuestionExtractionService")
class QuestionExtractionServiceTest {

    private final QuestionExtractionService service = TestExtractors.extractionService(new NoopEquationBlobConverter());

    private ListAppender<ILoggingEvent> listAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(QuestionExtractionService.class);
        listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(listAppender);
    }

    @Test
    @DisplayName("extract: returns the records and logs a summary")
    void extract_logsSummary() {
        byte[] docx = DocxTestDocuments.builder()
                .paragraph(text("1. With picture"), drawing("rId5"))
                .paragraph(text("2. Without"))
                .image("rId5", "media/image1.png", new byte[]{7})
                .build();

        List<QuestionRecord> records = service.extract(docx);

        assertThat(records).hasSize(2);
        assertThat(listAppender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.INFO);
                    assertThat(event.getFormattedMessage()).isEqualTo("Extracted 2 questions with 1 images");
                });
    }

    @Test
    @DisplayName("extract: unreadable input fails with DocumentExtractionException")
    void extract_notAPackage() {
        assertThatThrownBy(() -> service.extract("plain text".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(DocumentExtractionException.class);
    }

    @Test
    @DisplayName("extract: a package without its relationships part gives no records")
    void extract_missingRelationships() {
        byte[] docx = DocxTestDocuments.builder()
                .paragraph(text("1. Question"))
                .withoutDocumentRelationships()
                .build();

        assertThat(service.extract(docx)).isEmpty();
    }
}
