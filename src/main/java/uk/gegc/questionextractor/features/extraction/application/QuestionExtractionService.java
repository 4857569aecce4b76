package uk.gegc.questionextractor.features.extraction.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;
import uk.gegc.questionextractor.features.extraction.infra.docx.DocxPackage;

import java.util.List;

/**
 * Extracts exam questions from the bytes of a {@code .docx} document.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionExtractionService {

    private final QuestionBoundaryScanner boundaryScanner;

    /**
     * @throws uk.gegc.questionextractor.features.extraction.domain.DocumentExtractionException
     *         when the bytes are not a readable package or the body is not well-formed
     */
    public List<QuestionRecord> extract(byte[] docx) {
        try (DocxPackage document = DocxPackage.open(docx)) {
            List<QuestionRecord> records = boundaryScanner.scan(document);
            int images = records.stream().mapToInt(record -> record.images().size()).sum();
            log.info("Extracted {} questions with {} images", records.size(), images);
            return records;
        }
    }
}
