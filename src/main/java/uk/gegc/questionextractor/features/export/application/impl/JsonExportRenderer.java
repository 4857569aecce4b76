package uk.gegc.questionextractor.features.export.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.questionextractor.features.export.application.ExportRenderer;
import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;
import uk.gegc.questionextractor.features.export.domain.model.ExportPayload;
import uk.gegc.questionextractor.features.export.infra.mapping.QuestionExportAssembler;

import java.nio.charset.StandardCharsets;

@Component
@RequiredArgsConstructor
public class JsonExportRenderer implements ExportRenderer {

    private final ObjectMapper objectMapper;
    private final QuestionExportAssembler assembler;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.JSON;
    }

    @Override
    public ExportFile render(ExportPayload payload) {
        try {
            String filename = payload.filenamePrefix() + ".json";

            // Image bytes are not part of the JSON document, only their filenames
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(assembler.toExportDocument(payload.questions()));
            byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
            return new ExportFile(filename, "application/json", bytes);
        } catch (Exception e) {
            throw new RuntimeException("Failed to render JSON export", e);
        }
    }
}
