package uk.gegc.questionextractor.features.export.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.questionextractor.features.export.application.ExportRenderer;
import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;
import uk.gegc.questionextractor.features.export.domain.model.ExportPayload;
import uk.gegc.questionextractor.features.export.infra.mapping.QuestionExportAssembler;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionImage;
import uk.gegc.questionextractor.features.extraction.domain.model.QuestionRecord;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs every question into its own folder:
 * <pre>
 * question_3/question.json
 * question_3/images/image_1.png
 * </pre>
 * Questions without a number use their 1-based position; a folder name already taken gets
 * {@code _<position>} appended.
 */
@Component
@RequiredArgsConstructor
public class ZipExportRenderer implements ExportRenderer {

    static final String QUESTION_ENTRY = "question.json";
    static final String IMAGES_FOLDER = "images";

    private final ObjectMapper objectMapper;
    private final QuestionExportAssembler assembler;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.ZIP;
    }

    @Override
    public ExportFile render(ExportPayload payload) {
        try {
            byte[] bytes = pack(payload.questions());
            return new ExportFile(payload.filenamePrefix() + ".zip", "application/zip", bytes);
        } catch (IOException e) {
            throw new RuntimeException("Failed to render ZIP export", e);
        }
    }

    private byte[] pack(List<QuestionRecord> questions) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Set<String> usedFolders = new HashSet<>();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (int i = 0; i < questions.size(); i++) {
                QuestionRecord question = questions.get(i);
                String folder = folderName(question, i + 1, usedFolders);

                byte[] json = objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsBytes(assembler.toExportDto(question));
                writeEntry(zip, folder + "/" + QUESTION_ENTRY, json);
                for (QuestionImage image : question.images()) {
                    writeEntry(zip, folder + "/" + IMAGES_FOLDER + "/" + image.filename(), image.content());
                }
            }
        }
        return out.toByteArray();
    }

    static String folderName(QuestionRecord question, int position, Set<String> usedFolders) {
        String folder = "question_" + (question.number() != null ? question.number() : position);
        if (!usedFolders.add(folder)) {
            folder = folder + "_" + position;
            usedFolders.add(folder);
        }
        return folder;
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }
}
