package uk.gegc.questionextractor.features.extraction.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.questionextractor.features.export.application.QuestionExportService;
import uk.gegc.questionextractor.features.export.domain.model.ExportFile;
import uk.gegc.questionextractor.features.export.domain.model.ExportFormat;

import java.io.IOException;

/**
 * REST controller for question extraction from uploaded {@code .docx} exam documents.
 */
@RestController
@RequestMapping("/api/v1/extractions")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Question Extraction", description = "Extract numbered exam questions, options, keys, hints, equations and images from Word documents")
public class QuestionExtractionController {

    private final QuestionExportService exportService;

    @Operation(
            summary = "Extract questions",
            description = "Uploads a .docx document and returns its questions as a JSON document or as a zip with one folder per question"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Questions extracted and rendered"),
            @ApiResponse(responseCode = "400", description = "File is empty, missing or too large, or the format is unknown"),
            @ApiResponse(responseCode = "415", description = "File is not a .docx document"),
            @ApiResponse(responseCode = "422", description = "File is not a readable word-processing package")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Resource> extract(
            @Parameter(description = "Document file to upload", required = true) @RequestParam("file") MultipartFile file,
            @Parameter(description = "Output format, JSON when omitted") @RequestParam(value = "format", required = false) ExportFormat format) throws IOException {

        log.info("Extracting questions: originalName={}, size={}, format={}", file.getOriginalFilename(), file.getSize(), format);

        ExportFile exportFile = exportService.export(file.getOriginalFilename(), file.getBytes(), format);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exportFile.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + exportFile.filename() + "\"")
                .contentLength(exportFile.contentLength())
                .body(new ByteArrayResource(exportFile.content()));
    }
}
