package uk.gegc.questionextractor.features.export.domain.model;

public enum ExportFormat {
    JSON,
    ZIP
}
