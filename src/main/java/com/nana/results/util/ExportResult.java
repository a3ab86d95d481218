package com.nana.results.util;

import java.nio.file.Path;

/**
 * ExportResult - Outcome of a File Export
 *
 * <p>Exporters return this instead of throwing, so callers branch on
 * {@link #isSuccess()} and show {@link #getSummary()}.
 */
public final class ExportResult {

    private final boolean success;
    private final Path    outputPath;
    private final int     rowsWritten;
    private final long    fileSizeBytes;
    private final String  errorMessage;

    private ExportResult(boolean success, Path outputPath, int rowsWritten,
                         long fileSizeBytes, String errorMessage) {
        this.success       = success;
        this.outputPath    = outputPath;
        this.rowsWritten   = rowsWritten;
        this.fileSizeBytes = fileSizeBytes;
        this.errorMessage  = errorMessage;
    }

    public static ExportResult success(Path outputPath, int rowsWritten, long fileSizeBytes) {
        return new ExportResult(true, outputPath, rowsWritten, fileSizeBytes, null);
    }

    public static ExportResult failure(String errorMessage) {
        return new ExportResult(false, null, 0, 0, errorMessage);
    }

    public boolean isSuccess()      { return success; }

    public Path getOutputPath()     { return outputPath; }

    public int getRowsWritten()     { return rowsWritten; }

    public long getFileSizeBytes()  { return fileSizeBytes; }

    public String getErrorMessage() { return errorMessage; }

    public String getFileSizeFormatted() {
        if (fileSizeBytes < 1024) {
            return fileSizeBytes + " B";
        } else if (fileSizeBytes < 1024 * 1024) {
            return String.format("%.1f KB", fileSizeBytes / 1024.0);
        } else {
            return String.format("%.1f MB", fileSizeBytes / (1024.0 * 1024));
        }
    }

    public String getSummary() {
        if (success) {
            return String.format("Exported %d rows to '%s' (%s).",
                    rowsWritten,
                    outputPath != null ? outputPath.getFileName() : "unknown",
                    getFileSizeFormatted());
        }
        return "Export failed: " + errorMessage;
    }

    @Override
    public String toString() {
        return "ExportResult{success=" + success
               + (success
                   ? ", rows=" + rowsWritten + ", size=" + getFileSizeFormatted()
                   : ", error='" + errorMessage + "'")
               + "}";
    }
}
