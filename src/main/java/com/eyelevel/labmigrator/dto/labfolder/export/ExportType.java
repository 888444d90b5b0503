package com.eyelevel.labmigrator.dto.labfolder.export;

/**
 * The two export formats Labfolder can generate server-side.
 */
public enum ExportType {
    PDF("pdf", "export.pdf"),
    XHTML("xhtml", "export.zip");

    private final String path;
    private final String defaultFileName;

    ExportType(String path, String defaultFileName) {
        this.path = path;
        this.defaultFileName = defaultFileName;
    }

    /**
     * The segment after {@code /exports/} in the Labfolder API.
     */
    public String path() {
        return path;
    }

    public String defaultFileName() {
        return defaultFileName;
    }
}
