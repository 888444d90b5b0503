package com.eyelevel.labmigrator.service.export;

import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportType;
import com.eyelevel.labmigrator.dto.labfolder.export.PdfExportRequest;
import com.eyelevel.labmigrator.exception.ExportException;
import com.eyelevel.labmigrator.model.Attachment;
import com.eyelevel.labmigrator.model.ProjectGroup;
import com.eyelevel.labmigrator.service.export.LabfolderExportService.ExportedFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Produces the Labfolder PDF export of a project as an experiment attachment. PDFs are cached as
 * {@code <projectId>_<title>.pdf}; a cached PDF is reused instead of asking Labfolder for a new export.
 */
@Slf4j
@Service
public class ProjectPdfExporter {

    private static final String EXTENSION = ".pdf";

    private final LabfolderExportService exportService;
    private final MigrationConfig migrationConfig;

    public ProjectPdfExporter(LabfolderExportService exportService, MigrationConfig migrationConfig) {
        this.exportService = exportService;
        this.migrationConfig = migrationConfig;
    }

    public boolean isEnabled() {
        return migrationConfig.getExport().getPdf().isEnabled();
    }

    /**
     * @return The project PDF, or empty for the ungrouped bucket, which has no Labfolder project to export.
     * @throws ExportException if a cached PDF cannot be read or the export fails.
     */
    public Optional<Attachment> projectPdf(ProjectGroup group) {
        if (group.isUngrouped()) {
            return Optional.empty();
        }
        String projectId = group.projectId();
        Path cacheDir = migrationConfig.getExport().getPdf().getCacheDir();
        Optional<Path> cached = findCached(cacheDir, projectId);
        if (cached.isPresent()) {
            log.info("Project {}: reusing cached PDF export {}.", projectId, cached.get());
            return Optional.of(attachment(cached.get().getFileName().toString(), read(cached.get())));
        }

        String fileName = safeName(projectId) + "_" + safeName(group.title()) + EXTENSION;
        ExportedFile exported = exportService.export(ExportType.PDF, PdfExportRequest.forProject(projectId, fileName));
        String exportedName = FilenameUtils.getName(exported.fileName());
        if (exportedName == null || exportedName.isBlank()) {
            exportedName = fileName;
        } else if (!exportedName.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            exportedName = exportedName + EXTENSION;
        }
        store(cacheDir, fileName, exported.content());
        return Optional.of(attachment(exportedName, exported.content()));
    }

    /**
     * Letters, digits and {@code -_ .} are kept, everything else becomes {@code _}.
     */
    static String safeName(String value) {
        String safe = value == null ? "" : value.replaceAll("[^\\p{L}\\p{N}\\-_ .]", "_").strip();
        return safe.isEmpty() ? "project" : safe;
    }

    private static Optional<Path> findCached(Path cacheDir, String projectId) {
        if (cacheDir == null || !Files.isDirectory(cacheDir)) {
            return Optional.empty();
        }
        String prefix = safeName(projectId) + "_";
        try (Stream<Path> files = Files.list(cacheDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> {
                        String name = file.getFileName().toString();
                        return name.startsWith(prefix) && name.toLowerCase(Locale.ROOT).endsWith(EXTENSION);
                    })
                    .max(Comparator.comparingLong(file -> file.toFile().lastModified()));
        } catch (IOException e) {
            log.warn("Could not list the PDF cache {}: {}", cacheDir, e.getMessage());
            return Optional.empty();
        }
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ExportException("Could not read cached PDF " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * A PDF that cannot be cached is still attached; the next run exports it again.
     */
    private static void store(Path cacheDir, String fileName, byte[] content) {
        if (cacheDir == null) {
            return;
        }
        try {
            Files.createDirectories(cacheDir);
            Path target = cacheDir.resolve(fileName);
            Path tempFile = Files.createTempFile(cacheDir, fileName, ".tmp");
            Files.write(tempFile, content);
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Cached PDF export as {}.", target);
        } catch (IOException e) {
            log.warn("Could not cache PDF export {} in {}: {}", fileName, cacheDir, e.getMessage());
        }
    }

    private static Attachment attachment(String fileName, byte[] content) {
        return Attachment.builder()
                .fileName(fileName)
                .mimeType(MediaType.APPLICATION_PDF_VALUE)
                .content(content)
                .build();
    }
}
