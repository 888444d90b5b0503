package com.eyelevel.labmigrator.service.export;

import com.eyelevel.labmigrator.common.apiclient.labfolder.LabfolderApiClient;
import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportResponse;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportType;
import com.eyelevel.labmigrator.dto.labfolder.export.XhtmlExportRequest;
import com.eyelevel.labmigrator.exception.ExportException;
import com.eyelevel.labmigrator.model.Attachment;
import com.eyelevel.labmigrator.service.export.LabfolderExportService.ExportedFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Finds the Labfolder XHTML export of the notebook in the export cache directory and reads project artifacts
 * from it.
 *
 * <p>An extracted export ({@code labfolder_xhtml_<id>/}) is preferred; a cached zip is extracted next to it.
 * Labfolder is only asked for an export when the run is restricted to the projects an export contains. The
 * chosen root is kept for the rest of the run.
 */
@Slf4j
@Service
public class XhtmlExportStore {

    static final String EXPORT_PREFIX = "labfolder_xhtml_";
    private static final String LEGACY_PREFIX = "xhtml_";
    private static final String ZIP_EXTENSION = ".zip";
    private static final String STAGING_SUFFIX = ".partial";
    private static final String PROJECTS_DIR = "projects";
    private static final String INDEX_FILE = "index.html";
    private static final String SPREADSHEET_EXTENSION = ".xlsx";
    private static final int MAX_PROJECTS_DEPTH = 6;

    private final LabfolderApiClient labfolderApiClient;
    private final LabfolderExportService exportService;
    private final MigrationConfig migrationConfig;

    private Path root;
    private boolean prepared;

    public XhtmlExportStore(LabfolderApiClient labfolderApiClient, LabfolderExportService exportService,
                            MigrationConfig migrationConfig) {
        this.labfolderApiClient = labfolderApiClient;
        this.exportService = exportService;
        this.migrationConfig = migrationConfig;
    }

    public boolean isEnabled() {
        MigrationConfig.Xhtml xhtml = migrationConfig.getExport().getXhtml();
        return xhtml.isAttachArtifacts() || xhtml.isOnlyProjectsFromXhtml();
    }

    /**
     * Chooses the export root for this run. With {@code only-projects-from-xhtml} a cached export that lacks
     * one of the projects is replaced by a newer export from Labfolder.
     *
     * @param projectIds The projects about to be imported.
     * @return The root, or empty when no export is available.
     */
    public synchronized Optional<Path> prepare(Collection<String> projectIds) {
        root = localRoot().orElse(null);
        prepared = true;
        if (!migrationConfig.getExport().getXhtml().isOnlyProjectsFromXhtml()) {
            if (root == null) {
                log.info("No local XHTML export found; continuing without XHTML attachments.");
            } else {
                log.info("Using local XHTML export {}.", root);
            }
            return Optional.ofNullable(root);
        }

        List<String> missing = root == null ? List.copyOf(projectIds) : missingProjects(root, projectIds);
        if (!missing.isEmpty()) {
            log.info("XHTML export cache lacks {} project(s), requesting a current export.", missing.size());
            try {
                root = requestRoot();
            } catch (RuntimeException e) {
                log.warn("Could not obtain an XHTML export from Labfolder: {}", e.getMessage());
            }
        }
        return Optional.ofNullable(root);
    }

    public synchronized Optional<Path> root() {
        if (!prepared) {
            root = localRoot().orElse(null);
            prepared = true;
        }
        return Optional.ofNullable(root);
    }

    /**
     * A project is in the export when a directory under a {@code projects} folder is named after its id and
     * holds an {@code index.html}.
     */
    public boolean containsProject(Path exportRoot, String projectId) {
        return !projectDirectories(exportRoot, projectId, false).isEmpty();
    }

    /**
     * The {@code index.html} and every spreadsheet of the project's newest export folder.
     *
     * @throws ExportException if a file of the export cannot be read.
     */
    public List<ExportArtifact> projectArtifacts(String projectId) {
        Optional<Path> exportRoot = root();
        if (exportRoot.isEmpty() || projectId == null) {
            return List.of();
        }
        Optional<Path> projectDir = projectDirectories(exportRoot.get(), projectId, true).stream()
                .max(Comparator.comparingLong(dir -> dir.toFile().lastModified()));
        if (projectDir.isEmpty()) {
            log.debug("Project {} is not in the XHTML export {}.", projectId, exportRoot.get());
            return List.of();
        }

        List<Path> files = new ArrayList<>();
        Path index = projectDir.get().resolve(INDEX_FILE);
        if (Files.isRegularFile(index)) {
            files.add(index);
        }
        try (Stream<Path> walk = Files.walk(projectDir.get())) {
            walk.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT)
                            .endsWith(SPREADSHEET_EXTENSION))
                    .sorted()
                    .forEach(files::add);
        } catch (IOException e) {
            throw new ExportException("Could not list XHTML export folder " + projectDir.get() + ": "
                                      + e.getMessage(), e);
        }

        List<ExportArtifact> artifacts = new ArrayList<>();
        for (Path file : files) {
            String relative = projectDir.get().relativize(file).toString().replace('\\', '/');
            artifacts.add(new ExportArtifact("xhtml/" + relative, attachment(file)));
        }
        return artifacts;
    }

    private List<String> missingProjects(Path exportRoot, Collection<String> projectIds) {
        return projectIds.stream().filter(id -> !containsProject(exportRoot, id)).toList();
    }

    private Optional<Path> localRoot() {
        Path cacheDir = migrationConfig.getExport().getXhtml().getCacheDir();
        if (cacheDir == null || !Files.isDirectory(cacheDir)) {
            return Optional.empty();
        }
        Optional<Path> extracted = newest(cacheDir, true);
        if (extracted.isPresent()) {
            log.debug("Reusing extracted XHTML export {}.", extracted.get());
            return extracted;
        }
        Optional<Path> zip = newest(cacheDir, false);
        if (zip.isEmpty()) {
            return Optional.empty();
        }
        String name = zip.get().getFileName().toString();
        String token = name.substring(name.startsWith(EXPORT_PREFIX) ? EXPORT_PREFIX.length() : LEGACY_PREFIX.length(),
                                      name.length() - ZIP_EXTENSION.length());
        Path outDir = cacheDir.resolve(EXPORT_PREFIX + token);
        try {
            extract(zip.get(), outDir);
            return Optional.of(outDir);
        } catch (ExportException e) {
            log.warn("Ignoring cached XHTML export {}: {}", zip.get(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reuses the newest finished XHTML export of the account, or starts a new one, and extracts it into the
     * cache directory.
     */
    private Path requestRoot() {
        Optional<ExportResponse> finished = labfolderApiClient.listExports(ExportType.XHTML, ExportResponse.FINISHED)
                .stream()
                .filter(export -> export.id() != null)
                .max(Comparator.comparing(export -> Objects.toString(export.creationDate(), "")));
        String exportId;
        if (finished.isPresent()) {
            exportId = finished.get().id();
            log.info("Reusing finished XHTML export {}.", exportId);
        } else {
            exportId = labfolderApiClient.createExport(ExportType.XHTML, new XhtmlExportRequest(false));
            exportService.awaitFinished(ExportType.XHTML, exportId);
        }

        Path cacheDir = migrationConfig.getExport().getXhtml().getCacheDir();
        String token = ProjectPdfExporter.safeName(exportId);
        Path zip = cacheDir.resolve(EXPORT_PREFIX + token + ZIP_EXTENSION);
        if (!Files.isRegularFile(zip)) {
            ExportedFile download = exportService.download(ExportType.XHTML, exportId, null);
            write(zip, download.content());
        }
        Path outDir = cacheDir.resolve(EXPORT_PREFIX + token);
        extract(zip, outDir);
        return outDir;
    }

    private static Optional<Path> newest(Path cacheDir, boolean directories) {
        try (Stream<Path> children = Files.list(cacheDir)) {
            return children
                    .filter(path -> directories ? Files.isDirectory(path) : Files.isRegularFile(path))
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        boolean prefixed = (name.startsWith(EXPORT_PREFIX) || name.startsWith(LEGACY_PREFIX))
                                           && !name.endsWith(STAGING_SUFFIX);
                        return prefixed && (directories || name.toLowerCase(Locale.ROOT).endsWith(ZIP_EXTENSION));
                    })
                    .max(Comparator.comparingLong(path -> path.toFile().lastModified()));
        } catch (IOException e) {
            log.warn("Could not list the XHTML export cache {}: {}", cacheDir, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Directories under any {@code projects} folder of the export that are named after the project.
     */
    private static List<Path> projectDirectories(Path exportRoot, String projectId, boolean prefixOnly) {
        if (exportRoot == null || projectId == null || !Files.isDirectory(exportRoot)) {
            return List.of();
        }
        List<Path> matches = new ArrayList<>();
        try (Stream<Path> projectsRoots = Files.walk(exportRoot, MAX_PROJECTS_DEPTH)) {
            for (Path projectsRoot : projectsRoots.filter(Files::isDirectory)
                    .filter(dir -> PROJECTS_DIR.equals(Objects.toString(dir.getFileName(), "")))
                    .toList()) {
                try (Stream<Path> dirs = Files.walk(projectsRoot)) {
                    dirs.filter(Files::isDirectory)
                            .filter(dir -> namedAfter(dir.getFileName().toString(), projectId, prefixOnly))
                            .filter(dir -> prefixOnly || Files.isRegularFile(dir.resolve(INDEX_FILE)))
                            .forEach(matches::add);
                }
            }
        } catch (IOException e) {
            throw new ExportException("Could not search XHTML export " + exportRoot + ": " + e.getMessage(), e);
        }
        return matches;
    }

    static boolean namedAfter(String directoryName, String projectId, boolean prefixOnly) {
        if (prefixOnly) {
            return directoryName.startsWith(projectId + "_");
        }
        return directoryName.equals(projectId)
               || directoryName.startsWith(projectId + "_")
               || directoryName.endsWith("_" + projectId)
               || directoryName.contains("_" + projectId + "_");
    }

    /**
     * Unpacks the zip into {@code outDir} unless that folder already exists. Entries that would land outside
     * {@code outDir} are rejected.
     *
     * @throws ExportException if the zip is corrupt or cannot be written out.
     */
    static void extract(Path zip, Path outDir) {
        if (Files.isDirectory(outDir)) {
            return;
        }
        Path target = outDir.toAbsolutePath().normalize();
        Path staging = target.resolveSibling(target.getFileName() + STAGING_SUFFIX);
        try {
            FileUtils.deleteDirectory(staging.toFile());
            Files.createDirectories(staging);
            try (InputStream in = Files.newInputStream(zip); ZipInputStream zis = new ZipInputStream(in)) {
                ZipEntry entry;
                int count = 0;
                while ((entry = zis.getNextEntry()) != null) {
                    Path file = staging.resolve(entry.getName()).normalize();
                    if (!file.startsWith(staging)) {
                        throw new ExportException("Zip entry '" + entry.getName() + "' escapes " + outDir);
                    }
                    if (entry.isDirectory()) {
                        Files.createDirectories(file);
                    } else {
                        Files.createDirectories(file.getParent());
                        Files.copy(zis, file, StandardCopyOption.REPLACE_EXISTING);
                        count++;
                    }
                    zis.closeEntry();
                }
                if (count == 0) {
                    throw new ExportException("Not a zip archive or empty: " + zip);
                }
            }
            Files.move(staging, target);
            log.info("Extracted XHTML export {} to {}.", zip, target);
        } catch (ZipException e) {
            throw new ExportException("Invalid or corrupted zip " + zip + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ExportException("Could not extract " + zip + ": " + e.getMessage(), e);
        } finally {
            FileUtils.deleteQuietly(staging.toFile());
        }
    }

    private static void write(Path file, byte[] content) {
        try {
            Files.createDirectories(file.getParent());
            Path tempFile = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            Files.write(tempFile, content);
            try {
                Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ExportException("Could not store XHTML export " + file + ": " + e.getMessage(), e);
        }
    }

    private static Attachment attachment(Path file) {
        String fileName = file.getFileName().toString();
        try {
            return Attachment.builder()
                    .fileName(fileName)
                    .mimeType(MediaTypeFactory.getMediaType(fileName).map(MediaType::toString)
                                      .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE))
                    .content(Files.readAllBytes(file))
                    .build();
        } catch (IOException e) {
            throw new ExportException("Could not read XHTML export file " + file + ": " + e.getMessage(), e);
        }
    }
}
