package com.eyelevel.labmigrator.service.importer;

import com.eyelevel.labmigrator.common.apiclient.elabftw.ElabftwApiClient;
import com.eyelevel.labmigrator.common.json.JsonParser;
import com.eyelevel.labmigrator.common.json.JsonSerializer;
import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentMetadata;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentMetadata.ExtraField;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentPatchRequest;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentResponse;
import com.eyelevel.labmigrator.dto.elabftw.UploadResponse;
import com.eyelevel.labmigrator.exception.ExperimentImportException;
import com.eyelevel.labmigrator.model.Attachment;
import com.eyelevel.labmigrator.model.Author;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.EntryTransformation;
import com.eyelevel.labmigrator.model.GroupImportResult;
import com.eyelevel.labmigrator.model.ImportStatus;
import com.eyelevel.labmigrator.model.MigrationFailure;
import com.eyelevel.labmigrator.model.ProjectGroup;
import com.eyelevel.labmigrator.model.TransformedUnit;
import com.eyelevel.labmigrator.model.UploadedAttachment;
import com.eyelevel.labmigrator.service.export.ExportArtifact;
import com.eyelevel.labmigrator.service.export.ProjectPdfExporter;
import com.eyelevel.labmigrator.service.export.XhtmlExportStore;
import com.eyelevel.labmigrator.service.importer.ImportLedger.LedgerRecord;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Writes one project group into eLabFTW as one experiment: create, upload attachments, patch body and metadata,
 * link the ISA study.
 *
 * <p>When enabled, the project's Labfolder PDF and XHTML export files are uploaded next to the body.
 *
 * <p>Only a failed creation stops the group before anything is written. Upload failures leave the
 * attachment's placeholder in the body; a failed patch leaves the experiment partially populated and marked
 * incomplete in the {@link ImportLedger}, so the next run continues in the same experiment.
 */
@Slf4j
@Service
public class ExperimentImportService {

    static final String FIELD_OWNER = "Project Owner";
    static final String FIELD_CREATION_DATE = "Project creation date";
    static final String FIELD_PROJECT_ID = "Labfolder Project ID";
    static final String FIELD_ISA_STUDY = "ISA-Study";
    static final String PDF_EXPORT_KEY = "pdf";
    // ledger key prefix of export files
    private static final String EXPORT_KEY_PREFIX = "export:";

    private final ElabftwApiClient elabftwApiClient;
    private final RetryTemplate uploadRetryTemplate;
    private final ExperimentBodyBuilder bodyBuilder;
    private final MetadataResolver metadataResolver;
    private final ImportLedger importLedger;
    private final MigrationConfig migrationConfig;
    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;
    private final ProjectPdfExporter projectPdfExporter;
    private final XhtmlExportStore xhtmlExportStore;

    public ExperimentImportService(ElabftwApiClient elabftwApiClient,
                                   @Qualifier("uploadRetryTemplate") RetryTemplate uploadRetryTemplate,
                                   ExperimentBodyBuilder bodyBuilder,
                                   MetadataResolver metadataResolver,
                                   ImportLedger importLedger,
                                   MigrationConfig migrationConfig,
                                   @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer,
                                   @Qualifier("jacksonJsonParser") JsonParser jsonParser,
                                   ProjectPdfExporter projectPdfExporter,
                                   XhtmlExportStore xhtmlExportStore) {
        this.elabftwApiClient = elabftwApiClient;
        this.uploadRetryTemplate = uploadRetryTemplate;
        this.bodyBuilder = bodyBuilder;
        this.metadataResolver = metadataResolver;
        this.importLedger = importLedger;
        this.migrationConfig = migrationConfig;
        this.jsonSerializer = jsonSerializer;
        this.jsonParser = jsonParser;
        this.projectPdfExporter = projectPdfExporter;
        this.xhtmlExportStore = xhtmlExportStore;
    }

    /**
     * Imports the group.
     *
     * @param transformations The transformed entries of the group, in group order.
     * @return The outcome; GROUP and ATTACHMENT failures are reported in it rather than thrown.
     */
    public GroupImportResult importGroup(ProjectGroup group, List<EntryTransformation> transformations) {
        String key = group.key();
        Optional<LedgerRecord> previous = importLedger.find(key);
        if (previous.filter(LedgerRecord::completed).isPresent()) {
            log.info("Project {} was already migrated to experiment {}; skipping.", key,
                     previous.get().experimentId());
            return GroupImportResult.skipped(group.projectId(), previous.get().experimentId());
        }

        List<MigrationFailure> failures = new ArrayList<>();
        String experimentId;
        if (previous.isPresent()) {
            experimentId = previous.get().experimentId();
            log.info("Project {}: resuming incomplete experiment {}.", key, experimentId);
        } else {
            try {
                experimentId = elabftwApiClient.createExperiment(group.title(), group.tags());
            } catch (RuntimeException e) {
                log.error("Project {}: creating the experiment failed: {}", key, e.getMessage());
                failures.add(MigrationFailure.group(group.projectId(), null,
                                                    "Experiment creation failed: " + e.getMessage()));
                return new GroupImportResult(group.projectId(), null, ImportStatus.FAILED, null, List.of(),
                                             failures);
            }
            try {
                importLedger.recordStarted(key, experimentId);
            } catch (ExperimentImportException e) {
                log.error("Project {}: experiment {} was created but could not be recorded: {}", key,
                          experimentId, e.getMessage());
                failures.add(MigrationFailure.group(group.projectId(), experimentId,
                                                    "Recording experiment " + experimentId
                                                    + " in the import ledger failed: " + e.getMessage()));
                return new GroupImportResult(group.projectId(), experimentId, ImportStatus.FAILED, null,
                                             List.of(), failures);
            }
        }

        List<UploadedAttachment> uploads = new ArrayList<>();
        Map<String, List<String>> fragmentsByEntry = new LinkedHashMap<>();
        for (EntryTransformation transformation : transformations) {
            List<String> fragments = new ArrayList<>();
            for (TransformedUnit unit : transformation.units()) {
                fragments.add(resolveFragment(group, experimentId, unit, uploads, failures));
            }
            fragmentsByEntry.put(transformation.entry().getId(), fragments);
        }
        String body = bodyBuilder.build(group, fragmentsByEntry);

        Optional<String> isaId = metadataResolver.isaIdFor(group.projectId());
        Entry first = group.firstEntry();
        Author owner = first == null ? null : first.getAuthor();
        try {
            ExperimentPatchRequest patch = new ExperimentPatchRequest(
                    body, migrationConfig.getImport().getCategory(),
                    jsonSerializer.serialize(buildMetadata(experimentId, first, isaId)),
                    metadataResolver.userIdFor(owner).orElse(null));
            elabftwApiClient.patchExperiment(experimentId, patch);
        } catch (RuntimeException e) {
            log.error("Project {}: patching experiment {} failed: {}", key, experimentId, e.getMessage());
            failures.add(MigrationFailure.group(group.projectId(), experimentId,
                                                "Experiment patch failed: " + e.getMessage()));
            return new GroupImportResult(group.projectId(), experimentId, ImportStatus.FAILED, body, uploads,
                                         failures);
        }

        if (isaId.isPresent() && ElabftwApiClient.isNumeric(isaId.get())) {
            try {
                elabftwApiClient.linkResource(experimentId, isaId.get());
            } catch (RuntimeException e) {
                log.error("Project {}: linking ISA study {} to experiment {} failed: {}", key, isaId.get(),
                          experimentId, e.getMessage());
                failures.add(MigrationFailure.group(group.projectId(), experimentId,
                                                    "Linking ISA study " + isaId.get() + " failed: " + e.getMessage()));
            }
        }

        attachExports(group, experimentId, uploads, failures);

        try {
            importLedger.recordCompleted(key, experimentId);
        } catch (ExperimentImportException e) {
            log.error("Project {}: experiment {} is complete but could not be recorded: {}", key, experimentId,
                      e.getMessage());
            failures.add(MigrationFailure.group(group.projectId(), experimentId,
                                                "Recording experiment " + experimentId
                                                + " as complete in the import ledger failed: " + e.getMessage()));
        }
        log.info("Project {} imported into experiment {} ({} entries, {} attachments, {} failure(s)).", key,
                 experimentId, group.entries().size(), uploads.size(), failures.size());
        return new GroupImportResult(group.projectId(), experimentId, ImportStatus.IMPORTED, body, uploads, failures);
    }

    /**
     * Uploads the unit's attachment, if any, and swaps its placeholder for the download link. On failure the
     * placeholder stays in the fragment.
     */
    private String resolveFragment(ProjectGroup group, String experimentId, TransformedUnit unit,
                                   List<UploadedAttachment> uploads, List<MigrationFailure> failures) {
        Optional<Attachment> attachment = unit.attachment();
        if (attachment.isEmpty()) {
            return unit.getHtmlFragment();
        }
        Attachment file = attachment.get();
        String elementKey = ImportLedger.elementKey(unit.getEntryId(), unit.getElementId());
        try {
            UploadResponse upload = recordedUpload(group.key(), experimentId, elementKey, file)
                    .orElseGet(() -> upload(group.key(), experimentId, elementKey, file));
            String link = downloadLink(upload, file.getFileName());
            uploads.add(new UploadedAttachment(unit.getEntryId(), unit.getElementId(), file.getFileName(),
                                               upload.id(), link));
            return unit.getHtmlFragment().replace(file.placeholderAttribute(), Attachment.attributeValue(link));
        } catch (RuntimeException e) {
            log.error("Experiment {}: upload of '{}' (entry {}, element {}) failed: {}", experimentId,
                      file.getFileName(), unit.getEntryId(), unit.getElementId(), e.getMessage());
            failures.add(MigrationFailure.attachment(group.projectId(), unit.getEntryId(), unit.getElementId(),
                                                     experimentId, "Upload of '" + file.getFileName()
                                                                   + "' failed: " + e.getMessage()));
            return unit.getHtmlFragment();
        }
    }

    /**
     * Uploads the project's Labfolder PDF export and XHTML export files, when enabled. They are not linked from
     * the body; a failure is an ATTACHMENT failure of the group.
     */
    private void attachExports(ProjectGroup group, String experimentId, List<UploadedAttachment> uploads,
                               List<MigrationFailure> failures) {
        List<ExportArtifact> artifacts = new ArrayList<>();
        if (projectPdfExporter.isEnabled()) {
            try {
                projectPdfExporter.projectPdf(group)
                        .ifPresent(pdf -> artifacts.add(new ExportArtifact(PDF_EXPORT_KEY, pdf)));
            } catch (RuntimeException e) {
                log.error("Project {}: PDF export failed: {}", group.key(), e.getMessage());
                failures.add(MigrationFailure.attachment(group.projectId(), null, PDF_EXPORT_KEY, experimentId,
                                                         "PDF export failed: " + e.getMessage()));
            }
        }
        if (xhtmlExportStore.isEnabled() && !group.isUngrouped()) {
            try {
                artifacts.addAll(xhtmlExportStore.projectArtifacts(group.projectId()));
            } catch (RuntimeException e) {
                log.error("Project {}: reading the XHTML export failed: {}", group.key(), e.getMessage());
                failures.add(MigrationFailure.attachment(group.projectId(), null, "xhtml", experimentId,
                                                         "Reading the XHTML export failed: " + e.getMessage()));
            }
        }

        for (ExportArtifact artifact : artifacts) {
            Attachment file = artifact.attachment();
            String elementKey = EXPORT_KEY_PREFIX + artifact.key();
            try {
                UploadResponse upload = recordedUpload(group.key(), experimentId, elementKey, file)
                        .orElseGet(() -> upload(group.key(), experimentId, elementKey, file));
                uploads.add(new UploadedAttachment(null, artifact.key(), file.getFileName(), upload.id(),
                                                   downloadLink(upload, file.getFileName())));
            } catch (RuntimeException e) {
                log.error("Experiment {}: upload of export file '{}' failed: {}", experimentId, file.getFileName(),
                          e.getMessage());
                failures.add(MigrationFailure.attachment(group.projectId(), null, artifact.key(), experimentId,
                                                         "Upload of export file '" + file.getFileName()
                                                         + "' failed: " + e.getMessage()));
            }
        }
    }

    /**
     * The upload a previous run made for this element, if the ledger has one and eLabFTW still knows it.
     */
    private Optional<UploadResponse> recordedUpload(String key, String experimentId, String elementKey,
                                                    Attachment file) {
        Optional<String> uploadId = importLedger.uploadIdFor(key, elementKey);
        if (uploadId.isEmpty()) {
            return Optional.empty();
        }
        try {
            UploadResponse upload = uploadRetryTemplate.execute(context -> {
                context.setAttribute(AttachmentUploadRetryListener.ATTACHMENT_NAME, file.getFileName());
                return elabftwApiClient.getUpload(experimentId, uploadId.get());
            });
            log.debug("Experiment {}: '{}' already uploaded as {}.", experimentId, file.getFileName(),
                      uploadId.get());
            return Optional.of(upload);
        } catch (RuntimeException e) {
            log.warn("Experiment {}: recorded upload {} of '{}' could not be read, uploading again: {}",
                     experimentId, uploadId.get(), file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * POSTs the file and reads the stored upload back. The two calls are retried separately, so a failed
     * read-back never sends the file a second time.
     */
    private UploadResponse upload(String key, String experimentId, String elementKey, Attachment file) {
        Optional<String> uploadId = uploadRetryTemplate.execute(context -> {
            context.setAttribute(AttachmentUploadRetryListener.ATTACHMENT_NAME, file.getFileName());
            return elabftwApiClient.postUpload(experimentId, file);
        });
        uploadId.ifPresent(id -> rememberUpload(key, experimentId, elementKey, id));
        UploadResponse upload = uploadRetryTemplate.execute(context -> {
            context.setAttribute(AttachmentUploadRetryListener.ATTACHMENT_NAME, file.getFileName());
            return uploadId.isPresent()
                    ? elabftwApiClient.getUpload(experimentId, uploadId.get())
                    : elabftwApiClient.findNewestUpload(experimentId, file.getFileName());
        });
        if (uploadId.isEmpty() && upload.id() != null) {
            rememberUpload(key, experimentId, elementKey, upload.id());
        }
        return upload;
    }

    private void rememberUpload(String key, String experimentId, String elementKey, String uploadId) {
        try {
            importLedger.recordUpload(key, experimentId, elementKey, uploadId);
        } catch (ExperimentImportException e) {
            log.warn("Experiment {}: could not record upload {} in the import ledger: {}", experimentId, uploadId,
                     e.getMessage());
        }
    }

    static String downloadLink(UploadResponse upload, String fallbackName) {
        String realName = upload.realName() != null ? upload.realName() : fallbackName;
        return "app/download.php?name=%s&f=%s&storage=%s".formatted(
                UriUtils.encodeQueryParam(realName, StandardCharsets.UTF_8),
                upload.longName() == null ? "" : upload.longName(),
                upload.storage() == null ? "1" : upload.storage());
    }

    /**
     * The extra fields of the experiment, merged into whatever metadata the experiment already has.
     */
    private ExperimentMetadata buildMetadata(String experimentId, Entry first, Optional<String> isaId) {
        ExperimentMetadata current = currentMetadata(experimentId);

        Map<String, ExtraField> fields = new LinkedHashMap<>();
        if (current != null && current.extraFields() != null) {
            fields.putAll(current.extraFields());
        }
        fields.put(FIELD_OWNER, ExtraField.text(first == null ? null : first.getAuthorName()));
        fields.put(FIELD_CREATION_DATE, ExtraField.text(first == null ? null : first.getProjectCreationDate()));
        fields.put(FIELD_PROJECT_ID, ExtraField.text(first == null ? null : first.getProjectId()));
        isaId.ifPresent(id -> fields.put(FIELD_ISA_STUDY, ExtraField.items(id)));

        TreeSet<Integer> groups = new TreeSet<>();
        Boolean displayMainText = Boolean.TRUE;
        if (current != null && current.elabftw() != null) {
            if (current.elabftw().extraFieldsGroups() != null) {
                groups.addAll(current.elabftw().extraFieldsGroups());
            }
            if (current.elabftw().displayMainText() != null) {
                displayMainText = current.elabftw().displayMainText();
            }
        }
        groups.add(0);
        return new ExperimentMetadata(new ExperimentMetadata.ElabftwSection(displayMainText, new ArrayList<>(groups)),
                                      fields);
    }

    private ExperimentMetadata currentMetadata(String experimentId) {
        try {
            ExperimentResponse experiment = elabftwApiClient.getExperiment(experimentId);
            JsonNode metadata = experiment == null ? null : experiment.metadata();
            if (metadata == null || metadata.isNull() || metadata.isMissingNode()) {
                return null;
            }
            String json = metadata.isTextual() ? metadata.asText() : metadata.toString();
            return json.isBlank() ? null : jsonParser.parseObject(json, ExperimentMetadata.class);
        } catch (RuntimeException e) {
            log.warn("Experiment {}: could not read current metadata, writing fresh metadata: {}", experimentId,
                     e.getMessage());
            return null;
        }
    }
}
