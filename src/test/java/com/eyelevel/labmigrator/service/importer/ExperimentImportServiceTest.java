package com.eyelevel.labmigrator.service.importer;

import com.eyelevel.labmigrator.common.apiclient.elabftw.ElabftwApiClient;
import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentPatchRequest;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentResponse;
import com.eyelevel.labmigrator.dto.elabftw.UploadResponse;
import com.eyelevel.labmigrator.exception.ExportException;
import com.eyelevel.labmigrator.exception.apiclient.ApiException;
import com.eyelevel.labmigrator.exception.apiclient.BadRequestException;
import com.eyelevel.labmigrator.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.labmigrator.model.Attachment;
import com.eyelevel.labmigrator.model.Author;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.EntryTransformation;
import com.eyelevel.labmigrator.model.FailureSeverity;
import com.eyelevel.labmigrator.model.GroupImportResult;
import com.eyelevel.labmigrator.model.ImportStatus;
import com.eyelevel.labmigrator.model.MigrationFailure;
import com.eyelevel.labmigrator.model.ProjectGroup;
import com.eyelevel.labmigrator.model.UploadedAttachment;
import com.eyelevel.labmigrator.model.element.FileElement;
import com.eyelevel.labmigrator.service.export.ExportArtifact;
import com.eyelevel.labmigrator.service.export.ProjectPdfExporter;
import com.eyelevel.labmigrator.service.export.XhtmlExportStore;
import com.eyelevel.labmigrator.service.importer.ImportLedger.LedgerRecord;
import com.eyelevel.labmigrator.service.transform.ElementTransformerService;
import com.eyelevel.labmigrator.support.Handlers;
import com.eyelevel.labmigrator.support.SampleElements;
import com.eyelevel.labmigrator.support.TestEntries;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatcher;
import org.springframework.retry.support.RetryTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.eyelevel.labmigrator.support.TestEntries.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExperimentImportServiceTest {

    @TempDir
    Path tempDir;

    private ElabftwApiClient elabftwApiClient;
    private MetadataResolver metadataResolver;
    private ImportLedger importLedger;
    private MigrationConfig config;
    private ElementTransformerService transformer;
    private RetryTemplate retryTemplate;
    private ProjectPdfExporter projectPdfExporter;
    private XhtmlExportStore xhtmlExportStore;
    private ExperimentImportService importService;

    @BeforeEach
    void setUp() {
        elabftwApiClient = mock(ElabftwApiClient.class);
        metadataResolver = mock(MetadataResolver.class);
        projectPdfExporter = mock(ProjectPdfExporter.class);
        xhtmlExportStore = mock(XhtmlExportStore.class);
        config = new MigrationConfig();
        config.getImport().setCategory(83);
        config.getImport().setLedgerPath(tempDir.resolve("ledger.json"));
        importLedger = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());
        transformer = Handlers.transformerService(config);
        retryTemplate = RetryTemplate.builder()
                .maxAttempts(3)
                .fixedBackoff(1)
                .retryOn(ApiException.class)
                .traversingCauses()
                .build();
        importService = serviceWith(importLedger);

        when(metadataResolver.isaIdFor("p1")).thenReturn(Optional.of("17"));
        when(metadataResolver.userIdFor(any(Author.class))).thenReturn(Optional.of(5));
        when(elabftwApiClient.getExperiment("42")).thenReturn(new ExperimentResponse("42", "Project p1", null));
    }

    @Test
    void importsEntriesInOrderWithResolvedAttachments() throws JsonProcessingException {
        when(elabftwApiClient.createExperiment(eq("Project p1"), anyList())).thenReturn("42");
        stubUploads();
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.IMPORTED);
        assertThat(result.experimentId()).isEqualTo("42");
        assertThat(result.failures()).isEmpty();
        assertThat(result.uploads()).extracting(UploadedAttachment::fileName)
                .containsExactly("gel.png", "protocol.pdf");
        assertThat(result.body())
                .containsSubsequence("Entry: Entry e1", "<p>Hello <b>world</b></p>",
                                     "<img src=\"app/download.php?name=gel.png&amp;f=ab/gel.png&amp;storage=1\"",
                                     "Entry: Entry e2", "href=\"app/download.php?name=protocol.pdf&amp;f=cd/protocol.pdf",
                                     "Labfolder Info")
                .doesNotContain("{{attachment:");

        ArgumentCaptor<ExperimentPatchRequest> patch = ArgumentCaptor.forClass(ExperimentPatchRequest.class);
        verify(elabftwApiClient).patchExperiment(eq("42"), patch.capture());
        assertThat(patch.getValue().body()).isEqualTo(result.body());
        assertThat(patch.getValue().category()).isEqualTo(83);
        assertThat(patch.getValue().userid()).isEqualTo(5);
        JsonNode metadata = readTree(patch.getValue().metadata());
        JsonNode fields = metadata.path("extra_fields");
        assertThat(fields.path(ExperimentImportService.FIELD_OWNER).path("type").asText()).isEqualTo("text");
        assertThat(fields.path(ExperimentImportService.FIELD_OWNER).path("value").asText()).isEqualTo("Emma Stone");
        assertThat(fields.path(ExperimentImportService.FIELD_PROJECT_ID).path("value").asText()).isEqualTo("p1");
        assertThat(fields.path(ExperimentImportService.FIELD_CREATION_DATE).path("value").asText())
                .isEqualTo("2020-01-15T09:00:00.000+0100");
        assertThat(fields.path(ExperimentImportService.FIELD_ISA_STUDY).path("type").asText()).isEqualTo("items");
        assertThat(fields.path(ExperimentImportService.FIELD_ISA_STUDY).path("value").asText()).isEqualTo("17");
        assertThat(metadata.path("elabftw").path("extra_fields_groups").toString()).isEqualTo("[0]");
        assertThat(metadata.path("elabftw").path("display_main_text").asBoolean()).isTrue();
        verify(elabftwApiClient).linkResource("42", "17");
        assertThat(importLedger.find("p1")).map(LedgerRecord::completed).contains(true);
    }

    @Test
    void failedUploadIsRetriedThenReportedWithoutStoppingTheGroup() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        doThrow(new ServiceUnavailableException("storage offline"))
                .when(elabftwApiClient).postUpload(eq("42"), argThat(named("gel.png")));
        doReturn(Optional.of("10"))
                .when(elabftwApiClient).postUpload(eq("42"), argThat(named("protocol.pdf")));
        when(elabftwApiClient.getUpload("42", "10"))
                .thenReturn(new UploadResponse("10", "protocol.pdf", "cd/protocol.pdf", "1"));
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        verify(elabftwApiClient, times(3)).postUpload(eq("42"), argThat(named("gel.png")));
        assertThat(result.status()).isEqualTo(ImportStatus.IMPORTED);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.severity()).isEqualTo(FailureSeverity.ATTACHMENT);
            assertThat(failure.entryId()).isEqualTo("e1");
            assertThat(failure.elementId()).isEqualTo("i1");
            assertThat(failure.experimentId()).isEqualTo("42");
        });
        assertThat(result.body()).contains("{{attachment:gel.png}}").contains("name=protocol.pdf");
        verify(elabftwApiClient).patchExperiment(eq("42"), any());
    }

    @Test
    void failedCreationStopsTheGroupBeforeAnyWrite() {
        when(elabftwApiClient.createExperiment(anyString(), anyList()))
                .thenThrow(new BadRequestException("category does not exist"));
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.FAILED);
        assertThat(result.experimentId()).isNull();
        assertThat(result.failures()).extracting(MigrationFailure::severity).containsExactly(FailureSeverity.GROUP);
        verify(elabftwApiClient, never()).postUpload(any(), any());
        verify(elabftwApiClient, never()).patchExperiment(any(), any());
        assertThat(importLedger.find("p1")).isEmpty();
    }

    @Test
    void completedProjectIsSkipped() {
        importLedger.recordCompleted("p1", "42");
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.SKIPPED);
        assertThat(result.experimentId()).isEqualTo("42");
        verifyNoInteractions(elabftwApiClient);
    }

    @Test
    void incompleteProjectContinuesInItsExperimentAndReusesUploads() {
        importLedger.recordStarted("p1", "42");
        importLedger.recordUpload("p1", "42", "e1/i1", "9");
        stubUploads();
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.IMPORTED);
        verify(elabftwApiClient, never()).createExperiment(any(), any());
        verify(elabftwApiClient, never()).postUpload(eq("42"), argThat(named("gel.png")));
        verify(elabftwApiClient, times(1)).postUpload(eq("42"), argThat(named("protocol.pdf")));
        assertThat(result.body()).contains("name=gel.png&amp;f=ab/gel.png").contains("name=protocol.pdf");
    }

    @Test
    void sameNamedFilesOfDifferentElementsGetTheirOwnUploadsOnResume() {
        importLedger.recordStarted("p1", "42");
        importLedger.recordUpload("p1", "42", "e1/f1", "9");
        when(elabftwApiClient.getUpload("42", "9"))
                .thenReturn(new UploadResponse("9", "protocol.pdf", "ab/protocol.pdf", "1"));
        when(elabftwApiClient.postUpload(eq("42"), any(Attachment.class))).thenReturn(Optional.of("10"));
        when(elabftwApiClient.getUpload("42", "10"))
                .thenReturn(new UploadResponse("10", "protocol.pdf", "cd/protocol.pdf", "1"));
        Entry first = entry("e1", "p1", "Emma", "Stone", SampleElements.file("f1"));
        Entry second = entry("e2", "p1", "Emma", "Stone", SampleElements.file("f1"));
        ProjectGroup group = new ProjectGroup("p1", List.of(first, second));

        GroupImportResult result = importService.importGroup(group, transform(group));

        verify(elabftwApiClient, times(1)).postUpload(eq("42"), any(Attachment.class));
        verify(elabftwApiClient, never()).listUploads(any());
        assertThat(result.uploads()).extracting(UploadedAttachment::uploadId).containsExactly("9", "10");
        assertThat(result.body()).containsSubsequence("f=ab/protocol.pdf", "f=cd/protocol.pdf");
        assertThat(importLedger.uploadIdFor("p1", "e2/f1")).contains("10");
    }

    @Test
    void failedReadBackIsRetriedWithoutPostingTheFileAgain() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        when(elabftwApiClient.postUpload(eq("42"), any(Attachment.class))).thenAnswer(invocation -> {
            Attachment file = invocation.getArgument(1);
            return Optional.of(file.getFileName().equals("gel.png") ? "9" : "10");
        });
        when(elabftwApiClient.getUpload("42", "9"))
                .thenThrow(new ServiceUnavailableException("busy"))
                .thenThrow(new ServiceUnavailableException("busy"))
                .thenReturn(new UploadResponse("9", "gel.png", "ab/gel.png", "1"));
        when(elabftwApiClient.getUpload("42", "10"))
                .thenReturn(new UploadResponse("10", "protocol.pdf", "cd/protocol.pdf", "1"));
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        verify(elabftwApiClient, times(1)).postUpload(eq("42"), argThat(named("gel.png")));
        verify(elabftwApiClient, times(3)).getUpload("42", "9");
        assertThat(result.failures()).isEmpty();
        assertThat(result.body()).contains("name=gel.png&amp;f=ab/gel.png");
        assertThat(importLedger.uploadIdFor("p1", "e1/i1")).contains("9");
    }

    @Test
    void uploadWithoutIdIsRecordedAfterItIsFoundByName() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        when(elabftwApiClient.postUpload(eq("42"), any(Attachment.class))).thenReturn(Optional.empty());
        when(elabftwApiClient.findNewestUpload("42", "gel.png"))
                .thenReturn(new UploadResponse("9", "gel.png", "ab/gel.png", "1"));
        when(elabftwApiClient.findNewestUpload("42", "protocol.pdf"))
                .thenReturn(new UploadResponse("10", "protocol.pdf", "cd/protocol.pdf", "1"));
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.failures()).isEmpty();
        verify(elabftwApiClient, never()).getUpload(any(), any());
        assertThat(importLedger.uploadIdFor("p1", "e1/i1")).contains("9");
        assertThat(importLedger.uploadIdFor("p1", "e2/f1")).contains("10");
    }

    @Test
    void unrecordableExperimentIsReportedWithItsId() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        config.getImport().setLedgerPath(blocker.resolve("ledger.json"));
        ImportLedger unwritable = new ImportLedger(config, TestEntries.jsonSerializer(), TestEntries.jsonParser());
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        ProjectGroup group = group();

        GroupImportResult result = serviceWith(unwritable).importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.FAILED);
        assertThat(result.experimentId()).isEqualTo("42");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.severity()).isEqualTo(FailureSeverity.GROUP);
            assertThat(failure.experimentId()).isEqualTo("42");
            assertThat(failure.message()).contains("import ledger");
        });
        verify(elabftwApiClient, never()).postUpload(any(), any());
        verify(elabftwApiClient, never()).patchExperiment(any(), any());
    }

    @Test
    void failedPatchLeavesTheProjectIncomplete() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        stubUploads();
        doThrow(new ServiceUnavailableException("down"))
                .when(elabftwApiClient).patchExperiment(eq("42"), any());
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.FAILED);
        assertThat(result.experimentId()).isEqualTo("42");
        assertThat(result.failures()).extracting(MigrationFailure::severity).containsExactly(FailureSeverity.GROUP);
        verify(elabftwApiClient, never()).linkResource(any(), any());
        assertThat(importLedger.find("p1")).map(LedgerRecord::completed).contains(false);
    }

    @Test
    void existingMetadataIsKept() throws JsonProcessingException {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        when(elabftwApiClient.getExperiment("42")).thenReturn(new ExperimentResponse("42", "t", new TextNode(
                "{\"elabftw\": {\"display_main_text\": false, \"extra_fields_groups\": [2]},"
                + " \"extra_fields\": {\"Lab\": {\"type\": \"text\", \"value\": \"B12\", \"group_id\": 2}}}")));
        stubUploads();
        ProjectGroup group = group();

        importService.importGroup(group, transform(group));

        ArgumentCaptor<ExperimentPatchRequest> patch = ArgumentCaptor.forClass(ExperimentPatchRequest.class);
        verify(elabftwApiClient).patchExperiment(eq("42"), patch.capture());
        JsonNode metadata = readTree(patch.getValue().metadata());
        assertThat(metadata.path("extra_fields").path("Lab").path("value").asText()).isEqualTo("B12");
        assertThat(metadata.path("extra_fields").path("Lab").path("group_id").asInt()).isEqualTo(2);
        assertThat(metadata.path("extra_fields").has(ExperimentImportService.FIELD_OWNER)).isTrue();
        assertThat(metadata.path("elabftw").path("extra_fields_groups").toString()).isEqualTo("[0,2]");
        assertThat(metadata.path("elabftw").path("display_main_text").asBoolean()).isFalse();
    }

    @Test
    void failedIsaLinkIsReportedButTheGroupCounts() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        stubUploads();
        doThrow(new BadRequestException("no such item"))
                .when(elabftwApiClient).linkResource("42", "17");
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.IMPORTED);
        assertThat(result.failures()).extracting(MigrationFailure::severity).containsExactly(FailureSeverity.GROUP);
    }

    @Test
    void placeholderOfNameWithQuotesAndAmpersandsIsReplaced() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        when(elabftwApiClient.postUpload(eq("42"), any(Attachment.class))).thenReturn(Optional.of("11"));
        when(elabftwApiClient.getUpload("42", "11"))
                .thenReturn(new UploadResponse("11", "a\"b&c.pdf", "ef/abc.pdf", "1"));
        Entry only = entry("e1", "p1", "Emma", "Stone",
                           new FileElement("f1", "a\"b&c.pdf", "application/pdf", new byte[]{1}));
        ProjectGroup group = new ProjectGroup("p1", List.of(only));

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.failures()).isEmpty();
        assertThat(result.body())
                .contains("href=\"app/download.php?name=a%22b%26c.pdf&amp;f=ef/abc.pdf&amp;storage=1\"")
                .doesNotContain("{{attachment:");
    }

    @Test
    void projectExportsAreUploadedNextToTheBody() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        stubUploads();
        Attachment pdf = Attachment.builder().fileName("p1_Project p1.pdf").mimeType("application/pdf")
                .content(new byte[]{1}).build();
        Attachment index = Attachment.builder().fileName("index.html").mimeType("text/html")
                .content(new byte[]{2}).build();
        when(projectPdfExporter.isEnabled()).thenReturn(true);
        when(projectPdfExporter.projectPdf(any(ProjectGroup.class))).thenReturn(Optional.of(pdf));
        when(xhtmlExportStore.isEnabled()).thenReturn(true);
        when(xhtmlExportStore.projectArtifacts("p1")).thenReturn(List.of(new ExportArtifact("xhtml/index.html", index)));
        doReturn(Optional.of("12")).when(elabftwApiClient).postUpload("42", pdf);
        doReturn(Optional.of("13")).when(elabftwApiClient).postUpload("42", index);
        when(elabftwApiClient.getUpload("42", "12"))
                .thenReturn(new UploadResponse("12", "p1_Project p1.pdf", "gh/p1.pdf", "1"));
        when(elabftwApiClient.getUpload("42", "13"))
                .thenReturn(new UploadResponse("13", "index.html", "ij/index.html", "1"));
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.failures()).isEmpty();
        assertThat(result.uploads()).extracting(UploadedAttachment::fileName)
                .containsExactly("gel.png", "protocol.pdf", "p1_Project p1.pdf", "index.html");
        assertThat(result.uploads().get(2).entryId()).isNull();
        assertThat(result.uploads().get(2).elementId()).isEqualTo("pdf");
        assertThat(result.body()).doesNotContain("p1_Project");
        assertThat(importLedger.uploadIdFor("p1", "export:pdf")).contains("12");
        assertThat(importLedger.uploadIdFor("p1", "export:xhtml/index.html")).contains("13");
    }

    @Test
    void failedPdfExportIsReportedButTheGroupCounts() {
        when(elabftwApiClient.createExperiment(anyString(), anyList())).thenReturn("42");
        stubUploads();
        when(projectPdfExporter.isEnabled()).thenReturn(true);
        when(projectPdfExporter.projectPdf(any(ProjectGroup.class)))
                .thenThrow(new ExportException("PDF export 5 failed with status ERROR"));
        ProjectGroup group = group();

        GroupImportResult result = importService.importGroup(group, transform(group));

        assertThat(result.status()).isEqualTo(ImportStatus.IMPORTED);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.severity()).isEqualTo(FailureSeverity.ATTACHMENT);
            assertThat(failure.elementId()).isEqualTo("pdf");
            assertThat(failure.message()).contains("status ERROR");
        });
        assertThat(importLedger.find("p1")).map(LedgerRecord::completed).contains(true);
    }

    @Test
    void downloadLinkEncodesTheName() {
        assertThat(ExperimentImportService.downloadLink(new UploadResponse("1", "run 1.csv", "aa/bb.csv", null), "x"))
                .isEqualTo("app/download.php?name=run%201.csv&f=aa/bb.csv&storage=1");
    }

    private static ArgumentMatcher<Attachment> named(String fileName) {
        return file -> file != null && fileName.equals(file.getFileName());
    }

    private static JsonNode readTree(String json) throws JsonProcessingException {
        return TestEntries.OBJECT_MAPPER.readTree(json);
    }

    private void stubUploads() {
        when(elabftwApiClient.postUpload(eq("42"), any(Attachment.class))).thenAnswer(invocation -> {
            Attachment file = invocation.getArgument(1);
            return Optional.of(file.getFileName().equals("gel.png") ? "9" : "10");
        });
        when(elabftwApiClient.getUpload("42", "9")).thenReturn(new UploadResponse("9", "gel.png", "ab/gel.png", "1"));
        when(elabftwApiClient.getUpload("42", "10"))
                .thenReturn(new UploadResponse("10", "protocol.pdf", "cd/protocol.pdf", "1"));
    }

    private ExperimentImportService serviceWith(ImportLedger ledger) {
        return new ExperimentImportService(elabftwApiClient, retryTemplate, new ExperimentBodyBuilder(),
                                           metadataResolver, ledger, config,
                                           TestEntries.jsonSerializer(), TestEntries.jsonParser(),
                                           projectPdfExporter, xhtmlExportStore);
    }

    private static ProjectGroup group() {
        Entry first = entry("e1", "p1", "Emma", "Stone", SampleElements.text("t1"), SampleElements.image("i1"));
        Entry second = entry("e2", "p1", "Emma", "Stone", SampleElements.file("f1"));
        return new ProjectGroup("p1", List.of(first, second));
    }

    private List<EntryTransformation> transform(ProjectGroup group) {
        return group.entries().stream().map(transformer::transformEntry).toList();
    }
}
