package com.eyelevel.labmigrator.common.apiclient.labfolder;

import com.eyelevel.labmigrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.labmigrator.common.apiclient.model.HeaderConfig;
import com.eyelevel.labmigrator.dto.labfolder.element.BinaryDownload;
import com.eyelevel.labmigrator.dto.labfolder.entry.LabfolderEntry;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportResponse;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportType;
import com.eyelevel.labmigrator.dto.labfolder.export.PdfExportRequest;
import com.eyelevel.labmigrator.dto.labfolder.export.XhtmlExportRequest;
import com.eyelevel.labmigrator.exception.apiclient.NotFoundException;
import com.eyelevel.labmigrator.exception.apiclient.UnauthorizedException;
import com.eyelevel.labmigrator.support.StubExchange;
import com.eyelevel.labmigrator.support.TestEntries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabfolderApiClientTest {

    private static final String ENTRIES = """
            [{"id": "101", "entry_number": 3, "title": "Day 1", "tags": ["cells"], "project_id": "p1",
              "project": {"id": "p1", "title": "Cell culture", "creation_date": "2020-01-15", "number_of_entries": 4},
              "author": {"id": "u1", "first_name": "Emma", "last_name": "Stone"},
              "elements": [{"id": "t1", "type": "TEXT"}, {"id": "f1", "type": "FILE"}],
              "hidden": false}]""";

    private StubExchange exchange;
    private BearerTokenAuthentication authentication;
    private LabfolderApiClient client;

    @BeforeEach
    void setUp() {
        exchange = new StubExchange();
        authentication = new BearerTokenAuthentication();
        client = new LabfolderApiClient(exchange.webClient("https://labfolder.test/api/v2"), authentication,
                                        new HeaderConfig() { }, TestEntries.jsonParser(), "emma@lab.test",
                                        "secret");
    }

    @Test
    void logsInBeforeFirstCallAndSendsBearerToken() {
        exchange.json(HttpStatus.OK, "{\"token\": \"t1\", \"expires\": \"2030-01-01\"}")
                .json(HttpStatus.OK, ENTRIES);

        List<LabfolderEntry> page = client.listEntries(0, 50);

        assertThat(exchange.request(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(exchange.request(0).url().getPath()).isEqualTo("/api/v2/auth/login");
        assertThat(exchange.request(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isNull();

        assertThat(exchange.request(1).url().getPath()).isEqualTo("/api/v2/entries");
        assertThat(exchange.request(1).url().getRawQuery())
                .contains("limit=50", "offset=0", "include_hidden=true", "expand=author");
        assertThat(exchange.request(1).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer t1");

        LabfolderEntry entry = page.get(0);
        assertThat(entry.entryNumber()).isEqualTo(3);
        assertThat(entry.project().numberOfEntries()).isEqualTo(4);
        assertThat(entry.author().firstName()).isEqualTo("Emma");
        assertThat(entry.elements()).extracting(LabfolderEntry.ElementReference::type).containsExactly("TEXT", "FILE");
        assertThat(entry.lastEditor()).isNull();
    }

    @Test
    void expiredTokenIsRefreshedOnceAndTheCallRepeated() {
        authentication.updateToken("stale");
        exchange.json(HttpStatus.UNAUTHORIZED, "{\"message\": \"token expired\"}")
                .json(HttpStatus.OK, "{\"token\": \"fresh\"}")
                .json(HttpStatus.OK, "[]");

        assertThat(client.listEntries(0, 50)).isEmpty();

        assertThat(exchange.requests()).hasSize(3);
        assertThat(exchange.request(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer stale");
        assertThat(exchange.request(1).url().getPath()).endsWith("/auth/login");
        assertThat(exchange.request(2).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer fresh");
    }

    @Test
    void secondRejectionAfterRefreshSurfaces() {
        authentication.updateToken("stale");
        exchange.json(HttpStatus.UNAUTHORIZED, "{}")
                .json(HttpStatus.OK, "{\"token\": \"fresh\"}")
                .json(HttpStatus.UNAUTHORIZED, "{}");

        assertThatThrownBy(() -> client.listEntries(0, 50)).isInstanceOf(UnauthorizedException.class);
        assertThat(exchange.requests()).hasSize(3);
    }

    @Test
    void loginWithoutTokenIsRejected() {
        exchange.json(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> client.login()).isInstanceOf(UnauthorizedException.class);
        assertThat(authentication.hasToken()).isFalse();
    }

    @Test
    void downloadTakesNameAndTypeFromHeaders() {
        authentication.updateToken("t1");
        exchange.respond(ClientResponse.create(HttpStatus.OK)
                                 .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"protocol.pdf\"")
                                 .header(HttpHeaders.CONTENT_TYPE, "application/pdf")
                                 .body("%PDF-1.4")
                                 .build());

        BinaryDownload download = client.downloadFile("f1");

        assertThat(exchange.request(0).url().getPath()).isEqualTo("/api/v2/elements/file/f1/download");
        assertThat(download.fileName()).isEqualTo("protocol.pdf");
        assertThat(download.mimeType()).isEqualTo("application/pdf");
        assertThat(new String(download.content(), StandardCharsets.UTF_8)).isEqualTo("%PDF-1.4");
    }

    @Test
    void imageWithoutHeadersGetsDefaultName() {
        authentication.updateToken("t1");
        exchange.respond(ClientResponse.create(HttpStatus.OK).body("png").build());

        BinaryDownload download = client.downloadImage("i1");

        assertThat(exchange.request(0).url().getPath()).isEqualTo("/api/v2/elements/image/i1/original-data");
        assertThat(download.fileName()).isEqualTo("image");
        assertThat(download.mimeType()).isEqualTo("application/octet-stream");
    }

    @Test
    void fileNameDropsDirectoryParts() {
        assertThat(LabfolderApiClient.fileNameOf("attachment; filename=\"../../etc/passwd\"")).isEqualTo("passwd");
        assertThat(LabfolderApiClient.fileNameOf("attachment")).isNull();
    }

    @Test
    void createdExportIdIsReadFromTheBody() {
        authentication.updateToken("t1");
        exchange.json(HttpStatus.CREATED, "{\"id\": \"77\", \"status\": \"NEW\"}");

        String exportId = client.createExport(ExportType.PDF, PdfExportRequest.forProject("p1", "p1_Cells.pdf"));

        assertThat(exportId).isEqualTo("77");
        assertThat(exchange.requests()).hasSize(1);
        assertThat(exchange.request(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(exchange.request(0).url().getPath()).isEqualTo("/api/v2/exports/pdf");
    }

    @Test
    void exportWithoutIdInTheBodyIsTheNewestActiveOne() {
        authentication.updateToken("t1");
        exchange.json(HttpStatus.CREATED, "{}")
                .json(HttpStatus.OK, """
                        [{"id": "5", "status": "FINISHED", "creation_date": "2024-01-01T10:00:00"},
                         {"id": "6", "status": "NEW", "creation_date": "2024-02-01T10:00:00"}]""");

        String exportId = client.createExport(ExportType.XHTML, new XhtmlExportRequest(false));

        assertThat(exportId).isEqualTo("6");
        assertThat(exchange.request(1).method()).isEqualTo(HttpMethod.GET);
        assertThat(exchange.request(1).url().getPath()).isEqualTo("/api/v2/exports/xhtml");
        assertThat(exchange.request(1).url().getQuery())
                .contains("status=" + ExportResponse.ACTIVE_STATUSES, "limit=50");
    }

    @Test
    void exportThatCannotBeFoundAfterCreationIsNotFound() {
        authentication.updateToken("t1");
        exchange.json(HttpStatus.CREATED, "{}").json(HttpStatus.OK, "[]");

        assertThatThrownBy(() -> client.createExport(ExportType.PDF, PdfExportRequest.forProject("p1", "p1.pdf")))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void exportStatusIsRead() {
        authentication.updateToken("t1");
        exchange.json(HttpStatus.OK, """
                {"id": "77", "status": "FINISHED", "download_filename": "p1_Cells.pdf", "progress": 100}""");

        ExportResponse export = client.getExport(ExportType.PDF, "77");

        assertThat(exchange.request(0).url().getPath()).isEqualTo("/api/v2/exports/pdf/77");
        assertThat(export.isFinished()).isTrue();
        assertThat(export.isFailed()).isFalse();
        assertThat(export.downloadFilename()).isEqualTo("p1_Cells.pdf");
    }

    @Test
    void exportDownloadWithoutHeadersGetsTheTypeDefaultName() {
        authentication.updateToken("t1");
        exchange.respond(ClientResponse.create(HttpStatus.OK).body("PK").build());

        BinaryDownload download = client.downloadExport(ExportType.XHTML, "9");

        assertThat(exchange.request(0).url().getPath()).isEqualTo("/api/v2/exports/xhtml/9/download");
        assertThat(download.fileName()).isEqualTo("export.zip");
        assertThat(download.mimeType()).isEqualTo("application/zip");
    }
}
