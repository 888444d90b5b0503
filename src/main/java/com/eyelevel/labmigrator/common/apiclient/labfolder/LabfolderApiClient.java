package com.eyelevel.labmigrator.common.apiclient.labfolder;

import com.eyelevel.labmigrator.common.apiclient.ApiClient;
import com.eyelevel.labmigrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.labmigrator.common.apiclient.model.ApiRequest;
import com.eyelevel.labmigrator.common.apiclient.model.ApiResponse;
import com.eyelevel.labmigrator.common.apiclient.model.HeaderConfig;
import com.eyelevel.labmigrator.common.json.JsonParser;
import com.eyelevel.labmigrator.dto.labfolder.auth.LoginRequest;
import com.eyelevel.labmigrator.dto.labfolder.auth.LoginResponse;
import com.eyelevel.labmigrator.dto.labfolder.element.BinaryDownload;
import com.eyelevel.labmigrator.dto.labfolder.element.DataElementResponse;
import com.eyelevel.labmigrator.dto.labfolder.element.SheetElementResponse;
import com.eyelevel.labmigrator.dto.labfolder.element.TextElementResponse;
import com.eyelevel.labmigrator.dto.labfolder.entry.LabfolderEntry;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportResponse;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportType;
import com.eyelevel.labmigrator.exception.apiclient.ApiException;
import com.eyelevel.labmigrator.exception.apiclient.NotFoundException;
import com.eyelevel.labmigrator.exception.apiclient.UnauthorizedException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Client for the Labfolder API v2.
 *
 * <p>Every call runs with the bearer token obtained by {@link #login()}. A call rejected with 401 logs in
 * again and is retried exactly once; a second 401 surfaces to the caller.
 */
@Slf4j
@Service("labfolderApiClient")
public class LabfolderApiClient extends ApiClient {

    static final String EXPAND = "author,project,last_editor";
    private static final String DEFAULT_FILE_NAME = "file.bin";
    private static final String DEFAULT_IMAGE_NAME = "image";
    private static final int EXPORT_PAGE_SIZE = 50;

    private final BearerTokenAuthentication tokenAuthentication;
    private final JsonParser jsonParser;
    private final String username;
    private final String password;

    public LabfolderApiClient(
            @Qualifier("labfolderWebClient") final WebClient webClient,
            @Qualifier("labfolderAuthentication") final BearerTokenAuthentication authentication,
            @Qualifier("labfolderHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.labfolder-client.username}") final String username,
            @Value("${app.labfolder-client.password}") final String password
    ) {
        super(webClient, authentication, headerConfig);
        this.tokenAuthentication = authentication;
        this.jsonParser = jsonParser;
        this.username = username;
        this.password = password;
    }

    /**
     * Obtains a fresh bearer token and makes it the token of every following call.
     *
     * @throws ApiException if Labfolder rejects the credentials or returns no token.
     */
    public void login() {
        log.info("Logging in to Labfolder as '{}'.", username);
        tokenAuthentication.updateToken(null);
        ApiResponse apiResponse = call(ApiRequest.builder()
                                               .method(HttpMethod.POST)
                                               .path("/auth/login")
                                               .body(new LoginRequest(username, password))
                                               .contentType(MediaType.APPLICATION_JSON)
                                               .acceptMediaType(MediaType.APPLICATION_JSON)
                                               .build());
        LoginResponse loginResponse = jsonParser.parseObject(apiResponse.getData(), LoginResponse.class);
        if (loginResponse == null || loginResponse.token() == null || loginResponse.token().isBlank()) {
            throw new UnauthorizedException("Labfolder login for '" + username + "' returned no token");
        }
        tokenAuthentication.updateToken(loginResponse.token());
    }

    /**
     * Fetches one page of entries, hidden entries included, with author, project and last editor expanded.
     */
    public List<LabfolderEntry> listEntries(final int offset, final int limit) {
        Map<String, Object> queryParams = new LinkedHashMap<>();
        queryParams.put("limit", limit);
        queryParams.put("offset", offset);
        queryParams.put("include_hidden", true);
        queryParams.put("expand", EXPAND);

        ApiResponse apiResponse = callAuthenticated(ApiRequest.builder()
                                                            .method(HttpMethod.GET)
                                                            .path("/entries")
                                                            .queryParams(queryParams)
                                                            .acceptMediaType(MediaType.APPLICATION_JSON)
                                                            .build());
        LabfolderEntry[] page = jsonParser.parseObject(apiResponse.getData(), LabfolderEntry[].class);
        return page == null ? List.of() : Arrays.asList(page);
    }

    public TextElementResponse fetchText(final String elementId) {
        return jsonParser.parseObject(getElement("/elements/text/{id}", elementId).getData(),
                                      TextElementResponse.class);
    }

    public SheetElementResponse fetchTable(final String elementId) {
        return jsonParser.parseObject(getElement("/elements/table/{id}", elementId).getData(),
                                      SheetElementResponse.class);
    }

    public SheetElementResponse fetchWellPlate(final String elementId) {
        return jsonParser.parseObject(getElement("/elements/well-plate/{id}", elementId).getData(),
                                      SheetElementResponse.class);
    }

    public DataElementResponse fetchData(final String elementId) {
        return jsonParser.parseObject(getElement("/elements/data/{id}", elementId).getData(),
                                      DataElementResponse.class);
    }

    public BinaryDownload downloadFile(final String elementId) {
        return toDownload(download("/elements/file/{id}/download", elementId), DEFAULT_FILE_NAME);
    }

    public BinaryDownload downloadImage(final String elementId) {
        return toDownload(download("/elements/image/{id}/original-data", elementId), DEFAULT_IMAGE_NAME);
    }

    /**
     * Starts a server-side export.
     *
     * @return The id of the new export: the {@code id} of the response body or, when the body has none, the
     * newest export of that type that is not failed.
     * @throws ApiException if the call fails or no export can be found afterwards.
     */
    public String createExport(final ExportType type, final Object exportRequest) {
        ApiResponse apiResponse = callAuthenticated(ApiRequest.builder()
                                                            .method(HttpMethod.POST)
                                                            .path("/exports/{type}")
                                                            .pathVariables(Map.of("type", type.path()))
                                                            .body(exportRequest)
                                                            .contentType(MediaType.APPLICATION_JSON)
                                                            .acceptMediaType(MediaType.APPLICATION_JSON)
                                                            .build());
        String exportId = exportIdFromBody(apiResponse)
                .or(() -> listExports(type, ExportResponse.ACTIVE_STATUSES).stream()
                        .filter(export -> export.id() != null)
                        .max(Comparator.comparing(export -> Objects.toString(export.creationDate(), "")))
                        .map(ExportResponse::id))
                .orElseThrow(() -> new NotFoundException("No " + type + " export found after creating one"));
        log.info("Started {} export {}.", type, exportId);
        return exportId;
    }

    /**
     * @param statuses Comma-separated statuses to filter on; {@code null} lists every export.
     */
    public List<ExportResponse> listExports(final ExportType type, final String statuses) {
        Map<String, Object> queryParams = new LinkedHashMap<>();
        if (statuses != null) {
            queryParams.put("status", statuses);
        }
        queryParams.put("limit", EXPORT_PAGE_SIZE);

        ApiResponse apiResponse = callAuthenticated(ApiRequest.builder()
                                                            .method(HttpMethod.GET)
                                                            .path("/exports/{type}")
                                                            .pathVariables(Map.of("type", type.path()))
                                                            .queryParams(queryParams)
                                                            .acceptMediaType(MediaType.APPLICATION_JSON)
                                                            .build());
        ExportResponse[] exports = jsonParser.parseObject(apiResponse.getData(), ExportResponse[].class);
        return exports == null ? List.of() : Arrays.asList(exports);
    }

    public ExportResponse getExport(final ExportType type, final String exportId) {
        ApiResponse apiResponse = callAuthenticated(ApiRequest.builder()
                                                            .method(HttpMethod.GET)
                                                            .path("/exports/{type}/{id}")
                                                            .pathVariables(Map.of("type", type.path(), "id", exportId))
                                                            .acceptMediaType(MediaType.APPLICATION_JSON)
                                                            .build());
        return jsonParser.parseObject(apiResponse.getData(), ExportResponse.class);
    }

    public BinaryDownload downloadExport(final ExportType type, final String exportId) {
        return toDownload(callAuthenticated(ApiRequest.builder()
                                                    .method(HttpMethod.GET)
                                                    .path("/exports/{type}/{id}/download")
                                                    .pathVariables(Map.of("type", type.path(), "id", exportId))
                                                    .acceptMediaType(MediaType.ALL)
                                                    .build()),
                          type.defaultFileName());
    }

    private ApiResponse getElement(final String path, final String elementId) {
        return callAuthenticated(ApiRequest.builder()
                                         .method(HttpMethod.GET)
                                         .path(path)
                                         .pathVariables(Map.of("id", elementId))
                                         .acceptMediaType(MediaType.APPLICATION_JSON)
                                         .build());
    }

    private ApiResponse download(final String path, final String elementId) {
        return callAuthenticated(ApiRequest.builder()
                                         .method(HttpMethod.GET)
                                         .path(path)
                                         .pathVariables(Map.of("id", elementId))
                                         .acceptMediaType(MediaType.ALL)
                                         .build());
    }

    /**
     * Runs the request, logging in again and retrying once when it is rejected with 401. A missing token
     * triggers the initial login.
     */
    private ApiResponse callAuthenticated(final ApiRequest apiRequest) {
        return withReauthentication(() -> call(apiRequest), apiRequest);
    }

    private <T> T withReauthentication(final Supplier<T> action, final ApiRequest apiRequest) {
        if (!tokenAuthentication.hasToken()) {
            login();
        }
        try {
            return action.get();
        } catch (final UnauthorizedException e) {
            log.info("401 on {} {}, re-authenticating.", apiRequest.getMethod(), apiRequest.getPath());
            login();
            return action.get();
        } catch (final ApiException e) {
            log.warn("Labfolder API error {} on {} {}.", e.getStatusCode(), apiRequest.getMethod(),
                     apiRequest.getPath());
            throw e;
        }
    }

    private static BinaryDownload toDownload(final ApiResponse apiResponse, final String defaultName) {
        String fileName = apiResponse.header(HttpHeaders.CONTENT_DISPOSITION)
                .map(LabfolderApiClient::fileNameOf)
                .orElse(defaultName);
        String mimeType = apiResponse.header(HttpHeaders.CONTENT_TYPE)
                .filter(value -> !value.isBlank())
                .or(() -> MediaTypeFactory.getMediaType(fileName).map(MediaType::toString))
                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
        return new BinaryDownload(fileName, mimeType, apiResponse.getData());
    }

    private Optional<String> exportIdFromBody(final ApiResponse apiResponse) {
        if (!apiResponse.hasBody()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(jsonParser.parseTree(apiResponse.getData()))
                    .map(body -> body.get("id"))
                    .map(JsonNode::asText)
                    .filter(id -> !id.isBlank());
        } catch (final RuntimeException e) {
            log.debug("Export response body is not JSON, looking the export up instead.");
            return Optional.empty();
        }
    }

    static String fileNameOf(final String contentDisposition) {
        String name = null;
        try {
            name = ContentDisposition.parse(contentDisposition).getFilename();
        } catch (final IllegalArgumentException e) {
            log.debug("Unparseable Content-Disposition '{}'.", contentDisposition);
        }
        if (name == null && contentDisposition.contains("filename=")) {
            name = contentDisposition.substring(contentDisposition.indexOf("filename=") + 9).strip()
                                     .replace("\"", "");
        }
        // never trust directory parts coming from the server
        name = name == null ? null : FilenameUtils.getName(name);
        return name == null || name.isBlank() ? null : name;
    }
}
