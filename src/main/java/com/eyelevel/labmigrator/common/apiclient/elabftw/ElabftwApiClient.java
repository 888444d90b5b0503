package com.eyelevel.labmigrator.common.apiclient.elabftw;

import com.eyelevel.labmigrator.common.apiclient.ApiClient;
import com.eyelevel.labmigrator.common.apiclient.authentication.Authentication;
import com.eyelevel.labmigrator.common.apiclient.model.ApiRequest;
import com.eyelevel.labmigrator.common.apiclient.model.ApiResponse;
import com.eyelevel.labmigrator.common.apiclient.model.HeaderConfig;
import com.eyelevel.labmigrator.common.json.JsonParser;
import com.eyelevel.labmigrator.dto.elabftw.CreateExperimentRequest;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentPatchRequest;
import com.eyelevel.labmigrator.dto.elabftw.ExperimentResponse;
import com.eyelevel.labmigrator.dto.elabftw.LinkRequest;
import com.eyelevel.labmigrator.dto.elabftw.UploadResponse;
import com.eyelevel.labmigrator.exception.apiclient.ApiException;
import com.eyelevel.labmigrator.exception.apiclient.NotFoundException;
import com.eyelevel.labmigrator.model.Attachment;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the eLabFTW API v2 experiment endpoints.
 */
@Slf4j
@Service("elabftwApiClient")
public class ElabftwApiClient extends ApiClient {

    private final JsonParser jsonParser;

    public ElabftwApiClient(
            @Qualifier("elabftwWebClient") final WebClient webClient,
            @Qualifier("elabftwAuthentication") final Authentication authentication,
            @Qualifier("elabftwHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser
    ) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
    }

    /**
     * Creates an experiment.
     *
     * @return The new experiment id, read from the response body or, when the body is empty, from the
     * {@code Location} header.
     * @throws ApiException if the call fails or no numeric id can be found in the response.
     */
    public String createExperiment(final String title, final List<String> tags) {
        ApiResponse apiResponse = call(ApiRequest.builder()
                                               .method(HttpMethod.POST)
                                               .path("/experiments")
                                               .body(new CreateExperimentRequest(title, tags))
                                               .contentType(MediaType.APPLICATION_JSON)
                                               .acceptMediaType(MediaType.APPLICATION_JSON)
                                               .build());
        String experimentId = idFromBody(apiResponse)
                .or(() -> idFromLocation(apiResponse))
                .orElse("");
        if (!isNumeric(experimentId)) {
            throw new ApiException("Could not parse experiment id from response: '" + experimentId + "'",
                                   HttpStatus.BAD_GATEWAY.value());
        }
        log.info("Created experiment {} '{}'.", experimentId, title);
        return experimentId;
    }

    public ExperimentResponse getExperiment(final String experimentId) {
        ApiResponse apiResponse = call(ApiRequest.builder()
                                               .method(HttpMethod.GET)
                                               .path("/experiments/{id}")
                                               .pathVariables(Map.of("id", experimentId))
                                               .acceptMediaType(MediaType.APPLICATION_JSON)
                                               .build());
        return jsonParser.parseObject(apiResponse.getData(), ExperimentResponse.class);
    }

    public void patchExperiment(final String experimentId, final ExperimentPatchRequest patchRequest) {
        call(ApiRequest.builder()
                     .method(HttpMethod.PATCH)
                     .path("/experiments/{id}")
                     .pathVariables(Map.of("id", experimentId))
                     .body(patchRequest)
                     .contentType(MediaType.APPLICATION_JSON)
                     .acceptMediaType(MediaType.APPLICATION_JSON)
                     .build());
        log.debug("Patched experiment {}.", experimentId);
    }

    /**
     * Uploads an attachment as multipart field {@code file}. Only the POST happens here, so a retry of this call
     * never repeats a read-back.
     *
     * @return The id of the new upload when eLabFTW sent a {@code Location} header, empty otherwise.
     */
    public Optional<String> postUpload(final String experimentId, final Attachment attachment) {
        MultipartBodyBuilder multipart = new MultipartBodyBuilder();
        multipart.part("file", attachment.getContent())
                .filename(attachment.getFileName())
                .contentType(Optional.ofNullable(attachment.getMimeType())
                                     .map(MediaType::parseMediaType)
                                     .orElse(MediaType.APPLICATION_OCTET_STREAM));

        ApiResponse apiResponse = call(ApiRequest.builder()
                                               .method(HttpMethod.POST)
                                               .path("/experiments/{id}/uploads")
                                               .pathVariables(Map.of("id", experimentId))
                                               .body(multipart.build())
                                               .contentType(MediaType.MULTIPART_FORM_DATA)
                                               .acceptMediaType(MediaType.APPLICATION_JSON)
                                               .build());
        Optional<String> uploadId = idFromLocation(apiResponse).filter(ElabftwApiClient::isNumeric);
        log.debug("Uploaded '{}' to experiment {} (upload id {}).", attachment.getFileName(), experimentId,
                  uploadId.orElse("unknown"));
        return uploadId;
    }

    /**
     * The newest upload of the experiment with the given real name, for uploads whose response had no
     * {@code Location} header.
     *
     * @throws NotFoundException if the experiment has no upload with that name.
     */
    public UploadResponse findNewestUpload(final String experimentId, final String fileName) {
        return listUploads(experimentId).stream()
                .filter(upload -> fileName.equals(upload.realName()))
                .max(Comparator.comparingLong(upload -> parseLongOrZero(upload.id())))
                .orElseThrow(() -> new NotFoundException(
                        "Upload '" + fileName + "' not found on experiment " + experimentId));
    }

    public UploadResponse getUpload(final String experimentId, final String uploadId) {
        ApiResponse apiResponse = call(ApiRequest.builder()
                                               .method(HttpMethod.GET)
                                               .path("/experiments/{id}/uploads/{uploadId}")
                                               .pathVariables(Map.of("id", experimentId, "uploadId", uploadId))
                                               .acceptMediaType(MediaType.APPLICATION_JSON)
                                               .build());
        return jsonParser.parseObject(apiResponse.getData(), UploadResponse.class);
    }

    public List<UploadResponse> listUploads(final String experimentId) {
        ApiResponse apiResponse = call(ApiRequest.builder()
                                               .method(HttpMethod.GET)
                                               .path("/experiments/{id}/uploads")
                                               .pathVariables(Map.of("id", experimentId))
                                               .acceptMediaType(MediaType.APPLICATION_JSON)
                                               .build());
        UploadResponse[] uploads = jsonParser.parseObject(apiResponse.getData(), UploadResponse[].class);
        return uploads == null ? List.of() : Arrays.asList(uploads);
    }

    /**
     * Links the experiment to a resource (an ISA study item).
     *
     * @throws IllegalArgumentException if either id is not numeric.
     */
    public void linkResource(final String experimentId, final String resourceId) {
        if (!isNumeric(experimentId) || !isNumeric(resourceId)) {
            throw new IllegalArgumentException(
                    "Invalid ids for linking: experiment=" + experimentId + ", resource=" + resourceId);
        }
        call(ApiRequest.builder()
                     .method(HttpMethod.POST)
                     .path("/experiments/{id}/items_links/{resourceId}")
                     .pathVariables(Map.of("id", experimentId, "resourceId", resourceId))
                     .body(LinkRequest.create())
                     .contentType(MediaType.APPLICATION_JSON)
                     .acceptMediaType(MediaType.APPLICATION_JSON)
                     .build());
        log.info("Linked experiment {} to resource {}.", experimentId, resourceId);
    }

    public static boolean isNumeric(final String value) {
        return value != null && !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    private Optional<String> idFromBody(final ApiResponse apiResponse) {
        if (!apiResponse.hasBody()) {
            return Optional.empty();
        }
        try {
            JsonNode body = jsonParser.parseTree(apiResponse.getData());
            return Optional.ofNullable(body)
                    .map(node -> node.get("id"))
                    .map(JsonNode::asText)
                    .map(String::strip)
                    .filter(id -> !id.isEmpty());
        } catch (final RuntimeException e) {
            log.debug("Response body is not JSON, falling back to the Location header.");
            return Optional.empty();
        }
    }

    private static Optional<String> idFromLocation(final ApiResponse apiResponse) {
        return apiResponse.header(HttpHeaders.LOCATION)
                .map(location -> location.replaceAll("/+$", ""))
                .map(location -> location.substring(location.lastIndexOf('/') + 1))
                .filter(id -> !id.isEmpty());
    }

    private static long parseLongOrZero(final String value) {
        return isNumeric(value) ? Long.parseLong(value) : 0L;
    }
}
