package com.eyelevel.labmigrator.service.export;

import com.eyelevel.labmigrator.common.apiclient.labfolder.LabfolderApiClient;
import com.eyelevel.labmigrator.dto.labfolder.element.BinaryDownload;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportResponse;
import com.eyelevel.labmigrator.dto.labfolder.export.ExportType;
import com.eyelevel.labmigrator.exception.ExportException;
import com.eyelevel.labmigrator.exception.ExportPendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs Labfolder's server-side exports: start one, wait until it is finished, download the result.
 */
@Slf4j
@Service
public class LabfolderExportService {

    private final LabfolderApiClient labfolderApiClient;
    private final RetryTemplate exportPollTemplate;

    public LabfolderExportService(LabfolderApiClient labfolderApiClient,
                                  @Qualifier("exportPollTemplate") RetryTemplate exportPollTemplate) {
        this.labfolderApiClient = labfolderApiClient;
        this.exportPollTemplate = exportPollTemplate;
    }

    /**
     * Starts an export and returns its content once Labfolder has finished it.
     *
     * @return The download; its file name is the export's {@code download_filename} when Labfolder reports
     * one.
     * @throws ExportException if the export fails or does not finish in time.
     */
    public ExportedFile export(ExportType type, Object exportRequest) {
        String exportId = labfolderApiClient.createExport(type, exportRequest);
        ExportResponse finished = awaitFinished(type, exportId);
        return download(type, exportId, finished.downloadFilename());
    }

    /**
     * @param downloadFilename The name Labfolder reported for the export; the response's own name is used when
     *                         blank.
     */
    public ExportedFile download(ExportType type, String exportId, String downloadFilename) {
        BinaryDownload download = labfolderApiClient.downloadExport(type, exportId);
        String fileName = downloadFilename != null && !downloadFilename.isBlank() ? downloadFilename
                                                                                  : download.fileName();
        log.info("Downloaded {} export {} ({} bytes).", type, exportId, download.content().length);
        return new ExportedFile(exportId, fileName, download.content());
    }

    /**
     * Polls the export until it is finished.
     *
     * @throws ExportException if the export reports a failed status or is still pending at the timeout.
     */
    public ExportResponse awaitFinished(ExportType type, String exportId) {
        AtomicReference<String> lastStatus = new AtomicReference<>();
        try {
            return exportPollTemplate.execute(context -> {
                ExportResponse export = labfolderApiClient.getExport(type, exportId);
                String status = export == null ? null : export.status();
                if (!Objects.equals(lastStatus.getAndSet(status), status)) {
                    log.info("{} export {} status: {}", type, exportId, status);
                }
                if (export != null && export.isFinished()) {
                    return export;
                }
                if (export != null && export.isFailed()) {
                    throw new ExportException(type + " export " + exportId + " failed with status " + status);
                }
                throw new ExportPendingException(type + " export " + exportId + " is " + status);
            });
        } catch (ExportPendingException e) {
            throw new ExportException(type + " export " + exportId + " did not finish in time (last status "
                                      + lastStatus.get() + ")", e);
        }
    }

    /**
     * @param exportId The Labfolder export id.
     */
    public record ExportedFile(String exportId, String fileName, byte[] content) {
    }
}
