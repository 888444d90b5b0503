package com.eyelevel.labmigrator.model;

/**
 * An attachment that reached eLabFTW.
 *
 * @param uploadId     The id eLabFTW assigned to the upload.
 * @param downloadLink The body-relative link that replaced the attachment placeholder.
 */
public record UploadedAttachment(String entryId, String elementId, String fileName, String uploadId,
                                 String downloadLink) {
}
