package com.eyelevel.labmigrator.dto.labfolder.element;

/**
 * Raw bytes of a file or image element together with what the download response said about them.
 */
public record BinaryDownload(String fileName, String mimeType, byte[] content) {
}
