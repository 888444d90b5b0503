package com.eyelevel.labmigrator.dto.labfolder.export;

import com.fasterxml.jackson.annotation.JsonProperty;

public record XhtmlExportRequest(@JsonProperty("include_hidden_items") boolean includeHiddenItems) {
}
