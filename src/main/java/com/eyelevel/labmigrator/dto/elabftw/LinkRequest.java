package com.eyelevel.labmigrator.dto.elabftw;

public record LinkRequest(String action) {

    public static LinkRequest create() {
        return new LinkRequest("create");
    }
}
