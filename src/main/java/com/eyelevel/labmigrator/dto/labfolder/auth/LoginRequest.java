package com.eyelevel.labmigrator.dto.labfolder.auth;

/**
 * Body of {@code POST auth/login}.
 */
public record LoginRequest(String user, String password) {

    @Override
    public String toString() {
        return "LoginRequest[user=" + user + "]";
    }
}
