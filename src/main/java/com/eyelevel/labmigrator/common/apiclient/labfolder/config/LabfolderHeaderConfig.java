package com.eyelevel.labmigrator.common.apiclient.labfolder.config;

import com.eyelevel.labmigrator.common.apiclient.model.HeaderConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component("labfolderHeader")
public class LabfolderHeaderConfig extends HeaderConfig {

    public LabfolderHeaderConfig(@Value("${app.labfolder-client.user-agent:labmigrator}") String userAgent) {
        addHeader(HttpHeaders.USER_AGENT, userAgent);
    }
}
