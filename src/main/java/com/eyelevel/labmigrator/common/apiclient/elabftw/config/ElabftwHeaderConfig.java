package com.eyelevel.labmigrator.common.apiclient.elabftw.config;

import com.eyelevel.labmigrator.common.apiclient.model.HeaderConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component("elabftwHeader")
public class ElabftwHeaderConfig extends HeaderConfig {

    public ElabftwHeaderConfig(@Value("${app.elabftw-client.user-agent:labmigrator}") String userAgent) {
        addHeader(HttpHeaders.USER_AGENT, userAgent);
    }
}
