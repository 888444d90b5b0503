package com.eyelevel.labmigrator.common.apiclient.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for static headers sent with every request of one API client.
 */
@Getter
@Setter
public abstract class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    protected void addHeader(String name, String value) {
        Header header = new Header();
        header.setName(name);
        header.setValue(value);
        headers.add(header);
    }

    /**
     * Represents a single header with a name and a value.
     */
    @Getter
    @Setter
    public static class Header {

        private String name;
        private String value;
    }
}
