package com.eyelevel.labmigrator.model;

import java.util.Locale;

/**
 * A Labfolder user as embedded in entry listings.
 */
public record Author(String firstName, String lastName) {

    public String fullName() {
        String first = firstName == null ? "" : firstName.strip();
        String last = lastName == null ? "" : lastName.strip();
        return (first + " " + last).strip();
    }

    /**
     * Case-insensitive match of a filter against the first name or the full name.
     */
    public boolean matches(String filter) {
        if (filter == null || filter.isBlank()) {
            return false;
        }
        String wanted = filter.strip().toLowerCase(Locale.ROOT);
        return wanted.equals(firstName == null ? "" : firstName.strip().toLowerCase(Locale.ROOT))
               || wanted.equals(fullName().toLowerCase(Locale.ROOT));
    }
}
