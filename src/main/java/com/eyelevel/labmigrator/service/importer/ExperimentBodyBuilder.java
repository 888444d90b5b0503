package com.eyelevel.labmigrator.service.importer;

import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.ProjectGroup;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assembles the experiment body: every entry as a header block followed by its element fragments and creation
 * date, then a right-aligned footer with the Labfolder project details.
 */
@Component
public class ExperimentBodyBuilder {

    // Labfolder writes offsets without a colon, e.g. 2021-03-04T10:15:30.123+0100
    private static final DateTimeFormatter LABFOLDER_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    /**
     * @param fragmentsByEntry Resolved fragments per entry id, in element order. Entries without fragments get
     *                         only their header and date.
     */
    public String build(ProjectGroup group, Map<String, List<String>> fragmentsByEntry) {
        StringBuilder body = new StringBuilder();
        List<Entry> entries = group.entries();
        for (Entry entry : entries) {
            body.append(entryHeader(entry, entries.size()));
            List<String> fragments = fragmentsByEntry.getOrDefault(entry.getId(), List.of());
            if (!fragments.isEmpty()) {
                body.append(String.join("\n", fragments)).append("<br>");
            }
            body.append("Created: ").append(escape(createdDate(entry.getCreationDate()))).append("<br>");
            body.append("<hr><hr>");
        }
        body.append(footer(group.firstEntry()));
        return body.toString();
    }

    private static String entryHeader(Entry entry, int groupSize) {
        int total = entry.getProjectEntryCount() != null ? entry.getProjectEntryCount() : groupSize;
        String tags = entry.getTags() == null ? "" : entry.getTags().stream()
                .map(tag -> "§" + escape(tag))
                .collect(Collectors.joining(" "));
        return "\n----Entry %s of %d----<br>".formatted(entry.getEntryNumber() == null ? "?" : entry.getEntryNumber(),
                                                     total)
               + "<strong>Entry: %s (labfolder id: %s)</strong><br>".formatted(escape(entry.getTitle()),
                                                                               escape(entry.getId()))
               + "<strong>Tags:</strong> " + tags + "<br>";
    }

    private static String footer(Entry first) {
        if (first == null) {
            return "";
        }
        return "<div style=\"text-align: right; margin-top: 20px;\">"
               + "<h5 style=\"margin:0 0 4px 0;\">Labfolder Info</h5>"
               + "Project created: " + escape(first.getProjectCreationDate()) + "<br>"
               + "Labfolder project id: " + escape(first.getProjectId()) + "<br>"
               + "Author: " + escape(first.getAuthorName()) + "<br>"
               + "Last edited: " + escape(first.getVersionDate()) + "<br>"
               + "</div>";
    }

    /**
     * The calendar date of a Labfolder timestamp, or the raw value when it does not parse.
     */
    static String createdDate(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return "unknown";
        }
        try {
            return LABFOLDER_TIMESTAMP.parseBest(timestamp.strip(), OffsetDateTime::from, LocalDateTime::from)
                    .query(LocalDate::from).toString();
        } catch (DateTimeParseException e) {
            return timestamp;
        }
    }

    private static String escape(String value) {
        return value == null ? "" : Entities.escape(value);
    }
}
