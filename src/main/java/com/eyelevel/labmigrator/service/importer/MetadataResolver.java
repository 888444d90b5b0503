package com.eyelevel.labmigrator.service.importer;

import com.eyelevel.labmigrator.config.MigrationConfig;
import com.eyelevel.labmigrator.model.Author;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up experiment metadata kept outside Labfolder: the ISA study of a project and the eLabFTW user id of a
 * project owner. Both lookup files are optional; a missing or unreadable file is logged and treated as empty.
 */
@Slf4j
@Component
public class MetadataResolver {

    static final String ISA_PROJECT_COLUMN = "Project ID";
    static final String ISA_ID_COLUMN = "ISA ID";
    static final String FIRST_NAME_COLUMN = "First Name";
    static final String LAST_NAME_COLUMN = "Last Name";
    static final String USER_ID_COLUMN = "User ID";

    private final Map<String, String> isaIdsByProject;
    private final Map<String, Integer> userIdsByName;

    public MetadataResolver(MigrationConfig migrationConfig) {
        this.isaIdsByProject = loadIsaIds(migrationConfig.getIsaIdsFile());
        this.userIdsByName = loadUserIds(migrationConfig.getNamelistFile());
    }

    public Optional<String> isaIdFor(String projectId) {
        return projectId == null ? Optional.empty() : Optional.ofNullable(isaIdsByProject.get(projectId.strip()));
    }

    /**
     * Matches the owner's full name case-insensitively against "First Name Last Name" of the name list.
     */
    public Optional<Integer> userIdFor(Author owner) {
        if (owner == null) {
            return Optional.empty();
        }
        Optional<Integer> userId = Optional.ofNullable(userIdsByName.get(key(owner.fullName())));
        if (userId.isEmpty() && !userIdsByName.isEmpty()) {
            log.warn("No eLabFTW user id found for '{}'.", owner.fullName());
        }
        return userId;
    }

    private static Map<String, String> loadIsaIds(Path file) {
        Map<String, String> isaIds = new HashMap<>();
        for (Map<String, String> row : readRows(file)) {
            String projectId = row.getOrDefault(ISA_PROJECT_COLUMN, "").strip();
            String isaId = row.getOrDefault(ISA_ID_COLUMN, "").strip();
            if (!projectId.isEmpty() && !isaId.isEmpty()) {
                isaIds.put(projectId, isaId);
            }
        }
        if (file != null) {
            log.info("Loaded {} ISA study id(s) from {}.", isaIds.size(), file);
        }
        return isaIds;
    }

    private static Map<String, Integer> loadUserIds(Path file) {
        Map<String, Integer> userIds = new HashMap<>();
        for (Map<String, String> row : readRows(file)) {
            String name = row.getOrDefault(FIRST_NAME_COLUMN, "").strip() + " "
                          + row.getOrDefault(LAST_NAME_COLUMN, "").strip();
            String userId = row.getOrDefault(USER_ID_COLUMN, "").strip();
            try {
                userIds.put(key(name), Integer.valueOf(userId));
            } catch (NumberFormatException e) {
                log.warn("Ignoring name list row for '{}': user id '{}' is not a number.", name.strip(), userId);
            }
        }
        if (file != null) {
            log.info("Loaded {} user mapping(s) from {}.", userIds.size(), file);
        }
        return userIds;
    }

    private static List<Map<String, String>> readRows(Path file) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (file == null) {
            return rows;
        }
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .build();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = csvFormat.parse(reader)) {
            for (CSVRecord record : parser) {
                rows.add(record.toMap());
            }
        } catch (IOException | RuntimeException e) {
            log.error("Could not read lookup file {}: {}", file, e.getMessage());
        }
        return rows;
    }

    private static String key(String name) {
        return name.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
