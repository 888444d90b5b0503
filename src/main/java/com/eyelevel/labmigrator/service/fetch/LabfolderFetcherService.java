package com.eyelevel.labmigrator.service.fetch;

import com.eyelevel.labmigrator.common.apiclient.labfolder.LabfolderApiClient;
import com.eyelevel.labmigrator.dto.labfolder.element.BinaryDownload;
import com.eyelevel.labmigrator.dto.labfolder.element.DataElementResponse;
import com.eyelevel.labmigrator.dto.labfolder.element.SheetElementResponse;
import com.eyelevel.labmigrator.dto.labfolder.element.TextElementResponse;
import com.eyelevel.labmigrator.dto.labfolder.entry.LabfolderEntry;
import com.eyelevel.labmigrator.exception.SourceFetchException;
import com.eyelevel.labmigrator.model.Author;
import com.eyelevel.labmigrator.model.ElementFetchFailure;
import com.eyelevel.labmigrator.model.Entry;
import com.eyelevel.labmigrator.model.element.DataElement;
import com.eyelevel.labmigrator.model.element.DataItem;
import com.eyelevel.labmigrator.model.element.Element;
import com.eyelevel.labmigrator.model.element.ElementType;
import com.eyelevel.labmigrator.model.element.FileElement;
import com.eyelevel.labmigrator.model.element.ImageElement;
import com.eyelevel.labmigrator.model.element.TableElement;
import com.eyelevel.labmigrator.model.element.TextElement;
import com.eyelevel.labmigrator.model.element.UnsupportedElement;
import com.eyelevel.labmigrator.model.element.WellPlateElement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads entries and their element payloads from Labfolder.
 *
 * <p>Login and listing failures are fatal and raised as {@link SourceFetchException}. A failing element is
 * dropped from its entry and recorded as an {@link ElementFetchFailure}; the remaining elements and entries
 * are still fetched.
 */
@Slf4j
@Service
public class LabfolderFetcherService {

    private final LabfolderApiClient labfolderApiClient;
    private final int pageSize;

    public LabfolderFetcherService(LabfolderApiClient labfolderApiClient,
                                   @Value("${app.labfolder-client.page-size:50}") int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Labfolder page size must be positive, got " + pageSize);
        }
        this.labfolderApiClient = labfolderApiClient;
        this.pageSize = pageSize;
    }

    /**
     * Fetches every entry written by one of the given authors, with all element payloads resolved.
     *
     * @param authors First names or full names; {@code null}, empty or all-blank means every author.
     * @return The matching entries in listing order.
     * @throws SourceFetchException if logging in or listing entries fails.
     */
    public List<Entry> fetchEntries(List<String> authors) {
        List<String> filters = authors == null ? List.of() : authors.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(a -> !a.isEmpty())
                .toList();

        authenticate();
        List<LabfolderEntry> listed = listAllEntries();
        List<Entry> entries = new ArrayList<>();
        for (LabfolderEntry labfolderEntry : listed) {
            Author author = toAuthor(labfolderEntry.author());
            if (!filters.isEmpty() && (author == null || filters.stream().noneMatch(author::matches))) {
                continue;
            }
            entries.add(resolveEntry(labfolderEntry, author));
        }
        if (!filters.isEmpty() && entries.isEmpty()) {
            log.info("No entries matched authors {}.", filters);
        }
        log.info("Fetched {} of {} Labfolder entries.", entries.size(), listed.size());
        return entries;
    }

    private void authenticate() {
        try {
            labfolderApiClient.login();
        } catch (RuntimeException e) {
            throw new SourceFetchException("Labfolder login failed: " + e.getMessage(), e);
        }
    }

    private List<LabfolderEntry> listAllEntries() {
        List<LabfolderEntry> all = new ArrayList<>();
        int offset = 0;
        while (true) {
            List<LabfolderEntry> page;
            try {
                page = labfolderApiClient.listEntries(offset, pageSize);
            } catch (RuntimeException e) {
                throw new SourceFetchException("Listing Labfolder entries at offset " + offset + " failed: "
                                               + e.getMessage(), e);
            }
            all.addAll(page);
            log.debug("Listed {} entries at offset {}.", page.size(), offset);
            if (page.size() < pageSize) {
                return all;
            }
            offset += pageSize;
        }
    }

    private Entry resolveEntry(LabfolderEntry source, Author author) {
        List<Element> elements = new ArrayList<>();
        List<ElementFetchFailure> failures = new ArrayList<>();
        for (LabfolderEntry.ElementReference reference : source.elements()) {
            if (reference == null) {
                continue;
            }
            ElementType type = ElementType.fromLabel(reference.type());
            if (type == ElementType.UNSUPPORTED) {
                log.debug("Entry {}: keeping element {} of unsupported type {}.", source.id(), reference.id(),
                          reference.type());
                elements.add(new UnsupportedElement(reference.id(), reference.type()));
                continue;
            }
            try {
                elements.add(fetchElement(type, reference.id()));
            } catch (RuntimeException e) {
                log.warn("Entry {}: fetching {} element {} failed: {}", source.id(), type, reference.id(),
                         e.getMessage());
                failures.add(new ElementFetchFailure(reference.id(), type.getLabel(), e.getMessage()));
            }
        }

        LabfolderEntry.LabfolderProject project = source.project();
        String projectId = source.projectId() != null ? source.projectId() : project == null ? null : project.id();
        return Entry.builder()
                .id(source.id())
                .entryNumber(source.entryNumber())
                .title(source.title())
                .tags(new ArrayList<>(source.tags()))
                .projectId(projectId)
                .projectTitle(project == null ? null : project.title())
                .projectCreationDate(project == null ? null : project.creationDate())
                .projectEntryCount(project == null ? null : project.numberOfEntries())
                .author(author)
                .lastEditor(toAuthor(source.lastEditor()))
                .creationDate(source.creationDate())
                .versionDate(source.versionDate())
                .elements(elements)
                .fetchFailures(failures)
                .build();
    }

    private Element fetchElement(ElementType type, String elementId) {
        if (elementId == null || elementId.isBlank()) {
            throw new IllegalArgumentException("element reference without id");
        }
        return switch (type) {
            case TEXT -> {
                TextElementResponse text = labfolderApiClient.fetchText(elementId);
                yield new TextElement(elementId, text == null || text.content() == null ? "" : text.content());
            }
            case TABLE -> {
                SheetElementResponse table = labfolderApiClient.fetchTable(elementId);
                yield new TableElement(elementId, table.title(), table.content());
            }
            case WELL_PLATE -> {
                SheetElementResponse plate = labfolderApiClient.fetchWellPlate(elementId);
                yield new WellPlateElement(elementId, plate.title(), plate.content());
            }
            case DATA -> {
                DataElementResponse data = labfolderApiClient.fetchData(elementId);
                yield new DataElement(elementId, toItems(data.dataElements()));
            }
            case FILE -> {
                BinaryDownload file = labfolderApiClient.downloadFile(elementId);
                yield new FileElement(elementId, file.fileName(), file.mimeType(), file.content());
            }
            case IMAGE -> {
                BinaryDownload image = labfolderApiClient.downloadImage(elementId);
                yield new ImageElement(elementId, image.fileName(), image.mimeType(), image.content());
            }
            case UNSUPPORTED -> throw new IllegalStateException("unsupported elements are not fetched");
        };
    }

    private static List<DataItem> toItems(List<DataElementResponse.DataElementNode> nodes) {
        if (nodes == null) {
            return List.of();
        }
        return nodes.stream()
                .filter(Objects::nonNull)
                .map(node -> new DataItem(node.type(), node.title(),
                                          node.value() != null ? node.value() : node.description(),
                                          node.unit(), toItems(node.children())))
                .toList();
    }

    private static Author toAuthor(LabfolderEntry.LabfolderUser user) {
        return user == null ? null : new Author(user.firstName(), user.lastName());
    }
}
