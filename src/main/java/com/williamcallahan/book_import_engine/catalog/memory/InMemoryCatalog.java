/**
 * In-memory catalog used when no catalog backend is configured
 *
 * Features:
 * - Implements the book, custom-field, reading-log and mapping-template contracts in one process-local store
 * - Duplicate check and insert happen under one lock, giving per-record atomicity
 * - Owner relationships keep personal data apart from catalog-level fields
 * - Also serves as the catalog fake in tests
 */
package com.williamcallahan.book_import_engine.catalog.memory;

import com.williamcallahan.book_import_engine.catalog.CatalogGateway;
import com.williamcallahan.book_import_engine.catalog.CreateResult;
import com.williamcallahan.book_import_engine.catalog.CustomFieldCatalog;
import com.williamcallahan.book_import_engine.catalog.MappingTemplateCatalog;
import com.williamcallahan.book_import_engine.catalog.ReadingLogGateway;
import com.williamcallahan.book_import_engine.exception.CatalogOperationException;
import com.williamcallahan.book_import_engine.model.BookPatch;
import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.CatalogBook;
import com.williamcallahan.book_import_engine.model.CustomFieldDefinition;
import com.williamcallahan.book_import_engine.model.FieldScope;
import com.williamcallahan.book_import_engine.model.MappingTemplate;
import com.williamcallahan.book_import_engine.model.PersonalBookData;
import com.williamcallahan.book_import_engine.model.ReadingLogEntry;
import com.williamcallahan.book_import_engine.util.IsbnUtils;
import com.williamcallahan.book_import_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
@ConditionalOnProperty(name = "app.catalog.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryCatalog implements CatalogGateway, CustomFieldCatalog, ReadingLogGateway, MappingTemplateCatalog {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCatalog.class);

    public static final String UNASSIGNED_BOOK_ID = "unassigned-reading-sessions";
    static final String UNASSIGNED_BOOK_TITLE = "Unassigned Reading Sessions";

    private final Map<String, CatalogBook> books = new LinkedHashMap<>();
    private final Map<String, Map<String, PersonalBookData>> libraries = new ConcurrentHashMap<>();
    private final Map<String, CustomFieldDefinition> definitions = new ConcurrentHashMap<>();
    private final List<ReadingLogEntry> readingLog = new CopyOnWriteArrayList<>();
    private final Map<String, MappingTemplate> templates = new LinkedHashMap<>();
    private final Object lock = new Object();

    public InMemoryCatalog() {
        logger.info("No catalog backend configured. Using in-memory catalog implementation.");
    }

    @Override
    public Optional<String> findByIdentifier(String isbn) {
        synchronized (lock) {
            return findByIdentifierLocked(isbn);
        }
    }

    @Override
    public Optional<String> findByTitleAuthor(String title, String author) {
        synchronized (lock) {
            return findByTitleAuthorLocked(title, author);
        }
    }

    @Override
    public Optional<CatalogBook> findById(String bookId) {
        synchronized (lock) {
            return Optional.ofNullable(books.get(bookId)).map(CatalogBook::copy);
        }
    }

    @Override
    public CreateResult create(CandidateBook candidate) {
        if (candidate == null || !candidate.hasTitle()) {
            throw new CatalogOperationException("A catalog book needs a title");
        }
        synchronized (lock) {
            Optional<String> existing = findByIdentifierLocked(candidate.getIsbn13())
                .or(() -> findByIdentifierLocked(candidate.getIsbn10()))
                .or(() -> findByTitleAuthorLocked(candidate.getTitle(), candidate.getPrimaryAuthor()));
            if (existing.isPresent()) {
                return CreateResult.alreadyExists(existing.get());
            }
            String id = UUID.randomUUID().toString();
            books.put(id, CatalogBook.fromCandidate(id, candidate));
            return CreateResult.created(id);
        }
    }

    @Override
    public boolean update(String bookId, BookPatch patch) {
        synchronized (lock) {
            CatalogBook book = books.get(bookId);
            if (book == null) {
                return false;
            }
            applyPatch(book, patch);
            return true;
        }
    }

    @Override
    public void upsertPersonalData(String owner, String bookId, PersonalBookData data) {
        libraries.computeIfAbsent(owner, key -> new ConcurrentHashMap<>())
            .merge(bookId, data, InMemoryCatalog::mergePersonal);
    }

    @Override
    public Optional<PersonalBookData> findPersonalData(String owner, String bookId) {
        return Optional.ofNullable(libraries.getOrDefault(owner, Map.of()).get(bookId));
    }

    @Override
    public Optional<String> findOwnedByTitle(String owner, String title) {
        if (!ValidationUtils.hasText(title)) {
            return Optional.empty();
        }
        String wanted = title.trim().toLowerCase(Locale.ROOT);
        Map<String, PersonalBookData> library = libraries.getOrDefault(owner, Map.of());
        synchronized (lock) {
            return books.values().stream()
                .filter(book -> library.containsKey(book.getId()) && !UNASSIGNED_BOOK_ID.equals(book.getId()))
                .filter(book -> book.getTitle() != null && book.getTitle().trim().toLowerCase(Locale.ROOT).equals(wanted))
                .map(CatalogBook::getId)
                .findFirst();
        }
    }

    @Override
    public List<CatalogBook> search(String query, String owner, int limit) {
        if (!ValidationUtils.hasText(query) || limit <= 0) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        Map<String, PersonalBookData> library = libraries.getOrDefault(owner, Map.of());
        List<CatalogBook> results = new ArrayList<>();
        synchronized (lock) {
            for (CatalogBook book : books.values()) {
                if (results.size() >= limit) {
                    break;
                }
                if (!library.containsKey(book.getId()) || UNASSIGNED_BOOK_ID.equals(book.getId())) {
                    continue;
                }
                if (book.getTitle() != null && book.getTitle().toLowerCase(Locale.ROOT).contains(needle)) {
                    results.add(book.copy());
                }
            }
        }
        return results;
    }

    @Override
    public String unassignedBookId() {
        synchronized (lock) {
            books.computeIfAbsent(UNASSIGNED_BOOK_ID, id -> {
                CatalogBook placeholder = new CatalogBook();
                placeholder.setId(id);
                placeholder.setTitle(UNASSIGNED_BOOK_TITLE);
                return placeholder;
            });
        }
        return UNASSIGNED_BOOK_ID;
    }

    @Override
    public Optional<CustomFieldDefinition> findDefinition(String name, FieldScope scope, String owner) {
        return Optional.ofNullable(definitions.get(definitionKey(name, scope, owner)));
    }

    @Override
    public CustomFieldDefinition createDefinition(CustomFieldDefinition definition) {
        if (!ValidationUtils.hasText(definition.name()) || definition.scope() == null || definition.type() == null) {
            throw new CatalogOperationException("Custom field definitions need a name, scope and type");
        }
        return definitions.computeIfAbsent(
            definitionKey(definition.name(), definition.scope(), definition.ownerId()), key -> definition);
    }

    @Override
    public List<CustomFieldDefinition> listDefinitions(String owner) {
        return definitions.values().stream()
            .filter(def -> def.scope() == FieldScope.GLOBAL || owner.equals(def.ownerId()))
            .toList();
    }

    @Override
    public MappingTemplate saveTemplate(MappingTemplate template) {
        if (!ValidationUtils.hasText(template.id()) || !ValidationUtils.hasText(template.ownerId())) {
            throw new CatalogOperationException("Mapping templates need an id and an owner");
        }
        synchronized (templates) {
            templates.put(template.id(), template);
        }
        return template;
    }

    @Override
    public Optional<MappingTemplate> findTemplate(String templateId) {
        synchronized (templates) {
            return Optional.ofNullable(templates.get(templateId));
        }
    }

    @Override
    public List<MappingTemplate> listTemplates(String owner) {
        synchronized (templates) {
            return templates.values().stream()
                .filter(template -> template.isSystem() || template.ownerId().equals(owner))
                .sorted(Comparator.comparing(MappingTemplate::createdAt,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .toList();
        }
    }

    @Override
    public boolean deleteTemplate(String templateId) {
        synchronized (templates) {
            return templates.remove(templateId) != null;
        }
    }

    @Override
    public String createEntry(ReadingLogEntry entry) {
        synchronized (lock) {
            if (!books.containsKey(entry.bookId())) {
                throw new CatalogOperationException("Reading log entry references unknown book " + entry.bookId());
            }
        }
        readingLog.add(entry);
        return UUID.randomUUID().toString();
    }

    @Override
    public List<ReadingLogEntry> listEntries(String owner) {
        return readingLog.stream().filter(entry -> entry.owner().equals(owner)).toList();
    }

    public int bookCount() {
        synchronized (lock) {
            return (int) books.keySet().stream().filter(id -> !UNASSIGNED_BOOK_ID.equals(id)).count();
        }
    }

    public List<CatalogBook> allBooks() {
        synchronized (lock) {
            return books.values().stream()
                .filter(book -> !UNASSIGNED_BOOK_ID.equals(book.getId()))
                .map(CatalogBook::copy)
                .toList();
        }
    }

    private Optional<String> findByIdentifierLocked(String isbn) {
        if (!ValidationUtils.hasText(isbn)) {
            return Optional.empty();
        }
        String key = IsbnUtils.canonicalKey(isbn);
        if (key == null) {
            return Optional.empty();
        }
        return books.values().stream()
            .filter(book -> key.equals(IsbnUtils.canonicalKey(book.getIsbn13())) || key.equals(IsbnUtils.canonicalKey(book.getIsbn10())))
            .map(CatalogBook::getId)
            .findFirst();
    }

    private Optional<String> findByTitleAuthorLocked(String title, String author) {
        if (!ValidationUtils.hasText(title)) {
            return Optional.empty();
        }
        String wantedTitle = title.trim().toLowerCase(Locale.ROOT);
        String wantedAuthor = author == null ? "" : author.trim().toLowerCase(Locale.ROOT);
        return books.values().stream()
            .filter(book -> book.getTitle() != null && book.getTitle().trim().toLowerCase(Locale.ROOT).equals(wantedTitle))
            .filter(book -> {
                String primary = book.getAuthors().isEmpty() ? "" : book.getAuthors().get(0).trim().toLowerCase(Locale.ROOT);
                return primary.equals(wantedAuthor);
            })
            .map(CatalogBook::getId)
            .findFirst();
    }

    private static void applyPatch(CatalogBook book, BookPatch patch) {
        if (patch.getSubtitle() != null) book.setSubtitle(patch.getSubtitle());
        if (patch.getAuthors() != null) book.setAuthors(new ArrayList<>(patch.getAuthors()));
        if (patch.getIsbn10() != null) book.setIsbn10(patch.getIsbn10());
        if (patch.getIsbn13() != null) book.setIsbn13(patch.getIsbn13());
        if (patch.getAsin() != null) book.setAsin(patch.getAsin());
        if (patch.getPublisher() != null) book.setPublisher(patch.getPublisher());
        if (patch.getPublishedDate() != null) book.setPublishedDate(patch.getPublishedDate());
        if (patch.getPageCount() != null) book.setPageCount(patch.getPageCount());
        if (patch.getLanguage() != null) book.setLanguage(patch.getLanguage());
        if (patch.getDescription() != null) book.setDescription(patch.getDescription());
        if (patch.getCoverUrl() != null) book.setCoverUrl(patch.getCoverUrl());
        if (patch.getCategories() != null) book.setCategories(new ArrayList<>(patch.getCategories()));
        if (patch.getAverageRating() != null) book.setAverageRating(patch.getAverageRating());
        if (patch.getRatingCount() != null) book.setRatingCount(patch.getRatingCount());
        if (!patch.getGlobalCustomMetadata().isEmpty()) {
            Map<String, String> merged = new LinkedHashMap<>(book.getGlobalCustomMetadata());
            merged.putAll(patch.getGlobalCustomMetadata());
            book.setGlobalCustomMetadata(merged);
        }
    }

    private static PersonalBookData mergePersonal(PersonalBookData existing, PersonalBookData incoming) {
        Map<String, String> custom = new LinkedHashMap<>(existing.customMetadata());
        custom.putAll(incoming.customMetadata());
        return new PersonalBookData(
            incoming.readingStatus() != null ? incoming.readingStatus() : existing.readingStatus(),
            incoming.userRating() != null ? incoming.userRating() : existing.userRating(),
            incoming.personalNotes() != null ? incoming.personalNotes() : existing.personalNotes(),
            incoming.dateRead() != null ? incoming.dateRead() : existing.dateRead(),
            incoming.dateAdded() != null ? incoming.dateAdded() : existing.dateAdded(),
            incoming.startDate() != null ? incoming.startDate() : existing.startDate(),
            custom);
    }

    private static String definitionKey(String name, FieldScope scope, String owner) {
        String ownerPart = scope == FieldScope.GLOBAL ? "*" : String.valueOf(owner);
        return scope.getWireValue() + ":" + ownerPart + ":" + name.toLowerCase(Locale.ROOT);
    }
}
