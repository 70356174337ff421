/**
 * Narrow contract the import pipeline needs from the book catalog
 *
 * Features:
 * - Identifier and title/author lookups used for duplicate detection
 * - Create with an explicit created/already-exists result
 * - Partial update of catalog-level fields
 * - Per-owner relationship writes for personal data
 * - Owner-scoped exact title lookup and search used for reading-history matching
 */
package com.williamcallahan.book_import_engine.catalog;

import com.williamcallahan.book_import_engine.exception.CatalogOperationException;
import com.williamcallahan.book_import_engine.model.BookPatch;
import com.williamcallahan.book_import_engine.model.CandidateBook;
import com.williamcallahan.book_import_engine.model.CatalogBook;
import com.williamcallahan.book_import_engine.model.PersonalBookData;

import java.util.List;
import java.util.Optional;

public interface CatalogGateway {

    Optional<String> findByIdentifier(String isbn);

    Optional<String> findByTitleAuthor(String title, String author);

    Optional<CatalogBook> findById(String bookId);

    /**
     * Creates the book unless the catalog already holds a match by ISBN, then by title and
     * primary author.
     *
     * @throws CatalogOperationException when the catalog rejects a book that is not a duplicate
     */
    CreateResult create(CandidateBook candidate);

    /**
     * Applies a partial update to catalog-level fields.
     *
     * @return {@code false} when the book no longer exists or the update was refused
     */
    boolean update(String bookId, BookPatch patch);

    /**
     * Creates or updates the owner's relationship to a book. Personal custom values are merged
     * with existing ones.
     */
    void upsertPersonalData(String owner, String bookId, PersonalBookData data);

    Optional<PersonalBookData> findPersonalData(String owner, String bookId);

    /**
     * Id of the book in the owner's library whose title equals {@code title}, ignoring case and
     * surrounding whitespace. Unlike {@link #search} this is not capped by a result limit.
     */
    Optional<String> findOwnedByTitle(String owner, String title);

    List<CatalogBook> search(String query, String owner, int limit);

    /**
     * Id of the well-known placeholder book that collects reading sessions naming no book.
     */
    String unassignedBookId();
}
