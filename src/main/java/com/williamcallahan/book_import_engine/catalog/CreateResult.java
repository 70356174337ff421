package com.williamcallahan.book_import_engine.catalog;

/**
 * Outcome of a catalog create call. A duplicate is an ordinary result, not an exception.
 *
 * @param bookId id of the newly created book, or of the existing book that matched
 * @param status whether the book was created or already existed
 */
public record CreateResult(String bookId, Status status) {

    public enum Status {
        CREATED,
        ALREADY_EXISTS
    }

    public static CreateResult created(String bookId) {
        return new CreateResult(bookId, Status.CREATED);
    }

    public static CreateResult alreadyExists(String bookId) {
        return new CreateResult(bookId, Status.ALREADY_EXISTS);
    }

    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
