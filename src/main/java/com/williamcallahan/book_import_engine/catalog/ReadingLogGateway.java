package com.williamcallahan.book_import_engine.catalog;

import com.williamcallahan.book_import_engine.model.ReadingLogEntry;

import java.util.List;

public interface ReadingLogGateway {

    /**
     * Persists one reading session.
     *
     * @return id of the stored entry
     */
    String createEntry(ReadingLogEntry entry);

    List<ReadingLogEntry> listEntries(String owner);
}
