package com.chunkr.sink;

import java.io.IOException;
import java.util.List;

/**
 * Keyword-search sink. {@link #ingest} is keyed by document id: replaying documents must not
 * duplicate them.
 */
public interface SearchIndex {
    void checkReachable() throws IOException;

    /**
     * @param commit true to make the documents searchable before returning
     */
    void ingest(List<IndexDocument> documents, boolean commit) throws IOException;

    /**
     * Makes every previously ingested document searchable.
     */
    void commit() throws IOException;

    String describe();
}
