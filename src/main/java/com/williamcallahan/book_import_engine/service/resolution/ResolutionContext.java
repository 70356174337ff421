package com.williamcallahan.book_import_engine.service.resolution;

import com.williamcallahan.book_import_engine.model.FieldMapping;
import com.williamcallahan.book_import_engine.service.enrichment.EnrichmentIndex;

/**
 * Per-job inputs shared by every row the resolution engine handles.
 */
public record ResolutionContext(String jobId,
                                String owner,
                                FieldMapping mapping,
                                EnrichmentIndex enrichment,
                                String defaultReadingStatus) {
}
