package com.williamcallahan.book_import_engine.service.detect;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted header names that identify one export format.
 *
 * @param format format the signature identifies
 * @param weights lower-case header name to weight
 */
public record FormatSignature(ImportFormat format, Map<String, Double> weights) {

    public FormatSignature {
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public double totalWeight() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Sum of the weights of every signature header present, divided by the total weight.
     */
    public double score(Collection<String> headers) {
        double total = totalWeight();
        if (total <= 0 || headers == null) {
            return 0.0;
        }
        double matched = headers.stream()
            .filter(header -> header != null)
            .map(header -> header.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .mapToDouble(header -> weights.getOrDefault(header, 0.0))
            .sum();
        return matched / total;
    }
}
