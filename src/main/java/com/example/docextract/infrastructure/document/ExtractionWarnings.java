package com.example.docextract.infrastructure.document;

import com.example.docextract.domain.model.ElementExtractionWarning;
import com.example.docextract.domain.model.ExtractionFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects recoverable element failures for one document and logs each one as it happens.
 */
public final class ExtractionWarnings {

    private static final Logger log = LoggerFactory.getLogger(ExtractionWarnings.class);

    private final String source;
    private final List<ElementExtractionWarning> warnings = new ArrayList<>();

    public ExtractionWarnings(String source) {
        this.source = source;
    }

    /**
     * Records a skipped element.
     *
     * @param location page or slide number, {@code 0} when unknown
     * @param feature  kind of element that was skipped
     * @param message  what went wrong
     * @param cause    underlying exception, may be {@code null}
     */
    public void add(int location, ExtractionFeature feature, String message, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null
                ? message + ": " + cause.getMessage()
                : message;
        warnings.add(new ElementExtractionWarning(location, feature, detail));
        log.warn("Skipped {} element at location {} in {}: {}", feature, location, source, detail);
        if (cause != null) {
            log.debug("Element failure cause", cause);
        }
    }

    public List<ElementExtractionWarning> asList() {
        return List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }
}
