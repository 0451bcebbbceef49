package com.treewalk;

import java.util.Objects;

/**
 * Immutable parse settings.
 *
 * @param sourceType        grammar and program source type
 * @param collectComments   whether {@link ParseResult#comments()} is populated
 * @param reportDiagnostics whether {@link ParseResult#errors()} is populated
 */
public record ParseOptions(SourceType sourceType, boolean collectComments, boolean reportDiagnostics) {

    private static final ParseOptions DEFAULTS = new ParseOptions(SourceType.MODULE, true, true);

    public ParseOptions {
        Objects.requireNonNull(sourceType, "sourceType");
    }

    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    public static ParseOptions of(SourceType sourceType) {
        return DEFAULTS.withSourceType(sourceType);
    }

    public ParseOptions withSourceType(SourceType sourceType) {
        return new ParseOptions(sourceType, collectComments, reportDiagnostics);
    }

    public ParseOptions withCollectComments(boolean collectComments) {
        return new ParseOptions(sourceType, collectComments, reportDiagnostics);
    }

    public ParseOptions withReportDiagnostics(boolean reportDiagnostics) {
        return new ParseOptions(sourceType, collectComments, reportDiagnostics);
    }
}
