package com.treewalk;

import java.util.Locale;

/**
 * Source flavour requested by the caller. Selects the grammar and the {@code sourceType}
 * recorded on the resulting {@link com.treewalk.ast.Program}.
 */
public enum SourceType {
    MODULE("module", false),
    SCRIPT("script", false),
    JSX("jsx", false),
    TYPESCRIPT("typescript", true),
    TSX("tsx", true);

    private final String id;
    private final boolean typeScript;

    SourceType(String id, boolean typeScript) {
        this.id = id;
        this.typeScript = typeScript;
    }

    public String id() {
        return id;
    }

    public boolean isTypeScript() {
        return typeScript;
    }

    /**
     * Resolves a source type name such as {@code "module"} or {@code "ts"}.
     *
     * @throws ParseException if the name is not recognised
     */
    public static SourceType fromName(String name) {
        if (name == null) {
            throw new ParseException("Source type must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "module", "esm" -> MODULE;
            case "script" -> SCRIPT;
            case "jsx" -> JSX;
            case "ts", "typescript" -> TYPESCRIPT;
            case "tsx" -> TSX;
            default -> throw new ParseException("Unknown source type: '" + name
                + "' (expected module, script, jsx, ts, typescript or tsx)");
        };
    }

    /**
     * Infers the source type from a file name extension, defaulting to {@link #MODULE}.
     */
    public static SourceType fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".tsx")) {
            return TSX;
        }
        if (lower.endsWith(".ts") || lower.endsWith(".mts") || lower.endsWith(".cts")) {
            return TYPESCRIPT;
        }
        if (lower.endsWith(".jsx")) {
            return JSX;
        }
        if (lower.endsWith(".cjs")) {
            return SCRIPT;
        }
        return MODULE;
    }
}
