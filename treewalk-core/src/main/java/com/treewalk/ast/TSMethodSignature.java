package com.treewalk.ast;

import java.util.List;

public record TSMethodSignature(
    int start,
    int end,
    int startLine,
    int endLine,
    Node key,
    boolean optional,
    List<Pattern> params,
    TSTypeAnnotation returnType
) implements TSSignature {
    public TSMethodSignature(SourceLocation loc, Node key, boolean optional, List<Pattern> params, TSTypeAnnotation returnType) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), key, optional, params, returnType);
    }

    @Override
    public String type() {
        return "TSMethodSignature";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case KEY -> ChildSlot.of(key);
            case PARAMS -> ChildSlot.of(params);
            case RETURN_TYPE -> ChildSlot.of(returnType);
            default -> ChildSlot.empty();
        };
    }
}
