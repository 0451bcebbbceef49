package com.treewalk.ast;

import java.util.List;

public record TemplateLiteral(
    int start,
    int end,
    int startLine,
    int endLine,
    List<TemplateElement> quasis,
    List<Expression> expressions
) implements Expression {
    public TemplateLiteral(SourceLocation loc, List<TemplateElement> quasis, List<Expression> expressions) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), quasis, expressions);
    }

    @Override
    public String type() {
        return "TemplateLiteral";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case QUASIS -> ChildSlot.of(quasis);
            case EXPRESSIONS -> ChildSlot.of(expressions);
            default -> ChildSlot.empty();
        };
    }
}
