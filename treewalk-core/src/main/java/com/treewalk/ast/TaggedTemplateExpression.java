package com.treewalk.ast;

public record TaggedTemplateExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression tag,
    TemplateLiteral quasi
) implements Expression {
    public TaggedTemplateExpression(SourceLocation loc, Expression tag, TemplateLiteral quasi) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), tag, quasi);
    }

    @Override
    public String type() {
        return "TaggedTemplateExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case TAG -> ChildSlot.of(tag);
            case QUASI -> ChildSlot.of(quasi);
            default -> ChildSlot.empty();
        };
    }
}
