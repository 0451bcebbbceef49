package com.treewalk.ast;

/**
 * Fallback for constructs without a dedicated kind. Carries only its discriminator and location,
 * never children, and may stand in wherever a statement, expression, pattern or type is expected.
 */
public record GenericNode(
    String type,
    int start,
    int end,
    int startLine,
    int endLine
) implements Statement, Expression, Pattern, TSType, JSXChild, ClassMember, TSSignature {
    public GenericNode(String type, SourceLocation loc) {
        this(type, loc.start(), loc.end(), loc.startLine(), loc.endLine());
    }
}
