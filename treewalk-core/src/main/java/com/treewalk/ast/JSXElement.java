package com.treewalk.ast;

import java.util.List;

public record JSXElement(
    int start,
    int end,
    int startLine,
    int endLine,
    JSXOpeningElement openingElement,
    List<JSXChild> children,
    JSXClosingElement closingElement  // null when self-closing
) implements Expression, JSXChild {
    public JSXElement(SourceLocation loc, JSXOpeningElement openingElement, List<JSXChild> children, JSXClosingElement closingElement) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), openingElement, children, closingElement);
    }

    @Override
    public String type() {
        return "JSXElement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case OPENING_ELEMENT -> ChildSlot.of(openingElement);
            case CHILDREN -> ChildSlot.of(children);
            case CLOSING_ELEMENT -> ChildSlot.of(closingElement);
            default -> ChildSlot.empty();
        };
    }
}
