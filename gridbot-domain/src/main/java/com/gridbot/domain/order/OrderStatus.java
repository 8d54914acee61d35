package com.gridbot.domain.order;

/**
 * NEW -> SUBMITTED -> {FILLED | REJECTED | CANCELLED}.
 */
public enum OrderStatus {
    NEW,
    SUBMITTED,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELLED;
    }

    boolean canMoveTo(OrderStatus next) {
        return switch (this) {
            case NEW -> next == SUBMITTED || next == REJECTED;
            case SUBMITTED -> next.isTerminal();
            default -> false;
        };
    }
}
