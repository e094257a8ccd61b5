package com.flagship.retainer_settlement.settlement;

/**
 * Lifecycle of one kanban card drag.
 */
public enum DragState {
    IDLE,
    DRAGGING,
    DROPPED_SAME_COLUMN,
    /**
     * Dropped on another column. The drag is over once the ledger takes the stage change.
     */
    DROPPED_OTHER_COLUMN
}
