package com.work.bridge.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * relocation 生命周期状态。
 * <pre>
 * NONEXISTENT -> PENDING -> {PROCESSED | POSTPONED | CANCELED | REJECTED | ABORTED}
 * POSTPONED   -> {CONTINUED | CANCELED | REJECTED | ABORTED}
 * </pre>
 * 离开 PENDING 之后同一个 (chainId, nonce) 永远不会再回到 PENDING。
 */
public enum RelocationStatus {
    NONEXISTENT,
    PENDING,
    CANCELED,
    PROCESSED,
    REJECTED,
    ABORTED,
    POSTPONED,
    CONTINUED;

    private static final Set<RelocationStatus> REFUSABLE = EnumSet.of(PENDING, POSTPONED);
    private static final Set<RelocationStatus> TERMINAL = EnumSet.of(PROCESSED, CANCELED, REJECTED, ABORTED, CONTINUED);

    /**
     * cancel / reject / abort 只允许从 PENDING 或 POSTPONED 发起。
     */
    public boolean isRefusable() {
        return REFUSABLE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
