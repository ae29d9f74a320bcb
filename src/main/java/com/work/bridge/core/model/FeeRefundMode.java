package com.work.bridge.core.model;

/**
 * relocation 被拒绝/取消时，已扣的手续费是否退还给发起人。
 */
public enum FeeRefundMode {
    /**
     * 不退手续费，仅退本金。
     */
    NOTHING,
    /**
     * 本金和手续费全额退还。
     */
    FULL
}
