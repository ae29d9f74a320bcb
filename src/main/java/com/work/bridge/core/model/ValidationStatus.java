package com.work.bridge.core.model;

/**
 * accommodation guard 的校验结果码。
 */
public enum ValidationStatus {
    NO_ERROR,
    TIME_FRAME_NOT_SET,
    VOLUME_LIMIT_REACHED
}
