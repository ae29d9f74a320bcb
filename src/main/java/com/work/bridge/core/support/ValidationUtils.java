package com.work.bridge.core.support;

import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * 零地址：0x 后跟 40 个 0。
     */
    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ZERO_ADDRESS_PATTERN = Pattern.compile("^(0x)?0*$", Pattern.CASE_INSENSITIVE);

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验long值必须非负
     */
    public static long requireNonNegative(long value, String paramName) {
        if (value < 0) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return value;
    }

    /**
     * null、空串以及全 0 地址都视为“零地址”（对应合约里的 address(0)）。
     */
    public static boolean isZeroAddress(String address) {
        return address == null || address.trim().isEmpty() || ZERO_ADDRESS_PATTERN.matcher(address.trim()).matches();
    }

    /**
     * 地址统一为小写并去除首尾空白；零地址统一为 null，便于比较与存储。
     */
    public static String normalizeAddress(String address) {
        if (isZeroAddress(address)) {
            return null;
        }
        return address.trim().toLowerCase();
    }

    public static boolean isZeroAmount(BigInteger amount) {
        return amount == null || amount.signum() <= 0;
    }

    /**
     * 校验地址非零，否则抛出指定错误码。
     */
    public static String requireAddress(String address, BridgeErrorCode code) {
        if (isZeroAddress(address)) {
            throw new BridgeException(code, code.name() + ": address=" + address);
        }
        return normalizeAddress(address);
    }
}
