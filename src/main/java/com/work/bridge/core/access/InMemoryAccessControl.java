package com.work.bridge.core.access;

import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.exception.BridgeAccessDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.bridge.core.support.ValidationUtils.normalizeAddress;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 基于内存集合的角色表，启动时由配置初始化，运行期通过 grant / revoke 调整。
 */
public class InMemoryAccessControl implements AccessControl {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAccessControl.class);

    private final Map<BridgeRole, Set<String>> members = new EnumMap<>(BridgeRole.class);
    private final BridgeEventPublisher events;

    public InMemoryAccessControl(BridgeEventPublisher events) {
        this.events = requireNonNull(events, "events");
        for (BridgeRole role : BridgeRole.values()) {
            members.put(role, ConcurrentHashMap.newKeySet());
        }
    }

    /**
     * 启动期初始化，不做 OWNER 校验。
     */
    public void setup(BridgeRole role, String account) {
        String normalized = requireNonNull(normalizeAddress(account), "account");
        members.get(requireNonNull(role, "role")).add(normalized);
        log.info("role assigned role={} account={}", role, normalized);
    }

    @Override
    public boolean hasRole(BridgeRole role, String account) {
        String normalized = normalizeAddress(account);
        return normalized != null && members.get(requireNonNull(role, "role")).contains(normalized);
    }

    @Override
    public void checkRole(BridgeRole role, String account) {
        if (!hasRole(role, account)) {
            throw new BridgeAccessDeniedException(account, role);
        }
    }

    @Override
    public void grantRole(BridgeRole role, String account, String sender) {
        checkRole(BridgeRole.OWNER, sender);
        String normalized = requireNonNull(normalizeAddress(account), "account");
        if (members.get(requireNonNull(role, "role")).add(normalized)) {
            events.publish(l -> l.onRoleGranted(role, normalized, normalizeAddress(sender)));
        }
    }

    @Override
    public void revokeRole(BridgeRole role, String account, String sender) {
        checkRole(BridgeRole.OWNER, sender);
        String normalized = requireNonNull(normalizeAddress(account), "account");
        if (members.get(requireNonNull(role, "role")).remove(normalized)) {
            events.publish(l -> l.onRoleRevoked(role, normalized, normalizeAddress(sender)));
        }
    }

    @Override
    public Set<String> members(BridgeRole role) {
        return Collections.unmodifiableSet(new TreeSet<>(members.get(requireNonNull(role, "role"))));
    }
}
