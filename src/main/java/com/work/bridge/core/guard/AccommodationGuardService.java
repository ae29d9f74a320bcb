package com.work.bridge.core.guard;

import com.work.bridge.core.event.BridgeEventPublisher;
import com.work.bridge.core.exception.BridgeErrorCode;
import com.work.bridge.core.exception.BridgeException;
import com.work.bridge.core.model.GuardConfig;
import com.work.bridge.core.model.ValidationStatus;
import com.work.bridge.core.repository.GuardConfigRepository;
import com.work.bridge.core.support.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Optional;

import static com.work.bridge.core.support.ValidationUtils.requireAddress;
import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * accommodation 限额守卫：按 (chainId, token) 限制每个时间窗口内累计入账的数量。
 * <p>
 * 窗口从 lastResetTime 开始，长度为 timeFrame 秒；窗口结束后的第一次校验开启新窗口。
 * validate 只允许已登记的 bridge 调用，由账本在 accommodate 事务内同步调用（PROPAGATION_REQUIRED 加入同一事务）。
 */
public class AccommodationGuardService {

    private static final Logger log = LoggerFactory.getLogger(AccommodationGuardService.class);

    private final GuardConfigRepository repository;
    private final BridgeEventPublisher events;
    private final Clock clock;
    private final TransactionTemplate txTemplate;

    public AccommodationGuardService(GuardConfigRepository repository,
                                     BridgeEventPublisher events,
                                     Clock clock,
                                     @NonNull PlatformTransactionManager transactionManager) {
        this.repository = requireNonNull(repository, "repository");
        this.events = requireNonNull(events, "events");
        this.clock = requireNonNull(clock, "clock");
        requireNonNull(transactionManager, "transactionManager");
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.txTemplate = template;
    }

    /**
     * 登记允许调用 {@link #validate} 的 bridge 地址。
     */
    public void setBridge(String newBridge) {
        String bridge = requireAddress(newBridge, BridgeErrorCode.ZERO_BRIDGE_ADDRESS);
        txTemplate.executeWithoutResult(status -> {
            String oldBridge = repository.findBridge().orElse(null);
            repository.saveBridge(bridge);
            events.publish(l -> l.onSetBridge(oldBridge, bridge));
        });
    }

    public String getBridge() {
        return repository.findBridge().orElse(null);
    }

    /**
     * 首次配置时开启窗口（lastResetTime = now, currentVolume = 0）；
     * 再次配置只更新 timeFrame / volumeLimit，不重置当前窗口进度。
     */
    public void configure(long chainId, String token, long timeFrame, BigInteger volumeLimit) {
        String normalizedToken = requireKey(chainId, token);
        if (timeFrame <= 0) {
            throw new BridgeException(BridgeErrorCode.ZERO_TIME_FRAME, "timeFrame 必须大于0: " + timeFrame);
        }
        if (ValidationUtils.isZeroAmount(volumeLimit)) {
            throw new BridgeException(BridgeErrorCode.ZERO_VOLUME_LIMIT, "volumeLimit 必须大于0: " + volumeLimit);
        }
        txTemplate.executeWithoutResult(status -> {
            GuardConfig config = repository.lockAndLoad(chainId, normalizedToken)
                    .orElseGet(() -> new GuardConfig(chainId, normalizedToken, 0L, BigInteger.ZERO,
                            BigInteger.ZERO, nowSeconds()));
            config.setTimeFrame(timeFrame);
            config.setVolumeLimit(volumeLimit);
            repository.save(config);
            events.publish(l -> l.onConfigureAccommodationGuard(chainId, normalizedToken, timeFrame, volumeLimit));
        });
        log.info("guard configured chainId={} token={} timeFrame={} volumeLimit={}", chainId, normalizedToken, timeFrame, volumeLimit);
    }

    /**
     * 清空配置，等同于从未配置过。
     */
    public void reset(long chainId, String token) {
        String normalizedToken = requireKey(chainId, token);
        txTemplate.executeWithoutResult(status -> {
            repository.lockAndLoad(chainId, normalizedToken);
            repository.delete(chainId, normalizedToken);
            events.publish(l -> l.onResetAccommodationGuard(chainId, normalizedToken));
        });
    }

    /**
     * 校验一笔入账是否超出当前窗口的限额，通过时累加 currentVolume。
     * <p>
     * 返回非 NO_ERROR 时不修改任何状态（包括窗口翻转）。account 不参与计算，仅为接口对称保留。
     *
     * @throws BridgeException NOT_BRIDGE：调用方不是已登记的 bridge
     */
    public ValidationStatus validate(String caller, long chainId, String token, String account, BigInteger amount) {
        String bridge = repository.findBridge().orElse(null);
        if (bridge == null || !bridge.equals(ValidationUtils.normalizeAddress(caller))) {
            throw new BridgeException(BridgeErrorCode.NOT_BRIDGE, "guard validate 只允许 bridge 调用: caller=" + caller);
        }
        requireNonNull(amount, "amount");
        String normalizedToken = ValidationUtils.normalizeAddress(token);
        if (normalizedToken == null) {
            return ValidationStatus.TIME_FRAME_NOT_SET;
        }
        return txTemplate.execute(status -> {
            Optional<GuardConfig> loaded = repository.lockAndLoad(chainId, normalizedToken);
            if (!loaded.isPresent() || !loaded.get().isConfigured()) {
                return ValidationStatus.TIME_FRAME_NOT_SET;
            }
            GuardConfig config = loaded.get();
            long now = nowSeconds();
            if (now - config.getLastResetTime() >= config.getTimeFrame()) {
                config.setCurrentVolume(BigInteger.ZERO);
                config.setLastResetTime(now);
            }
            BigInteger nextVolume = config.getCurrentVolume().add(amount);
            if (nextVolume.compareTo(config.getVolumeLimit()) > 0) {
                log.warn("guard volume limit reached chainId={} token={} account={} amount={} currentVolume={} volumeLimit={}",
                        chainId, normalizedToken, account, amount, config.getCurrentVolume(), config.getVolumeLimit());
                return ValidationStatus.VOLUME_LIMIT_REACHED;
            }
            config.setCurrentVolume(nextVolume);
            repository.save(config);
            return ValidationStatus.NO_ERROR;
        });
    }

    /**
     * 未配置时返回全零配置。
     */
    public GuardConfig getConfig(long chainId, String token) {
        String normalizedToken = ValidationUtils.normalizeAddress(token);
        return repository.find(chainId, normalizedToken).orElseGet(() -> GuardConfig.empty(chainId, normalizedToken));
    }

    private static String requireKey(long chainId, String token) {
        if (chainId == 0) {
            throw new BridgeException(BridgeErrorCode.ZERO_CHAIN_ID, "chainId 不能为0");
        }
        return requireAddress(token, BridgeErrorCode.ZERO_TOKEN_ADDRESS);
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
