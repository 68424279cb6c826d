package com.signalguard.repository.redis;

import com.signalguard.config.RedisConfig;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.risk.RiskPolicyConfig;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis repository for managed positions, the hot copy read by the lifecycle manager,
 * reconciliation and the safety workers.
 *
 * <p>Active positions (open or waiting for confirmation) are indexed in a set. A position that
 * reaches a terminal state leaves the index and its key expires after {@link #TERMINAL_TTL};
 * the ledger keeps the permanent history.
 */
@Repository
@RequiredArgsConstructor
public class ManagedPositionRedisRepository {

    static final Duration TERMINAL_TTL = Duration.ofHours(24);

    private final RedisTemplate<String, Object> redisTemplate;

    public void save(ManagedPosition position) {
        String key = RedisConfig.KEY_PREFIX_POSITION + position.getPositionId();
        if (position.getState() != null && position.getState().isTerminal()) {
            redisTemplate.opsForValue().set(key, position, TERMINAL_TTL);
            redisTemplate.opsForSet().remove(RedisConfig.KEY_SET_POSITIONS_ALL, position.getPositionId());
            return;
        }
        redisTemplate.opsForValue().set(key, position);
        redisTemplate.opsForSet().add(RedisConfig.KEY_SET_POSITIONS_ALL, position.getPositionId());
    }

    public Optional<ManagedPosition> findById(String positionId) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_POSITION + positionId);
        return Optional.ofNullable((ManagedPosition) value);
    }

    /** All indexed (non-terminal) positions, including those waiting for confirmation. */
    public List<ManagedPosition> findAll() {
        Set<Object> ids = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_POSITIONS_ALL);
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> keys =
                ids.stream().map(id -> RedisConfig.KEY_PREFIX_POSITION + id).toList();

        List<Object> values = redisTemplate.opsForValue().multiGet(keys);
        if (values == null) {
            return Collections.emptyList();
        }

        return values.stream().filter(Objects::nonNull).map(v -> (ManagedPosition) v).toList();
    }

    public List<ManagedPosition> findOpen() {
        return findAll().stream().filter(ManagedPosition::isOpen).toList();
    }

    public List<ManagedPosition> findOpenBySymbol(String symbol) {
        String normalized = RiskPolicyConfig.normalize(symbol);
        return findOpen().stream()
                .filter(p -> RiskPolicyConfig.normalize(p.getSymbol()).equals(normalized))
                .toList();
    }

    public void delete(String positionId) {
        redisTemplate.delete(RedisConfig.KEY_PREFIX_POSITION + positionId);
        redisTemplate.opsForSet().remove(RedisConfig.KEY_SET_POSITIONS_ALL, positionId);
    }
}
