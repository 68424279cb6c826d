package com.signalguard.repository.redis;

import com.signalguard.config.RedisConfig;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis repository for operator-controlled system flags, such as the stored kill switch.
 */
@Repository
@RequiredArgsConstructor
public class SystemFlagRedisRepository {

    public static final String KILL_SWITCH = "kill_switch";

    private final RedisTemplate<String, Object> redisTemplate;

    public Optional<String> get(String name) {
        Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_FLAG + name);
        return Optional.ofNullable(value).map(String::valueOf);
    }

    public void set(String name, String value) {
        redisTemplate.opsForValue().set(RedisConfig.KEY_PREFIX_FLAG + name, value);
    }

    public void clear(String name) {
        redisTemplate.delete(RedisConfig.KEY_PREFIX_FLAG + name);
    }
}
