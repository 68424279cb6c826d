package com.signalguard.safety;

import com.signalguard.domain.enums.KillSwitchAction;
import com.signalguard.repository.redis.SystemFlagRedisRepository;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads the external kill switch. Sources are checked in order and the first active one wins:
 *
 * <ol>
 *   <li>the kill-switch file: present and empty means SAFE_MODE, unknown content also means
 *       SAFE_MODE</li>
 *   <li>the environment key</li>
 *   <li>the stored flag in Redis</li>
 * </ol>
 *
 * <p>{@code safe}, {@code safe_mode}, {@code 1} and {@code true} map to SAFE_MODE;
 * {@code panic}, {@code panic_close} and {@code 2} map to PANIC_CLOSE.
 */
@Component
public class KillSwitchReader {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchReader.class);

    private static final Set<String> SAFE_VALUES = Set.of("safe", "safe_mode", "1", "true");
    private static final Set<String> PANIC_VALUES = Set.of("panic", "panic_close", "2");

    private final SafetyConfig safetyConfig;
    private final SystemFlagRedisRepository systemFlagRedisRepository;
    private final UnaryOperator<String> environment;

    @Autowired
    public KillSwitchReader(SafetyConfig safetyConfig, SystemFlagRedisRepository systemFlagRedisRepository) {
        this(safetyConfig, systemFlagRedisRepository, System::getenv);
    }

    public KillSwitchReader(
            SafetyConfig safetyConfig,
            SystemFlagRedisRepository systemFlagRedisRepository,
            UnaryOperator<String> environment) {
        this.safetyConfig = safetyConfig;
        this.systemFlagRedisRepository = systemFlagRedisRepository;
        this.environment = environment;
    }

    public KillSwitchAction read() {
        KillSwitchAction fromFile = readFile();
        if (fromFile != KillSwitchAction.NONE) {
            return fromFile;
        }

        KillSwitchAction fromEnv = parseValue(environment.apply(safetyConfig.getKillSwitchEnvKey()));
        if (fromEnv != KillSwitchAction.NONE) {
            return fromEnv;
        }

        return readStoredFlag();
    }

    /** Stores the flag in Redis; {@link KillSwitchAction#NONE} clears it. */
    public void setStoredFlag(KillSwitchAction action) {
        if (action == KillSwitchAction.NONE) {
            systemFlagRedisRepository.clear(SystemFlagRedisRepository.KILL_SWITCH);
        } else {
            systemFlagRedisRepository.set(SystemFlagRedisRepository.KILL_SWITCH, action.name().toLowerCase(Locale.ROOT));
        }
    }

    private KillSwitchAction readFile() {
        String configured = safetyConfig.getKillSwitchFile();
        if (configured == null || configured.isBlank()) {
            return KillSwitchAction.NONE;
        }
        Path path = Path.of(configured);
        if (!Files.exists(path)) {
            return KillSwitchAction.NONE;
        }
        try {
            String content = normalize(Files.readString(path, StandardCharsets.UTF_8));
            if (content.isEmpty() || SAFE_VALUES.contains(content)) {
                return KillSwitchAction.SAFE_MODE;
            }
            if (PANIC_VALUES.contains(content)) {
                return KillSwitchAction.PANIC_CLOSE;
            }
            return KillSwitchAction.SAFE_MODE;
        } catch (IOException e) {
            // An unreadable switch file still counts as present
            log.warn("Kill switch file {} unreadable, assuming SAFE_MODE: {}", path, e.getMessage());
            return KillSwitchAction.SAFE_MODE;
        } catch (UncheckedIOException e) {
            log.warn("Kill switch file {} unreadable, assuming SAFE_MODE: {}", path, e.getMessage());
            return KillSwitchAction.SAFE_MODE;
        }
    }

    private KillSwitchAction readStoredFlag() {
        try {
            Optional<String> flag = systemFlagRedisRepository.get(SystemFlagRedisRepository.KILL_SWITCH);
            return flag.map(KillSwitchReader::parseValue).orElse(KillSwitchAction.NONE);
        } catch (RuntimeException e) {
            log.warn("Stored kill switch flag unavailable: {}", e.getMessage());
            return KillSwitchAction.NONE;
        }
    }

    /** Parses an environment or stored value; blank and unknown values are inactive. */
    public static KillSwitchAction parseValue(String raw) {
        String value = normalize(raw);
        if (SAFE_VALUES.contains(value)) {
            return KillSwitchAction.SAFE_MODE;
        }
        if (PANIC_VALUES.contains(value)) {
            return KillSwitchAction.PANIC_CLOSE;
        }
        return KillSwitchAction.NONE;
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
