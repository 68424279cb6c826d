package com.signalguard.unit.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signalguard.domain.enums.KillSwitchAction;
import com.signalguard.repository.redis.SystemFlagRedisRepository;
import com.signalguard.safety.KillSwitchReader;
import com.signalguard.safety.SafetyConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for KillSwitchReader covering value parsing and the file, environment and stored-flag
 * sources.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class KillSwitchReaderTest {

    @TempDir
    Path tempDir;

    @Mock
    private SystemFlagRedisRepository systemFlagRedisRepository;

    private SafetyConfig safetyConfig;
    private Map<String, String> environment;
    private KillSwitchReader killSwitchReader;

    @BeforeEach
    void setUp() {
        safetyConfig = new SafetyConfig();
        safetyConfig.setKillSwitchFile(tempDir.resolve("KILL_SWITCH").toString());
        environment = new HashMap<>();
        when(systemFlagRedisRepository.get(SystemFlagRedisRepository.KILL_SWITCH)).thenReturn(Optional.empty());
        killSwitchReader = new KillSwitchReader(safetyConfig, systemFlagRedisRepository, environment::get);
    }

    private void writeSwitchFile(String content) throws IOException {
        Files.writeString(Path.of(safetyConfig.getKillSwitchFile()), content);
    }

    @Test
    @DisplayName("Safe and panic spellings parse case-insensitively; anything else is inactive")
    void parsesValues() {
        assertThat(KillSwitchReader.parseValue("safe")).isEqualTo(KillSwitchAction.SAFE_MODE);
        assertThat(KillSwitchReader.parseValue("SAFE_MODE")).isEqualTo(KillSwitchAction.SAFE_MODE);
        assertThat(KillSwitchReader.parseValue("1")).isEqualTo(KillSwitchAction.SAFE_MODE);
        assertThat(KillSwitchReader.parseValue("true")).isEqualTo(KillSwitchAction.SAFE_MODE);
        assertThat(KillSwitchReader.parseValue("panic")).isEqualTo(KillSwitchAction.PANIC_CLOSE);
        assertThat(KillSwitchReader.parseValue(" Panic_Close ")).isEqualTo(KillSwitchAction.PANIC_CLOSE);
        assertThat(KillSwitchReader.parseValue("2")).isEqualTo(KillSwitchAction.PANIC_CLOSE);
        assertThat(KillSwitchReader.parseValue("off")).isEqualTo(KillSwitchAction.NONE);
        assertThat(KillSwitchReader.parseValue("")).isEqualTo(KillSwitchAction.NONE);
    }

    @Test
    void nullValueIsInactive() {
        assertThat(KillSwitchReader.parseValue(null)).isEqualTo(KillSwitchAction.NONE);
    }

    @Nested
    @DisplayName("Switch file")
    class SwitchFile {

        @Test
        @DisplayName("No file, no env, no flag reads NONE")
        void inactive() {
            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.NONE);
        }

        @Test
        @DisplayName("Empty file means SAFE_MODE")
        void emptyFile() throws IOException {
            writeSwitchFile("");

            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.SAFE_MODE);
        }

        @Test
        @DisplayName("Unrecognized file content still means SAFE_MODE")
        void unknownContent() throws IOException {
            writeSwitchFile("please stop");

            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.SAFE_MODE);
        }

        @Test
        @DisplayName("panic in the file wins over a safe env value")
        void filePanicWins() throws IOException {
            writeSwitchFile("panic\n");
            environment.put(safetyConfig.getKillSwitchEnvKey(), "safe");

            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.PANIC_CLOSE);
        }

        @Test
        @DisplayName("Blank file path disables the file source")
        void fileDisabled() throws IOException {
            writeSwitchFile("");
            safetyConfig.setKillSwitchFile("");

            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.NONE);
        }
    }

    @Nested
    @DisplayName("Environment and stored flag")
    class EnvironmentAndFlag {

        @Test
        void envPanic() {
            environment.put(safetyConfig.getKillSwitchEnvKey(), "2");

            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.PANIC_CLOSE);
        }

        @Test
        @DisplayName("Unknown env value falls through to the stored flag")
        void unknownEnvFallsThrough() {
            environment.put(safetyConfig.getKillSwitchEnvKey(), "maybe");
            when(systemFlagRedisRepository.get(SystemFlagRedisRepository.KILL_SWITCH)).thenReturn(Optional.of("safe_mode"));

            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.SAFE_MODE);
        }

        @Test
        @DisplayName("Unavailable flag store reads as inactive")
        void storeUnavailable() {
            when(systemFlagRedisRepository.get(SystemFlagRedisRepository.KILL_SWITCH))
                    .thenThrow(new IllegalStateException("redis down"));

            assertThat(killSwitchReader.read()).isEqualTo(KillSwitchAction.NONE);
        }

        @Test
        void storeAndClearFlag() {
            killSwitchReader.setStoredFlag(KillSwitchAction.PANIC_CLOSE);
            killSwitchReader.setStoredFlag(KillSwitchAction.NONE);

            verify(systemFlagRedisRepository).set(SystemFlagRedisRepository.KILL_SWITCH, "panic_close");
            verify(systemFlagRedisRepository).clear(SystemFlagRedisRepository.KILL_SWITCH);
        }
    }
}
