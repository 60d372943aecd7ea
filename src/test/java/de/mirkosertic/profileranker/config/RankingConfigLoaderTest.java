package de.mirkosertic.profileranker.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RankingConfigLoader}.
 */
class RankingConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperty() {
        System.clearProperty(RankingConfigLoader.PROP_CONFIG_FILE);
    }

    @Test
    void testBundledDefaultsMatchBuiltInDefaults() {
        final RankingConfigLoader loader = new RankingConfigLoader("ranking.yaml", tempDir.resolve("missing.yaml"));

        assertThat(loader.load()).isEqualTo(RankingConfig.defaults());
    }

    @Test
    void testMissingClasspathResource() {
        final RankingConfigLoader loader = new RankingConfigLoader("does-not-exist.yaml", tempDir.resolve("missing.yaml"));

        assertThat(loader.load()).isEqualTo(RankingConfig.defaults());
    }

    @Test
    void testUserFileOverridesClasspath() throws IOException {
        final Path userFile = tempDir.resolve("ranking.yaml");
        Files.writeString(userFile, """
                ranking:
                  k1: 1.2
                  stage-a-two-query: true
                  field-weights:
                    biography: 2.0
                """);

        final RankingConfig config = new RankingConfigLoader("ranking.yaml", userFile).load();

        assertThat(config.value(RankingParameter.K1)).isEqualTo(1.2);
        assertThat(config.flag(RankingParameter.STAGE_A_TWO_QUERY)).isTrue();
        assertThat(config.value(RankingParameter.B)).isEqualTo(0.75);
    }

    @Test
    void testSystemPropertyFileHasPriority() throws IOException {
        final Path userFile = tempDir.resolve("user.yaml");
        Files.writeString(userFile, "ranking:\n  k1: 1.2\n  b: 0.5\n");
        final Path explicitFile = tempDir.resolve("explicit.yaml");
        Files.writeString(explicitFile, "ranking:\n  k1: 0.9\n");
        System.setProperty(RankingConfigLoader.PROP_CONFIG_FILE, explicitFile.toString());

        final RankingConfig config = new RankingConfigLoader("ranking.yaml", userFile).load();

        assertThat(config.value(RankingParameter.K1)).isEqualTo(0.9);
        assertThat(config.value(RankingParameter.B)).isEqualTo(0.5);
    }

    @Test
    void testInvalidValueFailsTheLoad() throws IOException {
        final Path userFile = tempDir.resolve("ranking.yaml");
        Files.writeString(userFile, "ranking:\n  b: 3.0\n");

        final RankingConfigLoader loader = new RankingConfigLoader("ranking.yaml", userFile);

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    void testApplyWithoutRankingSection() {
        final RankingConfig base = RankingConfig.defaults();

        assertThat(RankingConfigLoader.apply(base, stream("other:\n  k1: 3.0\n"))).isSameAs(base);
        assertThat(RankingConfigLoader.apply(base, stream(""))).isSameAs(base);
        assertThatThrownBy(() -> RankingConfigLoader.apply(base, stream("ranking: 5\n")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ByteArrayInputStream stream(final String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
