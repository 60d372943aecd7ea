package de.mirkosertic.profileranker.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads the base {@link RankingConfig} from YAML files.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. File named by the {@code PROFILERANKER_CONFIG} environment variable
 * 2. File named by the {@code profileranker.config} system property
 * 3. User config file (~/.profileranker/ranking.yaml)
 * 4. Application defaults (ranking.yaml in classpath)
 * 5. Built-in defaults of {@link RankingParameter}
 * <p>
 * Every layer is a partial override merged onto the previous one. All values live below a
 * top-level {@code ranking} key. A layer that cannot be read is logged and skipped; a layer with
 * invalid values fails the load, since ranking with a half-applied configuration is worse than
 * not ranking at all.
 */
public class RankingConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(RankingConfigLoader.class);

    static final String ENV_CONFIG_FILE = "PROFILERANKER_CONFIG";
    static final String PROP_CONFIG_FILE = "profileranker.config";
    private static final String CONFIG_DIR = ".profileranker";
    private static final String USER_CONFIG_FILE = "ranking.yaml";
    private static final String DEFAULT_CONFIG_FILE = "ranking.yaml";
    private static final String ROOT_KEY = "ranking";

    private final String classpathResource;
    private final Path userConfigPath;

    public RankingConfigLoader() {
        this(DEFAULT_CONFIG_FILE, getUserConfigPath());
    }

    RankingConfigLoader(final String classpathResource, final Path userConfigPath) {
        this.classpathResource = classpathResource;
        this.userConfigPath = userConfigPath;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public RankingConfig load() {
        RankingConfig config = RankingConfig.defaults();

        // Step 1: Application defaults from classpath
        config = loadFromClasspath(config);

        // Step 2: User config file
        config = loadFromFile(config, userConfigPath);

        // Step 3: Explicit config file from system property, then environment (highest priority)
        final String propFile = System.getProperty(PROP_CONFIG_FILE);
        if (propFile != null && !propFile.isBlank()) {
            config = loadFromFile(config, Paths.get(propFile.trim()));
        }
        final String envFile = System.getenv(ENV_CONFIG_FILE);
        if (envFile != null && !envFile.isBlank()) {
            config = loadFromFile(config, Paths.get(envFile.trim()));
        }

        logger.info("Ranking configuration loaded: stageATopN={}, k1={}, b={}, twoQuery={}",
                config.intValue(RankingParameter.STAGE_A_TOP_N),
                config.value(RankingParameter.K1),
                config.value(RankingParameter.B),
                config.flag(RankingParameter.STAGE_A_TWO_QUERY));

        return config;
    }

    private RankingConfig loadFromClasspath(final RankingConfig base) {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                final RankingConfig result = apply(base, is);
                logger.debug("Loaded ranking defaults from classpath: {}", classpathResource);
                return result;
            }
        } catch (final IOException e) {
            logger.warn("Failed to load ranking defaults from classpath", e);
        }
        return base;
    }

    private RankingConfig loadFromFile(final RankingConfig base, final Path path) {
        if (!Files.exists(path)) {
            return base;
        }
        try (final InputStream is = Files.newInputStream(path)) {
            final RankingConfig result = apply(base, is);
            logger.debug("Loaded ranking config from: {}", path);
            return result;
        } catch (final IOException e) {
            logger.warn("Failed to load ranking config from: {}", path, e);
            return base;
        }
    }

    static RankingConfig apply(final RankingConfig base, final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> document = yaml.load(is);
        final Map<String, Object> ranking = extractRankingSection(document);
        return ranking == null ? base : base.withOverrides(ranking);
    }

    @SuppressWarnings("unchecked")
    private static @Nullable Map<String, Object> extractRankingSection(@Nullable final Map<String, Object> document) {
        if (document == null) {
            return null;
        }
        final Object section = document.get(ROOT_KEY);
        if (section == null) {
            return null;
        }
        if (!(section instanceof Map)) {
            throw new IllegalArgumentException("'" + ROOT_KEY + "' must be a map of ranking parameters");
        }
        return (Map<String, Object>) section;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }
}
