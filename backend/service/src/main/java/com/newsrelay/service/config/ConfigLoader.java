package com.newsrelay.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.newsrelay.collectors.filter.KeywordTaxonomy;
import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceGroupConfig;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads {@code sources.json}, {@code delivery.json} and {@code keywords.json} from a
 * config directory and applies environment overrides. Every problem surfaces as a
 * {@link ConfigException}.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    public static final String SOURCES_FILE = "sources.json";
    public static final String DELIVERY_FILE = "delivery.json";
    public static final String KEYWORDS_FILE = "keywords.json";

    private ConfigLoader() {
    }

    public static RelayConfig load(Path configDir, Map<String, String> env) {
        List<SourceGroupConfig> groups = loadGroups(configDir);
        ServiceFile service = loadService(configDir);
        KeywordTaxonomy taxonomy = loadTaxonomy(configDir);

        String token = env.get("BOT_TOKEN");
        String channel = env.get("CHANNEL_ID");
        if (token == null || token.isBlank()) {
            throw new ConfigException("BOT_TOKEN environment variable is required");
        }
        if (channel == null || channel.isBlank()) {
            throw new ConfigException("CHANNEL_ID environment variable is required");
        }

        StoreSettings store = service.store();
        if (env.containsKey("DEDUP_FILE") && !env.get("DEDUP_FILE").isBlank()) {
            store = store.withFile(env.get("DEDUP_FILE"));
        }
        HealthSettings health = service.health();
        if (env.containsKey("HEALTH_PORT")) {
            health = health.withPort(parsePort(env.get("HEALTH_PORT")));
        }
        TranslatorSettings translator = service.translator().withOverrides(
                blankToNull(env.get("TRANSLATOR_ENDPOINT")),
                blankToNull(env.get("TRANSLATOR_API_KEY")),
                blankToNull(env.get("TRANSLATOR_MODEL"))
        );
        if (translator.enabled() && (translator.apiKey() == null || translator.apiKey().isBlank())) {
            throw new ConfigException("Translation is enabled but TRANSLATOR_API_KEY is not set");
        }

        return new RelayConfig(
                groups,
                taxonomy,
                service.delivery().withCredentials(token, channel),
                service.fetch(),
                store,
                translator,
                health,
                service.runtime()
        );
    }

    public static List<SourceGroupConfig> loadGroups(Path configDir) {
        Path path = configDir.resolve(SOURCES_FILE);
        if (!Files.exists(path)) {
            throw new ConfigException("Missing source configuration " + path);
        }
        SourcesFile file = read(path, new TypeReference<>() {
        });
        if (file == null || file.groups() == null || file.groups().isEmpty()) {
            throw new ConfigException(path + " declares no source groups");
        }
        validateGroups(file.groups());
        return file.groups();
    }

    static void validateGroups(List<SourceGroupConfig> groups) {
        Set<String> groupNames = new HashSet<>();
        Set<String> sourceNames = new HashSet<>();
        for (SourceGroupConfig group : groups) {
            if (group.name() == null || group.name().isBlank()) {
                throw new ConfigException("Every source group needs a name");
            }
            if (!groupNames.add(group.name())) {
                throw new ConfigException("Duplicate source group name: " + group.name());
            }
            if (group.interval().isNegative() || group.interval().isZero()) {
                throw new ConfigException("Group " + group.name() + " must have a positive interval");
            }
            if (group.sources().isEmpty()) {
                throw new ConfigException("Group " + group.name() + " has no sources");
            }
            for (SourceConfig source : group.sources()) {
                validateSource(group.name(), source);
                if (!sourceNames.add(source.sourceName())) {
                    throw new ConfigException("Duplicate source name: " + source.sourceName());
                }
            }
        }
    }

    private static void validateSource(String groupName, SourceConfig source) {
        String label = "Source '" + source.sourceName() + "' in group " + groupName;
        if (source.sourceName() == null || source.sourceName().isBlank()) {
            throw new ConfigException("A source in group " + groupName + " has no sourceName");
        }
        if (source.kind() == null) {
            throw new ConfigException(label + " has no kind (RSS or HTML)");
        }
        if (source.endpoints().isEmpty()) {
            throw new ConfigException(label + " has no endpoints");
        }
        for (String endpoint : source.endpoints()) {
            requireHttpUrl(label, endpoint);
        }
        if (source.alternateEndpoint() != null) {
            requireHttpUrl(label, source.alternateEndpoint());
        }
        if (source.toleranceWindow() != null && source.toleranceWindow().isNegative()) {
            throw new ConfigException(label + " has a negative toleranceWindow");
        }
        if (source.futureSkew() != null && source.futureSkew().isNegative()) {
            throw new ConfigException(label + " has a negative futureSkew");
        }
        for (Map.Entry<String, Duration> tolerance : source.sectionTolerance().entrySet()) {
            if (tolerance.getValue() == null || tolerance.getValue().isNegative()) {
                throw new ConfigException(label + " has an invalid tolerance for section " + tolerance.getKey());
            }
        }
    }

    private static void requireHttpUrl(String label, String value) {
        try {
            URI uri = URI.create(value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
                throw new ConfigException(label + " has a non-HTTP endpoint: " + value);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigException(label + " has a malformed endpoint: " + value, e);
        }
    }

    static ServiceFile loadService(Path configDir) {
        Path path = configDir.resolve(DELIVERY_FILE);
        if (!Files.exists(path)) {
            LOGGER.info("No " + DELIVERY_FILE + " found; using delivery defaults");
            return new ServiceFile(null, null, null, null, null, null);
        }
        ServiceFile file = read(path, new TypeReference<>() {
        });
        return file == null ? new ServiceFile(null, null, null, null, null, null) : file;
    }

    static KeywordTaxonomy loadTaxonomy(Path configDir) {
        Path path = configDir.resolve(KEYWORDS_FILE);
        if (!Files.exists(path)) {
            LOGGER.info("No " + KEYWORDS_FILE + " found; using the built-in financial keyword taxonomy");
            return KeywordTaxonomy.financialDefaults();
        }
        KeywordTaxonomy taxonomy = read(path, new TypeReference<>() {
        });
        return taxonomy == null ? KeywordTaxonomy.empty() : taxonomy;
    }

    private static int parsePort(String raw) {
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 0 || port > 65535) {
                throw new ConfigException("HEALTH_PORT out of range: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ConfigException("HEALTH_PORT is not a number: " + raw, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new ConfigException("Failed loading config from " + path + ": " + e.getMessage(), e);
        }
    }

    public record SourcesFile(List<SourceGroupConfig> groups) {
    }

    public record ServiceFile(
            DeliverySettings delivery,
            FetchSettings fetch,
            StoreSettings store,
            TranslatorSettings translator,
            HealthSettings health,
            RuntimeSettings runtime
    ) {
        public ServiceFile {
            delivery = delivery == null ? DeliverySettings.defaults() : delivery;
            fetch = fetch == null ? FetchSettings.defaults() : fetch;
            store = store == null ? StoreSettings.defaults() : store;
            translator = translator == null ? TranslatorSettings.defaults() : translator;
            health = health == null ? HealthSettings.defaults() : health;
            runtime = runtime == null ? RuntimeSettings.defaults() : runtime;
        }
    }
}
