package com.newsrelay.service.config;

import com.newsrelay.core.model.SourceConfig;
import com.newsrelay.core.model.SourceGroupConfig;
import com.newsrelay.core.model.SourceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private static final Map<String, String> CREDENTIALS = Map.of("BOT_TOKEN", "123:abc", "CHANNEL_ID", "@news");

    @TempDir
    Path dir;

    @Test
    void loadsGroupsDeliverySettingsAndKeywords() throws Exception {
        writeSources("""
                {
                  "groups": [
                    {
                      "name": "crypto",
                      "interval": "PT2M",
                      "maxArticlesPerCycle": 4,
                      "sources": [
                        {"sourceName": "feed-a", "kind": "RSS", "endpoints": ["https://a.example.com/rss"],
                         "enforceFreshness": true, "toleranceWindow": "PT1H",
                         "sectionTolerance": {"economic": "PT6H"}},
                        {"sourceName": "page-b", "kind": "HTML", "endpoints": ["https://b.example.com/news"],
                         "section": "AUTO"}
                      ]
                    }
                  ]
                }
                """);
        Files.writeString(dir.resolve("delivery.json"), """
                {
                  "delivery": {"maxRetries": 4, "minDeliveryInterval": "PT2S"},
                  "store": {"file": "state/seen.json", "maxRecords": 100},
                  "health": {"port": 8099}
                }
                """);
        Files.writeString(dir.resolve("keywords.json"), """
                {"categories": [{"name": "gold", "weight": 3, "keywords": ["Gold", "Bullion"]}]}
                """);

        RelayConfig config = ConfigLoader.load(dir, CREDENTIALS);

        assertEquals(1, config.groups().size());
        SourceGroupConfig group = config.groups().get(0);
        assertEquals(Duration.ofMinutes(2), group.interval());
        assertEquals(4, group.maxArticlesPerCycle());
        assertTrue(group.enabled());

        SourceConfig feed = group.sources().get(0);
        assertEquals(SourceKind.RSS, feed.kind());
        assertEquals(Duration.ofHours(1), feed.freshnessPolicy().toleranceWindow());
        assertEquals(Duration.ofHours(6), feed.freshnessPolicy().toleranceFor("ECONOMIC-INDICATORS"));
        assertTrue(group.sources().get(1).autoSection());

        assertEquals(4, config.delivery().maxRetries());
        assertEquals(Duration.ofSeconds(2), config.delivery().minDeliveryInterval());
        assertEquals(Duration.ofSeconds(60), config.delivery().coolDown());
        assertEquals("123:abc", config.delivery().botToken());
        assertEquals("@news", config.delivery().channelId());
        assertEquals(Path.of("state/seen.json"), config.store().path());
        assertEquals(100, config.store().maxRecords());
        assertEquals(8099, config.health().port());
        assertEquals(1, config.taxonomy().categories().size());
        assertEquals("gold", config.taxonomy().categories().get(0).keywords().get(0));
    }

    @Test
    void fallsBackToDefaultsWhenOptionalFilesAreMissing() throws Exception {
        writeMinimalSources();

        RelayConfig config = ConfigLoader.load(dir, CREDENTIALS);

        assertEquals(2, config.delivery().maxRetries());
        assertEquals(3000, config.store().maxRecords());
        assertEquals(0, config.health().port());
        assertFalse(config.translator().enabled());
        assertFalse(config.taxonomy().isEmpty());
    }

    @Test
    void missingCredentialsFailBeforeAnythingElse() throws Exception {
        writeMinimalSources();

        ConfigException noToken = assertThrows(ConfigException.class,
                () -> ConfigLoader.load(dir, Map.of("CHANNEL_ID", "@news")));
        assertTrue(noToken.getMessage().contains("BOT_TOKEN"));

        ConfigException noChannel = assertThrows(ConfigException.class,
                () -> ConfigLoader.load(dir, Map.of("BOT_TOKEN", "123:abc", "CHANNEL_ID", " ")));
        assertTrue(noChannel.getMessage().contains("CHANNEL_ID"));
    }

    @Test
    void rejectsInvalidSourceDeclarations() throws Exception {
        writeSources("""
                {"groups": [{"name": "g", "sources": [
                  {"sourceName": "bad", "kind": "RSS", "endpoints": ["ftp://example.com/feed"]}
                ]}]}
                """);
        ConfigException nonHttp = assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
        assertTrue(nonHttp.getMessage().contains("non-HTTP endpoint"));

        writeSources("""
                {"groups": [{"name": "g", "sources": [
                  {"sourceName": "same", "kind": "RSS", "endpoints": ["https://a.example.com/rss"]},
                  {"sourceName": "same", "kind": "HTML", "endpoints": ["https://b.example.com/"]}
                ]}]}
                """);
        ConfigException duplicate = assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
        assertTrue(duplicate.getMessage().contains("Duplicate source name"));

        writeSources("""
                {"groups": [{"name": "g", "sources": [
                  {"sourceName": "kindless", "endpoints": ["https://a.example.com/rss"]}
                ]}]}
                """);
        assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));

        writeSources("""
                {"groups": [{"name": "g", "sources": [
                  {"sourceName": "past", "kind": "RSS", "endpoints": ["https://a.example.com/rss"],
                   "toleranceWindow": "-PT1H"}
                ]}]}
                """);
        ConfigException window = assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
        assertTrue(window.getMessage().contains("negative toleranceWindow"));

        writeSources("""
                {"groups": [{"name": "g", "sources": [
                  {"sourceName": "skewed", "kind": "RSS", "endpoints": ["https://a.example.com/rss"],
                   "futureSkew": "-PT5M"}
                ]}]}
                """);
        ConfigException skew = assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
        assertTrue(skew.getMessage().contains("negative futureSkew"));

        writeSources("{\"groups\": []}");
        assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
    }

    @Test
    void missingOrMalformedSourcesFileNamesThePath() throws Exception {
        ConfigException missing = assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
        assertTrue(missing.getMessage().contains("sources.json"));

        writeSources("{not-json");
        ConfigException malformed = assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
        assertTrue(malformed.getMessage().contains("sources.json"));
    }

    @Test
    void environmentOverridesStoreHealthAndTranslator() throws Exception {
        writeMinimalSources();
        Files.writeString(dir.resolve("delivery.json"), """
                {"translator": {"enabled": true}}
                """);

        ConfigException noKey = assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, CREDENTIALS));
        assertTrue(noKey.getMessage().contains("TRANSLATOR_API_KEY"));

        RelayConfig config = ConfigLoader.load(dir, Map.of(
                "BOT_TOKEN", "123:abc",
                "CHANNEL_ID", "@news",
                "DEDUP_FILE", "/var/lib/relay/seen.json",
                "HEALTH_PORT", "9191",
                "TRANSLATOR_API_KEY", "secret",
                "TRANSLATOR_MODEL", "small-model"
        ));
        assertEquals(Path.of("/var/lib/relay/seen.json"), config.store().path());
        assertEquals(9191, config.health().port());
        assertEquals("secret", config.translator().apiKey());
        assertEquals("small-model", config.translator().model());
        assertEquals("Arabic", config.translator().targetLanguage());

        assertThrows(ConfigException.class, () -> ConfigLoader.load(dir, Map.of(
                "BOT_TOKEN", "123:abc", "CHANNEL_ID", "@news", "TRANSLATOR_API_KEY", "k", "HEALTH_PORT", "http")));
    }

    private void writeMinimalSources() throws Exception {
        writeSources("""
                {"groups": [{"name": "g", "sources": [
                  {"sourceName": "feed", "kind": "RSS", "endpoints": ["https://a.example.com/rss"]}
                ]}]}
                """);
    }

    private void writeSources(String json) throws Exception {
        Files.writeString(dir.resolve("sources.json"), json);
    }
}
