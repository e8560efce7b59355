package com.newsrelay.service;

import com.newsrelay.collectors.api.CollectorContext;
import com.newsrelay.collectors.fetch.Backoff;
import com.newsrelay.collectors.fetch.FetchChain;
import com.newsrelay.collectors.fetch.FetchStrategies;
import com.newsrelay.collectors.fetch.RotatingHttpSession;
import com.newsrelay.collectors.filter.ArticleFilter;
import com.newsrelay.collectors.source.SourceCollector;
import com.newsrelay.core.bus.EventBus;
import com.newsrelay.core.model.SourceGroupConfig;
import com.newsrelay.core.util.Sleeper;
import com.newsrelay.service.config.ConfigException;
import com.newsrelay.service.config.ConfigLoader;
import com.newsrelay.service.config.DeliverySettings;
import com.newsrelay.service.config.FetchSettings;
import com.newsrelay.service.config.RelayConfig;
import com.newsrelay.service.config.TranslatorSettings;
import com.newsrelay.service.delivery.CircuitBreaker;
import com.newsrelay.service.delivery.DeliveryException;
import com.newsrelay.service.delivery.DeliveryThrottle;
import com.newsrelay.service.delivery.DeliveryWorker;
import com.newsrelay.service.delivery.RetryPolicy;
import com.newsrelay.service.delivery.TelegramDeliveryTarget;
import com.newsrelay.service.format.ChatCompletionTranslator;
import com.newsrelay.service.format.MessageFormatter;
import com.newsrelay.service.format.NoopTranslator;
import com.newsrelay.service.format.Translator;
import com.newsrelay.service.health.HealthServer;
import com.newsrelay.service.health.HealthState;
import com.newsrelay.service.http.HttpClientFactory;
import com.newsrelay.service.runtime.CycleReport;
import com.newsrelay.service.runtime.SchedulerService;
import com.newsrelay.service.runtime.SourceGroupPoller;
import com.newsrelay.service.store.JsonFileDedupStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 2;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        installLogging();
        int code = run(args, System.getenv());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, Map<String, String> env) throws InterruptedException {
        CliOptions options;
        RelayConfig config;
        HttpClient httpClient;
        try {
            options = CliOptions.parse(args);
            config = ConfigLoader.load(options.configDir(), env);
            httpClient = HttpClientFactory.create(config.fetch().requestTimeout(), env);
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        Clock clock = Clock.systemUTC();
        Sleeper sleeper = Sleeper.system();
        EventBus eventBus = new EventBus();
        HealthState healthState = new HealthState(
                eventBus, clock, config.health().unhealthyThreshold(), config.health().staleAfter());

        JsonFileDedupStore store = new JsonFileDedupStore(config.store().path(), config.store().maxRecords(), clock);
        LOGGER.info("Dedup store loaded with " + store.size() + " record(s) from " + config.store().path());

        CollectorContext context = collectorContext(config.fetch(), httpClient, sleeper, eventBus, clock);

        DeliverySettings delivery = config.delivery();
        TelegramDeliveryTarget target = new TelegramDeliveryTarget(
                httpClient, delivery.apiBaseUrl(), delivery.botToken(), delivery.requestTimeout());
        DeliveryWorker worker = new DeliveryWorker(
                target,
                new CircuitBreaker(target.name(), delivery.failureThreshold(), delivery.coolDown(), clock, eventBus),
                new RetryPolicy(delivery.maxRetries(), delivery.baseDelay(), delivery.backoffFactor()),
                new DeliveryThrottle(delivery.minDeliveryInterval(), clock, sleeper),
                sleeper,
                eventBus,
                clock
        );
        MessageFormatter formatter = new MessageFormatter(translator(config.translator(), httpClient));
        ArticleFilter filter = new ArticleFilter(config.taxonomy());
        SourceCollector collector = new SourceCollector();

        List<SourceGroupPoller> pollers = new ArrayList<>();
        for (SourceGroupConfig group : config.groups()) {
            pollers.add(new SourceGroupPoller(
                    group, collector, context, filter, store, formatter, worker, delivery.channelId()));
        }
        SchedulerService scheduler = new SchedulerService(
                pollers, store, eventBus, clock, config.runtime().shutdownGrace());

        HealthServer healthServer = null;
        if (config.health().port() > 0) {
            healthServer = new HealthServer(config.health().port(), healthState, () -> metrics(store, worker));
            healthServer.start();
        }

        if (options.once()) {
            List<CycleReport> reports = scheduler.runOnce();
            reports.forEach(report -> LOGGER.info("Cycle report: " + report));
            scheduler.shutdown();
            if (healthServer != null) {
                healthServer.stop();
            }
            return EXIT_OK;
        }

        if (delivery.announceStartup()) {
            announce(target, delivery.channelId(), config.groups().size());
        }

        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        HealthServer server = healthServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown requested");
            scheduler.shutdown();
            if (server != null) {
                server.stop();
            }
            shutdownLatch.countDown();
        }, "newsrelay-shutdown"));

        shutdownLatch.await();
        return EXIT_OK;
    }

    static CollectorContext collectorContext(
            FetchSettings fetch,
            HttpClient httpClient,
            Sleeper sleeper,
            EventBus eventBus,
            Clock clock
    ) {
        Duration connectTimeout = fetch.requestTimeout();
        RotatingHttpSession session = new RotatingHttpSession(
                () -> HttpClientFactory.create(connectTimeout), fetch.requestsPerSession());
        FetchChain chain = new FetchChain(
                session, sleeper, new Backoff(fetch.backoffBase(), fetch.backoffCap()), fetch.minPayloadBytes());
        return new CollectorContext(chain, new FetchStrategies(fetch.requestTimeout()), eventBus, clock);
    }

    static Translator translator(TranslatorSettings settings, HttpClient httpClient) {
        if (!settings.enabled()) {
            return new NoopTranslator();
        }
        return new ChatCompletionTranslator(
                httpClient,
                settings.endpoint(),
                settings.apiKey(),
                settings.model(),
                settings.targetLanguage(),
                settings.timeout()
        );
    }

    private static Map<String, Object> metrics(JsonFileDedupStore store, DeliveryWorker worker) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("storeSize", store.size());
        metrics.put("storeMaxSize", store.maxSize());
        CircuitBreaker.Snapshot breaker = worker.breaker().snapshot();
        metrics.put("circuitState", breaker.state().name());
        metrics.put("circuitFailureCount", breaker.failureCount());
        return metrics;
    }

    private static void announce(TelegramDeliveryTarget target, String channelId, int groups) {
        try {
            target.announce(channelId, "News relay started, watching " + groups + " source group(s).");
        } catch (DeliveryException e) {
            LOGGER.warning("Startup announcement failed (" + e.kind() + "): " + e.getMessage());
        }
    }

    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in == null) {
                return;
            }
            Files.createDirectories(Path.of("logs"));
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Could not configure logging: " + e.getMessage());
        }
    }

    record CliOptions(boolean once, Path configDir) {
        static CliOptions parse(String[] args) {
            boolean once = false;
            Path configDir = Path.of("config");
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--once".equals(arg)) {
                    once = true;
                } else if ("--config-dir".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new ConfigException("--config-dir requires a path");
                    }
                    configDir = Path.of(args[++i]);
                } else if (arg.startsWith("--config-dir=")) {
                    configDir = Path.of(arg.substring("--config-dir=".length()));
                } else {
                    throw new ConfigException("Unknown argument: " + arg + " (usage: [--once] [--config-dir <dir>])");
                }
            }
            return new CliOptions(once, configDir);
        }
    }
}
