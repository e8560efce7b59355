package com.newsrelay.service.config;

import com.newsrelay.collectors.filter.KeywordTaxonomy;
import com.newsrelay.core.model.SourceGroupConfig;

import java.util.List;
import java.util.Objects;

public record RelayConfig(
        List<SourceGroupConfig> groups,
        KeywordTaxonomy taxonomy,
        DeliverySettings delivery,
        FetchSettings fetch,
        StoreSettings store,
        TranslatorSettings translator,
        HealthSettings health,
        RuntimeSettings runtime
) {
    public RelayConfig {
        groups = List.copyOf(Objects.requireNonNull(groups, "groups are required"));
        taxonomy = taxonomy == null ? KeywordTaxonomy.empty() : taxonomy;
        delivery = delivery == null ? DeliverySettings.defaults() : delivery;
        fetch = fetch == null ? FetchSettings.defaults() : fetch;
        store = store == null ? StoreSettings.defaults() : store;
        translator = translator == null ? TranslatorSettings.defaults() : translator;
        health = health == null ? HealthSettings.defaults() : health;
        runtime = runtime == null ? RuntimeSettings.defaults() : runtime;
    }
}
