package com.newsrelay.collectors.filter;

import java.util.List;

/**
 * Weighted keyword categories used for relevance scoring. An empty taxonomy accepts
 * every article.
 */
public record KeywordTaxonomy(List<KeywordCategory> categories) {
    public KeywordTaxonomy {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static KeywordTaxonomy empty() {
        return new KeywordTaxonomy(List.of());
    }

    public boolean isEmpty() {
        return categories.stream().allMatch(category -> category.keywords().isEmpty());
    }

    public static KeywordTaxonomy financialDefaults() {
        return new KeywordTaxonomy(List.of(
                new KeywordCategory("crypto", 2, List.of(
                        "bitcoin", "ethereum", "crypto", "cryptocurrency", "blockchain", "defi", "nft",
                        "binance", "coinbase", "solana", "cardano", "dogecoin", "ripple", "xrp", "btc", "eth"
                )),
                new KeywordCategory("markets", 1, List.of(
                        "stock", "share", "market", "trading", "investor", "investment", "portfolio", "dividend",
                        "earnings", "revenue", "profit", "ipo", "merger", "acquisition", "buyback",
                        "fed", "federal reserve", "interest rate", "inflation", "gdp", "unemployment",
                        "consumer price", "cpi", "ppi", "retail sales", "housing", "manufacturing",
                        "dollar", "euro", "yen", "pound", "currency", "forex", "exchange rate",
                        "central bank", "monetary policy",
                        "oil", "crude", "gold", "silver", "copper", "natural gas", "commodity", "opec",
                        "stablecoin", "altcoin", "bank", "economy", "economic", "tariff", "trade"
                ))
        ));
    }
}
