package com.chronofill.backend.service.plan;

import com.chronofill.backend.model.SourceSystem;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.chronofill.backend.service.plan.Materialization.INCREMENTAL;
import static com.chronofill.backend.service.plan.Materialization.TABLE;
import static com.chronofill.backend.service.plan.Materialization.VIEW;
import static com.chronofill.backend.service.plan.ModelLayer.ATTRIBUTION;
import static com.chronofill.backend.service.plan.ModelLayer.CANONICAL;
import static com.chronofill.backend.service.plan.ModelLayer.MARTS;
import static com.chronofill.backend.service.plan.ModelLayer.METRICS;
import static com.chronofill.backend.service.plan.ModelLayer.SEMANTIC;
import static com.chronofill.backend.service.plan.ModelLayer.STAGING;

/**
 * Static dependency graph of the downstream transformation models, keyed by model name.
 */
@Component
public class ModelRegistry {

    private static final long DEFAULT_ROWS_PER_DAY = 200;

    private final Map<String, TransformModel> models = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private final Map<SourceSystem, List<String>> stagingBySource = new EnumMap<>(SourceSystem.class);
    private final Map<SourceSystem, List<String>> ingestionTablesBySource = new EnumMap<>(SourceSystem.class);
    private final Map<SourceSystem, Long> rowsPerDay = new EnumMap<>(SourceSystem.class);

    public ModelRegistry() {
        registerModels();
        registerSources();
        for (TransformModel model : models.values()) {
            for (String dependency : model.dependsOn()) {
                dependents.computeIfAbsent(dependency, key -> new TreeSet<>()).add(model.name());
            }
        }
    }

    public Optional<TransformModel> find(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public int size() {
        return models.size();
    }

    public Set<String> dependentsOf(String name) {
        return dependents.getOrDefault(name, Collections.emptySet());
    }

    public List<String> stagingModelsFor(SourceSystem source) {
        return stagingBySource.getOrDefault(source, List.of());
    }

    public List<String> ingestionTablesFor(SourceSystem source) {
        return ingestionTablesBySource.getOrDefault(source, List.of());
    }

    public long rowsPerDay(SourceSystem source) {
        return rowsPerDay.getOrDefault(source, DEFAULT_ROWS_PER_DAY);
    }

    private void registerModels() {
        add(TransformModel.of("stg_shopify_orders", STAGING, VIEW));
        add(TransformModel.of("stg_shopify_customers", STAGING, VIEW));
        add(TransformModel.of("stg_facebook_ads_performance", STAGING, VIEW));
        add(TransformModel.of("stg_google_ads_performance", STAGING, VIEW));
        add(TransformModel.of("stg_tiktok_ads_performance", STAGING, VIEW));
        add(TransformModel.of("stg_snapchat_ads", STAGING, VIEW));
        add(TransformModel.of("stg_klaviyo_events", STAGING, VIEW));
        add(TransformModel.of("stg_email_campaigns", STAGING, VIEW, "stg_klaviyo_events"));
        add(TransformModel.of("dim_ad_accounts", STAGING, TABLE,
                "stg_facebook_ads_performance", "stg_google_ads_performance").tagged("dimension"));
        add(TransformModel.of("dim_campaigns", STAGING, TABLE,
                "stg_facebook_ads_performance", "stg_google_ads_performance").tagged("dimension"));

        add(TransformModel.of("orders", CANONICAL, INCREMENTAL, "stg_shopify_orders"));
        add(TransformModel.of("fact_orders_v1", CANONICAL, INCREMENTAL, "stg_shopify_orders").tagged("versioned"));
        add(TransformModel.of("marketing_spend", CANONICAL, INCREMENTAL,
                "stg_facebook_ads_performance", "stg_google_ads_performance",
                "stg_tiktok_ads_performance", "stg_snapchat_ads"));
        add(TransformModel.of("fact_marketing_spend_v1", CANONICAL, INCREMENTAL,
                "stg_facebook_ads_performance", "stg_google_ads_performance",
                "stg_tiktok_ads_performance", "stg_snapchat_ads").tagged("versioned"));
        add(TransformModel.of("campaign_performance", CANONICAL, INCREMENTAL,
                "stg_facebook_ads_performance", "stg_google_ads_performance"));
        add(TransformModel.of("fact_campaign_performance_v1", CANONICAL, INCREMENTAL,
                "stg_facebook_ads_performance", "stg_google_ads_performance").tagged("versioned"));

        add(TransformModel.of("last_click", ATTRIBUTION, VIEW, "orders", "campaign_performance"));

        add(TransformModel.of("sem_orders_v1", SEMANTIC, VIEW, "orders").tagged("semantic", "immutable"));
        add(TransformModel.of("sem_marketing_spend_v1", SEMANTIC, VIEW, "marketing_spend")
                .tagged("semantic", "immutable"));
        add(TransformModel.of("sem_campaign_performance_v1", SEMANTIC, VIEW, "campaign_performance")
                .tagged("semantic", "immutable"));
        add(TransformModel.of("fact_orders_current", SEMANTIC, VIEW, "sem_orders_v1").tagged("semantic", "governed"));
        add(TransformModel.of("fact_marketing_spend_current", SEMANTIC, VIEW, "sem_marketing_spend_v1")
                .tagged("semantic", "governed"));
        add(TransformModel.of("fact_campaign_performance_current", SEMANTIC, VIEW, "sem_campaign_performance_v1")
                .tagged("semantic", "governed"));

        add(TransformModel.of("fct_revenue", METRICS, VIEW, "orders"));
        add(TransformModel.of("fct_roas", METRICS, VIEW, "last_click", "fct_revenue", "marketing_spend"));
        add(TransformModel.of("fct_cac", METRICS, VIEW, "orders", "last_click", "fct_revenue", "marketing_spend"));
        add(TransformModel.of("fct_aov", METRICS, VIEW, "fct_revenue"));
        add(TransformModel.of("fct_marketing_metrics", METRICS, TABLE, "marketing_spend", "orders").tagged("marketing"));
        add(TransformModel.of("metric_roas_v1", METRICS, VIEW, "fct_roas").tagged("immutable"));
        add(TransformModel.of("metric_roas_v2", METRICS, VIEW, "fct_revenue", "marketing_spend").tagged("immutable"));
        add(TransformModel.of("metric_roas_current", METRICS, VIEW, "metric_roas_v1").tagged("governed"));

        add(TransformModel.of("mart_revenue_metrics", MARTS, TABLE, "fct_revenue"));
        add(TransformModel.of("mart_marketing_metrics", MARTS, TABLE, "fct_roas", "fct_cac"));
    }

    private void registerSources() {
        source(SourceSystem.SHOPIFY, 500, List.of("stg_shopify_orders", "stg_shopify_customers"),
                List.of("_airbyte_raw_shopify_orders", "_airbyte_raw_shopify_customers"));
        source(SourceSystem.FACEBOOK, 200, List.of("stg_facebook_ads_performance"), List.of("_airbyte_raw_meta_ads"));
        source(SourceSystem.GOOGLE, 200, List.of("stg_google_ads_performance"), List.of("_airbyte_raw_google_ads"));
        source(SourceSystem.TIKTOK, 100, List.of("stg_tiktok_ads_performance"), List.of("_airbyte_raw_tiktok_ads"));
        source(SourceSystem.SNAPCHAT, 50, List.of("stg_snapchat_ads"), List.of("_airbyte_raw_snapchat_ads"));
        source(SourceSystem.KLAVIYO, 300, List.of("stg_klaviyo_events", "stg_email_campaigns"),
                List.of("_airbyte_raw_klaviyo_events"));
        source(SourceSystem.RECHARGE, 100, List.of(), List.of());
        source(SourceSystem.PINTEREST, 50, List.of(), List.of());
        source(SourceSystem.AMAZON, 100, List.of(), List.of());
        source(SourceSystem.GA4, 1000, List.of(), List.of());
    }

    private void add(TransformModel model) {
        models.put(model.name(), model);
    }

    private void source(SourceSystem source, long estimatedRowsPerDay, List<String> staging, List<String> ingestion) {
        rowsPerDay.put(source, estimatedRowsPerDay);
        stagingBySource.put(source, staging);
        ingestionTablesBySource.put(source, ingestion);
    }
}
