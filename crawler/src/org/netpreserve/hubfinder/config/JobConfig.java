package org.netpreserve.hubfinder.config;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Root configuration for a hub discovery job.
 *
 * @param domains    which sites to discover hubs on
 * @param crawl      how to fetch (workers, politeness, retries, limits)
 * @param planner    how to choose what to fetch next
 * @param validation how to judge fetched pages
 * @param storage    where to keep hub records and learned patterns
 * @param gazetteer  path of a gazetteer YAML file, or null for the bundled one
 */
public record JobConfig(
        List<DomainConfig> domains,
        CrawlConfig crawl,
        PlannerConfig planner,
        ValidationConfig validation,
        StorageConfig storage,
        @Nullable String gazetteer
) {
    public JobConfig {
        domains = domains == null ? List.of() : List.copyOf(domains);
    }

    public JobConfig withDomains(List<DomainConfig> domains) {
        return new JobConfig(domains, crawl, planner, validation, storage, gazetteer);
    }

    public JobConfig withCrawl(CrawlConfig crawl) {
        return new JobConfig(domains, crawl, planner, validation, storage, gazetteer);
    }

    public JobConfig withPlanner(PlannerConfig planner) {
        return new JobConfig(domains, crawl, planner, validation, storage, gazetteer);
    }

    public JobConfig withValidation(ValidationConfig validation) {
        return new JobConfig(domains, crawl, planner, validation, storage, gazetteer);
    }
}
