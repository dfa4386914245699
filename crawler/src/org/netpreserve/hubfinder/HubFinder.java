package org.netpreserve.hubfinder;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.netpreserve.hubfinder.config.ConfigLoader;
import org.netpreserve.hubfinder.config.DomainConfig;
import org.netpreserve.hubfinder.config.JobConfig;
import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class HubFinder {
    private static final Logger log = LoggerFactory.getLogger(HubFinder.class);

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of("data");
        var domains = new ArrayList<DomainConfig>();
        CrawlMode mode = null;
        boolean dumpConfig = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--job-dir", "-j" -> jobDir = Path.of(args[++i]);
                case "--mode", "-m" -> mode = CrawlMode.fromString(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: hubfinder [options] [URL...]");
                    System.out.println("Options:");
                    System.out.println("  -h, --help");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("  -j, --job-dir DIR        Directory for job data and config.yaml");
                    System.out.println("  -m, --mode MODE          normal or exclusive-hub-focus");
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    Url url = new Url(args[i]);
                    if (!url.isValid() || !url.isHttp()) {
                        System.err.println("Not an http(s) URL: " + args[i]);
                        System.exit(1);
                    }
                    domains.add(new DomainConfig(url));
                }
            }
        }

        JobConfig config = ConfigLoader.load(jobDir.resolve("config.yaml"));
        if (!domains.isEmpty()) config = config.withDomains(domains);
        if (mode != null) config = config.withPlanner(config.planner().withMode(mode));
        if (dumpConfig) {
            ObjectMapper mapper = ConfigLoader.mapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }
        if (config.domains().isEmpty()) {
            System.err.println("No domains given on the command line or in " + jobDir.resolve("config.yaml"));
            System.exit(1);
        }

        Job job = Job.open(jobDir, config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                job.close();
            } catch (Exception e) {
                System.err.println("Error shutting down job: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook"));

        try {
            job.start();
        } catch (FatalCrawlException e) {
            log.error("Job failed to start: {}", e.getMessage());
            System.exit(2);
        }
        RunReport report = null;
        while (report == null) {
            report = job.awaitStop(Duration.ofMinutes(1));
            if (report == null) {
                Progress progress = job.progress();
                log.info("Progress: {} confirmed, {} rejected, {} articles, {} fetches", progress.confirmed(),
                        progress.rejected(), progress.articles(), progress.fetches());
            }
        }
        List<String> covered = new ArrayList<>();
        for (DomainConfig domain : config.domains()) {
            covered.add(domain.host() + "=" + job.coverage(domain.host()).size());
        }
        log.info("Run {} finished {}: hubs per domain {}, {} gaps remaining", report.runId(), report.status(),
                covered, report.remainingGaps());
        System.exit(report.status() == RunReport.Status.FAILED ? 2 : 0);
    }
}
