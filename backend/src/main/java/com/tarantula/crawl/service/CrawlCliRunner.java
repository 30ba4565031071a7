package com.tarantula.crawl.service;

import com.tarantula.config.CrawlerProperties;
import com.tarantula.crawl.model.CrawlRunStatusResponse;
import com.tarantula.crawl.model.RunConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlCoordinator crawlCoordinator;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlCoordinator crawlCoordinator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlCoordinator = crawlCoordinator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        CrawlerProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        CrawlerProperties.Defaults defaults = properties.getDefaults();
        RunConfig config = new RunConfig(
            cli.getUrl(),
            defaults.isIgnoreRedirects(),
            defaults.getMaximumRedirects(),
            cli.getMaximumDepth() == null ? defaults.getMaximumDepth() : cli.getMaximumDepth(),
            defaults.isIgnoreRobotsTxt(),
            defaults.isKeepHtmlInMemory(),
            properties.getUserAgent(),
            cli.getCallbackUrl(),
            null
        );

        String runId = crawlCoordinator.startRun(config);
        CrawlRunStatusResponse summary = crawlCoordinator.awaitCompletion(
            runId,
            Duration.ofMinutes(cli.getTimeoutMinutes())
        );
        if (!summary.state().isTerminal()) {
            log.warn("Crawl run {} still {} after {} minutes, cancelling", runId, summary.state(), cli.getTimeoutMinutes());
            summary = crawlCoordinator.cancelRun(runId);
        }
        log.info(
            "Crawl run {} ended with state {}: visited={}, pages={}, failures={}, robotsExcluded={}, linksDiscovered={}",
            summary.runId(),
            summary.state(),
            summary.visited(),
            summary.pagesEmitted(),
            summary.failures(),
            summary.robotsExcluded(),
            summary.linksDiscovered()
        );

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
