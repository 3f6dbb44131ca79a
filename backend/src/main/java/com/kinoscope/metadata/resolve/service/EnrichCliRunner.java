package com.kinoscope.metadata.resolve.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class EnrichCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(EnrichCliRunner.class);

    private final ResolverProperties properties;
    private final MovieEnrichmentService enrichmentService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public EnrichCliRunner(
        ResolverProperties properties,
        MovieEnrichmentService enrichmentService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.enrichmentService = enrichmentService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ResolverProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }
        if (cli.getSeedFile() == null || cli.getSeedFile().isBlank()) {
            throw new IllegalArgumentException("resolver.cli.seed-file is required when resolver.cli.run=true");
        }

        SeedRecord seed = readSeed(Path.of(cli.getSeedFile()));
        Document sourceDocument = readSourceDocument(cli.getSourceHtmlFile());
        MergedMovie merged = enrichmentService.enrich(new EnrichmentRequest(seed, sourceDocument, null));
        log.info("Enriched '{}': imdb={} rating={} tmdb={}", merged.title(), merged.imdbId(), merged.imdbRating(), merged.tmdbId());
        try {
            log.info("Merged record:\n{}", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(merged));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize merged record for '{}'", merged.title(), e);
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    SeedRecord readSeed(Path seedFile) {
        try {
            return objectMapper.readValue(seedFile.toFile(), SeedRecord.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed file " + seedFile, e);
        }
    }

    Document readSourceDocument(String sourceHtmlFile) {
        if (sourceHtmlFile == null || sourceHtmlFile.isBlank()) {
            return null;
        }
        try {
            return Jsoup.parse(Files.readString(Path.of(sourceHtmlFile), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read source HTML " + sourceHtmlFile, e);
        }
    }
}
