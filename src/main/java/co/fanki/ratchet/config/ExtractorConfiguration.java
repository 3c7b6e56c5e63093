package co.fanki.ratchet.config;

import co.fanki.ratchet.autoload.domain.DirectoryScanner;
import co.fanki.ratchet.autoload.domain.Inflector;
import co.fanki.ratchet.autoload.domain.NamespaceIndex;
import co.fanki.ratchet.extraction.application.ProjectScanService;
import co.fanki.ratchet.extraction.application.ReferenceExtractionService;
import co.fanki.ratchet.extraction.domain.ConstantResolver;
import co.fanki.ratchet.extraction.domain.ParserRegistry;
import co.fanki.ratchet.extraction.domain.ReferenceExtractor;
import co.fanki.ratchet.extraction.domain.ruby.ErbSourceParser;
import co.fanki.ratchet.extraction.domain.ruby.RubySourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Wires the extraction pipeline for the configured project.
 *
 * <p>The namespace index is built once at startup; files added to the
 * autoload roots afterwards are not known until a restart.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@EnableConfigurationProperties(RatchetProperties.class)
public class ExtractorConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExtractorConfiguration.class);

    @Bean
    public Inflector inflector(final RatchetProperties properties) {
        return new Inflector(properties.getAcronyms(),
                properties.getInflections());
    }

    @Bean
    public NamespaceIndex namespaceIndex(final RatchetProperties properties,
            final Inflector inflector) {
        LOG.info("Indexing autoload paths of {}", properties.rootPath());
        try {
            return new DirectoryScanner(inflector).scan(
                    properties.rootPath(), properties.autoloadRoots());
        } catch (final IOException e) {
            throw new UncheckedIOException(
                    "Failed to index autoload paths", e);
        }
    }

    @Bean
    public RubySourceParser rubySourceParser() {
        return new RubySourceParser();
    }

    @Bean
    public ParserRegistry parserRegistry(final RubySourceParser ruby) {
        return new ParserRegistry(List.of(ruby, new ErbSourceParser(ruby)));
    }

    @Bean
    public ConstantResolver constantResolver(final NamespaceIndex index,
            final RatchetProperties properties) {
        return new ConstantResolver(index,
                properties.isResolveNestedConstants());
    }

    @Bean
    public ReferenceExtractionService referenceExtractionService(
            final RatchetProperties properties,
            final ParserRegistry parsers,
            final ConstantResolver resolver) {
        return new ReferenceExtractionService(properties.rootPath(), parsers,
                ReferenceExtractor.standard(), resolver);
    }

    @Bean
    public ProjectScanService projectScanService(
            final ReferenceExtractionService extractionService,
            final NamespaceIndex index,
            final ParserRegistry parsers,
            final RatchetProperties properties) {
        return new ProjectScanService(extractionService, index, parsers,
                properties.getScanThreads());
    }

}
