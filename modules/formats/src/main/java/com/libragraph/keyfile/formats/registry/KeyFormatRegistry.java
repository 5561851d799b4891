package com.libragraph.keyfile.formats.registry;

import com.libragraph.keyfile.formats.api.KeyFormatParser;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Holds all {@link KeyFormatParser}s in the order they must be tried:
 * highest priority first. Parser beans are discovered via CDI.
 */
@ApplicationScoped
public class KeyFormatRegistry {

    private static final Logger log = Logger.getLogger(KeyFormatRegistry.class);

    @Inject
    Instance<KeyFormatParser> parsers;

    private List<KeyFormatParser> ordered = List.of();

    @PostConstruct
    void init() {
        register(parsers);
        log.infof("KeyFormatRegistry initialized with %d parsers", ordered.size());
    }

    void register(Iterable<KeyFormatParser> candidates) {
        ordered = StreamSupport.stream(candidates.spliterator(), false)
                .sorted(Comparator.comparingInt(KeyFormatParser::priority).reversed())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Parsers in resolution order.
     */
    public List<KeyFormatParser> orderedParsers() {
        return ordered;
    }
}
