package com.raidxp.extractor;

import com.raidxp.api.IEventExtractor;
import com.raidxp.api.model.Event;
import com.raidxp.api.model.EventIdentity;
import com.raidxp.api.model.EventTypes;
import com.raidxp.infra.metrics.Counter;
import com.raidxp.infra.metrics.MetricsRegistry;
import com.raidxp.runtime.model.RuleSet;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/**
 * Turns one raw log line into the gameplay events it describes.
 *
 * <p>Every compiled rule is tried against the line in configuration order. A
 * matching rule yields one or more events depending on its type:
 * <ul>
 * <li>{@code KILL}: a kill for the killer, plus a {@code HEADSHOT} when the line
 * carries a headshot marker.</li>
 * <li>{@code DEATH}: a death for the victim, with the killer as context.</li>
 * <li>{@code SURVIVE}, {@code EXTRACT}: the event itself; an extract also yields a
 * {@code SURVIVE} tagged {@code from=EXTRACT}.</li>
 * <li>{@code DOGTAG}: a pickup credited to the first non-empty of
 * {@code name}, {@code killer}, {@code victim}.</li>
 * <li>anything else: a passthrough event carrying every non-empty capture.</li>
 * </ul>
 * Events that share an {@link EventIdentity} within the line are emitted once.
 * Events without an actor are dropped here so the engine never sees them.
 *
 * <p>Thread-safe; the rule set is immutable.
 */
public final class EventExtractor implements IEventExtractor {
    private static final Logger logger = Logger.getLogger(EventExtractor.class.getName());

    private static final List<String> DOGTAG_ATTRIBUTES = List.of("victim", "level", "side", "weapon", "status");
    private static final String TIMESTAMP_GROUP = "ts";

    private final List<RuleSet.CompiledRule> rules;
    private final HeadshotDetector headshots;
    private final TimestampParser timestamps;
    private final MetricsRegistry metrics;
    private final Counter linesSkipped;

    public EventExtractor(RuleSet ruleSet) {
        this(ruleSet, Clock.systemUTC(), MetricsRegistry.getInstance());
    }

    public EventExtractor(RuleSet ruleSet, Clock clock, MetricsRegistry metrics) {
        this.rules = ruleSet.getRules();
        this.headshots = new HeadshotDetector(ruleSet.getHeadshotKeywords());
        this.timestamps = new TimestampParser(clock);
        this.metrics = metrics;
        this.linesSkipped = metrics.counter("lines_skipped_total");
    }

    @Override
    public List<Event> parse(String line) {
        if (line == null || line.isBlank()) {
            linesSkipped.increment();
            return List.of();
        }

        List<Event> events = new ArrayList<>();
        Set<EventIdentity> seen = new HashSet<>();
        for (RuleSet.CompiledRule rule : rules) {
            try {
                Matcher m = rule.pattern().matcher(line);
                if (!m.find()) {
                    continue;
                }
                for (Event event : derive(rule.eventType(), line, captures(rule, m))) {
                    if (event.actor().isEmpty()) {
                        logger.fine(() -> "Dropping " + event.type() + " without actor: " + line);
                    } else if (seen.add(event.identity())) {
                        events.add(event);
                    }
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Rule " + rule.eventType() + " failed on line: " + line, e);
            }
        }

        if (events.isEmpty()) {
            linesSkipped.increment();
            logger.finest(() -> "No events in line: " + line);
        } else {
            events.forEach(e -> metrics.counter("events_extracted_total", "type", e.type()).increment());
        }
        return Collections.unmodifiableList(events);
    }

    private static Map<String, String> captures(RuleSet.CompiledRule rule, Matcher m) {
        Map<String, String> captures = new LinkedHashMap<>();
        for (String group : rule.groupNames()) {
            String value = m.group(group);
            if (value != null) {
                captures.put(group, value);
            }
        }
        return captures;
    }

    private List<Event> derive(String type, String line, Map<String, String> captures) {
        Instant ts = timestamp(captures.get(TIMESTAMP_GROUP));
        String killer = captures.getOrDefault("killer", "").trim();
        String victim = captures.getOrDefault("victim", "").trim();
        String name = captures.getOrDefault("name", "").trim();

        switch (type) {
            case EventTypes.KILL: {
                Map<String, Object> data = Map.of("victim", victim);
                Event kill = new Event(ts, EventTypes.KILL, killer, data);
                if (headshots.indicates(line, captures)) {
                    return List.of(kill, new Event(ts, EventTypes.HEADSHOT, killer, data));
                }
                return List.of(kill);
            }
            case EventTypes.DEATH:
                return List.of(new Event(ts, EventTypes.DEATH, victim, Map.of("killer", killer)));
            case EventTypes.SURVIVE:
                return List.of(new Event(ts, EventTypes.SURVIVE, name));
            case EventTypes.EXTRACT:
                return List.of(
                        new Event(ts, EventTypes.EXTRACT, name),
                        new Event(ts, EventTypes.SURVIVE, name, Map.of("from", EventTypes.EXTRACT)));
            case EventTypes.DOGTAG: {
                Map<String, Object> data = new LinkedHashMap<>();
                for (String attribute : DOGTAG_ATTRIBUTES) {
                    String value = captures.getOrDefault(attribute, "").trim();
                    if (!value.isEmpty()) {
                        data.put(attribute, value);
                    }
                }
                return List.of(new Event(ts, EventTypes.DOGTAG, firstNonEmpty(name, killer, victim), data));
            }
            default: {
                Map<String, Object> data = new LinkedHashMap<>();
                captures.forEach((group, value) -> {
                    if (!TIMESTAMP_GROUP.equals(group) && !value.isBlank()) {
                        data.put(group, value.trim());
                    }
                });
                return List.of(new Event(ts, type, firstNonEmpty(name, killer, victim), data));
            }
        }
    }

    private Instant timestamp(String raw) {
        return timestamps.parse(raw).orElseGet(() -> {
            if (raw != null) {
                logger.fine(() -> "Unparseable timestamp '" + raw + "', using processing time");
            }
            return timestamps.now();
        });
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (!candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }
}
