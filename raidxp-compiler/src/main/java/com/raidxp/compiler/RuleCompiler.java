package com.raidxp.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raidxp.api.IRuleCompiler;
import com.raidxp.api.exceptions.CompilationException;
import com.raidxp.api.model.EventTypes;
import com.raidxp.api.model.QuestSeed;
import com.raidxp.compiler.model.RuleDocument;
import com.raidxp.leveling.XpAwardTable;
import com.raidxp.runtime.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles the rule document into an immutable {@link RuleSet}.
 *
 * <p>Compilation is all-or-nothing: the first invalid pattern, award or quest seed
 * raises {@link CompilationException} and nothing is returned. A document ending
 * in {@code .json} is read as JSON, anything else as YAML.
 */
public class RuleCompiler implements IRuleCompiler {
    private static final Logger logger = Logger.getLogger(RuleCompiler.class.getName());

    static final List<String> DEFAULT_HEADSHOT_KEYWORDS = List.of("HEADSHOT", "HS");

    static final List<QuestSeed> DEFAULT_QUEST_SEEDS = List.of(
            new QuestSeed("dogtags_week", "Collect 5 dog tags", EventTypes.DOGTAG, 5, 0),
            new QuestSeed("survive_week", "Survive 5 raids", EventTypes.SURVIVE, 5, 0));

    // (?<name> but not lookbehind (?<= / (?<!
    private static final Pattern NAMED_GROUP = Pattern.compile("(?<!\\\\)\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private Tracer tracer;

    public RuleCompiler() {
        this(OpenTelemetry.noop().getTracer("raidxp-compiler"));
    }

    public RuleCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public RuleSet compile(Path rulesPath) throws IOException, CompilationException {
        Span span = tracer.spanBuilder("compile-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ruleFilePath", rulesPath.toString());

            RuleDocument document = readDocument(rulesPath, RuleDocument.class);
            if (document == null) {
                throw new CompilationException("Rule document is empty: " + rulesPath);
            }

            RuleSet.Builder builder = RuleSet.builder();
            compilePatterns(document.patterns()).forEach(builder::addRule);
            builder.withHeadshotKeywords(headshotKeywords(document.headshotKeywords()))
                    .withXpAwards(document.xp() == null
                            ? XpAwardTable.defaults().asMap()
                            : validateAwards(document.xp()))
                    .withQuestSeeds(questSeeds(document.quests()))
                    .withQuestCycleDays(validateCycleDays(document.questCycleDays()));

            RuleSet ruleSet = builder.build();
            span.setAttribute("ruleCount", ruleSet.getNumRules());
            logger.info(String.format("Compiled %d extraction rules from %s: %s",
                    ruleSet.getNumRules(), rulesPath, ruleSet.getRules().stream()
                            .map(RuleSet.CompiledRule::eventType).toList()));
            return ruleSet;
        } catch (IOException | CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Compiles a standalone XP award document ({@code {event_type: integer}}) that
     * replaces the table carried by the rule document.
     */
    public Map<String, Integer> compileXpTable(Path xpPath) throws IOException, CompilationException {
        @SuppressWarnings("unchecked")
        Map<String, Object> raw = readDocument(xpPath, LinkedHashMap.class);
        if (raw == null || raw.isEmpty()) {
            throw new CompilationException("XP award document is empty: " + xpPath);
        }
        return validateAwards(raw);
    }

    private <T> T readDocument(Path path, Class<T> type) throws IOException {
        String content = Files.readString(path);
        ObjectMapper mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? jsonMapper : yamlMapper;
        try {
            return mapper.readValue(content, type);
        } catch (JsonProcessingException e) {
            throw new CompilationException("Malformed document " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private List<RuleSet.CompiledRule> compilePatterns(Map<String, String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new CompilationException("Rule document has no patterns");
        }
        List<RuleSet.CompiledRule> rules = new ArrayList<>();
        Set<String> eventTypes = new HashSet<>();
        for (Map.Entry<String, String> entry : patterns.entrySet()) {
            String eventType = entry.getKey() == null ? "" : entry.getKey().trim().toUpperCase(Locale.ROOT);
            if (eventType.isEmpty()) {
                throw new CompilationException("Pattern has an empty event type");
            }
            if (!eventTypes.add(eventType)) {
                throw new CompilationException("Duplicate event type: " + eventType);
            }
            String source = entry.getValue();
            if (source == null || source.isBlank()) {
                throw new CompilationException("Pattern for " + eventType + " is empty");
            }
            rules.add(compileRule(eventType, source));
        }
        return rules;
    }

    RuleSet.CompiledRule compileRule(String eventType, String source) {
        String javaSource = toJavaSyntax(source);
        try {
            Pattern pattern = Pattern.compile(javaSource);
            return new RuleSet.CompiledRule(eventType, pattern, groupNames(javaSource));
        } catch (PatternSyntaxException e) {
            throw new CompilationException("Invalid pattern for " + eventType + ": " + e.getDescription(), e);
        }
    }

    /**
     * Accepts {@code (?P<name>...)} and {@code (?P=name)} group syntax as written for
     * other regex dialects.
     */
    static String toJavaSyntax(String source) {
        return source.replace("(?P<", "(?<")
                .replaceAll("\\(\\?P=([a-zA-Z][a-zA-Z0-9]*)\\)", "\\\\k<$1>");
    }

    static List<String> groupNames(String javaSource) {
        List<String> names = new ArrayList<>();
        Matcher m = NAMED_GROUP.matcher(javaSource);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    private List<String> headshotKeywords(List<String> configured) {
        if (configured == null) {
            return DEFAULT_HEADSHOT_KEYWORDS;
        }
        List<String> keywords = configured.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                .toList();
        return keywords.isEmpty() ? DEFAULT_HEADSHOT_KEYWORDS : keywords;
    }

    private Map<String, Integer> validateAwards(Map<String, Object> raw) {
        Map<String, Integer> awards = new LinkedHashMap<>();
        raw.forEach((type, value) -> {
            if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
                throw new CompilationException("XP award for " + type + " must be an integer, got: " + value);
            }
            long xp = ((Number) value).longValue();
            if (xp > Integer.MAX_VALUE) {
                throw new CompilationException("XP award for " + type + " is too large: " + xp);
            }
            awards.put(type, (int) xp);
        });
        try {
            return XpAwardTable.of(awards).asMap();
        } catch (IllegalArgumentException e) {
            throw new CompilationException(e.getMessage(), e);
        }
    }

    private List<QuestSeed> questSeeds(List<RuleDocument.QuestSeedDefinition> definitions) {
        if (definitions == null) {
            return DEFAULT_QUEST_SEEDS;
        }
        List<QuestSeed> seeds = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < definitions.size(); i++) {
            RuleDocument.QuestSeedDefinition def = definitions.get(i);
            if (def == null || def.key() == null || def.key().isBlank()) {
                throw new CompilationException("Quest seed at index " + i + " has missing or empty key");
            }
            if (!keys.add(def.key())) {
                throw new CompilationException("Duplicate quest seed key: " + def.key());
            }
            if (def.title() == null || def.title().isBlank()) {
                throw new CompilationException("Quest seed '" + def.key() + "' has no title");
            }
            if (def.eventType() == null || def.eventType().isBlank()) {
                throw new CompilationException("Quest seed '" + def.key() + "' has no event_type");
            }
            if (def.target() == null || def.target() <= 0) {
                throw new CompilationException("Quest seed '" + def.key() + "' needs a positive target");
            }
            int reward = def.rewardXp() == null ? 0 : def.rewardXp();
            if (reward < 0) {
                throw new CompilationException("Quest seed '" + def.key() + "' has a negative reward_xp");
            }
            seeds.add(new QuestSeed(def.key().trim(), def.title().trim(),
                    def.eventType().trim().toUpperCase(Locale.ROOT), def.target(), reward));
        }
        return seeds;
    }

    private int validateCycleDays(Integer days) {
        if (days == null || days <= 0) {
            throw new CompilationException("quest_cycle_days must be positive, got: " + days);
        }
        return days;
    }
}
