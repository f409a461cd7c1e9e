package com.raidxp.compiler;

import com.raidxp.api.exceptions.CompilationException;
import com.raidxp.api.model.QuestSeed;
import com.raidxp.runtime.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class RuleCompilerTest {

    @TempDir
    Path tempDir;

    private RuleCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new RuleCompiler(OpenTelemetry.noop().getTracer("test"));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Should compile patterns in document order with upper-cased types")
    void compilesPatternsInOrder() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  kill: '^(?<ts>\\S+ \\S+) KILL: (?<killer>\\S+) -> (?<victim>\\S+)'
                  EXTRACT: '^(?<ts>\\S+ \\S+) EXTRACT: (?<name>\\S+)'
                  Death: 'DEATH: (?<victim>\\S+) by (?<killer>\\S+)'
                """);

        RuleSet ruleSet = compiler.compile(rules);

        assertThat(ruleSet.getRules())
                .extracting(RuleSet.CompiledRule::eventType)
                .containsExactly("KILL", "EXTRACT", "DEATH");
        assertThat(ruleSet.getRules().get(0).groupNames()).containsExactly("ts", "killer", "victim");
        assertThat(ruleSet.getRules().get(2).groupNames()).containsExactly("victim", "killer");
    }

    @Test
    @DisplayName("Should apply defaults for keywords, XP table and quest seeds")
    void appliesDefaults() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: 'KILL: (?<killer>\\S+)'
                """);

        RuleSet ruleSet = compiler.compile(rules);

        assertThat(ruleSet.getHeadshotKeywords()).containsExactly("HEADSHOT", "HS");
        assertThat(ruleSet.getXpAwards()).containsEntry("KILL", 100).containsEntry("SURVIVE", 150);
        assertThat(ruleSet.getQuestSeeds()).extracting(QuestSeed::key)
                .containsExactly("dogtags_week", "survive_week");
        assertThat(ruleSet.getQuestCycleDays()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should accept P-style named groups")
    void rewritesPythonStyleGroups() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: '^(?P<ts>[^ ]+) .* KILL: (?P<killer>[^ ]+) -> (?P<victim>[^ ]+)(?: \\((?P<headshot>HEADSHOT)\\))?'
                """);

        RuleSet.CompiledRule rule = compiler.compile(rules).getRules().get(0);
        Matcher m = rule.pattern().matcher("12:00:01 [raid] KILL: Alpha -> Bravo (HEADSHOT)");

        assertThat(rule.groupNames()).containsExactly("ts", "killer", "victim", "headshot");
        assertThat(m.find()).isTrue();
        assertThat(m.group("killer")).isEqualTo("Alpha");
        assertThat(m.group("headshot")).isEqualTo("HEADSHOT");
    }

    @Test
    void groupNamesIgnoreLookbehind() {
        assertThat(RuleCompiler.groupNames("(?<=x)(?<name>\\w+)(?<!y)")).containsExactly("name");
    }

    @Test
    void readsConfiguredSections() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  DOGTAG: 'DOGTAG: (?<name>\\S+) picked up'
                headshot_keywords: [CRIT]
                xp:
                  DOGTAG: 45
                  kill: 10
                quests:
                  - key: tags
                    title: Tag hunter
                    event_type: dogtag
                    target: 3
                    reward_xp: 250
                quest_cycle_days: 1
                """);

        RuleSet ruleSet = compiler.compile(rules);

        assertThat(ruleSet.getHeadshotKeywords()).containsExactly("CRIT");
        assertThat(ruleSet.getXpAwards()).containsExactly(entry("DOGTAG", 45), entry("KILL", 10));
        assertThat(ruleSet.getQuestSeeds()).containsExactly(new QuestSeed("tags", "Tag hunter", "DOGTAG", 3, 250));
        assertThat(ruleSet.getQuestCycleDays()).isEqualTo(1);
    }

    @Test
    void readsJsonDocuments() throws IOException {
        Path rules = write("rules.json", """
                {"patterns": {"SURVIVE": "SURVIVE: (?<name>\\\\S+)"}, "headshot_keywords": []}
                """);

        RuleSet ruleSet = compiler.compile(rules);

        assertThat(ruleSet.getRules()).singleElement()
                .satisfies(r -> assertThat(r.pattern().matcher("SURVIVE: Zed").find()).isTrue());
        assertThat(ruleSet.getHeadshotKeywords()).containsExactly("HEADSHOT", "HS");
    }

    @Test
    @DisplayName("Should fail fast on an invalid pattern")
    void failsOnInvalidPattern() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: 'KILL: (?<killer>\\S+'
                """);

        assertThatThrownBy(() -> compiler.compile(rules))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Invalid pattern for KILL");
    }

    @Test
    void failsWithoutPatterns() throws IOException {
        Path rules = write("rules.yaml", "headshot_keywords: [HS]\n");

        assertThatThrownBy(() -> compiler.compile(rules))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("no patterns");
    }

    @Test
    void failsOnDuplicateTypeAfterNormalization() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: 'a'
                  kill: 'b'
                """);

        assertThatThrownBy(() -> compiler.compile(rules))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Duplicate event type: KILL");
    }

    @Test
    void failsOnNonIntegerAward() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: 'a'
                xp:
                  KILL: lots
                """);

        assertThatThrownBy(() -> compiler.compile(rules))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("must be an integer");
    }

    @Test
    void failsOnNegativeAward() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: 'a'
                xp:
                  KILL: -5
                """);

        assertThatThrownBy(() -> compiler.compile(rules))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void failsOnInvalidQuestSeed() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: 'a'
                quests:
                  - {key: k1, title: One, event_type: KILL, target: 0}
                """);

        assertThatThrownBy(() -> compiler.compile(rules))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("positive target");
    }

    @Test
    void failsOnUnknownSection() throws IOException {
        Path rules = write("rules.yaml", """
                patterns:
                  KILL: 'a'
                paterns:
                  DEATH: 'b'
                """);

        assertThatThrownBy(() -> compiler.compile(rules))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Malformed document");
    }

    @Test
    void compilesStandaloneXpTable() throws IOException {
        Path xp = write("xp.yaml", """
                KILL: 150
                extract: 0
                """);

        Map<String, Integer> awards = compiler.compileXpTable(xp);

        assertThat(awards).containsExactly(entry("KILL", 150), entry("EXTRACT", 0));
    }
}
