package com.logsentinel.core.detection;

import com.logsentinel.core.model.AnomalyPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CompiledMatcher}.
 */
class CompiledMatcherTest {

    private static final String[] FRAGMENTS = {
            "err", "fail", "time", "out", "\\d+", "[a-c]+", "x|y", "^a", "b$", "(ab)+",
            "(?:q|w)", "e.?r", "o{2}", "\\bto", "[0-9][a-z]", "(?<tag>ti)me"
    };
    private static final String LINE_ALPHABET = "abcefilmortuwxyqAEFIT0123 :";

    @Test
    @DisplayName("Earlier rule should win when several rules match the same line")
    void earlierRuleShouldWin() {
        CompiledMatcher matcher = CompiledMatcher.compile(List.of(
                AnomalyPattern.custom("ERROR|FAIL", "GENERIC_ERROR"),
                AnomalyPattern.custom("Timeout", "TIMEOUT")));

        Optional<PatternHit> hit = matcher.match("2024-01-01 FAIL: connect Timeout");

        assertThat(matcher.isCombined()).isTrue();
        assertThat(hit).isPresent();
        assertThat(hit.get().getCategory()).isEqualTo("GENERIC_ERROR");
        assertThat(hit.get().getPatternSource()).isEqualTo("ERROR|FAIL");
        assertThat(hit.get().getMatchedText()).isEqualTo("FAIL");
    }

    @Test
    @DisplayName("Registration order should beat position in the line")
    void registrationOrderShouldBeatPosition() {
        CompiledMatcher matcher = CompiledMatcher.compile(List.of(
                AnomalyPattern.custom("Timeout", "TIMEOUT"),
                AnomalyPattern.custom("FAIL", "GENERIC_ERROR")));

        Optional<PatternHit> hit = matcher.match("FAIL: connect Timeout");

        assertThat(hit).map(PatternHit::getCategory).contains("TIMEOUT");
        assertThat(hit).map(PatternHit::getMatchedText).contains("Timeout");
    }

    @Test
    @DisplayName("Matching should be case-insensitive")
    void matchingShouldIgnoreCase() {
        CompiledMatcher matcher = CompiledMatcher.compile(List.of(
                AnomalyPattern.builtIn("Kernel panic", "KERNEL_PANIC")));

        assertThat(matcher.match("[  12.3] KERNEL PANIC - not syncing")).isPresent();
        assertThat(matcher.match("kernel: all good")).isEmpty();
    }

    @Test
    @DisplayName("Case-insensitive matching should fold non-ASCII letters")
    void matchingShouldFoldNonAsciiCase() {
        CompiledMatcher matcher = CompiledMatcher.compile(List.of(
                AnomalyPattern.custom("échec", "FAILURE"),
                AnomalyPattern.custom("Störung", "DISTURBANCE")));

        assertThat(matcher.match("ÉCHEC disque")).map(PatternHit::getCategory).contains("FAILURE");
        assertThat(matcher.match("ÉCHEC disque")).map(PatternHit::getMatchedText).contains("ÉCHEC");
        assertThat(matcher.match("netz STÖRUNG")).map(PatternHit::getCategory).contains("DISTURBANCE");
    }

    @Test
    @DisplayName("Combined matching should equal evaluating each rule in order (random rule sets)")
    void combinedShouldEqualSequentialEvaluation() {
        Random random = new Random(42);

        for (int round = 0; round < 200; round++) {
            List<AnomalyPattern> rules = randomRules(random);
            CompiledMatcher matcher = CompiledMatcher.compile(rules);
            assertThat(matcher.isCombined()).as("rules %s", rules).isTrue();

            for (int i = 0; i < 25; i++) {
                String line = randomLine(random);
                Optional<PatternHit> expected = firstHitInOrder(rules, line);
                Optional<PatternHit> actual = matcher.match(line);

                assertThat(actual.map(PatternHit::getPatternSource))
                        .as("source for line '%s' and rules %s", line, rules)
                        .isEqualTo(expected.map(PatternHit::getPatternSource));
                assertThat(actual.map(PatternHit::getMatchedText))
                        .as("matched text for line '%s' and rules %s", line, rules)
                        .isEqualTo(expected.map(PatternHit::getMatchedText));
                assertThat(actual.map(PatternHit::getCategory))
                        .isEqualTo(expected.map(PatternHit::getCategory));
            }
        }
    }

    @Test
    @DisplayName("Rules with numeric back-references should be evaluated one by one with the same results")
    void backReferencesShouldFallBack() {
        List<AnomalyPattern> rules = List.of(
                AnomalyPattern.custom("(a)\\1", "DOUBLE_A"),
                AnomalyPattern.custom("b+", "B"));
        CompiledMatcher matcher = CompiledMatcher.compile(rules);

        assertThat(matcher.isCombined()).isFalse();
        assertThat(matcher.match("xbaAy")).map(PatternHit::getCategory).contains("DOUBLE_A");
        assertThat(matcher.match("xbay")).map(PatternHit::getCategory).contains("B");
        assertThat(matcher.match("xyz")).isEmpty();
    }

    @Test
    @DisplayName("An escaped backslash followed by a digit is not a back-reference")
    void escapedBackslashIsNotBackReference() {
        CompiledMatcher matcher = CompiledMatcher.compile(List.of(
                AnomalyPattern.custom("path\\\\1", "PATH")));

        assertThat(matcher.isCombined()).isTrue();
        assertThat(matcher.match("c:\\path\\1")).map(PatternHit::getCategory).contains("PATH");
    }

    @Test
    @DisplayName("Rules reusing a group name should fall back to one-by-one evaluation")
    void clashingGroupNamesShouldFallBack() {
        List<AnomalyPattern> rules = List.of(
                AnomalyPattern.custom("(?<w>disk)", "DISK"),
                AnomalyPattern.custom("(?<w>fan)", "FAN"));
        CompiledMatcher matcher = CompiledMatcher.compile(rules);

        assertThat(matcher.isCombined()).isFalse();
        assertThat(matcher.match("fan stalled, disk ok")).map(PatternHit::getCategory).contains("DISK");
        assertThat(matcher.match("fan stalled")).map(PatternHit::getCategory).contains("FAN");
    }

    @Test
    @DisplayName("Empty matcher should never match")
    void emptyMatcherShouldNeverMatch() {
        CompiledMatcher matcher = CompiledMatcher.compile(List.of());

        assertThat(matcher.isEmpty()).isTrue();
        assertThat(matcher.match("Kernel panic")).isEmpty();
        assertThat(CompiledMatcher.empty().match("")).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<AnomalyPattern> randomRules(Random random) {
        int count = 1 + random.nextInt(6);
        Set<String> sources = new LinkedHashSet<>();
        while (sources.size() < count) {
            String source = FRAGMENTS[random.nextInt(FRAGMENTS.length)];
            if (random.nextBoolean()) {
                source = source + FRAGMENTS[random.nextInt(FRAGMENTS.length)];
            }
            if (source.indexOf("(?<tag>") != source.lastIndexOf("(?<tag>")) {
                continue;
            }
            sources.add(source);
        }

        // one named group per rule set, so the combined expression stays valid
        List<AnomalyPattern> rules = new ArrayList<>();
        boolean namedGroupUsed = false;
        int index = 0;
        for (String source : sources) {
            if (source.contains("(?<tag>")) {
                if (namedGroupUsed) {
                    continue;
                }
                namedGroupUsed = true;
            }
            rules.add(AnomalyPattern.custom(source, "C" + index++));
        }
        return rules;
    }

    private static String randomLine(Random random) {
        int length = random.nextInt(24);
        StringBuilder line = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            line.append(LINE_ALPHABET.charAt(random.nextInt(LINE_ALPHABET.length())));
        }
        return line.toString();
    }

    private static Optional<PatternHit> firstHitInOrder(List<AnomalyPattern> rules, String line) {
        for (AnomalyPattern rule : rules) {
            Matcher m = Pattern.compile(rule.getSource(), AnomalyPattern.REGEX_FLAGS).matcher(line);
            if (m.find()) {
                return Optional.of(new PatternHit(rule.getCategory(), rule.getSource(), m.group()));
            }
        }
        return Optional.empty();
    }
}
