package com.tabularmeta.core.validation;

import com.tabularmeta.core.error.InvalidLexicalValueException;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViolationHandlerTest {

    @Test
    void strict_throwsLocatedViolation() {
        ViolationHandler handler = ViolationHandler.of(null);

        assertThat(handler.isStrict()).isTrue();
        assertThatThrownBy(() -> handler.report(new InvalidLexicalValueException("integer", "x"), "a.csv:2:1 id:"))
            .isInstanceOf(InvalidLexicalValueException.class)
            .hasMessageStartingWith("a.csv:2:1 id: ");
    }

    @Test
    void lenient_logsAtConfiguredLevel() {
        CollectingValidationLog log = new CollectingValidationLog();
        ViolationHandler handler = ViolationHandler.of(log, Level.ERROR);

        handler.report(new InvalidLexicalValueException("integer", "x"), "a.csv:2:1 id:");

        assertThat(handler.isStrict()).isFalse();
        assertThat(log.getEntries()).singleElement().satisfies(e -> {
            assertThat(e.level()).isEqualTo(Level.ERROR);
            assertThat(e.message()).startsWith("a.csv:2:1 id: ").contains("x");
        });
    }

    @Test
    void firstLocationWins() {
        InvalidLexicalValueException e = new InvalidLexicalValueException("integer", "x");

        e.atLocation("a.csv:2:1 id:").atLocation("other");

        assertThat(e.getLocation()).isEqualTo("a.csv:2:1 id:");
    }

    @Test
    void slf4jLog_countsMessages() {
        Slf4jValidationLog log = new Slf4jValidationLog();

        log.warn("one");
        log.log(Level.INFO, "two");

        assertThat(log.getCount()).isEqualTo(2);
    }

    @Test
    void discard_acceptsEverything() {
        ValidationLog log = ValidationLog.discard();

        log.warn("ignored");

        assertThat(log).isNotNull();
    }
}
