package com.tabularmeta.core.validation;

import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ValidationLog} keeping every message in memory, in order of arrival.
 */
public class CollectingValidationLog implements ValidationLog {

    /**
     * One logged message.
     *
     * @param level severity
     * @param message message text
     */
    public record Entry(Level level, String message) {}

    private final List<Entry> entries = new ArrayList<>();

    @Override
    public void log(Level level, String message) {
        entries.add(new Entry(level, message));
    }

    public List<Entry> getEntries() {
        return List.copyOf(entries);
    }

    public List<String> getMessages() {
        return entries.stream().map(Entry::message).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
