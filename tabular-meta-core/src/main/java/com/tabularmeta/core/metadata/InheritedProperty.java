package com.tabularmeta.core.metadata;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Names one inherited property, how to read it from {@link InheritedProperties}, and the value it
 * takes when no description in the chain sets it.
 *
 * @param <T> property value type
 */
public final class InheritedProperty<T> {

    public static final InheritedProperty<UriTemplate> ABOUT_URL =
        new InheritedProperty<>("aboutUrl", InheritedProperties::aboutUrl, null);
    public static final InheritedProperty<Datatype> DATATYPE =
        new InheritedProperty<>("datatype", InheritedProperties::datatype, null);
    public static final InheritedProperty<String> DEFAULT =
        new InheritedProperty<>("default", InheritedProperties::defaultValue, "");
    public static final InheritedProperty<String> LANG =
        new InheritedProperty<>("lang", InheritedProperties::lang, NaturalLanguage.UNDEFINED);
    public static final InheritedProperty<List<String>> NULL =
        new InheritedProperty<>("null", InheritedProperties::nullValues, List.of(""));
    public static final InheritedProperty<Boolean> ORDERED =
        new InheritedProperty<>("ordered", InheritedProperties::ordered, false);
    public static final InheritedProperty<UriTemplate> PROPERTY_URL =
        new InheritedProperty<>("propertyUrl", InheritedProperties::propertyUrl, null);
    public static final InheritedProperty<Boolean> REQUIRED =
        new InheritedProperty<>("required", InheritedProperties::required, false);
    public static final InheritedProperty<String> SEPARATOR =
        new InheritedProperty<>("separator", InheritedProperties::separator, null);
    public static final InheritedProperty<String> TEXT_DIRECTION =
        new InheritedProperty<>("textDirection", InheritedProperties::textDirection, null);
    public static final InheritedProperty<UriTemplate> VALUE_URL =
        new InheritedProperty<>("valueUrl", InheritedProperties::valueUrl, null);

    private static final Map<String, InheritedProperty<?>> BY_NAME = Map.ofEntries(
        Map.entry(ABOUT_URL.name, ABOUT_URL),
        Map.entry(DATATYPE.name, DATATYPE),
        Map.entry(DEFAULT.name, DEFAULT),
        Map.entry(LANG.name, LANG),
        Map.entry(NULL.name, NULL),
        Map.entry(ORDERED.name, ORDERED),
        Map.entry(PROPERTY_URL.name, PROPERTY_URL),
        Map.entry(REQUIRED.name, REQUIRED),
        Map.entry(SEPARATOR.name, SEPARATOR),
        Map.entry(TEXT_DIRECTION.name, TEXT_DIRECTION),
        Map.entry(VALUE_URL.name, VALUE_URL)
    );

    private final String name;
    private final Function<InheritedProperties, T> getter;
    private final T terminalDefault;

    private InheritedProperty(String name, Function<InheritedProperties, T> getter, T terminalDefault) {
        this.name = name;
        this.getter = getter;
        this.terminalDefault = terminalDefault;
    }

    /**
     * @param name property name as in metadata documents, e.g. {@code "null"}
     * @return the property, or empty if the name is not an inherited property
     */
    public static Optional<InheritedProperty<?>> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String name() {
        return name;
    }

    /**
     * @param properties one description's properties
     * @return the locally declared value, or null
     */
    public T get(InheritedProperties properties) {
        return getter.apply(properties);
    }

    public T terminalDefault() {
        return terminalDefault;
    }

    @Override
    public String toString() {
        return name;
    }
}
