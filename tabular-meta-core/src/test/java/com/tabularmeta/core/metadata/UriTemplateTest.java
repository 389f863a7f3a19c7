package com.tabularmeta.core.metadata;

import com.tabularmeta.core.error.InvalidDescriptionException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UriTemplateTest {

    @Test
    void simpleExpansion_encodesReservedCharacters() {
        UriTemplate template = UriTemplate.parse("http://example.org/city/{name}");

        assertThat(template.expand(Map.of("name", "São Paulo/SP")))
            .isEqualTo("http://example.org/city/S%C3%A3o%20Paulo%2FSP");
    }

    @Test
    void reservedAndFragmentExpansion_keepReservedCharacters() {
        Map<String, Object> vars = Map.of("path", "a/b", "id", "x:1");

        assertThat(UriTemplate.parse("{+path}").expand(vars)).isEqualTo("a/b");
        assertThat(UriTemplate.parse("doc{#id}").expand(vars)).isEqualTo("doc#x:1");
    }

    @Test
    void undefinedVariables_expandToNothing() {
        Map<String, Object> vars = new HashMap<>();
        vars.put("a", null);

        assertThat(UriTemplate.parse("x{a}y{b}").expand(vars)).isEqualTo("xy");
    }

    @Test
    void prefixAndLists() {
        assertThat(UriTemplate.parse("{code:2}").expand(Map.of("code", "DEU"))).isEqualTo("DE");
        assertThat(UriTemplate.parse("{ids}").expand(Map.of("ids", List.of(1, 2)))).isEqualTo("1,2");
        assertThat(UriTemplate.parse("{a,b}").expand(Map.of("a", 1, "b", 2))).isEqualTo("1,2");
    }

    @Test
    void variableNames_inOrder() {
        assertThat(UriTemplate.parse("{b}/{a}/{b}").variableNames()).containsExactly("b", "a");
    }

    @Test
    void unsupportedOperatorsAndBadSyntax_areRejected() {
        assertThatThrownBy(() -> UriTemplate.parse("{?q}")).isInstanceOf(InvalidDescriptionException.class);
        assertThatThrownBy(() -> UriTemplate.parse("{a b}")).isInstanceOf(InvalidDescriptionException.class);
        assertThatThrownBy(() -> UriTemplate.parse("a}")).isInstanceOf(InvalidDescriptionException.class);
    }
}
