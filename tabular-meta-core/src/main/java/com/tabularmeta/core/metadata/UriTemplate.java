package com.tabularmeta.core.metadata;

import com.tabularmeta.core.error.InvalidDescriptionException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URI template (RFC 6570) used by {@code aboutUrl}, {@code propertyUrl} and {@code valueUrl}.
 *
 * <p>Supports simple ({@code {var}}), reserved ({@code {+var}}) and fragment ({@code {#var}})
 * expansion with comma-separated variable lists and {@code :n} prefixes. Undefined and null
 * variables expand to nothing; collections are joined with commas.
 */
public final class UriTemplate {

    private static final Pattern EXPRESSION = Pattern.compile("\\{([^{}]*)}");
    private static final Pattern VARSPEC = Pattern.compile(
        "((?:[A-Za-z0-9_]|%[0-9A-Fa-f]{2})(?:\\.?(?:[A-Za-z0-9_]|%[0-9A-Fa-f]{2}))*)(?::([1-9][0-9]{0,3})|\\*)?");
    private static final String UNRESERVED = "-._~";
    private static final String RESERVED = ":/?#[]@!$&'()*+,;=";

    private record Part(String literal, char operator, List<VarSpec> vars) {}

    private record VarSpec(String name, int prefix) {}

    private final String template;
    private final List<Part> parts;

    private UriTemplate(String template, List<Part> parts) {
        this.template = template;
        this.parts = parts;
    }

    /**
     * Parses a template.
     *
     * @param template template text
     * @return parsed template
     * @throws InvalidDescriptionException on malformed expressions or unsupported operators
     */
    public static UriTemplate parse(String template) {
        Objects.requireNonNull(template, "template must not be null");
        List<Part> parts = new ArrayList<>();
        Matcher m = EXPRESSION.matcher(template);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                parts.add(new Part(template.substring(last, m.start()), '\0', List.of()));
            }
            parts.add(expression(template, m.group(1)));
            last = m.end();
        }
        if (last < template.length()) {
            String rest = template.substring(last);
            if (rest.indexOf('{') >= 0 || rest.indexOf('}') >= 0) {
                throw new InvalidDescriptionException("unbalanced braces in URI template: " + template);
            }
            parts.add(new Part(rest, '\0', List.of()));
        }
        return new UriTemplate(template, List.copyOf(parts));
    }

    private static Part expression(String template, String body) {
        char operator = ' ';
        if (!body.isEmpty() && "+#".indexOf(body.charAt(0)) >= 0) {
            operator = body.charAt(0);
            body = body.substring(1);
        } else if (!body.isEmpty() && "./;?&=,!@|".indexOf(body.charAt(0)) >= 0) {
            throw new InvalidDescriptionException("unsupported URI template operator in " + template);
        }
        List<VarSpec> vars = new ArrayList<>();
        for (String spec : body.split(",", -1)) {
            Matcher vm = VARSPEC.matcher(spec);
            if (!vm.matches()) {
                throw new InvalidDescriptionException("invalid URI template variable '" + spec + "' in " + template);
            }
            vars.add(new VarSpec(vm.group(1), vm.group(2) == null ? 0 : Integer.parseInt(vm.group(2))));
        }
        return new Part(null, operator, List.copyOf(vars));
    }

    /**
     * Expands the template.
     *
     * @param variables variable values
     * @return expanded text
     */
    public String expand(Map<String, ?> variables) {
        StringBuilder out = new StringBuilder();
        for (Part part : parts) {
            if (part.literal() != null) {
                out.append(part.literal());
                continue;
            }
            boolean reserved = part.operator() != ' ';
            List<String> values = new ArrayList<>();
            for (VarSpec var : part.vars()) {
                String value = render(variables.get(var.name()), var.prefix(), reserved);
                if (value != null) {
                    values.add(value);
                }
            }
            if (!values.isEmpty()) {
                if (part.operator() == '#') {
                    out.append('#');
                }
                out.append(String.join(",", values));
            }
        }
        return out.toString();
    }

    private static String render(Object value, int prefix, boolean reserved) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> collection) {
            List<String> items = new ArrayList<>();
            for (Object item : collection) {
                if (item != null) {
                    items.add(encode(String.valueOf(item), reserved));
                }
            }
            return items.isEmpty() ? null : String.join(",", items);
        }
        String text = String.valueOf(value);
        if (prefix > 0 && text.codePointCount(0, text.length()) > prefix) {
            text = text.substring(0, text.offsetByCodePoints(0, prefix));
        }
        return encode(text, reserved);
    }

    private static String encode(String text, boolean reserved) {
        StringBuilder out = new StringBuilder();
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            char c = (char) b;
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (b < 0x80 && (alnum || UNRESERVED.indexOf(c) >= 0 || (reserved && RESERVED.indexOf(c) >= 0))) {
                out.append(c);
            } else if (reserved && c == '%' && i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2])) {
                out.append('%');
            } else {
                out.append('%').append(String.format("%02X", b));
            }
        }
        return out.toString();
    }

    private static boolean isHex(byte b) {
        return Character.digit(b, 16) >= 0;
    }

    /**
     * @return names of all variables, in order of appearance
     */
    public List<String> variableNames() {
        return parts.stream().flatMap(p -> p.vars().stream()).map(VarSpec::name).distinct().toList();
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UriTemplate other && template.equals(other.template);
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }
}
