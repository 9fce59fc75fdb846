package work.lcod.graphgen.emit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Boilerplate fragments loaded once from {@code templates/<target>/<name>.tmpl} on the classpath. The map is
 * never modified after construction, so one instance serves concurrent conversions.
 */
public final class TemplateCache {
    private static final List<String> TEMPLATE_NAMES = List.of("java/errors", "rust/errors");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([a-z_]+)}");
    private static final TemplateCache SHARED = load();

    private final Map<String, String> templates;

    private TemplateCache(Map<String, String> templates) {
        this.templates = Map.copyOf(templates);
    }

    public static TemplateCache shared() {
        return SHARED;
    }

    public String render(String name, Map<String, String> variables) {
        var template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Unknown template: " + name);
        }
        var matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            var key = matcher.group(1);
            var value = variables.get(key);
            if (value == null) {
                throw new IllegalArgumentException("Template " + name + " needs variable '" + key + "'");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static TemplateCache load() {
        var loaded = new LinkedHashMap<String, String>();
        for (var name : TEMPLATE_NAMES) {
            var resource = "/templates/" + name + ".tmpl";
            try (InputStream in = TemplateCache.class.getResourceAsStream(resource)) {
                Objects.requireNonNull(in, () -> "Missing template resource " + resource);
                loaded.put(name, new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read template " + resource, ex);
            }
        }
        return new TemplateCache(loaded);
    }
}
