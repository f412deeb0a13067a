package alertcore.rule;

import alertcore.label.LabelSet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 注解模板渲染，支持 {{ $labels.name }}、{{ $value }}
 */
public final class AnnotationTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{\\{\\s*\\$(labels\\.([a-zA-Z_][a-zA-Z0-9_]*)|value)\\s*}}");

    private AnnotationTemplate() {
    }

    public static String render(String template, LabelSet labels, double value) {
        if (template == null || !template.contains("{{")) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = matcher.group(2) != null
                    ? labels.get(matcher.group(2))
                    : formatValue(value);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static Map<String, String> renderAll(Map<String, String> templates, LabelSet labels, double value) {
        Map<String, String> rendered = new LinkedHashMap<>();
        if (templates != null) {
            templates.forEach((key, template) -> rendered.put(key, render(template, labels, value)));
        }
        return rendered;
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
