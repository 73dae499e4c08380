package dev.smartrouter.registry;

import dev.smartrouter.config.RegistryProperties;
import dev.smartrouter.config.RouterProperties;
import dev.smartrouter.domain.valueobject.ModelCapability;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a {@link ModelCapability} from a model id such as {@code qwen2.5-coder:7b},
 * {@code Qwen3-30B-A3B} or {@code mixtral-8x7b}.
 *
 * <p>Recognised figures, matched on the lower-cased id:
 * <ul>
 *   <li>{@code <n>b} / {@code <n>m} plain size (millions converted to billions); the largest wins</li>
 *   <li>{@code <n>x<m>b} expert mix: total n*m, active m</li>
 *   <li>{@code <n>a<m>b} compact total/active pair, e.g. {@code 30A3B}</li>
 *   <li>{@code a<m>b} active size of a mixture-of-experts model</li>
 * </ul>
 * An id without any figure is sized with the configured default and flagged as degraded.
 * It is still tiered, never dropped.
 */
public class ParameterExtractor {

    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";
    private static final Pattern EXPERT_MIX = Pattern.compile("(?<![a-z0-9.])(\\d+)x" + NUMBER + "b(?![a-z0-9])");
    private static final Pattern TOTAL_ACTIVE = Pattern.compile("(?<![a-z0-9.])" + NUMBER + "a" + NUMBER + "b(?![a-z0-9])");
    private static final Pattern ACTIVE = Pattern.compile("(?<![a-z0-9.])a" + NUMBER + "b(?![a-z0-9])");
    private static final Pattern PLAIN = Pattern.compile("(?<![a-z0-9.])" + NUMBER + "([bm])(?![a-z0-9])");

    private final double defaultParams;
    private final List<String> excludedMarkers;
    private final List<String> coderMarkers;

    public ParameterExtractor(double defaultParams, List<String> excludedMarkers, List<String> coderMarkers) {
        this.defaultParams = defaultParams;
        this.excludedMarkers = lowerCase(excludedMarkers);
        this.coderMarkers = lowerCase(coderMarkers);
    }

    public static ParameterExtractor from(RouterProperties routing, RegistryProperties registry) {
        return new ParameterExtractor(routing.defaultParams(), registry.excludedMarkers(), registry.coderMarkers());
    }

    public ModelCapability extract(String modelId) {
        String id = modelId.toLowerCase(Locale.ROOT);
        boolean excluded = containsAny(id, excludedMarkers);
        boolean coder = containsAny(id, coderMarkers);

        Double total = null;
        Double active = null;

        Matcher mix = EXPERT_MIX.matcher(id);
        if (mix.find()) {
            double experts = Double.parseDouble(mix.group(1));
            double width = Double.parseDouble(mix.group(2));
            total = experts * width;
            active = width;
        }

        Matcher pair = TOTAL_ACTIVE.matcher(id);
        if (pair.find()) {
            total = Double.parseDouble(pair.group(1));
            active = Double.parseDouble(pair.group(2));
        }

        Matcher activeMatcher = ACTIVE.matcher(id);
        if (activeMatcher.find()) {
            active = Double.parseDouble(activeMatcher.group(1));
        }

        Matcher plain = PLAIN.matcher(id);
        while (plain.find()) {
            double value = Double.parseDouble(plain.group(1));
            if ("m".equals(plain.group(2))) value = value / 1000.0;
            if (total == null || value > total) total = value;
        }

        if (total == null && active != null) {
            // a lone active figure is the only size we have
            return new ModelCapability(active, null, coder, excluded, false);
        }
        if (total == null) {
            return new ModelCapability(defaultParams, null, coder, excluded, true);
        }
        return new ModelCapability(total, active, coder, excluded, false);
    }

    private static boolean containsAny(String id, List<String> markers) {
        for (String marker : markers) {
            if (id.contains(marker)) return true;
        }
        return false;
    }

    private static List<String> lowerCase(List<String> markers) {
        return markers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
    }
}
