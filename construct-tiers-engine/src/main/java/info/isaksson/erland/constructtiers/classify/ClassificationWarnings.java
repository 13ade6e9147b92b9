package info.isaksson.erland.constructtiers.classify;

import info.isaksson.erland.constructtiers.ir.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects the warnings of one file.
 *
 * <p>Node warnings carry the node id and location as context; file warnings carry the measured
 * value. The final list is sorted by code, then message, then context.</p>
 */
final class ClassificationWarnings {

    private static final Comparator<ClassificationWarning> ORDER = Comparator
            .comparing((ClassificationWarning w) -> w.code)
            .thenComparing(w -> w.message)
            .thenComparing(w -> w.context.toString());

    private final List<ClassificationWarning> warnings = new ArrayList<>();

    void warnNode(String code, String message, Node node) {
        Map<String, String> ctx = new TreeMap<>();
        ctx.put("node", String.valueOf(node.id));
        if (node.location != null) ctx.put("location", node.location.toString());
        warnings.add(new ClassificationWarning(code, message, ctx));
    }

    void warnFile(String code, String message, String measure, int value) {
        warnings.add(new ClassificationWarning(code, message, Map.of(measure, String.valueOf(value))));
    }

    List<ClassificationWarning> toDeterministicList() {
        List<ClassificationWarning> out = new ArrayList<>(warnings);
        out.sort(ORDER);
        return Collections.unmodifiableList(out);
    }
}
