package prop.parser;

import java.util.HashMap;
import java.util.Map;
import prop.formula.Formula;

/**
 * Remembers parsed formulas for the lifetime of the owning object. Entries are keyed by the
 * trimmed input text and by the canonical string of the result, so differently spelled inputs of
 * the same formula share one instance.
 */
public class FormulaCache {
    private final Parser parser;
    private final Map<String, Formula> byText = new HashMap<>();
    private final Map<String, Formula> byCanonical = new HashMap<>();

    public FormulaCache(Parser parser) {
        this.parser = parser;
    }

    public synchronized Formula parse(String text) {
        String key = text.strip();
        Formula cached = byText.get(key);
        if (cached != null) {
            return cached;
        }
        Formula parsed = parser.parse(text);
        Formula shared = byCanonical.computeIfAbsent(parsed.toCanonicalString(), k -> parsed);
        byText.put(key, shared);
        return shared;
    }

    public synchronized int size() {
        return byCanonical.size();
    }

    public synchronized void clear() {
        byText.clear();
        byCanonical.clear();
    }
}
