package prop.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import prop.Operator;

public final class SymbolTable {
    private final Map<Operator, Set<String>> acceptedSymbols;
    // Longest spellings first, so "<->" wins over "<" style prefixes
    private final List<Map.Entry<String, Operator>> byLength;

    public SymbolTable(Map<Operator, Set<String>> acceptedSymbols) {
        Map<Operator, Set<String>> copy = new EnumMap<>(Operator.class);
        Map<String, Operator> owners = new HashMap<>();
        for (Operator op : Operator.values()) {
            Set<String> spellings = acceptedSymbols.get(op);
            if (spellings == null || spellings.isEmpty()) {
                throw new IllegalArgumentException("No spelling configured for " + op);
            }
            for (String spelling : spellings) {
                checkSpelling(op, spelling);
                Operator previous = owners.put(spelling, op);
                if (previous != null && previous != op) {
                    throw new IllegalArgumentException(
                            "Spelling '" + spelling + "' used for both " + previous + " and " + op);
                }
            }
            copy.put(op, Collections.unmodifiableSet(new LinkedHashSet<>(spellings)));
        }
        this.acceptedSymbols = Collections.unmodifiableMap(copy);
        List<Map.Entry<String, Operator>> entries = new ArrayList<>(owners.entrySet());
        entries.sort((a, b) -> {
            int cmp = Integer.compare(b.getKey().length(), a.getKey().length());
            return cmp != 0 ? cmp : a.getKey().compareTo(b.getKey());
        });
        this.byLength = List.copyOf(entries);
    }

    /**
     * Symbolic and ASCII spellings of every operator.
     */
    public static SymbolTable defaults() {
        Map<Operator, Set<String>> map = new EnumMap<>(Operator.class);
        for (Operator op : Operator.values()) {
            Set<String> spellings = new LinkedHashSet<>();
            spellings.add(op.symbol());
            spellings.addAll(op.asciiSpellings());
            map.put(op, spellings);
        }
        return new SymbolTable(map);
    }

    /**
     * Only the symbolic spellings produced by {@code toCanonicalString()}.
     */
    public static SymbolTable symbolicOnly() {
        Map<Operator, Set<String>> map = new EnumMap<>(Operator.class);
        for (Operator op : Operator.values()) {
            map.put(op, Set.of(op.symbol()));
        }
        return new SymbolTable(map);
    }

    private static void checkSpelling(Operator op, String spelling) {
        if (spelling == null || spelling.isEmpty()) {
            throw new IllegalArgumentException("Empty spelling for " + op);
        }
        for (int i = 0; i < spelling.length(); i++) {
            char c = spelling.charAt(i);
            if (Character.isWhitespace(c) || Character.isLetterOrDigit(c) || c == '_' || c == '(' || c == ')') {
                throw new IllegalArgumentException("Illegal character '" + c + "' in spelling '" + spelling + "' for " + op);
            }
        }
    }

    public Set<String> spellings(Operator op) {
        return acceptedSymbols.get(op);
    }

    public Map<Operator, Set<String>> asMap() {
        return acceptedSymbols;
    }

    Optional<Map.Entry<String, Operator>> longestMatch(String text, int position) {
        for (var entry : byLength) {
            if (text.startsWith(entry.getKey(), position)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
