package proofGeneration.search;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import prop.formula.Formula;

public class KnownSet {
    private final Map<Formula, Candidate> known = new LinkedHashMap<>();

    public synchronized boolean insert(Candidate candidate) {
        return known.putIfAbsent(candidate.formula(), candidate) == null;
    }

    public synchronized boolean contains(Formula formula) {
        return known.containsKey(formula);
    }

    public synchronized Candidate get(Formula formula) {
        return known.get(formula);
    }

    public synchronized int size() {
        return known.size();
    }

    public synchronized List<Formula> snapshot() {
        return new ArrayList<>(known.keySet());
    }
}
