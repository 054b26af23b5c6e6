package truthTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import prop.formula.Assignment;
import prop.formula.Formula;

public class Semantics {

    public enum Classification {
        TAUTOLOGY,
        CONTRADICTION,
        CONTINGENT
    }

    private final TruthTableGenerator generator;

    public Semantics() {
        this(new TruthTableGenerator());
    }

    public Semantics(TruthTableGenerator generator) {
        this.generator = generator;
    }

    public Classification classify(Formula formula) {
        Table table = generator.generate(List.of(formula));
        if (table.isTautology(0)) return Classification.TAUTOLOGY;
        if (table.isContradiction(0)) return Classification.CONTRADICTION;
        return Classification.CONTINGENT;
    }

    public boolean equivalent(Formula first, Formula second) {
        Table table = generator.generate(List.of(first, second));
        return table.column(0).equals(table.column(1));
    }

    /**
     * Find a row where every premise holds and the conclusion does not.
     */
    public Optional<Assignment> findCounterExample(List<Formula> premises, Formula conclusion) {
        List<Formula> columns = new ArrayList<>(premises);
        columns.add(conclusion);
        Table table = generator.generate(columns);
        int last = columns.size() - 1;
        for (Table.Row row : table.rows()) {
            if (allTrue(row.values().subList(0, last)) && !row.values().get(last)) {
                return Optional.of(row.assignment());
            }
        }
        return Optional.empty();
    }

    public boolean entails(List<Formula> premises, Formula conclusion) {
        return findCounterExample(premises, conclusion).isEmpty();
    }

    public boolean consistent(List<Formula> premises) {
        if (premises.isEmpty()) {
            return true;
        }
        Table table = generator.generate(premises);
        return table.rows().stream().anyMatch(row -> allTrue(row.values()));
    }

    private static boolean allTrue(List<Boolean> values) {
        return values.stream().allMatch(Boolean::booleanValue);
    }
}
