package truthTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import prop.formula.Assignment;
import prop.formula.Formula;

/**
 * Builds truth tables.
 * <p>
 * Columns list the variables in first-occurrence order across the formulas. Rows enumerate the
 * assignments as a binary counter over that column order: the first variable varies slowest and
 * {@code true} comes before {@code false}. So with variables P, Q the rows are TT, TF, FT, FF.
 * The order is part of the contract, exported tables depend on it.
 */
public class TruthTableGenerator {
    private static final Logger logger = LoggerFactory.getLogger(TruthTableGenerator.class);

    public static final int DEFAULT_MAX_VARIABLES = 10;
    // Row indices are ints, 2^30 rows is already far past anything printable
    private static final int HARD_MAX_VARIABLES = 30;

    private final int maxVariables;

    public TruthTableGenerator() {
        this(DEFAULT_MAX_VARIABLES);
    }

    public TruthTableGenerator(int maxVariables) {
        if (maxVariables < 0 || maxVariables > HARD_MAX_VARIABLES) {
            throw new IllegalArgumentException("maxVariables must be between 0 and " + HARD_MAX_VARIABLES + ": " + maxVariables);
        }
        this.maxVariables = maxVariables;
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    public Table generate(List<Formula> formulas) {
        return generate(formulas, false);
    }

    /**
     * @param strict when set, every formula must use exactly the same variables
     * @throws MixedVariableSetException in strict mode when the variable sets differ
     * @throws TooManyVariablesException when the table would exceed the configured ceiling
     */
    public Table generate(List<Formula> formulas, boolean strict) {
        if (formulas == null || formulas.isEmpty()) {
            throw new IllegalArgumentException("At least one formula is required");
        }
        List<String> variables = columnOrder(formulas);
        if (strict) {
            Set<String> expected = Set.copyOf(variables);
            for (Formula formula : formulas) {
                if (!formula.variables().equals(expected)) {
                    throw new MixedVariableSetException(formula, new LinkedHashSet<>(variables));
                }
            }
        }
        if (variables.size() > maxVariables) {
            throw new TooManyVariablesException(variables.size(), maxVariables);
        }
        int rowCount = 1 << variables.size();
        logger.debug("Generating truth table with {} variables, {} rows and {} formula columns",
                variables.size(), rowCount, formulas.size());
        List<Table.Row> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            Assignment assignment = assignmentForRow(variables, i);
            List<Boolean> values = new ArrayList<>(formulas.size());
            for (Formula formula : formulas) {
                values.add(formula.evaluate(assignment));
            }
            rows.add(new Table.Row(assignment, values));
        }
        return new Table(variables, formulas, rows);
    }

    public static List<String> columnOrder(List<Formula> formulas) {
        Set<String> variables = new LinkedHashSet<>();
        for (Formula formula : formulas) {
            variables.addAll(formula.variables());
        }
        return List.copyOf(variables);
    }

    // Variable j of n is false iff bit n-1-j of the row index is set
    static Assignment assignmentForRow(List<String> variables, int row) {
        int n = variables.size();
        Map<String, Boolean> values = new LinkedHashMap<>();
        for (int j = 0; j < n; j++) {
            values.put(variables.get(j), ((row >> (n - 1 - j)) & 1) == 0);
        }
        return new Assignment(values);
    }
}
