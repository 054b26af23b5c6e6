package truthTable;

import java.util.ArrayList;
import java.util.List;
import prop.formula.Assignment;
import prop.formula.Formula;

public final class Table {
    private final List<String> variables;
    private final List<Formula> formulas;
    private final List<Row> rows;

    public record Row(Assignment assignment, List<Boolean> values) {
        public Row {
            values = List.copyOf(values);
        }
    }

    Table(List<String> variables, List<Formula> formulas, List<Row> rows) {
        this.variables = List.copyOf(variables);
        this.formulas = List.copyOf(formulas);
        this.rows = List.copyOf(rows);
    }

    public List<String> variables() {
        return variables;
    }

    public List<Formula> formulas() {
        return formulas;
    }

    public List<Row> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<String> headers() {
        List<String> out = new ArrayList<>(variables);
        formulas.forEach(f -> out.add(f.toCanonicalString()));
        return out;
    }

    public List<List<Boolean>> toRows() {
        List<List<Boolean>> out = new ArrayList<>(rows.size());
        for (Row row : rows) {
            List<Boolean> cells = new ArrayList<>(variables.size() + formulas.size());
            for (String variable : variables) {
                cells.add(row.assignment().valueOf(variable));
            }
            cells.addAll(row.values());
            out.add(List.copyOf(cells));
        }
        return out;
    }

    /**
     * Values of the formula at {@code formulaIndex}, top to bottom.
     */
    public List<Boolean> column(int formulaIndex) {
        checkIndex(formulaIndex);
        return rows.stream().map(r -> r.values().get(formulaIndex)).toList();
    }

    public boolean isTautology(int formulaIndex) {
        return column(formulaIndex).stream().allMatch(Boolean::booleanValue);
    }

    public boolean isContradiction(int formulaIndex) {
        return column(formulaIndex).stream().noneMatch(Boolean::booleanValue);
    }

    public List<Integer> rowsWhereTrue(int formulaIndex) {
        List<Boolean> column = column(formulaIndex);
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < column.size(); i++) {
            if (column.get(i)) out.add(i);
        }
        return out;
    }

    private void checkIndex(int formulaIndex) {
        if (formulaIndex < 0 || formulaIndex >= formulas.size()) {
            throw new IndexOutOfBoundsException("No formula column " + formulaIndex + " in a table of " + formulas.size());
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(" | ", headers())).append('\n');
        for (List<Boolean> row : toRows()) {
            sb.append(String.join(" | ", row.stream().map(v -> v ? "T" : "F").toList())).append('\n');
        }
        return sb.toString();
    }
}
