package prop;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import prop.formula.Formula;
import prop.formula.Variable;

public class Substitution {
    private final Map<Variable, Formula> map;

    public Substitution() {
        this.map = new LinkedHashMap<>();
    }

    private Substitution(Map<Variable, Formula> map) {
        this.map = map;
    }

    public Formula getOrDefault(Variable var, Formula defaultFormula) {
        return map.getOrDefault(var, defaultFormula);
    }

    public Optional<Formula> get(Variable var) {
        return Optional.ofNullable(map.get(var));
    }

    public boolean isBound(Variable var) {
        return map.containsKey(var);
    }

    public void put(Variable var, Formula formula) {
        map.put(var, formula);
    }

    @Override
    public String toString() {
        return map.toString();
    }

    public Substitution copy() {
        return new Substitution(new LinkedHashMap<>(map));
    }
}
