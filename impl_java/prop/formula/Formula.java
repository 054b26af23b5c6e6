package prop.formula;

import java.util.List;
import java.util.Set;
import prop.Substitution;

/**
 * An immutable propositional formula. Every operation is implemented by each variant, so a new
 * connective cannot be added without revisiting all of them.
 */
public sealed interface Formula permits Variable, Not, BinaryFormula {

    /**
     * Replace every variable bound in the substitution by its binding. Used to instantiate rule
     * schemata; variables without a binding are left untouched.
     */
    Formula applySub(Substitution substitution);

    /**
     * Get the variables of the formula.
     * @return variable names in left-to-right first-occurrence order
     */
    Set<String> variables();

    /**
     * Evaluate the formula under an assignment.
     * @throws UnboundVariableException if the assignment has no value for a variable of the formula
     */
    boolean evaluate(Assignment assignment);

    /**
     * Deterministic serialization with symbolic operators and the fewest parentheses the
     * grammar needs. Parsing the result yields an equal formula.
     */
    String toCanonicalString();

    /**
     * Binding strength of the top-level connective, atoms bind tightest.
     */
    int precedence();

    /**
     * Number of nodes in the tree.
     */
    int size();

    /**
     * All sub-formulas in pre-order, including this formula.
     */
    List<Formula> subformulas();
}
