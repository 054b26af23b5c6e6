package prop;

import java.util.List;
import java.util.function.Supplier;
import proofGeneration.proof.Proof;
import proofGeneration.proof.ProofLine;
import proofGeneration.proof.ProofValidator;
import proofGeneration.proof.ValidationResult;
import proofGeneration.search.CancellationToken;
import proofGeneration.search.ProofSearchEngine;
import proofGeneration.search.SearchLimits;
import prop.formula.Formula;
import prop.parser.Parser;
import truthTable.Table;
import truthTable.TruthTableGenerator;

/**
 * Entry point for front ends: parse formulas, tabulate them, search for proofs and check proofs.
 * <p>
 * The engine keeps no state between calls beyond its configuration and is safe to share between
 * threads. Each proof search runs on a fresh {@link ProofSearchEngine} that is closed afterwards.
 */
public class LogicEngine {
    private final Parser parser;
    private final TruthTableGenerator tableGenerator;
    private final ProofValidator validator;
    private final Supplier<ProofSearchEngine> searchEngines;

    public LogicEngine() {
        this(new Parser(), new TruthTableGenerator(), ProofSearchEngine::new);
    }

    public LogicEngine(Parser parser, TruthTableGenerator tableGenerator, Supplier<ProofSearchEngine> searchEngines) {
        this.parser = parser;
        this.tableGenerator = tableGenerator;
        this.validator = new ProofValidator();
        this.searchEngines = searchEngines;
    }

    public Formula parseFormula(String text) {
        return parser.parse(text);
    }

    public Table generateTruthTable(List<Formula> formulas) {
        return tableGenerator.generate(formulas);
    }

    /**
     * @param strict reject formulas whose variable sets differ
     * @throws truthTable.MixedVariableSetException in strict mode when the variable sets differ
     */
    public Table generateTruthTable(List<Formula> formulas, boolean strict) {
        return tableGenerator.generate(formulas, strict);
    }

    public Proof deriveProof(List<Formula> premises, Formula goal, SearchLimits limits) {
        return deriveProof(premises, goal, limits, CancellationToken.none());
    }

    /**
     * @throws proofGeneration.search.NoProofFoundException if no proof turns up within the limits
     */
    public Proof deriveProof(List<Formula> premises, Formula goal, SearchLimits limits, CancellationToken token) {
        try (ProofSearchEngine engine = searchEngines.get()) {
            return engine.derive(premises, goal, limits, token);
        }
    }

    public ValidationResult validateProof(List<Formula> premises, Formula goal, List<ProofLine> lines) {
        return validator.validate(premises, goal, lines);
    }

    public ValidationResult validateProof(Proof proof) {
        return validator.validate(proof);
    }
}
