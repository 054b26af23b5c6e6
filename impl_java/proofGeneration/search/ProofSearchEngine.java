package proofGeneration.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proofGeneration.Heuristics;
import proofGeneration.proof.Justification;
import proofGeneration.proof.Proof;
import proofGeneration.proof.ProofLine;
import proofGeneration.rules.InferenceRule;
import proofGeneration.rules.RuleApplication;
import proofGeneration.rules.RuleCatalog;
import prop.formula.Formula;

/**
 * Forward-chaining best-first proof search.
 * <p>
 * The known set starts with the premises. Each step takes the best candidates off the frontier,
 * adds them to the known set and applies every rule with one of them as an antecedent and the
 * other antecedents drawn from the known set. The search stops as soon as the goal becomes known
 * and rebuilds the proof from the recorded rule applications, so every returned proof is valid
 * by construction.
 * <p>
 * The search is bounded, not complete: it gives up when {@link SearchLimits} are reached, even
 * for goals that do follow from the premises. Conclusion variables that a rule leaves open
 * (Addition's new disjunct) are only instantiated with sub-formulas of the goal.
 */
public class ProofSearchEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProofSearchEngine.class);

    private final List<InferenceRule> rules;
    private final Heuristics.Heuristic heuristic;
    private final ExecutorService executor;
    private final int poolSize;
    private final int drainSize;

    public ProofSearchEngine() {
        this(new Heuristics.GoalDistance(), 1);
    }

    public ProofSearchEngine(Heuristics.Heuristic heuristic, int poolSize) {
        this(RuleCatalog.all(), heuristic, poolSize);
    }

    /**
     * @param poolSize worker threads used to expand a batch; 1 keeps the whole search on the caller's thread
     */
    public ProofSearchEngine(List<InferenceRule> rules, Heuristics.Heuristic heuristic, int poolSize) {
        this.rules = List.copyOf(rules);
        this.heuristic = heuristic;
        this.poolSize = Math.max(1, poolSize);
        this.executor = this.poolSize > 1 ? Executors.newFixedThreadPool(this.poolSize) : null;
        this.drainSize = heuristic.getDrainSize() == -1 ? this.poolSize : Math.max(1, heuristic.getDrainSize());
    }

    public Proof derive(List<Formula> premises, Formula goal, SearchLimits limits) {
        return derive(premises, goal, limits, CancellationToken.none());
    }

    public Proof derive(List<Formula> premises, Formula goal, SearchLimits limits, CancellationToken token) {
        logger.debug("Searching for {} from {} premises using {}", goal, premises.size(), heuristic.getName());
        Search search = new Search(new ArrayList<>(new LinkedHashSet<>(premises)), goal, limits, token);
        Proof proof = search.run();
        logger.info("Found a proof of {} with {} lines after {} rule applications", goal, proof.size(), search.applied);
        return proof;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private final class Search {
        private final List<Formula> premises;
        private final Formula goal;
        private final SearchLimits limits;
        private final CancellationToken token;
        private final int maxFormulaSize;
        private final Map<Formula, Integer> goalProfile;
        private final List<Formula> choices;
        private final KnownSet known = new KnownSet();
        private final PriorityBlockingQueue<Candidate> frontier;
        private final Set<Formula> queued = new HashSet<>();
        private long nextId = 0;
        private int applied = 0;

        Search(List<Formula> premises, Formula goal, SearchLimits limits, CancellationToken token) {
            this.premises = premises;
            this.goal = goal;
            this.limits = limits;
            this.token = token;
            this.maxFormulaSize = limits.effectiveMaxFormulaSize(premises, goal);
            this.goalProfile = profile(goal);
            this.choices = List.copyOf(new LinkedHashSet<>(goal.subformulas()));
            this.frontier = new PriorityBlockingQueue<>(11, heuristic);
        }

        Proof run() {
            List<Candidate> accepted = new ArrayList<>();
            for (Formula premise : premises) {
                Candidate candidate = new Candidate(premise, null, 0, overlap(premise), nextId++);
                known.insert(candidate);
                accepted.add(candidate);
            }
            if (known.contains(goal)) {
                return reconstruct();
            }
            if (known.size() >= limits.maxKnownSetSize()) {
                throw exhausted(NoProofFoundException.Reason.SEARCH_EXHAUSTED);
            }
            expand(accepted);
            while (true) {
                if (token.isCancelled()) {
                    throw exhausted(NoProofFoundException.Reason.CANCELLED);
                }
                if (limits.deadlinePassed()) {
                    throw exhausted(NoProofFoundException.Reason.DEADLINE_EXCEEDED);
                }
                if (frontier.isEmpty() || applied >= limits.maxDepth()) {
                    throw exhausted(NoProofFoundException.Reason.SEARCH_EXHAUSTED);
                }
                List<Candidate> batch = new ArrayList<>(drainSize);
                frontier.drainTo(batch, drainSize);
                accepted = new ArrayList<>(batch.size());
                for (Candidate candidate : batch) {
                    queued.remove(candidate.formula());
                    if (!known.insert(candidate)) continue;
                    applied++;
                    accepted.add(candidate);
                    if (logger.isTraceEnabled()) {
                        logger.trace("Known #{}: {}", known.size(), candidate.application());
                    }
                    if (candidate.formula().equals(goal)) {
                        return reconstruct();
                    }
                    if (applied >= limits.maxDepth() || known.size() >= limits.maxKnownSetSize()) {
                        throw exhausted(NoProofFoundException.Reason.SEARCH_EXHAUSTED);
                    }
                }
                expand(accepted);
            }
        }

        private NoProofFoundException exhausted(NoProofFoundException.Reason reason) {
            logger.debug("Giving up on {}: {} after {} rule applications, {} known, {} queued",
                    goal, reason, applied, known.size(), frontier.size());
            return new NoProofFoundException(reason, applied, known.size());
        }

        // Results are merged in batch order whatever order the workers finish in
        private void expand(List<Candidate> fresh) {
            if (fresh.isEmpty()) return;
            List<Formula> snapshot = known.snapshot();
            List<List<RuleApplication>> results = new ArrayList<>(fresh.size());
            if (executor == null || fresh.size() == 1) {
                for (Candidate candidate : fresh) {
                    results.add(consequences(candidate.formula(), snapshot));
                }
            } else {
                var futures = new ArrayList<CompletableFuture<List<RuleApplication>>>(fresh.size());
                for (Candidate candidate : fresh) {
                    futures.add(CompletableFuture.supplyAsync(() -> consequences(candidate.formula(), snapshot), executor));
                }
                for (var future : futures) {
                    try {
                        results.add(future.get());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw exhausted(NoProofFoundException.Reason.CANCELLED);
                    } catch (ExecutionException e) {
                        throw new IllegalStateException("Rule expansion failed", e.getCause());
                    }
                }
            }
            for (List<RuleApplication> applications : results) {
                for (RuleApplication application : applications) {
                    Formula conclusion = application.conclusion();
                    if (known.contains(conclusion) || !queued.add(conclusion)) continue;
                    int depth = 1 + application.antecedents().stream()
                            .mapToInt(a -> known.get(a).depth())
                            .max().orElse(0);
                    frontier.add(new Candidate(conclusion, application, depth, overlap(conclusion), nextId++));
                }
            }
        }

        private List<RuleApplication> consequences(Formula fresh, List<Formula> snapshot) {
            List<RuleApplication> out = new ArrayList<>();
            for (InferenceRule rule : rules) {
                for (RuleApplication application : rule.applyWith(fresh, snapshot, choices)) {
                    Formula conclusion = application.conclusion();
                    if (conclusion.size() <= maxFormulaSize && !known.contains(conclusion)) {
                        out.add(application);
                    }
                }
            }
            return out;
        }

        private Map<Formula, Integer> profile(Formula formula) {
            Map<Formula, Integer> counts = new HashMap<>();
            for (Formula sub : formula.subformulas()) {
                counts.merge(sub, 1, Integer::sum);
            }
            return counts;
        }

        private int overlap(Formula formula) {
            int total = 0;
            for (var entry : profile(formula).entrySet()) {
                total += Math.min(entry.getValue(), goalProfile.getOrDefault(entry.getKey(), 0));
            }
            return total;
        }

        // Premises first, with a premise goal moved last, then the derived lines the goal needs
        // in the order they became known
        private Proof reconstruct() {
            List<Candidate> derived = new ArrayList<>();
            collect(known.get(goal), new HashSet<>(), derived);
            derived.sort(Comparator.comparingLong(Candidate::id));

            List<ProofLine> lines = new ArrayList<>();
            Map<Formula, Integer> lineOf = new HashMap<>();
            List<Formula> premiseOrder = new ArrayList<>(premises);
            if (premiseOrder.remove(goal)) {
                premiseOrder.add(goal);
            }
            for (Formula premise : premiseOrder) {
                lines.add(new ProofLine(lines.size() + 1, premise, Justification.premise()));
                lineOf.put(premise, lines.size());
            }
            for (Candidate candidate : derived) {
                RuleApplication application = candidate.application();
                List<Integer> refs = application.antecedents().stream().map(lineOf::get).toList();
                lines.add(new ProofLine(lines.size() + 1, candidate.formula(),
                        new Justification.ByRule(application.rule().getName(), refs)));
                lineOf.put(candidate.formula(), lines.size());
            }
            return new Proof(premises, goal, lines);
        }

        private void collect(Candidate candidate, Set<Formula> visited, List<Candidate> out) {
            if (candidate.isPremise() || !visited.add(candidate.formula())) return;
            for (Formula antecedent : candidate.application().antecedents()) {
                collect(known.get(antecedent), visited, out);
            }
            out.add(candidate);
        }
    }
}
