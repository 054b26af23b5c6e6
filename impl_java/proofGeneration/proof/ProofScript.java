package proofGeneration.proof;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import prop.formula.Formula;
import prop.parser.FormulaSyntaxException;
import prop.parser.Parser;

/**
 * Reads a hand-written proof from plain text:
 * <pre>
 * # Modus Ponens
 * premise: P
 * premise: P -> Q
 * goal: Q
 * 1. P ; Premise
 * 2. P -> Q ; Premise
 * 3. Q ; MP 1,2
 * </pre>
 * Blank lines and lines starting with {@code #} are skipped. The reader only checks the layout;
 * whether the proof is correct is up to {@link ProofValidator}.
 */
public class ProofScript {
    private static final Pattern HEADER = Pattern.compile("(premise|goal)\\s*:\\s*(.*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE = Pattern.compile("(\\d+)\\s*\\.\\s*([^;]*);\\s*(.*)");
    private static final Pattern RULE = Pattern.compile("(.*?)\\s+(\\d+(?:\\s*,\\s*\\d+)*)");

    private final Parser parser;

    public ProofScript() {
        this(new Parser());
    }

    public ProofScript(Parser parser) {
        this.parser = parser;
    }

    public Proof read(String text) {
        return read(new StringReader(text));
    }

    public Proof read(Reader source) {
        List<Formula> premises = new ArrayList<>();
        List<ProofLine> lines = new ArrayList<>();
        Formula goal = null;
        int lineNumber = 0;
        try (BufferedReader reader = new BufferedReader(source)) {
            String raw;
            while ((raw = reader.readLine()) != null) {
                lineNumber++;
                String text = raw.strip();
                if (text.isEmpty() || text.startsWith("#")) continue;

                Matcher header = HEADER.matcher(text);
                if (header.matches()) {
                    Formula formula = formula(lineNumber, header.group(2));
                    if (header.group(1).equalsIgnoreCase("goal")) {
                        if (goal != null) {
                            throw new ProofScriptException(lineNumber, "the goal is given twice");
                        }
                        goal = formula;
                    } else {
                        premises.add(formula);
                    }
                    continue;
                }
                Matcher line = LINE.matcher(text);
                if (!line.matches()) {
                    throw new ProofScriptException(lineNumber,
                            "expected 'premise:', 'goal:' or '<n>. <formula> ; <justification>' but found '" + text + "'");
                }
                lines.add(new ProofLine(Integer.parseInt(line.group(1)), formula(lineNumber, line.group(2)),
                        justification(lineNumber, line.group(3).strip())));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (goal == null) {
            throw new ProofScriptException(lineNumber, "the script has no 'goal:' line");
        }
        return new Proof(premises, goal, lines);
    }

    private Formula formula(int lineNumber, String text) {
        try {
            return parser.parse(text);
        } catch (FormulaSyntaxException e) {
            throw new ProofScriptException(lineNumber, e.getMessage(), e);
        }
    }

    private static Justification justification(int lineNumber, String text) {
        if (text.equalsIgnoreCase("premise")) {
            return Justification.premise();
        }
        if (text.isEmpty()) {
            throw new ProofScriptException(lineNumber, "missing justification");
        }
        Matcher rule = RULE.matcher(text);
        if (!rule.matches()) {
            return new Justification.ByRule(text, List.of());
        }
        List<Integer> refs = new ArrayList<>();
        for (String ref : rule.group(2).split(",")) {
            refs.add(Integer.parseInt(ref.strip()));
        }
        return new Justification.ByRule(rule.group(1), refs);
    }
}
