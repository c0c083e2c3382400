package cobol.mapper.analysis;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cobol.mapper.config.AnalyzerConfig;
import cobol.mapper.config.NamingRules;
import cobol.mapper.model.CallEdge;
import cobol.mapper.model.EdgeKind;
import cobol.mapper.model.ExitKind;
import cobol.mapper.model.ExitRecord;
import cobol.mapper.model.InteractionKind;
import cobol.mapper.model.InteractionPoint;
import cobol.mapper.model.Names;
import cobol.mapper.model.Paragraph;
import cobol.mapper.model.ReservedWords;
import cobol.mapper.structure.ParagraphIndex;
import cobol.mapper.structure.ProgramStructure;

/**
 * Scans paragraph bodies for control transfers, exits and CICS interactions.
 * <p>
 * Recognized statements:
 * <ul>
 *   <li>{@code GO TO a [b ...] [DEPENDING ON x]}</li>
 *   <li>{@code PERFORM a} and {@code PERFORM a THRU|THROUGH b}; inline PERFORMs, including a bare
 *   {@code PERFORM ... END-PERFORM} block, are skipped and their bodies scanned</li>
 *   <li>{@code STOP RUN}, {@code GOBACK}</li>
 *   <li>{@code EXEC CICS XCTL | RETURN | ABEND | LINK | START | SEND MAP | RECEIVE MAP ... END-EXEC}</li>
 *   <li>{@code CALL 'literal'}</li>
 * </ul>
 * Other EXEC blocks (SQL, DLI) are skipped whole. Every occurrence is recorded.
 */
public final class InteractionAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(InteractionAnalyzer.class);

    private final NamingRules rules;
    private final String fallbackSuffix;

    public InteractionAnalyzer(AnalyzerConfig config) {
        Objects.requireNonNull(config, "config");
        this.rules = config.namingRules();
        this.fallbackSuffix = config.targetFallbackSuffix();
    }

    public AnalysisResult analyze(ProgramStructure structure) {
        Objects.requireNonNull(structure, "structure");

        final Scan scan = new Scan(structure.index());
        for (Paragraph p : structure.paragraphs()) {
            scan.paragraph(p.name(), Tokenizer.tokenize(p.body()));
        }

        final List<String> entryPoints = entryPoints(structure, scan.edges);
        final AnalysisStats stats = stats(structure, scan);

        log.debug("{}: {} edge(s), {} exit(s), {} interaction(s), {} suppressed, {} unresolved",
                structure.unit(), scan.edges.size(), scan.exits.size(), scan.interactions.size(),
                scan.suppressed, stats.unresolvedEdges());
        return new AnalysisResult(structure, scan.edges, scan.exits, scan.interactions, entryPoints, stats);
    }

    /**
     * First paragraph always; then every paragraph no resolved bound points at.
     */
    static List<String> entryPoints(ProgramStructure structure, List<CallEdge> edges) {
        final Set<String> inbound = new HashSet<>();
        for (CallEdge e : edges) {
            if (e.targetResolved()) inbound.add(e.target());
            if (e.terminalResolved()) inbound.add(e.terminal());
        }
        final List<String> out = new ArrayList<>();
        final List<Paragraph> paragraphs = structure.paragraphs();
        for (int i = 0; i < paragraphs.size(); i++) {
            final String name = paragraphs.get(i).name();
            if (i == 0 || !inbound.contains(name)) {
                out.add(name);
            }
        }
        return out;
    }

    private static AnalysisStats stats(ProgramStructure structure, Scan scan) {
        final Map<EdgeKind, Integer> edgeCounts = new EnumMap<>(EdgeKind.class);
        int unresolved = 0;
        for (CallEdge e : scan.edges) {
            edgeCounts.merge(e.kind(), 1, Integer::sum);
            if (!e.resolved()) unresolved++;
        }
        final Map<ExitKind, Integer> exitCounts = new EnumMap<>(ExitKind.class);
        for (ExitRecord x : scan.exits) {
            exitCounts.merge(x.kind(), 1, Integer::sum);
        }
        return new AnalysisStats(structure.paragraphs().size(), edgeCounts, exitCounts,
                scan.suppressed, unresolved, scan.interactions.size());
    }

    /**
     * Mutable state of one unit's scan.
     */
    private final class Scan {

        private final ParagraphIndex index;
        private final List<CallEdge> edges = new ArrayList<>();
        private final List<ExitRecord> exits = new ArrayList<>();
        private final List<InteractionPoint> interactions = new ArrayList<>();
        private int suppressed;

        private String paragraph;
        private List<Token> tokens;

        Scan(ParagraphIndex index) {
            this.index = index;
        }

        void paragraph(String name, List<Token> body) {
            this.paragraph = name;
            this.tokens = body;

            int i = 0;
            while (i < tokens.size()) {
                final Token t = tokens.get(i);
                if (!t.isWord()) {
                    i++;
                    continue;
                }
                switch (t.text()) {
                    case "GO":
                        i = goTo(i);
                        break;
                    case "PERFORM":
                        i = perform(i);
                        break;
                    case "STOP":
                        if (isWord(i + 1, "RUN")) {
                            exits.add(new ExitRecord(paragraph, ExitKind.PROGRAM_END, null, "STOP RUN", t.sequence(), i));
                            i += 2;
                        } else {
                            i++;
                        }
                        break;
                    case "GOBACK":
                        exits.add(new ExitRecord(paragraph, ExitKind.PROGRAM_END, null, "GOBACK", t.sequence(), i));
                        i++;
                        break;
                    case "CALL":
                        i = call(i);
                        break;
                    case "EXEC":
                    case "EXECUTE":
                        i = exec(i);
                        break;
                    default:
                        i++;
                }
            }
        }

        // GO [TO] a b c DEPENDING ON x: several targets only with DEPENDING.
        private int goTo(int at) {
            int i = at + 1;
            if (isWord(i, "TO")) i++;

            final List<Token> names = new ArrayList<>();
            int j = i;
            while (j < tokens.size() && tokens.get(j).isWord()
                    && !tokens.get(j).text().equals("DEPENDING")
                    && Names.isIdentifier(tokens.get(j).text())) {
                names.add(tokens.get(j));
                j++;
            }
            if (names.isEmpty()) {
                return i;
            }
            if (isWord(j, "DEPENDING")) {
                for (Token n : names) {
                    addSingle(EdgeKind.GO_TO, n.text(), at);
                }
                return j + 1;
            }
            addSingle(EdgeKind.GO_TO, names.get(0).text(), at);
            return i + 1;
        }

        private int perform(int at) {
            final int i = at + 1;
            if (i >= tokens.size() || !tokens.get(i).isWord()) return i;

            final String first = tokens.get(i).text();
            // Inline form: the body starts with a statement word or the count of a TIMES phrase
            if (ReservedWords.isStatementWord(first) || isWord(i + 1, "TIMES") || !Names.isIdentifier(first)) {
                return i;
            }
            final int sequence = tokens.get(at).sequence();

            String terminal = null;
            int next = i + 1;
            if ((isWord(next, "THRU") || isWord(next, "THROUGH"))
                    && next + 1 < tokens.size() && tokens.get(next + 1).isWord()) {
                terminal = tokens.get(next + 1).text();
                next += 2;
            }

            if (rules.isTraceRoutine(first)) {
                suppressed++;
                return next;
            }
            if (terminal == null) {
                addSingle(EdgeKind.PERFORM, first, at);
            } else {
                final String target = index.resolve(first, fallbackSuffix);
                final String end = index.resolve(terminal, fallbackSuffix);
                edges.add(CallEdge.range(paragraph,
                        target != null ? target : Names.normalize(first), target != null,
                        end != null ? end : Names.normalize(terminal), end != null,
                        sequence, at));
            }
            return next;
        }

        private int call(int at) {
            final int i = at + 1;
            if (i < tokens.size() && tokens.get(i).kind() == Token.Kind.LITERAL) {
                interactions.add(new InteractionPoint(paragraph, InteractionKind.CALL,
                        Names.stripQuotes(tokens.get(i).text()), null, tokens.get(at).sequence()));
                return i + 1;
            }
            return i;
        }

        private int exec(int at) {
            int end = at + 1;
            while (end < tokens.size() && !tokens.get(end).isWord("END-EXEC")) {
                end++;
            }
            if (isWord(at + 1, "CICS") && at + 2 < end) {
                cics(tokens.get(at + 2).text(), options(at + 3, end), at);
            }
            return end + 1;
        }

        private void cics(String command, Map<String, String> options, int at) {
            final int sequence = tokens.get(at).sequence();
            switch (command) {
                case "XCTL":
                    exits.add(new ExitRecord(paragraph, ExitKind.EXTERNAL_TRANSFER, options.get("PROGRAM"), "XCTL", sequence, at));
                    break;
                case "RETURN":
                    exits.add(new ExitRecord(paragraph, ExitKind.RETURN, options.get("TRANSID"), "RETURN", sequence, at));
                    break;
                case "ABEND":
                    exits.add(new ExitRecord(paragraph, ExitKind.FORCED_STOP, options.get("ABCODE"), "ABEND", sequence, at));
                    break;
                case "LINK":
                    interactions.add(new InteractionPoint(paragraph, InteractionKind.LINK, options.get("PROGRAM"), null, sequence));
                    break;
                case "START":
                    interactions.add(new InteractionPoint(paragraph, InteractionKind.START, options.get("TRANSID"), null, sequence));
                    break;
                case "SEND":
                    if (options.containsKey("MAP")) {
                        interactions.add(new InteractionPoint(paragraph, InteractionKind.SEND_MAP,
                                options.get("MAP"), options.get("MAPSET"), sequence));
                    }
                    break;
                case "RECEIVE":
                    if (options.containsKey("MAP")) {
                        interactions.add(new InteractionPoint(paragraph, InteractionKind.RECEIVE_MAP,
                                options.get("MAP"), options.get("MAPSET"), sequence));
                    }
                    break;
                default:
                    break;
            }
        }

        /**
         * Option words of a CICS command; a value in parentheses is attached to the word before it.
         * Literal values lose their quotes, data names stay as written.
         */
        private Map<String, String> options(int from, int to) {
            final Map<String, String> out = new HashMap<>();
            int i = from;
            while (i < to) {
                final Token t = tokens.get(i);
                if (!t.isWord()) {
                    i++;
                    continue;
                }
                if (i + 1 < to && tokens.get(i + 1).kind() == Token.Kind.LPAREN) {
                    final StringBuilder value = new StringBuilder();
                    int j = i + 2;
                    while (j < to && tokens.get(j).kind() != Token.Kind.RPAREN) {
                        final Token v = tokens.get(j);
                        if (value.length() > 0) value.append(' ');
                        value.append(v.kind() == Token.Kind.LITERAL ? Names.stripQuotes(v.text()) : v.text());
                        j++;
                    }
                    out.putIfAbsent(t.text(), value.length() == 0 ? null : value.toString());
                    i = j + 1;
                } else {
                    out.putIfAbsent(t.text(), null);
                    i++;
                }
            }
            return out;
        }

        private void addSingle(EdgeKind kind, String name, int at) {
            final String resolved = index.resolve(name, fallbackSuffix);
            edges.add(CallEdge.single(paragraph, kind,
                    resolved != null ? resolved : Names.normalize(name), resolved != null,
                    tokens.get(at).sequence(), at));
        }

        private boolean isWord(int i, String word) {
            return i < tokens.size() && tokens.get(i).isWord(word);
        }
    }
}
