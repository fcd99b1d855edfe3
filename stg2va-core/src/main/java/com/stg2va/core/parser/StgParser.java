package com.stg2va.core.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stg2va.core.error.MalformedGraphException;
import com.stg2va.core.model.Direction;
import com.stg2va.core.model.Marking;
import com.stg2va.core.model.PetriNet;
import com.stg2va.core.model.Place;
import com.stg2va.core.model.Signal;
import com.stg2va.core.model.SignalRole;
import com.stg2va.core.model.Transition;
import com.stg2va.core.model.TransitionLabel;

/**
 * Parses the {@code .g} (astg) text format into a {@link PetriNet}.
 *
 * <h2>Format</h2>
 * <pre>{@code
 * .model handshake
 * .inputs req
 * .outputs ack
 * .graph
 * req+ ack+
 * ack+ req-
 * req- ack-
 * ack- req+
 * .marking { <ack-,req+> }
 * .end
 * }</pre>
 *
 * <p>A graph line names a source node followed by its successors. A token whose base name is a
 * declared signal is a transition ({@code req+}, {@code req+/2}); a token whose base name is a
 * declared dummy is a dummy transition; anything else is a place. A direct transition-to-transition
 * arc goes through an implicit place named {@code <from,to>}.
 *
 * <p>A place counts as declared when it heads an arc line of its own. Any defect aborts parsing
 * with a {@link MalformedGraphException}; no partial net is ever returned.
 */
public class StgParser {

    private static final Logger log = LoggerFactory.getLogger(StgParser.class);

    private static final Pattern NODE = Pattern.compile("([A-Za-z_][A-Za-z_0-9.]*)([+~-])?(/[0-9]+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z_0-9.]*");
    private static final Pattern MARKING_ENTRY = Pattern.compile("(<[^>]*>|[^\\s{}=<]+)(?:\\s*=\\s*([0-9]+))?");

    private static final String COMMENT = "#";

    /**
     * Parses a {@code .g} file.
     *
     * @param path source file
     * @return parsed net
     * @throws IOException if the file cannot be read
     * @throws MalformedGraphException if the content is not a well-formed STG
     */
    public PetriNet parse(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        log.debug("Reading STG from: {}", path);
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Parses {@code .g} text.
     *
     * @param source STG text
     * @return parsed net
     * @throws MalformedGraphException if the content is not a well-formed STG
     */
    public PetriNet parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        ParseState state = new ParseState();
        state.readSections(source);
        PetriNet net = state.build();
        log.info("Parsed STG '{}': {} signals, {} places, {} transitions",
            net.name(), net.signals().size(), net.places().size(), net.transitions().size());
        return net;
    }

    /**
     * A source line kept with its 1-based number.
     */
    private record SourceLine(int number, String text) {}

    /**
     * Mutable working state of one parse run.
     */
    private static final class ParseState {

        private String modelName;
        private final Map<String, Signal> signals = new LinkedHashMap<>();
        private final List<SourceLine> graphLines = new ArrayList<>();
        private final List<SourceLine> markingLines = new ArrayList<>();
        private final List<SourceLine> capacityLines = new ArrayList<>();

        private final Map<String, Integer> placeIndex = new LinkedHashMap<>();
        private final List<Place> places = new ArrayList<>();
        private final Map<String, Integer> transitionIndex = new LinkedHashMap<>();
        private final List<TransitionBuilder> transitions = new ArrayList<>();

        void readSections(String source) {
            String[] lines = source.split("\\R", -1);
            boolean inGraph = false;
            boolean ended = false;
            boolean sawGraph = false;

            for (int i = 0; i < lines.length; i++) {
                int number = i + 1;
                String text = stripComment(lines[i]).trim();
                if (text.isEmpty()) {
                    continue;
                }
                if (ended) {
                    throw new MalformedGraphException(number, firstWord(text), "Content after .end");
                }
                if (!text.startsWith(".")) {
                    if (!inGraph) {
                        throw new MalformedGraphException(number, firstWord(text),
                            "Arc line outside of the .graph section");
                    }
                    graphLines.add(new SourceLine(number, text));
                    continue;
                }

                String directive = firstWord(text);
                String rest = text.substring(directive.length()).trim();
                inGraph = false;
                switch (directive) {
                    case ".model" -> readModel(number, rest);
                    case ".inputs" -> declare(number, rest, SignalRole.INPUT);
                    case ".outputs" -> declare(number, rest, SignalRole.OUTPUT);
                    case ".internal" -> declare(number, rest, SignalRole.INTERNAL);
                    case ".dummy" -> declare(number, rest, SignalRole.DUMMY);
                    case ".graph" -> {
                        inGraph = true;
                        sawGraph = true;
                    }
                    case ".marking" -> markingLines.add(new SourceLine(number, rest));
                    case ".capacity" -> capacityLines.add(new SourceLine(number, rest));
                    case ".end" -> ended = true;
                    default -> throw new MalformedGraphException(number, directive, "Unknown directive");
                }
            }

            int lastLine = lines.length;
            if (modelName == null) {
                throw new MalformedGraphException(lastLine, null, "Missing .model declaration");
            }
            if (!sawGraph) {
                throw new MalformedGraphException(lastLine, null, "No .graph section was found");
            }
            if (!ended) {
                throw new MalformedGraphException(lastLine, null, "Missing .end");
            }
            if (signals.values().stream().noneMatch(signal -> signal.role().isPhysical())) {
                throw new MalformedGraphException(lastLine, modelName,
                    "No input, output or internal signals are declared");
            }
            if (graphLines.isEmpty()) {
                throw new MalformedGraphException(lastLine, modelName, "The .graph section has no arcs");
            }
        }

        private void readModel(int number, String rest) {
            if (modelName != null) {
                throw new MalformedGraphException(number, rest, "Duplicate .model declaration");
            }
            if (!IDENTIFIER.matcher(rest).matches()) {
                throw new MalformedGraphException(number, rest, "Invalid model name");
            }
            modelName = rest;
        }

        private void declare(int number, String rest, SignalRole role) {
            if (rest.isEmpty()) {
                throw new MalformedGraphException(number, null, "Empty signal declaration");
            }
            for (String name : rest.split("\\s+")) {
                if (!IDENTIFIER.matcher(name).matches()) {
                    throw new MalformedGraphException(number, name, "Invalid signal name");
                }
                if (signals.containsKey(name)) {
                    throw new MalformedGraphException(number, name,
                        "Duplicated signal (already declared as " + signals.get(name).role() + ")");
                }
                signals.put(name, new Signal(name, role));
            }
        }

        PetriNet build() {
            Set<String> declaredPlaces = collectDeclaredPlaces();

            for (SourceLine line : graphLines) {
                String[] tokens = line.text().split("\\s+");
                if (tokens.length < 2) {
                    throw new MalformedGraphException(line.number(), tokens[0], "Arc line has no successor");
                }
                Node from = resolve(line.number(), tokens[0], declaredPlaces);
                for (int k = 1; k < tokens.length; k++) {
                    Node to = resolve(line.number(), tokens[k], declaredPlaces);
                    connect(line.number(), from, to);
                }
            }

            Marking initial = readMarking();
            readCapacity();

            List<Transition> built = transitions.stream()
                .map(TransitionBuilder::build)
                .toList();
            for (Signal signal : signals.values()) {
                boolean used = built.stream().anyMatch(t -> t.label().signal().equals(signal.name()));
                if (!used) {
                    log.warn("Signal '{}' is declared but has no transitions", signal.name());
                }
            }
            return new PetriNet(modelName, List.copyOf(signals.values()), places, built, initial);
        }

        private Set<String> collectDeclaredPlaces() {
            Set<String> declared = new HashSet<>();
            for (SourceLine line : graphLines) {
                String head = line.text().split("\\s+")[0];
                Matcher matcher = NODE.matcher(head);
                if (matcher.matches() && !signals.containsKey(matcher.group(1))) {
                    declared.add(head);
                }
            }
            return declared;
        }

        private Node resolve(int number, String token, Set<String> declaredPlaces) {
            Matcher matcher = NODE.matcher(token);
            if (!matcher.matches()) {
                throw new MalformedGraphException(number, token, "Invalid place or transition name");
            }
            String base = matcher.group(1);
            String edge = matcher.group(2);
            String instance = matcher.group(3);
            Signal signal = signals.get(base);

            if (signal == null) {
                if (edge != null || instance != null) {
                    throw new MalformedGraphException(number, token,
                        "Transition refers to undeclared signal '" + base + "'");
                }
                if (!declaredPlaces.contains(token)) {
                    throw new MalformedGraphException(number, token,
                        "Place is referenced but never declared (it has no arc line of its own)");
                }
                return new Node(false, place(token, false));
            }

            TransitionLabel label;
            if (signal.role() == SignalRole.DUMMY) {
                if (edge != null) {
                    throw new MalformedGraphException(number, token, "Dummy transition must not carry an edge");
                }
                label = new TransitionLabel(base, Direction.TOGGLE);
            } else {
                if (edge == null) {
                    throw new MalformedGraphException(number, token,
                        "Transition of signal '" + base + "' has no direction (+, - or ~)");
                }
                label = new TransitionLabel(base, Direction.fromSymbol(edge.charAt(0)));
            }
            return new Node(true, transition(token, label));
        }

        private void connect(int number, Node from, Node to) {
            if (!from.transition() && !to.transition()) {
                throw new MalformedGraphException(number, places.get(to.index()).name(),
                    "Arc from place " + places.get(from.index()).name() + " to a place");
            }
            if (from.transition() && to.transition()) {
                TransitionBuilder source = transitions.get(from.index());
                TransitionBuilder target = transitions.get(to.index());
                int implicit = place("<" + source.name + "," + target.name + ">", true);
                source.outputs.add(implicit);
                target.inputs.add(implicit);
            } else if (from.transition()) {
                transitions.get(from.index()).outputs.add(to.index());
            } else {
                transitions.get(to.index()).inputs.add(from.index());
            }
        }

        private int place(String name, boolean implicit) {
            Integer existing = placeIndex.get(name);
            if (existing != null) {
                return existing;
            }
            int index = places.size();
            places.add(new Place(index, name, implicit));
            placeIndex.put(name, index);
            return index;
        }

        private int transition(String name, TransitionLabel label) {
            Integer existing = transitionIndex.get(name);
            if (existing != null) {
                return existing;
            }
            int index = transitions.size();
            transitions.add(new TransitionBuilder(index, name, label));
            transitionIndex.put(name, index);
            return index;
        }

        private Marking readMarking() {
            Set<Integer> marked = new LinkedHashSet<>();
            Set<String> seen = new HashSet<>();
            for (SourceLine line : markingLines) {
                String body = braceBody(line);
                Matcher matcher = MARKING_ENTRY.matcher(body);
                while (matcher.find()) {
                    String name = normalizePlaceName(matcher.group(1));
                    int value = parseValue(line.number(), name, matcher.group(2));
                    if (!seen.add(name)) {
                        throw new MalformedGraphException(line.number(), name, "Duplicated marking");
                    }
                    Integer index = placeIndex.get(name);
                    if (index == null) {
                        throw new MalformedGraphException(line.number(), name, "Marking names an unknown place");
                    }
                    if (value > 1) {
                        throw new MalformedGraphException(line.number(), name,
                            "Marking of " + value + " tokens violates 1-safety");
                    }
                    if (value == 1) {
                        marked.add(index);
                    }
                }
            }
            if (marked.isEmpty()) {
                log.warn("Initial marking is empty; the net cannot fire");
            }
            return Marking.of(marked);
        }

        private void readCapacity() {
            for (SourceLine line : capacityLines) {
                Matcher matcher = MARKING_ENTRY.matcher(line.text());
                while (matcher.find()) {
                    String name = normalizePlaceName(matcher.group(1));
                    if (!placeIndex.containsKey(name)) {
                        throw new MalformedGraphException(line.number(), name, "Capacity names an unknown place");
                    }
                    int capacity = parseValue(line.number(), name, matcher.group(2));
                    if (capacity != 1) {
                        throw new MalformedGraphException(line.number(), name,
                            "Only 1-safe nets are supported; capacity must be 1");
                    }
                }
            }
        }

        private static String braceBody(SourceLine line) {
            String text = line.text();
            int open = text.indexOf('{');
            int close = text.lastIndexOf('}');
            if (open != 0 || close < open) {
                throw new MalformedGraphException(line.number(), text, "Marking must be enclosed in { }");
            }
            return text.substring(open + 1, close);
        }

        private static int parseValue(int number, String name, String value) {
            if (value == null) {
                return 1;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new MalformedGraphException(number, name, "Invalid token count '" + value + "'");
            }
        }

        private static String normalizePlaceName(String raw) {
            return raw.startsWith("<") ? raw.replaceAll("\\s+", "") : raw;
        }

        private static String stripComment(String line) {
            int hash = line.indexOf(COMMENT);
            return hash < 0 ? line : line.substring(0, hash);
        }

        private static String firstWord(String text) {
            int space = text.indexOf(' ');
            int tab = text.indexOf('\t');
            int end = text.length();
            if (space >= 0) {
                end = space;
            }
            if (tab >= 0 && tab < end) {
                end = tab;
            }
            return text.substring(0, end);
        }
    }

    /**
     * A resolved graph token: either a transition or a place arena index.
     */
    private record Node(boolean transition, int index) {}

    private static final class TransitionBuilder {
        private final int index;
        private final String name;
        private final TransitionLabel label;
        private final Set<Integer> inputs = new LinkedHashSet<>();
        private final Set<Integer> outputs = new LinkedHashSet<>();

        TransitionBuilder(int index, String name, TransitionLabel label) {
            this.index = index;
            this.name = name;
            this.label = label;
        }

        Transition build() {
            return new Transition(index, name, label, List.copyOf(inputs), List.copyOf(outputs));
        }
    }
}
