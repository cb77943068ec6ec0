package com.example.barshift.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Turns free-text notes such as "doesn't work Monday" or "up to 3 shifts" into a
 * {@link WorkerConstraint}.
 * <p>
 * Each line is checked against the rules in priority order and only the first matching rule
 * is applied. Lines matched by more than one rule are reported back as ambiguous.
 */
@Component
public class ConstraintTextParser {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintTextParser.class);

    private static final String DOESNT_WORK = "doesn't work";
    private static final String CANNOT_WORK = "cannot work";
    private static final String CAN_ONLY_WORK = "can only work";
    private static final String UP_TO = "up to";
    private static final String SHIFTS = "shifts";
    private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+or\\s+", Pattern.CASE_INSENSITIVE);

    private final List<Rule> rules = List.of(
            new Rule("restricted day", line -> line.contains(DOESNT_WORK),
                    line -> remainder(line, DOESNT_WORK).map(ConstraintUpdate.RestrictDay::new)),
            new Rule("restricted shift", line -> line.contains(CANNOT_WORK),
                    line -> remainder(line, CANNOT_WORK).map(ConstraintUpdate.RestrictShift::new)),
            new Rule("allowed shifts", line -> line.contains(CAN_ONLY_WORK),
                    line -> remainder(line, CAN_ONLY_WORK).map(this::allowedShifts)),
            new Rule("max shifts", line -> line.contains(UP_TO) && line.contains(SHIFTS),
                    line -> Optional.of(maxShifts(line)))
    );

    public ParsedConstraints parse(String text) {
        WorkerConstraint constraint = WorkerConstraint.defaults();
        List<String> ambiguous = new ArrayList<>();
        List<String> ignored = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return new ParsedConstraints(constraint, ambiguous, ignored);
        }
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.replace('’', '\'').trim();
            if (line.isEmpty()) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            List<Rule> matching = rules.stream().filter(r -> r.matches(lower)).toList();
            if (matching.isEmpty()) {
                ignored.add(line);
                continue;
            }
            if (matching.size() > 1) {
                logger.warn("Ambiguous constraint line, applying '{}' rule: {}", matching.get(0).name(), line);
                ambiguous.add(line);
            }
            Optional<ConstraintUpdate> update = matching.get(0).extract().apply(line);
            if (update.isPresent()) {
                constraint = update.get().applyTo(constraint);
            } else {
                ignored.add(line);
            }
        }
        return new ParsedConstraints(constraint, ambiguous, ignored);
    }

    private ConstraintUpdate allowedShifts(String remainder) {
        List<String> shifts = Arrays.stream(LIST_SEPARATOR.split(remainder))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return new ConstraintUpdate.AllowShifts(shifts);
    }

    private ConstraintUpdate maxShifts(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        int from = lower.indexOf(UP_TO) + UP_TO.length();
        int to = lower.indexOf(SHIFTS, from);
        if (to < 0) {
            logger.warn("No max shift count in '{}', using {}", line, WorkerConstraint.DEFAULT_MAX_SHIFTS);
            return new ConstraintUpdate.MaxShifts(WorkerConstraint.DEFAULT_MAX_SHIFTS);
        }
        String token = line.substring(from, to).trim();
        try {
            int value = Integer.parseInt(token);
            if (value > 0) {
                return new ConstraintUpdate.MaxShifts(value);
            }
            logger.warn("Max shift count must be positive, got {}, using {}", value, WorkerConstraint.DEFAULT_MAX_SHIFTS);
        } catch (NumberFormatException e) {
            logger.warn("Unparsable max shift count '{}', using {}", token, WorkerConstraint.DEFAULT_MAX_SHIFTS);
        }
        return new ConstraintUpdate.MaxShifts(WorkerConstraint.DEFAULT_MAX_SHIFTS);
    }

    private static Optional<String> remainder(String line, String keyword) {
        int at = line.toLowerCase(Locale.ROOT).indexOf(keyword);
        String rest = line.substring(at + keyword.length()).trim();
        while (rest.endsWith(".") || rest.endsWith(";")) {
            rest = rest.substring(0, rest.length() - 1).trim();
        }
        return rest.isEmpty() ? Optional.empty() : Optional.of(rest);
    }

    private record Rule(String name,
                        Predicate<String> matcher,
                        Function<String, Optional<ConstraintUpdate>> extract) {
        boolean matches(String lowerCaseLine) {
            return matcher.test(lowerCaseLine);
        }
    }

    /**
     * @param constraint     the record built from all recognised lines
     * @param ambiguousLines lines that matched more than one rule
     * @param ignoredLines   lines no rule could use
     */
    public record ParsedConstraints(WorkerConstraint constraint,
                                    List<String> ambiguousLines,
                                    List<String> ignoredLines) {
        public ParsedConstraints {
            ambiguousLines = List.copyOf(ambiguousLines);
            ignoredLines = List.copyOf(ignoredLines);
        }
    }
}
