package dumb.normcode.activate;

import java.util.List;
import java.util.stream.Collectors;

/** Aborts activation; carries every problem found, no repository is emitted. */
public class ActivationException extends RuntimeException {

    private final List<Problem> problems;

    public ActivationException(List<Problem> problems) {
        super(describe(problems));
        this.problems = List.copyOf(problems);
    }

    private static String describe(List<Problem> problems) {
        return "Activation failed with " + problems.size() + " problem(s):\n"
                + problems.stream().map(p -> "  " + p).collect(Collectors.joining("\n"));
    }

    public List<Problem> problems() {
        return problems;
    }

    public boolean has(Problem.Code code) {
        return problems.stream().anyMatch(p -> p.code() == code);
    }
}
