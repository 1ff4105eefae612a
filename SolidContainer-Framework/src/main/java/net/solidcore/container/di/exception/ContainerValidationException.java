package net.solidcore.container.di.exception;

import lombok.Getter;

import java.util.List;

/**
 * Collects every problem found while validating the registrations of a container.
 */
@Getter
public class ContainerValidationException extends ServiceResolutionException {

    private final List<String> problems;

    public ContainerValidationException(List<String> problems) {
        super("Container validation failed with " + problems.size() + " problem(s):\n - "
                + String.join("\n - ", problems));
        this.problems = List.copyOf(problems);
    }
}
