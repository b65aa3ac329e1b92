package com.codematch.core.error;

import java.util.List;

/**
 * Thrown when a direct verification request yields several contracts and the caller
 * did not say which one to verify.
 */
public class AmbiguousContractException extends CodematchException {

    /**
     * One selectable contract.
     *
     * @param index        value to pass back as the chosen contract
     * @param name         contract name
     * @param compiledPath source path of the contract
     */
    public record Choice(int index, String name, String compiledPath) {}

    private final List<Choice> choices;

    public AmbiguousContractException(List<Choice> choices) {
        super(ErrorKind.INVALID_REQUEST,
                "Detected %d contracts (%s), but can only verify 1 at a time. Please choose a main contract and try again."
                        .formatted(choices.size(),
                                String.join(", ", choices.stream().map(Choice::name).toList())));
        this.choices = List.copyOf(choices);
    }

    public List<Choice> getChoices() {
        return choices;
    }
}
