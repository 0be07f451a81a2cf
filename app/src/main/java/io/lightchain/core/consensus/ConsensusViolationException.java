package io.lightchain.core.consensus;

/** Header that breaks a consensus rule: bad linkage, wrong bits, insufficient work or an unexpected id. */
public class ConsensusViolationException extends IllegalArgumentException {
    public ConsensusViolationException(String message) {
        super(message);
    }
}
