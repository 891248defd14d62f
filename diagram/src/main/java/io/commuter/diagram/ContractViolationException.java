package io.commuter.diagram;

public class ContractViolationException extends CommutativeDiagramException {

    public ContractViolationException(String message) {
        super(message);
    }

    @Override
    public CommutativeDiagramError kind() {
        return CommutativeDiagramError.CONTRACT_VIOLATION;
    }
}
