package in.addwise.domain.model;

public record EngineWarning(WarningType type, String candidateId, String message) {

    @Override
    public String toString() {
        return type + (candidateId != null ? "[" + candidateId + "]" : "") + ": " + message;
    }
}
