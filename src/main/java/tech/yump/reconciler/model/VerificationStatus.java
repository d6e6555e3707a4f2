package tech.yump.reconciler.model;

public enum VerificationStatus {
    PASS("Pass"),
    FAIL("Fail"),
    PENDING("Pending");

    private final String label;

    VerificationStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
