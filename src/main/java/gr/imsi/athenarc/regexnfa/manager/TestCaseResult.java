package gr.imsi.athenarc.regexnfa.manager;

public class TestCaseResult {
    private final String input;
    private final boolean accepted;

    public TestCaseResult(String input, boolean accepted) {
        this.input = input;
        this.accepted = accepted;
    }

    public String getInput() {
        return input;
    }

    public boolean isAccepted() {
        return accepted;
    }

    public String getVerdict() {
        return accepted ? "Accepted" : "Rejected";
    }

    @Override
    public String toString() {
        return input + ": " + getVerdict();
    }
}
