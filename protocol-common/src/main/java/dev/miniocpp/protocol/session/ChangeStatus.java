package dev.miniocpp.protocol.session;

public enum ChangeStatus {

    ACCEPTED("Accepted"),
    REJECTED("Rejected");

    private final String wireName;

    ChangeStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
