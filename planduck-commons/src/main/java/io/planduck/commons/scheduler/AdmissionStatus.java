package io.planduck.commons.scheduler;

public enum AdmissionStatus {
    /** A worker slot was free when the job arrived. */
    RUNNING("running"),
    /** All worker slots were busy; the job waits in the overflow queue. */
    QUEUED("queued");

    private final String label;

    AdmissionStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
