package com.social.violation.core.model;

/**
 * Composite result of reporting one violation.
 *
 * <p>Lets a caller tell apart "recorded and user warned", "recorded but the
 * notification was not delivered" and "failed to record". On
 * {@link RecordStatus#ERROR} the {@code action}, {@code violationCount} and
 * {@code notification} are all {@code null}.</p>
 *
 * @param recordStatus   persistence and count status
 * @param action         chosen action, {@code null} on error
 * @param detail         action message, or the error text
 * @param violationCount the user's all-time total including this violation
 * @param notification   outcome of the notification publish, {@code null} if none was attempted
 */
public record ViolationReport(
        RecordStatus recordStatus,
        EscalationAction action,
        String detail,
        Long violationCount,
        PublishOutcome notification) {

    public static ViolationReport error(String detail) {
        return new ViolationReport(RecordStatus.ERROR, null, detail, null, null);
    }

    public static ViolationReport decided(EscalationAction action, String detail, long violationCount,
                                          PublishOutcome notification) {
        return new ViolationReport(RecordStatus.RECORDED, action, detail, violationCount, notification);
    }

    public boolean isRecorded() {
        return recordStatus == RecordStatus.RECORDED;
    }

    public boolean isNotified() {
        return notification != null && notification.delivered();
    }
}
