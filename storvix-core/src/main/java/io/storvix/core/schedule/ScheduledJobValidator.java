package io.storvix.core.schedule;

/**
 * Checks the shape of a job record before it is persisted and after it is read back.
 * Throws {@link InvalidScheduleException} with a message naming the first offending field.
 */
public final class ScheduledJobValidator {

    private ScheduledJobValidator() {
    }

    public static ScheduledJob validate(ScheduledJob job) {
        if (job == null) {
            throw new InvalidScheduleException("job must not be null");
        }
        if (job.id() == null || job.id().isBlank()) {
            throw new InvalidScheduleException("id is required");
        }
        if (job.owner() == null) {
            throw new InvalidScheduleException("owner is required");
        }
        if (job.createdAt() == null) {
            throw new InvalidScheduleException("createdAt is required");
        }
        if (job.firstRunAt() == null) {
            throw new InvalidScheduleException("firstRunAt is required");
        }
        validateTiming(job.frequency(), job.customInterval());
        validatePayload(job.payload());
        return job;
    }

    public static void validateTiming(Frequency frequency, Double customInterval) {
        if (frequency == null) {
            throw new InvalidScheduleException("frequency is required");
        }
        if (frequency == Frequency.CUSTOM && CustomInterval.toDuration(customInterval).isEmpty()) {
            throw new InvalidScheduleException("customInterval must be a positive number up to " + CustomInterval.MAX_VALUE + " when frequency is custom");
        }
    }

    public static void validatePayload(JobPayload payload) {
        if (payload instanceof ReportPayload report) {
            if (report.target().isBlank()) {
                throw new InvalidScheduleException("report target is required");
            }
            if (report.format() == null) {
                throw new InvalidScheduleException("report format must be one of pdf, xlsx");
            }
            return;
        }
        if (payload instanceof MailPayload mail) {
            if (mail.recipients().stream().allMatch(recipient -> recipient == null || recipient.isBlank())) {
                throw new InvalidScheduleException("at least one mail recipient is required");
            }
            if (mail.attachReport() && (mail.target().isBlank() || mail.format() == null)) {
                throw new InvalidScheduleException("attached report needs a target and a format");
            }
            return;
        }
        throw new InvalidScheduleException("payload is required");
    }
}
