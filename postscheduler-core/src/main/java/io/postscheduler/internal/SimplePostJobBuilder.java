package io.postscheduler.internal;

import io.postscheduler.PostJobBuilder;
import io.postscheduler.core.PostJobSpec;
import io.postscheduler.core.Recurrence;
import io.postscheduler.exception.JobValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link PostJobBuilder} implementation.
 *
 * <p>Free-text snapshot fields are trimmed and truncated to the column sizes the dashboard uses.
 */
public class SimplePostJobBuilder implements PostJobBuilder {

    static final int MAX_DISPLAY_NAME = 100;
    static final int MAX_FOLDER_PATH = 500;
    static final int MAX_LOCATION = 200;

    private final String listingRef;
    private final Function<PostJobSpec, String> persister;
    private final Clock clock;

    private Profile profile;
    private LocalDateTime runAt;
    private Recurrence recurrence = Recurrence.NONE;

    public SimplePostJobBuilder(String listingRef, Profile profile, Function<PostJobSpec, String> persister, Clock clock) {
        this.listingRef = listingRef;
        this.profile = profile;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public PostJobBuilder profile(Profile profile) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        return this;
    }

    @Override
    public PostJobBuilder at(LocalDateTime time) {
        this.runAt = Objects.requireNonNull(time, "time must not be null");
        return this;
    }

    @Override
    public PostJobBuilder recurrence(Recurrence recurrence) {
        this.recurrence = Objects.requireNonNull(recurrence, "recurrence must not be null");
        return this;
    }

    @Override
    public PostJobBuilder recurrence(String recurrence) {
        this.recurrence = Recurrence.fromValue(recurrence);
        return this;
    }

    @Override
    public PostJobSpec build() {
        List<String> missing = new ArrayList<>(4);
        if (isBlank(listingRef)) {
            missing.add("listingRef");
        }
        if (profile == null || isBlank(profile.profileRef())) {
            missing.add("profileRef");
        }
        if (profile == null || isBlank(profile.displayName())) {
            missing.add("profileDisplayName");
        }
        if (runAt == null) {
            missing.add("scheduledAt");
        }
        if (!missing.isEmpty()) {
            throw new JobValidationException("Missing required fields: " + String.join(", ", missing));
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (!runAt.isAfter(now)) {
            throw new JobValidationException("Scheduled time must be in the future: " + runAt + " (now " + now + ")");
        }

        return new PostJobSpec(
                listingRef.trim(),
                profile.profileRef().trim(),
                truncate(profile.displayName(), MAX_DISPLAY_NAME),
                truncate(profile.folderPath(), MAX_FOLDER_PATH),
                truncate(profile.location(), MAX_LOCATION),
                runAt,
                runAt,
                recurrence,
                null
        );
    }

    @Override
    public String save() {
        return persister.apply(build());
    }

    static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        String s = value.trim();
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
