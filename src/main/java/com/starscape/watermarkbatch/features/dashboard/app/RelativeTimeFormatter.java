package com.starscape.watermarkbatch.features.dashboard.app;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Human wording for how long ago something happened, e.g. "5 minutes ago".
 * Anything older than a week is shown as a date.
 */
final class RelativeTimeFormatter {
    
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    
    private RelativeTimeFormatter() {
    }
    
    static String format(Instant time, Instant now) {
        long seconds = Duration.between(time, now).getSeconds();
        
        if (seconds < 60) {
            return "Just now";
        }
        if (seconds < 3_600) {
            return plural(seconds / 60, "minute");
        }
        if (seconds < 86_400) {
            return plural(seconds / 3_600, "hour");
        }
        if (seconds < 604_800) {
            return plural(seconds / 86_400, "day");
        }
        return DATE.format(time);
    }
    
    private static String plural(long amount, String unit) {
        return amount + " " + unit + (amount > 1 ? "s" : "") + " ago";
    }
}
