package au.org.ala.pixels.codec;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Download file names of the form {@code pixels-edited-2024-05-01T09-30-15.png}: an ISO-8601 UTC
 * timestamp to the second, with the colons replaced so the name is valid on every file system.
 */
public final class ExportFileNames {

    public static final String DEFAULT_PREFIX = "pixels-edited-";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss");

    private ExportFileNames() {
    }

    public static String timestamped(String prefix, ExportFormat format, Clock clock) {
        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        return prefix + TIMESTAMP.format(now) + "." + format.extension();
    }

    public static String timestamped(ExportFormat format) {
        return timestamped(DEFAULT_PREFIX, format, Clock.systemUTC());
    }
}
