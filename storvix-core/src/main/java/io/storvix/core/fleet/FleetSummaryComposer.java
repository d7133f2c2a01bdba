package io.storvix.core.fleet;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jsoup.nodes.Entities;

/**
 * Composes the "Systems Status Summary" mail body: a count per {@link HealthBucket} followed by
 * one line per system, most severe first. Systems not seen within the look-back window are left out.
 */
public final class FleetSummaryComposer implements SummaryComposer {
    private static final Duration WINDOW = Duration.ofDays(21);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("MMM d, yyyy HH:mm", Locale.US)
        .withZone(ZoneOffset.UTC);

    private final FleetInventory inventory;
    private final Clock clock;

    public FleetSummaryComposer(FleetInventory inventory, Clock clock) {
        this.inventory = inventory;
        this.clock = clock;
    }

    @Override
    public String compose(List<String> companies) throws IOException {
        Instant now = clock.instant();
        Instant cutoff = now.minus(WINDOW);
        Set<String> wanted = companies == null ? Set.of() : companies.stream()
            .filter(company -> company != null && !company.isBlank())
            .map(company -> company.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

        Map<HealthBucket, List<StorageSystem>> buckets = new EnumMap<>(HealthBucket.class);
        for (HealthBucket bucket : HealthBucket.values()) {
            buckets.put(bucket, new ArrayList<>());
        }
        int total = 0;
        for (StorageSystem system : inventory.systems()) {
            if (system.lastSeenAt() == null || system.lastSeenAt().isBefore(cutoff)) {
                continue;
            }
            if (!wanted.isEmpty() && !wanted.contains(system.company().toLowerCase(Locale.ROOT))) {
                continue;
            }
            buckets.get(HealthBucket.classify(system, now)).add(system);
            total++;
        }

        StringBuilder html = new StringBuilder();
        html.append("<div class=\"email-body\" style=\"font-family:Arial,Helvetica,sans-serif;color:#333\">");
        html.append("<p><strong>Systems Status Summary</strong><br>Generated ")
            .append(STAMP.format(now)).append(" UTC, ")
            .append(total).append(" systems reporting in the last ").append(WINDOW.toDays()).append(" days</p>");
        html.append("<table class=\"summary-table\">");
        for (HealthBucket bucket : HealthBucket.values()) {
            html.append("<tr><td style=\"color:").append(bucket.color()).append("\">")
                .append(bucket.label()).append("</td><td>").append(buckets.get(bucket).size()).append("</td></tr>");
        }
        html.append("</table>");

        for (HealthBucket bucket : HealthBucket.values()) {
            List<StorageSystem> systems = buckets.get(bucket);
            if (systems.isEmpty()) {
                continue;
            }
            systems.sort(Comparator.comparingDouble(StorageSystem::usedPercent).reversed());
            html.append("<h3 style=\"color:").append(bucket.color()).append("\">").append(bucket.label()).append("</h3>");
            for (StorageSystem system : systems) {
                html.append("<p>")
                    .append(escape(system.company())).append(" ")
                    .append(escape(system.name()))
                    .append(system.unitId().isEmpty() ? "" : " (" + escape(system.unitId()) + ")")
                    .append(": ").append(String.format(Locale.ROOT, "%.1f", system.usedPercent())).append("% used")
                    .append(", last seen ").append(STAMP.format(system.lastSeenAt()))
                    .append("</p>");
            }
        }
        html.append("</div>");
        return html.toString();
    }

    private static String escape(String value) {
        return Entities.escape(value);
    }
}
