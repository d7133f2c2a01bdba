package io.storvix.core.artifact;

import io.storvix.core.fleet.FleetInventory;
import io.storvix.core.fleet.HealthBucket;
import io.storvix.core.fleet.StorageSystem;
import io.storvix.core.schedule.ReportFormat;
import io.storvix.core.schedule.ReportPayload;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Default {@link ArtifactProducer} over the fleet inventory. Sections select column groups
 * ({@code capacity}, {@code health}, {@code status}); unknown or no sections render all of them.
 */
public final class FleetReportProducer implements ArtifactProducer {
    private static final List<String> KNOWN_SECTIONS = List.of("capacity", "health", "status");

    private final FleetInventory inventory;
    private final Clock clock;
    private final PdfReportRenderer pdf = new PdfReportRenderer();
    private final XlsxReportRenderer xlsx = new XlsxReportRenderer();

    public FleetReportProducer(FleetInventory inventory, Clock clock) {
        this.inventory = inventory;
        this.clock = clock;
    }

    @Override
    public Artifact produce(String target, List<String> sections, ReportFormat format) throws ArtifactProductionException {
        if (target == null || target.isBlank()) {
            throw new ArtifactProductionException("report target is required");
        }
        if (format == null) {
            throw new ArtifactProductionException("report format is required");
        }
        boolean aggregate = ReportPayload.ALL_SYSTEMS.equals(target);
        List<StorageSystem> systems;
        try {
            if (aggregate) {
                systems = inventory.systems();
            } else {
                systems = inventory.findByHost(target)
                    .map(List::of)
                    .orElseThrow(() -> new ArtifactProductionException("unknown host: " + target));
            }
        } catch (IOException e) {
            throw new ArtifactProductionException("fleet inventory unavailable", e);
        }

        ReportDocument document = document(target, aggregate, sections == null ? List.of() : sections, systems);
        String filename = (aggregate ? "report" : target + "-report") + "." + format.extension();
        try {
            byte[] content = switch (format) {
                case PDF -> pdf.render(document);
                case XLSX -> xlsx.render(document);
            };
            return new Artifact(content, filename, format.mimeType());
        } catch (IOException | RuntimeException e) {
            throw new ArtifactProductionException("failed to render " + filename, e);
        }
    }

    private ReportDocument document(String target, boolean aggregate, List<String> sections, List<StorageSystem> systems) {
        Instant now = clock.instant();
        List<String> selected = sections.stream()
            .map(section -> section.trim().toLowerCase(Locale.ROOT))
            .filter(KNOWN_SECTIONS::contains)
            .distinct()
            .toList();
        if (selected.isEmpty()) {
            selected = KNOWN_SECTIONS;
        }

        List<String> headers = new ArrayList<>(List.of("Host", "Name", "Company"));
        if (selected.contains("capacity")) {
            headers.addAll(List.of("Capacity TB", "Used TB", "Used %"));
        }
        if (selected.contains("health")) {
            headers.add("Health score");
        }
        if (selected.contains("status")) {
            headers.add("Status");
        }

        List<List<String>> rows = new ArrayList<>();
        for (StorageSystem system : systems) {
            List<String> row = new ArrayList<>(List.of(system.hostId(), system.name(), system.company()));
            if (selected.contains("capacity")) {
                row.add(decimal(system.capacityTb()));
                row.add(decimal(system.usedTb()));
                row.add(decimal(system.usedPercent()));
            }
            if (selected.contains("health")) {
                row.add(system.healthScore() == null ? "n/a" : decimal(system.healthScore()));
            }
            if (selected.contains("status")) {
                row.add(HealthBucket.classify(system, now).label());
            }
            rows.add(row);
        }

        String title = aggregate ? "Aggregated report for all systems" : "Report for host: " + target;
        return new ReportDocument(title, now, sections, headers, rows);
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
