package io.storvix.core.artifact;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

final class PdfReportRenderer {
    private static final float MARGIN = 40f;
    private static final float TITLE_SIZE = 16f;
    private static final float BODY_SIZE = 10f;
    private static final float LEADING = 14f;

    private final PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

    byte[] render(ReportDocument report) throws IOException {
        List<Line> lines = new ArrayList<>();
        lines.add(new Line(report.title(), bold, TITLE_SIZE));
        lines.add(new Line("Generated at " + DateTimeFormatter.ISO_INSTANT.format(report.generatedAt()), regular, BODY_SIZE));
        if (!report.sections().isEmpty()) {
            lines.add(new Line("Sections included: " + String.join(", ", report.sections()), regular, BODY_SIZE));
        }
        lines.add(new Line("", regular, BODY_SIZE));
        lines.add(new Line(String.join(" | ", report.headers()), bold, BODY_SIZE));
        for (List<String> row : report.rows()) {
            lines.add(new Line(String.join(" | ", row), regular, BODY_SIZE));
        }
        if (report.rows().isEmpty()) {
            lines.add(new Line("No systems matched this report.", regular, BODY_SIZE));
        }

        try (PDDocument document = new PDDocument()) {
            PDPageContentStream stream = null;
            float y = 0;
            try {
                for (Line line : lines) {
                    if (stream == null || y - LEADING < MARGIN) {
                        if (stream != null) {
                            stream.close();
                        }
                        PDPage page = new PDPage(PDRectangle.A4);
                        document.addPage(page);
                        stream = new PDPageContentStream(document, page);
                        y = page.getMediaBox().getHeight() - MARGIN;
                    }
                    y -= line.size() > BODY_SIZE ? LEADING * 1.5f : LEADING;
                    stream.beginText();
                    stream.setFont(line.font(), line.size());
                    stream.newLineAtOffset(MARGIN, y);
                    stream.showText(printable(line.text()));
                    stream.endText();
                }
            } finally {
                if (stream != null) {
                    stream.close();
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    // standard 14 fonts only encode WinAnsi
    private static String printable(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            out.append(c >= 0x20 && c <= 0xFF ? c : '?');
        }
        return out.toString();
    }

    private record Line(String text, PDType1Font font, float size) {
    }
}
