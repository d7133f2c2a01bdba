package io.storvix.core.delivery;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

public final class MailBodies {
    private static final String LINE_BREAK_MARKER = "\\n";

    private MailBodies() {
    }

    public static boolean looksLikeHtml(String body) {
        return body != null && body.contains("<") && body.contains(">");
    }

    /**
     * Flattens an HTML body into the plain-text alternative, keeping one line per block element.
     */
    public static String toPlainText(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        if (!looksLikeHtml(body)) {
            return body.trim();
        }
        Document document = Jsoup.parse(body);
        document.outputSettings().prettyPrint(false);
        document.select("br").before(LINE_BREAK_MARKER);
        document.select("p, div, li, tr, h1, h2, h3, h4, h5, h6").after(LINE_BREAK_MARKER);
        String marked = document.body().html().replace(LINE_BREAK_MARKER, "\n");
        String cleaned = Jsoup.clean(marked, "", Safelist.none(), new Document.OutputSettings().prettyPrint(false));
        String text = Parser.unescapeEntities(cleaned, false);

        StringBuilder out = new StringBuilder();
        for (String line : text.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                out.append(trimmed).append('\n');
            }
        }
        return out.toString().trim();
    }
}
