package com.groundwave.zettelkasten.io;

import com.groundwave.zettelkasten.error.RenderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders Org-mode content to an HTML fragment.
 *
 * Covers the subset used in the notes: headlines, paragraphs, plain lists,
 * tables, src/example/quote blocks, inline emphasis and links. Org-roam id links
 * become {@code <a href="{basePath}/{id}">label</a>}; links leaving the site are
 * prefixed with {@link #EXTERNAL_LINK_PREFIX}. Property drawers, keyword lines
 * and comments are not rendered.
 */
@Component
@Slf4j
public class OrgHtmlRenderer {

    public static final String DEFAULT_BASE_PATH = "/zk";
    public static final String EXTERNAL_LINK_PREFIX = "🗗 ";

    private static final List<String> INTERNAL_LINK_PREFIXES = List.of("/zk", "/note", "/home", "/groundwave");

    private static final Pattern DRAWER_START = Pattern.compile("^\\s*:(PROPERTIES|LOGBOOK):\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DRAWER_END = Pattern.compile("^\\s*:END:\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_START = Pattern.compile("^\\s*#\\+BEGIN_(\\w+)(?:\\s+(.*))?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern KEYWORD = Pattern.compile("^\\s*#\\+\\w+:.*$");
    private static final Pattern COMMENT = Pattern.compile("^\\s*#(\\s.*)?$");
    private static final Pattern HEADLINE = Pattern.compile("^(\\*+)\\s+(.*?)(?:\\s+(:[\\w@#%:]+:))?\\s*$");
    private static final Pattern LIST_ITEM = Pattern.compile("^(\\s*)([-+]|\\d+[.)])\\s+(.*)$");
    private static final Pattern TABLE_ROW = Pattern.compile("^\\s*\\|.*$");
    private static final Pattern TABLE_RULE = Pattern.compile("^\\s*\\|[-+|\\s]*$");
    private static final Pattern HORIZONTAL_RULE = Pattern.compile("^\\s*-{5,}\\s*$");
    private static final Pattern LINK = Pattern.compile("\\[\\[([^\\]]+)\\](?:\\[([^\\]]+)\\])?\\]");

    private static final String EMPHASIS_PRE = "(^|[\\s('\"{])";
    private static final String EMPHASIS_POST = "(?=$|[\\s\\-.,:;!?'\")}\\[])";
    private static final Pattern VERBATIM = emphasis("=");
    private static final Pattern CODE = emphasis("~");
    private static final Pattern BOLD = emphasis("\\*");
    private static final Pattern ITALIC = emphasis("/");
    private static final Pattern UNDERLINE = emphasis("_");
    private static final Pattern STRIKE = emphasis("\\+");

    private final String siteBaseUrl;

    public OrgHtmlRenderer(@Value("${groundwave.zk.site-base-url:}") String siteBaseUrl) {
        this.siteBaseUrl = siteBaseUrl == null ? "" : siteBaseUrl.trim().replaceAll("/+$", "");
    }

    /**
     * Render with id links pointing at {@value #DEFAULT_BASE_PATH}.
     */
    public String render(String content) throws RenderException {
        return render(content, DEFAULT_BASE_PATH);
    }

    /**
     * Render with id links pointing at {@code basePath}.
     *
     * @throws RenderException if the content is not text
     */
    public String render(String content, String basePath) throws RenderException {
        if (content == null) {
            throw new RenderException("No org-mode content to render");
        }
        if (content.indexOf('\u0000') >= 0) {
            throw new RenderException("Org-mode content contains binary data");
        }

        String base = basePath == null ? "" : basePath.trim().replaceAll("/+$", "");
        if (base.isEmpty()) {
            base = DEFAULT_BASE_PATH;
        }

        List<String> lines = content.lines().toList();
        StringBuilder html = new StringBuilder();
        renderLines(lines, 0, lines.size(), base, html);
        return html.toString();
    }

    private void renderLines(List<String> lines, int from, int to, String base, StringBuilder html) {
        List<String> paragraph = new ArrayList<>();
        int i = from;

        while (i < to) {
            String line = lines.get(i);

            if (line.isBlank()) {
                flushParagraph(paragraph, base, html);
                i++;
                continue;
            }

            if (DRAWER_START.matcher(line).matches()) {
                flushParagraph(paragraph, base, html);
                i = skipDrawer(lines, i + 1, to);
                continue;
            }

            Matcher blockMatcher = BLOCK_START.matcher(line);
            if (blockMatcher.matches()) {
                flushParagraph(paragraph, base, html);
                i = renderBlock(lines, i, to, blockMatcher.group(1), blockMatcher.group(2), base, html);
                continue;
            }

            if (KEYWORD.matcher(line).matches() || COMMENT.matcher(line).matches()) {
                flushParagraph(paragraph, base, html);
                i++;
                continue;
            }

            Matcher headlineMatcher = HEADLINE.matcher(line);
            if (headlineMatcher.matches()) {
                flushParagraph(paragraph, base, html);
                int level = Math.min(headlineMatcher.group(1).length() + 1, 6);
                html.append("<h").append(level).append(">")
                    .append(renderInline(headlineMatcher.group(2), base))
                    .append("</h").append(level).append(">\n");
                i++;
                continue;
            }

            if (HORIZONTAL_RULE.matcher(line).matches()) {
                flushParagraph(paragraph, base, html);
                html.append("<hr>\n");
                i++;
                continue;
            }

            if (TABLE_ROW.matcher(line).matches()) {
                flushParagraph(paragraph, base, html);
                i = renderTable(lines, i, to, base, html);
                continue;
            }

            if (LIST_ITEM.matcher(line).matches()) {
                flushParagraph(paragraph, base, html);
                i = renderList(lines, i, to, base, html);
                continue;
            }

            paragraph.add(line.trim());
            i++;
        }

        flushParagraph(paragraph, base, html);
    }

    private int skipDrawer(List<String> lines, int from, int to) {
        for (int i = from; i < to; i++) {
            if (DRAWER_END.matcher(lines.get(i)).matches()) {
                return i + 1;
            }
        }
        return to;
    }

    private int renderBlock(List<String> lines, int start, int to, String type, String parameters,
                            String base, StringBuilder html) {
        Pattern endPattern = Pattern.compile("^\\s*#\\+END_" + Pattern.quote(type) + "\\s*$", Pattern.CASE_INSENSITIVE);
        int end = start + 1;
        while (end < to && !endPattern.matcher(lines.get(end)).matches()) {
            end++;
        }

        String blockType = type.toLowerCase(Locale.ROOT);
        if ("src".equals(blockType)) {
            html.append("<pre><code class=\"code-block\"");
            String language = parameters == null ? "" : parameters.trim().split("\\s+")[0];
            if (!language.isEmpty()) {
                html.append(" data-lang=\"").append(escapeHtml(language)).append("\"");
            }
            html.append(">").append(escapeHtml(joinRaw(lines, start + 1, end))).append("</code></pre>\n");
        } else if ("example".equals(blockType)) {
            html.append("<pre class=\"example\">").append(escapeHtml(joinRaw(lines, start + 1, end))).append("</pre>\n");
        } else if ("quote".equals(blockType)) {
            html.append("<blockquote>\n");
            renderLines(lines, start + 1, end, base, html);
            html.append("</blockquote>\n");
        } else {
            html.append("<div class=\"").append(escapeHtml(blockType)).append("\">\n");
            renderLines(lines, start + 1, end, base, html);
            html.append("</div>\n");
        }

        // an unterminated block runs to the end of the content
        return Math.min(end + 1, to);
    }

    private int renderTable(List<String> lines, int start, int to, String base, StringBuilder html) {
        List<List<String>> rows = new ArrayList<>();
        int headerRows = 0;
        int i = start;

        while (i < to && TABLE_ROW.matcher(lines.get(i)).matches()) {
            String line = lines.get(i);
            if (TABLE_RULE.matcher(line).matches()) {
                if (headerRows == 0 && !rows.isEmpty()) {
                    headerRows = rows.size();
                }
            } else {
                rows.add(splitCells(line));
            }
            i++;
        }

        html.append("<table>\n");
        for (int r = 0; r < rows.size(); r++) {
            String cellTag = r < headerRows ? "th" : "td";
            html.append("<tr>");
            for (String cell : rows.get(r)) {
                html.append("<").append(cellTag).append(">")
                    .append(renderInline(cell, base))
                    .append("</").append(cellTag).append(">");
            }
            html.append("</tr>\n");
        }
        html.append("</table>\n");
        return i;
    }

    private List<String> splitCells(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("|")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.endsWith("|")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }

        List<String> cells = new ArrayList<>();
        for (String cell : trimmed.split("\\|", -1)) {
            cells.add(cell.trim());
        }
        return cells;
    }

    private int renderList(List<String> lines, int start, int to, String base, StringBuilder html) {
        Matcher first = LIST_ITEM.matcher(lines.get(start));
        first.matches();
        int indent = first.group(1).length();
        boolean ordered = Character.isDigit(first.group(2).charAt(0));
        String listTag = ordered ? "ol" : "ul";

        html.append("<").append(listTag).append(">\n");

        int i = start;
        while (i < to) {
            Matcher itemMatcher = LIST_ITEM.matcher(lines.get(i));
            if (!itemMatcher.matches() || itemMatcher.group(1).length() != indent) {
                break;
            }

            StringBuilder itemText = new StringBuilder(itemMatcher.group(3).trim());
            i++;

            // continuation lines and nested lists are indented past the bullet
            StringBuilder nested = new StringBuilder();
            while (i < to) {
                String next = lines.get(i);
                if (next.isBlank() || leadingSpaces(next) <= indent) {
                    break;
                }
                Matcher nestedMatcher = LIST_ITEM.matcher(next);
                if (nestedMatcher.matches()) {
                    i = renderList(lines, i, to, base, nested);
                } else {
                    itemText.append("\n").append(next.trim());
                    i++;
                }
            }

            html.append("<li>").append(renderInline(itemText.toString(), base));
            if (nested.length() > 0) {
                html.append("\n").append(nested);
            }
            html.append("</li>\n");
        }

        html.append("</").append(listTag).append(">\n");
        return i;
    }

    private void flushParagraph(List<String> paragraph, String base, StringBuilder html) {
        if (paragraph.isEmpty()) {
            return;
        }
        html.append("<p>").append(renderInline(String.join("\n", paragraph), base)).append("</p>\n");
        paragraph.clear();
    }

    /**
     * Render links and emphasis within a single block of text.
     */
    String renderInline(String text, String base) {
        StringBuilder html = new StringBuilder();
        Matcher linkMatcher = LINK.matcher(text);
        int last = 0;

        while (linkMatcher.find()) {
            html.append(renderEmphasis(escapeHtml(text.substring(last, linkMatcher.start()))));
            html.append(renderLink(linkMatcher.group(1), linkMatcher.group(2), base));
            last = linkMatcher.end();
        }
        html.append(renderEmphasis(escapeHtml(text.substring(last))));
        return html.toString();
    }

    private String renderLink(String target, String description, String base) {
        String href;
        String label;

        if (target.regionMatches(true, 0, "id:", 0, 3)) {
            String id = target.substring(3).trim();
            href = base + "/" + id.toLowerCase(Locale.ROOT);
            label = description != null ? description : id;
        } else {
            href = target.trim();
            label = description != null ? description : href;
        }

        String prefix = isExternalLink(href) ? EXTERNAL_LINK_PREFIX : "";
        return "<a href=\"" + escapeHtml(href) + "\">" + prefix + escapeHtml(label) + "</a>";
    }

    /**
     * A link leaves the site unless it is a fragment, an internal route, or under the site base URL.
     */
    boolean isExternalLink(String href) {
        String trimmed = href == null ? "" : href.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return false;
        }

        for (String prefix : INTERNAL_LINK_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return false;
            }
        }

        return !isSiteLink(trimmed);
    }

    private boolean isSiteLink(String href) {
        if (siteBaseUrl.isEmpty()) {
            return false;
        }
        if (href.startsWith(siteBaseUrl)) {
            return true;
        }

        URI base = parseAbsolute(siteBaseUrl);
        URI link = parseAbsolute(href);
        if (base == null || link == null || !base.getHost().equalsIgnoreCase(link.getHost())) {
            return false;
        }

        String basePath = base.getPath() == null ? "" : base.getPath().replaceAll("/+$", "");
        if (basePath.isEmpty()) {
            return true;
        }
        String linkPath = link.getPath() == null ? "" : link.getPath();
        return linkPath.equals(basePath) || linkPath.startsWith(basePath + "/");
    }

    private static URI parseAbsolute(String raw) {
        try {
            URI uri = new URI(raw);
            if (uri.getHost() == null) {
                uri = new URI("https://" + raw);
            }
            return uri.getHost() == null ? null : uri;
        } catch (Exception e) {
            return null;
        }
    }

    private static String renderEmphasis(String escaped) {
        String html = VERBATIM.matcher(escaped).replaceAll("$1<code class=\"verbatim\">$2</code>");
        html = CODE.matcher(html).replaceAll("$1<code class=\"inline-code\">$2</code>");
        html = BOLD.matcher(html).replaceAll("$1<b>$2</b>");
        html = ITALIC.matcher(html).replaceAll("$1<i>$2</i>");
        html = UNDERLINE.matcher(html).replaceAll("$1<u>$2</u>");
        html = STRIKE.matcher(html).replaceAll("$1<del>$2</del>");
        return html;
    }

    private static Pattern emphasis(String marker) {
        String body = "([^\\s" + marker + "](?:[^" + marker + "\\n]*?[^\\s" + marker + "])?)";
        return Pattern.compile(EMPHASIS_PRE + marker + body + marker + EMPHASIS_POST);
    }

    private static String joinRaw(List<String> lines, int from, int to) {
        return String.join("\n", lines.subList(from, Math.max(from, to)));
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }
        return count;
    }

    static String escapeHtml(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '&') {
                escaped.append("&amp;");
            } else if (c == '<') {
                escaped.append("&lt;");
            } else if (c == '>') {
                escaped.append("&gt;");
            } else if (c == '"') {
                escaped.append("&#34;");
            } else if (c == '\'') {
                escaped.append("&#39;");
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
