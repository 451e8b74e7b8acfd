package com.williamcallahan.cleanhtml.service.html;

import com.williamcallahan.cleanhtml.domain.html.BlockTags;
import com.williamcallahan.cleanhtml.domain.html.HtmlElement;
import com.williamcallahan.cleanhtml.domain.html.HtmlFragment;
import com.williamcallahan.cleanhtml.domain.html.HtmlNode;
import com.williamcallahan.cleanhtml.domain.html.HtmlText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes a fragment back to markup, one top-level block per line.
 *
 * <p>Output uses XML syntax ({@code <br />}), keeps non-ASCII characters as they are and
 * turns non-breaking spaces into plain spaces.
 */
public final class FragmentSerializer {

    private static final char NBSP = '\u00a0';
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("(?:\\n\\s*){2,}");
    private static final Pattern TRAILING_WHITESPACE_RUN = Pattern.compile("\\s\\s+$");

    private FragmentSerializer() {}

    /**
     * Serializes the fragment.
     *
     * @param fragment content to write
     * @return markup with a newline after each top-level block and no blank lines
     */
    public static String serialize(HtmlFragment fragment) {
        Document shell = createShell();
        List<HtmlNode> nodes = fragment.nodes();
        StringBuilder markup = new StringBuilder();
        for (int index = 0; index < nodes.size(); index++) {
            HtmlNode node = nodes.get(index);
            boolean block = isBlockElement(node);
            if (block) {
                if (markup.length() > 0 && markup.charAt(markup.length() - 1) != '\n') {
                    markup.append('\n');
                }
                markup.append(render(node, shell)).append('\n');
                continue;
            }
            if (node.isBlankText() && bordersBlock(nodes, index)) {
                continue;
            }
            markup.append(render(node, shell));
        }
        if (markup.length() > 0 && markup.charAt(markup.length() - 1) != '\n') {
            markup.append('\n');
        }
        return tidy(markup.toString());
    }

    /**
     * Serializes a single node without any line handling.
     *
     * @param node node to render
     * @return node markup
     */
    public static String render(HtmlNode node) {
        return render(node, createShell());
    }

    static String tidy(String markup) {
        String tidied = markup.replace(NBSP, ' ');
        tidied = BLANK_LINE_RUN.matcher(tidied).replaceAll("\n");
        return TRAILING_WHITESPACE_RUN.matcher(tidied).replaceAll("");
    }

    private static String render(HtmlNode node, Document shell) {
        Node rendered = toJsoup(node);
        shell.body().appendChild(rendered);
        String html = rendered.outerHtml();
        rendered.remove();
        return html;
    }

    private static Node toJsoup(HtmlNode node) {
        if (node instanceof HtmlText text) {
            return new TextNode(text.content().replace(NBSP, ' '));
        }
        HtmlElement element = (HtmlElement) node;
        Element rendered = new Element(element.tagName());
        for (Map.Entry<String, String> attribute : element.attributes().entrySet()) {
            rendered.attr(attribute.getKey(), attribute.getValue());
        }
        for (HtmlNode child : element.children()) {
            rendered.appendChild(toJsoup(child));
        }
        return rendered;
    }

    private static Document createShell() {
        Document shell = Document.createShell("");
        shell.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8)
                .prettyPrint(false);
        return shell;
    }

    private static boolean isBlockElement(HtmlNode node) {
        return node instanceof HtmlElement element && BlockTags.isBlock(element.tagName());
    }

    private static boolean bordersBlock(List<HtmlNode> nodes, int index) {
        boolean previousIsBlock = index == 0 || isBlockElement(nodes.get(index - 1));
        boolean nextIsBlock = index == nodes.size() - 1 || isBlockElement(nodes.get(index + 1));
        return previousIsBlock || nextIsBlock;
    }
}
