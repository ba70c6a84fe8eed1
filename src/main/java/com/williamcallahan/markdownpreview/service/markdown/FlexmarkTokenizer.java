package com.williamcallahan.markdownpreview.service.markdown;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.Emphasis;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlockBase;
import com.vladsch.flexmark.ast.HtmlEntity;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.HtmlInlineComment;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.ImageRef;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.Link;
import com.vladsch.flexmark.ast.LinkRef;
import com.vladsch.flexmark.ast.ListBlock;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.RefNode;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.StrongEmphasis;
import com.vladsch.flexmark.ast.Text;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.autolink.AutolinkExtension;
import com.vladsch.flexmark.ext.gfm.strikethrough.Strikethrough;
import com.vladsch.flexmark.ext.gfm.strikethrough.StrikethroughExtension;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableBody;
import com.vladsch.flexmark.ext.tables.TableCaption;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableHead;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.ext.tables.TableSeparator;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.ast.util.ReferenceRepository;
import com.vladsch.flexmark.util.ast.Document;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import com.vladsch.flexmark.util.misc.Extension;
import com.williamcallahan.markdownpreview.domain.markdown.MarkdownToken;
import com.williamcallahan.markdownpreview.domain.markdown.SourceMap;
import com.williamcallahan.markdownpreview.domain.markdown.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tokenizer backed by flexmark-java.
 *
 * <p>Parses markdown into a flexmark AST and flattens it into a token stream: block containers
 * become open/close token pairs carrying source maps, leaf blocks become self-contained tokens,
 * and the inline content of paragraphs, headings and table cells is nested under
 * {@link TokenType#INLINE} tokens.</p>
 */
final class FlexmarkTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(FlexmarkTokenizer.class);

    /**
     * Accepts or rejects a link destination during tokenization.
     */
    @FunctionalInterface
    interface LinkFilter {

        /**
         * @param destination destination as written, escapes resolved
         * @return normalized destination, or empty when the link must render as text
         */
        Optional<String> accept(String destination);
    }

    private record ParserKey(boolean linkify, List<Extension> extensions) {
    }

    private final Cache<ParserKey, Parser> parsers;

    FlexmarkTokenizer(int parserCacheSize) {
        this.parsers = Caffeine.newBuilder()
            .maximumSize(Math.max(1, parserCacheSize))
            .build();
    }

    /**
     * Tokenizes markdown text.
     *
     * @param text markdown body, front matter already removed
     * @param linkify detect bare URLs
     * @param extensions additional flexmark extensions registered on the adapter
     * @param links link normalization and validation
     * @return block-level token stream with zero-based body source maps
     */
    List<MarkdownToken> tokenize(String text, boolean linkify, List<Extension> extensions, LinkFilter links) {
        Parser parser = parsers.get(new ParserKey(linkify, List.copyOf(extensions)), FlexmarkTokenizer::buildParser);
        Document document = parser.parse(text);
        Conversion conversion = new Conversion(text, document, links);
        conversion.blocks(document);
        return conversion.tokens;
    }

    private static Parser buildParser(ParserKey key) {
        List<Extension> extensions = new ArrayList<>(Arrays.asList(
            TablesExtension.create(),
            StrikethroughExtension.create()
        ));
        if (key.linkify()) {
            extensions.add(AutolinkExtension.create());
        }
        extensions.addAll(key.extensions());

        MutableDataSet options = new MutableDataSet()
            .set(Parser.EXTENSIONS, extensions)
            .set(Parser.BLANK_LINES_IN_AST, false)
            .set(TablesExtension.COLUMN_SPANS, false)
            .set(TablesExtension.APPEND_MISSING_COLUMNS, true)
            .set(TablesExtension.DISCARD_EXTRA_COLUMNS, true)
            .set(TablesExtension.HEADER_SEPARATOR_COLUMN_MATCH, true);

        logger.debug("Building flexmark parser (linkify={}, extra extensions={})", key.linkify(), key.extensions().size());
        return Parser.builder(options).build();
    }

    /**
     * State of one AST-to-token conversion.
     */
    private static final class Conversion {
        private final List<MarkdownToken> tokens = new ArrayList<>();
        private final String source;
        private final ReferenceRepository references;
        private final LineIndex lines;
        private final LinkFilter links;

        Conversion(String source, Document document, LinkFilter links) {
            this.source = source;
            this.references = Parser.REFERENCES.get(document);
            this.lines = new LineIndex(source);
            this.links = links;
        }

        void blocks(Node parent) {
            for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                block(child);
            }
        }

        private void block(Node node) {
            if (node instanceof Heading heading) {
                String tag = "h" + heading.getLevel();
                MarkdownToken open = open(TokenType.HEADING_OPEN, tag, node);
                open.setMarkup(heading.isAtxHeading() ? "#".repeat(heading.getLevel()) : "");
                tokens.add(open);
                tokens.add(inlineContainer(node, heading.getText().toString(), open));
                tokens.add(close(TokenType.HEADING_CLOSE, tag));
            } else if (node instanceof Paragraph) {
                MarkdownToken open = open(TokenType.PARAGRAPH_OPEN, "p", node);
                open.setHidden(isInTightList(node));
                tokens.add(open);
                tokens.add(inlineContainer(node, childSource(node), open));
                MarkdownToken close = close(TokenType.PARAGRAPH_CLOSE, "p");
                close.setHidden(open.isHidden());
                tokens.add(close);
            } else if (node instanceof BlockQuote) {
                container(node, TokenType.BLOCKQUOTE_OPEN, TokenType.BLOCKQUOTE_CLOSE, "blockquote");
            } else if (node instanceof BulletList) {
                container(node, TokenType.BULLET_LIST_OPEN, TokenType.BULLET_LIST_CLOSE, "ul");
            } else if (node instanceof OrderedList orderedList) {
                MarkdownToken open = open(TokenType.ORDERED_LIST_OPEN, "ol", node);
                if (orderedList.getStartNumber() != 1) {
                    open.attrSet("start", String.valueOf(orderedList.getStartNumber()));
                }
                tokens.add(open);
                blocks(node);
                tokens.add(close(TokenType.ORDERED_LIST_CLOSE, "ol"));
            } else if (node instanceof ListItem) {
                container(node, TokenType.LIST_ITEM_OPEN, TokenType.LIST_ITEM_CLOSE, "li");
            } else if (node instanceof FencedCodeBlock fence) {
                MarkdownToken token = leaf(TokenType.FENCE, "code", node);
                token.setInfo(fence.getInfo().unescape());
                token.setContent(fence.getContentChars().normalizeEOL());
                token.setMarkup(fence.getOpeningMarker().toString());
                tokens.add(token);
            } else if (node instanceof IndentedCodeBlock code) {
                MarkdownToken token = leaf(TokenType.CODE_BLOCK, "code", node);
                token.setContent(code.getContentChars().normalizeEOL());
                tokens.add(token);
            } else if (node instanceof ThematicBreak) {
                MarkdownToken token = leaf(TokenType.HR, "hr", node);
                token.setMarkup(node.getChars().trim().toString());
                tokens.add(token);
            } else if (node instanceof HtmlBlockBase) {
                MarkdownToken token = leaf(TokenType.HTML_BLOCK, "", node);
                String html = node.getChars().normalizeEOL();
                token.setContent(html.endsWith("\n") ? html : html + "\n");
                tokens.add(token);
            } else if (node instanceof Reference) {
                // link reference definitions produce no output
            } else if (node instanceof TableBlock) {
                container(node, TokenType.TABLE_OPEN, TokenType.TABLE_CLOSE, "table");
            } else if (node instanceof TableHead) {
                container(node, TokenType.THEAD_OPEN, TokenType.THEAD_CLOSE, "thead");
            } else if (node instanceof TableBody) {
                container(node, TokenType.TBODY_OPEN, TokenType.TBODY_CLOSE, "tbody");
            } else if (node instanceof TableRow) {
                container(node, TokenType.TR_OPEN, TokenType.TR_CLOSE, "tr");
            } else if (node instanceof TableCell cell) {
                tableCell(cell);
            } else if (node instanceof TableSeparator || node instanceof TableCaption) {
                // separator rows and captions carry no cell content
            } else if (node.hasChildren()) {
                blocks(node);
            } else {
                logger.debug("Skipping unsupported block node {}", node.getNodeName());
            }
        }

        private void tableCell(TableCell cell) {
            boolean header = cell.isHeader();
            String tag = header ? "th" : "td";
            MarkdownToken open = open(header ? TokenType.TH_OPEN : TokenType.TD_OPEN, tag, cell);
            if (cell.getAlignment() != null) {
                open.attrSet("style", "text-align:" + cell.getAlignment().name().toLowerCase(Locale.ROOT));
            }
            tokens.add(open);
            tokens.add(inlineContainer(cell, cell.getText().trim().toString(), open));
            tokens.add(close(header ? TokenType.TH_CLOSE : TokenType.TD_CLOSE, tag));
        }

        private void container(Node node, TokenType openType, TokenType closeType, String tag) {
            tokens.add(open(openType, tag, node));
            blocks(node);
            tokens.add(close(closeType, tag));
        }

        private MarkdownToken open(TokenType type, String tag, Node node) {
            MarkdownToken token = new MarkdownToken(type, tag, 1);
            token.setBlock(true);
            token.setSourceMap(sourceMap(node));
            return token;
        }

        private MarkdownToken leaf(TokenType type, String tag, Node node) {
            MarkdownToken token = new MarkdownToken(type, tag, 0);
            token.setBlock(true);
            token.setSourceMap(sourceMap(node));
            return token;
        }

        private static MarkdownToken close(TokenType type, String tag) {
            MarkdownToken token = new MarkdownToken(type, tag, -1);
            token.setBlock(true);
            return token;
        }

        private MarkdownToken inlineContainer(Node node, String content, MarkdownToken owner) {
            MarkdownToken inline = new MarkdownToken(TokenType.INLINE, "", 0);
            inline.setContent(content);
            owner.getSourceMap().ifPresent(inline::setSourceMap);
            inlines(node, inline.getChildren());
            return inline;
        }

        private void inlines(Node parent, List<MarkdownToken> out) {
            for (Node child = parent.getFirstChild(); child != null; child = child.getNext()) {
                inline(child, out);
            }
        }

        private void inline(Node node, List<MarkdownToken> out) {
            if (node instanceof Text || node instanceof HtmlEntity) {
                out.add(text(node.getChars().unescape()));
            } else if (node instanceof SoftLineBreak) {
                out.add(new MarkdownToken(TokenType.SOFTBREAK, "br", 0));
            } else if (node instanceof HardLineBreak) {
                out.add(new MarkdownToken(TokenType.HARDBREAK, "br", 0));
            } else if (node instanceof Code code) {
                MarkdownToken token = new MarkdownToken(TokenType.CODE_INLINE, "code", 0);
                token.setContent(codeSpanContent(code.getText().toString()));
                token.setMarkup(code.getOpeningMarker().toString());
                out.add(token);
            } else if (node instanceof StrongEmphasis strong) {
                delimited(node, TokenType.STRONG_OPEN, TokenType.STRONG_CLOSE, "strong", strong.getOpeningMarker().toString(), out);
            } else if (node instanceof Emphasis emphasis) {
                delimited(node, TokenType.EM_OPEN, TokenType.EM_CLOSE, "em", emphasis.getOpeningMarker().toString(), out);
            } else if (node instanceof Strikethrough strikethrough) {
                delimited(node, TokenType.S_OPEN, TokenType.S_CLOSE, "s", strikethrough.getOpeningMarker().toString(), out);
            } else if (node instanceof Image image) {
                image(node, image.getUrl().unescape(), image.getTitle().unescape(), out);
            } else if (node instanceof ImageRef imageRef) {
                Reference reference = resolve(imageRef);
                if (reference == null) {
                    out.add(text(node.getChars().unescape()));
                } else {
                    image(node, reference.getUrl().unescape(), reference.getTitle().unescape(), out);
                }
            } else if (node instanceof Link link) {
                link(node, link.getUrl().unescape(), link.getTitle().unescape(), "", out);
            } else if (node instanceof LinkRef linkRef) {
                Reference reference = resolve(linkRef);
                if (reference == null) {
                    out.add(text(node.getChars().unescape()));
                } else {
                    link(node, reference.getUrl().unescape(), reference.getTitle().unescape(), "", out);
                }
            } else if (node instanceof MailLink mailLink) {
                String address = mailLink.getText().toString();
                autolink("mailto:" + address, address, out);
            } else if (node instanceof AutoLink autoLink) {
                String url = autoLink.getText().isEmpty() ? autoLink.getChars().toString() : autoLink.getText().toString();
                String destination = url.toLowerCase(Locale.ROOT).startsWith("www.") ? "http://" + url : url;
                autolink(destination, url, out);
            } else if (node instanceof HtmlInline || node instanceof HtmlInlineComment) {
                MarkdownToken token = new MarkdownToken(TokenType.HTML_INLINE, "", 0);
                token.setContent(node.getChars().toString());
                out.add(token);
            } else if (node.hasChildren()) {
                inlines(node, out);
            } else {
                out.add(text(node.getChars().unescape()));
            }
        }

        private void delimited(Node node, TokenType openType, TokenType closeType, String tag, String markup,
                               List<MarkdownToken> out) {
            MarkdownToken open = new MarkdownToken(openType, tag, 1);
            open.setMarkup(markup);
            out.add(open);
            inlines(node, out);
            MarkdownToken close = new MarkdownToken(closeType, tag, -1);
            close.setMarkup(markup);
            out.add(close);
        }

        private void link(Node node, String destination, String title, String markup, List<MarkdownToken> out) {
            Optional<String> href = links.accept(destination);
            if (href.isEmpty()) {
                out.add(text(node.getChars().unescape()));
                return;
            }
            MarkdownToken open = new MarkdownToken(TokenType.LINK_OPEN, "a", 1);
            open.attrSet("href", href.get());
            if (!title.isEmpty()) {
                open.attrSet("title", title);
            }
            open.setMarkup(markup);
            out.add(open);
            inlines(node, out);
            MarkdownToken close = new MarkdownToken(TokenType.LINK_CLOSE, "a", -1);
            close.setMarkup(markup);
            out.add(close);
        }

        private void autolink(String destination, String label, List<MarkdownToken> out) {
            Optional<String> href = links.accept(destination);
            if (href.isEmpty()) {
                out.add(text(label));
                return;
            }
            MarkdownToken open = new MarkdownToken(TokenType.LINK_OPEN, "a", 1);
            open.attrSet("href", href.get());
            open.setMarkup("autolink");
            out.add(open);
            out.add(text(label));
            MarkdownToken close = new MarkdownToken(TokenType.LINK_CLOSE, "a", -1);
            close.setMarkup("autolink");
            out.add(close);
        }

        private void image(Node node, String destination, String title, List<MarkdownToken> out) {
            Optional<String> src = links.accept(destination);
            if (src.isEmpty()) {
                out.add(text(node.getChars().unescape()));
                return;
            }
            MarkdownToken token = new MarkdownToken(TokenType.IMAGE, "img", 0);
            token.attrSet("src", src.get());
            token.attrSet("alt", "");
            if (!title.isEmpty()) {
                token.attrSet("title", title);
            }
            inlines(node, token.getChildren());
            StringBuilder alt = new StringBuilder();
            for (MarkdownToken child : token.getChildren()) {
                alt.append(child.getContent());
            }
            token.setContent(alt.toString());
            out.add(token);
        }

        private Reference resolve(RefNode refNode) {
            if (!refNode.isDefined() || references == null) {
                return null;
            }
            return refNode.getReferenceNode(references);
        }

        private static MarkdownToken text(String content) {
            MarkdownToken token = new MarkdownToken(TokenType.TEXT, "", 0);
            token.setContent(content);
            return token;
        }

        private static String codeSpanContent(String raw) {
            String content = raw.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
            if (content.length() >= 2 && content.startsWith(" ") && content.endsWith(" ") && !content.isBlank()) {
                content = content.substring(1, content.length() - 1);
            }
            return content;
        }

        private String childSource(Node node) {
            Node first = node.getFirstChild();
            Node last = node.getLastChild();
            if (first == null || last == null) {
                return "";
            }
            return source.substring(first.getStartOffset(), last.getEndOffset()).trim();
        }

        private static boolean isInTightList(Node paragraph) {
            return paragraph.getParent() instanceof ListItem item
                && item.getParent() instanceof ListBlock list
                && list.isTight();
        }

        private SourceMap sourceMap(Node node) {
            int start = lines.lineOf(node.getStartOffset());
            int end = lines.lineOf(Math.max(node.getStartOffset(), node.getEndOffset() - 1)) + 1;
            return new SourceMap(start, end);
        }
    }

    /**
     * Maps character offsets of the parsed text to zero-based line numbers.
     */
    static final class LineIndex {
        private final int[] lineStarts;

        LineIndex(String text) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int index = 0; index < text.length(); index++) {
                char current = text.charAt(index);
                if (current == '\r' && index + 1 < text.length() && text.charAt(index + 1) == '\n') {
                    continue;
                }
                if (current == '\n' || current == '\r') {
                    starts.add(index + 1);
                }
            }
            this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        int lineOf(int offset) {
            int position = Arrays.binarySearch(lineStarts, Math.max(0, offset));
            return position >= 0 ? position : -position - 2;
        }
    }
}
