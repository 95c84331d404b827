package com.flamingo.ai.flowbridge.service.css;

import com.helger.css.CSSSourceLocation;
import com.helger.css.ECSSVersion;
import com.helger.css.ICSSSourceLocationAware;
import com.helger.css.decl.CSSDeclaration;
import com.helger.css.decl.CSSFontFaceRule;
import com.helger.css.decl.CSSImportRule;
import com.helger.css.decl.CSSKeyframesRule;
import com.helger.css.decl.CSSMediaRule;
import com.helger.css.decl.CSSNamespaceRule;
import com.helger.css.decl.CSSSelector;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.CSSSupportsRule;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.decl.ICSSTopLevelRule;
import com.helger.css.reader.CSSReader;
import com.helger.css.reader.CSSReaderDeclarationList;
import com.helger.css.reader.CSSReaderSettings;
import com.helger.css.reader.errorhandler.LoggingCSSParseErrorHandler;
import com.helger.css.writer.CSSWriterSettings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Stylesheet scanner on top of the ph-css parser. Parsing runs in browser-compliant mode, so a
 * malformed rule is skipped the way a browser skips it and an unclosed trailing block is dropped.
 * Block texts are sliced from the source by the parser's token positions, so callers see the
 * author's own formatting rather than a re-serialized rule.
 */
@Component
@Slf4j
public class CssRuleScanner {

  private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
  private static final Pattern CLASS_NAME = Pattern.compile("\\.(-?[_a-zA-Z][\\w-]*)");
  private static final Set<String> GROUPING_AT_RULES =
      Set.of("media", "supports", "layer", "container", "document");
  private static final CSSWriterSettings WRITER_SETTINGS =
      new CSSWriterSettings(ECSSVersion.CSS30);

  /**
   * Scans a stylesheet into blocks, recursing into grouping at-rules.
   *
   * @param css stylesheet text, may be null
   * @return blocks in source order
   */
  public List<CssBlock> scan(String css) {
    if (css == null || css.isBlank()) {
      return List.of();
    }
    return scanSheet(normalize(stripComments(css)));
  }

  /** Concatenated {@code <style>} bodies of a page, or the input itself when it has none. */
  public static String stylesheetOf(String source) {
    if (source == null) {
      return "";
    }
    String css = styleElements(source);
    return css.isEmpty() ? source : css;
  }

  /** Concatenated {@code <style>} bodies of a page, empty when it has none. */
  public static String styleElements(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    StringBuilder css = new StringBuilder();
    for (Element style : Jsoup.parse(html).select("style")) {
      css.append(style.data()).append('\n');
    }
    return css.toString();
  }

  /** Removes block comments. */
  public static String stripComments(String css) {
    return COMMENT.matcher(css).replaceAll("");
  }

  /**
   * Parses a rule body into declarations, keeping each value as written. A body the strict
   * declaration reader rejects is re-read leniently so only the broken declarations are lost.
   */
  public static List<CssDeclaration> parseDeclarations(String body) {
    List<CssDeclaration> declarations = new ArrayList<>();
    if (body == null || body.isBlank()) {
      return declarations;
    }
    String src = normalize(stripComments(body));
    SourceText source = new SourceText(src);
    List<CSSDeclaration> parsed = new ArrayList<>();
    var list = CSSReaderDeclarationList.readFromString(src, ECSSVersion.CSS30);
    if (list != null) {
      parsed.addAll(list.getAllDeclarations());
    } else {
      String wrapped = "x{" + src + "}";
      CascadingStyleSheet sheet = CSSReader.readFromStringReader(wrapped, lenientSettings());
      if (sheet == null || sheet.getAllStyleRules().isEmpty()) {
        log.debug("Unparseable declaration block skipped: {}", abbreviate(src));
        return declarations;
      }
      source = new SourceText(wrapped);
      parsed.addAll(sheet.getAllStyleRules().get(0).getAllDeclarations());
    }
    for (CSSDeclaration declaration : parsed) {
      CssDeclaration converted = toDeclaration(declaration, source);
      if (converted != null) {
        declarations.add(converted);
      }
    }
    return declarations;
  }

  /** Splits a selector list into its selectors, as written. */
  public static List<String> splitSelectors(String selectorList) {
    if (selectorList == null || selectorList.isBlank()) {
      return List.of();
    }
    String src = normalize(selectorList.trim()) + "{}";
    CascadingStyleSheet sheet = CSSReader.readFromStringReader(src, lenientSettings());
    if (sheet == null || sheet.getAllStyleRules().isEmpty()) {
      return List.of(selectorList.trim());
    }
    SourceText source = new SourceText(src);
    List<String> selectors = new ArrayList<>();
    for (CSSSelector selector : sheet.getAllStyleRules().get(0).getAllSelectors()) {
      int[] span = source.span(selector);
      String text =
          span == null
              ? selector.getAsCSSString(WRITER_SETTINGS, 0)
              : src.substring(span[0], span[1]).trim();
      if (!text.isEmpty()) {
        selectors.add(text);
      }
    }
    return selectors;
  }

  /** Class names referenced by a selector, in order of first appearance. */
  public static Set<String> classNames(String selector) {
    Set<String> names = new LinkedHashSet<>();
    Matcher matcher = CLASS_NAME.matcher(selector);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }

  // ---- private helpers ----

  private static CSSReaderSettings lenientSettings() {
    return new CSSReaderSettings()
        .setCSSVersion(ECSSVersion.CSS30)
        .setBrowserCompliantMode(true)
        .setCustomErrorHandler(new LoggingCSSParseErrorHandler());
  }

  private static List<CssBlock> scanSheet(String src) {
    CascadingStyleSheet sheet = CSSReader.readFromStringReader(src, lenientSettings());
    if (sheet == null) {
      int lastClose = src.lastIndexOf('}');
      if (lastClose > 0 && !src.substring(lastClose + 1).isBlank()) {
        log.debug("Unclosed CSS dropped: {}", abbreviate(src.substring(lastClose + 1)));
        return scanSheet(src.substring(0, lastClose + 1));
      }
      log.debug("Unparseable stylesheet skipped: {}", abbreviate(src));
      return List.of();
    }
    SourceText source = new SourceText(src);
    List<CssBlock> blocks = new ArrayList<>();
    for (CSSImportRule rule : sheet.getAllImportRules()) {
      addIfPresent(blocks, statement(rule, source));
    }
    for (CSSNamespaceRule rule : sheet.getAllNamespaceRules()) {
      addIfPresent(blocks, statement(rule, source));
    }
    for (ICSSTopLevelRule rule : sheet.getAllRules()) {
      addIfPresent(blocks, toBlock(rule, source));
    }
    return blocks;
  }

  private static void addIfPresent(List<CssBlock> blocks, CssBlock block) {
    if (block != null) {
      blocks.add(block);
    }
  }

  private static CssBlock statement(Object rule, SourceText source) {
    String text = source.slice(rule);
    if (text == null) {
      return null;
    }
    String statement = text.endsWith(";") ? text.substring(0, text.length() - 1).trim() : text;
    return new CssBlock(CssBlock.Kind.AT_RULE, statement, null, statement + ";", List.of());
  }

  private static CssBlock toBlock(ICSSTopLevelRule rule, SourceText source) {
    int[] span = source.span(rule);
    if (span == null) {
      log.debug("Rule without source position skipped: {}", rule.getClass().getSimpleName());
      return null;
    }
    String raw = source.text().substring(span[0], span[1]);
    int textStart = span[0] + raw.length() - raw.stripLeading().length();
    String text = raw.trim();
    if (!text.endsWith("}")) {
      if (text.startsWith("@") && text.endsWith(";")) {
        return statement(rule, source);
      }
      log.debug("Unclosed CSS block dropped: {}", abbreviate(text));
      return null;
    }
    int open = openingBrace(rule, text, textStart, source);
    if (open < 0) {
      return null;
    }
    String prelude = text.substring(0, open).trim();
    String body = text.substring(open + 1, text.length() - 1);

    if (rule instanceof CSSStyleRule) {
      return new CssBlock(CssBlock.Kind.STYLE_RULE, prelude, body, text, List.of());
    }
    if (rule instanceof CSSMediaRule) {
      return new CssBlock(CssBlock.Kind.MEDIA, prelude, body, text, scanSheet(body));
    }
    if (rule instanceof CSSKeyframesRule) {
      return new CssBlock(CssBlock.Kind.KEYFRAMES, prelude, body, text, List.of());
    }
    if (rule instanceof CSSFontFaceRule) {
      return new CssBlock(CssBlock.Kind.FONT_FACE, prelude, body, text, List.of());
    }
    CssBlock atRule = new CssBlock(CssBlock.Kind.AT_RULE, prelude, body, text, List.of());
    if (rule instanceof CSSSupportsRule || GROUPING_AT_RULES.contains(atRule.atRuleName())) {
      return new CssBlock(CssBlock.Kind.AT_RULE, prelude, body, text, scanSheet(body));
    }
    return atRule;
  }

  /**
   * Offset of the block's opening brace within its text. For style rules the search starts after
   * the last selector so braces inside attribute values do not count.
   */
  private static int openingBrace(
      ICSSTopLevelRule rule, String text, int textStart, SourceText source) {
    int from = 0;
    if (rule instanceof CSSStyleRule) {
      List<CSSSelector> selectors = ((CSSStyleRule) rule).getAllSelectors();
      if (!selectors.isEmpty()) {
        int[] last = source.span(selectors.get(selectors.size() - 1));
        if (last != null) {
          from = Math.max(0, last[1] - textStart);
        }
      }
    }
    return text.indexOf('{', Math.min(from, text.length()));
  }

  private static CssDeclaration toDeclaration(CSSDeclaration declaration, SourceText source) {
    String text = source.slice(declaration);
    if (text == null) {
      text = declaration.getAsCSSString(WRITER_SETTINGS, 0);
    }
    if (text.endsWith(";")) {
      text = text.substring(0, text.length() - 1);
    }
    int colon = text.indexOf(':');
    if (colon <= 0) {
      return null;
    }
    String property = text.substring(0, colon).trim();
    String value = text.substring(colon + 1).trim();
    return property.isEmpty() ? null : new CssDeclaration(property, value);
  }

  /** Line endings and tabs are normalized so parser columns map one-to-one onto characters. */
  private static String normalize(String css) {
    return css.replace("\r\n", "\n").replace('\r', '\n').replace('\t', ' ');
  }

  private static String abbreviate(String text) {
    String flat = text.replaceAll("\\s+", " ").trim();
    return flat.length() <= 80 ? flat : flat.substring(0, 80) + "...";
  }

  /** Maps the parser's 1-based line and column positions back onto the parsed text. */
  private static final class SourceText {

    private final String text;
    private final List<Integer> lineStarts = new ArrayList<>();

    SourceText(String text) {
      this.text = text;
      lineStarts.add(0);
      for (int i = 0; i < text.length(); i++) {
        if (text.charAt(i) == '\n') {
          lineStarts.add(i + 1);
        }
      }
    }

    String text() {
      return text;
    }

    /** Trimmed source text of a parsed node, or null when the parser kept no position. */
    String slice(Object node) {
      int[] span = span(node);
      return span == null ? null : text.substring(span[0], span[1]).trim();
    }

    /** Start offset and exclusive end offset of a parsed node, or null. */
    int[] span(Object node) {
      if (!(node instanceof ICSSSourceLocationAware)) {
        return null;
      }
      CSSSourceLocation location = ((ICSSSourceLocationAware) node).getSourceLocation();
      if (location == null) {
        return null;
      }
      int start =
          offset(
              location.getFirstTokenBeginLineNumber(), location.getFirstTokenBeginColumnNumber());
      int last =
          offset(location.getLastTokenEndLineNumber(), location.getLastTokenEndColumnNumber());
      if (start < 0 || last < start) {
        return null;
      }
      return new int[] {start, Math.min(last + 1, text.length())};
    }

    private int offset(int line, int column) {
      if (line < 1 || column < 1 || line > lineStarts.size()) {
        return -1;
      }
      int offset = lineStarts.get(line - 1) + column - 1;
      return offset > text.length() ? -1 : offset;
    }
  }
}
