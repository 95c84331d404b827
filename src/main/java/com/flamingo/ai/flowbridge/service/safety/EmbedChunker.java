package com.flamingo.ai.flowbridge.service.safety;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Utf8;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Splits an over-limit embed into chunks no larger than a byte budget. CSS is cut between
 * top-level rules, JS between top-level statements and HTML between lines. A single unit larger
 * than the budget is cut on character boundaries.
 */
@Component
public class EmbedChunker {

  public ChunkedEmbed chunk(EmbedType type, String content, int chunkSizeBytes) {
    if (chunkSizeBytes <= 0) {
      throw new IllegalArgumentException("chunkSizeBytes must be positive");
    }
    List<String> units =
        switch (type) {
          case CSS -> cssUnits(content);
          case JS -> jsUnits(content);
          case HTML -> lineUnits(content);
        };
    List<EmbedChunk> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int currentBytes = 0;
    for (String unit : units) {
      int unitBytes = Utf8.encodedLength(unit);
      if (currentBytes + unitBytes > chunkSizeBytes && currentBytes > 0) {
        addChunk(chunks, current.toString(), type);
        current.setLength(0);
        currentBytes = 0;
      }
      if (unitBytes > chunkSizeBytes) {
        for (String piece : hardSplit(unit, chunkSizeBytes)) {
          addChunk(chunks, piece, type);
        }
        continue;
      }
      current.append(unit);
      currentBytes += unitBytes;
    }
    if (currentBytes > 0) {
      addChunk(chunks, current.toString(), type);
    }
    return new ChunkedEmbed(type, Utf8.encodedLength(content), chunks);
  }

  // ---- private helpers ----

  private static void addChunk(List<EmbedChunk> chunks, String content, EmbedType type) {
    chunks.add(new EmbedChunk(chunks.size(), content, Utf8.encodedLength(content), type));
  }

  /** Top-level rules, each keeping the whitespace that follows it. */
  @VisibleForTesting
  static List<String> cssUnits(String css) {
    List<String> units = new ArrayList<>();
    int depth = 0;
    int start = 0;
    char quote = 0;
    for (int i = 0; i < css.length(); i++) {
      char c = css.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '{') {
        depth++;
      } else if (c == '}' && depth > 0) {
        depth--;
        if (depth == 0) {
          int end = skipWhitespace(css, i + 1);
          units.add(css.substring(start, end));
          start = end;
          i = end - 1;
        }
      } else if (c == ';' && depth == 0) {
        // statement at-rules such as @import
        int end = skipWhitespace(css, i + 1);
        units.add(css.substring(start, end));
        start = end;
        i = end - 1;
      }
    }
    if (start < css.length()) {
      units.add(css.substring(start));
    }
    return units;
  }

  /** Top-level statements: cut after a depth-zero {@code ;} or a closing brace at depth zero. */
  @VisibleForTesting
  static List<String> jsUnits(String js) {
    List<String> units = new ArrayList<>();
    int depth = 0;
    int start = 0;
    char quote = 0;
    for (int i = 0; i < js.length(); i++) {
      char c = js.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '"' || c == '\'' || c == '`') {
        quote = c;
      } else if (c == '/' && i + 1 < js.length() && js.charAt(i + 1) == '/') {
        int newline = js.indexOf('\n', i);
        i = newline < 0 ? js.length() : newline - 1;
      } else if (c == '/' && i + 1 < js.length() && js.charAt(i + 1) == '*') {
        int close = js.indexOf("*/", i + 2);
        i = close < 0 ? js.length() : close + 1;
      } else if (c == '{' || c == '(' || c == '[') {
        depth++;
      } else if ((c == '}' || c == ')' || c == ']') && depth > 0) {
        depth--;
        if (c == '}' && depth == 0) {
          int end = skipWhitespace(js, i + 1);
          if (end >= js.length() || js.charAt(end) != ';') {
            units.add(js.substring(start, end));
            start = end;
            i = end - 1;
          }
        }
      } else if (c == ';' && depth == 0) {
        int end = skipWhitespace(js, i + 1);
        units.add(js.substring(start, end));
        start = end;
        i = end - 1;
      }
    }
    if (start < js.length()) {
      units.add(js.substring(start));
    }
    return units;
  }

  private static List<String> lineUnits(String html) {
    List<String> units = new ArrayList<>();
    int start = 0;
    int newline;
    while ((newline = html.indexOf('\n', start)) >= 0) {
      units.add(html.substring(start, newline + 1));
      start = newline + 1;
    }
    if (start < html.length()) {
      units.add(html.substring(start));
    }
    return units;
  }

  private static int skipWhitespace(String text, int from) {
    int i = from;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private static List<String> hardSplit(String unit, int chunkSizeBytes) {
    List<String> pieces = new ArrayList<>();
    int start = 0;
    int bytes = 0;
    int i = 0;
    while (i < unit.length()) {
      int codePoint = unit.codePointAt(i);
      int charCount = Character.charCount(codePoint);
      int width = Utf8.encodedLength(unit.substring(i, i + charCount));
      if (bytes + width > chunkSizeBytes && bytes > 0) {
        pieces.add(unit.substring(start, i));
        start = i;
        bytes = 0;
      }
      bytes += width;
      i += charCount;
    }
    if (start < unit.length()) {
      pieces.add(unit.substring(start));
    }
    return pieces;
  }
}
