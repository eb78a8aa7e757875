package com.codeheadsystems.dbu.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the text of a migration into statements the store can execute one at a time.
 *
 * <p>Scanning is line based. Outside a procedural block a statement ends on the first line that ends
 * with the terminator. A statement starting with {@code CREATE TRIGGER} is a procedural block: the
 * terminators inside its body do not end it. {@code BEGIN} and {@code CASE} open a nesting level,
 * {@code END} closes one, and the statement ends when the depth returns to zero.
 */
@Singleton
public class StatementSplitter {

  private static final Logger log = LoggerFactory.getLogger(StatementSplitter.class);

  private static final String TERMINATOR = ";";
  private static final Pattern BLOCK_START = Pattern.compile(
      "^\\s*CREATE\\s+(TEMP\\s+|TEMPORARY\\s+)?TRIGGER\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRANSACTION_CONTROL = Pattern.compile(
      "^(BEGIN(\\s+(DEFERRED|IMMEDIATE|EXCLUSIVE))?(\\s+TRANSACTION)?|COMMIT(\\s+TRANSACTION)?|END\\s+TRANSACTION)\\s*;?$",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern BLOCK_WORD = Pattern.compile("\\b(BEGIN|CASE|END)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRAILING_TERMINATOR = Pattern.compile(";\\s*$");

  /**
   * Instantiates a new Statement splitter.
   */
  @Inject
  public StatementSplitter() {
    log.info("StatementSplitter()");
  }

  /**
   * Split the schema text into independently executable statements, in source order.
   * Trailing terminators are removed from every statement.
   *
   * @param schemaText the raw text of a migration
   * @return the statements, never null
   */
  public List<String> split(final String schemaText) {
    log.trace("split({} chars)", schemaText == null ? 0 : schemaText.length());
    final List<String> statements = new ArrayList<>();
    if (schemaText == null) {
      return statements;
    }
    final StringBuilder current = new StringBuilder();
    boolean inBlock = false;
    boolean blockOpened = false;
    int depth = 0;

    for (String rawLine : schemaText.split("\\r?\\n")) {
      final String line = stripTrailingComment(rawLine);
      final String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      if (current.length() == 0 && TRANSACTION_CONTROL.matcher(trimmed).matches()) {
        log.debug("Dropping transaction control line: {}", trimmed);
        continue;
      }

      current.append(line).append('\n');

      if (!inBlock && isFirstLine(current, line) && BLOCK_START.matcher(trimmed).find()) {
        inBlock = true;
        blockOpened = false;
        depth = 0;
      }

      if (inBlock) {
        depth += blockDepthChange(trimmed);
        if (depth > 0) {
          blockOpened = true;
        }
        if (blockOpened && depth <= 0) {
          emit(statements, current);
          inBlock = false;
          blockOpened = false;
          depth = 0;
        }
      } else if (trimmed.endsWith(TERMINATOR)) {
        emit(statements, current);
      }
    }

    if (!current.toString().isBlank()) {
      log.debug("Emitting unterminated trailing statement");
      emit(statements, current);
    }
    return statements;
  }

  private boolean isFirstLine(final StringBuilder current, final String line) {
    return current.length() == line.length() + 1;
  }

  private void emit(final List<String> statements, final StringBuilder current) {
    final String statement = TRAILING_TERMINATOR.matcher(current.toString().trim()).replaceAll("").trim();
    if (!statement.isEmpty()) {
      statements.add(statement);
    }
    current.setLength(0);
  }

  /**
   * Net change in block depth for one line, ignoring words inside string literals and quoted identifiers.
   */
  int blockDepthChange(final String line) {
    int change = 0;
    final Matcher matcher = BLOCK_WORD.matcher(unquoted(line));
    while (matcher.find()) {
      final String word = matcher.group(1).toUpperCase(Locale.ROOT);
      if (word.equals("END")) {
        change--;
      } else {
        change++;
      }
    }
    return change;
  }

  /**
   * Replaces quoted sections with spaces so keywords inside them are not seen.
   */
  private String unquoted(final String line) {
    final StringBuilder sb = new StringBuilder(line.length());
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      final char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        sb.append(' ');
      } else if (c == '\'' || c == '"' || c == '`') {
        quote = c;
        sb.append(' ');
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Removes a {@code --} comment that follows code on the same line, unless it sits inside a quote.
   */
  String stripTrailingComment(final String line) {
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      final char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == '-' && i + 1 < line.length() && line.charAt(i + 1) == '-') {
        return line.substring(0, i).stripTrailing();
      }
    }
    return line;
  }
}
