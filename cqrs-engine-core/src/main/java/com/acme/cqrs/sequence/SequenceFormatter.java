package com.acme.cqrs.sequence;

import com.acme.cqrs.core.ValidationException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders sequence templates. {@code %%name%%} inserts a variable; {@code %%name#:0>5%%} pads it on
 * the left with '0' to width 5 ({@code <} pads on the right).
 */
final class SequenceFormatter {

  private static final Pattern PLACEHOLDER =
      Pattern.compile("%%([A-Za-z0-9_]+)(?:#:(.)([<>])(\\d+))?%%");

  private SequenceFormatter() {}

  static String format(String template, Map<String, Object> variables) {
    Matcher m = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (m.find()) {
      String name = m.group(1);
      if (!variables.containsKey(name)) {
        throw new ValidationException("Unknown placeholder '" + name + "' in format " + template);
      }
      String value = String.valueOf(variables.get(name));
      if (m.group(2) != null) {
        value = pad(value, m.group(2).charAt(0), ">".equals(m.group(3)), Integer.parseInt(m.group(4)));
      }
      m.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    m.appendTail(out);
    return out.toString();
  }

  private static String pad(String value, char fill, boolean left, int width) {
    if (value.length() >= width) {
      return value;
    }
    String padding = String.valueOf(fill).repeat(width - value.length());
    return left ? padding + value : value + padding;
  }
}
