package com.notifyhub.scheduler.service;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Substitutes {@code {{name}}} placeholders. Names are letters, digits or underscores, optionally
 * padded with whitespace inside the braces. A placeholder without a value is left as written.
 */
@Component
public class TemplateRenderer {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*\\}\\}");

  public String render(String text, Map<String, String> variables) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    final Matcher matcher = PLACEHOLDER.matcher(text);
    return matcher.replaceAll(
        match -> {
          final String value = variables.get(match.group(1));
          return Matcher.quoteReplacement(value == null ? match.group() : value);
        });
  }
}
