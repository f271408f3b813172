package io.syncbridge.workflow;

import io.syncbridge.util.Json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{path}}} tokens in step templates.
 *
 * <p>A path is a dot-separated walk through nested maps (and list indexes), e.g.
 * {@code {{guest_name}}} or {@code {{create_user.id}}}. Scopes are searched in the order
 * given; a token that resolves in none of them, or resolves to {@code null}, fails with
 * {@link TemplateResolutionException}. Strings are inserted as-is, numbers and booleans via
 * {@code toString()}, maps and lists as JSON. A template value that consists of exactly one
 * token keeps the resolved value's type; maps and lists are copied, so the rendered payload
 * never shares mutable state with the scopes.
 *
 * <p>All methods are pure.
 */
public final class TemplateRenderer {
  private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_\\-]+(?:\\.[A-Za-z0-9_\\-]+)*)\\s*}}");

  private TemplateRenderer() {
  }

  /**
   * Renders a string template against a single context.
   *
   * @throws TemplateResolutionException if a token cannot be resolved
   */
  public static String render(String template, Map<String, Object> context) {
    return renderString(template, List.of(context));
  }

  /**
   * Renders every string inside a payload template, searching {@code scopes} in order.
   *
   * @throws TemplateResolutionException if a token cannot be resolved
   */
  @SafeVarargs
  public static Map<String, Object> renderPayload(Map<String, Object> template, Map<String, Object>... scopes) {
    @SuppressWarnings("unchecked")
    Map<String, Object> rendered = (Map<String, Object>) renderValue(template, List.of(scopes));
    return rendered;
  }

  /**
   * Collects the token paths used anywhere in a payload template.
   */
  public static Set<String> tokens(Object template) {
    Set<String> found = new LinkedHashSet<>();
    collectTokens(template, found);
    return found;
  }

  /**
   * Resolves a dotted path against the first scope that contains it.
   */
  public static Optional<Object> resolve(String path, List<Map<String, Object>> scopes) {
    for (Map<String, Object> scope : scopes) {
      Optional<Object> value = resolveIn(path, scope);
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }

  private static Object renderValue(Object template, List<Map<String, Object>> scopes) {
    if (template instanceof String text) {
      Matcher whole = TOKEN.matcher(text.strip());
      if (whole.matches()) {
        String path = whole.group(1);
        return copy(resolve(path, scopes).orElseThrow(() -> new TemplateResolutionException(path)));
      }
      return renderString(text, scopes);
    }
    if (template instanceof Map<?, ?> map) {
      Map<String, Object> rendered = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        rendered.put(String.valueOf(entry.getKey()), renderValue(entry.getValue(), scopes));
      }
      return rendered;
    }
    if (template instanceof List<?> list) {
      List<Object> rendered = new ArrayList<>(list.size());
      for (Object element : list) {
        rendered.add(renderValue(element, scopes));
      }
      return rendered;
    }
    return template;
  }

  private static Object copy(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copied = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copied.put(String.valueOf(entry.getKey()), copy(entry.getValue()));
      }
      return copied;
    }
    if (value instanceof List<?> list) {
      List<Object> copied = new ArrayList<>(list.size());
      for (Object element : list) {
        copied.add(copy(element));
      }
      return copied;
    }
    return value;
  }

  private static String renderString(String template, List<Map<String, Object>> scopes) {
    if (template == null) {
      return null;
    }
    Matcher matcher = TOKEN.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String path = matcher.group(1);
      Object value = resolve(path, scopes).orElseThrow(() -> new TemplateResolutionException(path));
      matcher.appendReplacement(out, Matcher.quoteReplacement(stringify(value)));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private static Optional<Object> resolveIn(String path, Map<String, Object> scope) {
    Object current = scope;
    for (String segment : path.split("\\.")) {
      if (current instanceof Map<?, ?> map) {
        if (!map.containsKey(segment)) {
          return Optional.empty();
        }
        current = map.get(segment);
      } else if (current instanceof List<?> list && segment.chars().allMatch(Character::isDigit)) {
        int index = Integer.parseInt(segment);
        if (index >= list.size()) {
          return Optional.empty();
        }
        current = list.get(index);
      } else {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(current);
  }

  private static String stringify(Object value) {
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      return Json.write(value);
    }
    return value.toString();
  }

  private static void collectTokens(Object template, Set<String> found) {
    if (template instanceof String text) {
      Matcher matcher = TOKEN.matcher(text);
      while (matcher.find()) {
        found.add(matcher.group(1));
      }
    } else if (template instanceof Map<?, ?> map) {
      for (Object value : map.values()) {
        collectTokens(value, found);
      }
    } else if (template instanceof List<?> list) {
      for (Object element : list) {
        collectTokens(element, found);
      }
    }
  }
}
