/*
 * どこで: Email 配信サービス層
 * 何を: テンプレート中の {name} プレースホルダを変数で置換する
 * なぜ: 置換に失敗しても配信を止めず、元のテンプレートをそのまま送れるようにするため
 */
package com.example.email.service;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 名前付きプレースホルダを置換する。
 *
 * <p>二重の波括弧はそれぞれ波括弧 1 文字として出力する。変数が存在しない、または
 * プレースホルダの書式が不正な場合は置換を諦め、テンプレートを未加工のまま返す。値が null の変数は空文字になる。
 */
@Component
public class TemplateRenderer {

  private static final Logger logger = LoggerFactory.getLogger(TemplateRenderer.class);

  public String render(String template, Map<String, Object> variables) {
    if (template == null) {
      return "";
    }
    try {
      return substitute(template, variables == null ? Map.of() : variables);
    } catch (RenderException ex) {
      logger.warn("template rendering skipped reason={}", ex.getMessage());
      return template;
    }
  }

  private String substitute(String template, Map<String, Object> variables) {
    final StringBuilder out = new StringBuilder(template.length());
    int i = 0;
    while (i < template.length()) {
      final char c = template.charAt(i);
      if (c == '{') {
        if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
          out.append('{');
          i += 2;
          continue;
        }
        final int close = template.indexOf('}', i + 1);
        if (close < 0) {
          throw new RenderException("unterminated placeholder at index " + i);
        }
        final String name = template.substring(i + 1, close);
        if (!isIdentifier(name)) {
          throw new RenderException("malformed placeholder '" + name + "'");
        }
        if (!variables.containsKey(name)) {
          throw new RenderException("missing variable '" + name + "'");
        }
        final Object value = variables.get(name);
        out.append(value == null ? "" : value.toString());
        i = close + 1;
      } else if (c == '}') {
        if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
          out.append('}');
          i += 2;
          continue;
        }
        throw new RenderException("single '}' at index " + i);
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  private boolean isIdentifier(String name) {
    if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      final char c = name.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) {
        return false;
      }
    }
    return true;
  }

  private static final class RenderException extends RuntimeException {
    RenderException(String message) {
      super(message, null, false, false);
    }
  }
}
