/*
 * どこで: Password expiry サービス層
 * 何を: 件名/本文テンプレートのプレースホルダーをユーザー値で置換する
 * なぜ: 未知のプレースホルダーを送信前に検出し、生の {{...}} を含むメールを出さないため
 */
package com.example.password_expiry.service;

import com.example.password_expiry.model.DirectoryUser;
import com.example.password_expiry.model.ExpiryState;
import com.example.password_expiry.model.NotificationProfile;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class MessageTemplateRenderer {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]*?)\\s*\\}\\}");

  private final DateTimeFormatter dateFormat;

  public MessageTemplateRenderer(ZoneId businessZone) {
    this.dateFormat = DateTimeFormatter.ISO_LOCAL_DATE.withZone(businessZone);
  }

  public RenderedMessage render(NotificationProfile profile, DirectoryUser user, ExpiryState state) {
    return new RenderedMessage(
        render(profile.subjectTemplate(), user, state), render(profile.emailTemplate(), user, state));
  }

  public String render(String template, DirectoryUser user, ExpiryState state) {
    if (template == null || template.isEmpty()) {
      return "";
    }
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder rendered = new StringBuilder(template.length());
    while (matcher.find()) {
      final TemplatePlaceholder placeholder = lookup(matcher.group(1));
      matcher.appendReplacement(
          rendered, Matcher.quoteReplacement(placeholder.resolve(user, state, dateFormat)));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }

  /**
   * Checks that every placeholder in the template is known.
   *
   * @throws TemplateRenderException naming the first unknown placeholder
   */
  public void validate(String template) {
    if (template == null) {
      return;
    }
    final Matcher matcher = PLACEHOLDER.matcher(template);
    while (matcher.find()) {
      lookup(matcher.group(1));
    }
  }

  private TemplatePlaceholder lookup(String token) {
    return TemplatePlaceholder.fromToken(token)
        .orElseThrow(
            () -> new TemplateRenderException("unknown template placeholder {{" + token + "}}"));
  }
}
